package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubIssue(
    long id,
    int number,
    String title,
    String body,
    String state,
    boolean locked,
    GitHubUser assignee,
    List<GitHubUser> assignees,
    JsonNode milestone,
    int comments,
    Instant createdAt,
    Instant updatedAt,
    Instant closedAt,
    String authorAssociation,
    GitHubUser user,
    List<JsonNode> labels) {}
