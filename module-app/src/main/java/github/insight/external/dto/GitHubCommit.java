package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubCommit(
    String sha,
    String nodeId,
    JsonNode commit,
    String url,
    String htmlUrl,
    String commentsUrl,
    GitHubUser author,
    GitHubUser committer,
    List<JsonNode> parents) {}
