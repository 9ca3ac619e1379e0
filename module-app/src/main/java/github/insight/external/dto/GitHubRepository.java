package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.RepositoryRecord;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubRepository(
    long id,
    String name,
    String fullName,
    String description,
    @JsonProperty("private") boolean privateRepository,
    boolean fork,
    String language,
    long size,
    long stargazersCount,
    long watchersCount,
    long forksCount,
    long openIssuesCount,
    String defaultBranch,
    Instant createdAt,
    Instant updatedAt,
    Instant pushedAt,
    String homepage,
    List<String> topics,
    boolean archived,
    boolean disabled,
    JsonNode license,
    GitHubUser owner) {

  /** 집계 엔진 입력으로 변환 */
  public RepositoryRecord toRecord() {
    return new RepositoryRecord(
        name,
        fullName,
        description,
        language,
        stargazersCount,
        forksCount,
        watchersCount,
        openIssuesCount,
        size,
        privateRepository,
        fork,
        updatedAt);
  }
}
