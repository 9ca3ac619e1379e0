package github.insight.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.LanguageCount;
import github.insight.external.dto.GitHubUser;
import java.util.List;

/** GET /users/{username}/stats */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserStatsResponse(
    String username,
    GitHubUser user,
    RepositoryCounts repositories,
    Activity activity,
    Languages languages,
    List<RepositoryBrief> topRepositories) {

  public record RepositoryCounts(
      long total,
      @JsonProperty("public") long publicCount,
      @JsonProperty("private") long privateCount,
      long forked,
      long original) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Activity(
      long totalStars, long totalForks, long totalIssues, double averageStarsPerRepo) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Languages(List<LanguageCount> topLanguages, int totalLanguages) {}
}
