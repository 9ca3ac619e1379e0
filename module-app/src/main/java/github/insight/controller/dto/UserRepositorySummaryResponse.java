package github.insight.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.LanguageSummary;
import github.insight.domain.model.repository.RepositorySummary;
import java.util.List;
import java.util.Map;

/** GET /users/{username}/repositories/summary */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserRepositorySummaryResponse(
    String username,
    Totals summary,
    Map<String, LanguageSummary> languages,
    List<RepositoryBrief> topRepositories,
    List<RepositoryBrief> recentActivity) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Totals(
      long totalRepositories,
      long publicRepositories,
      long privateRepositories,
      double publicPercentage,
      double privatePercentage,
      long forkedRepositories,
      long originalRepositories,
      long totalStars,
      long totalForks,
      long totalWatchers,
      long totalSize,
      long totalOpenIssues,
      double averageStarsPerRepository) {}

  public static UserRepositorySummaryResponse of(String username, RepositorySummary summary) {
    Totals totals =
        new Totals(
            summary.totalRepositories(),
            summary.publicRepositories(),
            summary.privateRepositories(),
            summary.publicPercentage(),
            summary.privatePercentage(),
            summary.forkedRepositories(),
            summary.originalRepositories(),
            summary.totalStars(),
            summary.totalForks(),
            summary.totalWatchers(),
            summary.totalSize(),
            summary.totalOpenIssues(),
            summary.averageStarsPerRepository());

    return new UserRepositorySummaryResponse(
        username,
        totals,
        summary.languages(),
        summary.topRepositories().stream().map(RepositoryBrief::from).toList(),
        summary.recentlyUpdated().stream().map(RepositoryBrief::from).toList());
  }
}
