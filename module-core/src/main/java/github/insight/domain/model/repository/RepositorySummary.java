package github.insight.domain.model.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 저장소 집합 요약
 *
 * <p>빈 입력이면 모든 수치가 0이고 목록/맵은 비어 있습니다. {@code languages}는 처음 등장한 순서를 유지합니다.
 */
public record RepositorySummary(
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
    double averageStarsPerRepository,
    Map<String, LanguageSummary> languages,
    List<RepositoryRecord> topRepositories,
    List<RepositoryRecord> recentlyUpdated) {

  public RepositorySummary {
    languages =
        languages == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(languages));
    topRepositories = topRepositories == null ? List.of() : List.copyOf(topRepositories);
    recentlyUpdated = recentlyUpdated == null ? List.of() : List.copyOf(recentlyUpdated);
  }
}
