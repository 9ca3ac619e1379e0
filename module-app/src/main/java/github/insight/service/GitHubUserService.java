package github.insight.service;

import github.insight.controller.dto.RepositoryBrief;
import github.insight.controller.dto.UserLanguagesResponse;
import github.insight.controller.dto.UserRepositorySummaryResponse;
import github.insight.controller.dto.UserStatsResponse;
import github.insight.domain.model.repository.RepositoryRecord;
import github.insight.domain.model.repository.RepositorySummary;
import github.insight.domain.service.aggregation.AggregationEngine;
import github.insight.external.GitHubPaths;
import github.insight.external.dto.GitHubRepository;
import github.insight.external.dto.GitHubUser;
import github.insight.service.cache.CacheNamespace;
import github.insight.service.cache.GitHubCachedFetcher;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 사용자 단위 조회와 집계
 *
 * <p>요약/언어/통계는 최근 업데이트순 첫 페이지 최대 100개 저장소만 대상으로 합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitHubUserService {

  static final int AGGREGATION_PAGE_SIZE = 100;

  private final GitHubCachedFetcher fetcher;
  private final GitHubPayloadMapper mapper;
  private final AggregationEngine aggregationEngine;

  public GitHubUser getUser(String username) {
    return mapper.toObject(
        fetcher.fetch(CacheNamespace.USER, GitHubPaths.user(username)), GitHubUser.class);
  }

  public List<GitHubRepository> getRepositories(String username, int page, int perPage) {
    Map<String, Object> query = Map.of("page", page, "per_page", perPage, "sort", "updated");
    return mapper.toList(
        fetcher.fetch(CacheNamespace.USER_REPOS, GitHubPaths.userRepositories(username), query),
        GitHubRepository.class);
  }

  public UserRepositorySummaryResponse getRepositorySummary(String username) {
    RepositorySummary summary = aggregationEngine.summarize(aggregationRecords(username));
    return UserRepositorySummaryResponse.of(username, summary);
  }

  public UserLanguagesResponse getLanguages(String username) {
    return UserLanguagesResponse.of(
        username, aggregationEngine.languageUsage(aggregationRecords(username)));
  }

  public UserStatsResponse getStats(String username) {
    GitHubUser user = getUser(username);
    List<RepositoryRecord> records = aggregationRecords(username);
    RepositorySummary summary = aggregationEngine.summarize(records);

    UserStatsResponse.RepositoryCounts counts =
        new UserStatsResponse.RepositoryCounts(
            summary.totalRepositories(),
            summary.publicRepositories(),
            summary.privateRepositories(),
            summary.forkedRepositories(),
            summary.originalRepositories());
    UserStatsResponse.Activity activity =
        new UserStatsResponse.Activity(
            summary.totalStars(),
            summary.totalForks(),
            summary.totalOpenIssues(),
            summary.averageStarsPerRepository());
    UserStatsResponse.Languages languages =
        new UserStatsResponse.Languages(
            aggregationEngine.languageLeaderboard(records), summary.languages().size());

    return new UserStatsResponse(
        username,
        user,
        counts,
        activity,
        languages,
        summary.topRepositories().stream().map(RepositoryBrief::from).toList());
  }

  private List<RepositoryRecord> aggregationRecords(String username) {
    List<RepositoryRecord> records =
        getRepositories(username, 1, AGGREGATION_PAGE_SIZE).stream()
            .map(GitHubRepository::toRecord)
            .toList();
    log.debug("[Aggregation] {} repositories loaded for {}", records.size(), username);
    return records;
  }
}
