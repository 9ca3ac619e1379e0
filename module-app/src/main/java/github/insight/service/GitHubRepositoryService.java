package github.insight.service;

import github.insight.controller.dto.RepositoryLanguagesResponse;
import github.insight.domain.service.aggregation.AggregationEngine;
import github.insight.external.GitHubPaths;
import github.insight.external.dto.GitHubCommit;
import github.insight.external.dto.GitHubEvent;
import github.insight.external.dto.GitHubIssue;
import github.insight.external.dto.GitHubPullRequest;
import github.insight.external.dto.GitHubRepository;
import github.insight.service.cache.CacheNamespace;
import github.insight.service.cache.GitHubCachedFetcher;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** 저장소 단위 조회 */
@Service
@RequiredArgsConstructor
public class GitHubRepositoryService {

  private final GitHubCachedFetcher fetcher;
  private final GitHubPayloadMapper mapper;
  private final AggregationEngine aggregationEngine;

  public GitHubRepository getRepository(String owner, String repo) {
    return mapper.toObject(
        fetcher.fetch(CacheNamespace.REPO, GitHubPaths.repository(owner, repo)),
        GitHubRepository.class);
  }

  public RepositoryLanguagesResponse getLanguages(String owner, String repo) {
    Map<String, Long> bytesByLanguage =
        mapper.toByteMap(
            fetcher.fetch(
                CacheNamespace.REPO_LANGUAGES,
                GitHubPaths.repositoryResource(owner, repo, "languages")));
    return RepositoryLanguagesResponse.of(
        owner + "/" + repo, aggregationEngine.languageShares(bytesByLanguage));
  }

  public List<GitHubEvent> getEvents(String owner, String repo, int page, int perPage) {
    return activity(
        owner, repo, "events", Map.of("page", page, "per_page", perPage), GitHubEvent.class);
  }

  public List<GitHubCommit> getCommits(String owner, String repo, int page, int perPage) {
    return activity(
        owner, repo, "commits", Map.of("page", page, "per_page", perPage), GitHubCommit.class);
  }

  public List<GitHubIssue> getIssues(
      String owner, String repo, String state, int page, int perPage) {
    return activity(
        owner,
        repo,
        "issues",
        Map.of("state", state, "page", page, "per_page", perPage),
        GitHubIssue.class);
  }

  public List<GitHubPullRequest> getPullRequests(
      String owner, String repo, String state, int page, int perPage) {
    return activity(
        owner,
        repo,
        "pulls",
        Map.of("state", state, "page", page, "per_page", perPage),
        GitHubPullRequest.class);
  }

  private <T> List<T> activity(
      String owner, String repo, String resource, Map<String, ?> query, Class<T> type) {
    return mapper.toList(
        fetcher.fetch(
            CacheNamespace.REPO_ACTIVITY,
            GitHubPaths.repositoryResource(owner, repo, resource),
            query),
        type);
  }
}
