package github.insight.service;

import github.insight.external.GitHubPaths;
import github.insight.external.dto.GitHubRepository;
import github.insight.external.dto.GitHubUser;
import github.insight.service.cache.CacheNamespace;
import github.insight.service.cache.GitHubCachedFetcher;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GitHubSearchService {

  private final GitHubCachedFetcher fetcher;
  private final GitHubPayloadMapper mapper;

  /** 스타 수 내림차순 저장소 검색 */
  public List<GitHubRepository> searchRepositories(String query, int page, int perPage) {
    Map<String, Object> params =
        Map.of("q", query, "page", page, "per_page", perPage, "sort", "stars");
    return mapper.searchItems(
        fetcher.fetch(CacheNamespace.SEARCH, GitHubPaths.SEARCH_REPOSITORIES, params),
        GitHubRepository.class);
  }

  public List<GitHubUser> searchUsers(String query, int page, int perPage) {
    Map<String, Object> params = Map.of("q", query, "page", page, "per_page", perPage);
    return mapper.searchItems(
        fetcher.fetch(CacheNamespace.SEARCH, GitHubPaths.SEARCH_USERS, params), GitHubUser.class);
  }
}
