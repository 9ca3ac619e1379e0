package github.insight.service.cache;

import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** GitHub 응답 캐시 네임스페이스와 TTL */
@Getter
@RequiredArgsConstructor
public enum CacheNamespace {
  USER("user", Duration.ofMinutes(5)),
  USER_REPOS("user_repos", Duration.ofMinutes(10)),
  REPO("repo", Duration.ofMinutes(5)),
  REPO_LANGUAGES("repo_languages", Duration.ofMinutes(10)),
  REPO_ACTIVITY("repo_activity", Duration.ofMinutes(1)),
  SEARCH("search", Duration.ofMinutes(2));

  private final String key;
  private final Duration ttl;
}
