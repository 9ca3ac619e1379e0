package github.insight.external;

import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/** GitHub API 경로 조립. 사용자 입력 세그먼트는 모두 퍼센트 인코딩합니다. */
public final class GitHubPaths {

  public static final String RATE_LIMIT = "/rate_limit";
  public static final String SEARCH_REPOSITORIES = "/search/repositories";
  public static final String SEARCH_USERS = "/search/users";

  private GitHubPaths() {}

  public static String user(String username) {
    return "/users/" + segment(username);
  }

  public static String userRepositories(String username) {
    return user(username) + "/repos";
  }

  public static String repository(String owner, String repo) {
    return "/repos/" + segment(owner) + "/" + segment(repo);
  }

  public static String repositoryResource(String owner, String repo, String resource) {
    return repository(owner, repo) + "/" + resource;
  }

  private static String segment(String value) {
    return UriUtils.encodePathSegment(value, StandardCharsets.UTF_8);
  }
}
