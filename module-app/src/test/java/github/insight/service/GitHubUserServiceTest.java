package github.insight.service;

import static github.insight.support.GitHubFixtures.json;
import static github.insight.support.GitHubFixtures.repository;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import github.insight.controller.dto.RepositoryBrief;
import github.insight.controller.dto.UserLanguagesResponse;
import github.insight.controller.dto.UserRepositorySummaryResponse;
import github.insight.controller.dto.UserStatsResponse;
import github.insight.domain.model.repository.LanguageCount;
import github.insight.domain.service.aggregation.AggregationEngine;
import github.insight.error.exception.GitHubDataProcessingException;
import github.insight.error.exception.GitHubResourceNotFoundException;
import github.insight.external.GitHubApiClient;
import github.insight.external.dto.GitHubRepository;
import github.insight.external.dto.GitHubUser;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.service.cache.GitHubCachedFetcher;
import github.insight.support.GitHubFixtures;
import github.insight.support.TestLogicExecutors;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * GitHubUserService 단위 테스트
 *
 * <p>GitHub 클라이언트만 mock이고 캐시, 매핑, 집계는 실제 구현을 사용한다.
 */
@Tag("unit")
class GitHubUserServiceTest {

  private static final String REPOS_PATH = "/users/octocat/repos";

  private GitHubApiClient client;
  private GitHubUserService service;

  @BeforeEach
  void setUp() {
    client = mock(GitHubApiClient.class);
    LogicExecutor executor = TestLogicExecutors.real();
    GitHubCachedFetcher fetcher =
        new GitHubCachedFetcher(GitHubFixtures.localOnlyCacheStore(executor), client);
    service =
        new GitHubUserService(
            fetcher,
            new GitHubPayloadMapper(GitHubFixtures.MAPPER, executor),
            new AggregationEngine());
  }

  private void givenRepositories(String... repositories) {
    given(client.fetch(eq(REPOS_PATH), anyMap()))
        .willReturn(json("[" + String.join(",", repositories) + "]"));
  }

  @Nested
  @DisplayName("단건/목록 조회")
  class Lookup {

    @Test
    @DisplayName("사용자 JSON을 DTO로 매핑한다")
    void getUser() {
      given(client.fetch(eq("/users/octocat"), anyMap())).willReturn(json(GitHubFixtures.OCTOCAT));

      GitHubUser user = service.getUser("octocat");

      assertThat(user.login()).isEqualTo("octocat");
      assertThat(user.publicRepos()).isEqualTo(8);
      assertThat(user.createdAt()).hasToString("2011-01-25T18:44:36Z");
    }

    @Test
    @DisplayName("404는 그대로 전파된다")
    void notFound() {
      given(client.fetch(eq("/users/ghost"), anyMap()))
          .willThrow(new GitHubResourceNotFoundException("/users/ghost"));

      assertThatThrownBy(() -> service.getUser("ghost"))
          .isInstanceOf(GitHubResourceNotFoundException.class);
    }

    @Test
    @DisplayName("저장소 목록은 최근 업데이트순 정렬 파라미터로 요청한다")
    void repositoriesQuery() {
      givenRepositories(repository("hello", "Java", 3, false, "2024-01-01T00:00:00Z"));

      List<GitHubRepository> repositories = service.getRepositories("octocat", 2, 50);

      assertThat(repositories).hasSize(1);
      assertThat(repositories.get(0).fullName()).isEqualTo("octocat/hello");
      assertThat(repositories.get(0).stargazersCount()).isEqualTo(3);
      verify(client).fetch(REPOS_PATH, Map.of("page", 2, "per_page", 50, "sort", "updated"));
    }

    @Test
    @DisplayName("배열이 아닌 응답은 GitHubDataProcessingException(S004)")
    void unexpectedShape() {
      given(client.fetch(eq(REPOS_PATH), anyMap())).willReturn(json("{'message':'weird'}"));

      assertThatThrownBy(() -> service.getRepositories("octocat", 1, 30))
          .isInstanceOf(GitHubDataProcessingException.class);
    }
  }

  @Nested
  @DisplayName("집계")
  class Aggregation {

    @BeforeEach
    void repositories() {
      givenRepositories(
          repository("a", "Python", 10, false, "2024-03-01T00:00:00Z"),
          repository("b", "JavaScript", 5, true, "2024-05-01T00:00:00Z"),
          repository("c", "Python", 15, false, null));
    }

    @Test
    @DisplayName("요약: 스타 합계, 언어 비율, 스타순 상위 저장소")
    void summary() {
      UserRepositorySummaryResponse response = service.getRepositorySummary("octocat");

      assertThat(response.username()).isEqualTo("octocat");
      assertThat(response.summary().totalRepositories()).isEqualTo(3);
      assertThat(response.summary().totalStars()).isEqualTo(30);
      assertThat(response.summary().privateRepositories()).isEqualTo(1);
      assertThat(response.languages().get("Python").count()).isEqualTo(2);
      assertThat(response.languages().get("Python").percentage()).isEqualTo(66.67);
      assertThat(response.languages().get("JavaScript").percentage()).isEqualTo(33.33);
      assertThat(response.topRepositories())
          .extracting(RepositoryBrief::stars)
          .containsExactly(15L, 10L, 5L);
      assertThat(response.recentActivity())
          .extracting(RepositoryBrief::name)
          .containsExactly("b", "a", "c");
    }

    @Test
    @DisplayName("요약/언어/통계는 같은 저장소 페이지를 캐시로 공유한다")
    void sharesRepositoryPage() {
      service.getRepositorySummary("octocat");
      service.getLanguages("octocat");

      verify(client, times(1))
          .fetch(REPOS_PATH, Map.of("page", 1, "per_page", 100, "sort", "updated"));
    }

    @Test
    @DisplayName("언어 사용량은 저장소 수 기준이다")
    void languages() {
      UserLanguagesResponse response = service.getLanguages("octocat");

      assertThat(response.totalLanguages()).isEqualTo(2);
      assertThat(response.languages().keySet()).containsExactly("Python", "JavaScript");
      assertThat(response.languages().get("Python").repositoryCount()).isEqualTo(2);
      assertThat(response.languages().get("Python").totalStars()).isEqualTo(25);
    }

    @Test
    @DisplayName("통계: 사용자 + 저장소 분포 + 언어 리더보드")
    void stats() {
      given(client.fetch(eq("/users/octocat"), anyMap())).willReturn(json(GitHubFixtures.OCTOCAT));

      UserStatsResponse stats = service.getStats("octocat");

      assertThat(stats.user().name()).isEqualTo("The Octocat");
      assertThat(stats.repositories().total()).isEqualTo(3);
      assertThat(stats.repositories().publicCount()).isEqualTo(2);
      assertThat(stats.activity().totalStars()).isEqualTo(30);
      assertThat(stats.activity().averageStarsPerRepo()).isEqualTo(10.0);
      assertThat(stats.languages().topLanguages())
          .containsExactly(new LanguageCount("Python", 2), new LanguageCount("JavaScript", 1));
      assertThat(stats.languages().totalLanguages()).isEqualTo(2);
    }

    @Test
    @DisplayName("저장소가 없으면 모든 수치가 0이다")
    void emptyUser() {
      given(client.fetch(eq("/users/empty/repos"), anyMap())).willReturn(json("[]"));

      UserRepositorySummaryResponse response = service.getRepositorySummary("empty");

      assertThat(response.summary().totalRepositories()).isZero();
      assertThat(response.summary().averageStarsPerRepository()).isZero();
      assertThat(response.languages()).isEmpty();
      assertThat(response.topRepositories()).isEmpty();
    }
  }
}
