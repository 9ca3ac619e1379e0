package github.insight.service;

import static github.insight.support.GitHubFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class GitHubSearchServiceTest {

  private GitHubApiClient client;
  private GitHubSearchService service;

  @BeforeEach
  void setUp() {
    client = mock(GitHubApiClient.class);
    LogicExecutor executor = TestLogicExecutors.real();
    service =
        new GitHubSearchService(
            new GitHubCachedFetcher(GitHubFixtures.localOnlyCacheStore(executor), client),
            new GitHubPayloadMapper(GitHubFixtures.MAPPER, executor));
  }

  @Test
  @DisplayName("저장소 검색은 스타순 정렬로 요청하고 items만 돌려준다")
  void searchRepositories() {
    given(client.fetch(eq("/search/repositories"), anyMap()))
        .willReturn(
            json(
                "{'total_count':1,'incomplete_results':false,"
                    + "'items':[{'id':1,'name':'spring','full_name':'x/spring'}]}"));

    List<GitHubRepository> result = service.searchRepositories("spring", 1, 30);

    assertThat(result).extracting(GitHubRepository::fullName).containsExactly("x/spring");
    verify(client)
        .fetch(
            "/search/repositories",
            Map.of("q", "spring", "page", 1, "per_page", 30, "sort", "stars"));
  }

  @Test
  @DisplayName("items가 없으면 빈 목록")
  void missingItems() {
    given(client.fetch(eq("/search/users"), anyMap())).willReturn(json("{'total_count':0}"));

    List<GitHubUser> result = service.searchUsers("nobody", 1, 30);

    assertThat(result).isEmpty();
  }
}
