package github.insight.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import github.insight.controller.dto.RepositoryLanguagesResponse;
import github.insight.domain.model.repository.LanguageShare;
import github.insight.global.error.GlobalExceptionHandler;
import github.insight.service.GitHubRepositoryService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("GitHubRepositoryController 단위 테스트")
class GitHubRepositoryControllerTest {

  @Mock private GitHubRepositoryService gitHubRepositoryService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new GitHubRepositoryController(gitHubRepositoryService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  @DisplayName("언어 비중 응답은 total_languages와 언어별 bytes/percentage를 담는다")
  void languages() throws Exception {
    given(gitHubRepositoryService.getLanguages("octocat", "hello"))
        .willReturn(
            RepositoryLanguagesResponse.of(
                "octocat/hello",
                List.of(
                    new LanguageShare("Java", 750, 75.0), new LanguageShare("Shell", 250, 25.0))));

    mockMvc
        .perform(get("/api/v1/repos/octocat/hello/languages"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.repository").value("octocat/hello"))
        .andExpect(jsonPath("$.total_languages").value(2))
        .andExpect(jsonPath("$.languages.Java.bytes").value(750))
        .andExpect(jsonPath("$.languages.Shell.percentage").value(25.0));
  }

  @Test
  @DisplayName("state 기본값은 open")
  void defaultState() throws Exception {
    given(gitHubRepositoryService.getIssues("octocat", "hello", "open", 1, 30))
        .willReturn(List.of());

    mockMvc
        .perform(get("/api/v1/repos/octocat/hello/issues"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());
  }

  @Test
  @DisplayName("허용되지 않은 state → 400 + C001")
  void invalidState() throws Exception {
    mockMvc
        .perform(get("/api/v1/repos/octocat/hello/pulls").param("state", "merged"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("C001"));

    verify(gitHubRepositoryService, never())
        .getPullRequests(anyString(), anyString(), anyString(), anyInt(), anyInt());
  }

  @Test
  @DisplayName("예상하지 못한 예외 → 500 + S001, 상세 메시지는 숨긴다")
  void unexpectedFailure() throws Exception {
    given(gitHubRepositoryService.getCommits("octocat", "hello", 1, 30))
        .willThrow(new IllegalStateException("secret detail"));

    mockMvc
        .perform(get("/api/v1/repos/octocat/hello/commits"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("S001"));
  }
}
