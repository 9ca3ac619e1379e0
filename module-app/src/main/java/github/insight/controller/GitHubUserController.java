package github.insight.controller;

import github.insight.controller.dto.UserLanguagesResponse;
import github.insight.controller.dto.UserRepositorySummaryResponse;
import github.insight.controller.dto.UserStatsResponse;
import github.insight.external.dto.GitHubRepository;
import github.insight.external.dto.GitHubUser;
import github.insight.service.GitHubUserService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class GitHubUserController {

  private final GitHubUserService gitHubUserService;

  @GetMapping("/{username}")
  public ResponseEntity<GitHubUser> getUser(@PathVariable("username") String username) {
    return ResponseEntity.ok(gitHubUserService.getUser(username));
  }

  /** 최근 업데이트순 저장소 목록 */
  @GetMapping("/{username}/repositories")
  public ResponseEntity<List<GitHubRepository>> getRepositories(
      @PathVariable("username") String username,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(gitHubUserService.getRepositories(username, page, perPage));
  }

  @GetMapping("/{username}/repositories/summary")
  public ResponseEntity<UserRepositorySummaryResponse> getRepositorySummary(
      @PathVariable("username") String username) {
    return ResponseEntity.ok(gitHubUserService.getRepositorySummary(username));
  }

  @GetMapping("/{username}/languages")
  public ResponseEntity<UserLanguagesResponse> getLanguages(
      @PathVariable("username") String username) {
    return ResponseEntity.ok(gitHubUserService.getLanguages(username));
  }

  @GetMapping("/{username}/stats")
  public ResponseEntity<UserStatsResponse> getStats(@PathVariable("username") String username) {
    return ResponseEntity.ok(gitHubUserService.getStats(username));
  }
}
