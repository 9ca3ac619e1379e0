package github.insight.controller;

import github.insight.controller.dto.RepositoryLanguagesResponse;
import github.insight.external.dto.GitHubCommit;
import github.insight.external.dto.GitHubEvent;
import github.insight.external.dto.GitHubIssue;
import github.insight.external.dto.GitHubPullRequest;
import github.insight.external.dto.GitHubRepository;
import github.insight.service.GitHubRepositoryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/repos/{owner}/{repo}")
@RequiredArgsConstructor
public class GitHubRepositoryController {

  private static final String STATE_PATTERN = "open|closed|all";

  private final GitHubRepositoryService gitHubRepositoryService;

  @GetMapping
  public ResponseEntity<GitHubRepository> getRepository(
      @PathVariable("owner") String owner, @PathVariable("repo") String repo) {
    return ResponseEntity.ok(gitHubRepositoryService.getRepository(owner, repo));
  }

  /** 언어별 바이트 수와 비중 */
  @GetMapping("/languages")
  public ResponseEntity<RepositoryLanguagesResponse> getLanguages(
      @PathVariable("owner") String owner, @PathVariable("repo") String repo) {
    return ResponseEntity.ok(gitHubRepositoryService.getLanguages(owner, repo));
  }

  @GetMapping("/events")
  public ResponseEntity<List<GitHubEvent>> getEvents(
      @PathVariable("owner") String owner,
      @PathVariable("repo") String repo,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(gitHubRepositoryService.getEvents(owner, repo, page, perPage));
  }

  @GetMapping("/commits")
  public ResponseEntity<List<GitHubCommit>> getCommits(
      @PathVariable("owner") String owner,
      @PathVariable("repo") String repo,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(gitHubRepositoryService.getCommits(owner, repo, page, perPage));
  }

  @GetMapping("/issues")
  public ResponseEntity<List<GitHubIssue>> getIssues(
      @PathVariable("owner") String owner,
      @PathVariable("repo") String repo,
      @RequestParam(name = "state", defaultValue = "open") @Pattern(regexp = STATE_PATTERN)
          String state,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(
        gitHubRepositoryService.getIssues(owner, repo, state, page, perPage));
  }

  @GetMapping("/pulls")
  public ResponseEntity<List<GitHubPullRequest>> getPullRequests(
      @PathVariable("owner") String owner,
      @PathVariable("repo") String repo,
      @RequestParam(name = "state", defaultValue = "open") @Pattern(regexp = STATE_PATTERN)
          String state,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(
        gitHubRepositoryService.getPullRequests(owner, repo, state, page, perPage));
  }
}
