package github.insight.controller;

import github.insight.external.dto.GitHubRepository;
import github.insight.external.dto.GitHubUser;
import github.insight.service.GitHubSearchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class GitHubSearchController {

  private final GitHubSearchService gitHubSearchService;

  @GetMapping("/repositories")
  public ResponseEntity<List<GitHubRepository>> searchRepositories(
      @RequestParam(name = "q") @NotBlank String query,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(gitHubSearchService.searchRepositories(query, page, perPage));
  }

  @GetMapping("/users")
  public ResponseEntity<List<GitHubUser>> searchUsers(
      @RequestParam(name = "q") @NotBlank String query,
      @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
      @RequestParam(name = "per_page", defaultValue = "30") @Min(1) @Max(100) int perPage) {
    return ResponseEntity.ok(gitHubSearchService.searchUsers(query, page, perPage));
  }
}
