package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/**
 * Pull Request
 *
 * <p>목록 API는 additions/deletions/commits 같은 상세 수치를 내려주지 않으므로 0으로 남을 수 있습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubPullRequest(
    long id,
    int number,
    String title,
    String body,
    String state,
    boolean locked,
    GitHubUser assignee,
    List<GitHubUser> assignees,
    List<GitHubUser> requestedReviewers,
    JsonNode milestone,
    int comments,
    int reviewComments,
    int commits,
    int additions,
    int deletions,
    int changedFiles,
    Instant createdAt,
    Instant updatedAt,
    Instant closedAt,
    Instant mergedAt,
    String mergeCommitSha,
    String authorAssociation,
    GitHubUser user,
    List<JsonNode> labels,
    JsonNode head,
    JsonNode base,
    boolean draft,
    boolean merged,
    Boolean mergeable,
    String mergeableState,
    GitHubUser mergedBy,
    String commentsUrl,
    String reviewCommentsUrl,
    String commitsUrl,
    String statusesUrl) {}
