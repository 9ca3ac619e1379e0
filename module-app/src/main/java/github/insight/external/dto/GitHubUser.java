package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** GitHub 사용자. 검색 결과처럼 일부 필드만 채워진 응답도 그대로 매핑합니다. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubUser(
    long id,
    String login,
    String name,
    String email,
    String avatarUrl,
    String bio,
    String location,
    String company,
    String blog,
    String twitterUsername,
    int publicRepos,
    int publicGists,
    int followers,
    int following,
    Instant createdAt,
    Instant updatedAt,
    Boolean hireable,
    String type,
    boolean siteAdmin) {}
