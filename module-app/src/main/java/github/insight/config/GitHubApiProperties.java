package github.insight.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * GitHub REST API 클라이언트 설정
 *
 * <p>토큰이 없으면 비인증 호출(시간당 60회 한도)로 동작합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "github.api")
public class GitHubApiProperties {

  /** API 베이스 URL (기본: https://api.github.com) */
  @NotBlank private String baseUrl = "https://api.github.com";

  /** Personal access token. 비어 있으면 Authorization 헤더를 보내지 않습니다. */
  private String token;

  /** User-Agent 헤더 값. GitHub는 이 헤더가 없는 요청을 거부합니다. */
  @NotBlank private String userAgent = "GitHub-Insight-API/1.0.0";

  /** TCP 연결 타임아웃 (기본: 5초) */
  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  /** 응답 대기 타임아웃 (기본: 10초) */
  @NotNull private Duration responseTimeout = Duration.ofSeconds(10);

  public boolean hasToken() {
    return token != null && !token.isBlank();
  }
}
