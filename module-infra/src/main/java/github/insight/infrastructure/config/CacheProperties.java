package github.insight.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 2계층 캐시 설정 프로퍼티
 *
 * <p>원격 계층(Redis)은 기본 비활성입니다. 비활성이거나 기동 시 연결에 실패하면 로컬 계층만 사용합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

  /** 로컬 계층 최대 항목 수 (기본: 1000) */
  @Min(1)
  private int localCapacity = 1000;

  /** 호출자가 TTL을 지정하지 않을 때 사용하는 TTL (기본: 5분) */
  @NotNull private Duration defaultTtl = Duration.ofSeconds(300);

  @Valid @NotNull private Remote remote = new Remote();

  @Getter
  @Setter
  public static class Remote {

    /** 원격 계층 사용 여부 (기본: false) */
    private boolean enabled = false;

    @NotBlank private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 6379;

    /** 비어 있으면 인증 없이 접속 */
    private String password;

    @Min(0)
    private int database = 0;

    /** TCP 연결 타임아웃 (기본: 5초) */
    @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

    /** 명령 응답 타임아웃 (기본: 5초). 초과하면 원격 계층 장애로 간주 */
    @NotNull private Duration readTimeout = Duration.ofSeconds(5);

    /** Redisson 재시도 횟수 (기본: 1) */
    @Min(0)
    private int retryAttempts = 1;
  }
}
