package github.insight.config;

import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 클라이언트별 요청 한도 설정
 *
 * <p>버킷은 프로세스 메모리에 있으므로 인스턴스마다 별도로 계산됩니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {

  /** Rate Limiting 활성화 여부 (기본: true) */
  private boolean enabled = true;

  /** 클라이언트당 분당 허용 요청 수 (기본: 60) */
  @Min(1)
  private int requestsPerMinute = 60;

  /** 동시에 추적하는 클라이언트 버킷 최대 수 (기본: 10000) */
  @Min(1)
  private long maxClients = 10_000;

  /**
   * 클라이언트 IP를 읽을 신뢰 프록시 헤더. 순서대로 확인하고 없으면 remoteAddr를 사용합니다.
   *
   * <p>프록시 뒤에 있지 않다면 비워 두세요. 헤더 위조로 한도를 우회할 수 있습니다.
   */
  private List<String> trustedHeaders = new ArrayList<>();
}
