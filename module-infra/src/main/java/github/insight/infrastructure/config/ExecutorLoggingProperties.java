package github.insight.infrastructure.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** LogicExecutor 로깅 설정 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "executor.logging")
public class ExecutorLoggingProperties {

  /** 이 시간(ms)을 넘긴 작업은 INFO로 SLOW 로그를 남깁니다. 0이면 비활성. (기본: 1000) */
  @PositiveOrZero private long slowMs = 1000;
}
