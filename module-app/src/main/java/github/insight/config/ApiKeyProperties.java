package github.insight.config;

import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** 선택적 API 키 인증 설정 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "security.api-key")
public class ApiKeyProperties {

  /** 인증 사용 여부 (기본: false) */
  private boolean enabled = false;

  /** API 키를 담는 요청 헤더 (기본: X-API-Key) */
  @NotBlank private String header = "X-API-Key";

  /** 허용 키 목록. 환경 변수로는 콤마 구분 문자열을 사용합니다. */
  private List<String> validKeys = new ArrayList<>();

  /** 인증 없이 허용할 경로 접두사 */
  private List<String> exemptPaths = new ArrayList<>(List.of("/api/v1/health", "/actuator"));
}
