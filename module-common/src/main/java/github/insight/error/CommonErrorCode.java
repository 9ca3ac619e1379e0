package github.insight.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  RESOURCE_NOT_FOUND("C002", "GitHub 리소스를 찾을 수 없습니다 (%s)", HttpStatus.NOT_FOUND),
  API_KEY_REQUIRED("C003", "API 키가 필요합니다 (헤더: %s)", HttpStatus.UNAUTHORIZED),
  INVALID_API_KEY("C004", "유효하지 않은 API 키입니다.", HttpStatus.FORBIDDEN),
  RATE_LIMIT_EXCEEDED(
      "C005", "요청 한도를 초과했습니다. %s초 후 다시 시도해주세요.", HttpStatus.TOO_MANY_REQUESTS),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S004", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EXTERNAL_API_ERROR("S005", "외부 API 호출 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_SERIALIZATION_ERROR("S006", "캐시 직렬화 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
