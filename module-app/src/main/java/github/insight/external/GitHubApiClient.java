package github.insight.external;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * GitHub REST API 호출 경계
 *
 * <p>구현체는 2xx 응답 본문을 그대로 돌려주고, 실패를 다음과 같이 규격화합니다.
 *
 * <ul>
 *   <li>404 → {@code GitHubResourceNotFoundException}
 *   <li>그 외 비정상 상태 코드, 네트워크 오류, 타임아웃, 깨진 본문 → {@code ExternalServiceException}
 * </ul>
 */
public interface GitHubApiClient {

  /**
   * @param path 베이스 URL 이후 경로. 경로 세그먼트는 이미 인코딩되어 있어야 합니다 ({@link GitHubPaths}).
   * @param queryParams 쿼리 파라미터 (값은 클라이언트가 인코딩)
   */
  JsonNode fetch(String path, Map<String, ?> queryParams);

  default JsonNode fetch(String path) {
    return fetch(path, Map.of());
  }
}
