package github.insight.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <p>TaskName을 구조화하여 동적 값과 고정 Taxonomy를 분리합니다.
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("CacheStore", "getRemote", "9f86d081...")
 *   → "CacheStore:getRemote:9f86d081..."
 * - TaskContext.of("GitHubApi", "fetch", "/users/octocat")
 *   → "GitHubApi:fetch:/users/octocat"
 * </pre>
 *
 * <h3>메트릭 카디널리티 통제</h3>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (메트릭에서 제외)
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "CacheStore", "GitHubApi")
 * @param operation 작업 유형 (예: "getRemote", "fetch")
 * @param dynamicValue 동적 값 (예: 캐시 키, 요청 경로)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** @return "component:operation[:dynamicValue]" 형식의 문자열 */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
