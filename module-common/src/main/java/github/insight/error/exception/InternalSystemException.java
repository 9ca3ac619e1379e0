package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ServerBaseException;
import lombok.Getter;

/** 관리되지 않은 예외를 프로젝트 규격으로 감싸는 시스템 예외 */
@Getter
public class InternalSystemException extends ServerBaseException {

  // 로그 추적용. 응답 메시지에는 노출되지 않는다.
  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }
}
