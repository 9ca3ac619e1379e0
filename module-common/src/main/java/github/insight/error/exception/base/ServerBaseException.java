package github.insight.error.exception.base;

import github.insight.error.ErrorCode;

/**
 * ServerBaseException: 시스템 내부 오류나 외부 의존성 장애로 발생하는 '서버 예외' 5xx 계열의 에러를 처리하며, 장애 회고를 위한 상세 로그를 남기는
 * 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
