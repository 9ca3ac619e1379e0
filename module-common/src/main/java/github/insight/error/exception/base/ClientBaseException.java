package github.insight.error.exception.base;

import github.insight.error.ErrorCode;

/**
 * ClientBaseException: 요청이 잘못되었을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패 원인을 전달하는 것이
 * 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "GitHub 리소스를 찾을 수 없습니다 (users/octocat)"처럼 동적 인자로 메시지를 완성합니다.
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
