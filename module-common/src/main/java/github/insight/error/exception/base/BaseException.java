package github.insight.error.exception.base;

import github.insight.error.ErrorCode;
import lombok.Getter;

/**
 * 프로젝트 예외 계층의 루트
 *
 * <p>메시지는 {@link ErrorCode#getMessage()} 템플릿에 인자를 채워 만듭니다. 인자가 없으면 템플릿을 그대로 사용합니다.
 */
@Getter
public abstract class BaseException extends RuntimeException {

  private final transient ErrorCode errorCode;

  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Object... args) {
    super(format(errorCode, args));
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(format(errorCode, args), cause);
    this.errorCode = errorCode;
  }

  private static String format(ErrorCode errorCode, Object... args) {
    if (args == null || args.length == 0) {
      return errorCode.getMessage();
    }
    return String.format(errorCode.getMessage(), args);
  }
}
