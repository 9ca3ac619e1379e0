package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ServerBaseException;

public class ExternalServiceException extends ServerBaseException {

  // 대상 서비스 이름(예: GitHub API)을 인자로 받아 메시지를 구성합니다.
  public ExternalServiceException(String serviceName) {
    super(CommonErrorCode.EXTERNAL_API_ERROR, serviceName);
  }

  public ExternalServiceException(String serviceName, Throwable cause) {
    super(CommonErrorCode.EXTERNAL_API_ERROR, cause, serviceName);
  }
}
