package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ClientBaseException;

public class ApiKeyRequiredException extends ClientBaseException {

  public ApiKeyRequiredException(String headerName) {
    super(CommonErrorCode.API_KEY_REQUIRED, headerName);
  }
}
