package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ClientBaseException;

public class InvalidApiKeyException extends ClientBaseException {

  public InvalidApiKeyException() {
    super(CommonErrorCode.INVALID_API_KEY);
  }
}
