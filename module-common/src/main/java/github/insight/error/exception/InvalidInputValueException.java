package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ClientBaseException;

public class InvalidInputValueException extends ClientBaseException {

  public InvalidInputValueException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
