package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ClientBaseException;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends ClientBaseException {

  private final long retryAfterSeconds;

  public RateLimitExceededException(long retryAfterSeconds) {
    super(CommonErrorCode.RATE_LIMIT_EXCEEDED, retryAfterSeconds);
    this.retryAfterSeconds = retryAfterSeconds;
  }
}
