package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ServerBaseException;

public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String key, Throwable cause) {
    super(CommonErrorCode.CACHE_SERIALIZATION_ERROR, cause, key);
  }
}
