package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ServerBaseException;

/** GitHub 응답을 도메인 레코드로 변환하지 못한 경우 */
public class GitHubDataProcessingException extends ServerBaseException {

  public GitHubDataProcessingException(String detail, Throwable cause) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, detail);
  }
}
