package github.insight.error.exception;

import github.insight.error.CommonErrorCode;
import github.insight.error.exception.base.ClientBaseException;

/** 업스트림 GitHub API가 404를 반환한 경우 */
public class GitHubResourceNotFoundException extends ClientBaseException {

  public GitHubResourceNotFoundException(String resourcePath) {
    super(CommonErrorCode.RESOURCE_NOT_FOUND, resourcePath);
  }
}
