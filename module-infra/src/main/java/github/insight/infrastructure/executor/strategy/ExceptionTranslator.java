package github.insight.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import github.insight.error.exception.CacheSerializationException;
import github.insight.error.exception.GitHubDataProcessingException;
import github.insight.error.exception.InternalSystemException;
import github.insight.error.exception.base.BaseException;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.util.ExceptionUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException은 그대로 통과
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /**
   * 기본 예외 변환기
   *
   * <p>BaseException은 보존하고 나머지는 {@link InternalSystemException}으로 규격화합니다.
   */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** GitHub 응답 매핑 전용 변환기. Jackson 매핑 실패를 데이터 처리 예외로 바꿉니다. */
  static ExceptionTranslator forGitHubPayload() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException
              || unwrapped instanceof IllegalArgumentException) {
            return new GitHubDataProcessingException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /**
   * 캐시 직렬화 전용 변환기
   *
   * <p>컨텍스트의 dynamicValue를 캐시 키로 사용합니다.
   */
  static ExceptionTranslator forCacheSerialization() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new CacheSerializationException(context.dynamicValue(), unwrapped));
  }
}
