package github.insight.infrastructure.executor;

import github.insight.common.function.ThrowingSupplier;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>코드 평탄화(Code Flattening)를 최우선으로 설계되었습니다. 비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code
 * this::method})를 활용하세요.
 *
 * <h3>지원하는 예외 처리 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (복구 로직 실행) - {@link #executeOrCatch}
 *   <li><b>다중 catch</b> (ExceptionTranslator 사용) - {@link #executeWithTranslation}
 * </ol>
 *
 * <p>모든 패턴에서 {@link Error}는 잡지 않고 그대로 전파합니다.
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * public Optional<String> readRemote(String key) {
 *   return executor.executeOrDefault(
 *       () -> remoteTier.get(key), Optional.empty(), TaskContext.of("CacheStore", "getRemote", key));
 * }
 * }</pre>
 *
 * @see ThrowingSupplier
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 작업을 실행하고 실패하면 기본 변환기로 변환한 예외를 전파합니다.
   *
   * <p>{@code BaseException}은 그대로, 그 외 예외는 {@code InternalSystemException}으로 전파됩니다.
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 예외 발생 시 기본값 반환
   *
   * <h4>사용 예시</h4>
   *
   * <pre>{@code
   * boolean reachable = executor.executeOrDefault(remoteTier::ping, false, context);
   * }</pre>
   */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 예외 발생 시 복구 함수 실행
   *
   * <p>복구 함수는 기본 변환기를 거친 예외를 받습니다.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** 주어진 변환기로 예외를 변환하여 전파 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
