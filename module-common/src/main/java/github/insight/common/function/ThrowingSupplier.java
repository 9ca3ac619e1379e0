package github.insight.common.function;

/**
 * 체크 예외를 던질 수 있는 Supplier
 *
 * <p>{@code LogicExecutor}에 작업을 넘길 때 사용합니다. 변환 규칙은 실행기가 결정합니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  T get() throws Throwable;
}
