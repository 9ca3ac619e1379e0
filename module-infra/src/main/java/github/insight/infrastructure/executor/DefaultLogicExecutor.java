package github.insight.infrastructure.executor;

import github.insight.common.function.ThrowingSupplier;
import github.insight.infrastructure.executor.policy.LoggingPolicy;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 {@code logic.executor} 자동 기록
 *   <li><b>Error 격리</b> - Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>메트릭 카디널리티 통제</b> - 동적 값은 로그에만 기록, 태그는 component/operation/result만 사용
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";
  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final MeterRegistry meterRegistry;
  private final LoggingPolicy loggingPolicy;
  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      onSuccess(sample, start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable translated = translateSafe(translator, t, context);
      record(sample, context, "recovered");
      loggingPolicy.onRecovered(translated, System.nanoTime() - start, context);
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      onSuccess(sample, start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(customTranslator, t, context);
      record(sample, context, "failure");
      loggingPolicy.onFailure(primary, System.nanoTime() - start, context);
      throw primary;
    }
  }

  private void onSuccess(Timer.Sample sample, long start, TaskContext context) {
    record(sample, context, "success");
    loggingPolicy.onSuccess(System.nanoTime() - start, context);
  }

  private void record(Timer.Sample sample, TaskContext context, String result) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result)
            .register(meterRegistry));
  }

  /**
   * translator를 안전하게 호출한다.
   *
   * <p>translator가 RuntimeException으로 실패하면 그 예외 자체를 결과로 삼고, Error는 전파한다.
   */
  private static RuntimeException translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error e) {
      throw e;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }
}
