package github.insight.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception unwrapping utilities.
 *
 * <p>Extracts root causes from wrapped exceptions like CompletionException and ExecutionException.
 */
public final class ExceptionUtils {

  /**
   * Unwrap async exception wrappers to find the root cause.
   *
   * @param throwable The exception to unwrap
   * @return The root cause, or the original if not wrapped
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  /** Short "Type: message" rendering for single-line warn logs. */
  public static String describe(Throwable throwable) {
    if (throwable == null) {
      return "unknown";
    }
    Throwable root = unwrapAsyncException(throwable);
    return root.getClass().getSimpleName() + ": " + root.getMessage();
  }

  private ExceptionUtils() {
    // Utility class
  }
}
