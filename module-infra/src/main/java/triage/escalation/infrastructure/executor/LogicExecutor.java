package triage.escalation.infrastructure.executor;

import java.util.function.Function;
import triage.escalation.infrastructure.executor.function.ThrowingRunnable;
import triage.escalation.infrastructure.executor.function.ThrowingSupplier;

/**
 * Runs side-effecting work with uniform logging, timing and exception translation.
 *
 * <p>Keep the lambda short and move the body into a method reference:
 *
 * <pre>{@code
 * executor.executeVoid(this::writeLine, TaskContext.of("EventChannel", "write", path));
 * }</pre>
 *
 * <h3>Exception policy</h3>
 *
 * <ul>
 *   <li>{@link Error}: rethrown untouched, never caught
 *   <li>{@code BaseException}: passed through as is
 *   <li>anything else: wrapped in {@code InternalSystemException} carrying the task name
 * </ul>
 */
public interface LogicExecutor {

  /** Run and propagate failures after translation. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** Run; on failure log it and return {@code defaultValue}. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** Run; on failure hand the translated exception to {@code recovery}. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** Run and always run {@code finallyBlock} afterwards, exactly once. */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);
}
