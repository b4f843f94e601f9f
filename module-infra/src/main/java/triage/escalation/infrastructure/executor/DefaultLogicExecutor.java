package triage.escalation.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import triage.escalation.error.exception.InternalSystemException;
import triage.escalation.error.exception.base.BaseException;
import triage.escalation.error.exception.base.ClientBaseException;
import triage.escalation.infrastructure.executor.function.ThrowingRunnable;
import triage.escalation.infrastructure.executor.function.ThrowingSupplier;

/**
 * Default {@link LogicExecutor}.
 *
 * <p>Records every run in the {@code logic.executor} timer, tagged with the task's component,
 * operation and outcome. Client errors are logged at WARN, everything else at ERROR.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    try {
      return run(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translate(t, context);
      logFailure(translated, context);
      throw translated;
    }
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
    try {
      return run(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translate(t, context);
      logFailure(translated, context);
      return recovery.apply(translated);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return execute(task, context);
    } finally {
      finallyBlock.run();
    }
  }

  private <T> T run(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Timer.Sample sample = Timer.start(meterRegistry);
    String outcome = "success";
    try {
      return task.get();
    } catch (Throwable t) {
      outcome = "failure";
      throw t;
    } finally {
      sample.stop(
          Timer.builder(METRIC_NAME)
              .tag("component", context.component())
              .tag("operation", context.operation())
              .tag("outcome", outcome)
              .register(meterRegistry));
    }
  }

  private static RuntimeException translate(Throwable t, TaskContext context) {
    if (t instanceof BaseException base) {
      return base;
    }
    return new InternalSystemException(context.toTaskName(), t);
  }

  private static void logFailure(RuntimeException e, TaskContext context) {
    if (e instanceof ClientBaseException) {
      log.warn("[LogicExecutor] {} rejected: {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.error("[LogicExecutor] {} failed", context.toTaskName(), e);
  }
}
