package triage.escalation.infrastructure.executor.function;

/** Runnable that may throw checked exceptions. */
@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
