package triage.escalation.infrastructure.executor.function;

/** Supplier that may throw checked exceptions. */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
