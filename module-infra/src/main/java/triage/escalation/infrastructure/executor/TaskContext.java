package triage.escalation.infrastructure.executor;

import java.util.Objects;

/**
 * Structured task name for executor logging and metrics.
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * TaskContext.of("EventPublisher", "deliver", "local-file") -> "EventPublisher:deliver:local-file"
 * TaskContext.of("Scheduler", "Escalation.tick")            -> "Scheduler:Escalation.tick"
 * </pre>
 *
 * <p>{@code component} and {@code operation} become metric tags and must come from a fixed set.
 * {@code dynamicValue} (alert ids, channel names) only appears in log lines.
 *
 * @param component component name, e.g. "EventPublisher", "Scheduler", "AlertCommand"
 * @param operation operation name, e.g. "deliver", "Escalation.tick"
 * @param dynamicValue free-form detail, never used as a tag
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
