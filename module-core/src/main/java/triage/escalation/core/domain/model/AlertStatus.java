package triage.escalation.core.domain.model;

/**
 * Alert lifecycle status.
 *
 * <p>PENDING is initial. RESOLVED is terminal for the engine (the alert is archived externally).
 */
public enum AlertStatus {
  PENDING,
  ACKNOWLEDGED,
  RESOLVED,
  ESCALATED;

  /** Open alerts have a running escalation timer and collect notifications. */
  public boolean isOpen() {
    return this == PENDING || this == ESCALATED;
  }

  public boolean isTerminal() {
    return this == RESOLVED;
  }
}
