package triage.escalation.core.domain.model;

import java.util.Locale;

/**
 * Alert priority.
 *
 * <p>Immutable after the alert is created. Re-prioritisation is modelled as a new alert.
 *
 * <p>Pure domain model - no external dependencies.
 */
public enum AlertPriority {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /** HIGH and CRITICAL alerts may be escalated manually before their deadline. */
  public boolean isUrgent() {
    return this == HIGH || this == CRITICAL;
  }

  /**
   * Parse a priority name case-insensitively ("critical", "HIGH").
   *
   * @throws IllegalArgumentException if the name is not a priority
   */
  public static AlertPriority from(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("priority cannot be null or blank");
    }
    return AlertPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
