package triage.escalation.core.domain.model;

/**
 * Classification attached to a fired notification threshold.
 *
 * <p>The delivery side uses it to pick sound, vibration and push behaviour.
 */
public enum NotificationClass {
  INFO,
  WARNING,
  CRITICAL;

  /**
   * Classify a percentage-remaining checkpoint.
   *
   * @param threshold the checkpoint that fired (e.g. 50, 25, 10)
   * @return CRITICAL at 25 or below, WARNING at 50 or below, otherwise INFO
   */
  public static NotificationClass of(int threshold) {
    if (threshold <= 25) {
      return CRITICAL;
    }
    if (threshold <= 50) {
      return WARNING;
    }
    return INFO;
  }
}
