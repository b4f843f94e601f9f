package triage.escalation.core.notification;

import java.util.List;
import triage.escalation.error.exception.ThresholdConfigurationException;

/**
 * Percentage-remaining checkpoints at which a warning fires once per alert.
 *
 * <p>Thresholds are ordered by ascending urgency, i.e. strictly descending percentages such as
 * {@code [50, 25, 10]}. Each must lie in {@code 1..100}.
 */
public record NotificationPolicy(boolean enabled, List<Integer> thresholds) {

  public NotificationPolicy {
    if (thresholds == null) {
      throw new ThresholdConfigurationException("notification thresholds are missing");
    }
    for (int i = 0; i < thresholds.size(); i++) {
      Integer current = thresholds.get(i);
      if (current == null || current < 1 || current > 100) {
        throw new ThresholdConfigurationException(
            "notification threshold must be within 1..100 but was " + current);
      }
      if (i > 0 && thresholds.get(i - 1) <= current) {
        throw new ThresholdConfigurationException(
            "notification thresholds must be strictly descending: " + thresholds);
      }
    }
    thresholds = List.copyOf(thresholds);
  }

  public static NotificationPolicy of(Integer... thresholds) {
    return new NotificationPolicy(true, List.of(thresholds));
  }

  public static NotificationPolicy defaults() {
    return of(50, 25, 10);
  }

  public static NotificationPolicy disabled() {
    return new NotificationPolicy(false, List.of());
  }
}
