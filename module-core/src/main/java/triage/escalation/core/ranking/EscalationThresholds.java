package triage.escalation.core.ranking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.error.exception.ThresholdConfigurationException;

/**
 * Response-time thresholds per priority, in minutes.
 *
 * <p>Validated on construction: all four priorities present, all positive, and strictly
 * {@code critical < high < medium < low}.
 */
public record EscalationThresholds(Map<AlertPriority, Integer> minutes) {

  private static final AlertPriority[] MOST_URGENT_FIRST = {
    AlertPriority.CRITICAL, AlertPriority.HIGH, AlertPriority.MEDIUM, AlertPriority.LOW
  };

  public EscalationThresholds {
    if (minutes == null) {
      throw new ThresholdConfigurationException("threshold map is missing");
    }
    EnumMap<AlertPriority, Integer> copy = new EnumMap<>(AlertPriority.class);
    for (AlertPriority priority : AlertPriority.values()) {
      Integer value = minutes.get(priority);
      if (value == null) {
        throw new ThresholdConfigurationException("no threshold for " + priority);
      }
      if (value <= 0) {
        throw new ThresholdConfigurationException(
            "threshold for " + priority + " must be positive but was " + value);
      }
      copy.put(priority, value);
    }
    for (int i = 1; i < MOST_URGENT_FIRST.length; i++) {
      AlertPriority tighter = MOST_URGENT_FIRST[i - 1];
      AlertPriority looser = MOST_URGENT_FIRST[i];
      if (copy.get(tighter) >= copy.get(looser)) {
        throw new ThresholdConfigurationException(
            String.format(
                "%s threshold (%d min) must be shorter than %s threshold (%d min)",
                tighter, copy.get(tighter), looser, copy.get(looser)));
      }
    }
    minutes = Collections.unmodifiableMap(copy);
  }

  public static EscalationThresholds of(int critical, int high, int medium, int low) {
    Map<AlertPriority, Integer> map = new EnumMap<>(AlertPriority.class);
    map.put(AlertPriority.CRITICAL, critical);
    map.put(AlertPriority.HIGH, high);
    map.put(AlertPriority.MEDIUM, medium);
    map.put(AlertPriority.LOW, low);
    return new EscalationThresholds(map);
  }

  /** 15 / 30 / 60 / 120 minutes. */
  public static EscalationThresholds defaults() {
    return of(15, 30, 60, 120);
  }

  public int minutesFor(AlertPriority priority) {
    return minutes.get(priority);
  }
}
