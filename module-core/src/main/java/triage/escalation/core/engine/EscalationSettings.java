package triage.escalation.core.engine;

import java.util.Objects;
import triage.escalation.core.notification.NotificationPolicy;
import triage.escalation.core.ranking.EscalationThresholds;
import triage.escalation.core.ranking.EscalationTiers;
import triage.escalation.error.exception.ThresholdConfigurationException;

/**
 * Engine configuration, validated once at construction.
 *
 * @param maxVisible capacity of the visible head of the queue
 * @param autoEscalateOnOverdue escalate PENDING alerts automatically once overdue
 * @param resolvedRetention how many recently resolved alerts are remembered so later actions on
 *     them are rejected as invalid transitions rather than unknown ids
 * @param tiers responder tiers an unacknowledged escalated alert climbs
 */
public record EscalationSettings(
    EscalationThresholds thresholds,
    NotificationPolicy notificationPolicy,
    int maxVisible,
    boolean autoEscalateOnOverdue,
    int resolvedRetention,
    EscalationTiers tiers) {

  public EscalationSettings {
    Objects.requireNonNull(thresholds, "thresholds cannot be null");
    Objects.requireNonNull(notificationPolicy, "notificationPolicy cannot be null");
    Objects.requireNonNull(tiers, "tiers cannot be null");
    if (maxVisible < 0) {
      throw new ThresholdConfigurationException("maxVisible must not be negative: " + maxVisible);
    }
    if (resolvedRetention < 0) {
      throw new ThresholdConfigurationException(
          "resolvedRetention must not be negative: " + resolvedRetention);
    }
  }

  public EscalationSettings(
      EscalationThresholds thresholds,
      NotificationPolicy notificationPolicy,
      int maxVisible,
      boolean autoEscalateOnOverdue,
      int resolvedRetention) {
    this(
        thresholds,
        notificationPolicy,
        maxVisible,
        autoEscalateOnOverdue,
        resolvedRetention,
        EscalationTiers.defaults());
  }

  public static EscalationSettings defaults() {
    return new EscalationSettings(
        EscalationThresholds.defaults(), NotificationPolicy.defaults(), 10, true, 1000);
  }

  public EscalationSettings withNotificationPolicy(NotificationPolicy policy) {
    return new EscalationSettings(
        thresholds, policy, maxVisible, autoEscalateOnOverdue, resolvedRetention, tiers);
  }

  public EscalationSettings withMaxVisible(int capacity) {
    return new EscalationSettings(
        thresholds, notificationPolicy, capacity, autoEscalateOnOverdue, resolvedRetention, tiers);
  }

  public EscalationSettings withAutoEscalateOnOverdue(boolean enabled) {
    return new EscalationSettings(
        thresholds, notificationPolicy, maxVisible, enabled, resolvedRetention, tiers);
  }

  public EscalationSettings withTiers(EscalationTiers escalationTiers) {
    return new EscalationSettings(
        thresholds,
        notificationPolicy,
        maxVisible,
        autoEscalateOnOverdue,
        resolvedRetention,
        escalationTiers);
  }
}
