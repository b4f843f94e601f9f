package triage.escalation.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.engine.EscalationSettings;
import triage.escalation.core.notification.NotificationPolicy;
import triage.escalation.core.ranking.EscalationThresholds;
import triage.escalation.core.ranking.EscalationTiers;

/**
 * Escalation engine settings.
 *
 * <pre>
 * escalation:
 *   threshold-minutes:
 *     critical: 15
 *     high: 30
 *     medium: 60
 *     low: 120
 *   notify-at: [50, 25, 10]
 *   notifications-enabled: true
 *   max-visible: 10
 *   auto-escalate-on-overdue: true
 *   resolved-retention: 1000
 *   tick-interval-millis: 2000
 *   tier-timeout-minutes: [15, 30]
 * </pre>
 *
 * <p>Cross-field rules (threshold ordering, checkpoint ordering) are enforced by {@link
 * #toSettings()}, which throws {@code ThresholdConfigurationException}.
 */
@Validated
@ConfigurationProperties(prefix = "escalation")
public record EscalationProperties(
    @Valid @DefaultValue ThresholdMinutes thresholdMinutes,
    @NotNull @DefaultValue({"50", "25", "10"}) List<Integer> notifyAt,
    @DefaultValue("true") boolean notificationsEnabled,
    @DefaultValue("10") @Min(0) int maxVisible,
    @DefaultValue("true") boolean autoEscalateOnOverdue,
    @DefaultValue("1000") @Min(0) int resolvedRetention,
    @DefaultValue("2000") @Min(100) long tickIntervalMillis,
    @NotNull @DefaultValue({"15", "30"}) List<Integer> tierTimeoutMinutes) {

  /** Response time per priority, in minutes. */
  public record ThresholdMinutes(
      @DefaultValue("15") @Min(1) int critical,
      @DefaultValue("30") @Min(1) int high,
      @DefaultValue("60") @Min(1) int medium,
      @DefaultValue("120") @Min(1) int low) {

    Map<AlertPriority, Integer> asMap() {
      Map<AlertPriority, Integer> map = new EnumMap<>(AlertPriority.class);
      map.put(AlertPriority.CRITICAL, critical);
      map.put(AlertPriority.HIGH, high);
      map.put(AlertPriority.MEDIUM, medium);
      map.put(AlertPriority.LOW, low);
      return map;
    }
  }

  public static EscalationProperties defaults() {
    return new EscalationProperties(
        new ThresholdMinutes(15, 30, 60, 120),
        List.of(50, 25, 10),
        true,
        10,
        true,
        1000,
        2000,
        List.of(15, 30));
  }

  public EscalationSettings toSettings() {
    return new EscalationSettings(
        new EscalationThresholds(thresholdMinutes.asMap()),
        new NotificationPolicy(notificationsEnabled, notifyAt),
        maxVisible,
        autoEscalateOnOverdue,
        resolvedRetention,
        new EscalationTiers(tierTimeoutMinutes));
  }
}
