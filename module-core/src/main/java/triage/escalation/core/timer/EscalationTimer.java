package triage.escalation.core.timer;

import java.time.Duration;
import java.time.Instant;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.SeverityBand;
import triage.escalation.core.domain.model.TimerState;

/**
 * Escalation countdown for one alert.
 *
 * <p>Pure function of {@code (alert, thresholdMinutes, now)}; no clock is read here.
 *
 * <h3>Banding</h3>
 *
 * <ul>
 *   <li>remaining {@code <= 0}: OVERDUE, percentage 0, display {@code "OVERDUE"}
 *   <li>percentage {@code <= 25}: CRITICAL
 *   <li>percentage {@code <= 50}: WARNING
 *   <li>otherwise NORMAL
 * </ul>
 */
public final class EscalationTimer {

  private static final double CRITICAL_PERCENT = 25.0;
  private static final double WARNING_PERCENT = 50.0;

  private EscalationTimer() {}

  public static TimerState compute(Alert alert, int thresholdMinutes, Instant now) {
    if (thresholdMinutes <= 0) {
      throw new IllegalArgumentException("thresholdMinutes must be positive: " + thresholdMinutes);
    }
    Duration threshold = Duration.ofMinutes(thresholdMinutes);
    Instant deadline = alert.createdAt().plus(threshold);
    Duration remaining = Duration.between(now, deadline);
    long remainingSeconds = remaining.getSeconds();
    long thresholdSeconds = threshold.getSeconds();

    if (remaining.isZero() || remaining.isNegative()) {
      return new TimerState(
          remainingSeconds,
          thresholdSeconds,
          0.0,
          SeverityBand.OVERDUE,
          TimerDisplayFormatter.OVERDUE,
          deadline);
    }

    double percentage = clamp(remaining.toMillis() * 100.0 / threshold.toMillis());
    return new TimerState(
        remainingSeconds,
        thresholdSeconds,
        percentage,
        bandOf(percentage),
        TimerDisplayFormatter.format(Math.max(remainingSeconds, 1)),
        deadline);
  }

  static SeverityBand bandOf(double percentage) {
    if (percentage <= CRITICAL_PERCENT) {
      return SeverityBand.CRITICAL;
    }
    if (percentage <= WARNING_PERCENT) {
      return SeverityBand.WARNING;
    }
    return SeverityBand.NORMAL;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(100.0, value));
  }
}
