package triage.escalation.core.domain.model;

import java.time.Instant;

/**
 * Derived escalation timer snapshot. Never persisted; recomputed from the alert and the clock.
 *
 * @param remainingSeconds signed seconds until the deadline, negative once overdue
 * @param thresholdSeconds configured response time for the alert's priority
 * @param percentageRemaining remaining share of the response time, clamped to [0, 100]
 * @param severityBand coarse urgency band
 * @param display operator-facing countdown text
 * @param deadline {@code createdAt + threshold}
 */
public record TimerState(
    long remainingSeconds,
    long thresholdSeconds,
    double percentageRemaining,
    SeverityBand severityBand,
    String display,
    Instant deadline) {

  public boolean isOverdue() {
    return severityBand == SeverityBand.OVERDUE;
  }

  /** Seconds past the deadline, 0 while the alert is still within its response time. */
  public long overdueSeconds() {
    return remainingSeconds < 0 ? -remainingSeconds : 0L;
  }
}
