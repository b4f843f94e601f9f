package triage.escalation.core.domain.event;

import java.time.Instant;
import triage.escalation.core.domain.model.AlertPriority;

/** An escalated alert went unacknowledged long enough to move up to the next responder tier. */
public record TierEscalatedEvent(
    String alertId, AlertPriority priority, int fromTier, int toTier, Instant occurredAt)
    implements EscalationEvent {

  @Override
  public EscalationEventType type() {
    return EscalationEventType.TIER_ESCALATED;
  }

  @Override
  public String summary() {
    return String.format(
        "%s alert %s escalated from tier %d to tier %d", priority, alertId, fromTier, toTier);
  }
}
