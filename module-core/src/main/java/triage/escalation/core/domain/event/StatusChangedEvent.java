package triage.escalation.core.domain.event;

import java.time.Instant;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertStatus;

/** Status transition applied by an operator or by auto-escalation (actor {@code system}). */
public record StatusChangedEvent(
    String alertId,
    AlertStatus from,
    AlertStatus to,
    AlertAction action,
    String actorId,
    Instant occurredAt)
    implements EscalationEvent {

  @Override
  public EscalationEventType type() {
    return EscalationEventType.STATUS_CHANGED;
  }

  @Override
  public String summary() {
    return String.format("alert %s %s -> %s by %s (%s)", alertId, from, to, actorId, action);
  }
}
