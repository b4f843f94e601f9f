package triage.escalation.core.domain.event;

import java.time.Instant;
import triage.escalation.core.domain.model.AlertPriority;

/** The alert passed its response deadline. Emitted once per alert. */
public record OverdueEvent(
    String alertId, AlertPriority priority, long overdueSeconds, Instant occurredAt)
    implements EscalationEvent {

  @Override
  public EscalationEventType type() {
    return EscalationEventType.OVERDUE;
  }

  @Override
  public String summary() {
    return String.format(
        "%s alert %s is overdue by %ds", priority, alertId, overdueSeconds);
  }
}
