package triage.escalation.core.domain.event;

import java.time.Instant;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.NotificationClass;
import triage.escalation.core.domain.model.TimerState;

/** A notification checkpoint was reached for the first time. */
public record NotifyEvent(
    String alertId,
    AlertPriority priority,
    int threshold,
    NotificationClass classification,
    TimerState timer,
    Instant occurredAt)
    implements EscalationEvent {

  @Override
  public EscalationEventType type() {
    return EscalationEventType.NOTIFY;
  }

  @Override
  public String summary() {
    return String.format(
        "%s alert %s has %d%% of its response time left (%s)",
        priority, alertId, threshold, timer.display());
  }
}
