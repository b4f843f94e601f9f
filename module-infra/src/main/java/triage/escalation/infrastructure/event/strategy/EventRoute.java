package triage.escalation.infrastructure.event.strategy;

import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.domain.event.NotifyEvent;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.event.StatusChangedEvent;
import triage.escalation.core.domain.event.TierEscalatedEvent;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.core.domain.model.NotificationClass;

/** Delivery route of an event. */
public enum EventRoute {
  /** Needs a responder now: overdue, CRITICAL notifications, escalations and tier steps. */
  PAGE,
  /** Informational. */
  LOG;

  public static EventRoute of(EscalationEvent event) {
    if (event instanceof OverdueEvent || event instanceof TierEscalatedEvent) {
      return PAGE;
    }
    if (event instanceof NotifyEvent notify) {
      return notify.classification() == NotificationClass.CRITICAL ? PAGE : LOG;
    }
    if (event instanceof StatusChangedEvent changed) {
      return changed.to() == AlertStatus.ESCALATED ? PAGE : LOG;
    }
    return LOG;
  }
}
