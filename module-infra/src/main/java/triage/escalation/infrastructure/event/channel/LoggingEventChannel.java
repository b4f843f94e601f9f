package triage.escalation.infrastructure.event.channel;

import lombok.extern.slf4j.Slf4j;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.domain.event.NotifyEvent;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.event.TierEscalatedEvent;
import triage.escalation.core.domain.model.NotificationClass;

/**
 * Writes events to the application log. Never fails.
 *
 * <p>Overdue events and CRITICAL notifications go out at WARN, the rest at INFO.
 */
@Slf4j
public class LoggingEventChannel implements EventChannel {

  @Override
  public boolean send(EscalationEvent event) {
    if (isUrgent(event)) {
      log.warn("[EscalationEvent] {} {}", event.type(), event.summary());
    } else {
      log.info("[EscalationEvent] {} {}", event.type(), event.summary());
    }
    return true;
  }

  @Override
  public String getChannelName() {
    return "log";
  }

  private static boolean isUrgent(EscalationEvent event) {
    if (event instanceof OverdueEvent || event instanceof TierEscalatedEvent) {
      return true;
    }
    return event instanceof NotifyEvent notify
        && notify.classification() == NotificationClass.CRITICAL;
  }
}
