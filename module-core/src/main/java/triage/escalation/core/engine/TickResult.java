package triage.escalation.core.engine;

import java.time.Instant;
import java.util.List;
import triage.escalation.core.domain.event.EscalationEvent;

/**
 * Outcome of one engine tick.
 *
 * @param evaluated open alerts whose timers were checked
 * @param tierSteps responder tier steps taken by escalated alerts
 */
public record TickResult(
    Instant at,
    int evaluated,
    int notifications,
    int newlyOverdue,
    int autoEscalated,
    int tierSteps,
    List<EscalationEvent> events) {

  public TickResult {
    events = List.copyOf(events);
  }

  public boolean hasEvents() {
    return !events.isEmpty();
  }
}
