package triage.escalation.core.domain.event;

import java.time.Instant;
import java.util.List;

/** Responders of an acknowledged alert were replaced. */
public record AssignmentEvent(
    String alertId, List<String> assignees, String actorId, Instant occurredAt)
    implements EscalationEvent {

  public AssignmentEvent {
    assignees = List.copyOf(assignees);
  }

  @Override
  public EscalationEventType type() {
    return EscalationEventType.ASSIGNMENT;
  }

  @Override
  public String summary() {
    return String.format("alert %s reassigned to %s by %s", alertId, assignees, actorId);
  }
}
