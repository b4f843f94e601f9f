package triage.escalation.core.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Operator command against a single alert.
 *
 * @param assignees new responder ids, only read for {@link AlertAction#REASSIGN}
 */
public record ActionRequest(
    String alertId, AlertAction action, String actorId, List<String> assignees) {

  public ActionRequest {
    Objects.requireNonNull(alertId, "alertId cannot be null");
    Objects.requireNonNull(action, "action cannot be null");
    Objects.requireNonNull(actorId, "actorId cannot be null");
    assignees = assignees == null ? List.of() : List.copyOf(assignees);
  }

  public static ActionRequest of(String alertId, AlertAction action, String actorId) {
    return new ActionRequest(alertId, action, actorId, List.of());
  }

  public static ActionRequest reassign(String alertId, String actorId, List<String> assignees) {
    return new ActionRequest(alertId, AlertAction.REASSIGN, actorId, assignees);
  }
}
