package triage.escalation.core.lifecycle;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.error.exception.InvalidInputException;
import triage.escalation.error.exception.InvalidTransitionException;

/**
 * Alert state machine. Strict whitelist: an action is legal only if {@link #availableActions}
 * returns it.
 *
 * <pre>
 * PENDING      --ACKNOWLEDGE--> ACKNOWLEDGED
 * PENDING      --ESCALATE-----> ESCALATED     (HIGH/CRITICAL, or overdue)
 * PENDING      --DISMISS------> RESOLVED
 * ACKNOWLEDGED --RESOLVE------> RESOLVED
 * ACKNOWLEDGED --REASSIGN-----> ACKNOWLEDGED
 * ESCALATED    --ACKNOWLEDGE--> ACKNOWLEDGED
 * </pre>
 *
 * <p>ACKNOWLEDGE_OVERDUE is offered for open overdue alerts and never changes status.
 */
public final class AlertLifecycle {

  private AlertLifecycle() {}

  public static Set<AlertAction> availableActions(
      AlertStatus status, AlertPriority priority, boolean overdue) {
    EnumSet<AlertAction> actions = EnumSet.noneOf(AlertAction.class);
    switch (status) {
      case PENDING -> {
        actions.add(AlertAction.ACKNOWLEDGE);
        actions.add(AlertAction.DISMISS);
        if (priority.isUrgent() || overdue) {
          actions.add(AlertAction.ESCALATE);
        }
      }
      case ACKNOWLEDGED -> {
        actions.add(AlertAction.RESOLVE);
        actions.add(AlertAction.REASSIGN);
      }
      case ESCALATED -> actions.add(AlertAction.ACKNOWLEDGE);
      case RESOLVED -> {
        // terminal
      }
    }
    if (overdue && status.isOpen()) {
      actions.add(AlertAction.ACKNOWLEDGE_OVERDUE);
    }
    return Collections.unmodifiableSet(actions);
  }

  public static Set<AlertAction> availableActions(Alert alert, boolean overdue) {
    return availableActions(alert.status(), alert.priority(), overdue);
  }

  public static boolean isAllowed(Alert alert, AlertAction action, boolean overdue) {
    return availableActions(alert, overdue).contains(action);
  }

  /**
   * Apply a validated action and return the resulting alert.
   *
   * @throws InvalidTransitionException if the action is not available; the alert is untouched
   * @throws InvalidInputException if REASSIGN carries no assignees
   */
  public static Alert apply(Alert alert, AlertAction action, TransitionContext context) {
    Objects.requireNonNull(alert, "alert cannot be null");
    Objects.requireNonNull(action, "action cannot be null");
    Set<AlertAction> available = availableActions(alert, context.overdue());
    if (!available.contains(action)) {
      throw new InvalidTransitionException(alert.id(), alert.status(), action, available);
    }
    return switch (action) {
      case ACKNOWLEDGE -> alert.acknowledge(context.now());
      case ESCALATE -> alert.escalate();
      case DISMISS, RESOLVE -> alert.resolve(context.now());
      case REASSIGN -> {
        if (context.assignees().isEmpty()) {
          throw new InvalidInputException("reassignment of " + alert.id() + " has no assignees");
        }
        yield alert.withAssignees(context.assignees());
      }
      case ACKNOWLEDGE_OVERDUE -> alert;
    };
  }

  /**
   * Inputs a transition may need besides the alert itself.
   *
   * @param overdue whether the alert's timer is overdue at {@code now}
   */
  public record TransitionContext(Instant now, boolean overdue, List<String> assignees) {

    public TransitionContext {
      Objects.requireNonNull(now, "now cannot be null");
      assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    public static TransitionContext at(Instant now, boolean overdue) {
      return new TransitionContext(now, overdue, List.of());
    }
  }
}
