package triage.escalation.core.domain.model;

/**
 * Operator actions governed by the alert lifecycle.
 *
 * <p>Which actions are legal for a given alert is decided by {@code AlertLifecycle} only.
 */
public enum AlertAction {
  ACKNOWLEDGE(false),
  ESCALATE(true),
  DISMISS(true),
  RESOLVE(false),
  REASSIGN(false),
  /** Clears the alert from the urgent worklist without changing its status. */
  ACKNOWLEDGE_OVERDUE(false);

  private final boolean requiresConfirmation;

  AlertAction(boolean requiresConfirmation) {
    this.requiresConfirmation = requiresConfirmation;
  }

  /** The caller must confirm these actions with the operator before submitting them. */
  public boolean requiresConfirmation() {
    return requiresConfirmation;
  }
}
