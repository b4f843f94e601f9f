package triage.escalation.error.exception;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ClientBaseException;

/**
 * Thrown when an action is not in the alert's available-action set.
 *
 * <p>Carries the set that was valid at the moment of rejection so the caller can offer the right
 * choices again.
 */
@Getter
public class InvalidTransitionException extends ClientBaseException {

  private final String alertId;
  private final AlertStatus status;
  private final AlertAction action;
  private final Set<AlertAction> validActions;

  public InvalidTransitionException(
      String alertId, AlertStatus status, AlertAction action, Set<AlertAction> validActions) {
    super(CommonErrorCode.INVALID_TRANSITION, action, alertId, status);
    this.alertId = alertId;
    this.status = status;
    this.action = action;
    this.validActions =
        validActions.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(validActions));
  }
}
