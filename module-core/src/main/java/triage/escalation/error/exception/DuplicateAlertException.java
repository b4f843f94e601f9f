package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ClientBaseException;

public class DuplicateAlertException extends ClientBaseException {

  public DuplicateAlertException(String alertId) {
    super(CommonErrorCode.DUPLICATE_ALERT, alertId);
  }
}
