package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ClientBaseException;

public class AlertNotFoundException extends ClientBaseException {

  public AlertNotFoundException(String alertId) {
    super(CommonErrorCode.ALERT_NOT_FOUND, alertId);
  }
}
