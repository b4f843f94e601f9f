package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
