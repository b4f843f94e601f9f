package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ServerBaseException;

/**
 * Wraps an unmanaged exception raised inside an executor task.
 *
 * <p>The task name is kept in the message so the failing component can be found in the logs.
 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
