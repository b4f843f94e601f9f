package triage.escalation.error.exception.base;

import triage.escalation.error.ErrorCode;

/**
 * ClientBaseException: the request conflicts with the current state or is malformed. The caller
 * can recover by correcting the request; no incident log is needed.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // e.g. "Alert not found (id: %s)"
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
