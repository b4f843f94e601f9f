package triage.escalation.error.exception.base;

import triage.escalation.error.ErrorCode;

/**
 * ServerBaseException: configuration faults and infrastructure failures. Logged with the cause so
 * the incident can be traced afterwards.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
