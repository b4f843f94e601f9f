package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ServerBaseException;

/**
 * Thrown when an outbound event channel cannot deliver an event.
 *
 * <p><strong>ServerBaseException:</strong> delivery is retried or dropped by the channel's own
 * policy. The engine state that produced the event stays as it is.
 */
public class EventDeliveryException extends ServerBaseException {

  public EventDeliveryException(String channelName) {
    super(CommonErrorCode.EVENT_DELIVERY_FAILURE, channelName);
  }

  public EventDeliveryException(String channelName, Throwable cause) {
    super(CommonErrorCode.EVENT_DELIVERY_FAILURE, cause, channelName);
  }
}
