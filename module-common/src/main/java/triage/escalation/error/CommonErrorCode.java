package triage.escalation.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error code catalogue.
 *
 * <ul>
 *   <li>{@code Cxxx}: caller errors, recoverable by correcting the request
 *   <li>{@code Sxxx}: system errors, logged with full detail
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors ===
  INVALID_INPUT_VALUE("C001", "Invalid input: %s"),
  ALERT_NOT_FOUND("C002", "Alert not found (id: %s)"),
  INVALID_TRANSITION("C003", "Action %s is not allowed for alert %s in status %s"),
  DUPLICATE_ALERT("C004", "Alert is already tracked (id: %s)"),

  // === Server Errors ===
  INTERNAL_SERVER_ERROR("S001", "Internal error while executing %s"),
  THRESHOLD_CONFIGURATION_INVALID("S002", "Escalation configuration is invalid: %s"),
  EVENT_DELIVERY_FAILURE("S003", "Event delivery failed (channel: %s)");

  private final String code;
  private final String message;
}
