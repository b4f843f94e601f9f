package triage.escalation.core.domain.model;

public enum EscalationReason {
  /** An operator escalated the alert. */
  MANUAL,
  /** The engine escalated the alert after its response deadline passed. */
  OVERDUE,
  /** An escalated alert stayed unacknowledged past its tier timeout. */
  TIER_TIMEOUT
}
