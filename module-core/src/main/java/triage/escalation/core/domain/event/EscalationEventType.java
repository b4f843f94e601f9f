package triage.escalation.core.domain.event;

public enum EscalationEventType {
  NOTIFY,
  OVERDUE,
  STATUS_CHANGED,
  ASSIGNMENT,
  TIER_ESCALATED
}
