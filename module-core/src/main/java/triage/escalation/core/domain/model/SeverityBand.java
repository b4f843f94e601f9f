package triage.escalation.core.domain.model;

/** Coarse urgency band derived from the percentage of response time remaining. */
public enum SeverityBand {
  NORMAL,
  WARNING,
  CRITICAL,
  OVERDUE
}
