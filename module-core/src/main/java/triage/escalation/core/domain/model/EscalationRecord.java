package triage.escalation.core.domain.model;

import java.time.Instant;

/**
 * One entry of an alert's escalation history.
 *
 * @param fromTier responder tier before the step, {@code 0} when the alert was not yet escalated
 * @param toTier responder tier after the step
 */
public record EscalationRecord(
    String alertId,
    AlertStatus fromStatus,
    EscalationReason reason,
    String actorId,
    Instant at,
    int fromTier,
    int toTier) {}
