package triage.escalation.core.domain.event;

import java.time.Instant;

/**
 * Outbound event emitted by the escalation engine.
 *
 * <p>Events are produced while the engine holds its lock and handed to the publisher after the
 * lock is released. Delivery failures never roll back engine state.
 */
public interface EscalationEvent {

  String alertId();

  Instant occurredAt();

  EscalationEventType type();

  /** One-line human-readable description for log and page channels. */
  String summary();
}
