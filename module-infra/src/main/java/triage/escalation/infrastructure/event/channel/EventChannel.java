package triage.escalation.infrastructure.event.channel;

import triage.escalation.core.domain.event.EscalationEvent;

/**
 * Delivery target for escalation events.
 *
 * <p>Implementations must be thread-safe and must not throw for ordinary delivery failures; they
 * report them through the return value.
 */
public interface EventChannel {

  /** @return {@code true} if the event was delivered */
  boolean send(EscalationEvent event);

  /** Channel identifier for logs and metrics, e.g. "log", "local-file", "in-memory". */
  String getChannelName();
}
