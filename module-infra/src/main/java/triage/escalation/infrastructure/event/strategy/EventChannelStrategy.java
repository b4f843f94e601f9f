package triage.escalation.infrastructure.event.strategy;

import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.infrastructure.event.channel.EventChannel;

/** Picks the primary channel for an event. */
public interface EventChannelStrategy {

  EventChannel getChannel(EscalationEvent event);
}
