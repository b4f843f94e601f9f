package triage.escalation.infrastructure.event.strategy;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.infrastructure.event.channel.EventChannel;

/**
 * Routes events to channels by {@link EventRoute}.
 *
 * <p>A route without a provider falls back to the {@link EventRoute#LOG} provider, which is
 * mandatory.
 */
public class StatelessEventChannelStrategy implements EventChannelStrategy {

  private final Map<EventRoute, Supplier<EventChannel>> channelProviders;

  public StatelessEventChannelStrategy(Map<EventRoute, Supplier<EventChannel>> channelProviders) {
    if (!channelProviders.containsKey(EventRoute.LOG)) {
      throw new IllegalArgumentException("a LOG route channel is required");
    }
    this.channelProviders = new EnumMap<>(channelProviders);
  }

  @Override
  public EventChannel getChannel(EscalationEvent event) {
    return channelProviders
        .getOrDefault(EventRoute.of(event), channelProviders.get(EventRoute.LOG))
        .get();
  }
}
