package triage.escalation.infrastructure.event.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import triage.escalation.core.domain.event.AssignmentEvent;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.domain.event.NotifyEvent;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.event.StatusChangedEvent;
import triage.escalation.core.domain.event.TierEscalatedEvent;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.core.domain.model.NotificationClass;
import triage.escalation.core.domain.model.SeverityBand;
import triage.escalation.core.domain.model.TimerState;
import triage.escalation.infrastructure.event.channel.EventChannel;
import triage.escalation.infrastructure.event.channel.InMemoryEventBuffer;
import triage.escalation.infrastructure.event.channel.LoggingEventChannel;

@Tag("unit")
@DisplayName("StatelessEventChannelStrategy")
class StatelessEventChannelStrategyTest {

  private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

  private final LoggingEventChannel logChannel = new LoggingEventChannel();
  private final InMemoryEventBuffer pageChannel = new InMemoryEventBuffer(10);

  private static NotifyEvent notify(int threshold) {
    TimerState timer =
        new TimerState(90, 900, 10.0, SeverityBand.CRITICAL, "1:30", NOW.plusSeconds(90));
    return new NotifyEvent(
        "a-1", AlertPriority.CRITICAL, threshold, NotificationClass.of(threshold), timer, NOW);
  }

  private static StatusChangedEvent changedTo(AlertStatus to) {
    return new StatusChangedEvent(
        "a-1", AlertStatus.PENDING, to, AlertAction.ACKNOWLEDGE, "u", NOW);
  }

  @Test
  @DisplayName("urgent events take the PAGE route")
  void pageRoute() {
    assertThat(EventRoute.of(new OverdueEvent("a-1", AlertPriority.LOW, 1, NOW)))
        .isEqualTo(EventRoute.PAGE);
    assertThat(EventRoute.of(notify(10))).isEqualTo(EventRoute.PAGE);
    assertThat(EventRoute.of(changedTo(AlertStatus.ESCALATED))).isEqualTo(EventRoute.PAGE);
    assertThat(EventRoute.of(new TierEscalatedEvent("a-1", AlertPriority.HIGH, 1, 2, NOW)))
        .isEqualTo(EventRoute.PAGE);
  }

  @Test
  @DisplayName("informational events take the LOG route")
  void logRoute() {
    assertThat(EventRoute.of(notify(50))).isEqualTo(EventRoute.LOG);
    assertThat(EventRoute.of(changedTo(AlertStatus.ACKNOWLEDGED))).isEqualTo(EventRoute.LOG);
    assertThat(EventRoute.of(new AssignmentEvent("a-1", List.of("bob"), "u", NOW)))
        .isEqualTo(EventRoute.LOG);
  }

  @Test
  @DisplayName("routes to the configured channel")
  void routes() {
    StatelessEventChannelStrategy strategy =
        new StatelessEventChannelStrategy(
            Map.of(EventRoute.LOG, () -> logChannel, EventRoute.PAGE, () -> pageChannel));

    assertThat(strategy.getChannel(notify(10))).isSameAs(pageChannel);
    assertThat(strategy.getChannel(notify(50))).isSameAs(logChannel);
  }

  @Test
  @DisplayName("missing routes fall back to the LOG channel")
  void fallsBackToLog() {
    Map<EventRoute, Supplier<EventChannel>> providers = Map.of(EventRoute.LOG, () -> logChannel);
    StatelessEventChannelStrategy strategy = new StatelessEventChannelStrategy(providers);

    EscalationEvent overdue = new OverdueEvent("a-1", AlertPriority.HIGH, 1, NOW);
    assertThat(strategy.getChannel(overdue)).isSameAs(logChannel);
  }

  @Test
  @DisplayName("a LOG route is mandatory")
  void logRouteRequired() {
    assertThatThrownBy(
            () -> new StatelessEventChannelStrategy(Map.of(EventRoute.PAGE, () -> pageChannel)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
