package triage.escalation.infrastructure.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.infrastructure.event.channel.EventChannel;
import triage.escalation.infrastructure.event.channel.FallbackSupport;
import triage.escalation.infrastructure.event.channel.InMemoryEventBuffer;
import triage.escalation.infrastructure.event.strategy.EventRoute;
import triage.escalation.infrastructure.event.strategy.StatelessEventChannelStrategy;
import triage.escalation.infrastructure.executor.DefaultLogicExecutor;
import triage.escalation.infrastructure.executor.LogicExecutor;

@Tag("unit")
@DisplayName("AsyncEscalationEventPublisher")
class AsyncEscalationEventPublisherTest {

  private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

  private SimpleMeterRegistry meterRegistry;
  private LogicExecutor executor;
  private AsyncEscalationEventPublisher publisher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  @AfterEach
  void tearDown() {
    if (publisher != null) {
      publisher.shutdown(Duration.ofSeconds(2));
    }
  }

  private static EscalationEvent overdue(String id) {
    return new OverdueEvent(id, AlertPriority.CRITICAL, 5, NOW);
  }

  private AsyncEscalationEventPublisher publisherFor(EventChannel channel, int capacity) {
    StatelessEventChannelStrategy strategy =
        new StatelessEventChannelStrategy(Map.of(EventRoute.LOG, () -> channel));
    return new AsyncEscalationEventPublisher(strategy, executor, meterRegistry, capacity);
  }

  private double count(String name) {
    return meterRegistry.get("escalation.events." + name).counter().count();
  }

  @Test
  @DisplayName("delivers published events on the background thread")
  void delivers() {
    RecordingChannel channel = new RecordingChannel(true);
    publisher = publisherFor(channel, 16);
    publisher.start();

    publisher.publishAll(List.of(overdue("a-1"), overdue("a-2")));

    await().atMost(Duration.ofSeconds(5)).until(() -> channel.received.size() == 2);
    assertThat(channel.received).containsExactly("a-1", "a-2");
    assertThat(count("published")).isEqualTo(2);
    await().atMost(Duration.ofSeconds(5)).until(() -> count("delivered") == 2);
  }

  @Test
  @DisplayName("start is idempotent")
  void startTwice() {
    publisher = publisherFor(new RecordingChannel(true), 4);

    publisher.start();
    publisher.start();

    assertThat(publisher.isRunning()).isTrue();
  }

  @Test
  @DisplayName("drops events when the queue is full")
  void dropsWhenFull() {
    publisher = publisherFor(new RecordingChannel(true), 2);

    publisher.publish(overdue("a-1"));
    publisher.publish(overdue("a-2"));
    publisher.publish(overdue("a-3"));

    assertThat(publisher.pending()).isEqualTo(2);
    assertThat(count("published")).isEqualTo(2);
    assertThat(count("dropped")).isEqualTo(1);
  }

  @Test
  @DisplayName("a failing channel hands the event to its fallback")
  void usesFallback() {
    FailingChannel primary = new FailingChannel();
    InMemoryEventBuffer buffer = new InMemoryEventBuffer(10);
    primary.setFallback(buffer);
    publisher = publisherFor(primary, 4);

    publisher.deliver(overdue("a-1"));

    assertThat(buffer.peekAll()).extracting(EscalationEvent::alertId).containsExactly("a-1");
    assertThat(count("buffered")).isEqualTo(1);
    assertThat(count("delivered")).isZero();
    assertThat(count("failed")).isZero();
  }

  @Test
  @DisplayName("counts a failure when no channel delivers")
  void countsFailure() {
    publisher = publisherFor(new FailingChannel(), 4);

    publisher.deliver(overdue("a-1"));

    assertThat(count("failed")).isEqualTo(1);
  }

  @Test
  @DisplayName("a throwing channel counts as a failed delivery")
  void throwingChannel() {
    EventChannel throwing =
        new EventChannel() {
          @Override
          public boolean send(EscalationEvent event) {
            throw new IllegalStateException("broken");
          }

          @Override
          public String getChannelName() {
            return "broken";
          }
        };
    publisher = publisherFor(throwing, 4);

    publisher.deliver(overdue("a-1"));

    assertThat(count("failed")).isEqualTo(1);
  }

  @Test
  @DisplayName("shutdown drains queued events and rejects new ones")
  void shutdownDrains() {
    RecordingChannel channel = new RecordingChannel(true);
    publisher = publisherFor(channel, 64);
    for (int i = 0; i < 20; i++) {
      publisher.publish(overdue("a-" + i));
    }
    publisher.start();

    boolean drained = publisher.shutdown(Duration.ofSeconds(5));

    assertThat(drained).isTrue();
    assertThat(channel.received).hasSize(20);
    assertThat(publisher.isRunning()).isFalse();

    publisher.publish(overdue("late"));
    assertThat(publisher.pending()).isZero();
    assertThat(count("dropped")).isEqualTo(1);
  }

  @Test
  @DisplayName("every event counted as published is handled when shutdown races publishers")
  void shutdownRacingPublishers() throws InterruptedException {
    RecordingChannel channel = new RecordingChannel(true);
    publisher = publisherFor(channel, 1024);
    publisher.start();
    AtomicBoolean stop = new AtomicBoolean();
    AtomicInteger sequence = new AtomicInteger();
    Thread producer =
        new Thread(
            () -> {
              while (!stop.get()) {
                publisher.publish(overdue("a-" + sequence.incrementAndGet()));
              }
            });
    producer.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> count("published") > 100);

    publisher.shutdown(Duration.ofSeconds(5));
    stop.set(true);
    producer.join(5000);

    assertThat(publisher.pending()).isZero();
    assertThat(count("delivered")).isEqualTo(count("published"));
    assertThat((double) channel.received.size()).isEqualTo(count("published"));
    assertThat(count("published") + count("dropped")).isEqualTo(sequence.get());
  }

  @Test
  @DisplayName("shutdown without a started worker reports undelivered events")
  void shutdownWithoutStart() {
    publisher = publisherFor(new RecordingChannel(true), 4);
    publisher.publish(overdue("a-1"));

    assertThat(publisher.shutdown(Duration.ofMillis(100))).isFalse();
  }

  @Test
  @DisplayName("capacity must be positive")
  void capacityValidated() {
    assertThatThrownBy(() -> publisherFor(new RecordingChannel(true), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static final class RecordingChannel implements EventChannel {

    private final List<String> received = new CopyOnWriteArrayList<>();
    private final boolean accept;

    private RecordingChannel(boolean accept) {
      this.accept = accept;
    }

    @Override
    public boolean send(EscalationEvent event) {
      received.add(event.alertId());
      return accept;
    }

    @Override
    public String getChannelName() {
      return "recording";
    }
  }

  private static final class FailingChannel implements EventChannel, FallbackSupport {

    private EventChannel fallback;

    @Override
    public boolean send(EscalationEvent event) {
      return false;
    }

    @Override
    public String getChannelName() {
      return "failing";
    }

    @Override
    public void setFallback(EventChannel fallback) {
      this.fallback = fallback;
    }

    @Override
    public EventChannel getFallback() {
      return fallback;
    }
  }
}
