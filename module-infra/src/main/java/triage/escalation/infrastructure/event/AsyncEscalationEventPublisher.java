package triage.escalation.infrastructure.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.port.out.EscalationEventPublisher;
import triage.escalation.infrastructure.event.channel.EventChannel;
import triage.escalation.infrastructure.event.channel.FallbackSupport;
import triage.escalation.infrastructure.event.strategy.EventChannelStrategy;
import triage.escalation.infrastructure.executor.LogicExecutor;
import triage.escalation.infrastructure.executor.TaskContext;

/**
 * Non-blocking publisher: a bounded queue in front of a single delivery thread.
 *
 * <h3>Back-pressure</h3>
 *
 * <ul>
 *   <li>{@link #publish} never blocks. When the queue is full the event is dropped, counted and
 *       logged at WARN.
 *   <li>The delivery thread asks the strategy for a channel and, if the channel fails and has a
 *       fallback, tries the fallback once.
 * </ul>
 *
 * <h3>Metrics</h3>
 *
 * <ul>
 *   <li>{@code escalation.events.published} accepted into the queue
 *   <li>{@code escalation.events.dropped} rejected because the queue was full or closed
 *   <li>{@code escalation.events.delivered} sent by the channel the strategy picked
 *   <li>{@code escalation.events.buffered} accepted only by that channel's fallback
 *   <li>{@code escalation.events.failed} sent by neither
 * </ul>
 *
 * <p>An event offered while {@link #shutdown} runs is taken back out of the queue and counted as
 * dropped, so nothing is counted as published after the delivery thread stopped.
 */
@Slf4j
public class AsyncEscalationEventPublisher implements EscalationEventPublisher {

  private static final long POLL_MILLIS = 100;

  private final EventChannelStrategy strategy;
  private final LogicExecutor executor;
  private final BlockingQueue<EscalationEvent> queue;
  private final Counter publishedCounter;
  private final Counter droppedCounter;
  private final Counter deliveredCounter;
  private final Counter bufferedCounter;
  private final Counter failedCounter;

  private volatile boolean accepting = true;
  private volatile boolean running = false;
  private Thread worker;

  public AsyncEscalationEventPublisher(
      EventChannelStrategy strategy,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("event buffer capacity must be positive: " + capacity);
    }
    this.strategy = strategy;
    this.executor = executor;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.publishedCounter = counter(meterRegistry, "published", "Events accepted for delivery");
    this.droppedCounter = counter(meterRegistry, "dropped", "Events dropped before delivery");
    this.deliveredCounter = counter(meterRegistry, "delivered", "Events delivered to a channel");
    this.bufferedCounter =
        counter(meterRegistry, "buffered", "Events held by a fallback channel");
    this.failedCounter = counter(meterRegistry, "failed", "Events no channel could deliver");
  }

  private static Counter counter(MeterRegistry registry, String suffix, String description) {
    return Counter.builder("escalation.events." + suffix)
        .description(description)
        .register(registry);
  }

  /** Start the delivery thread. Idempotent. */
  public synchronized void start() {
    if (worker != null) {
      return;
    }
    running = true;
    worker = new Thread(this::deliveryLoop, "escalation-events");
    worker.setDaemon(true);
    worker.start();
    log.info("[EventPublisher] Started with capacity={}", queue.remainingCapacity());
  }

  @Override
  public void publish(EscalationEvent event) {
    if (!accepting) {
      droppedCounter.increment();
      log.warn(
          "[EventPublisher] Shutting down, dropping event: type={}, alertId={}",
          event.type(),
          event.alertId());
      return;
    }
    if (queue.offer(event)) {
      if (!accepting && queue.remove(event)) {
        droppedCounter.increment();
        log.warn(
            "[EventPublisher] Closed during publish, dropping event: type={}, alertId={}",
            event.type(),
            event.alertId());
        return;
      }
      publishedCounter.increment();
      return;
    }
    droppedCounter.increment();
    log.warn(
        "[EventPublisher] Queue full, dropping event: type={}, alertId={}",
        event.type(),
        event.alertId());
  }

  /** Events waiting for the delivery thread. */
  public int pending() {
    return queue.size();
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Stop accepting events and wait for the queue to drain.
   *
   * @return {@code true} if every queued event was handled within {@code timeout}
   */
  public boolean shutdown(Duration timeout) {
    accepting = false;
    running = false;
    Thread current;
    synchronized (this) {
      current = worker;
    }
    if (current == null) {
      return queue.isEmpty();
    }
    try {
      current.join(timeout.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[EventPublisher] Interrupted while draining, pending={}", queue.size());
      return false;
    }
    boolean drained = !current.isAlive() && queue.isEmpty();
    if (drained) {
      log.info("[EventPublisher] Drained and stopped");
    } else {
      log.warn("[EventPublisher] Drain timed out after {}, pending={}", timeout, queue.size());
    }
    return drained;
  }

  private void deliveryLoop() {
    while (running || !queue.isEmpty()) {
      EscalationEvent event;
      try {
        event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("[EventPublisher] Delivery thread interrupted, pending={}", queue.size());
        return;
      }
      if (event != null) {
        deliver(event);
      }
    }
  }

  void deliver(EscalationEvent event) {
    EventChannel channel = strategy.getChannel(event);
    if (sendVia(channel, event)) {
      deliveredCounter.increment();
      return;
    }
    boolean sent = false;
    if (channel instanceof FallbackSupport withFallback) {
      EventChannel fallback = withFallback.getFallback();
      if (fallback != null) {
        log.warn(
            "[EventPublisher] {} failed, trying {}: alertId={}",
            channel.getChannelName(),
            fallback.getChannelName(),
            event.alertId());
        sent = sendVia(fallback, event);
      }
    }
    if (sent) {
      bufferedCounter.increment();
    } else {
      failedCounter.increment();
      log.warn(
          "[EventPublisher] Event not delivered: type={}, alertId={}",
          event.type(),
          event.alertId());
    }
  }

  private boolean sendVia(EventChannel channel, EscalationEvent event) {
    return executor.executeOrDefault(
        () -> channel.send(event),
        false,
        TaskContext.of("EventPublisher", "deliver", channel.getChannelName()));
  }
}
