package triage.escalation.lifecycle;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import triage.escalation.infrastructure.config.EventDeliveryProperties;
import triage.escalation.infrastructure.event.AsyncEscalationEventPublisher;
import triage.escalation.infrastructure.event.channel.InMemoryEventBuffer;
import triage.escalation.infrastructure.event.channel.LoggingEventChannel;
import triage.escalation.infrastructure.executor.LogicExecutor;
import triage.escalation.infrastructure.executor.TaskContext;
import triage.escalation.scheduler.EscalationTickScheduler;

/**
 * Graceful shutdown of event delivery.
 *
 * <h3>Order</h3>
 *
 * <ol>
 *   <li>stop the tick scheduler from starting new ticks
 *   <li>close the publisher and wait up to {@code escalation.events.drain-timeout-seconds} for
 *       queued events to reach a channel
 *   <li>replay events held by the in-memory fallback buffer into the log channel
 * </ol>
 *
 * <p>Phase {@code Integer.MAX_VALUE}: stopped before every other lifecycle bean, while the
 * channels are still usable.
 */
@Slf4j
@Component
public class EventDrainOnShutdown implements SmartLifecycle {

  private final AsyncEscalationEventPublisher publisher;
  private final InMemoryEventBuffer fallbackBuffer;
  private final LoggingEventChannel loggingChannel;
  private final ObjectProvider<EscalationTickScheduler> tickScheduler;
  private final LogicExecutor executor;
  private final EventDeliveryProperties properties;
  private final Timer drainTimer;

  private volatile boolean running = false;

  public EventDrainOnShutdown(
      AsyncEscalationEventPublisher publisher,
      InMemoryEventBuffer fallbackBuffer,
      LoggingEventChannel loggingChannel,
      ObjectProvider<EscalationTickScheduler> tickScheduler,
      LogicExecutor executor,
      EventDeliveryProperties properties,
      MeterRegistry meterRegistry) {
    this.publisher = publisher;
    this.fallbackBuffer = fallbackBuffer;
    this.loggingChannel = loggingChannel;
    this.tickScheduler = tickScheduler;
    this.executor = executor;
    this.properties = properties;
    this.drainTimer =
        Timer.builder("shutdown.events.drain.duration")
            .description("Time spent draining escalation events on shutdown")
            .register(meterRegistry);
  }

  @Override
  public void start() {
    this.running = true;
    log.debug("[EventDrain] Started");
  }

  @Override
  public void stop() {
    long startNanos = System.nanoTime();
    tickScheduler.ifAvailable(EscalationTickScheduler::stopAccepting);

    Duration timeout = Duration.ofSeconds(properties.drainTimeoutSeconds());
    int pending = publisher.pending();
    boolean drained =
        executor.executeOrDefault(
            () -> publisher.shutdown(timeout),
            false,
            TaskContext.of("EventDrain", "Shutdown", String.valueOf(pending)));
    replayBuffered();

    drainTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    this.running = false;
    if (drained) {
      log.info("[EventDrain] Delivered {} pending events before shutdown", pending);
    } else {
      log.warn(
          "[EventDrain] {} events still pending after {}s",
          publisher.pending(),
          timeout.toSeconds());
    }
  }

  private void replayBuffered() {
    int buffered = fallbackBuffer.getBufferSize();
    if (buffered == 0) {
      return;
    }
    int replayed =
        executor.executeOrDefault(
            () -> fallbackBuffer.drainTo(loggingChannel),
            0,
            TaskContext.of("EventDrain", "ReplayBuffer", String.valueOf(buffered)));
    log.warn("[EventDrain] Replayed {} of {} buffered events to the log", replayed, buffered);
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE;
  }

  @Override
  public boolean isAutoStartup() {
    return true;
  }
}
