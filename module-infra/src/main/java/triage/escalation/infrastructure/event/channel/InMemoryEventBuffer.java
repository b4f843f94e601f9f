package triage.escalation.infrastructure.event.channel;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;
import triage.escalation.core.domain.event.EscalationEvent;

/**
 * Bounded in-memory holding area for events no other channel could deliver.
 *
 * <p>When the buffer is full new events are dropped with a warning. Buffered events can be
 * replayed into another channel with {@link #drainTo(EventChannel)}.
 */
@Slf4j
public class InMemoryEventBuffer implements EventChannel, FallbackSupport {

  private final BlockingQueue<EscalationEvent> buffer;
  private EventChannel fallback;

  public InMemoryEventBuffer(int capacity) {
    this.buffer = new ArrayBlockingQueue<>(capacity);
  }

  @Override
  public boolean send(EscalationEvent event) {
    boolean offered = buffer.offer(event);
    if (!offered) {
      log.warn(
          "[InMemoryEventBuffer] Buffer full, dropping event: type={}, alertId={}",
          event.type(),
          event.alertId());
    }
    return offered;
  }

  @Override
  public String getChannelName() {
    return "in-memory";
  }

  public int getBufferSize() {
    return buffer.size();
  }

  /** Buffered events, oldest first, without removing them. */
  public List<EscalationEvent> peekAll() {
    return List.copyOf(buffer);
  }

  /**
   * Replay buffered events into {@code targetChannel}. Events the target rejects are dropped.
   *
   * @return number of events the target accepted
   */
  public int drainTo(EventChannel targetChannel) {
    int drained = 0;
    EscalationEvent event;
    while ((event = buffer.poll()) != null) {
      if (targetChannel.send(event)) {
        drained++;
      } else {
        log.warn(
            "[InMemoryEventBuffer] Failed to drain event to {}: alertId={}",
            targetChannel.getChannelName(),
            event.alertId());
      }
    }
    return drained;
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
