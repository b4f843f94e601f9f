package triage.escalation.infrastructure.event.channel;

/** Channel that hands events to a secondary channel when its own delivery fails. */
public interface FallbackSupport extends EventChannel {

  void setFallback(EventChannel fallback);

  /** Secondary channel, or {@code null} when none is configured. */
  EventChannel getFallback();
}
