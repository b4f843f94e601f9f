package triage.escalation.core.port.out;

import java.util.List;
import triage.escalation.core.domain.event.EscalationEvent;

/**
 * Port for handing engine events to delivery channels.
 *
 * <p>Implemented by module-infra. Implementations must not block the caller for long: the engine
 * calls this right after releasing its lock, on the tick thread or the request thread.
 */
public interface EscalationEventPublisher {

  /** Discards every event. Used when no delivery is configured and in tests. */
  EscalationEventPublisher NO_OP = event -> {};

  void publish(EscalationEvent event);

  default void publishAll(List<? extends EscalationEvent> events) {
    for (EscalationEvent event : events) {
      publish(event);
    }
  }
}
