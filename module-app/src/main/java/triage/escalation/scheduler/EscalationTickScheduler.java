package triage.escalation.scheduler;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import triage.escalation.core.engine.EscalationEngine;
import triage.escalation.core.engine.TickResult;
import triage.escalation.infrastructure.executor.LogicExecutor;
import triage.escalation.infrastructure.executor.TaskContext;

/**
 * Drives the escalation engine clock.
 *
 * <p>{@code fixedDelay}: the next tick starts {@code escalation.tick-interval-millis} after the
 * previous one finished, so ticks never overlap. A failed tick is logged by the executor and the
 * next one runs as usual.
 *
 * <p>Disable with {@code scheduler.escalation.enabled=false} (tests drive the engine directly).
 */
@Slf4j
@Component
@ConditionalOnProperty(
    name = "scheduler.escalation.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EscalationTickScheduler {

  private final EscalationEngine engine;
  private final LogicExecutor executor;
  private final Clock clock;
  private final Timer tickTimer;

  private volatile boolean accepting = true;

  public EscalationTickScheduler(
      EscalationEngine engine, LogicExecutor executor, Clock clock, MeterRegistry meterRegistry) {
    this.engine = engine;
    this.executor = executor;
    this.clock = clock;
    this.tickTimer =
        Timer.builder("escalation.tick")
            .description("Escalation tick duration")
            .register(meterRegistry);
  }

  @Scheduled(fixedDelayString = "${escalation.tick-interval-millis:2000}")
  public void tick() {
    if (!accepting) {
      return;
    }
    executor.executeVoid(
        () -> tickTimer.record(this::runTick), TaskContext.of("Scheduler", "Escalation.tick"));
  }

  private void runTick() {
    TickResult result = engine.tick(clock.instant());
    if (result.hasEvents()) {
      log.info(
          "[EscalationTick] evaluated={}, notifications={}, overdue={}, autoEscalated={},"
              + " tierSteps={}",
          result.evaluated(),
          result.notifications(),
          result.newlyOverdue(),
          result.autoEscalated(),
          result.tierSteps());
    } else {
      log.debug("[EscalationTick] evaluated={}, no events", result.evaluated());
    }
  }

  /** Skip every tick from now on. Called once shutdown begins. */
  public void stopAccepting() {
    accepting = false;
    log.info("[EscalationTick] Stopped accepting ticks");
  }

  public boolean isAccepting() {
    return accepting;
  }
}
