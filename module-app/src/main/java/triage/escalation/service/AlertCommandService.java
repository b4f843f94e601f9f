package triage.escalation.service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import triage.escalation.core.domain.model.ActionRequest;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.engine.EscalationEngine;
import triage.escalation.infrastructure.executor.LogicExecutor;
import triage.escalation.infrastructure.executor.TaskContext;

/**
 * Inbound commands against the escalation engine.
 *
 * <p>Every command is stamped with the injected {@link Clock} and runs through the {@link
 * LogicExecutor}. Domain rejections ({@code InvalidTransitionException}, {@code
 * AlertNotFoundException}, ...) reach the caller unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertCommandService {

  private final EscalationEngine engine;
  private final LogicExecutor executor;
  private final Clock clock;

  public Alert createAlert(AlertPriority priority, Map<String, String> metadata) {
    Alert alert =
        executor.execute(
            () -> engine.createAlert(priority, metadata, clock.instant()),
            TaskContext.of("AlertCommand", "create", String.valueOf(priority)));
    log.info("[AlertCommand] Created {} alert {}", priority, alert.id());
    return alert;
  }

  public Alert createAlert(AlertPriority priority) {
    return createAlert(priority, Map.of());
  }

  public Alert submit(Alert alert) {
    executor.executeVoid(
        () -> engine.submit(alert), TaskContext.of("AlertCommand", "submit", alert.id()));
    log.info("[AlertCommand] Submitted {} alert {}", alert.priority(), alert.id());
    return alert;
  }

  public Alert applyAction(String alertId, AlertAction action, String actorId) {
    return apply(ActionRequest.of(alertId, action, actorId));
  }

  public Alert reassign(String alertId, String actorId, List<String> assignees) {
    return apply(ActionRequest.reassign(alertId, actorId, assignees));
  }

  private Alert apply(ActionRequest request) {
    return executor.execute(
        () -> engine.applyAction(request, clock.instant()),
        TaskContext.of("AlertCommand", request.action().name(), request.alertId()));
  }

  /** Drop an alert from the working set. Unknown ids are ignored. */
  public Optional<Alert> remove(String alertId) {
    Optional<Alert> removed =
        executor.execute(
            () -> engine.remove(alertId), TaskContext.of("AlertCommand", "remove", alertId));
    removed.ifPresent(alert -> log.info("[AlertCommand] Removed alert {}", alert.id()));
    return removed;
  }
}
