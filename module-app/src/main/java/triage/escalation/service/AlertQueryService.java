package triage.escalation.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertFilter;
import triage.escalation.core.domain.model.AlertView;
import triage.escalation.core.domain.model.EscalationRecord;
import triage.escalation.core.engine.EscalationEngine;

/**
 * Read side of the engine. Timers are evaluated at the injected clock's current instant; queries
 * never fire notifications.
 */
@Service
@RequiredArgsConstructor
public class AlertQueryService {

  private final EscalationEngine engine;
  private final Clock clock;

  public List<AlertView> getVisible() {
    return engine.getVisible(clock.instant());
  }

  public List<AlertView> getVisible(int maxVisible) {
    return engine.getVisible(maxVisible, clock.instant());
  }

  public List<AlertView> getQueued() {
    return engine.getQueued(clock.instant());
  }

  public List<AlertView> getQueued(int maxVisible) {
    return engine.getQueued(maxVisible, clock.instant());
  }

  public Optional<AlertView> find(String alertId) {
    return engine.find(alertId, clock.instant());
  }

  /** Overdue alerts nobody has acknowledged yet, in the order they became overdue. */
  public List<AlertView> urgentWorklist() {
    return engine.urgentWorklist(clock.instant());
  }

  public Set<AlertAction> availableActions(String alertId) {
    return engine.availableActions(alertId, clock.instant());
  }

  public List<EscalationRecord> history(String alertId) {
    return engine.escalationHistory(alertId);
  }

  /** Responder tier the alert has reached; {@code 0} if it was never escalated. */
  public int escalationTier(String alertId) {
    return engine.escalationTier(alertId);
  }

  public Optional<Instant> nextTierStepAt(String alertId) {
    return engine.nextTierStepAt(alertId);
  }

  public List<AlertView> filter(AlertFilter filter) {
    return engine.filter(filter, clock.instant());
  }

  public Set<Integer> firedThresholds(String alertId) {
    return engine.firedThresholds(alertId);
  }

  public int size() {
    return engine.size();
  }
}
