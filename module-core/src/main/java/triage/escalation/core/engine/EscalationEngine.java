package triage.escalation.core.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import triage.escalation.core.domain.event.AssignmentEvent;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.core.domain.event.NotifyEvent;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.event.StatusChangedEvent;
import triage.escalation.core.domain.event.TierEscalatedEvent;
import triage.escalation.core.domain.model.ActionRequest;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertFilter;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.core.domain.model.AlertView;
import triage.escalation.core.domain.model.EscalationReason;
import triage.escalation.core.domain.model.EscalationRecord;
import triage.escalation.core.domain.model.TimerState;
import triage.escalation.core.lifecycle.AlertLifecycle;
import triage.escalation.core.lifecycle.AlertLifecycle.TransitionContext;
import triage.escalation.core.notification.NotificationDeduper;
import triage.escalation.core.notification.NotificationDecision;
import triage.escalation.core.notification.NotificationRecord;
import triage.escalation.core.port.out.EscalationEventPublisher;
import triage.escalation.core.queue.AlertQueue;
import triage.escalation.core.ranking.EscalationTiers;
import triage.escalation.core.timer.AlertAgeFormatter;
import triage.escalation.core.timer.EscalationTimer;
import triage.escalation.error.exception.AlertNotFoundException;
import triage.escalation.error.exception.DuplicateAlertException;
import triage.escalation.error.exception.InvalidInputException;

/**
 * Owns the alert set and drives timers, notifications and escalation.
 *
 * <h3>Concurrency</h3>
 *
 * <ul>
 *   <li>One read/write lock guards the queue, fired sets, overdue set, worklist, tiers, history
 *       and resolved retention together. A status change and the discard of its fired set are
 *       therefore atomic for readers.
 *   <li>Mutations take the write lock; queries take the read lock and never touch fired state.
 *   <li>Events are collected under the lock and published after it is released.
 * </ul>
 *
 * <h3>Time</h3>
 *
 * <p>Every operation takes {@code now} explicitly. {@link #tick} is idempotent for equal or
 * increasing {@code now}.
 */
@Slf4j
public class EscalationEngine {

  /** Actor recorded for transitions the engine performs itself. */
  public static final String SYSTEM_ACTOR = "system";

  private final EscalationSettings settings;
  private final EscalationEventPublisher publisher;
  private final Supplier<String> idGenerator;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AlertQueue queue = new AlertQueue();
  private final Map<String, NotificationRecord> fired = new HashMap<>();
  private final Set<String> overdueReported = new HashSet<>();
  private final Set<String> urgentWorklist = new LinkedHashSet<>();
  // Overdue acknowledged before or after the tick that reported it.
  private final Set<String> overdueAcknowledged = new HashSet<>();
  private final Map<String, Integer> tiers = new HashMap<>();
  private final Map<String, Instant> nextTierAt = new HashMap<>();
  private final Map<String, List<EscalationRecord>> history = new HashMap<>();
  // Recently resolved alerts, oldest evicted first.
  private final Map<String, Alert> resolved;

  public EscalationEngine(EscalationSettings settings, EscalationEventPublisher publisher) {
    this(settings, publisher, () -> UUID.randomUUID().toString());
  }

  public EscalationEngine(
      EscalationSettings settings,
      EscalationEventPublisher publisher,
      Supplier<String> idGenerator) {
    this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    this.publisher = Objects.requireNonNull(publisher, "publisher cannot be null");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
    int retention = settings.resolvedRetention();
    this.resolved =
        new LinkedHashMap<>() {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Alert> eldest) {
            return size() > retention;
          }
        };
  }

  public EscalationSettings settings() {
    return settings;
  }

  // ==================== Intake ====================

  /** Create and track a new PENDING alert. */
  public Alert createAlert(AlertPriority priority, Map<String, String> metadata, Instant now) {
    Alert alert = Alert.create(idGenerator.get(), priority, now, metadata);
    submit(alert);
    return alert;
  }

  /**
   * Track an alert created elsewhere.
   *
   * @throws DuplicateAlertException if the id is already tracked or recently resolved
   * @throws InvalidInputException if the alert is already resolved
   */
  public void submit(Alert alert) {
    Objects.requireNonNull(alert, "alert cannot be null");
    if (alert.status() == AlertStatus.RESOLVED) {
      throw new InvalidInputException("resolved alert " + alert.id() + " cannot be submitted");
    }
    lock.writeLock().lock();
    try {
      if (resolved.containsKey(alert.id())) {
        throw new DuplicateAlertException(alert.id());
      }
      queue.add(alert);
    } finally {
      lock.writeLock().unlock();
    }
    log.info(
        "[EscalationEngine] Alert tracked: id={}, priority={}, status={}",
        alert.id(),
        alert.priority(),
        alert.status());
  }

  // ==================== Tick ====================

  /**
   * Evaluate every open alert at {@code now}.
   *
   * <ol>
   *   <li>report newly overdue alerts once and put them on the urgent worklist
   *   <li>fire every notification checkpoint reached and not yet fired
   *   <li>escalate PENDING overdue alerts when auto-escalation is enabled
   *   <li>move unacknowledged ESCALATED alerts up one responder tier per elapsed tier timeout
   * </ol>
   *
   * <p>The overdue report stays single-fire while an alert climbs tiers.
   */
  public TickResult tick(Instant now) {
    Objects.requireNonNull(now, "now cannot be null");
    List<EscalationEvent> events = new ArrayList<>();
    int evaluated = 0;
    int notifications = 0;
    int newlyOverdue = 0;
    int autoEscalated = 0;
    int tierSteps = 0;

    lock.writeLock().lock();
    try {
      for (Alert alert : queue.snapshot()) {
        if (!alert.status().isOpen()) {
          continue;
        }
        evaluated++;
        TimerState timer = timerOf(alert, now);

        if (alert.status() == AlertStatus.ESCALATED) {
          tierSteps += advanceTiers(alert, now, events);
        }

        if (timer.isOverdue() && overdueReported.add(alert.id())) {
          if (!overdueAcknowledged.contains(alert.id())) {
            urgentWorklist.add(alert.id());
          }
          events.add(
              new OverdueEvent(alert.id(), alert.priority(), timer.overdueSeconds(), now));
          newlyOverdue++;
          log.warn(
              "[EscalationEngine] Alert overdue: id={}, priority={}, overdueBy={}s",
              alert.id(),
              alert.priority(),
              timer.overdueSeconds());
        }

        notifications += fireNotifications(alert, timer, now, events);

        if (alert.status() == AlertStatus.PENDING
            && timer.isOverdue()
            && settings.autoEscalateOnOverdue()) {
          Alert escalated =
              AlertLifecycle.apply(alert, AlertAction.ESCALATE, TransitionContext.at(now, true));
          queue.replace(escalated);
          enterEscalation(alert, EscalationReason.OVERDUE, SYSTEM_ACTOR, now);
          events.add(
              new StatusChangedEvent(
                  alert.id(),
                  alert.status(),
                  escalated.status(),
                  AlertAction.ESCALATE,
                  SYSTEM_ACTOR,
                  now));
          autoEscalated++;
          log.info("[EscalationEngine] Alert auto-escalated: id={}", alert.id());
        }
      }
    } finally {
      lock.writeLock().unlock();
    }

    publisher.publishAll(events);
    log.debug(
        "[EscalationEngine] Tick complete: at={}, evaluated={}, notifications={}, overdue={},"
            + " escalated={}, tierSteps={}",
        now,
        evaluated,
        notifications,
        newlyOverdue,
        autoEscalated,
        tierSteps);
    return new TickResult(
        now, evaluated, notifications, newlyOverdue, autoEscalated, tierSteps, events);
  }

  private int advanceTiers(Alert alert, Instant now, List<EscalationEvent> events) {
    int steps = 0;
    Instant due;
    while ((due = nextTierAt.get(alert.id())) != null && !now.isBefore(due)) {
      int from = tiers.getOrDefault(alert.id(), 1);
      int to = from + 1;
      tiers.put(alert.id(), to);
      scheduleNextTier(alert.id(), to, due);
      appendHistory(
          alert.id(),
          AlertStatus.ESCALATED,
          EscalationReason.TIER_TIMEOUT,
          SYSTEM_ACTOR,
          now,
          from,
          to);
      events.add(new TierEscalatedEvent(alert.id(), alert.priority(), from, to, now));
      steps++;
      log.warn(
          "[EscalationEngine] Alert moved up a tier: id={}, tier {} -> {}", alert.id(), from, to);
    }
    return steps;
  }

  private int fireNotifications(
      Alert alert, TimerState timer, Instant now, List<EscalationEvent> events) {
    NotificationRecord record = fired.computeIfAbsent(alert.id(), id -> new NotificationRecord());
    int count = 0;
    Optional<NotificationDecision> decision;
    while ((decision =
            NotificationDeduper.shouldNotify(
                timer.percentageRemaining(), record.fired(), settings.notificationPolicy()))
        .isPresent()) {
      NotificationDecision d = decision.get();
      record.record(d.threshold());
      events.add(
          new NotifyEvent(
              alert.id(), alert.priority(), d.threshold(), d.classification(), timer, now));
      count++;
    }
    return count;
  }

  // ==================== Actions ====================

  /**
   * Apply an operator action.
   *
   * @return the alert after the action
   * @throws AlertNotFoundException if the id is neither tracked nor recently resolved
   * @throws triage.escalation.error.exception.InvalidTransitionException if the action is not
   *     available; nothing changes
   */
  public Alert applyAction(ActionRequest request, Instant now) {
    Objects.requireNonNull(request, "request cannot be null");
    Objects.requireNonNull(now, "now cannot be null");
    List<EscalationEvent> events = new ArrayList<>();
    Alert result;

    lock.writeLock().lock();
    try {
      Alert current = queue.get(request.alertId()).orElse(null);
      if (current == null) {
        Alert archived = resolved.get(request.alertId());
        if (archived == null) {
          throw new AlertNotFoundException(request.alertId());
        }
        // Always rejected: a resolved alert has no available actions.
        AlertLifecycle.apply(archived, request.action(), TransitionContext.at(now, false));
        return archived;
      }

      boolean overdue = timerOf(current, now).isOverdue();
      result =
          AlertLifecycle.apply(
              current,
              request.action(),
              new TransitionContext(now, overdue, request.assignees()));
      commit(current, result, request, now, events);
    } finally {
      lock.writeLock().unlock();
    }

    publisher.publishAll(events);
    return result;
  }

  private void commit(
      Alert before, Alert after, ActionRequest request, Instant now, List<EscalationEvent> events) {
    String id = before.id();
    switch (request.action()) {
      case ACKNOWLEDGE_OVERDUE -> {
        overdueAcknowledged.add(id);
        urgentWorklist.remove(id);
        log.info(
            "[EscalationEngine] Overdue alert acknowledged: id={}, actor={}",
            id,
            request.actorId());
        return;
      }
      case REASSIGN -> {
        queue.replace(after);
        events.add(
            new AssignmentEvent(id, List.copyOf(after.assignedTo()), request.actorId(), now));
        log.info(
            "[EscalationEngine] Alert reassigned: id={}, assignees={}, actor={}",
            id,
            after.assignedTo(),
            request.actorId());
        return;
      }
      case ESCALATE -> enterEscalation(before, EscalationReason.MANUAL, request.actorId(), now);
      default -> {
        // status transition only
      }
    }

    if (after.status() == AlertStatus.RESOLVED) {
      queue.remove(id);
      if (settings.resolvedRetention() > 0) {
        resolved.put(id, after);
      }
    } else {
      queue.replace(after);
    }
    if (!after.status().isOpen()) {
      discardOpenState(id);
    }
    events.add(
        new StatusChangedEvent(
            id, before.status(), after.status(), request.action(), request.actorId(), now));
    log.info(
        "[EscalationEngine] Alert transitioned: id={}, {} -> {}, action={}, actor={}",
        id,
        before.status(),
        after.status(),
        request.action(),
        request.actorId());
  }

  /**
   * Drop an alert from the working set. Idempotent.
   *
   * @return the removed alert, if it was tracked
   */
  public Optional<Alert> remove(String alertId) {
    lock.writeLock().lock();
    try {
      Optional<Alert> removed = queue.remove(alertId);
      Alert archived = resolved.remove(alertId);
      discardOpenState(alertId);
      history.remove(alertId);
      tiers.remove(alertId);
      return removed.isPresent() ? removed : Optional.ofNullable(archived);
    } finally {
      lock.writeLock().unlock();
    }
  }

  // ==================== Queries ====================

  public List<AlertView> getVisible(Instant now) {
    return getVisible(settings.maxVisible(), now);
  }

  public List<AlertView> getVisible(int maxVisible, Instant now) {
    lock.readLock().lock();
    try {
      return views(queue.visible(maxVisible), now);
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<AlertView> getQueued(Instant now) {
    return getQueued(settings.maxVisible(), now);
  }

  public List<AlertView> getQueued(int maxVisible, Instant now) {
    lock.readLock().lock();
    try {
      return views(queue.queued(maxVisible), now);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Tracked or recently resolved alert with its timer at {@code now}. */
  public Optional<AlertView> find(String alertId, Instant now) {
    lock.readLock().lock();
    try {
      return lookup(alertId).map(alert -> view(alert, now));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Actions an operator may take on the alert now; empty for unknown ids. */
  public Set<AlertAction> availableActions(String alertId, Instant now) {
    lock.readLock().lock();
    try {
      return lookup(alertId)
          .map(alert -> AlertLifecycle.availableActions(alert, timerOf(alert, now).isOverdue()))
          .orElse(Collections.emptySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Overdue alerts not yet acknowledged as overdue, in the order they became overdue. */
  public List<AlertView> urgentWorklist(Instant now) {
    lock.readLock().lock();
    try {
      List<AlertView> result = new ArrayList<>(urgentWorklist.size());
      for (String id : urgentWorklist) {
        queue.get(id).ifPresent(alert -> result.add(view(alert, now)));
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<EscalationRecord> escalationHistory(String alertId) {
    lock.readLock().lock();
    try {
      return List.copyOf(history.getOrDefault(alertId, List.of()));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Current responder tier; {@code 0} if the alert was never escalated or is unknown. */
  public int escalationTier(String alertId) {
    lock.readLock().lock();
    try {
      return tiers.getOrDefault(alertId, 0);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** When the alert moves up its next tier, if it is escalated and below the top tier. */
  public Optional<Instant> nextTierStepAt(String alertId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(nextTierAt.get(alertId));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Tracked alerts in queue order, then recently resolved ones, that match the filter. */
  public List<AlertView> filter(AlertFilter filter, Instant now) {
    lock.readLock().lock();
    try {
      List<AlertView> result = new ArrayList<>();
      for (Alert alert : queue.snapshot()) {
        if (filter.matches(alert)) {
          result.add(view(alert, now));
        }
      }
      for (Alert alert : resolved.values()) {
        if (filter.matches(alert)) {
          result.add(view(alert, now));
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Set<Integer> firedThresholds(String alertId) {
    lock.readLock().lock();
    try {
      NotificationRecord record = fired.get(alertId);
      return record == null ? Set.of() : Set.copyOf(record.fired());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Number of tracked alerts, resolved ones excluded. */
  public int size() {
    lock.readLock().lock();
    try {
      return queue.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  // ==================== Internals ====================

  /** Timer at {@code now}, or frozen at the instant the alert stopped being open. */
  TimerState timerOf(Alert alert, Instant now) {
    Instant stoppedAt = alert.timerStoppedAt();
    Instant at = stoppedAt != null && stoppedAt.isBefore(now) ? stoppedAt : now;
    return EscalationTimer.compute(alert, settings.thresholds().minutesFor(alert.priority()), at);
  }

  private AlertView view(Alert alert, Instant now) {
    return new AlertView(
        alert, timerOf(alert, now), AlertAgeFormatter.format(alert.createdAt(), now));
  }

  private List<AlertView> views(List<Alert> alerts, Instant now) {
    List<AlertView> result = new ArrayList<>(alerts.size());
    for (Alert alert : alerts) {
      result.add(view(alert, now));
    }
    return result;
  }

  private Optional<Alert> lookup(String alertId) {
    Optional<Alert> tracked = queue.get(alertId);
    return tracked.isPresent() ? tracked : Optional.ofNullable(resolved.get(alertId));
  }

  private void discardOpenState(String alertId) {
    fired.remove(alertId);
    overdueReported.remove(alertId);
    urgentWorklist.remove(alertId);
    overdueAcknowledged.remove(alertId);
    nextTierAt.remove(alertId);
  }

  private void enterEscalation(Alert from, EscalationReason reason, String actorId, Instant at) {
    int fromTier = tiers.getOrDefault(from.id(), 0);
    int toTier = Math.max(fromTier, 1);
    tiers.put(from.id(), toTier);
    scheduleNextTier(from.id(), toTier, at);
    appendHistory(from.id(), from.status(), reason, actorId, at, fromTier, toTier);
  }

  private void scheduleNextTier(String alertId, int tier, Instant enteredAt) {
    EscalationTiers configured = settings.tiers();
    if (tier < configured.maxTier()) {
      nextTierAt.put(
          alertId, enteredAt.plus(Duration.ofMinutes(configured.timeoutMinutesAt(tier))));
    } else {
      nextTierAt.remove(alertId);
    }
  }

  private void appendHistory(
      String alertId,
      AlertStatus fromStatus,
      EscalationReason reason,
      String actorId,
      Instant at,
      int fromTier,
      int toTier) {
    history
        .computeIfAbsent(alertId, id -> new ArrayList<>())
        .add(new EscalationRecord(alertId, fromStatus, reason, actorId, at, fromTier, toTier));
  }
}
