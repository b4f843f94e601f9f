package triage.escalation.core.queue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.core.ranking.PriorityRanking;
import triage.escalation.error.exception.DuplicateAlertException;

/**
 * Alerts kept sorted by {@link PriorityRanking#QUEUE_ORDER}, split into a visible head and a
 * queued tail.
 *
 * <p>Insertion uses an upper-bound binary search, so alerts with equal ordering keys stay in
 * insertion order. Lookup by id goes through a side index.
 *
 * <p>Not thread-safe. Callers serialise access.
 */
public class AlertQueue {

  private final List<Alert> ordered = new ArrayList<>();
  private final Map<String, Alert> index = new HashMap<>();

  /** @throws DuplicateAlertException if an alert with the same id is already queued */
  public void add(Alert alert) {
    if (index.containsKey(alert.id())) {
      throw new DuplicateAlertException(alert.id());
    }
    insertSorted(alert);
  }

  /** Idempotent; returns the removed alert when it was present. */
  public Optional<Alert> remove(String id) {
    Alert removed = index.remove(id);
    if (removed == null) {
      return Optional.empty();
    }
    ordered.remove(positionOf(removed));
    return Optional.of(removed);
  }

  public Optional<Alert> get(String id) {
    return Optional.ofNullable(index.get(id));
  }

  public boolean contains(String id) {
    return index.containsKey(id);
  }

  /** First {@code n} alerts in queue order. */
  public List<Alert> visible(int n) {
    requireNonNegative(n);
    return List.copyOf(ordered.subList(0, Math.min(n, ordered.size())));
  }

  /** Everything after the first {@code n} alerts. */
  public List<Alert> queued(int n) {
    requireNonNegative(n);
    if (n >= ordered.size()) {
      return List.of();
    }
    return List.copyOf(ordered.subList(n, ordered.size()));
  }

  /**
   * Move an alert to the position its new status sorts to.
   *
   * @return the updated alert, or empty if the id is unknown
   */
  public Optional<Alert> reprioritize(String id, AlertStatus newStatus) {
    Alert current = index.get(id);
    if (current == null) {
      return Optional.empty();
    }
    Alert updated =
        new Alert(
            current.id(),
            current.priority(),
            newStatus,
            current.createdAt(),
            current.acknowledgedAt(),
            current.resolvedAt(),
            current.assignedTo(),
            current.metadata());
    replace(updated);
    return Optional.of(updated);
  }

  /**
   * Swap in an updated copy of a queued alert. Unknown ids are added.
   *
   * <p>An alert whose ordering key is unchanged keeps its slot, so its place among equal keys is
   * not lost. Otherwise it is re-sorted to the end of its new run.
   */
  public void replace(Alert updated) {
    Alert previous = index.get(updated.id());
    if (previous != null && PriorityRanking.QUEUE_ORDER.compare(previous, updated) == 0) {
      ordered.set(positionOf(previous), updated);
      index.put(updated.id(), updated);
      return;
    }
    if (previous != null) {
      index.remove(updated.id());
      ordered.remove(positionOf(previous));
    }
    insertSorted(updated);
  }

  public int size() {
    return ordered.size();
  }

  public boolean isEmpty() {
    return ordered.isEmpty();
  }

  /** Full queue in order. */
  public List<Alert> snapshot() {
    return Collections.unmodifiableList(new ArrayList<>(ordered));
  }

  private void insertSorted(Alert alert) {
    ordered.add(upperBound(alert), alert);
    index.put(alert.id(), alert);
  }

  private int upperBound(Alert alert) {
    int low = 0;
    int high = ordered.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (PriorityRanking.QUEUE_ORDER.compare(ordered.get(mid), alert) <= 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  // Equal keys form a run; scan it for the exact instance.
  private int positionOf(Alert alert) {
    int end = upperBound(alert);
    for (int i = end - 1; i >= 0; i--) {
      Alert candidate = ordered.get(i);
      if (candidate.id().equals(alert.id())) {
        return i;
      }
      if (PriorityRanking.QUEUE_ORDER.compare(candidate, alert) != 0) {
        break;
      }
    }
    throw new IllegalStateException("queue index out of sync for alert " + alert.id());
  }

  private static void requireNonNegative(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("capacity must not be negative: " + n);
    }
  }
}
