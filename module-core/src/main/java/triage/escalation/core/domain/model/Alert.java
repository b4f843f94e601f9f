package triage.escalation.core.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tracked alert (immutable).
 *
 * <p>Every state change returns a new instance. Transition legality is decided by {@code
 * AlertLifecycle}; the wither methods here only guard the timestamp invariants.
 *
 * <h3>Invariants</h3>
 *
 * <ul>
 *   <li>{@code id}, {@code priority} and {@code createdAt} never change
 *   <li>{@code acknowledgedAt} and {@code resolvedAt} are set exactly once
 *   <li>{@code assignedTo} keeps insertion order and has no duplicates
 * </ul>
 */
public record Alert(
    String id,
    AlertPriority priority,
    AlertStatus status,
    Instant createdAt,
    Instant acknowledgedAt,
    Instant resolvedAt,
    Set<String> assignedTo,
    Map<String, String> metadata) {

  public Alert {
    Objects.requireNonNull(id, "id cannot be null");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id cannot be blank");
    }
    Objects.requireNonNull(priority, "priority cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    Objects.requireNonNull(createdAt, "createdAt cannot be null");
    assignedTo =
        assignedTo == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(assignedTo));
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** New PENDING alert with no assignees. */
  public static Alert create(
      String id, AlertPriority priority, Instant createdAt, Map<String, String> metadata) {
    return new Alert(
        id, priority, AlertStatus.PENDING, createdAt, null, null, Set.of(), metadata);
  }

  public static Alert create(String id, AlertPriority priority, Instant createdAt) {
    return create(id, priority, createdAt, Map.of());
  }

  public Alert acknowledge(Instant at) {
    Objects.requireNonNull(at, "at cannot be null");
    Instant stamp = acknowledgedAt != null ? acknowledgedAt : at;
    return new Alert(
        id, priority, AlertStatus.ACKNOWLEDGED, createdAt, stamp, resolvedAt, assignedTo, metadata);
  }

  public Alert escalate() {
    return new Alert(
        id,
        priority,
        AlertStatus.ESCALATED,
        createdAt,
        acknowledgedAt,
        resolvedAt,
        assignedTo,
        metadata);
  }

  public Alert resolve(Instant at) {
    Objects.requireNonNull(at, "at cannot be null");
    Instant stamp = resolvedAt != null ? resolvedAt : at;
    return new Alert(
        id, priority, AlertStatus.RESOLVED, createdAt, acknowledgedAt, stamp, assignedTo, metadata);
  }

  public Alert withAssignees(Collection<String> assignees) {
    return new Alert(
        id,
        priority,
        status,
        createdAt,
        acknowledgedAt,
        resolvedAt,
        new LinkedHashSet<>(assignees),
        metadata);
  }

  /**
   * Instant at which the escalation timer stopped, or {@code null} while it is still running.
   *
   * <p>Acknowledgment stops the clock. Dismissal of a pending alert stops it at resolution.
   */
  public Instant timerStoppedAt() {
    if (status.isOpen()) {
      return null;
    }
    if (acknowledgedAt != null) {
      return acknowledgedAt;
    }
    return resolvedAt;
  }
}
