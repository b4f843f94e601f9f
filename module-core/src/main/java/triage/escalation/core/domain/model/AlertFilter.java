package triage.escalation.core.domain.model;

import java.time.Instant;
import java.util.Set;

/**
 * Optional criteria for listing alerts. An empty set or a {@code null} bound matches everything.
 *
 * @param createdFrom inclusive lower bound on {@code createdAt}
 * @param createdTo exclusive upper bound on {@code createdAt}
 */
public record AlertFilter(
    Set<AlertPriority> priorities,
    Set<AlertStatus> statuses,
    String assignee,
    Instant createdFrom,
    Instant createdTo) {

  public AlertFilter {
    priorities = priorities == null ? Set.of() : Set.copyOf(priorities);
    statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
  }

  public static AlertFilter all() {
    return new AlertFilter(Set.of(), Set.of(), null, null, null);
  }

  public static AlertFilter byPriority(AlertPriority... priorities) {
    return new AlertFilter(Set.of(priorities), Set.of(), null, null, null);
  }

  public static AlertFilter byStatus(AlertStatus... statuses) {
    return new AlertFilter(Set.of(), Set.of(statuses), null, null, null);
  }

  public AlertFilter withAssignee(String assignee) {
    return new AlertFilter(priorities, statuses, assignee, createdFrom, createdTo);
  }

  public AlertFilter createdBetween(Instant from, Instant to) {
    return new AlertFilter(priorities, statuses, assignee, from, to);
  }

  public boolean matches(Alert alert) {
    if (!priorities.isEmpty() && !priorities.contains(alert.priority())) {
      return false;
    }
    if (!statuses.isEmpty() && !statuses.contains(alert.status())) {
      return false;
    }
    if (assignee != null && !alert.assignedTo().contains(assignee)) {
      return false;
    }
    if (createdFrom != null && alert.createdAt().isBefore(createdFrom)) {
      return false;
    }
    return createdTo == null || alert.createdAt().isBefore(createdTo);
  }
}
