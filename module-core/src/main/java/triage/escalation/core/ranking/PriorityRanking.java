package triage.escalation.core.ranking;

import java.util.Comparator;
import triage.escalation.core.domain.model.Alert;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.AlertStatus;

/**
 * Queue ordering: {@code (statusWeight, priorityWeight, createdAt)} ascending.
 *
 * <p>Lower weight sorts first. Escalated alerts lead, then pending, acknowledged, resolved. Within
 * a status, CRITICAL leads LOW. Equal keys keep creation order.
 */
public final class PriorityRanking {

  /** Comparator used by the alert queue. */
  public static final Comparator<Alert> QUEUE_ORDER =
      Comparator.comparingInt((Alert a) -> statusWeight(a.status()))
          .thenComparingInt(a -> priorityWeight(a.priority()))
          .thenComparing(Alert::createdAt);

  private PriorityRanking() {}

  public static int priorityWeight(AlertPriority priority) {
    return switch (priority) {
      case CRITICAL -> 0;
      case HIGH -> 1;
      case MEDIUM -> 2;
      case LOW -> 3;
    };
  }

  public static int statusWeight(AlertStatus status) {
    return switch (status) {
      case ESCALATED -> 0;
      case PENDING -> 1;
      case ACKNOWLEDGED -> 2;
      case RESOLVED -> 3;
    };
  }
}
