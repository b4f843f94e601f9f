package triage.escalation.core.domain.model;

/**
 * Query result: the alert with its timer and age at the moment of the query.
 *
 * @param age compact age text such as "5m", "2h" or "3d"
 */
public record AlertView(Alert alert, TimerState timer, String age) {

  public String id() {
    return alert.id();
  }

  public boolean isOverdue() {
    return timer.isOverdue();
  }
}
