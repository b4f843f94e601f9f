package triage.escalation.core.notification;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fired thresholds of one alert. Grows only; the owner discards the whole record when the alert
 * leaves the open statuses.
 *
 * <p>Not thread-safe. The engine guards it together with the queue.
 */
public final class NotificationRecord {

  private final Set<Integer> fired = new TreeSet<>(Collections.reverseOrder());

  /** @return {@code true} if the threshold was not recorded before */
  public boolean record(int threshold) {
    return fired.add(threshold);
  }

  public boolean hasFired(int threshold) {
    return fired.contains(threshold);
  }

  public Set<Integer> fired() {
    return Collections.unmodifiableSet(fired);
  }

  public int size() {
    return fired.size();
  }
}
