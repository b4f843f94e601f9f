package triage.escalation.core.notification;

import java.util.Optional;
import java.util.Set;

/**
 * Picks the next notification threshold to fire, at most one per call.
 *
 * <p>Checkpoints are scanned in policy order and the first one that has been reached and not yet
 * fired wins. Nothing is recorded here; the caller records the returned threshold and asks
 * again when an alert may have passed several checkpoints at once.
 */
public final class NotificationDeduper {

  private NotificationDeduper() {}

  public static Optional<NotificationDecision> shouldNotify(
      double percentageRemaining, Set<Integer> firedSet, NotificationPolicy policy) {
    if (!policy.enabled()) {
      return Optional.empty();
    }
    for (int threshold : policy.thresholds()) {
      if (percentageRemaining <= threshold && !firedSet.contains(threshold)) {
        return Optional.of(NotificationDecision.of(threshold));
      }
    }
    return Optional.empty();
  }
}
