package triage.escalation.core.notification;

import triage.escalation.core.domain.model.NotificationClass;

/** A threshold that should fire now, with its classification. */
public record NotificationDecision(int threshold, NotificationClass classification) {

  public static NotificationDecision of(int threshold) {
    return new NotificationDecision(threshold, NotificationClass.of(threshold));
  }
}
