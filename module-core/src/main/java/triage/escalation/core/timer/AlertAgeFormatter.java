package triage.escalation.core.timer;

import java.time.Duration;
import java.time.Instant;

/** Compact alert age: whole days, else whole hours, else whole minutes ("3d", "2h", "5m"). */
public final class AlertAgeFormatter {

  private AlertAgeFormatter() {}

  public static String format(Instant createdAt, Instant now) {
    Duration age = Duration.between(createdAt, now);
    if (age.isNegative()) {
      return "0m";
    }
    long days = age.toDays();
    if (days > 0) {
      return days + "d";
    }
    long hours = age.toHours();
    if (hours > 0) {
      return hours + "h";
    }
    return age.toMinutes() + "m";
  }
}
