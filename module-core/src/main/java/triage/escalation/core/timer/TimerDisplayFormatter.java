package triage.escalation.core.timer;

/**
 * Countdown text for a running escalation timer.
 *
 * <ul>
 *   <li>{@code >= 3600s}: {@code "1h 5m"}
 *   <li>under one minute: {@code "42s"}
 *   <li>otherwise: {@code "12:05"}
 * </ul>
 */
public final class TimerDisplayFormatter {

  public static final String OVERDUE = "OVERDUE";

  private TimerDisplayFormatter() {}

  /**
   * @param remainingSeconds seconds until the deadline; zero or less renders {@link #OVERDUE}
   */
  public static String format(long remainingSeconds) {
    if (remainingSeconds <= 0) {
      return OVERDUE;
    }
    if (remainingSeconds >= 3600) {
      long hours = remainingSeconds / 3600;
      long minutes = (remainingSeconds % 3600) / 60;
      return String.format("%dh %dm", hours, minutes);
    }
    long minutes = remainingSeconds / 60;
    long seconds = remainingSeconds % 60;
    if (minutes == 0) {
      return seconds + "s";
    }
    return String.format("%d:%02d", minutes, seconds);
  }
}
