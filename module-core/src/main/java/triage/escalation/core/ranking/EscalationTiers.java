package triage.escalation.core.ranking;

import java.util.List;
import triage.escalation.error.exception.ThresholdConfigurationException;

/**
 * Responder tiers an escalated alert climbs while nobody acknowledges it.
 *
 * <p>Entry {@code i} is how long, in minutes, an alert stays at tier {@code i + 1} before it moves
 * up one tier. An escalated alert starts at tier 1, so the top tier is {@code size + 1}. An empty
 * list keeps every escalated alert at tier 1.
 */
public record EscalationTiers(List<Integer> timeoutMinutes) {

  public EscalationTiers {
    if (timeoutMinutes == null) {
      throw new ThresholdConfigurationException("tier timeouts are missing");
    }
    for (int i = 0; i < timeoutMinutes.size(); i++) {
      Integer value = timeoutMinutes.get(i);
      if (value == null || value <= 0) {
        throw new ThresholdConfigurationException(
            "timeout for tier " + (i + 1) + " must be positive but was " + value);
      }
    }
    timeoutMinutes = List.copyOf(timeoutMinutes);
  }

  public static EscalationTiers of(Integer... timeoutMinutes) {
    return new EscalationTiers(List.of(timeoutMinutes));
  }

  /** Three tiers: 15 minutes at tier 1, 30 minutes at tier 2. */
  public static EscalationTiers defaults() {
    return of(15, 30);
  }

  public static EscalationTiers none() {
    return new EscalationTiers(List.of());
  }

  public int maxTier() {
    return timeoutMinutes.size() + 1;
  }

  /** Minutes spent at {@code tier} before the next step; only defined below {@link #maxTier()}. */
  public int timeoutMinutesAt(int tier) {
    if (tier < 1 || tier >= maxTier()) {
      throw new IllegalArgumentException("no timeout for tier " + tier);
    }
    return timeoutMinutes.get(tier - 1);
  }
}
