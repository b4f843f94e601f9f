package triage.escalation.core.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import triage.escalation.error.exception.ThresholdConfigurationException;

@Tag("unit")
@DisplayName("EscalationTiers")
class EscalationTiersTest {

  @Test
  @DisplayName("defaults give three tiers")
  void defaults() {
    EscalationTiers tiers = EscalationTiers.defaults();

    assertThat(tiers.maxTier()).isEqualTo(3);
    assertThat(tiers.timeoutMinutesAt(1)).isEqualTo(15);
    assertThat(tiers.timeoutMinutesAt(2)).isEqualTo(30);
  }

  @Test
  @DisplayName("the top tier has no timeout")
  void topTierHasNoTimeout() {
    assertThatThrownBy(() -> EscalationTiers.defaults().timeoutMinutesAt(3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(EscalationTiers.none().maxTier()).isEqualTo(1);
  }

  @Test
  @DisplayName("non-positive or missing timeouts are rejected")
  void rejectsInvalid() {
    assertThatThrownBy(() -> EscalationTiers.of(15, 0))
        .isInstanceOf(ThresholdConfigurationException.class)
        .hasMessageContaining("tier 2");
    assertThatThrownBy(() -> new EscalationTiers(Arrays.asList(15, null)))
        .isInstanceOf(ThresholdConfigurationException.class);
    assertThatThrownBy(() -> new EscalationTiers(null))
        .isInstanceOf(ThresholdConfigurationException.class);
  }
}
