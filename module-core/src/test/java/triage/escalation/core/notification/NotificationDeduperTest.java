package triage.escalation.core.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import triage.escalation.core.domain.model.NotificationClass;
import triage.escalation.error.exception.ThresholdConfigurationException;

@Tag("unit")
@DisplayName("NotificationDeduper")
class NotificationDeduperTest {

  private final NotificationPolicy policy = NotificationPolicy.of(50, 25, 10);

  @Test
  @DisplayName("nothing fires while above every checkpoint")
  void aboveAllCheckpoints() {
    assertThat(NotificationDeduper.shouldNotify(75.0, Set.of(), policy)).isEmpty();
  }

  @Test
  @DisplayName("the 50% checkpoint fires as WARNING")
  void halfFiresWarning() {
    assertThat(NotificationDeduper.shouldNotify(50.0, Set.of(), policy))
        .contains(new NotificationDecision(50, NotificationClass.WARNING));
  }

  @Test
  @DisplayName("an already fired checkpoint is skipped")
  void firedIsSkipped() {
    assertThat(NotificationDeduper.shouldNotify(40.0, Set.of(50), policy)).isEmpty();
    assertThat(NotificationDeduper.shouldNotify(20.0, Set.of(50), policy))
        .contains(new NotificationDecision(25, NotificationClass.CRITICAL));
  }

  @Test
  @DisplayName("a jump past several checkpoints returns the least urgent unfired one")
  void jumpReturnsFirstInOrder() {
    assertThat(NotificationDeduper.shouldNotify(5.0, Set.of(), policy))
        .map(NotificationDecision::threshold)
        .contains(50);
  }

  @Test
  @DisplayName("all fired yields nothing")
  void allFired() {
    assertThat(NotificationDeduper.shouldNotify(0.0, Set.of(50, 25, 10), policy)).isEmpty();
  }

  @Test
  @DisplayName("disabled policy never fires")
  void disabled() {
    assertThat(NotificationDeduper.shouldNotify(0.0, Set.of(), NotificationPolicy.disabled()))
        .isEmpty();
  }

  @Test
  @DisplayName("checkpoints above 50 classify as INFO")
  void infoClassification() {
    assertThat(NotificationDeduper.shouldNotify(70.0, Set.of(), NotificationPolicy.of(75, 50)))
        .contains(new NotificationDecision(75, NotificationClass.INFO));
  }

  @Nested
  @DisplayName("policy validation")
  class PolicyValidation {

    @Test
    @DisplayName("ascending checkpoints are rejected")
    void ascending() {
      assertThatThrownBy(() -> NotificationPolicy.of(25, 50))
          .isInstanceOf(ThresholdConfigurationException.class)
          .hasMessageContaining("strictly descending");
    }

    @Test
    @DisplayName("duplicate checkpoints are rejected")
    void duplicates() {
      assertThatThrownBy(() -> NotificationPolicy.of(50, 50))
          .isInstanceOf(ThresholdConfigurationException.class);
    }

    @Test
    @DisplayName("checkpoints outside 1..100 are rejected")
    void outOfRange() {
      assertThatThrownBy(() -> NotificationPolicy.of(150, 50))
          .isInstanceOf(ThresholdConfigurationException.class);
      assertThatThrownBy(() -> NotificationPolicy.of(50, 0))
          .isInstanceOf(ThresholdConfigurationException.class);
    }

    @Test
    @DisplayName("an empty checkpoint list is allowed and never fires")
    void emptyList() {
      NotificationPolicy empty = new NotificationPolicy(true, List.of());

      assertThat(NotificationDeduper.shouldNotify(0.0, Set.of(), empty)).isEmpty();
    }
  }

  @Test
  @DisplayName("record only grows")
  void recordIsMonotonic() {
    NotificationRecord record = new NotificationRecord();

    assertThat(record.record(50)).isTrue();
    assertThat(record.record(50)).isFalse();
    record.record(25);

    assertThat(record.fired()).containsExactly(50, 25);
    assertThat(record.hasFired(25)).isTrue();
    assertThatThrownBy(() -> record.fired().remove(50))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
