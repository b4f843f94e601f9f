package triage.escalation.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("Alert")
class AlertTest {

  private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

  @Test
  @DisplayName("new alert is pending and unassigned")
  void create() {
    Alert alert = Alert.create("a-1", AlertPriority.HIGH, T0, Map.of("room", "ICU-3"));

    assertThat(alert.status()).isEqualTo(AlertStatus.PENDING);
    assertThat(alert.assignedTo()).isEmpty();
    assertThat(alert.metadata()).containsEntry("room", "ICU-3");
    assertThat(alert.timerStoppedAt()).isNull();
  }

  @Test
  @DisplayName("metadata is copied on construction")
  void metadataCopied() {
    Map<String, String> source = new HashMap<>();
    source.put("patient", "p-7");
    Alert alert = Alert.create("a-1", AlertPriority.LOW, T0, source);

    source.put("patient", "changed");

    assertThat(alert.metadata()).containsEntry("patient", "p-7");
  }

  @Test
  @DisplayName("acknowledgedAt is set only once")
  void acknowledgedOnce() {
    Alert acked = Alert.create("a-1", AlertPriority.HIGH, T0).acknowledge(T0.plusSeconds(10));

    Alert again = acked.acknowledge(T0.plusSeconds(99));

    assertThat(again.acknowledgedAt()).isEqualTo(T0.plusSeconds(10));
  }

  @Test
  @DisplayName("resolving an acknowledged alert keeps the acknowledgment as the timer stop")
  void timerStopsAtAcknowledgment() {
    Alert resolved =
        Alert.create("a-1", AlertPriority.HIGH, T0)
            .acknowledge(T0.plusSeconds(10))
            .resolve(T0.plusSeconds(50));

    assertThat(resolved.timerStoppedAt()).isEqualTo(T0.plusSeconds(10));
    assertThat(resolved.resolvedAt()).isEqualTo(T0.plusSeconds(50));
  }

  @Test
  @DisplayName("assignees keep order without duplicates")
  void assigneesOrdered() {
    Alert alert =
        Alert.create("a-1", AlertPriority.HIGH, T0).withAssignees(List.of("b", "a", "b"));

    assertThat(alert.assignedTo()).containsExactly("b", "a");
  }

  @Test
  @DisplayName("blank id is rejected")
  void blankId() {
    assertThatThrownBy(() -> Alert.create(" ", AlertPriority.HIGH, T0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("priority parses case-insensitively")
  void priorityParse() {
    assertThat(AlertPriority.from("critical")).isEqualTo(AlertPriority.CRITICAL);
    assertThat(AlertPriority.HIGH.isUrgent()).isTrue();
    assertThat(AlertPriority.MEDIUM.isUrgent()).isFalse();
    assertThatThrownBy(() -> AlertPriority.from("urgent"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
