package triage.escalation.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("AlertFilter")
class AlertFilterTest {

  private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

  private final Alert critical = Alert.create("c", AlertPriority.CRITICAL, T0);
  private final Alert lowAcked =
      Alert.create("l", AlertPriority.LOW, T0.plusSeconds(600))
          .acknowledge(T0.plusSeconds(700))
          .withAssignees(List.of("nurse-1"));

  @Test
  @DisplayName("empty filter matches everything")
  void all() {
    assertThat(AlertFilter.all().matches(critical)).isTrue();
    assertThat(AlertFilter.all().matches(lowAcked)).isTrue();
  }

  @Test
  @DisplayName("priority and status criteria")
  void priorityAndStatus() {
    assertThat(AlertFilter.byPriority(AlertPriority.CRITICAL).matches(critical)).isTrue();
    assertThat(AlertFilter.byPriority(AlertPriority.CRITICAL).matches(lowAcked)).isFalse();
    assertThat(AlertFilter.byStatus(AlertStatus.ACKNOWLEDGED).matches(lowAcked)).isTrue();
    assertThat(AlertFilter.byStatus(AlertStatus.ACKNOWLEDGED).matches(critical)).isFalse();
  }

  @Test
  @DisplayName("assignee criterion")
  void assignee() {
    AlertFilter mine = AlertFilter.all().withAssignee("nurse-1");

    assertThat(mine.matches(lowAcked)).isTrue();
    assertThat(mine.matches(critical)).isFalse();
  }

  @Test
  @DisplayName("created range is inclusive at the start and exclusive at the end")
  void createdRange() {
    AlertFilter firstTenMinutes = AlertFilter.all().createdBetween(T0, T0.plusSeconds(600));

    assertThat(firstTenMinutes.matches(critical)).isTrue();
    assertThat(firstTenMinutes.matches(lowAcked)).isFalse();
  }
}
