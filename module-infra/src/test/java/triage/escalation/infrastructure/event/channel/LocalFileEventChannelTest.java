package triage.escalation.infrastructure.event.channel;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import triage.escalation.core.domain.event.OverdueEvent;
import triage.escalation.core.domain.event.StatusChangedEvent;
import triage.escalation.core.domain.model.AlertAction;
import triage.escalation.core.domain.model.AlertPriority;
import triage.escalation.core.domain.model.AlertStatus;
import triage.escalation.infrastructure.executor.DefaultLogicExecutor;
import triage.escalation.infrastructure.executor.LogicExecutor;

@Tag("unit")
@DisplayName("LocalFileEventChannel")
class LocalFileEventChannelTest {

  private static final Instant NOW = Instant.parse("2024-01-01T10:30:00Z");

  @TempDir Path tempDir;

  private ObjectMapper objectMapper;
  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    objectMapper =
        new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    executor = new DefaultLogicExecutor(new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("appends one JSON envelope per event")
  void appendsJsonLines() throws IOException {
    Path file = tempDir.resolve("events.jsonl");
    LocalFileEventChannel channel = new LocalFileEventChannel(file, objectMapper, executor);

    assertThat(channel.send(new OverdueEvent("a-1", AlertPriority.CRITICAL, 42, NOW))).isTrue();
    assertThat(
            channel.send(
                new StatusChangedEvent(
                    "a-1",
                    AlertStatus.PENDING,
                    AlertStatus.ESCALATED,
                    AlertAction.ESCALATE,
                    "system",
                    NOW)))
        .isTrue();

    List<String> lines = Files.readAllLines(file);
    assertThat(lines).hasSize(2);

    JsonNode first = objectMapper.readTree(lines.get(0));
    assertThat(first.get("type").asText()).isEqualTo("OVERDUE");
    assertThat(first.get("alertId").asText()).isEqualTo("a-1");
    assertThat(first.get("occurredAt").asText()).isEqualTo("2024-01-01T10:30:00Z");
    assertThat(first.get("event").get("overdueSeconds").asLong()).isEqualTo(42);

    JsonNode second = objectMapper.readTree(lines.get(1));
    assertThat(second.get("type").asText()).isEqualTo("STATUS_CHANGED");
    assertThat(second.get("event").get("to").asText()).isEqualTo("ESCALATED");
  }

  @Test
  @DisplayName("creates missing parent directories")
  void createsParentDirectories() {
    Path file = tempDir.resolve("nested/dir/events.jsonl");
    LocalFileEventChannel channel = new LocalFileEventChannel(file, objectMapper, executor);

    assertThat(channel.send(new OverdueEvent("a-2", AlertPriority.LOW, 1, NOW))).isTrue();
    assertThat(file).exists();
  }

  @Test
  @DisplayName("reports a failed send when the file cannot be written")
  void failedWriteReturnsFalse() throws IOException {
    Path blocker = Files.createFile(tempDir.resolve("blocker"));
    LocalFileEventChannel channel =
        new LocalFileEventChannel(blocker.resolve("events.jsonl"), objectMapper, executor);

    assertThat(channel.send(new OverdueEvent("a-3", AlertPriority.HIGH, 5, NOW))).isFalse();
  }

  @Test
  @DisplayName("fallback channel is configurable")
  void fallback() {
    LocalFileEventChannel channel =
        new LocalFileEventChannel(tempDir.resolve("events.jsonl"), objectMapper, executor);
    InMemoryEventBuffer buffer = new InMemoryEventBuffer(10);

    channel.setFallback(buffer);

    assertThat(channel.getFallback()).isSameAs(buffer);
    assertThat(channel.getChannelName()).isEqualTo("local-file");
  }
}
