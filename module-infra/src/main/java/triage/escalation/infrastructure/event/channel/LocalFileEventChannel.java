package triage.escalation.infrastructure.event.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import triage.escalation.core.domain.event.EscalationEvent;
import triage.escalation.error.exception.EventDeliveryException;
import triage.escalation.infrastructure.executor.LogicExecutor;
import triage.escalation.infrastructure.executor.TaskContext;

/**
 * Appends events to a local file, one JSON object per line.
 *
 * <pre>
 * {"type":"OVERDUE","alertId":"a-1","occurredAt":"2024-01-01T10:30:00Z","summary":"...","event":{...}}
 * </pre>
 *
 * <p>Write failures are logged by the executor and reported as a failed send, so the publisher
 * can try the fallback channel.
 */
@Slf4j
public class LocalFileEventChannel implements EventChannel, FallbackSupport {

  private final Path filePath;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final Object writeLock = new Object();
  private EventChannel fallback;

  public LocalFileEventChannel(Path filePath, ObjectMapper objectMapper, LogicExecutor executor) {
    this.filePath = filePath;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  @Override
  public boolean send(EscalationEvent event) {
    return executor.executeOrDefault(
        () -> {
          append(event);
          return true;
        },
        false,
        TaskContext.of("EventChannel", "writeFile", event.alertId()));
  }

  private void append(EscalationEvent event) throws IOException {
    String line = objectMapper.writeValueAsString(envelope(event)) + System.lineSeparator();
    synchronized (writeLock) {
      Path parent = filePath.toAbsolutePath().getParent();
      if (parent != null && Files.notExists(parent)) {
        Files.createDirectories(parent);
      }
      if (Files.exists(filePath) && !Files.isWritable(filePath)) {
        throw new EventDeliveryException(getChannelName());
      }
      Files.writeString(
          filePath,
          line,
          StandardOpenOption.CREATE,
          StandardOpenOption.WRITE,
          StandardOpenOption.APPEND);
    }
    log.debug("[LocalFileEventChannel] Event written: type={}, file={}", event.type(), filePath);
  }

  private static Map<String, Object> envelope(EscalationEvent event) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("type", event.type());
    envelope.put("alertId", event.alertId());
    envelope.put("occurredAt", event.occurredAt());
    envelope.put("summary", event.summary());
    envelope.put("event", event);
    return envelope;
  }

  @Override
  public String getChannelName() {
    return "local-file";
  }

  public Path getFilePath() {
    return filePath;
  }

  @Override
  public void setFallback(EventChannel fallback) {
    this.fallback = fallback;
    log.info(
        "[LocalFileEventChannel] Fallback channel set to {}",
        fallback != null ? fallback.getChannelName() : "none");
  }

  @Override
  public EventChannel getFallback() {
    return fallback;
  }
}
