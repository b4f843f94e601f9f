package triage.escalation.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Outbound event delivery.
 *
 * <pre>
 * escalation:
 *   events:
 *     buffer-capacity: 1024
 *     fallback-buffer-capacity: 1000
 *     drain-timeout-seconds: 10
 *     file:
 *       enabled: false
 *       path: logs/escalation-events.jsonl
 * </pre>
 *
 * @param bufferCapacity publisher queue size; events beyond it are dropped
 * @param fallbackBufferCapacity in-memory buffer behind the file channel
 * @param drainTimeoutSeconds how long shutdown waits for queued events
 */
@Validated
@ConfigurationProperties(prefix = "escalation.events")
public record EventDeliveryProperties(
    @DefaultValue("1024") @Min(1) int bufferCapacity,
    @DefaultValue("1000") @Min(1) int fallbackBufferCapacity,
    @DefaultValue("10") @Min(1) int drainTimeoutSeconds,
    @Valid @DefaultValue FileOutput file) {

  public record FileOutput(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("logs/escalation-events.jsonl") @NotBlank String path) {}
}
