package triage.escalation.infrastructure.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Threads that run the escalation tick.
 *
 * <pre>
 * scheduler:
 *   task-scheduler:
 *     pool-size: 2
 *     await-termination-seconds: 30
 *     thread-name-prefix: escalation-tick-
 * </pre>
 *
 * @param awaitTerminationSeconds how long shutdown waits for a running tick
 */
@Validated
@ConfigurationProperties(prefix = "scheduler.task-scheduler")
public record SchedulerProperties(
    @DefaultValue("2") @Min(1) int poolSize,
    @DefaultValue("30") @Min(1) int awaitTerminationSeconds,
    @DefaultValue("escalation-tick-") @NotBlank String threadNamePrefix) {}
