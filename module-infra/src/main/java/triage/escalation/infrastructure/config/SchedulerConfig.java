package triage.escalation.infrastructure.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler that runs {@code EscalationTickScheduler}.
 *
 * <p>The pool only rejects work once it is shutting down; each rejection bumps {@code
 * scheduler.rejected}. Executor gauges are published under {@code executor.*} with name {@code
 * task.scheduler}.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix(properties.threadNamePrefix());
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(countRejections(meterRegistry));
    scheduler.initialize();

    new ExecutorServiceMetrics(scheduler.getScheduledExecutor(), "task.scheduler", List.of())
        .bindTo(meterRegistry);
    log.info(
        "[TaskScheduler] pool={}, prefix={}, awaitTermination={}s",
        properties.poolSize(),
        properties.threadNamePrefix(),
        properties.awaitTerminationSeconds());
    return scheduler;
  }

  static RejectedExecutionHandler countRejections(MeterRegistry meterRegistry) {
    Counter rejected =
        Counter.builder("scheduler.rejected")
            .description("Scheduled tasks refused by a shut-down pool")
            .register(meterRegistry);
    return (task, executor) -> {
      rejected.increment();
      throw new RejectedExecutionException("escalation scheduler is shut down");
    };
  }
}
