package triage.escalation.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import triage.escalation.core.engine.EscalationEngine;
import triage.escalation.core.engine.EscalationSettings;
import triage.escalation.core.port.out.EscalationEventPublisher;
import triage.escalation.infrastructure.event.AsyncEscalationEventPublisher;
import triage.escalation.infrastructure.event.channel.EventChannel;
import triage.escalation.infrastructure.event.channel.InMemoryEventBuffer;
import triage.escalation.infrastructure.event.channel.LocalFileEventChannel;
import triage.escalation.infrastructure.event.channel.LoggingEventChannel;
import triage.escalation.infrastructure.event.strategy.EventChannelStrategy;
import triage.escalation.infrastructure.event.strategy.EventRoute;
import triage.escalation.infrastructure.event.strategy.StatelessEventChannelStrategy;
import triage.escalation.infrastructure.executor.LogicExecutor;

/**
 * Wires the escalation engine and its event delivery.
 *
 * <h3>Channel chain</h3>
 *
 * <ul>
 *   <li>LOG route: {@link LoggingEventChannel}
 *   <li>PAGE route, file enabled: {@link LocalFileEventChannel}, falling back to {@link
 *       InMemoryEventBuffer}
 *   <li>PAGE route, file disabled: {@link LoggingEventChannel}
 * </ul>
 *
 * <p>Settings are validated while the {@link EscalationSettings} bean is created, so bad
 * thresholds stop the application before the scheduler starts.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({EscalationProperties.class, EventDeliveryProperties.class})
public class EscalationEngineConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public EscalationSettings escalationSettings(EscalationProperties properties) {
    EscalationSettings settings = properties.toSettings();
    log.info(
        "[EscalationConfig] Thresholds={}, notifyAt={}, maxVisible={}, autoEscalate={},"
            + " tierTimeouts={}",
        settings.thresholds().minutes(),
        settings.notificationPolicy().thresholds(),
        settings.maxVisible(),
        settings.autoEscalateOnOverdue(),
        settings.tiers().timeoutMinutes());
    return settings;
  }

  @Bean
  public LoggingEventChannel loggingEventChannel() {
    return new LoggingEventChannel();
  }

  @Bean
  public InMemoryEventBuffer inMemoryEventBuffer(EventDeliveryProperties properties) {
    return new InMemoryEventBuffer(properties.fallbackBufferCapacity());
  }

  @Bean
  public EventChannelStrategy eventChannelStrategy(
      EventDeliveryProperties properties,
      LoggingEventChannel loggingChannel,
      InMemoryEventBuffer buffer,
      ObjectMapper objectMapper,
      LogicExecutor executor) {
    Map<EventRoute, Supplier<EventChannel>> providers = new EnumMap<>(EventRoute.class);
    providers.put(EventRoute.LOG, () -> loggingChannel);

    if (properties.file().enabled()) {
      ObjectMapper fileMapper =
          objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
      LocalFileEventChannel fileChannel =
          new LocalFileEventChannel(Path.of(properties.file().path()), fileMapper, executor);
      fileChannel.setFallback(buffer);
      providers.put(EventRoute.PAGE, () -> fileChannel);
    } else {
      providers.put(EventRoute.PAGE, () -> loggingChannel);
    }
    return new StatelessEventChannelStrategy(providers);
  }

  @Bean(initMethod = "start", destroyMethod = "")
  public AsyncEscalationEventPublisher escalationEventPublisher(
      EventChannelStrategy strategy,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      EventDeliveryProperties properties) {
    return new AsyncEscalationEventPublisher(
        strategy, executor, meterRegistry, properties.bufferCapacity());
  }

  @Bean
  public EscalationEngine escalationEngine(
      EscalationSettings settings, EscalationEventPublisher publisher) {
    return new EscalationEngine(settings, publisher);
  }
}
