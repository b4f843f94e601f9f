package triage.escalation.infrastructure.config;

import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Startup report of settings that are legal but probably unintended.
 *
 * <p>Hard errors (non-monotonic thresholds, bad checkpoints) already failed the context while
 * the engine settings were built. This listener only warns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationConfigurationValidator
    implements ApplicationListener<ApplicationReadyEvent> {

  private final EscalationProperties escalationProperties;
  private final EventDeliveryProperties eventProperties;

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    validate();
  }

  /** @return number of warnings logged */
  int validate() {
    int warnings = 0;
    if (!escalationProperties.notificationsEnabled()) {
      log.warn("[EscalationConfig] Notifications are disabled; only overdue events will fire");
      warnings++;
    }
    if (!escalationProperties.autoEscalateOnOverdue()) {
      log.warn("[EscalationConfig] Auto-escalation is off; overdue alerts stay PENDING");
      warnings++;
    }
    if (escalationProperties.maxVisible() == 0) {
      log.warn("[EscalationConfig] max-visible is 0; every alert will be queued");
      warnings++;
    }
    if (eventProperties.file().enabled()) {
      Path parent = Path.of(eventProperties.file().path()).toAbsolutePath().getParent();
      if (parent != null && Files.exists(parent) && !Files.isWritable(parent)) {
        log.warn(
            "[EscalationConfig] Event file directory is not writable: {}; paged events will"
                + " go to the in-memory buffer",
            parent);
        warnings++;
      }
    }
    if (warnings == 0) {
      log.info("[EscalationConfig] Configuration check passed");
    }
    return warnings;
  }
}
