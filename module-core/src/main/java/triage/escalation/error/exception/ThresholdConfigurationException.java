package triage.escalation.error.exception;

import triage.escalation.error.CommonErrorCode;
import triage.escalation.error.exception.base.ServerBaseException;

/**
 * Escalation thresholds or notification checkpoints are inconsistent.
 *
 * <p>Raised while the engine settings are built, which fails application startup.
 */
public class ThresholdConfigurationException extends ServerBaseException {

  public ThresholdConfigurationException(String detail) {
    super(CommonErrorCode.THRESHOLD_CONFIGURATION_INVALID, detail);
  }
}
