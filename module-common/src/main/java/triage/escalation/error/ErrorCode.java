package triage.escalation.error;

public interface ErrorCode {
  String getCode();

  String getMessage();
}
