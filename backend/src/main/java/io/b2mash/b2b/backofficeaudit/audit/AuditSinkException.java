package io.b2mash.b2b.backofficeaudit.audit;

/** Raised when an {@link AuditSink} fails to store an entry. Never retried by the pipeline. */
public class AuditSinkException extends RuntimeException {

  public AuditSinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
