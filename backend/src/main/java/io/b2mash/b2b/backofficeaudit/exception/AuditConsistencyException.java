package io.b2mash.b2b.backofficeaudit.exception;

/**
 * An event or the current identity references a user, group or entity that the corresponding
 * directory cannot resolve. Aborts auditing of the current event; no partial entry is written.
 */
public class AuditConsistencyException extends RuntimeException {

  public AuditConsistencyException(String message) {
    super(message);
  }

  public static AuditConsistencyException missing(String resourceType, Object id) {
    return new AuditConsistencyException("No " + resourceType + " found with id " + id);
  }
}
