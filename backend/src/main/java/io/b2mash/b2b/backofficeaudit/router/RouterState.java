package io.b2mash.b2b.backofficeaudit.router;

/** Registration state of the {@link AuditEventRouter}. */
public enum RouterState {
  UNREGISTERED,
  REGISTERED
}
