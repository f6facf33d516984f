package io.b2mash.b2b.backofficeaudit.context;

public interface CallerAddressSource {

  /** Network address of the current caller; empty when no request is in scope. Never null. */
  String currentRequestIpAddress();
}
