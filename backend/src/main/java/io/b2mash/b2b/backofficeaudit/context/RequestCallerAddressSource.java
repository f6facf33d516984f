package io.b2mash.b2b.backofficeaudit.context;

import io.b2mash.b2b.backofficeaudit.audit.AuditTrailProperties;
import io.b2mash.b2b.backofficeaudit.security.ClientIpResolver;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/** Reads the caller address from the servlet request bound to the current thread, if any. */
@Component
public class RequestCallerAddressSource implements CallerAddressSource {

  private final AuditTrailProperties properties;

  public RequestCallerAddressSource(AuditTrailProperties properties) {
    this.properties = properties;
  }

  @Override
  public String currentRequestIpAddress() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      String ip =
          ClientIpResolver.resolve(
              servletAttrs.getRequest(), properties.trustForwardedHeaders());
      return ip != null ? ip : "";
    }
    return "";
  }
}
