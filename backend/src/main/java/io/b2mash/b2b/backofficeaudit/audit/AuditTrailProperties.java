package io.b2mash.b2b.backofficeaudit.audit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the audit trail pipeline.
 *
 * @param enabled whether the router subscribes to event sources at startup
 * @param trustForwardedHeaders whether {@code X-Forwarded-For} / {@code X-Real-IP} are honoured
 *     when resolving the caller address; only enable behind a trusted reverse proxy
 */
@ConfigurationProperties(prefix = "audit.trail")
public record AuditTrailProperties(
    @DefaultValue("true") boolean enabled, @DefaultValue("false") boolean trustForwardedHeaders) {}
