package io.b2mash.b2b.backofficeaudit;

import io.b2mash.b2b.backofficeaudit.audit.AuditTrailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AuditTrailProperties.class)
public class BackofficeAuditApplication {

  public static void main(String[] args) {
    SpringApplication.run(BackofficeAuditApplication.class, args);
  }
}
