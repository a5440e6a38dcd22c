package io.b2mash.b2b.artifactvault.config;

import io.b2mash.b2b.artifactvault.audit.AuditSink;
import io.b2mash.b2b.artifactvault.audit.JsonlAuditSink;
import io.b2mash.b2b.artifactvault.classification.LabelOrdering;
import io.b2mash.b2b.artifactvault.security.CapabilityChecker;
import io.b2mash.b2b.artifactvault.security.GrantsCapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the non-component collaborators. The clock, capability checker and audit sink are the
 * external seams; each backs off when the host application supplies its own bean.
 */
@Configuration
@EnableConfigurationProperties(VaultProperties.class)
public class VaultConfiguration {

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  StorageLayout storageLayout(VaultProperties properties) {
    return new StorageLayout(Path.of(properties.storageRoot()));
  }

  @Bean
  LabelOrdering labelOrdering(VaultProperties properties) {
    return new LabelOrdering(properties.classification().ordering());
  }

  @Bean
  @ConditionalOnMissingBean
  CapabilityChecker capabilityChecker(VaultProperties properties) {
    return GrantsCapabilityChecker.from(properties);
  }

  @Bean
  @ConditionalOnMissingBean
  AuditSink auditSink(StorageLayout storageLayout, ObjectMapper objectMapper) {
    return new JsonlAuditSink(storageLayout, objectMapper);
  }
}
