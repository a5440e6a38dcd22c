package io.b2mash.b2b.artifactvault.compliance;

import io.b2mash.b2b.artifactvault.config.VaultProperties;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Applies {@code vault.retention.log-windows} to the auxiliary logs on a cron schedule. */
@Component
@ConditionalOnProperty(name = "vault.retention.enabled", havingValue = "true")
public class RetentionScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(RetentionScheduledJob.class);

  private final RetentionEnforcementService retentionService;
  private final Map<String, Integer> logWindows;

  public RetentionScheduledJob(
      RetentionEnforcementService retentionService, VaultProperties properties) {
    this.retentionService = retentionService;
    this.logWindows = properties.retention().logWindows();
  }

  @Scheduled(cron = "${vault.retention.cron:0 30 3 * * *}")
  public void executeRetention() {
    if (logWindows.isEmpty()) {
      log.debug("Retention scheduled job skipped: no log windows configured");
      return;
    }
    log.info("Retention scheduled job started for {} log kind(s)", logWindows.size());
    try {
      var summary = retentionService.enforceRetention(logWindows, false);
      if (!summary.getFailures().isEmpty()) {
        log.warn("Retention scheduled job failed for kinds {}", summary.getFailures().keySet());
      }
    } catch (Exception e) {
      log.error("Retention scheduled job failed", e);
    }
  }
}
