package io.b2mash.b2b.artifactvault.lifecycle;

import io.b2mash.b2b.artifactvault.config.VaultProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that runs the lifecycle pass on {@code vault.lifecycle.cron}. Runs in dry-run mode
 * unless {@code vault.lifecycle.dry-run} is set to false.
 */
@Component
@ConditionalOnProperty(name = "vault.lifecycle.enabled", havingValue = "true")
public class LifecycleScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(LifecycleScheduledJob.class);

  private final LifecycleService lifecycleService;
  private final boolean dryRun;

  public LifecycleScheduledJob(LifecycleService lifecycleService, VaultProperties properties) {
    this.lifecycleService = lifecycleService;
    this.dryRun = properties.lifecycle().dryRun();
  }

  @Scheduled(cron = "${vault.lifecycle.cron:0 0 3 * * *}")
  public void executeLifecycleRun() {
    log.info("Lifecycle scheduled job started (dryRun={})", dryRun);
    try {
      var summary = lifecycleService.run(dryRun);
      if (summary.getErrors() > 0) {
        log.warn("Lifecycle scheduled job finished with {} error(s)", summary.getErrors());
      }
    } catch (Exception e) {
      log.error("Lifecycle scheduled job failed", e);
    }
  }
}
