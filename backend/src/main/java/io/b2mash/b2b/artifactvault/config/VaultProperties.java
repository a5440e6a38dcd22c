package io.b2mash.b2b.artifactvault.config;

import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.classification.ExportPolicy;
import io.b2mash.b2b.artifactvault.storage.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration surface of the vault, bound from the {@code vault.*} namespace.
 *
 * @param storageRoot directory holding tiers, keyring, legal holds, audit and auxiliary logs
 * @param encryptionEnabled when false, artifacts are written in plaintext and sidecars record
 *     {@code encrypted:false}
 * @param tiers per-tier retention windows
 * @param classification default label and label ordering
 * @param compliance export policy and legal-hold behavior
 * @param lifecycle schedule of the tier migration job
 * @param retention schedule and per-kind windows of auxiliary log pruning
 * @param security static capability grants used when no external checker is registered
 */
@Validated
@ConfigurationProperties(prefix = "vault")
public record VaultProperties(
    @NotBlank String storageRoot,
    @DefaultValue("true") boolean encryptionEnabled,
    @Valid @DefaultValue Tiers tiers,
    @Valid @DefaultValue Classification classification,
    @Valid @DefaultValue Compliance compliance,
    @Valid @DefaultValue Lifecycle lifecycle,
    @Valid @DefaultValue Retention retention,
    @Valid @DefaultValue Security security) {

  /**
   * @param hotRetentionDays days an artifact stays hot before promotion to warm
   * @param warmRetentionDays age in days after which a warm artifact moves to cold
   * @param coldRetentionDays age in days after which a cold artifact is purged
   */
  public record Tiers(
      @PositiveOrZero @DefaultValue("7") int hotRetentionDays,
      @PositiveOrZero @DefaultValue("30") int warmRetentionDays,
      @PositiveOrZero @DefaultValue("365") int coldRetentionDays) {

    public int retentionDays(Tier tier) {
      return switch (tier) {
        case HOT -> hotRetentionDays;
        case WARM -> warmRetentionDays;
        case COLD -> coldRetentionDays;
      };
    }
  }

  public record Classification(
      @NotNull @DefaultValue("INTERNAL") ClassificationLabel defaultLabel,
      @NotEmpty @DefaultValue({"PUBLIC", "INTERNAL", "CONFIDENTIAL", "RESTRICTED"})
          List<ClassificationLabel> ordering) {}

  public record Compliance(
      @NotNull @DefaultValue("DENY") ExportPolicy exportPolicy,
      @DefaultValue("true") boolean legalHoldBlocksDelete) {}

  /** Lifecycle runs in dry-run mode unless explicitly switched off. */
  public record Lifecycle(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("0 0 3 * * *") String cron,
      @DefaultValue("true") boolean dryRun) {}

  /**
   * @param logWindows auxiliary log kind to retention window in days
   */
  public record Retention(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("0 30 3 * * *") String cron,
      Map<String, Integer> logWindows) {

    public Retention {
      logWindows = logWindows != null ? Map.copyOf(logWindows) : Map.of();
    }
  }

  /**
   * @param grants actor id to capability names ({@code export}, {@code delete}, {@code relabel},
   *     {@code rotateKey}, {@code legalHold})
   */
  public record Security(Map<String, List<String>> grants) {

    public Security {
      grants = grants != null ? Map.copyOf(grants) : Map.of();
    }
  }
}
