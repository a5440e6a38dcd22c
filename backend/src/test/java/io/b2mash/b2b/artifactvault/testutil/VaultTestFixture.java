package io.b2mash.b2b.artifactvault.testutil;

import io.b2mash.b2b.artifactvault.audit.AuditEventRecord;
import io.b2mash.b2b.artifactvault.audit.AuditService;
import io.b2mash.b2b.artifactvault.audit.AuditSubsystem;
import io.b2mash.b2b.artifactvault.audit.JsonlAuditSink;
import io.b2mash.b2b.artifactvault.classification.ClassificationLabel;
import io.b2mash.b2b.artifactvault.classification.ClassificationService;
import io.b2mash.b2b.artifactvault.classification.LabelOrdering;
import io.b2mash.b2b.artifactvault.compliance.LegalHoldRegistry;
import io.b2mash.b2b.artifactvault.compliance.RetentionEnforcementService;
import io.b2mash.b2b.artifactvault.compliance.TenantDeletionService;
import io.b2mash.b2b.artifactvault.compliance.TenantExportService;
import io.b2mash.b2b.artifactvault.config.VaultProperties;
import io.b2mash.b2b.artifactvault.crypto.EnvelopeCipher;
import io.b2mash.b2b.artifactvault.crypto.FileKeyring;
import io.b2mash.b2b.artifactvault.crypto.KeyManagementService;
import io.b2mash.b2b.artifactvault.eventlog.EventLogStore;
import io.b2mash.b2b.artifactvault.lifecycle.LifecycleService;
import io.b2mash.b2b.artifactvault.security.Actor;
import io.b2mash.b2b.artifactvault.security.GrantsCapabilityChecker;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import io.b2mash.b2b.artifactvault.storage.TieredArtifactStore;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Wires the real vault components over a temp directory without a Spring context. Properties are
 * bound through the same binder Spring Boot uses, so defaults come from {@link VaultProperties}.
 */
public final class VaultTestFixture {

  public static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

  /** Holds every capability and the highest clearance. */
  public static final Actor OFFICER =
      new Actor("compliance-officer", ClassificationLabel.RESTRICTED);

  /** May export, cleared for internal material only. */
  public static final Actor ANALYST = new Actor("analyst", ClassificationLabel.INTERNAL);

  /** Holds no capabilities. */
  public static final Actor VIEWER = new Actor("viewer", ClassificationLabel.PUBLIC);

  private final MutableClock clock;
  private final VaultProperties properties;
  private final StorageLayout layout;
  private final ObjectMapper objectMapper;
  private final JsonlAuditSink auditSink;
  private final AuditService auditService;
  private final FileKeyring keyring;
  private final EnvelopeCipher cipher;
  private final LabelOrdering labelOrdering;
  private final GrantsCapabilityChecker capabilityChecker;
  private final TieredArtifactStore store;
  private final EventLogStore eventLogStore;
  private final LegalHoldRegistry legalHoldRegistry;

  private VaultTestFixture(Path root, Map<String, String> overrides) {
    var source = new HashMap<String, String>();
    source.put("vault.storage-root", root.toString());
    source.put(
        "vault.security.grants.compliance-officer", "export,delete,relabel,rotateKey,legalHold");
    source.put("vault.security.grants.analyst", "export");
    source.putAll(overrides);
    this.properties = bindProperties(source);

    this.clock = new MutableClock(START);
    this.layout = new StorageLayout(root);
    this.objectMapper = JsonMapper.builder().build();
    this.auditSink = new JsonlAuditSink(layout, objectMapper);
    this.auditService = new AuditService(auditSink, clock);
    this.keyring = new FileKeyring(layout, objectMapper, clock);
    this.cipher = new EnvelopeCipher(keyring);
    this.labelOrdering = new LabelOrdering(properties.classification().ordering());
    this.capabilityChecker = GrantsCapabilityChecker.from(properties);
    this.store =
        new TieredArtifactStore(
            layout, objectMapper, keyring, cipher, labelOrdering, auditService, clock, properties);
    this.eventLogStore = new EventLogStore(layout, objectMapper, clock);
    this.legalHoldRegistry =
        new LegalHoldRegistry(layout, objectMapper, capabilityChecker, auditService, clock);
  }

  public static VaultTestFixture create(Path root) {
    return new VaultTestFixture(root, Map.of());
  }

  public static VaultTestFixture create(Path root, Map<String, String> overrides) {
    return new VaultTestFixture(root, overrides);
  }

  /** Binds {@code vault.*} entries of {@code source} the way Spring Boot would at startup. */
  public static VaultProperties bindProperties(Map<String, String> source) {
    return new Binder(new MapConfigurationPropertySource(source))
        .bind("vault", VaultProperties.class)
        .get();
  }

  public MutableClock clock() {
    return clock;
  }

  public VaultProperties properties() {
    return properties;
  }

  public StorageLayout layout() {
    return layout;
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public AuditService auditService() {
    return auditService;
  }

  public FileKeyring keyring() {
    return keyring;
  }

  public EnvelopeCipher cipher() {
    return cipher;
  }

  public LabelOrdering labelOrdering() {
    return labelOrdering;
  }

  public GrantsCapabilityChecker capabilityChecker() {
    return capabilityChecker;
  }

  public TieredArtifactStore store() {
    return store;
  }

  public EventLogStore eventLogStore() {
    return eventLogStore;
  }

  public LegalHoldRegistry legalHoldRegistry() {
    return legalHoldRegistry;
  }

  public ClassificationService classificationService() {
    return new ClassificationService(
        store, labelOrdering, capabilityChecker, auditService, properties);
  }

  public KeyManagementService keyManagementService() {
    return new KeyManagementService(keyring, capabilityChecker, auditService);
  }

  public LifecycleService lifecycleService() {
    return new LifecycleService(store, auditService, clock, properties);
  }

  public TenantExportService exportService() {
    return new TenantExportService(
        store,
        eventLogStore,
        labelOrdering,
        capabilityChecker,
        auditService,
        layout,
        objectMapper,
        clock,
        properties);
  }

  public TenantDeletionService deletionService() {
    return new TenantDeletionService(
        store,
        eventLogStore,
        legalHoldRegistry,
        capabilityChecker,
        auditService,
        clock,
        properties);
  }

  public RetentionEnforcementService retentionService() {
    return new RetentionEnforcementService(eventLogStore, auditService, clock);
  }

  /** Audit events recorded so far in one subsystem, oldest first. */
  public List<AuditEventRecord> auditEvents(AuditSubsystem subsystem) {
    return auditSink.read(subsystem);
  }

  /** Audit events of one type recorded so far in one subsystem. */
  public List<AuditEventRecord> auditEvents(AuditSubsystem subsystem, String eventType) {
    return auditSink.read(subsystem).stream()
        .filter(event -> eventType.equals(event.eventType()))
        .toList();
  }
}
