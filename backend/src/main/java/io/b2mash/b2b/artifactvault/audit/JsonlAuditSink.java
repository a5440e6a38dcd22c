package io.b2mash.b2b.artifactvault.audit;

import io.b2mash.b2b.artifactvault.storage.AppendOnlyLog;
import io.b2mash.b2b.artifactvault.storage.StorageLayout;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import tools.jackson.databind.ObjectMapper;

/** Default {@link AuditSink}: one append-only JSON-lines file per subsystem. */
public class JsonlAuditSink implements AuditSink {

  private final StorageLayout storageLayout;
  private final ObjectMapper objectMapper;
  private final Map<String, AppendOnlyLog<AuditEventRecord>> logs = new ConcurrentHashMap<>();

  public JsonlAuditSink(StorageLayout storageLayout, ObjectMapper objectMapper) {
    this.storageLayout = storageLayout;
    this.objectMapper = objectMapper;
  }

  @Override
  public void record(AuditEventRecord event) {
    var auditLog = logFor(event.subsystem());
    synchronized (auditLog) {
      auditLog.append(event);
    }
  }

  /** Every event recorded so far for a subsystem, oldest first. */
  public List<AuditEventRecord> read(AuditSubsystem subsystem) {
    var auditLog = logFor(subsystem.value());
    synchronized (auditLog) {
      return auditLog.replay();
    }
  }

  private AppendOnlyLog<AuditEventRecord> logFor(String subsystem) {
    return logs.computeIfAbsent(
        subsystem,
        s ->
            new AppendOnlyLog<>(
                storageLayout.auditDir().resolve(s + StorageLayout.LOG_SUFFIX),
                objectMapper,
                AuditEventRecord.class));
  }
}
