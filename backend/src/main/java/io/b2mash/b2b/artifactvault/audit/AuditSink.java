package io.b2mash.b2b.artifactvault.audit;

/**
 * Destination of audit events. Implementations may fail; {@link AuditService} turns any failure
 * into a warning so the audited operation is never blocked.
 */
public interface AuditSink {

  void record(AuditEventRecord event);
}
