package io.b2mash.b2b.artifactvault.audit;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point every component uses to record a state change. Stamps the event time from the
 * injected clock and forwards to the {@link AuditSink}.
 *
 * <p>Failure semantics: a sink failure is logged at WARN and swallowed. The state change has
 * already happened by the time it is audited, so failing the caller would misreport it.
 */
@Service
public class AuditService {

  private static final Logger log = LoggerFactory.getLogger(AuditService.class);

  private final AuditSink sink;
  private final Clock clock;

  public AuditService(AuditSink sink, Clock clock) {
    this.sink = sink;
    this.clock = clock;
  }

  public void log(AuditEventRecord record) {
    var stamped = record.occurredAt() != null ? record : record.withOccurredAt(clock.instant());
    try {
      sink.record(stamped);
      log.debug(
          "Recorded audit event: subsystem={}, type={}, tenant={}, artifact={}/{}",
          stamped.subsystem(),
          stamped.eventType(),
          stamped.tenantId(),
          stamped.workflowId(),
          stamped.artifactId());
    } catch (RuntimeException e) {
      log.warn(
          "Audit sink failed for event {} ({}): {}",
          stamped.eventType(),
          stamped.subsystem(),
          e.getMessage());
    }
  }
}
