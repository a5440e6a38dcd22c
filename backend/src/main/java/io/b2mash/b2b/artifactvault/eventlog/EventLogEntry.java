package io.b2mash.b2b.artifactvault.eventlog;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * One line of an auxiliary event log. The raw line is kept verbatim so rewrites and exports never
 * reformat records they did not touch.
 *
 * @param rawLine the line as stored, without its terminator
 * @param fields parsed JSON object; empty when the line is not a JSON object
 */
public record EventLogEntry(String rawLine, Map<String, Object> fields) {

  public static final String TIMESTAMP_FIELD = "timestamp";
  public static final String TENANT_FIELD = "tenant_id";

  public EventLogEntry {
    fields = fields != null ? fields : Map.of();
  }

  public Optional<String> tenantId() {
    Object value = fields.get(TENANT_FIELD);
    return value instanceof String tenant ? Optional.of(tenant) : Optional.empty();
  }

  public boolean belongsTo(String tenantId) {
    return tenantId.equals(fields.get(TENANT_FIELD));
  }

  /**
   * Event time, accepting ISO-8601 instants, offset or zone-less (read as UTC) date-times, and
   * numeric epoch seconds.
   */
  public Optional<Instant> timestamp() {
    Object value = fields.get(TIMESTAMP_FIELD);
    if (value instanceof Number epochSeconds) {
      return Optional.of(Instant.ofEpochMilli(Math.round(epochSeconds.doubleValue() * 1000)));
    }
    if (!(value instanceof String text) || text.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(text));
    } catch (DateTimeParseException ignored) {
      // fall through to the offset and local forms
    }
    try {
      return Optional.of(OffsetDateTime.parse(text).toInstant());
    } catch (DateTimeParseException ignored) {
      // fall through
    }
    try {
      return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
