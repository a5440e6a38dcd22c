package io.b2mash.b2b.artifactvault.eventlog;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EventLogEntryTest {

  private static final Instant EXPECTED = Instant.parse("2026-03-01T12:30:00Z");

  @ParameterizedTest
  @ValueSource(
      strings = {"2026-03-01T12:30:00Z", "2026-03-01T14:30:00+02:00", "2026-03-01T12:30:00"})
  void timestampAcceptsIsoForms(String value) {
    var entry = entryWith(Map.of(EventLogEntry.TIMESTAMP_FIELD, value));

    assertThat(entry.timestamp()).contains(EXPECTED);
  }

  @Test
  void timestampAcceptsEpochSeconds() {
    var entry = entryWith(Map.of(EventLogEntry.TIMESTAMP_FIELD, EXPECTED.getEpochSecond()));

    assertThat(entry.timestamp()).contains(EXPECTED);
  }

  @Test
  void unreadableOrMissingTimestampIsEmpty() {
    assertThat(entryWith(Map.of(EventLogEntry.TIMESTAMP_FIELD, "yesterday")).timestamp()).isEmpty();
    assertThat(entryWith(Map.of(EventLogEntry.TIMESTAMP_FIELD, true)).timestamp()).isEmpty();
    assertThat(entryWith(Map.of()).timestamp()).isEmpty();
  }

  @Test
  void tenantOwnershipComesFromTenantField() {
    var entry = entryWith(Map.of(EventLogEntry.TENANT_FIELD, "tenant-a"));

    assertThat(entry.tenantId()).contains("tenant-a");
    assertThat(entry.belongsTo("tenant-a")).isTrue();
    assertThat(entry.belongsTo("tenant-b")).isFalse();
  }

  @Test
  void entryWithoutFieldsBelongsToNoTenant() {
    var entry = new EventLogEntry("garbage", null);

    assertThat(entry.fields()).isEmpty();
    assertThat(entry.tenantId()).isEmpty();
    assertThat(entry.belongsTo("tenant-a")).isFalse();
  }

  private static EventLogEntry entryWith(Map<String, Object> fields) {
    return new EventLogEntry("{}", new HashMap<>(fields));
  }
}
