package com.zstrm.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void nullPassesThroughBothDirections() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void keepsMicrosecondPrecision() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30.123456Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void traceIdsAreCompactAndUnique() {
    final String first = TraceIds.newTraceId();
    final String second = TraceIds.newTraceId();

    assertThat(first).hasSize(32).doesNotContain("-");
    assertThat(first).isNotEqualTo(second);
  }
}
