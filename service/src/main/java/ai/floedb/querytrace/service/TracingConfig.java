/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.querytrace.service;

import java.time.Duration;
import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/**
 * Limits and timings of a {@link LocalTracingService}.
 *
 * @param maxPendingSessions sessions that may be active at once; further sessions are refused
 * @param maxPendingRecords records that may be admitted and not yet written
 * @param maxEventsPerSession events a single session may collect
 * @param slowQueryThreshold sessions flagged for slow query logging are written above this
 * @param writePeriod delay between background flushes
 * @param writeBatchSize queued sessions that trigger an immediate flush
 * @param workerEnabled whether the background flush worker runs
 */
public record TracingConfig(
    int maxPendingSessions,
    long maxPendingRecords,
    int maxEventsPerSession,
    Duration slowQueryThreshold,
    Duration writePeriod,
    int writeBatchSize,
    boolean workerEnabled) {

  static final String PREFIX = "querytrace.tracing.";

  static final int DEFAULT_MAX_PENDING_SESSIONS = 1000;
  static final long DEFAULT_MAX_PENDING_RECORDS = 10_000L;
  static final int DEFAULT_MAX_EVENTS_PER_SESSION = 1000;
  static final long DEFAULT_SLOW_QUERY_THRESHOLD_MS = 500L;
  static final long DEFAULT_WRITE_PERIOD_MS = 2_000L;
  static final int DEFAULT_WRITE_BATCH_SIZE = 100;

  public TracingConfig {
    Objects.requireNonNull(slowQueryThreshold, "slowQueryThreshold");
    Objects.requireNonNull(writePeriod, "writePeriod");
    if (maxPendingSessions <= 0) {
      throw new IllegalArgumentException("maxPendingSessions must be > 0");
    }
    if (maxPendingRecords <= 0) {
      throw new IllegalArgumentException("maxPendingRecords must be > 0");
    }
    if (maxEventsPerSession < 0) {
      throw new IllegalArgumentException("maxEventsPerSession must be >= 0");
    }
    if (slowQueryThreshold.isNegative()) {
      throw new IllegalArgumentException("slowQueryThreshold must be >= 0");
    }
    if (writePeriod.isZero() || writePeriod.isNegative()) {
      throw new IllegalArgumentException("writePeriod must be > 0");
    }
    if (writeBatchSize <= 0) {
      throw new IllegalArgumentException("writeBatchSize must be > 0");
    }
  }

  public static TracingConfig defaults() {
    return new TracingConfig(
        DEFAULT_MAX_PENDING_SESSIONS,
        DEFAULT_MAX_PENDING_RECORDS,
        DEFAULT_MAX_EVENTS_PER_SESSION,
        Duration.ofMillis(DEFAULT_SLOW_QUERY_THRESHOLD_MS),
        Duration.ofMillis(DEFAULT_WRITE_PERIOD_MS),
        DEFAULT_WRITE_BATCH_SIZE,
        true);
  }

  /** Reads the {@code querytrace.tracing.*} keys; out-of-range values are clamped. */
  public static TracingConfig fromConfig(Config config) {
    Objects.requireNonNull(config, "config");
    int maxPendingSessions =
        Math.max(
            1,
            config
                .getOptionalValue(PREFIX + "max-pending-sessions", Integer.class)
                .orElse(DEFAULT_MAX_PENDING_SESSIONS));
    long maxPendingRecords =
        Math.max(
            1L,
            config
                .getOptionalValue(PREFIX + "max-pending-records", Long.class)
                .orElse(DEFAULT_MAX_PENDING_RECORDS));
    int maxEventsPerSession =
        Math.max(
            0,
            config
                .getOptionalValue(PREFIX + "max-events-per-session", Integer.class)
                .orElse(DEFAULT_MAX_EVENTS_PER_SESSION));
    long slowQueryThresholdMs =
        Math.max(
            0L,
            config
                .getOptionalValue(PREFIX + "slow-query-threshold-ms", Long.class)
                .orElse(DEFAULT_SLOW_QUERY_THRESHOLD_MS));
    long writePeriodMs =
        Math.max(
            10L,
            config
                .getOptionalValue(PREFIX + "write-period-ms", Long.class)
                .orElse(DEFAULT_WRITE_PERIOD_MS));
    int writeBatchSize =
        Math.max(
            1,
            config
                .getOptionalValue(PREFIX + "write-batch-size", Integer.class)
                .orElse(DEFAULT_WRITE_BATCH_SIZE));
    boolean workerEnabled =
        config.getOptionalValue(PREFIX + "worker-enabled", Boolean.class).orElse(true);

    return new TracingConfig(
        maxPendingSessions,
        maxPendingRecords,
        maxEventsPerSession,
        Duration.ofMillis(slowQueryThresholdMs),
        Duration.ofMillis(writePeriodMs),
        writeBatchSize,
        workerEnabled);
  }
}
