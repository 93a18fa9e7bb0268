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

import ai.floedb.querytrace.trace.RecordBudget;
import ai.floedb.querytrace.trace.TracingStats;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;

/** Exposes {@link LocalTracingService} counters and gauges to Micrometer. */
public final class TracingMetrics {
  private TracingMetrics() {}

  public static void bind(MeterRegistry registry, LocalTracingService service) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(service, "service");
    TracingStats stats = service.stats();
    RecordBudget budget = service.budget();

    FunctionCounter.builder("querytrace_tracing_trace_errors", stats, TracingStats::traceErrors)
        .description("Session records dropped because rendering or writing them failed")
        .register(registry);
    FunctionCounter.builder(
            "querytrace_tracing_dropped_sessions", stats, TracingStats::droppedSessions)
        .description("Sessions refused because too many were active")
        .register(registry);
    FunctionCounter.builder(
            "querytrace_tracing_dropped_records", stats, TracingStats::droppedRecords)
        .description("Trace events refused by the record budget or the per-session limit")
        .register(registry);
    FunctionCounter.builder(
            "querytrace_tracing_written_sessions", stats, TracingStats::writtenSessions)
        .description("Sessions handed to the trace backend")
        .register(registry);
    FunctionCounter.builder(
            "querytrace_tracing_written_records", stats, TracingStats::writtenRecords)
        .description("Records handed to the trace backend")
        .register(registry);
    FunctionCounter.builder("querytrace_tracing_flushes", stats, TracingStats::flushes)
        .description("Flushes of the pending write queue")
        .register(registry);

    Gauge.builder(
            "querytrace_tracing_active_sessions", service, LocalTracingService::activeSessions)
        .description("Sessions created and not yet closed")
        .register(registry);
    Gauge.builder(
            "querytrace_tracing_pending_writes", service, LocalTracingService::pendingWrites)
        .description("Finished sessions waiting for the next flush")
        .register(registry);
    Gauge.builder("querytrace_tracing_pending_records", budget, RecordBudget::pending)
        .description("Records admitted and not yet written or dropped")
        .register(registry);
  }
}
