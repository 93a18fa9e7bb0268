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
package ai.floedb.querytrace.trace;

import java.util.concurrent.atomic.AtomicLong;

/** Monotonic counters kept by a tracing service. */
public final class TracingStats {
  private final AtomicLong traceErrors = new AtomicLong();
  private final AtomicLong droppedSessions = new AtomicLong();
  private final AtomicLong droppedRecords = new AtomicLong();
  private final AtomicLong writtenSessions = new AtomicLong();
  private final AtomicLong writtenRecords = new AtomicLong();
  private final AtomicLong flushes = new AtomicLong();

  public void incrementTraceErrors() {
    traceErrors.incrementAndGet();
  }

  public void incrementDroppedSessions() {
    droppedSessions.incrementAndGet();
  }

  public void incrementDroppedRecords() {
    droppedRecords.incrementAndGet();
  }

  public void recordWrite(long sessions, long records) {
    writtenSessions.addAndGet(sessions);
    writtenRecords.addAndGet(records);
  }

  public void incrementFlushes() {
    flushes.incrementAndGet();
  }

  /** Failures while rendering or writing session records. */
  public long traceErrors() {
    return traceErrors.get();
  }

  /** Sessions refused because too many were already active. */
  public long droppedSessions() {
    return droppedSessions.get();
  }

  /** Event records refused by the service budget or the per-session event limit. */
  public long droppedRecords() {
    return droppedRecords.get();
  }

  public long writtenSessions() {
    return writtenSessions.get();
  }

  public long writtenRecords() {
    return writtenRecords.get();
  }

  public long flushes() {
    return flushes.get();
  }
}
