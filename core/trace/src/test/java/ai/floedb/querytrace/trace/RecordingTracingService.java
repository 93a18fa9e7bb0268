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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** In-memory {@link TracingService} that remembers what sessions handed to it. */
final class RecordingTracingService implements TracingService {
  final List<RecordBuffer> written = new ArrayList<>();
  final List<Boolean> writeNowFlags = new ArrayList<>();
  final List<TraceSession> ended = new ArrayList<>();
  final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

  private final TracingStats stats = new TracingStats();
  private final RecordBudget budget;
  private TracePolicy policy = TracePolicy.defaults(Duration.ofMillis(100));
  private int maxEventsPerSession = 1000;

  RecordingTracingService() {
    this(10_000);
  }

  RecordingTracingService(long maxPendingRecords) {
    this.budget = new RecordBudget(maxPendingRecords);
  }

  RecordingTracingService withPolicy(TracePolicy policy) {
    this.policy = policy;
    return this;
  }

  RecordingTracingService withMaxEventsPerSession(int max) {
    this.maxEventsPerSession = max;
    return this;
  }

  @Override
  public void endSession(TraceSession session) {
    ended.add(session);
  }

  @Override
  public void writeSessionRecords(RecordBuffer records, boolean writeNow) {
    written.add(records);
    writeNowFlags.add(writeNow);
  }

  @Override
  public TracingStats stats() {
    return stats;
  }

  @Override
  public TracePolicy policy() {
    return policy;
  }

  @Override
  public RecordBudget budget() {
    return budget;
  }

  @Override
  public Clock clock() {
    return clock;
  }

  @Override
  public int maxEventsPerSession() {
    return maxEventsPerSession;
  }
}
