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

import java.time.Duration;
import java.util.Objects;

final class DefaultTracePolicy implements TracePolicy {
  private final Duration slowQueryThreshold;

  DefaultTracePolicy(Duration slowQueryThreshold) {
    Objects.requireNonNull(slowQueryThreshold, "slowQueryThreshold");
    if (slowQueryThreshold.isNegative()) {
      throw new IllegalArgumentException("slowQueryThreshold must be >= 0");
    }
    this.slowQueryThreshold = slowQueryThreshold;
  }

  @Override
  public boolean shouldLogSlowQuery(TraceSession session, Duration elapsed) {
    return session.logSlowQuery() && elapsed.compareTo(slowQueryThreshold) > 0;
  }

  @Override
  public boolean shouldWriteRecords(TraceSession session) {
    return session.fullTracing() || session.records().isSlowQueryLogged();
  }

  @Override
  public String toString() {
    return "DefaultTracePolicy{slowQueryThreshold=" + slowQueryThreshold + "}";
  }
}
