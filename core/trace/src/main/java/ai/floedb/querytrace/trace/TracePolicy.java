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

/** Decides whether a finished session is slow and whether its records are persisted. */
public interface TracePolicy {

  boolean shouldLogSlowQuery(TraceSession session, Duration elapsed);

  boolean shouldWriteRecords(TraceSession session);

  /**
   * Policy driven by the session properties: a session is slow when it carries {@link
   * TraceProp#LOG_SLOW_QUERY} and ran longer than {@code slowQueryThreshold}; it is written when it
   * carries {@link TraceProp#FULL_TRACING} or was found slow.
   */
  static TracePolicy defaults(Duration slowQueryThreshold) {
    return new DefaultTracePolicy(slowQueryThreshold);
  }
}
