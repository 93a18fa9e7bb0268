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

/**
 * Process-wide collaborator every {@link TraceSession} reports to.
 *
 * <p>A session holds a reference to its service but never owns it; the service must outlive every
 * session it created.
 */
public interface TracingService {

  /** Called exactly once per session, when the session is closed. */
  void endSession(TraceSession session);

  /**
   * Takes ownership of a finished session's records for eventual persistence.
   *
   * @param writeNow the caller asked for the records to be written without waiting for the next
   *     periodic flush
   */
  void writeSessionRecords(RecordBuffer records, boolean writeNow);

  TracingStats stats();

  TracePolicy policy();

  RecordBudget budget();

  Clock clock();

  /** Upper bound on event records a single session may collect. */
  int maxEventsPerSession();
}
