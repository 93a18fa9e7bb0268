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

import java.util.List;
import java.util.UUID;

/**
 * Records collected by one trace session.
 *
 * <p>A buffer is owned by its session until the session hands it to {@link
 * TracingService#writeSessionRecords}. It is either written as a whole or dropped as a whole.
 */
public interface RecordBuffer {

  UUID sessionId();

  SessionRecord sessionRecord();

  /** Events appended so far, in append order. */
  List<EventRecord> events();

  /**
   * Appends an event if the service budget has room for it.
   *
   * @return {@code false} when the budget refused the event
   */
  boolean tryAppendEvent(EventRecord event);

  /** Accounts the session record against the service budget. Never refused. */
  void consumeFromBudget();

  /** Budget units currently held by this buffer. */
  long consumedBudget();

  /** Returns every held budget unit to the service. Idempotent. */
  void releaseBudget();

  /** Discards all events and the session record contents and releases the budget. Idempotent. */
  void dropRecords();

  /** Number of records that would be written: events plus the session record once it is ready. */
  int size();

  boolean isSlowQueryLogged();

  void setSlowQueryLogged(boolean slow);
}
