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

import java.time.Instant;
import java.util.Objects;

/**
 * One trace event appended to a session while it is collecting.
 *
 * @param message rendered event text
 * @param elapsedMicros microseconds since the owning session began
 * @param thread name of the thread that emitted the event
 * @param timestamp wall-clock time of the event
 */
public record EventRecord(String message, long elapsedMicros, String thread, Instant timestamp) {
  public EventRecord {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(thread, "thread");
    Objects.requireNonNull(timestamp, "timestamp");
    if (elapsedMicros < 0) {
      throw new IllegalArgumentException("elapsedMicros must be >= 0");
    }
  }
}
