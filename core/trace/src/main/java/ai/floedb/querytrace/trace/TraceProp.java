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

/** Behavior flags attached to a trace session when it is created. */
public enum TraceProp {
  /** Top-level session of a request; owns budget accounting and parameter capture. */
  PRIMARY,

  /** Flag the session as slow (and persist it) when it exceeds the slow query threshold. */
  LOG_SLOW_QUERY,

  /** Persist the session unconditionally. */
  FULL_TRACING,

  /** Ask the service to write the records as soon as the session is handed off. */
  WRITE_ON_CLOSE,

  /** Do not collect per-event records, only the session record. */
  IGNORE_EVENTS
}
