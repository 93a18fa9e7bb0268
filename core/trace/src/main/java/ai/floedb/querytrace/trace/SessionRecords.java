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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Default {@link RecordBuffer} backed by a list of events and a {@link SessionRecord}. */
public final class SessionRecords implements RecordBuffer {
  private final UUID sessionId;
  private final RecordBudget budget;
  private final SessionRecord sessionRecord;
  private final List<EventRecord> events = new ArrayList<>();

  private long consumedBudget;
  private boolean slowQueryLogged;

  public SessionRecords(UUID sessionId, RecordBudget budget) {
    this(sessionId, budget, new SessionRecord());
  }

  SessionRecords(UUID sessionId, RecordBudget budget, SessionRecord sessionRecord) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.budget = Objects.requireNonNull(budget, "budget");
    this.sessionRecord = Objects.requireNonNull(sessionRecord, "sessionRecord");
  }

  @Override
  public UUID sessionId() {
    return sessionId;
  }

  @Override
  public SessionRecord sessionRecord() {
    return sessionRecord;
  }

  @Override
  public List<EventRecord> events() {
    return Collections.unmodifiableList(events);
  }

  @Override
  public boolean tryAppendEvent(EventRecord event) {
    Objects.requireNonNull(event, "event");
    if (!budget.tryAcquire(1)) {
      return false;
    }
    consumedBudget++;
    events.add(event);
    return true;
  }

  @Override
  public void consumeFromBudget() {
    budget.consume(1);
    consumedBudget++;
  }

  @Override
  public long consumedBudget() {
    return consumedBudget;
  }

  @Override
  public void releaseBudget() {
    long units = consumedBudget;
    consumedBudget = 0;
    budget.release(units);
  }

  @Override
  public void dropRecords() {
    events.clear();
    sessionRecord.clear();
    releaseBudget();
  }

  @Override
  public int size() {
    return events.size() + (sessionRecord.isReady() ? 1 : 0);
  }

  @Override
  public boolean isSlowQueryLogged() {
    return slowQueryLogged;
  }

  @Override
  public void setSlowQueryLogged(boolean slow) {
    this.slowQueryLogged = slow;
  }
}
