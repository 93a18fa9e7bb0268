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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SessionRecordsTest {
  private final RecordBudget budget = new RecordBudget(3);
  private final SessionRecords records = new SessionRecords(UUID.randomUUID(), budget);

  private static EventRecord event(String message) {
    return new EventRecord(message, 0, "main", Instant.EPOCH);
  }

  @Test
  void size_countsEventsAndReadySessionRecord() {
    records.tryAppendEvent(event("a"));
    records.tryAppendEvent(event("b"));
    assertThat(records.size()).isEqualTo(2);

    records.sessionRecord().setElapsed(Duration.ofMillis(1));
    assertThat(records.size()).isEqualTo(3);
  }

  @Test
  void tryAppendEvent_refusedWhenBudgetIsFull() {
    assertThat(records.tryAppendEvent(event("a"))).isTrue();
    assertThat(records.tryAppendEvent(event("b"))).isTrue();
    assertThat(records.tryAppendEvent(event("c"))).isTrue();
    assertThat(records.tryAppendEvent(event("d"))).isFalse();

    assertThat(records.events()).extracting(EventRecord::message).containsExactly("a", "b", "c");
    assertThat(records.consumedBudget()).isEqualTo(3);
    assertThat(budget.available()).isZero();
  }

  @Test
  void consumeFromBudget_isNeverRefused() {
    records.tryAppendEvent(event("a"));
    records.tryAppendEvent(event("b"));
    records.tryAppendEvent(event("c"));

    records.consumeFromBudget();

    assertThat(budget.pending()).isEqualTo(4);
    assertThat(records.consumedBudget()).isEqualTo(4);
  }

  @Test
  void dropRecords_clearsEverythingAndIsIdempotent() {
    records.tryAppendEvent(event("a"));
    records.consumeFromBudget();
    records.sessionRecord().setElapsed(Duration.ofMillis(2));
    records.sessionRecord().putParameter("query", "SELECT 1");

    records.dropRecords();
    records.dropRecords();

    assertThat(records.size()).isZero();
    assertThat(records.events()).isEmpty();
    assertThat(records.sessionRecord().parameters()).isEmpty();
    assertThat(records.sessionRecord().isReady()).isFalse();
    assertThat(records.consumedBudget()).isZero();
    assertThat(budget.pending()).isZero();
  }

  @Test
  void releaseBudget_returnsUnitsOnlyOnce() {
    records.tryAppendEvent(event("a"));
    records.consumeFromBudget();

    records.releaseBudget();
    records.releaseBudget();

    assertThat(budget.pending()).isZero();
    assertThat(records.events()).hasSize(1);
  }

  @Test
  void events_viewIsReadOnly() {
    records.tryAppendEvent(event("a"));

    assertThatThrownBy(() -> records.events().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
