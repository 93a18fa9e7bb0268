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

/**
 * Service-wide cap on trace records that have been admitted but not yet written or dropped.
 *
 * <p>Shared by every session of a process. Event records are admitted only while there is room
 * ({@link #tryAcquire}); a primary session's own session record is always accounted ({@link
 * #consume}) even when that pushes the count past the cap.
 */
public final class RecordBudget {
  private final long max;
  private final AtomicLong pending = new AtomicLong();

  public RecordBudget(long max) {
    if (max < 0) {
      throw new IllegalArgumentException("max must be >= 0");
    }
    this.max = max;
  }

  public boolean tryAcquire(int units) {
    requirePositive(units);
    while (true) {
      long current = pending.get();
      if (current + units > max) {
        return false;
      }
      if (pending.compareAndSet(current, current + units)) {
        return true;
      }
    }
  }

  public void consume(int units) {
    requirePositive(units);
    pending.addAndGet(units);
  }

  public void release(long units) {
    if (units <= 0) {
      return;
    }
    pending.updateAndGet(current -> Math.max(0, current - units));
  }

  public long pending() {
    return pending.get();
  }

  public long available() {
    return Math.max(0, max - pending.get());
  }

  public long max() {
    return max;
  }

  private static void requirePositive(int units) {
    if (units <= 0) {
      throw new IllegalArgumentException("units must be > 0");
    }
  }
}
