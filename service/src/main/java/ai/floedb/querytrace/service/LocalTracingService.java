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

package ai.floedb.querytrace.service;

import ai.floedb.querytrace.trace.RecordBudget;
import ai.floedb.querytrace.trace.RecordBuffer;
import ai.floedb.querytrace.trace.TraceInfo;
import ai.floedb.querytrace.trace.TracePolicy;
import ai.floedb.querytrace.trace.TraceProp;
import ai.floedb.querytrace.trace.TraceSession;
import ai.floedb.querytrace.trace.TraceType;
import ai.floedb.querytrace.trace.TracingService;
import ai.floedb.querytrace.trace.TracingStats;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/**
 * Process-wide {@link TracingService}.
 *
 * <p>Admits sessions up to {@link TracingConfig#maxPendingSessions()}, queues the records of
 * finished sessions and hands them to a {@link TraceBackend} in batches: immediately when a session
 * asks for it or the queue reaches {@link TracingConfig#writeBatchSize()}, otherwise from a
 * background worker every {@link TracingConfig#writePeriod()}. Budget held by a batch is released
 * after the backend call whether or not it succeeded. While the worker runs, immediate flushes are
 * handed to it so that backend I/O never runs on the thread that closes a session.
 *
 * <p>Only sessions obtained from {@link #createSession} count against the active limit.
 *
 * <p>Thread-safe. Sessions themselves are confined to the thread that drives them.
 */
public final class LocalTracingService implements TracingService, AutoCloseable {
  private static final Logger LOG = Logger.getLogger(LocalTracingService.class);

  private final TracingConfig config;
  private final TraceBackend backend;
  private final Clock clock;
  private final TracePolicy policy;
  private final RecordBudget budget;
  private final TracingStats stats = new TracingStats();
  private final AtomicInteger activeSessions = new AtomicInteger();
  private final Set<TraceSession> admitted = ConcurrentHashMap.newKeySet();

  private final List<RecordBuffer> pending = new ArrayList<>();
  private final Object flushLock = new Object();

  private volatile ScheduledExecutorService worker;
  private volatile boolean stopping;

  public LocalTracingService(TracingConfig config, TraceBackend backend) {
    this(config, backend, Clock.systemUTC());
  }

  public LocalTracingService(TracingConfig config, TraceBackend backend, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.policy = TracePolicy.defaults(config.slowQueryThreshold());
    this.budget = new RecordBudget(config.maxPendingRecords());
  }

  public static LocalTracingService fromConfig(Config config, TraceBackend backend) {
    return new LocalTracingService(TracingConfig.fromConfig(config), backend);
  }

  /** Starts the periodic flush worker if the configuration enables it. */
  public synchronized void start() {
    if (worker != null || stopping || !config.workerEnabled()) {
      return;
    }
    long periodMs = config.writePeriod().toMillis();
    worker =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "querytrace-flush");
              t.setDaemon(true);
              return t;
            });
    worker.scheduleWithFixedDelay(this::flushSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
    LOG.infof(
        "Trace flush worker started: period=%dms batch=%d maxSessions=%d maxRecords=%d",
        periodMs,
        config.writeBatchSize(),
        config.maxPendingSessions(),
        config.maxPendingRecords());
  }

  // ----------------------------------------------------------------------
  //  Sessions
  // ----------------------------------------------------------------------

  /**
   * Opens a session for a new request.
   *
   * @return empty when too many sessions are active or the service is stopping
   */
  public Optional<TraceSession> createSession(TraceType type, Set<TraceProp> props) {
    if (!admitSession()) {
      return Optional.empty();
    }
    return Optional.of(track(new TraceSession(this, type, props)));
  }

  /** Opens a secondary session for work done on behalf of a remote primary session. */
  public Optional<TraceSession> createSession(TraceInfo info) {
    Objects.requireNonNull(info, "info");
    if (!admitSession()) {
      return Optional.empty();
    }
    return Optional.of(track(new TraceSession(this, info)));
  }

  private TraceSession track(TraceSession session) {
    admitted.add(session);
    return session;
  }

  private boolean admitSession() {
    if (stopping) {
      stats.incrementDroppedSessions();
      return false;
    }
    while (true) {
      int current = activeSessions.get();
      if (current >= config.maxPendingSessions()) {
        stats.incrementDroppedSessions();
        LOG.debugf("Too many active trace sessions (%d), dropping new session", current);
        return false;
      }
      if (activeSessions.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  @Override
  public void endSession(TraceSession session) {
    if (session == null || !admitted.remove(session)) {
      LOG.debugf("Ignoring end of a session this service did not admit: %s", session);
      return;
    }
    activeSessions.updateAndGet(current -> Math.max(0, current - 1));
  }

  // ----------------------------------------------------------------------
  //  Writes
  // ----------------------------------------------------------------------

  @Override
  public void writeSessionRecords(RecordBuffer records, boolean writeNow) {
    Objects.requireNonNull(records, "records");
    int queued;
    synchronized (pending) {
      pending.add(records);
      queued = pending.size();
    }
    if (stopping || writeNow || queued >= config.writeBatchSize()) {
      requestFlush();
    }
  }

  private void requestFlush() {
    ScheduledExecutorService current = worker;
    if (current != null) {
      try {
        current.execute(this::flushSafely);
        return;
      } catch (RejectedExecutionException e) {
        LOG.debugf("Trace flush worker is shut down, flushing on the caller");
      }
    }
    flushSafely();
  }

  /** Writes every queued session on the calling thread. Backend exceptions are counted. */
  public void flush() {
    synchronized (flushLock) {
      List<RecordBuffer> batch;
      synchronized (pending) {
        if (pending.isEmpty()) {
          return;
        }
        batch = new ArrayList<>(pending);
        pending.clear();
      }
      stats.incrementFlushes();

      List<RecordBuffer> nonEmpty = new ArrayList<>(batch.size());
      long recordCount = 0;
      for (RecordBuffer records : batch) {
        int size = records.size();
        if (size > 0) {
          nonEmpty.add(records);
          recordCount += size;
        }
      }

      try {
        if (!nonEmpty.isEmpty()) {
          backend.write(nonEmpty);
          stats.recordWrite(nonEmpty.size(), recordCount);
        }
      } catch (RuntimeException e) {
        stats.incrementTraceErrors();
        LOG.warnf(
            e, "Failed to write %d trace sessions (%d records)", nonEmpty.size(), recordCount);
        nonEmpty.forEach(RecordBuffer::dropRecords);
      } finally {
        batch.forEach(RecordBuffer::releaseBudget);
      }
    }
  }

  private void flushSafely() {
    try {
      flush();
    } catch (Throwable t) {
      stats.incrementTraceErrors();
      LOG.warnf(t, "Trace flush loop failed");
    }
  }

  /** Stops the worker and writes whatever is still queued. */
  @Override
  public void close() {
    ScheduledExecutorService current;
    synchronized (this) {
      stopping = true;
      current = worker;
      worker = null;
    }
    if (current != null) {
      current.shutdownNow();
    }
    flush();
  }

  // ----------------------------------------------------------------------
  //  Accessors
  // ----------------------------------------------------------------------

  public int activeSessions() {
    return activeSessions.get();
  }

  public int pendingWrites() {
    synchronized (pending) {
      return pending.size();
    }
  }

  public TracingConfig config() {
    return config;
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
    return config.maxEventsPerSession();
  }
}
