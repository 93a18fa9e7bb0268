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

import java.net.InetAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Trace state of one request (primary session) or of one piece of remote work done on behalf of a
 * request (secondary session).
 *
 * <p>A session moves {@link State#INACTIVE} → {@link State#FOREGROUND} on {@link #begin} and
 * {@link State#FOREGROUND} → {@link State#BACKGROUND} on the first of {@link
 * #stopForegroundAndWrite()} or {@link #close()}. While in the foreground it collects events and
 * query parameters. On the move to the background it decides, exactly once, whether its records
 * are handed to the {@link TracingService} for writing or dropped.
 *
 * <p>Only a primary session consumes service budget for its session record and renders query
 * parameters into it. A secondary session must be finalized by its own {@link #close()}.
 *
 * <p>A session is driven by the thread that owns the traced request and does no locking.
 */
public final class TraceSession implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(TraceSession.class);

  /** Lifecycle state. Transitions are one-way. */
  public enum State {
    /** Created but never begun. Finalizing an inactive session does nothing. */
    INACTIVE,

    /** Collecting events and parameters. */
    FOREGROUND,

    /** Finalized: records were handed off or dropped. */
    BACKGROUND
  }

  private final UUID sessionId;
  private final TraceType type;
  private final Set<TraceProp> props;
  private final TracingService tracingService;
  private final RecordBuffer records;

  private ParameterSet params;
  private State state = State.INACTIVE;
  private Instant start;
  private boolean closed;

  // ----------------------------------------------------------------------
  //  Construction
  // ----------------------------------------------------------------------

  /** Creates a session with a fresh id; it is primary when {@code props} has {@code PRIMARY}. */
  public TraceSession(TracingService tracingService, TraceType type, Set<TraceProp> props) {
    this(tracingService, UUID.randomUUID(), type, props, null);
  }

  /** Creates a secondary session that shares the id of the session described by {@code info}. */
  public TraceSession(TracingService tracingService, TraceInfo info) {
    this(
        tracingService,
        Objects.requireNonNull(info, "info").sessionId(),
        info.type(),
        info.props(),
        null);
  }

  TraceSession(
      TracingService tracingService,
      UUID sessionId,
      TraceType type,
      Set<TraceProp> props,
      RecordBuffer records) {
    this.tracingService = Objects.requireNonNull(tracingService, "tracingService");
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.type = Objects.requireNonNull(type, "type");
    this.props = copyProps(props);
    this.records =
        records != null ? records : new SessionRecords(sessionId, tracingService.budget());
  }

  // ----------------------------------------------------------------------
  //  Lifecycle
  // ----------------------------------------------------------------------

  /**
   * Starts collecting. A primary session also stamps its session record with the request, the
   * client and the start time.
   *
   * @throws IllegalStateException if the session was already begun
   */
  public void begin(String request, InetAddress client) {
    Objects.requireNonNull(request, "request");
    if (state != State.INACTIVE) {
      throw new IllegalStateException("session " + sessionId + " is already " + state);
    }

    start = tracingService.clock().instant();
    if (isPrimary()) {
      SessionRecord sessionRecord = records.sessionRecord();
      sessionRecord.setRequest(request);
      sessionRecord.setClient(client);
      sessionRecord.setCommand(type);
      sessionRecord.setStartedAt(start);
    }
    state = State.FOREGROUND;
  }

  public void begin() {
    begin("", null);
  }

  /**
   * Moves the session to the background and hands its records to the service or drops them.
   *
   * <p>Only the first call after {@link #begin} has any effect; later calls and calls on an
   * inactive session return immediately. Never throws: a failure while rendering the parameters
   * is counted in {@link TracingStats#traceErrors()} and all records of the session are dropped.
   */
  public void stopForegroundAndWrite() {
    if (state != State.FOREGROUND) {
      return;
    }

    Duration elapsed = elapsed();
    records.setSlowQueryLogged(tracingService.policy().shouldLogSlowQuery(this, elapsed));

    if (isPrimary()) {
      // Counts against the service budget, not against the per-session event limit.
      records.consumeFromBudget();
      records.sessionRecord().setElapsed(elapsed);

      // A partially rendered parameter map is never written; the whole buffer is dropped.
      if (shouldWriteRecords()) {
        try {
          buildParametersMap();
        } catch (RuntimeException | OutOfMemoryError e) {
          tracingService.stats().incrementTraceErrors();
          records.dropRecords();
          LOG.debugf(e, "%s: failed to render session parameters, records dropped", sessionId);
        }
      }
    }

    state = State.BACKGROUND;

    LOG.tracef("%s: Current records count is %d", sessionId, records.size());

    if (shouldWriteRecords()) {
      tracingService.writeSessionRecords(records, writeOnClose());
    } else {
      records.dropRecords();
    }
  }

  /**
   * Finalizes the session if needed and reports it ended to the service. Idempotent.
   *
   * <p>A secondary session is expected to still be in the foreground here; finding it already in
   * the background is logged as an error and otherwise ignored.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    if (!isPrimary() && state == State.BACKGROUND) {
      LOG.errorf("Secondary session is in a background state! session_id: %s", sessionId);
    }

    stopForegroundAndWrite();
    tracingService.endSession(this);

    LOG.tracef("%s: destructing", sessionId);
  }

  // ----------------------------------------------------------------------
  //  Events
  // ----------------------------------------------------------------------

  /**
   * Appends an event while the session is in the foreground. Events past the per-session limit or
   * refused by the service budget are counted as dropped.
   */
  public void trace(String message) {
    Objects.requireNonNull(message, "message");
    if (!isCollectingEvents()) {
      return;
    }

    if (records.events().size() >= tracingService.maxEventsPerSession()) {
      tracingService.stats().incrementDroppedRecords();
      return;
    }

    Instant now = tracingService.clock().instant();
    long micros = Math.max(0, Duration.between(start, now).toNanos() / 1_000);
    EventRecord event = new EventRecord(message, micros, Thread.currentThread().getName(), now);
    if (!records.tryAppendEvent(event)) {
      tracingService.stats().incrementDroppedRecords();
    }
  }

  /** Formats with {@link String#format} only when the event would be collected. */
  public void tracef(String format, Object... args) {
    if (isCollectingEvents()) {
      trace(String.format(format, args));
    }
  }

  private boolean isCollectingEvents() {
    return state == State.FOREGROUND && !props.contains(TraceProp.IGNORE_EVENTS);
  }

  // ----------------------------------------------------------------------
  //  Query parameters
  // ----------------------------------------------------------------------

  public void setBatchlogEndpoints(Set<InetAddress> endpoints) {
    params().setBatchlogEndpoints(endpoints);
  }

  public void setConsistencyLevel(ConsistencyLevel level) {
    params().setConsistencyLevel(level);
  }

  /** Stores the serial consistency level only when one is present. */
  public void setOptionalSerialConsistencyLevel(Optional<ConsistencyLevel> level) {
    params().setOptionalSerialConsistencyLevel(level);
  }

  /** Stores the page size only when it is positive. */
  public void setPageSize(int pageSize) {
    params().setPageSize(pageSize);
  }

  public void addQuery(String query) {
    params().addQuery(query);
  }

  public void setUserTimestamp(long timestamp) {
    params().setUserTimestamp(timestamp);
  }

  /** Parameters recorded so far; empty if no setter was ever called. */
  public Optional<ParameterSet> parameterSet() {
    return Optional.ofNullable(params);
  }

  private ParameterSet params() {
    if (params == null) {
      params = new ParameterSet();
    }
    return params;
  }

  private void buildParametersMap() {
    if (params == null) {
      return;
    }
    params.renderInto(records.sessionRecord());
  }

  // ----------------------------------------------------------------------
  //  Accessors
  // ----------------------------------------------------------------------

  public UUID sessionId() {
    return sessionId;
  }

  public TraceType type() {
    return type;
  }

  public Set<TraceProp> props() {
    return props;
  }

  public State state() {
    return state;
  }

  public boolean isPrimary() {
    return props.contains(TraceProp.PRIMARY);
  }

  public boolean logSlowQuery() {
    return props.contains(TraceProp.LOG_SLOW_QUERY);
  }

  public boolean fullTracing() {
    return props.contains(TraceProp.FULL_TRACING);
  }

  public boolean writeOnClose() {
    return props.contains(TraceProp.WRITE_ON_CLOSE);
  }

  public boolean shouldWriteRecords() {
    return tracingService.policy().shouldWriteRecords(this);
  }

  public RecordBuffer records() {
    return records;
  }

  /** Propagation info for secondary sessions opened on behalf of this one. */
  public TraceInfo traceInfo() {
    return new TraceInfo(sessionId, type, props);
  }

  /** Time since {@link #begin}; zero while inactive. */
  public Duration elapsed() {
    if (start == null) {
      return Duration.ZERO;
    }
    Duration elapsed = Duration.between(start, tracingService.clock().instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }

  private static Set<TraceProp> copyProps(Set<TraceProp> props) {
    EnumSet<TraceProp> copy = EnumSet.noneOf(TraceProp.class);
    if (props != null) {
      copy.addAll(props);
    }
    return Set.copyOf(copy);
  }

  @Override
  public String toString() {
    return "TraceSession{"
        + "sessionId="
        + sessionId
        + ", type="
        + type
        + ", props="
        + props
        + ", state="
        + state
        + '}';
  }
}
