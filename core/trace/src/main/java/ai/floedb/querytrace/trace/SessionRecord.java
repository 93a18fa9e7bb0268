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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary record of one session: what ran, for whom, for how long, and with which parameters.
 *
 * <p>The record counts as a persisted record only once the owning primary session stored its
 * elapsed time ({@link #isReady()}).
 */
public final class SessionRecord {
  private final Map<String, String> parameters;

  private String request = "";
  private InetAddress client;
  private TraceType command = TraceType.NONE;
  private Instant startedAt;
  private Duration elapsed;

  public SessionRecord() {
    this(new LinkedHashMap<>());
  }

  SessionRecord(Map<String, String> parameters) {
    this.parameters = Objects.requireNonNull(parameters, "parameters");
  }

  /** Adds a rendered parameter; the first value stored for a key wins. */
  void putParameter(String key, String value) {
    parameters.putIfAbsent(
        Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  void clear() {
    parameters.clear();
    elapsed = null;
  }

  public Map<String, String> parameters() {
    return Collections.unmodifiableMap(parameters);
  }

  public String request() {
    return request;
  }

  void setRequest(String request) {
    this.request = Objects.requireNonNull(request, "request");
  }

  public Optional<InetAddress> client() {
    return Optional.ofNullable(client);
  }

  void setClient(InetAddress client) {
    this.client = client;
  }

  public TraceType command() {
    return command;
  }

  void setCommand(TraceType command) {
    this.command = Objects.requireNonNull(command, "command");
  }

  public Optional<Instant> startedAt() {
    return Optional.ofNullable(startedAt);
  }

  void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Optional<Duration> elapsed() {
    return Optional.ofNullable(elapsed);
  }

  void setElapsed(Duration elapsed) {
    this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
  }

  public boolean isReady() {
    return elapsed != null;
  }
}
