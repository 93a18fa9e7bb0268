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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Optional query-shape metadata captured by a session while it is collecting.
 *
 * <p>Every field starts unset. Endpoints, timestamp, consistency levels and page size are replaced
 * by later calls; queries accumulate in call order. Only fields that were set are rendered.
 *
 * <p>Instances are owned by a single {@link TraceSession} and are not thread-safe.
 */
public final class ParameterSet {
  static final String BATCH_ENDPOINTS = "batch_endpoints";
  static final String CONSISTENCY_LEVEL = "consistency_level";
  static final String SERIAL_CONSISTENCY_LEVEL = "serial_consistency_level";
  static final String PAGE_SIZE = "page_size";
  static final String QUERY = "query";
  static final String USER_TIMESTAMP = "user_timestamp";

  // null means "never set"
  private Set<InetAddress> batchlogEndpoints;
  private Long userTimestamp;
  private ConsistencyLevel consistencyLevel;
  private ConsistencyLevel serialConsistencyLevel;
  private Integer pageSize;

  private final List<String> queries = new ArrayList<>();

  ParameterSet() {}

  void setBatchlogEndpoints(Set<InetAddress> endpoints) {
    Objects.requireNonNull(endpoints, "endpoints");
    Set<InetAddress> copy = new LinkedHashSet<>();
    for (InetAddress endpoint : endpoints) {
      copy.add(Objects.requireNonNull(endpoint, "endpoint"));
    }
    this.batchlogEndpoints = copy;
  }

  void setConsistencyLevel(ConsistencyLevel level) {
    this.consistencyLevel = Objects.requireNonNull(level, "level");
  }

  void setOptionalSerialConsistencyLevel(Optional<ConsistencyLevel> level) {
    Objects.requireNonNull(level, "level");
    level.ifPresent(value -> this.serialConsistencyLevel = value);
  }

  void setPageSize(int pageSize) {
    if (pageSize > 0) {
      this.pageSize = pageSize;
    }
  }

  void addQuery(String query) {
    queries.add(Objects.requireNonNull(query, "query"));
  }

  void setUserTimestamp(long timestamp) {
    this.userTimestamp = timestamp;
  }

  /**
   * Writes every set parameter into {@code record}.
   *
   * <p>A single query is keyed {@code query}; a batch is keyed {@code query[0]}, {@code query[1]},
   * ... in the order the statements were added. Endpoints are sorted so the rendered list does not
   * depend on set iteration order.
   */
  void renderInto(SessionRecord record) {
    if (batchlogEndpoints != null) {
      record.putParameter(
          BATCH_ENDPOINTS,
          batchlogEndpoints.stream()
              .map(InetAddress::getHostAddress)
              .sorted()
              .map(address -> "/" + address)
              .collect(Collectors.joining(",")));
    }

    if (consistencyLevel != null) {
      record.putParameter(CONSISTENCY_LEVEL, consistencyLevel.toString());
    }

    if (serialConsistencyLevel != null) {
      record.putParameter(SERIAL_CONSISTENCY_LEVEL, serialConsistencyLevel.toString());
    }

    if (pageSize != null) {
      record.putParameter(PAGE_SIZE, Integer.toString(pageSize));
    }

    if (queries.size() == 1) {
      record.putParameter(QUERY, queries.get(0));
    } else if (queries.size() > 1) {
      // batch
      for (int i = 0; i < queries.size(); i++) {
        record.putParameter(QUERY + "[" + i + "]", queries.get(i));
      }
    }

    if (userTimestamp != null) {
      record.putParameter(USER_TIMESTAMP, Long.toString(userTimestamp));
    }
  }

  public Optional<Set<InetAddress>> batchlogEndpoints() {
    return Optional.ofNullable(batchlogEndpoints).map(Collections::unmodifiableSet);
  }

  public Optional<ConsistencyLevel> consistencyLevel() {
    return Optional.ofNullable(consistencyLevel);
  }

  public Optional<ConsistencyLevel> serialConsistencyLevel() {
    return Optional.ofNullable(serialConsistencyLevel);
  }

  public OptionalInt pageSize() {
    return pageSize == null ? OptionalInt.empty() : OptionalInt.of(pageSize);
  }

  public OptionalLong userTimestamp() {
    return userTimestamp == null ? OptionalLong.empty() : OptionalLong.of(userTimestamp);
  }

  public List<String> queries() {
    return Collections.unmodifiableList(queries);
  }
}
