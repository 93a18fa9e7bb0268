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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.querytrace.trace.ConsistencyLevel;
import ai.floedb.querytrace.trace.RecordBuffer;
import ai.floedb.querytrace.trace.TraceProp;
import ai.floedb.querytrace.trace.TraceSession;
import ai.floedb.querytrace.trace.TraceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JsonLoggingTraceBackendTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ObjectMapper mapper = new ObjectMapper();
  private final JsonLoggingTraceBackend json = new JsonLoggingTraceBackend(mapper);
  private final RecordingBackend captured = new RecordingBackend();
  private final LocalTracingService service =
      new LocalTracingService(
          new TracingConfig(10, 100, 10, Duration.ZERO, Duration.ofSeconds(60), 10, false),
          captured,
          Clock.fixed(NOW, ZoneOffset.UTC));

  @AfterEach
  void tearDown() {
    service.close();
  }

  private RecordBuffer finish(TraceSession session) {
    session.close();
    service.flush();
    List<RecordBuffer> sessions = captured.sessions();
    assertThat(sessions).hasSize(1);
    return sessions.get(0);
  }

  @Test
  void render_primarySessionWithParametersAndEvents() throws Exception {
    TraceSession session =
        service
            .createSession(TraceType.QUERY, EnumSet.of(TraceProp.PRIMARY, TraceProp.FULL_TRACING))
            .orElseThrow();
    session.begin("Execute CQL3 query", InetAddress.getByName("10.0.0.5"));
    session.setConsistencyLevel(ConsistencyLevel.ONE);
    session.setPageSize(5000);
    session.addQuery("SELECT v FROM ks.t WHERE k = ?");
    session.trace("Parsing statement");

    JsonNode root = mapper.readTree(json.render(finish(session)));

    assertThat(root.get("session_id").asText()).isEqualTo(session.sessionId().toString());
    assertThat(root.get("slow_query").asBoolean()).isFalse();

    JsonNode record = root.get("session");
    assertThat(record.get("command").asText()).isEqualTo("QUERY");
    assertThat(record.get("request").asText()).isEqualTo("Execute CQL3 query");
    assertThat(record.get("client").asText()).isEqualTo("10.0.0.5");
    assertThat(record.get("started_at").asText()).isEqualTo("2026-03-01T12:00:00Z");
    assertThat(record.get("duration_us").asLong()).isZero();
    assertThat(record.get("parameters").get("consistency_level").asText()).isEqualTo("ONE");
    assertThat(record.get("parameters").get("page_size").asText()).isEqualTo("5000");
    assertThat(record.get("parameters").get("query").asText())
        .isEqualTo("SELECT v FROM ks.t WHERE k = ?");

    JsonNode events = root.get("events");
    assertThat(events.size()).isEqualTo(1);
    assertThat(events.get(0).get("activity").asText()).isEqualTo("Parsing statement");
    assertThat(events.get(0).get("source_elapsed").asLong()).isZero();
    assertThat(events.get(0).get("thread").asText()).isEqualTo(Thread.currentThread().getName());
    assertThat(events.get(0).get("event_time").asText()).isEqualTo("2026-03-01T12:00:00Z");
  }

  @Test
  void render_secondarySessionHasNoSessionObject() throws Exception {
    TraceSession primary =
        service
            .createSession(TraceType.QUERY, EnumSet.of(TraceProp.PRIMARY, TraceProp.FULL_TRACING))
            .orElseThrow();
    TraceSession secondary = service.createSession(primary.traceInfo()).orElseThrow();
    secondary.begin();
    secondary.trace("Read 1 live rows");

    JsonNode root = mapper.readTree(json.render(finish(secondary)));

    assertThat(root.get("session_id").asText()).isEqualTo(primary.sessionId().toString());
    assertThat(root.has("session")).isFalse();
    assertThat(root.get("events").size()).isEqualTo(1);
    primary.close();
  }

  @Test
  void write_acceptsEveryBufferOfTheBatch() throws Exception {
    TraceSession session =
        service
            .createSession(TraceType.REPAIR, EnumSet.of(TraceProp.PRIMARY, TraceProp.FULL_TRACING))
            .orElseThrow();
    session.begin();
    RecordBuffer records = finish(session);

    json.write(List.of(records, records));

    assertThat(json.toJson(records).get("session").get("command").asText()).isEqualTo("REPAIR");
  }
}
