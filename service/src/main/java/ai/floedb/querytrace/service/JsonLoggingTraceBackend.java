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

import ai.floedb.querytrace.trace.EventRecord;
import ai.floedb.querytrace.trace.RecordBuffer;
import ai.floedb.querytrace.trace.SessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/** {@link TraceBackend} that logs every session as one JSON document at INFO. */
public final class JsonLoggingTraceBackend implements TraceBackend {
  private static final Logger LOG = Logger.getLogger(JsonLoggingTraceBackend.class);

  private final ObjectMapper mapper;

  public JsonLoggingTraceBackend() {
    this(new ObjectMapper());
  }

  public JsonLoggingTraceBackend(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public void write(List<RecordBuffer> sessions) throws TraceBackendException {
    List<String> lines = new ArrayList<>(sessions.size());
    for (RecordBuffer records : sessions) {
      lines.add(render(records));
    }
    for (String line : lines) {
      LOG.info(line);
    }
  }

  String render(RecordBuffer records) throws TraceBackendException {
    try {
      return mapper.writeValueAsString(toJson(records));
    } catch (JsonProcessingException e) {
      throw new TraceBackendException(
          "Unable to render trace session " + records.sessionId(), e);
    }
  }

  ObjectNode toJson(RecordBuffer records) {
    ObjectNode root = mapper.createObjectNode();
    root.put("session_id", records.sessionId().toString());
    root.put("slow_query", records.isSlowQueryLogged());

    SessionRecord session = records.sessionRecord();
    if (session.isReady()) {
      ObjectNode sessionNode = root.putObject("session");
      sessionNode.put("command", session.command().name());
      sessionNode.put("request", session.request());
      session
          .client()
          .map(InetAddress::getHostAddress)
          .ifPresent(c -> sessionNode.put("client", c));
      session.startedAt().ifPresent(t -> sessionNode.put("started_at", t.toString()));
      session.elapsed().ifPresent(e -> sessionNode.put("duration_us", e.toNanos() / 1_000));
      ObjectNode parameters = sessionNode.putObject("parameters");
      session.parameters().forEach(parameters::put);
    }

    ArrayNode events = root.putArray("events");
    for (EventRecord event : records.events()) {
      ObjectNode node = events.addObject();
      node.put("activity", event.message());
      node.put("source_elapsed", event.elapsedMicros());
      node.put("thread", event.thread());
      node.put("event_time", event.timestamp().toString());
    }
    return root;
  }
}
