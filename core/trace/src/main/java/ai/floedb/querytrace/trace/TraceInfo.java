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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * What a primary session hands to remote work so it can open a secondary session under the same
 * session id.
 */
public record TraceInfo(UUID sessionId, TraceType type, Set<TraceProp> props) {
  public TraceInfo {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(type, "type");
    props = secondaryProps(props);
  }

  private static Set<TraceProp> secondaryProps(Set<TraceProp> props) {
    EnumSet<TraceProp> copy = EnumSet.noneOf(TraceProp.class);
    if (props != null) {
      copy.addAll(props);
    }
    copy.remove(TraceProp.PRIMARY);
    return Set.copyOf(copy);
  }
}
