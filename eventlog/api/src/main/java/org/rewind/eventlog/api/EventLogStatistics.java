/*
 * Copyright 2023 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rewind.eventlog.api;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Statistics of an {@link EventLog}.
 *
 * @param totalEvents     The number of events in the log
 * @param totalAggregates The number of distinct aggregates in the log
 * @param eventTypes      Number of events per cloud event type
 */
public record EventLogStatistics(long totalEvents, long totalAggregates, Map<String, Long> eventTypes) {
    public EventLogStatistics {
        requireNonNull(eventTypes, "Event types cannot be null");
        eventTypes = Map.copyOf(eventTypes);
    }
}
