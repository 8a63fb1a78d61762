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

import io.cloudevents.CloudEvent;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * An append-only, per-aggregate log of {@link CloudEvent}s. Events are never updated or deleted once written.
 * The log assigns each appended event the next version of its aggregate, starting at {@code 1}, and records it in the
 * {@code aggregateid} and {@code aggregateversion} extensions.
 */
public interface EventLog {

    /**
     * Get all events for a particular aggregate.
     *
     * @param aggregateId The id of the aggregate
     * @return All events for the aggregate, or an empty list if the aggregate doesn't exist. Callers must not assume that the events are sorted.
     */
    List<CloudEvent> getEvents(String aggregateId);

    /**
     * Append events to an aggregate if the {@code writeCondition} is fulfilled by the aggregate's current version.
     *
     * @param aggregateId    The id of the aggregate
     * @param writeCondition The condition that must be fulfilled for the events to be written
     * @param events         The events to append
     * @return The result of the write
     * @throws WriteConditionNotFulfilledException If the write condition was not fulfilled
     */
    WriteResult append(String aggregateId, WriteCondition writeCondition, Stream<CloudEvent> events);

    /**
     * Append events to an aggregate regardless of its current version.
     *
     * @see #append(String, WriteCondition, Stream)
     */
    default WriteResult append(String aggregateId, Stream<CloudEvent> events) {
        return append(aggregateId, WriteCondition.anyAggregateVersion(), events);
    }

    /**
     * Append events to an aggregate only if its current version is {@code expectedAggregateVersion}.
     *
     * @see #append(String, WriteCondition, Stream)
     */
    default WriteResult append(String aggregateId, long expectedAggregateVersion, Stream<CloudEvent> events) {
        return append(aggregateId, WriteCondition.aggregateVersionEq(expectedAggregateVersion), events);
    }

    /**
     * @return {@code true} if at least one event has been appended to the aggregate
     */
    boolean exists(String aggregateId);

    /**
     * @return The ids of all aggregates in the log, in the order they were first written to
     */
    Set<String> aggregateIds();

    /**
     * @return All events in the log, across aggregates, in the order they were appended
     */
    Stream<CloudEvent> all();

    /**
     * @return Counts of events, aggregates and events per type
     */
    EventLogStatistics statistics();
}
