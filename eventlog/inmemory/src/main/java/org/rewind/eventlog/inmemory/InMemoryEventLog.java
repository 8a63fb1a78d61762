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

package org.rewind.eventlog.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.rewind.cloudevents.RewindCloudEventExtension;
import org.rewind.cloudevents.RewindExtensionGetter;
import org.rewind.eventlog.api.EventLog;
import org.rewind.eventlog.api.EventLogStatistics;
import org.rewind.eventlog.api.WriteCondition;
import org.rewind.eventlog.api.WriteConditionNotFulfilledException;
import org.rewind.eventlog.api.WriteResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventLog} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes.
 */
public class InMemoryEventLog implements EventLog {

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<CloudEvent>> state = Collections.synchronizedMap(new LinkedHashMap<>());
    // Global append order, used by all()
    private final List<CloudEvent> appendOrder = Collections.synchronizedList(new ArrayList<>());

    @Override
    public List<CloudEvent> getEvents(String aggregateId) {
        requireNonNull(aggregateId, "AggregateId cannot be null");
        List<CloudEvent> events = state.get(aggregateId);
        return events == null ? Collections.emptyList() : Collections.unmodifiableList(events);
    }

    @Override
    public WriteResult append(String aggregateId, WriteCondition writeCondition, Stream<CloudEvent> events) {
        requireNonNull(aggregateId, "AggregateId cannot be null");
        requireTrue(writeCondition != null, WriteCondition.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> eventsToWrite = events.peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1)).collect(Collectors.toList());

        final AtomicReference<WriteResult> writeResult = new AtomicReference<>();
        state.compute(aggregateId, (__, currentEvents) -> {
            long currentAggregateVersion = calculateAggregateVersion(currentEvents);
            if (!writeCondition.isFulfilledBy(currentAggregateVersion)) {
                throw new WriteConditionNotFulfilledException(aggregateId, currentAggregateVersion, writeCondition, String.format("%s was not fulfilled. Expected %s but was %s.", WriteCondition.class.getSimpleName(), writeCondition, currentAggregateVersion));
            }

            List<CloudEvent> newEvents = applyRewindCloudEventExtension(eventsToWrite, aggregateId, currentAggregateVersion);
            appendOrder.addAll(newEvents);
            writeResult.set(new WriteResult(aggregateId, currentAggregateVersion + newEvents.size()));

            if (currentEvents == null) {
                return newEvents.isEmpty() ? null : newEvents;
            }
            List<CloudEvent> eventList = new ArrayList<>(currentEvents);
            eventList.addAll(newEvents);
            return eventList;
        });
        return writeResult.get();
    }

    @Override
    public boolean exists(String aggregateId) {
        return state.containsKey(aggregateId);
    }

    @Override
    public Set<String> aggregateIds() {
        synchronized (state) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(state.keySet()));
        }
    }

    @Override
    public Stream<CloudEvent> all() {
        synchronized (appendOrder) {
            return new ArrayList<>(appendOrder).stream();
        }
    }

    @Override
    public EventLogStatistics statistics() {
        synchronized (state) {
            Map<String, Long> eventTypes = state.values().stream()
                    .flatMap(List::stream)
                    .collect(Collectors.groupingBy(CloudEvent::getType, LinkedHashMap::new, Collectors.counting()));
            long totalEvents = state.values().stream().mapToLong(List::size).sum();
            return new EventLogStatistics(totalEvents, state.size(), eventTypes);
        }
    }

    private static List<CloudEvent> applyRewindCloudEventExtension(List<CloudEvent> events, String aggregateId, long aggregateVersion) {
        List<CloudEvent> newEvents = new ArrayList<>(events.size());
        long version = aggregateVersion;
        for (CloudEvent event : events) {
            version++;
            RewindCloudEventExtension extension = new RewindCloudEventExtension(aggregateId, version);
            newEvents.add(modifyCloudEvent(builder -> builder.withExtension(extension)).apply(event));
        }
        return newEvents;
    }

    private static long calculateAggregateVersion(List<CloudEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        return RewindExtensionGetter.getAggregateVersion(events.get(events.size() - 1));
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }

    private static Function<CloudEvent, CloudEvent> modifyCloudEvent(Function<CloudEventBuilder, CloudEventBuilder> fn) {
        return (cloudEvent) -> fn.apply(CloudEventBuilder.v1(cloudEvent)).build();
    }
}
