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

package org.rewind.application.service.blocking.generic;

import io.cloudevents.CloudEvent;
import org.rewind.application.converter.CloudEventConverter;
import org.rewind.application.service.blocking.ApplicationService;
import org.rewind.eventlog.api.EventLog;
import org.rewind.eventlog.api.WriteResult;
import org.rewind.reconstruction.EventSequencer;
import org.rewind.reconstruction.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A generic application service that works in many scenarios. It appends new events with a write condition on the
 * version of the aggregate that was read, so a concurrent writer makes the append fail with a
 * {@link org.rewind.eventlog.api.WriteConditionNotFulfilledException}. The write is not retried.
 *
 * @param <T> The domain event type
 */
public class GenericApplicationService<T> implements ApplicationService<T> {
    private static final Logger log = LoggerFactory.getLogger(GenericApplicationService.class);

    private final EventLog eventLog;
    private final CloudEventConverter<T> cloudEventConverter;

    /**
     * @param eventLog            The event log to use
     * @param cloudEventConverter The cloud event converter
     */
    public GenericApplicationService(EventLog eventLog, CloudEventConverter<T> cloudEventConverter) {
        if (eventLog == null) throw new IllegalArgumentException(EventLog.class.getSimpleName() + " cannot be null");
        if (cloudEventConverter == null) throw new IllegalArgumentException(CloudEventConverter.class.getSimpleName() + " cannot be null");
        this.eventLog = eventLog;
        this.cloudEventConverter = cloudEventConverter;
    }

    @Override
    public WriteResult execute(String aggregateId, Function<List<RecordedEvent<T>>, List<T>> functionThatCallsDomainModel, Consumer<List<T>> sideEffect) {
        Objects.requireNonNull(aggregateId, "AggregateId cannot be null");
        Objects.requireNonNull(functionThatCallsDomainModel, "Function that calls domain model cannot be null");

        // Read and decode all events of the aggregate
        List<RecordedEvent<T>> recordedEvents = EventSequencer.sequence(cloudEventConverter.toRecordedEvents(eventLog.getEvents(aggregateId)));
        long currentVersion = recordedEvents.isEmpty() ? 0 : recordedEvents.get(recordedEvents.size() - 1).version();

        // Call a pure function from the domain model which returns the new events
        List<T> newDomainEvents = emptyListIfNull(functionThatCallsDomainModel.apply(recordedEvents));

        Stream<CloudEvent> newEvents = cloudEventConverter.toCloudEvents(newDomainEvents.stream());
        WriteResult writeResult = eventLog.append(aggregateId, currentVersion, newEvents);
        log.debug("Appended {} event(s) to aggregate {}, version is now {}", newDomainEvents.size(), aggregateId, writeResult.getAggregateVersion());

        if (sideEffect != null) {
            sideEffect.accept(newDomainEvents);
        }
        return writeResult;
    }

    private static <T> List<T> emptyListIfNull(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
