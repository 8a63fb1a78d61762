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

import org.rewind.application.converter.CloudEventConverter;
import org.rewind.application.service.blocking.AggregateQueries;
import org.rewind.eventlog.api.EventLog;
import org.rewind.reconstruction.EmptyHistoryException;
import org.rewind.reconstruction.EventSequencer;
import org.rewind.reconstruction.Reconstruction;
import org.rewind.reconstruction.ReconstructionException;
import org.rewind.reconstruction.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

import static java.util.Objects.requireNonNull;

/**
 * {@link AggregateQueries} that read events from an {@link EventLog}, decode them with a {@link CloudEventConverter} and
 * reconstruct the aggregate using a {@link Reconstruction}.
 *
 * @param <S> The aggregate state
 * @param <E> The domain event type
 */
public class GenericAggregateQueries<S, E> implements AggregateQueries<S, E> {
    private static final Logger log = LoggerFactory.getLogger(GenericAggregateQueries.class);

    private final EventLog eventLog;
    private final CloudEventConverter<E> cloudEventConverter;
    private final Reconstruction<S, E> reconstruction;

    public GenericAggregateQueries(EventLog eventLog, CloudEventConverter<E> cloudEventConverter, Reconstruction<S, E> reconstruction) {
        requireNonNull(eventLog, EventLog.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(reconstruction, Reconstruction.class.getSimpleName() + " cannot be null");
        this.eventLog = eventLog;
        this.cloudEventConverter = cloudEventConverter;
        this.reconstruction = reconstruction;
    }

    @Override
    public Optional<S> reconstructCurrent(String aggregateId) {
        return Optional.ofNullable(reconstruction.reconstruct(requireHistory(aggregateId)));
    }

    @Override
    public Optional<S> reconstructToVersion(String aggregateId, long version) {
        return Optional.ofNullable(reconstruction.reconstructToVersion(requireHistory(aggregateId), version));
    }

    @Override
    public Optional<S> reconstructToTimestamp(String aggregateId, Instant timestamp) {
        return Optional.ofNullable(reconstruction.reconstructToTimestamp(requireHistory(aggregateId), timestamp));
    }

    @Override
    public SortedSet<Long> skippedVersions(String aggregateId) {
        return reconstruction.skippedVersions(events(aggregateId));
    }

    @Override
    public List<RecordedEvent<E>> events(String aggregateId) {
        requireNonNull(aggregateId, "AggregateId cannot be null");
        return EventSequencer.sequence(cloudEventConverter.toRecordedEvents(eventLog.getEvents(aggregateId)));
    }

    @Override
    public List<S> reconstructAll() {
        List<S> aggregates = new ArrayList<>();
        for (String aggregateId : eventLog.aggregateIds()) {
            try {
                reconstructCurrent(aggregateId).ifPresent(aggregates::add);
            } catch (ReconstructionException e) {
                log.warn("Failed to reconstruct aggregate {}, leaving it out", aggregateId, e);
            }
        }
        return aggregates;
    }

    private List<RecordedEvent<E>> requireHistory(String aggregateId) {
        List<RecordedEvent<E>> events = events(aggregateId);
        if (events.isEmpty()) {
            throw new EmptyHistoryException(aggregateId);
        }
        return events;
    }
}
