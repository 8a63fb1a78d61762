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

package org.rewind.application.converter;

import io.cloudevents.CloudEvent;
import org.rewind.cloudevents.RewindExtensionGetter;
import org.rewind.reconstruction.IntegrityException;
import org.rewind.reconstruction.RecordedEvent;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A cloud event converter interface that is used by Rewind application services
 * to convert to and from domain events.
 *
 * @param <T> The type of your domain event
 */
public interface CloudEventConverter<T> {

    /**
     * Convert a stream of domain events into a stream of cloud events.
     *
     * @param events The domain events to convert to cloud events
     * @return A stream of cloud events.
     */
    default Stream<CloudEvent> toCloudEvents(Stream<T> events) {
        Stream<T> stream = events == null ? Stream.empty() : events;
        return stream.map(this::toCloudEvent);
    }

    /**
     * The returned cloud event does not need the rewind extension, the event log adds it on append.
     */
    CloudEvent toCloudEvent(T domainEvent);

    /**
     * Decode only the data of the cloud event. Use {@link #toRecordedEvent(CloudEvent)} to also get its position in the log.
     *
     * @throws IntegrityException If the cloud event cannot be decoded
     */
    T toDomainEvent(CloudEvent cloudEvent);

    /**
     * Convert a cloud event read from an event log into a {@link RecordedEvent}. The aggregate id and version are read from
     * the rewind extension that the log adds when the event is appended.
     *
     * @param cloudEvent The cloud event to convert
     * @return The recorded event
     * @throws IntegrityException If the cloud event lacks the rewind extension or a time, or if the data cannot be decoded
     */
    default RecordedEvent<T> toRecordedEvent(CloudEvent cloudEvent) {
        final String aggregateId;
        final long version;
        try {
            aggregateId = RewindExtensionGetter.getAggregateId(cloudEvent);
            version = RewindExtensionGetter.getAggregateVersion(cloudEvent);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Cloud event " + cloudEvent.getId() + " was not read from an event log: " + e.getMessage(), e);
        }
        OffsetDateTime time = cloudEvent.getTime();
        if (time == null) {
            throw new IntegrityException("Cloud event " + cloudEvent.getId() + " of aggregate " + aggregateId + " has no time");
        }
        return new RecordedEvent<>(cloudEvent.getId(), aggregateId, cloudEvent.getType(), version, time.toInstant(), toDomainEvent(cloudEvent));
    }

    /**
     * @see #toRecordedEvent(CloudEvent)
     */
    default List<RecordedEvent<T>> toRecordedEvents(List<CloudEvent> cloudEvents) {
        return cloudEvents.stream().map(this::toRecordedEvent).collect(Collectors.toList());
    }
}
