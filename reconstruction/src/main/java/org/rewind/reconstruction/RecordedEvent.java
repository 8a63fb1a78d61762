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

package org.rewind.reconstruction;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A domain event as it was recorded in an aggregate's event log, together with the metadata assigned when it was written.
 *
 * @param id          The unique id of the event
 * @param aggregateId The id of the aggregate that the event belongs to
 * @param type        The event type, as it was named in the log
 * @param version     The position of the event in the aggregate's log, starting at {@code 1}
 * @param timestamp   The instant the event was recorded
 * @param event       The decoded domain event
 * @param <E>         The domain event type
 */
public record RecordedEvent<E>(String id, String aggregateId, String type, long version, Instant timestamp, E event) {

    public RecordedEvent {
        requireNonNull(id, "Id cannot be null");
        requireNonNull(aggregateId, "AggregateId cannot be null");
        requireNonNull(type, "Type cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
        requireNonNull(event, "Event cannot be null");
    }

    /**
     * @return {@code true} if the domain event is a {@link RollbackEvent}
     */
    public boolean isRollback() {
        return event instanceof RollbackEvent;
    }
}
