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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Puts the events of one aggregate in version order. The event log makes no promise about the order in which it returns
 * events so everything downstream starts from here.
 */
public class EventSequencer {

    private EventSequencer() {
    }

    /**
     * Sort events by ascending version.
     *
     * @param events The events of a single aggregate, in any order
     * @param <E>    The domain event type
     * @return An unmodifiable list of the events sorted by version
     * @throws IntegrityException If a version is not positive, if two events share a version or if the events belong to more than one aggregate
     */
    public static <E> List<RecordedEvent<E>> sequence(List<RecordedEvent<E>> events) {
        requireNonNull(events, "Events cannot be null");
        List<RecordedEvent<E>> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(RecordedEvent::version));

        RecordedEvent<E> previous = null;
        for (RecordedEvent<E> event : sorted) {
            if (event.version() < 1) {
                throw new IntegrityException(String.format("Event %s of aggregate %s has version %d, versions must be positive", event.id(), event.aggregateId(), event.version()));
            }
            if (previous != null) {
                if (!previous.aggregateId().equals(event.aggregateId())) {
                    throw new IntegrityException(String.format("Cannot sequence events from more than one aggregate (%s and %s)", previous.aggregateId(), event.aggregateId()));
                }
                if (previous.version() == event.version()) {
                    throw new IntegrityException(String.format("Events %s and %s of aggregate %s both have version %d", previous.id(), event.id(), event.aggregateId(), event.version()));
                }
            }
            previous = event;
        }
        return Collections.unmodifiableList(sorted);
    }
}
