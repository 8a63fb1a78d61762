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

package org.rewind.application.service.blocking;

import org.rewind.reconstruction.EmptyHistoryException;
import org.rewind.reconstruction.RecordedEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Reconstructs aggregates from their events in an event log.
 *
 * @param <S> The aggregate state
 * @param <E> The domain event type
 */
public interface AggregateQueries<S, E> {

    /**
     * @return The current state of the aggregate, or empty if its events never created it
     * @throws EmptyHistoryException If the aggregate has no events
     */
    Optional<S> reconstructCurrent(String aggregateId);

    /**
     * Reconstruct the aggregate as it was when {@code version} was its latest version. Events with a higher version,
     * rollbacks included, are disregarded.
     *
     * @throws EmptyHistoryException If the aggregate has no events
     */
    Optional<S> reconstructToVersion(String aggregateId, long version);

    /**
     * Reconstruct the aggregate as it was at {@code timestamp}. Events recorded after {@code timestamp}, rollbacks included,
     * are disregarded.
     *
     * @throws EmptyHistoryException If the aggregate has no events
     */
    Optional<S> reconstructToTimestamp(String aggregateId, Instant timestamp);

    /**
     * @return The versions of the aggregate that have been undone by rollbacks, empty if the aggregate has no events
     */
    SortedSet<Long> skippedVersions(String aggregateId);

    /**
     * @return All events of the aggregate sorted by version, rollbacks included
     */
    List<RecordedEvent<E>> events(String aggregateId);

    /**
     * @return The current state of all aggregates in the event log. Aggregates that cannot be reconstructed are left out.
     */
    List<S> reconstructAll();
}
