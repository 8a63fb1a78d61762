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

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Reconstructs aggregate state from an aggregate's events by sequencing them, resolving rollbacks and replaying the
 * visible history. Instances hold no mutable state and can be shared between threads.
 *
 * @param <S> The aggregate state
 * @param <E> The domain event type
 */
public class Reconstruction<S, E> {

    private final AggregateReplayer<S, E> replayer;

    public Reconstruction(AggregateReplayer<S, E> replayer) {
        requireNonNull(replayer, AggregateReplayer.class.getSimpleName() + " cannot be null");
        this.replayer = replayer;
    }

    /**
     * @param events All events of a single aggregate, in any order
     * @return The current state, or {@code null} if {@code events} is empty or never created the aggregate
     */
    public @Nullable S reconstruct(List<RecordedEvent<E>> events) {
        requireNonNull(events, "Events cannot be null");
        if (events.isEmpty()) {
            return null;
        }
        return replayer.replay(RollbackResolver.resolve(events));
    }

    /**
     * Reconstruct the state as it was when {@code version} was the latest version of the aggregate. Events with a higher
     * version, rollbacks included, are discarded before the history is resolved.
     */
    public @Nullable S reconstructToVersion(List<RecordedEvent<E>> events, long version) {
        return reconstruct(retain(events, e -> e.version() <= version));
    }

    /**
     * Reconstruct the state as it was at {@code timestamp}. Events recorded after {@code timestamp}, rollbacks included,
     * are discarded before the history is resolved.
     */
    public @Nullable S reconstructToTimestamp(List<RecordedEvent<E>> events, Instant timestamp) {
        requireNonNull(timestamp, "Timestamp cannot be null");
        return reconstruct(retain(events, e -> !e.timestamp().isAfter(timestamp)));
    }

    /**
     * @see SkippedVersionCalculator#skippedVersions(List)
     */
    public SortedSet<Long> skippedVersions(List<RecordedEvent<E>> events) {
        return SkippedVersionCalculator.skippedVersions(EventSequencer.sequence(events));
    }

    private static <E> List<RecordedEvent<E>> retain(List<RecordedEvent<E>> events, Predicate<RecordedEvent<E>> predicate) {
        requireNonNull(events, "Events cannot be null");
        return events.stream().filter(predicate).collect(Collectors.toList());
    }
}
