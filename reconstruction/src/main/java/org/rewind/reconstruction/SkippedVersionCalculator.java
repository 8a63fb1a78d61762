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

import org.rewind.reconstruction.RollbackTarget.ToTimestamp;
import org.rewind.reconstruction.RollbackTarget.ToVersion;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Calculates the versions of an aggregate that have been undone by rollbacks. A skipped version can never be the
 * target of a later rollback. Every rollback in the history contributes, not only the latest one, so the set only grows
 * as rollbacks are appended.
 */
public class SkippedVersionCalculator {

    private SkippedVersionCalculator() {
    }

    /**
     * @param events The events of a single aggregate, in any order
     * @param <E>    The domain event type
     * @return The skipped versions in ascending order
     */
    public static <E> SortedSet<Long> skippedVersions(List<RecordedEvent<E>> events) {
        requireNonNull(events, "Events cannot be null");
        SortedSet<Long> skipped = new TreeSet<>();
        for (RecordedEvent<E> event : events) {
            if (event.event() instanceof RollbackEvent rollbackEvent) {
                long from = event.version() - 1;
                long to = effectiveVersion(rollbackEvent.rollbackTarget(), events);
                for (long version = to + 1; version <= from; version++) {
                    skipped.add(version);
                }
            }
        }
        return Collections.unmodifiableSortedSet(skipped);
    }

    /**
     * The last version that a rollback to {@code target} keeps. For a version target this is the version itself, for a
     * timestamp target it is the highest version of an ordinary event recorded at or before the timestamp, or {@code 0}
     * if there is none.
     *
     * @param target The rollback target
     * @param events The events of a single aggregate, in any order
     * @param <E>    The domain event type
     */
    public static <E> long effectiveVersion(RollbackTarget target, List<RecordedEvent<E>> events) {
        requireNonNull(target, RollbackTarget.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        if (target instanceof ToVersion toVersion) {
            return toVersion.version();
        }
        return highestVersionAtOrBefore(((ToTimestamp) target).timestamp(), events);
    }

    private static <E> long highestVersionAtOrBefore(Instant rollbackDate, List<RecordedEvent<E>> events) {
        return events.stream()
                .filter(e -> !e.isRollback())
                .filter(e -> !e.timestamp().isAfter(rollbackDate))
                .mapToLong(RecordedEvent::version)
                .max()
                .orElse(0);
    }
}
