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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Narrows an aggregate's history to the events that are visible after its latest rollback.
 * <p>
 * The visible history consists of the business events up to the rollback's effective cutoff and every business event that
 * was appended after the rollback itself was recorded. A version rollback may point at an earlier rollback event, in which
 * case the chain is followed until it reaches a business event. Rollback events are never part of the result.
 * </p>
 */
public class RollbackResolver {

    private RollbackResolver() {
    }

    /**
     * @param events The events of a single aggregate, in any order
     * @param <E>    The domain event type
     * @return The visible business events, sorted by version
     * @throws IntegrityException              If the events cannot be sequenced
     * @throws MalformedRollbackChainException If a chain of nested version rollbacks doesn't terminate
     */
    public static <E> List<RecordedEvent<E>> resolve(List<RecordedEvent<E>> events) {
        List<RecordedEvent<E>> sequenced = EventSequencer.sequence(events);

        RecordedEvent<E> latest = null;
        for (RecordedEvent<E> event : sequenced) {
            if (event.isRollback()) {
                latest = event;
            }
        }

        if (latest == null) {
            return sequenced;
        }

        long latestVersion = latest.version();
        RollbackTarget target = ((RollbackEvent) latest.event()).rollbackTarget();
        final Predicate<RecordedEvent<E>> keep;
        if (target instanceof ToVersion toVersion) {
            long effectiveCutoff = followChain(latest, toVersion.version(), sequenced);
            keep = e -> e.version() <= effectiveCutoff;
        } else {
            Instant cutoffDate = ((ToTimestamp) target).timestamp();
            keep = e -> !e.timestamp().isAfter(cutoffDate);
        }

        return sequenced.stream()
                .filter(e -> !e.isRollback())
                .filter(keep.or(e -> e.version() > latestVersion))
                .collect(Collectors.toUnmodifiableList());
    }

    private static <E> long followChain(RecordedEvent<E> latest, long target, List<RecordedEvent<E>> sequenced) {
        Map<Long, RecordedEvent<E>> eventsByVersion = new HashMap<>();
        long numberOfRollbacks = 0;
        for (RecordedEvent<E> event : sequenced) {
            eventsByVersion.put(event.version(), event);
            if (event.isRollback()) {
                numberOfRollbacks++;
            }
        }

        long cutoff = target;
        long hops = 0;
        RecordedEvent<E> atCutoff = eventsByVersion.get(cutoff);
        while (atCutoff != null
                && atCutoff.event() instanceof RollbackEvent nested
                && nested.rollbackTarget() instanceof ToVersion nestedTarget) {
            if (++hops > numberOfRollbacks) {
                throw new MalformedRollbackChainException(latest.aggregateId(), latest.version(), numberOfRollbacks);
            }
            cutoff = nestedTarget.version();
            atCutoff = eventsByVersion.get(cutoff);
        }
        return cutoff;
    }
}
