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

import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.RollbackTarget;
import org.rewind.reconstruction.SkippedVersionCalculator;

import java.util.List;
import java.util.SortedSet;

import static java.util.Objects.requireNonNull;

/**
 * Rejects rollbacks that would make versions undone by an earlier rollback visible again. A version target is checked
 * as is, a timestamp target by the last version it keeps (see {@link SkippedVersionCalculator#effectiveVersion(RollbackTarget, List)}).
 */
public class RollbackTargetValidator {

    private final AggregateQueries<?, ?> aggregateQueries;

    public RollbackTargetValidator(AggregateQueries<?, ?> aggregateQueries) {
        requireNonNull(aggregateQueries, AggregateQueries.class.getSimpleName() + " cannot be null");
        this.aggregateQueries = aggregateQueries;
    }

    /**
     * @throws InvalidRollbackTargetException If {@code target} resolves to a skipped version
     */
    public void validate(String aggregateId, RollbackTarget target) {
        validate(aggregateId, target, aggregateQueries.events(aggregateId));
    }

    /**
     * Validate {@code target} against events that the caller has already read, for example the events that a command
     * is about to act on.
     *
     * @throws InvalidRollbackTargetException If {@code target} resolves to a version that is skipped in {@code events}
     */
    public static <E> void validate(String aggregateId, RollbackTarget target, List<RecordedEvent<E>> events) {
        requireNonNull(target, RollbackTarget.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        SortedSet<Long> skippedVersions = SkippedVersionCalculator.skippedVersions(events);
        long effectiveVersion = SkippedVersionCalculator.effectiveVersion(target, events);
        if (skippedVersions.contains(effectiveVersion)) {
            throw new InvalidRollbackTargetException(aggregateId, effectiveVersion, skippedVersions);
        }
    }
}
