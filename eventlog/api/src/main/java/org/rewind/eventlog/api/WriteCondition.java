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

package org.rewind.eventlog.api;

import org.jspecify.annotations.Nullable;

/**
 * A write condition may be applied when appending events to an {@link EventLog}. If the write condition is not fulfilled the events
 * will not be written.
 */
public sealed interface WriteCondition {

    /**
     * Aggregate version doesn't matter, essentially the same as an unconditional write.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition anyAggregateVersion() {
        return AggregateVersionWriteCondition.any();
    }

    /**
     * Aggregate version must be equal to the specified {@code version} in order for the events to be written.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition aggregateVersionEq(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Expected aggregate version cannot be negative");
        }
        return new AggregateVersionWriteCondition(version);
    }

    boolean isFulfilledBy(long currentAggregateVersion);

    record AggregateVersionWriteCondition(@Nullable Long expectedVersion) implements WriteCondition {

        public static AggregateVersionWriteCondition any() {
            return new AggregateVersionWriteCondition(null);
        }

        @Override
        public boolean isFulfilledBy(long currentAggregateVersion) {
            return expectedVersion == null || expectedVersion == currentAggregateVersion;
        }

        @Override
        public String toString() {
            return expectedVersion == null ? "any" : "aggregate version to be equal to " + expectedVersion;
        }
    }
}
