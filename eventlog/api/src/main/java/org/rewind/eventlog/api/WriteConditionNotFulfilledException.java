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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The write condition was not fulfilled so events have not been appended to the event log.
 * Typically this means that another writer appended to the same aggregate after it was read, which is effectively
 * the same as an optimistic locking exception.
 */
public class WriteConditionNotFulfilledException extends RuntimeException {
    public final String aggregateId;
    public final long aggregateVersion;
    public final WriteCondition writeCondition;

    public WriteConditionNotFulfilledException(String aggregateId, long aggregateVersion, WriteCondition writeCondition, String message) {
        super(message);
        this.writeCondition = writeCondition;
        this.aggregateVersion = aggregateVersion;
        this.aggregateId = aggregateId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteConditionNotFulfilledException)) return false;
        WriteConditionNotFulfilledException that = (WriteConditionNotFulfilledException) o;
        return aggregateVersion == that.aggregateVersion && Objects.equals(aggregateId, that.aggregateId) && Objects.equals(writeCondition, that.writeCondition) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, aggregateVersion, writeCondition);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteConditionNotFulfilledException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("aggregateVersion=" + aggregateVersion)
                .add("writeCondition=" + writeCondition)
                .add("message=" + super.getMessage())
                .toString();
    }
}
