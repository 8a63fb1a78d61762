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
 * The result of an append to the event log.
 */
public class WriteResult {

    private final String aggregateId;
    private final long aggregateVersion;

    public WriteResult(String aggregateId, long aggregateVersion) {
        this.aggregateId = aggregateId;
        this.aggregateVersion = aggregateVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteResult)) return false;
        WriteResult that = (WriteResult) o;
        return aggregateVersion == that.aggregateVersion && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, aggregateVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("newAggregateVersion=" + aggregateVersion)
                .toString();
    }

    /**
     * @return The version of the aggregate after the write
     */
    public long getAggregateVersion() {
        return aggregateVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
