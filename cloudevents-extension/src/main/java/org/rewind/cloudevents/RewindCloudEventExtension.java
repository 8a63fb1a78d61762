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

package org.rewind.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that adds the extensions required by Rewind. These are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #AGGREGATE_ID}</td><td>The id of the aggregate that the event belongs to</td></tr>
 *     <tr><td>{@value #AGGREGATE_VERSION}</td><td>The version of the event in the aggregate's event log, assigned when the event is appended</td></tr>
 * </table>
 */
public class RewindCloudEventExtension implements CloudEventExtension {
    public static final String AGGREGATE_ID = "aggregateid";
    public static final String AGGREGATE_VERSION = "aggregateversion";

    static final Set<String> KEYS = Set.of(AGGREGATE_ID, AGGREGATE_VERSION);
    private String aggregateId;
    private long aggregateVersion;

    public RewindCloudEventExtension(String aggregateId, long aggregateVersion) {
        Objects.requireNonNull(aggregateId, "AggregateId cannot be null");
        if (aggregateVersion < 1) {
            throw new IllegalArgumentException("Aggregate version cannot be less than 1");
        }
        this.aggregateId = aggregateId;
        this.aggregateVersion = aggregateVersion;
    }

    public static RewindCloudEventExtension rewind(String aggregateId, long aggregateVersion) {
        return new RewindCloudEventExtension(aggregateId, aggregateVersion);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object aggregateId = extensions.getExtension(AGGREGATE_ID);
        if (aggregateId != null) {
            this.aggregateId = aggregateId.toString();
        }

        Object aggregateVersion = extensions.getExtension(AGGREGATE_VERSION);
        if (aggregateVersion instanceof Number) {
            this.aggregateVersion = ((Number) aggregateVersion).longValue();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        if (AGGREGATE_ID.equals(key)) {
            return this.aggregateId;
        } else if (AGGREGATE_VERSION.equals(key)) {
            return this.aggregateVersion;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
