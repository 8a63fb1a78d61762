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

import static java.util.Objects.requireNonNull;

/**
 * A non-fatal problem found while replaying an aggregate. The replay continues after a warning.
 */
public record ReplayWarning(Kind kind, String aggregateId, long version, String type, String message) {

    public enum Kind {
        UNKNOWN_EVENT_TYPE,
        EVENT_BEFORE_CREATION,
        DUPLICATE_CREATION
    }

    public ReplayWarning {
        requireNonNull(kind, "Kind cannot be null");
        requireNonNull(aggregateId, "AggregateId cannot be null");
        requireNonNull(type, "Type cannot be null");
        requireNonNull(message, "Message cannot be null");
    }

    public static ReplayWarning of(Kind kind, RecordedEvent<?> event, String message) {
        return new ReplayWarning(kind, event.aggregateId(), event.version(), event.type(), message);
    }
}
