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

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * The point that a {@link RollbackEvent} returns to, either a version or an instant in time.
 */
public sealed interface RollbackTarget {

    static RollbackTarget toVersion(long version) {
        return new ToVersion(version);
    }

    static RollbackTarget toTimestamp(Instant timestamp) {
        return new ToTimestamp(timestamp);
    }

    record ToVersion(long version) implements RollbackTarget {
        public ToVersion {
            if (version < 0) {
                throw new IllegalArgumentException("Rollback version cannot be negative");
            }
        }

        @Override
        public String toString() {
            return "Version " + version;
        }
    }

    record ToTimestamp(Instant timestamp) implements RollbackTarget {
        public ToTimestamp {
            requireNonNull(timestamp, "Rollback timestamp cannot be null");
        }

        @Override
        public String toString() {
            return "Timestamp " + timestamp;
        }
    }
}
