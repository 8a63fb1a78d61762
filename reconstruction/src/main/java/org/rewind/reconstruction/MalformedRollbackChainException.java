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

/**
 * Thrown when following a chain of nested version rollbacks takes more hops than there are rollback events in the history,
 * which means that the chain contains a cycle.
 */
public class MalformedRollbackChainException extends ReconstructionException {
    public final String aggregateId;
    public final long rollbackVersion;

    public MalformedRollbackChainException(String aggregateId, long rollbackVersion, long maxHops) {
        super(String.format("Rollback chain starting at version %d of aggregate %s did not terminate within %d hops", rollbackVersion, aggregateId, maxHops));
        this.aggregateId = aggregateId;
        this.rollbackVersion = rollbackVersion;
    }
}
