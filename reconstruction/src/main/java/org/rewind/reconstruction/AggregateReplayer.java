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

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Folds the visible history of an aggregate into its state. Implementations must be deterministic and side-effect free,
 * the same list of events always yields the same state. Warnings go to a {@link ReplayObserver}.
 *
 * @param <S> The aggregate state
 * @param <E> The domain event type
 */
@FunctionalInterface
public interface AggregateReplayer<S, E> {

    /**
     * @param events Business events sorted by version, rollbacks already resolved
     * @return The state after applying all events, or {@code null} if the events never created the aggregate
     */
    @Nullable
    S replay(List<RecordedEvent<E>> events);
}
