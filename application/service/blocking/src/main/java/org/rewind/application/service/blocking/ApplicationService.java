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

import org.rewind.eventlog.api.WriteResult;
import org.rewind.reconstruction.RecordedEvent;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * An application service reads the events of an aggregate, hands them to a pure function in the domain model and appends
 * the events that the function returns. The append only succeeds if no other events were written to the aggregate in between.
 *
 * @param <T> The domain event type
 */
public interface ApplicationService<T> {

    /**
     * Execute a function that is given the recorded events of an aggregate, sorted by version, and returns the new events to
     * append. Side-effects are executed synchronously <i>after</i> the new events have been written to the event log.
     *
     * @param aggregateId                  The id of the aggregate to load events from and also write the events returned from {@code functionThatCallsDomainModel} to.
     * @param functionThatCallsDomainModel A <i>pure</i> function that calls the domain model.
     * @param sideEffect                   Side-effects that are executed <i>after</i> the events have been written to the event log, may be {@code null}.
     * @return The result of the write
     * @throws org.rewind.eventlog.api.WriteConditionNotFulfilledException If another writer appended to the aggregate concurrently
     */
    WriteResult execute(String aggregateId, Function<List<RecordedEvent<T>>, List<T>> functionThatCallsDomainModel, Consumer<List<T>> sideEffect);

    /**
     * Execute a function that is given the recorded events of an aggregate and returns the new events to append.
     *
     * @see #execute(String, Function, Consumer)
     */
    default WriteResult execute(String aggregateId, Function<List<RecordedEvent<T>>, List<T>> functionThatCallsDomainModel) {
        return execute(aggregateId, functionThatCallsDomainModel, null);
    }
}
