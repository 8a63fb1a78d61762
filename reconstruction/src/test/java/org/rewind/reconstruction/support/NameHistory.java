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

package org.rewind.reconstruction.support;

import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.RollbackTarget;
import org.rewind.reconstruction.support.NameEvent.NameDefined;
import org.rewind.reconstruction.support.NameEvent.NameRolledBack;
import org.rewind.reconstruction.support.NameEvent.NameWasChanged;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the history of a name aggregate. Each event is recorded one minute after the previous one, starting at
 * {@link #START}, so that timestamp order matches version order.
 */
public class NameHistory {
    public static final String AGGREGATE_ID = "name-1";
    public static final Instant START = Instant.parse("2023-01-01T10:00:00Z");

    private final List<RecordedEvent<NameEvent>> events = new ArrayList<>();

    public static NameHistory history() {
        return new NameHistory();
    }

    public static Instant timeOf(long version) {
        return START.plusSeconds(60 * (version - 1));
    }

    public NameHistory defined(String name) {
        return append(new NameDefined(name));
    }

    public NameHistory changed(String name) {
        return append(new NameWasChanged(name));
    }

    public NameHistory rolledBackToVersion(long version) {
        return append(new NameRolledBack(RollbackTarget.toVersion(version)));
    }

    public NameHistory rolledBackToTimestamp(Instant timestamp) {
        return append(new NameRolledBack(RollbackTarget.toTimestamp(timestamp)));
    }

    public List<RecordedEvent<NameEvent>> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public static RecordedEvent<NameEvent> recorded(long version, NameEvent event) {
        return new RecordedEvent<>("event-" + version, AGGREGATE_ID, event.getClass().getSimpleName(), version, timeOf(version), event);
    }

    private NameHistory append(NameEvent event) {
        events.add(recorded(events.size() + 1, event));
        return this;
    }
}
