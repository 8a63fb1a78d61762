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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when a rollback is requested to a version that an earlier rollback has undone.
 */
public class InvalidRollbackTargetException extends RuntimeException {
    public final String aggregateId;
    public final long targetVersion;
    private final SortedSet<Long> skippedVersions;

    public InvalidRollbackTargetException(String aggregateId, long targetVersion, SortedSet<Long> skippedVersions) {
        super(String.format("Cannot roll back aggregate %s to version %d since it was undone by an earlier rollback. Skipped versions: %s", aggregateId, targetVersion, skippedVersions));
        this.aggregateId = aggregateId;
        this.targetVersion = targetVersion;
        this.skippedVersions = Collections.unmodifiableSortedSet(new TreeSet<>(skippedVersions));
    }

    /**
     * @return All versions of the aggregate that are skipped, not only the requested one
     */
    public SortedSet<Long> getSkippedVersions() {
        return skippedVersions;
    }
}
