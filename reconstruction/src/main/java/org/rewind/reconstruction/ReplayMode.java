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
 * How an {@link AggregateReplayer} treats events that arrive in a state where they make no sense, such as a mutation
 * before the aggregate was created or a second creation.
 */
public enum ReplayMode {
    /**
     * Skip or apply such events and report a {@link ReplayWarning}.
     */
    LENIENT,
    /**
     * Fail the replay with an {@link IntegrityException}.
     */
    STRICT
}
