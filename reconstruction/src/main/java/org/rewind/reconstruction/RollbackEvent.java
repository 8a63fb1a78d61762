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
 * Implemented by the domain event that records a rollback of an aggregate. A rollback event never deletes anything, it
 * narrows the history that is visible when the aggregate is reconstructed.
 */
public interface RollbackEvent {

    /**
     * @return The point in the aggregate's history that this rollback returns to
     */
    RollbackTarget rollbackTarget();
}
