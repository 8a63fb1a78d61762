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

package org.rewind.example.domain.order.model.domainevents;

import org.jspecify.annotations.Nullable;
import org.rewind.example.domain.order.model.OrderSnapshot;
import org.rewind.reconstruction.RollbackEvent;
import org.rewind.reconstruction.RollbackTarget;

import static java.util.Objects.requireNonNull;

/**
 * Records that an order was rolled back to an earlier version or point in time. Only {@link #rollbackTarget()} takes
 * part in reconstruction, the remaining fields are kept for auditing.
 *
 * @param orderId        The id of the order
 * @param rollbackPoint  A human readable description of the target, such as {@code "Version 2"}
 * @param rollbackTarget The version or instant that the order was rolled back to
 * @param eventsUndone   The number of events after the target at the time of the rollback
 * @param previousState  The order before the rollback
 * @param newState       The order after the rollback
 * @param rollbackReason Why the order was rolled back
 */
public record OrderRolledBack(String orderId, String rollbackPoint, RollbackTarget rollbackTarget, int eventsUndone,
                              @Nullable OrderSnapshot previousState, @Nullable OrderSnapshot newState,
                              @Nullable String rollbackReason) implements OrderEvent, RollbackEvent {

    public OrderRolledBack {
        requireNonNull(orderId, "OrderId cannot be null");
        requireNonNull(rollbackTarget, RollbackTarget.class.getSimpleName() + " cannot be null");
        if (rollbackPoint == null) {
            rollbackPoint = rollbackTarget.toString();
        }
    }
}
