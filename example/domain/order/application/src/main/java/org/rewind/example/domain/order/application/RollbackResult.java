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

package org.rewind.example.domain.order.application;

import org.rewind.example.domain.order.model.Order;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;

/**
 * The outcome of rolling back an order.
 *
 * @param previousState   The order before the rollback
 * @param newState        The order after the rollback
 * @param rollbackEvent   The event that recorded the rollback
 * @param rollbackVersion The version that the rollback event was recorded as
 * @param eventsUndone    The number of events after the rollback point
 */
public record RollbackResult(Order previousState, Order newState, OrderRolledBack rollbackEvent, long rollbackVersion, int eventsUndone) {
}
