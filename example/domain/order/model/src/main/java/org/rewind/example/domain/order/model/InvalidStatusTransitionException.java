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

package org.rewind.example.domain.order.model;

public class InvalidStatusTransitionException extends IllegalStateException {
    public final String orderId;
    public final OrderStatus from;
    public final OrderStatus to;

    public InvalidStatusTransitionException(String orderId, OrderStatus from, OrderStatus to) {
        super(String.format("Cannot transition order %s from %s to %s", orderId, from, to));
        this.orderId = orderId;
        this.from = from;
        this.to = to;
    }
}
