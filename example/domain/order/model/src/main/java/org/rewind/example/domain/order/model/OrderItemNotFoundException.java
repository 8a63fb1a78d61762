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

public class OrderItemNotFoundException extends IllegalArgumentException {
    public final String orderId;
    public final String productId;

    public OrderItemNotFoundException(String orderId, String productId) {
        super(String.format("Product %s not found in order %s", productId, orderId));
        this.orderId = orderId;
        this.productId = productId;
    }
}
