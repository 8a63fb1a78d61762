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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The state of an order. An order is never changed, each method returns a new instance. The total amount is always
 * derived from the items.
 */
public final class Order {
    private final String id;
    private final String customerId;
    private final List<OrderItem> items;
    private final OrderStatus status;
    private final BigDecimal totalAmount;
    private final long version;

    private Order(String id, String customerId, List<OrderItem> items, OrderStatus status, long version) {
        this.id = requireNonNull(id, "Order id cannot be null");
        this.customerId = requireNonNull(customerId, "CustomerId cannot be null");
        this.items = Collections.unmodifiableList(new ArrayList<>(requireNonNull(items, "Items cannot be null")));
        this.status = requireNonNull(status, OrderStatus.class.getSimpleName() + " cannot be null");
        this.totalAmount = items.stream().map(OrderItem::subtotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        this.version = version;
    }

    public static Order create(String id, String customerId, List<OrderItem> items, OrderStatus status, long version) {
        return new Order(id, customerId, items, status, version);
    }

    Order withStatus(OrderStatus newStatus, long version) {
        return new Order(id, customerId, items, newStatus, version);
    }

    /**
     * Adds the item, or increases the quantity of the item with the same product id if there is one.
     */
    Order withItem(OrderItem item, long version) {
        List<OrderItem> newItems = new ArrayList<>(items.size() + 1);
        boolean merged = false;
        for (OrderItem existing : items) {
            if (existing.productId().equals(item.productId())) {
                newItems.add(existing.withQuantity(Math.addExact(existing.quantity(), item.quantity())));
                merged = true;
            } else {
                newItems.add(existing);
            }
        }
        if (!merged) {
            newItems.add(item);
        }
        return new Order(id, customerId, newItems, status, version);
    }

    Order withoutItem(String productId, long version) {
        List<OrderItem> newItems = new ArrayList<>(items);
        newItems.removeIf(item -> item.productId().equals(productId));
        return new Order(id, customerId, newItems, status, version);
    }

    public Optional<OrderItem> findItem(String productId) {
        return items.stream().filter(item -> item.productId().equals(productId)).findFirst();
    }

    public String id() {
        return id;
    }

    public String customerId() {
        return customerId;
    }

    public List<OrderItem> items() {
        return items;
    }

    public OrderStatus status() {
        return status;
    }

    public BigDecimal totalAmount() {
        return totalAmount;
    }

    /**
     * @return The version of the last event that was applied to the order
     */
    public long version() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order)) return false;
        Order order = (Order) o;
        return version == order.version && Objects.equals(id, order.id) && Objects.equals(customerId, order.customerId) && Objects.equals(items, order.items) && status == order.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, customerId, items, status, version);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Order.class.getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("customerId='" + customerId + "'")
                .add("items=" + items)
                .add("status=" + status)
                .add("totalAmount=" + totalAmount)
                .add("version=" + version)
                .toString();
    }
}
