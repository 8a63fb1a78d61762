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

import org.jspecify.annotations.Nullable;
import org.rewind.example.domain.order.model.domainevents.OrderCreated;
import org.rewind.example.domain.order.model.domainevents.OrderEvent;
import org.rewind.example.domain.order.model.domainevents.OrderItemAdded;
import org.rewind.example.domain.order.model.domainevents.OrderItemRemoved;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;
import org.rewind.example.domain.order.model.domainevents.OrderStatusUpdated;
import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.RollbackTarget;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The decisions that can be made about an order. Each function validates the request against the current state and
 * returns the events to record.
 */
public class Orders {

    private Orders() {
    }

    public static List<OrderEvent> createOrder(List<RecordedEvent<OrderEvent>> events, String orderId, String customerId, List<OrderItem> items) {
        if (!events.isEmpty()) {
            throw new IllegalStateException("Order " + orderId + " already exists");
        }
        if (isBlank(customerId)) {
            throw new IllegalArgumentException("Customer ID is required");
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
        for (int i = 0; i < items.size(); i++) {
            validateItem(items.get(i), "Item " + (i + 1) + ": ");
        }

        BigDecimal totalAmount = items.stream().map(OrderItem::subtotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        return Collections.singletonList(new OrderCreated(orderId, customerId, items, OrderStatus.PENDING, totalAmount));
    }

    /**
     * @return No events if the order already has {@code newStatus}
     */
    public static List<OrderEvent> updateStatus(Order order, OrderStatus newStatus) {
        requireNonNull(newStatus, OrderStatus.class.getSimpleName() + " cannot be null");
        if (order.status() == newStatus) {
            return Collections.emptyList();
        } else if (!order.status().canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(order.id(), order.status(), newStatus);
        }
        return Collections.singletonList(new OrderStatusUpdated(order.id(), order.status(), newStatus));
    }

    /**
     * Adding a product that is already in the order increases its quantity.
     */
    public static List<OrderEvent> addItem(Order order, OrderItem item) {
        requireItemChangesAllowed(order, "add items to");
        validateItem(item, "");
        order.findItem(item.productId()).ifPresent(existing -> {
            if (existing.quantity() > Integer.MAX_VALUE - item.quantity()) {
                throw new IllegalArgumentException("Quantity of product " + item.productId() + " in order " + order.id() + " would exceed " + Integer.MAX_VALUE);
            }
        });
        return Collections.singletonList(new OrderItemAdded(order.id(), item));
    }

    public static List<OrderEvent> removeItem(Order order, String productId) {
        requireItemChangesAllowed(order, "remove items from");
        if (isBlank(productId)) {
            throw new IllegalArgumentException("Product ID is required");
        }
        if (order.findItem(productId).isEmpty()) {
            throw new OrderItemNotFoundException(order.id(), productId);
        }
        if (order.items().size() == 1) {
            throw new IllegalStateException("Cannot remove last item from order " + order.id());
        }
        return Collections.singletonList(new OrderItemRemoved(order.id(), productId));
    }

    /**
     * @param current      The order as it is now
     * @param rolledBack   The order as it was at {@code target}
     * @param eventsUndone The number of events recorded after {@code target}
     */
    public static List<OrderEvent> rollBack(Order current, Order rolledBack, RollbackTarget target, int eventsUndone, @Nullable String reason) {
        requireNonNull(target, RollbackTarget.class.getSimpleName() + " cannot be null");
        OrderRolledBack orderRolledBack = new OrderRolledBack(current.id(), target.toString(), target, eventsUndone,
                OrderSnapshot.of(current), OrderSnapshot.of(rolledBack), reason);
        return Collections.singletonList(orderRolledBack);
    }

    private static void requireItemChangesAllowed(Order order, String action) {
        if (!order.status().allowsItemChanges()) {
            throw new IllegalStateException(String.format("Cannot %s order %s since it is %s", action, order.id(), order.status()));
        }
    }

    private static void validateItem(OrderItem item, String prefix) {
        if (item == null) {
            throw new IllegalArgumentException(prefix + "Item is required");
        }
        if (isBlank(item.productId())) {
            throw new IllegalArgumentException(prefix + "Product ID is required");
        }
        if (isBlank(item.productName())) {
            throw new IllegalArgumentException(prefix + "Product name is required");
        }
        if (item.quantity() <= 0) {
            throw new IllegalArgumentException(prefix + "Quantity must be positive");
        }
        if (item.price() == null || item.price().signum() <= 0) {
            throw new IllegalArgumentException(prefix + "Price must be positive");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
