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
import org.rewind.example.domain.order.model.domainevents.UnrecognizedOrderEvent;
import org.rewind.reconstruction.AggregateReplayer;
import org.rewind.reconstruction.IntegrityException;
import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.ReplayMode;
import org.rewind.reconstruction.ReplayObserver;
import org.rewind.reconstruction.ReplayWarning;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.rewind.reconstruction.ReplayWarning.Kind.DUPLICATE_CREATION;
import static org.rewind.reconstruction.ReplayWarning.Kind.EVENT_BEFORE_CREATION;
import static org.rewind.reconstruction.ReplayWarning.Kind.UNKNOWN_EVENT_TYPE;

/**
 * Replays the visible history of an order into an {@link Order}.
 * <p>
 * In {@link ReplayMode#LENIENT} mode a mutation before the order was created is ignored and a second {@link OrderCreated}
 * replaces the order, both are reported to the {@link ReplayObserver}. In {@link ReplayMode#STRICT} mode both throw an
 * {@link IntegrityException}. Unrecognized events are always skipped with a warning.
 * </p>
 */
public class OrderReplayer implements AggregateReplayer<Order, OrderEvent> {

    private final ReplayMode mode;
    private final ReplayObserver observer;

    /**
     * Create a lenient replayer that logs warnings.
     */
    public OrderReplayer() {
        this(ReplayMode.LENIENT, ReplayObserver.logging());
    }

    public OrderReplayer(ReplayMode mode, ReplayObserver observer) {
        requireNonNull(mode, ReplayMode.class.getSimpleName() + " cannot be null");
        requireNonNull(observer, ReplayObserver.class.getSimpleName() + " cannot be null");
        this.mode = mode;
        this.observer = observer;
    }

    @Override
    public @Nullable Order replay(List<RecordedEvent<OrderEvent>> events) {
        Order order = null;
        for (RecordedEvent<OrderEvent> event : events) {
            order = apply(order, event);
        }
        return order;
    }

    private @Nullable Order apply(@Nullable Order order, RecordedEvent<OrderEvent> recordedEvent) {
        OrderEvent event = recordedEvent.event();
        long version = recordedEvent.version();
        if (event instanceof OrderCreated created) {
            if (order != null) {
                violation(recordedEvent, DUPLICATE_CREATION, "Order " + order.id() + " was created twice, replacing it");
            }
            return Order.create(created.orderId(), created.customerId(), created.items(), created.status(), version);
        } else if (event instanceof UnrecognizedOrderEvent unrecognized) {
            observer.onWarning(ReplayWarning.of(UNKNOWN_EVENT_TYPE, recordedEvent, "Skipping unrecognized event type " + unrecognized.type()));
            return order;
        } else if (event instanceof OrderRolledBack) {
            // Rollbacks are resolved before replay
            return order;
        }

        if (order == null) {
            violation(recordedEvent, EVENT_BEFORE_CREATION, "Ignoring " + recordedEvent.type() + " since the order has not been created");
            return null;
        }

        if (event instanceof OrderStatusUpdated statusUpdated) {
            return order.withStatus(statusUpdated.newStatus(), version);
        } else if (event instanceof OrderItemAdded itemAdded) {
            return order.withItem(itemAdded.item(), version);
        } else if (event instanceof OrderItemRemoved itemRemoved) {
            return order.withoutItem(itemRemoved.productId(), version);
        }
        throw new IllegalStateException("Unhandled order event " + event.getClass().getName());
    }

    private void violation(RecordedEvent<OrderEvent> recordedEvent, ReplayWarning.Kind kind, String message) {
        if (mode == ReplayMode.STRICT) {
            throw new IntegrityException(String.format("%s (aggregateId=%s, version=%d)", message, recordedEvent.aggregateId(), recordedEvent.version()));
        }
        observer.onWarning(ReplayWarning.of(kind, recordedEvent, message));
    }
}
