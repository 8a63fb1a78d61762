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

import org.jspecify.annotations.Nullable;
import org.rewind.application.converter.CloudEventConverter;
import org.rewind.application.service.blocking.AggregateQueries;
import org.rewind.application.service.blocking.ApplicationService;
import org.rewind.application.service.blocking.InvalidRollbackTargetException;
import org.rewind.application.service.blocking.RollbackTargetValidator;
import org.rewind.application.service.blocking.generic.GenericAggregateQueries;
import org.rewind.application.service.blocking.generic.GenericApplicationService;
import org.rewind.eventlog.api.EventLog;
import org.rewind.eventlog.api.WriteResult;
import org.rewind.example.domain.order.model.Order;
import org.rewind.example.domain.order.model.OrderItem;
import org.rewind.example.domain.order.model.OrderReplayer;
import org.rewind.example.domain.order.model.OrderStatus;
import org.rewind.example.domain.order.model.Orders;
import org.rewind.example.domain.order.model.domainevents.OrderEvent;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;
import org.rewind.reconstruction.EmptyHistoryException;
import org.rewind.reconstruction.Reconstruction;
import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.RollbackTarget;
import org.rewind.reconstruction.RollbackTarget.ToTimestamp;
import org.rewind.reconstruction.RollbackTarget.ToVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Handles the commands and queries of orders stored in an {@link EventLog}.
 */
public class OrderApplicationService {
    private static final Logger log = LoggerFactory.getLogger(OrderApplicationService.class);

    private final ApplicationService<OrderEvent> applicationService;
    private final AggregateQueries<Order, OrderEvent> queries;
    private final Reconstruction<Order, OrderEvent> reconstruction;
    private final Supplier<String> orderIdGenerator;

    /**
     * Create an order application service that uses a lenient {@link OrderReplayer} and random order ids.
     */
    public OrderApplicationService(EventLog eventLog, Clock clock) {
        this(eventLog, OrderCloudEvents.cloudEventConverter(OrderCloudEvents.objectMapper(), clock), new OrderReplayer(), () -> UUID.randomUUID().toString());
    }

    public OrderApplicationService(EventLog eventLog, CloudEventConverter<OrderEvent> cloudEventConverter, OrderReplayer replayer, Supplier<String> orderIdGenerator) {
        requireNonNull(eventLog, EventLog.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(replayer, OrderReplayer.class.getSimpleName() + " cannot be null");
        requireNonNull(orderIdGenerator, "orderIdGenerator cannot be null");
        this.reconstruction = new Reconstruction<>(replayer);
        this.applicationService = new GenericApplicationService<>(eventLog, cloudEventConverter);
        this.queries = new GenericAggregateQueries<>(eventLog, cloudEventConverter, reconstruction);
        this.orderIdGenerator = orderIdGenerator;
    }

    /**
     * @return The id of the new order
     */
    public String createOrder(String customerId, List<OrderItem> items) {
        String orderId = orderIdGenerator.get();
        applicationService.execute(orderId, events -> Orders.createOrder(events, orderId, customerId, items));
        log.info("Created order {} for customer {}", orderId, customerId);
        return orderId;
    }

    public void updateStatus(String orderId, OrderStatus newStatus) {
        executeOnOrder(orderId, order -> Orders.updateStatus(order, newStatus));
    }

    public void addItem(String orderId, OrderItem item) {
        executeOnOrder(orderId, order -> Orders.addItem(order, item));
    }

    public void removeItem(String orderId, String productId) {
        executeOnOrder(orderId, order -> Orders.removeItem(order, productId));
    }

    /**
     * Roll back the order to the state it had at {@code version}. The rollback is recorded as a new event, nothing is deleted.
     *
     * @throws InvalidRollbackTargetException If {@code version} was undone by an earlier rollback
     */
    public RollbackResult rollbackToVersion(String orderId, long version, @Nullable String reason) {
        if (version < 1) {
            throw new IllegalArgumentException("Version to roll back to must be a positive number");
        }
        return rollback(orderId, RollbackTarget.toVersion(version), reason);
    }

    /**
     * Roll back the order to the state it had at {@code timestamp}. The rollback is recorded as a new event, nothing is deleted.
     *
     * @throws InvalidRollbackTargetException If the last event recorded at or before {@code timestamp} was undone by an earlier rollback
     */
    public RollbackResult rollbackToTimestamp(String orderId, Instant timestamp, @Nullable String reason) {
        requireNonNull(timestamp, "Timestamp cannot be null");
        return rollback(orderId, RollbackTarget.toTimestamp(timestamp), reason);
    }

    public Order getOrder(String orderId) {
        return queries.reconstructCurrent(orderId).orElseThrow(() -> orderDoesNotExist(orderId));
    }

    public Order getOrderAtVersion(String orderId, long version) {
        return queries.reconstructToVersion(orderId, version).orElseThrow(() -> orderDoesNotExist(orderId));
    }

    public Order getOrderAtTimestamp(String orderId, Instant timestamp) {
        return queries.reconstructToTimestamp(orderId, timestamp).orElseThrow(() -> orderDoesNotExist(orderId));
    }

    public SortedSet<Long> getSkippedVersions(String orderId) {
        return queries.skippedVersions(orderId);
    }

    public List<RecordedEvent<OrderEvent>> getOrderEvents(String orderId) {
        return queries.events(orderId);
    }

    public List<Order> getAllOrders() {
        return queries.reconstructAll();
    }

    private RollbackResult rollback(String orderId, RollbackTarget target, @Nullable String reason) {
        AtomicReference<Order> previousState = new AtomicReference<>();
        AtomicReference<Order> newState = new AtomicReference<>();
        AtomicReference<OrderRolledBack> rollbackEvent = new AtomicReference<>();

        WriteResult writeResult = applicationService.execute(orderId, events -> {
            Order current = requireOrder(orderId, events);
            RollbackTargetValidator.validate(orderId, target, events);

            long eventsToKeep = events.stream().filter(atOrBefore(target)).count();
            if (eventsToKeep == 0) {
                throw new IllegalArgumentException("No events found for order " + orderId + " at rollback point " + target);
            }
            int eventsUndone = (int) (events.size() - eventsToKeep);
            Order rolledBack = reconstructWithPendingRollback(orderId, events, new OrderRolledBack(orderId, null, target, eventsUndone, null, null, reason));
            if (rolledBack == null) {
                throw new IllegalStateException("Order " + orderId + " did not exist at rollback point " + target);
            }

            List<OrderEvent> newEvents = Orders.rollBack(current, rolledBack, target, eventsUndone, reason);
            previousState.set(current);
            newState.set(rolledBack);
            rollbackEvent.set((OrderRolledBack) newEvents.get(0));
            return newEvents;
        });

        OrderRolledBack event = rollbackEvent.get();
        log.info("Rolled back order {} to {}, undoing {} event(s). Rollback recorded as version {}", orderId, target, event.eventsUndone(), writeResult.getAggregateVersion());
        return new RollbackResult(previousState.get(), newState.get(), event, writeResult.getAggregateVersion(), event.eventsUndone());
    }

    /**
     * Replays {@code events} as if {@code rollback} had been appended after them, which gives the state that the order
     * will have once the rollback is written.
     */
    private @Nullable Order reconstructWithPendingRollback(String orderId, List<RecordedEvent<OrderEvent>> events, OrderRolledBack rollback) {
        RecordedEvent<OrderEvent> latest = events.get(events.size() - 1);
        List<RecordedEvent<OrderEvent>> eventsWithRollback = new ArrayList<>(events);
        eventsWithRollback.add(new RecordedEvent<>(UUID.randomUUID().toString(), orderId, OrderRolledBack.class.getSimpleName(),
                latest.version() + 1, latest.timestamp(), rollback));
        return reconstruction.reconstruct(eventsWithRollback);
    }

    private void executeOnOrder(String orderId, Function<Order, List<OrderEvent>> functionThatCallsDomainModel) {
        applicationService.execute(orderId, events -> functionThatCallsDomainModel.apply(requireOrder(orderId, events)));
    }

    private Order requireOrder(String orderId, List<RecordedEvent<OrderEvent>> events) {
        if (events.isEmpty()) {
            throw new EmptyHistoryException(orderId);
        }
        Order order = reconstruction.reconstruct(events);
        if (order == null) {
            throw orderDoesNotExist(orderId);
        }
        return order;
    }

    private static Predicate<RecordedEvent<OrderEvent>> atOrBefore(RollbackTarget target) {
        if (target instanceof ToVersion toVersion) {
            return e -> e.version() <= toVersion.version();
        }
        Instant timestamp = ((ToTimestamp) target).timestamp();
        return e -> !e.timestamp().isAfter(timestamp);
    }

    private static IllegalStateException orderDoesNotExist(String orderId) {
        return new IllegalStateException("Order " + orderId + " does not exist");
    }
}
