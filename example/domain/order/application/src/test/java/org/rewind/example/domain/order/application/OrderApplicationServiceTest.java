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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rewind.application.service.blocking.InvalidRollbackTargetException;
import org.rewind.eventlog.inmemory.InMemoryEventLog;
import org.rewind.example.domain.order.model.InvalidStatusTransitionException;
import org.rewind.example.domain.order.model.Order;
import org.rewind.example.domain.order.model.OrderItem;
import org.rewind.example.domain.order.model.OrderReplayer;
import org.rewind.example.domain.order.model.OrderSnapshot;
import org.rewind.example.domain.order.model.OrderStatus;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;
import org.rewind.example.domain.order.model.domainevents.UnrecognizedOrderEvent;
import org.rewind.reconstruction.EmptyHistoryException;
import org.rewind.reconstruction.IntegrityException;
import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.RollbackTarget;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("order application service")
@DisplayNameGeneration(ReplaceUnderscores.class)
public class OrderApplicationServiceTest {
    private static final Instant START = Instant.parse("2023-06-01T08:00:00Z");
    private static final OrderItem ITEM_A = new OrderItem("A", "Apple", 2, new BigDecimal("1.50"));
    private static final OrderItem ITEM_B = new OrderItem("B", "Banana", 1, new BigDecimal("0.25"));
    private static final OrderItem ITEM_C = new OrderItem("C", "Cherry", 3, new BigDecimal("4.00"));

    private InMemoryEventLog eventLog;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private OrderApplicationService orderApplicationService;

    @BeforeEach
    void create_order_application_service() {
        eventLog = new InMemoryEventLog();
        clock = new MutableClock(START);
        objectMapper = OrderCloudEvents.objectMapper();
        AtomicInteger orderNumber = new AtomicInteger();
        orderApplicationService = new OrderApplicationService(eventLog, OrderCloudEvents.cloudEventConverter(objectMapper, clock),
                new OrderReplayer(), () -> "order-" + orderNumber.incrementAndGet());
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        @Test
        void create_order_returns_the_generated_order_id() {
            // When
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A, ITEM_B));

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(orderId).isEqualTo("order-1"),
                    () -> assertThat(order.customerId()).isEqualTo("customer-1"),
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.PENDING),
                    () -> assertThat(order.totalAmount()).isEqualByComparingTo("3.25"),
                    () -> assertThat(order.version()).isEqualTo(1L)
            );
        }

        @Test
        void create_order_without_items_is_rejected_and_nothing_is_written() {
            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.createOrder("customer-1", List.of()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Order must have at least one item"),
                    () -> assertThat(eventLog.aggregateIds()).isEmpty()
            );
        }

        @Test
        void update_status_follows_the_order_life_cycle() {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));

            // When
            orderApplicationService.updateStatus(orderId, OrderStatus.CONFIRMED);
            orderApplicationService.updateStatus(orderId, OrderStatus.SHIPPED);

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.SHIPPED),
                    () -> assertThat(order.version()).isEqualTo(3L)
            );
        }

        @Test
        void invalid_status_transition_is_rejected() {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));

            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.updateStatus(orderId, OrderStatus.DELIVERED));

            // Then
            assertThat(throwable).isExactlyInstanceOf(InvalidStatusTransitionException.class)
                    .hasMessage("Cannot transition order order-1 from PENDING to DELIVERED");
        }

        @Test
        void commands_on_an_order_that_does_not_exist_are_rejected() {
            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.addItem("unknown", ITEM_B));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EmptyHistoryException.class).hasMessage("No events found for aggregate unknown");
        }

        @Test
        void add_and_remove_items() {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));

            // When
            orderApplicationService.addItem(orderId, ITEM_B);
            orderApplicationService.addItem(orderId, ITEM_C);
            orderApplicationService.removeItem(orderId, "B");

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A", "C"),
                    () -> assertThat(order.totalAmount()).isEqualByComparingTo("15.00")
            );
        }
    }

    @Nested
    @DisplayName("rollback to version")
    class RollbackToVersion {

        private String orderId;

        @BeforeEach
        void create_shipped_order() {
            orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            orderApplicationService.updateStatus(orderId, OrderStatus.CONFIRMED);
            orderApplicationService.addItem(orderId, ITEM_B);
            orderApplicationService.updateStatus(orderId, OrderStatus.SHIPPED);
        }

        @Test
        void restores_the_state_the_order_had_at_the_version() {
            // When
            RollbackResult result = orderApplicationService.rollbackToVersion(orderId, 2, "Shipped by mistake");

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A"),
                    () -> assertThat(orderApplicationService.getSkippedVersions(orderId)).containsExactly(3L, 4L),
                    () -> assertThat(result.rollbackVersion()).isEqualTo(5L),
                    () -> assertThat(result.eventsUndone()).isEqualTo(2),
                    () -> assertThat(result.previousState().status()).isEqualTo(OrderStatus.SHIPPED),
                    () -> assertThat(result.newState().status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(result.rollbackEvent().rollbackReason()).isEqualTo("Shipped by mistake"),
                    () -> assertThat(result.rollbackEvent().rollbackPoint()).isEqualTo("Version 2")
            );
        }

        @Test
        void keeps_the_undone_events_in_the_event_log() {
            // When
            orderApplicationService.rollbackToVersion(orderId, 2, null);

            // Then
            assertThat(orderApplicationService.getOrderEvents(orderId)).extracting(RecordedEvent::version).containsExactly(1L, 2L, 3L, 4L, 5L);
        }

        @Test
        void rejects_a_target_that_an_earlier_rollback_has_undone_and_lists_all_skipped_versions() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);

            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.rollbackToVersion(orderId, 3, null));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(InvalidRollbackTargetException.class)
                            .hasMessage("Cannot roll back aggregate order-1 to version 3 since it was undone by an earlier rollback. Skipped versions: [3, 4]"),
                    () -> assertThat(((InvalidRollbackTargetException) throwable).getSkippedVersions()).containsExactly(3L, 4L),
                    () -> assertThat(orderApplicationService.getOrderEvents(orderId)).hasSize(5)
            );
        }

        @Test
        void events_written_after_a_rollback_are_part_of_the_order() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);

            // When
            orderApplicationService.addItem(orderId, ITEM_C);

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A", "C"),
                    () -> assertThat(order.version()).isEqualTo(6L)
            );
        }

        @Test
        void rolling_back_to_an_earlier_rollback_follows_it_to_its_target() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);
            orderApplicationService.addItem(orderId, ITEM_C);

            // When
            RollbackResult result = orderApplicationService.rollbackToVersion(orderId, 5, null);

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A"),
                    () -> assertThat(result.rollbackVersion()).isEqualTo(7L),
                    () -> assertThat(result.eventsUndone()).isEqualTo(1),
                    () -> assertThat(orderApplicationService.getSkippedVersions(orderId)).containsExactly(3L, 4L, 6L)
            );
        }

        @Test
        void reported_state_is_the_state_the_order_has_after_the_rollback() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);
            orderApplicationService.addItem(orderId, ITEM_C);

            // When
            RollbackResult result = orderApplicationService.rollbackToVersion(orderId, 6, null);

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(result.newState()).isEqualTo(order),
                    () -> assertThat(result.rollbackEvent().newState()).isEqualTo(OrderSnapshot.of(order)),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A", "B", "C")
            );
        }

        @Test
        void version_must_be_positive() {
            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.rollbackToVersion(orderId, 0, null));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Version to roll back to must be a positive number");
        }

        @Test
        void version_after_the_latest_event_undoes_nothing() {
            // When
            RollbackResult result = orderApplicationService.rollbackToVersion(orderId, 10, null);

            // Then
            assertAll(
                    () -> assertThat(result.eventsUndone()).isZero(),
                    () -> assertThat(orderApplicationService.getOrder(orderId).status()).isEqualTo(OrderStatus.SHIPPED)
            );
        }
    }

    @Nested
    @DisplayName("rollback to timestamp")
    class RollbackToTimestamp {

        private String orderId;

        @BeforeEach
        void create_shipped_order_one_minute_per_event() {
            orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            clock.advance(Duration.ofMinutes(1));
            orderApplicationService.updateStatus(orderId, OrderStatus.CONFIRMED);
            clock.advance(Duration.ofMinutes(1));
            orderApplicationService.addItem(orderId, ITEM_B);
            clock.advance(Duration.ofMinutes(1));
            orderApplicationService.updateStatus(orderId, OrderStatus.SHIPPED);
            clock.advance(Duration.ofMinutes(1));
        }

        @Test
        void gives_the_same_state_as_rolling_back_to_the_last_version_before_the_timestamp() {
            // When
            RollbackResult result = orderApplicationService.rollbackToTimestamp(orderId, START.plusSeconds(90), null);

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A"),
                    () -> assertThat(result.eventsUndone()).isEqualTo(2),
                    () -> assertThat(result.rollbackEvent().rollbackTarget()).isEqualTo(RollbackTarget.toTimestamp(START.plusSeconds(90))),
                    () -> assertThat(orderApplicationService.getSkippedVersions(orderId)).containsExactly(3L, 4L)
            );
        }

        @Test
        void is_rejected_when_the_last_event_at_the_timestamp_was_undone_by_an_earlier_rollback() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);

            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.rollbackToTimestamp(orderId, START.plus(Duration.ofMinutes(2)), null));

            // Then
            Order order = orderApplicationService.getOrder(orderId);
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(InvalidRollbackTargetException.class)
                            .hasMessage("Cannot roll back aggregate order-1 to version 3 since it was undone by an earlier rollback. Skipped versions: [3, 4]"),
                    () -> assertThat(orderApplicationService.getOrderEvents(orderId)).hasSize(5),
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A")
            );
        }

        @Test
        void is_accepted_when_the_last_event_at_the_timestamp_precedes_the_skipped_versions() {
            // Given
            orderApplicationService.rollbackToVersion(orderId, 2, null);

            // When
            RollbackResult result = orderApplicationService.rollbackToTimestamp(orderId, START.plusSeconds(90), null);

            // Then
            assertAll(
                    () -> assertThat(result.newState().status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(result.newState().items()).extracting(OrderItem::productId).containsExactly("A"),
                    () -> assertThat(orderApplicationService.getOrder(orderId)).isEqualTo(result.newState())
            );
        }

        @Test
        void is_rejected_when_the_order_did_not_exist_at_the_timestamp() {
            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.rollbackToTimestamp(orderId, START.minusSeconds(1), null));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("No events found for order order-1 at rollback point Timestamp " + START.minusSeconds(1));
        }

        @Test
        void order_can_be_queried_at_a_timestamp_without_rolling_back() {
            // When
            Order order = orderApplicationService.getOrderAtTimestamp(orderId, START.plusSeconds(120));

            // Then
            assertAll(
                    () -> assertThat(order.items()).extracting(OrderItem::productId).containsExactly("A", "B"),
                    () -> assertThat(orderApplicationService.getOrder(orderId).status()).isEqualTo(OrderStatus.SHIPPED)
            );
        }
    }

    @Nested
    @DisplayName("stored events")
    class StoredEvents {

        @Test
        void rollback_is_stored_with_a_flattened_target() throws IOException {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            orderApplicationService.updateStatus(orderId, OrderStatus.CONFIRMED);
            orderApplicationService.rollbackToVersion(orderId, 1, "Confirmed too early");

            // When
            CloudEvent stored = eventLog.getEvents(orderId).get(2);

            // Then
            JsonNode data = objectMapper.readTree(stored.getData().toBytes());
            assertAll(
                    () -> assertThat(stored.getType()).isEqualTo("OrderRolledBack"),
                    () -> assertThat(data.get("rollbackType").asText()).isEqualTo("version"),
                    () -> assertThat(data.get("rollbackValue").asLong()).isEqualTo(1L),
                    () -> assertThat(data.get("rollbackPoint").asText()).isEqualTo("Version 1"),
                    () -> assertThat(data.get("eventsUndone").asInt()).isEqualTo(1),
                    () -> assertThat(data.get("previousState").get("status").asText()).isEqualTo("CONFIRMED"),
                    () -> assertThat(data.get("newState").get("status").asText()).isEqualTo("PENDING"),
                    () -> assertThat(data.get("rollbackReason").asText()).isEqualTo("Confirmed too early")
            );
        }

        @Test
        void events_of_unknown_types_are_skipped() {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            eventLog.append(orderId, 1, Stream.of(cloudEvent("OrderGiftWrapped", "{\"orderId\":\"" + orderId + "\",\"paper\":\"red\"}")));

            // When
            Order order = orderApplicationService.getOrder(orderId);

            // Then
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.PENDING),
                    () -> assertThat(orderApplicationService.getOrderEvents(orderId)).extracting(RecordedEvent::event)
                            .last().isEqualTo(new UnrecognizedOrderEvent("OrderGiftWrapped"))
            );
        }

        @Test
        void rollback_with_unknown_rollback_type_fails_reconstruction() {
            // Given
            String orderId = orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            eventLog.append(orderId, 1, Stream.of(cloudEvent(OrderRolledBack.class.getSimpleName(),
                    "{\"orderId\":\"" + orderId + "\",\"rollbackType\":\"sometime\",\"rollbackValue\":1}")));

            // When
            Throwable throwable = catchThrowable(() -> orderApplicationService.getOrder(orderId));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IntegrityException.class).hasMessageContaining("cannot be read as OrderRolledBack");
        }

        @Test
        void all_orders_are_reconstructed() {
            // Given
            orderApplicationService.createOrder("customer-1", List.of(ITEM_A));
            orderApplicationService.createOrder("customer-2", List.of(ITEM_B));

            // When
            List<Order> orders = orderApplicationService.getAllOrders();

            // Then
            assertThat(orders).extracting(Order::customerId).containsExactly("customer-1", "customer-2");
        }

        private CloudEvent cloudEvent(String type, String json) {
            return CloudEventBuilder.v1()
                    .withId(type + "-" + clock.instant().toEpochMilli())
                    .withSource(OrderCloudEvents.SOURCE)
                    .withType(type)
                    .withTime(clock.instant().atOffset(ZoneOffset.UTC))
                    .withDataContentType("application/json")
                    .withData(json.getBytes(StandardCharsets.UTF_8))
                    .build();
        }
    }
}
