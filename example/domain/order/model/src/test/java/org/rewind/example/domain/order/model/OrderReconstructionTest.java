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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rewind.example.domain.order.model.domainevents.OrderEvent;
import org.rewind.reconstruction.EventSequencer;
import org.rewind.reconstruction.Reconstruction;
import org.rewind.reconstruction.RecordedEvent;
import org.rewind.reconstruction.ReplayMode;
import org.rewind.reconstruction.ReplayObserver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.rewind.example.domain.order.model.OrderHistory.A;
import static org.rewind.example.domain.order.model.OrderHistory.B;
import static org.rewind.example.domain.order.model.OrderHistory.C;
import static org.rewind.example.domain.order.model.OrderHistory.order;
import static org.rewind.example.domain.order.model.OrderHistory.timeOf;

@DisplayName("order reconstruction")
@DisplayNameGeneration(ReplaceUnderscores.class)
class OrderReconstructionTest {

    private final OrderReplayer replayer = new OrderReplayer(ReplayMode.STRICT, ReplayObserver.noop());
    private final Reconstruction<Order, OrderEvent> reconstruction = new Reconstruction<>(replayer);

    /**
     * v1 created with A, v2 confirmed, v3 B added, v4 shipped, v5 rolled back to version 2
     */
    private static OrderHistory rolledBackHistory() {
        return order().created(A).statusUpdated(OrderStatus.CONFIRMED).itemAdded(B).statusUpdated(OrderStatus.SHIPPED).rolledBackToVersion(2);
    }

    @Test
    void history_without_rollbacks_is_replayed_as_is() {
        // Given
        List<RecordedEvent<OrderEvent>> events = order().created(A).statusUpdated(OrderStatus.CONFIRMED).itemAdded(B).events();

        // When
        Order order = reconstruction.reconstruct(events);

        // Then
        assertThat(order).isEqualTo(replayer.replay(EventSequencer.sequence(events)));
    }

    @Test
    void reconstruction_is_independent_of_event_order() {
        // Given
        List<RecordedEvent<OrderEvent>> events = rolledBackHistory().itemAdded(C).rolledBackToVersion(5).itemRemoved("A").events();
        Order expected = reconstruction.reconstruct(events);
        Random random = new Random(7);

        // When / Then
        for (int i = 0; i < 25; i++) {
            List<RecordedEvent<OrderEvent>> shuffled = new ArrayList<>(events);
            Collections.shuffle(shuffled, random);
            assertThat(reconstruction.reconstruct(shuffled)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("rollback to version")
    class RollbackToVersion {

        @Test
        void returns_order_as_it_was_at_the_target_version() {
            // When
            Order order = reconstruction.reconstruct(rolledBackHistory().events());

            // Then
            assertAll(
                    () -> assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED),
                    () -> assertThat(order.items()).containsExactly(A),
                    () -> assertThat(order.totalAmount()).isEqualByComparingTo("50.00"),
                    () -> assertThat(reconstruction.skippedVersions(rolledBackHistory().events())).containsExactly(3L, 4L)
            );
        }

        @Test
        void events_appended_after_the_rollback_are_applied() {
            // When
            Order order = reconstruction.reconstruct(rolledBackHistory().itemAdded(C).events());

            // Then
            assertThat(order.status()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.items()).containsExactly(A, C);
            assertThat(order.version()).isEqualTo(6);
        }

        @Test
        void rollback_to_an_earlier_rollback_resolves_to_the_same_state() {
            // Given
            List<RecordedEvent<OrderEvent>> single = rolledBackHistory().events();
            List<RecordedEvent<OrderEvent>> nested = rolledBackHistory().itemAdded(C).rolledBackToVersion(5).events();

            // When
            Order singleRollback = reconstruction.reconstruct(single);
            Order nestedRollback = reconstruction.reconstruct(nested);

            // Then
            assertThat(nestedRollback).isEqualTo(singleRollback);
        }
    }

    @Test
    void rollback_to_timestamp_of_version_equals_rollback_to_version() {
        // Given
        List<RecordedEvent<OrderEvent>> byVersion = rolledBackHistory().events();
        List<RecordedEvent<OrderEvent>> byTimestamp = order().created(A).statusUpdated(OrderStatus.CONFIRMED).itemAdded(B).statusUpdated(OrderStatus.SHIPPED).rolledBackToTimestamp(timeOf(2)).events();

        // When
        Order orderByVersion = reconstruction.reconstruct(byVersion);
        Order orderByTimestamp = reconstruction.reconstruct(byTimestamp);

        // Then
        assertThat(orderByTimestamp).isEqualTo(orderByVersion);
        assertThat(reconstruction.skippedVersions(byTimestamp)).isEqualTo(reconstruction.skippedVersions(byVersion));
    }

    @Test
    void skipped_versions_grow_monotonically_and_are_stable_for_the_same_history() {
        // Given
        OrderHistory history = rolledBackHistory();
        SortedSet<Long> afterFirstRollback = reconstruction.skippedVersions(history.events());
        history.itemAdded(C).itemAdded(B).rolledBackToVersion(6);

        // When
        SortedSet<Long> afterSecondRollback = reconstruction.skippedVersions(history.events());

        // Then
        assertThat(afterSecondRollback).containsAll(afterFirstRollback).containsExactly(3L, 4L, 7L);
        assertThat(reconstruction.skippedVersions(history.events())).isEqualTo(afterSecondRollback);
    }
}
