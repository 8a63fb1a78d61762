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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rewind.application.converter.jackson.JacksonCloudEventConverter;
import org.rewind.example.domain.order.model.domainevents.OrderCreated;
import org.rewind.example.domain.order.model.domainevents.OrderEvent;
import org.rewind.example.domain.order.model.domainevents.OrderItemAdded;
import org.rewind.example.domain.order.model.domainevents.OrderItemRemoved;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;
import org.rewind.example.domain.order.model.domainevents.OrderStatusUpdated;
import org.rewind.example.domain.order.model.domainevents.UnrecognizedOrderEvent;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Configures how order events are stored as cloud events.
 */
public class OrderCloudEvents {
    public static final URI SOURCE = URI.create("urn:rewind:example:order");

    private OrderCloudEvents() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new OrderJacksonModule())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @param clock The clock that decides the time of each new event
     */
    public static JacksonCloudEventConverter<OrderEvent> cloudEventConverter(ObjectMapper objectMapper, Clock clock) {
        return new JacksonCloudEventConverter.Builder<OrderEvent>(objectMapper, SOURCE)
                .register("OrderCreated", OrderCreated.class)
                .register("OrderStatusUpdated", OrderStatusUpdated.class)
                .register("OrderItemAdded", OrderItemAdded.class)
                .register("OrderItemRemoved", OrderItemRemoved.class)
                .register("OrderRolledBack", OrderRolledBack.class)
                .timeMapper(__ -> OffsetDateTime.now(clock))
                .unknownTypeMapper((type, __) -> new UnrecognizedOrderEvent(type))
                .build();
    }
}
