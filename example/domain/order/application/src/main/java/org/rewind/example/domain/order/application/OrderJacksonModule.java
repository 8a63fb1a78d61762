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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.rewind.example.domain.order.model.OrderSnapshot;
import org.rewind.example.domain.order.model.domainevents.OrderRolledBack;
import org.rewind.reconstruction.RollbackTarget;
import org.rewind.reconstruction.RollbackTarget.ToTimestamp;
import org.rewind.reconstruction.RollbackTarget.ToVersion;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Reads and writes {@link OrderRolledBack} with the target flattened into a {@code rollbackType} ({@code "version"} or
 * {@code "timestamp"}) and a {@code rollbackValue} (a version number or an ISO-8601 instant).
 */
public class OrderJacksonModule extends SimpleModule {
    static final String ROLLBACK_TYPE_VERSION = "version";
    static final String ROLLBACK_TYPE_TIMESTAMP = "timestamp";

    public OrderJacksonModule() {
        super(OrderJacksonModule.class.getSimpleName());
        addSerializer(OrderRolledBack.class, new OrderRolledBackSerializer());
        addDeserializer(OrderRolledBack.class, new OrderRolledBackDeserializer());
    }

    private static class OrderRolledBackSerializer extends JsonSerializer<OrderRolledBack> {

        @Override
        public void serialize(OrderRolledBack event, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("orderId", event.orderId());
            gen.writeStringField("rollbackPoint", event.rollbackPoint());
            RollbackTarget target = event.rollbackTarget();
            if (target instanceof ToVersion toVersion) {
                gen.writeStringField("rollbackType", ROLLBACK_TYPE_VERSION);
                gen.writeNumberField("rollbackValue", toVersion.version());
            } else {
                gen.writeStringField("rollbackType", ROLLBACK_TYPE_TIMESTAMP);
                gen.writeStringField("rollbackValue", ((ToTimestamp) target).timestamp().toString());
            }
            gen.writeNumberField("eventsUndone", event.eventsUndone());
            if (event.previousState() != null) {
                serializers.defaultSerializeField("previousState", event.previousState(), gen);
            }
            if (event.newState() != null) {
                serializers.defaultSerializeField("newState", event.newState(), gen);
            }
            if (event.rollbackReason() != null) {
                gen.writeStringField("rollbackReason", event.rollbackReason());
            }
            gen.writeEndObject();
        }
    }

    private static class OrderRolledBackDeserializer extends JsonDeserializer<OrderRolledBack> {

        @Override
        public OrderRolledBack deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            RollbackTarget target = readTarget(p, node);
            return new OrderRolledBack(
                    requiredText(p, node, "orderId"),
                    node.hasNonNull("rollbackPoint") ? node.get("rollbackPoint").asText() : null,
                    target,
                    node.path("eventsUndone").asInt(0),
                    readSnapshot(ctxt, node, "previousState"),
                    readSnapshot(ctxt, node, "newState"),
                    node.hasNonNull("rollbackReason") ? node.get("rollbackReason").asText() : null);
        }

        private static RollbackTarget readTarget(JsonParser p, JsonNode node) throws JsonMappingException {
            String rollbackType = requiredText(p, node, "rollbackType");
            JsonNode rollbackValue = node.path("rollbackValue");
            if (ROLLBACK_TYPE_VERSION.equals(rollbackType)) {
                if (!rollbackValue.canConvertToLong() || !rollbackValue.isIntegralNumber()) {
                    throw JsonMappingException.from(p, "rollbackValue of a version rollback must be an integer but was " + rollbackValue);
                }
                return RollbackTarget.toVersion(rollbackValue.asLong());
            } else if (ROLLBACK_TYPE_TIMESTAMP.equals(rollbackType)) {
                try {
                    return RollbackTarget.toTimestamp(Instant.parse(rollbackValue.asText()));
                } catch (DateTimeParseException e) {
                    throw JsonMappingException.from(p, "rollbackValue of a timestamp rollback must be an ISO-8601 instant but was " + rollbackValue, e);
                }
            }
            throw JsonMappingException.from(p, "Unknown rollbackType " + rollbackType);
        }

        private static OrderSnapshot readSnapshot(DeserializationContext ctxt, JsonNode node, String field) throws IOException {
            return node.hasNonNull(field) ? ctxt.readTreeAsValue(node.get(field), OrderSnapshot.class) : null;
        }

        private static String requiredText(JsonParser p, JsonNode node, String field) throws JsonMappingException {
            if (!node.hasNonNull(field)) {
                throw JsonMappingException.from(p, "Missing " + field);
            }
            return node.get(field).asText();
        }
    }
}
