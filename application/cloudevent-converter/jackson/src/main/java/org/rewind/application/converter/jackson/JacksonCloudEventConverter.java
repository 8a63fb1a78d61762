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

package org.rewind.application.converter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.rewind.application.converter.CloudEventConverter;
import org.rewind.reconstruction.IntegrityException;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * Stores domain events as JSON data ({@value #DEFAULT_CONTENT_TYPE}) of {@link CloudEvent}s using a Jackson {@link ObjectMapper}.
 * <p>
 * Each domain event class must be registered with the cloud event type it is stored as, see {@link Builder#register(String, Class)}.
 * Cloud events with a type that isn't registered are handed to the "unknown type mapper", which by default throws an {@link IntegrityException}.
 * </p>
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonCloudEventConverter<T> implements CloudEventConverter<T> {
    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;
    private final URI cloudEventSource;
    private final Map<String, Class<? extends T>> domainEventTypes;
    private final Map<Class<? extends T>, String> cloudEventTypes;
    private final Function<T, String> idMapper;
    private final Function<T, OffsetDateTime> timeMapper;
    private final BiFunction<String, CloudEvent, T> unknownTypeMapper;

    private JacksonCloudEventConverter(ObjectMapper objectMapper, URI cloudEventSource, Map<String, Class<? extends T>> domainEventTypes, Function<T, String> idMapper,
                                       Function<T, OffsetDateTime> timeMapper, BiFunction<String, CloudEvent, T> unknownTypeMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        requireNonNull(timeMapper, "timeMapper cannot be null");
        requireNonNull(unknownTypeMapper, "unknownTypeMapper cannot be null");
        if (domainEventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one domain event type must be registered");
        }
        this.objectMapper = objectMapper;
        this.cloudEventSource = cloudEventSource;
        this.domainEventTypes = Collections.unmodifiableMap(new LinkedHashMap<>(domainEventTypes));
        Map<Class<? extends T>, String> cloudEventTypes = new LinkedHashMap<>();
        domainEventTypes.forEach((type, clazz) -> cloudEventTypes.put(clazz, type));
        this.cloudEventTypes = Collections.unmodifiableMap(cloudEventTypes);
        this.idMapper = idMapper;
        this.timeMapper = timeMapper;
        this.unknownTypeMapper = unknownTypeMapper;
    }

    /**
     * Writes the domain event as JSON data of a cloud event whose type is the one registered for the event's class.
     *
     * @throws IllegalArgumentException If the class of the domain event has not been registered
     */
    @Override
    public CloudEvent toCloudEvent(T domainEvent) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        // @formatter:off
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(objectMapper.convertValue(domainEvent, new TypeReference<Map<String, Object>>() {}), objectMapper::writeValueAsBytes);
        // @formatter:on
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(domainEvent))
                .withSource(cloudEventSource)
                .withType(getCloudEventType(domainEvent))
                .withTime(timeMapper.apply(domainEvent))
                .withDataContentType(DEFAULT_CONTENT_TYPE)
                .withData(cloudEventData)
                .build();
    }

    /**
     * Reads the data of the cloud event as the domain event class registered for its type.
     *
     * @throws IntegrityException If the data of the cloud event cannot be read as the registered domain event class
     */
    @SuppressWarnings("unchecked")
    @Override
    public T toDomainEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Class<? extends T> domainEventType = domainEventTypes.get(cloudEvent.getType());
        if (domainEventType == null) {
            return unknownTypeMapper.apply(cloudEvent.getType(), cloudEvent);
        }

        CloudEventData data = cloudEvent.getData();
        if (data == null) {
            throw new IntegrityException("Cloud event " + cloudEvent.getId() + " of type " + cloudEvent.getType() + " has no data");
        }

        try {
            if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
                Map<String, Object> value = (Map<String, Object>) ((PojoCloudEventData<?>) data).getValue();
                return objectMapper.convertValue(value, domainEventType);
            } else {
                return objectMapper.readValue(data.toBytes(), domainEventType);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new IntegrityException("Cloud event " + cloudEvent.getId() + " of type " + cloudEvent.getType() + " cannot be read as " + domainEventType.getSimpleName(), e);
        }
    }

    /**
     * @param domainEvent The domain event
     * @return The cloud event type that the domain event is stored as
     * @throws IllegalArgumentException If the class of the domain event has not been registered
     */
    public String getCloudEventType(T domainEvent) {
        String type = cloudEventTypes.get(domainEvent.getClass());
        if (type == null) {
            throw new IllegalArgumentException(domainEvent.getClass().getName() + " is not registered in " + JacksonCloudEventConverter.class.getSimpleName());
        }
        return type;
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final URI cloudEventSource;
        private final Map<String, Class<? extends T>> domainEventTypes = new LinkedHashMap<>();
        private Function<T, String> idMapper = defaultIdMapperFunction();
        private Function<T, OffsetDateTime> timeMapper = defaultTimeMapperFunction();
        private BiFunction<String, CloudEvent, T> unknownTypeMapper = defaultUnknownTypeMapper();

        public Builder(ObjectMapper objectMapper, URI cloudEventSource) {
            this.objectMapper = objectMapper;
            this.cloudEventSource = cloudEventSource;
        }

        /**
         * @param cloudEventType  The cloud event type that events of {@code domainEventType} are stored as
         * @param domainEventType The domain event class
         */
        public Builder<T> register(String cloudEventType, Class<? extends T> domainEventType) {
            requireNonNull(cloudEventType, "cloudEventType cannot be null");
            requireNonNull(domainEventType, "domainEventType cannot be null");
            if (domainEventTypes.containsKey(cloudEventType)) {
                throw new IllegalArgumentException("Cloud event type " + cloudEventType + " is already registered");
            }
            if (domainEventTypes.containsValue(domainEventType)) {
                throw new IllegalArgumentException(domainEventType.getName() + " is already registered");
            }
            domainEventTypes.put(cloudEventType, domainEventType);
            return this;
        }

        /**
         * @param idMapper Generates the id of each new cloud event. Defaults to a random UUID.
         */
        public Builder<T> idMapper(Function<T, String> idMapper) {
            this.idMapper = idMapper;
            return this;
        }

        /**
         * @param timeMapper Decides the time of each new cloud event, which later becomes the timestamp used for reconstruction. Defaults to {@code OffsetDateTime.now(UTC)}.
         */
        public Builder<T> timeMapper(Function<T, OffsetDateTime> timeMapper) {
            this.timeMapper = timeMapper;
            return this;
        }

        /**
         * @param unknownTypeMapper A function that creates a domain event from a cloud event whose type isn't registered. By default, an {@link IntegrityException} is thrown.
         */
        public Builder<T> unknownTypeMapper(BiFunction<String, CloudEvent, T> unknownTypeMapper) {
            this.unknownTypeMapper = unknownTypeMapper;
            return this;
        }

        public JacksonCloudEventConverter<T> build() {
            return new JacksonCloudEventConverter<>(objectMapper, cloudEventSource, domainEventTypes, idMapper, timeMapper, unknownTypeMapper);
        }
    }

    private static <T> Function<T, String> defaultIdMapperFunction() {
        return __ -> UUID.randomUUID().toString();
    }

    private static <T> Function<T, OffsetDateTime> defaultTimeMapperFunction() {
        return __ -> OffsetDateTime.now(UTC);
    }

    private static <T> BiFunction<String, CloudEvent, T> defaultUnknownTypeMapper() {
        return (type, cloudEvent) -> {
            throw new IntegrityException("Cloud event " + cloudEvent.getId() + " has unknown type " + type);
        };
    }
}
