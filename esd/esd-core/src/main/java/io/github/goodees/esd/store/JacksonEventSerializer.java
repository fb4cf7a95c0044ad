package io.github.goodees.esd.store;

/*-
 * #%L
 * esd
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.esd.command.Metadata;
import io.github.goodees.esd.command.Metadatum;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of events. Event classes are registered under a type name, by default their simple name without
 * the {@code Event} suffix: {@code FundsDepositedEvent} is stored as {@code FundsDeposited}.
 *
 * <p>Stored metadata is a JSON object with {@code causationId}, {@code expectedVersion} and the list of additional
 * {@code metadata} pairs. Event ids are derived from causation id, expected version and position in the changeset,
 * so translating the same changeset twice yields the same ids and the store can recognize the repetition.
 */
public class JacksonEventSerializer implements ChangesetTranslator, SliceTranslator {
    static final String CAUSATION_ID = "causationId";
    static final String EXPECTED_VERSION = "expectedVersion";
    static final String METADATA = "metadata";

    private final ObjectMapper mapper;
    private final Map<String, Class<?>> typesByName = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> namesByType = new ConcurrentHashMap<>();

    public JacksonEventSerializer() {
        this(createMapper());
    }

    public JacksonEventSerializer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Default type name of an event class. Strips suffix Event.
     * @param eventClass the class
     * @return type name
     */
    public static String defaultTypeName(Class<?> eventClass) {
        String simpleName = eventClass.getSimpleName();
        return simpleName.endsWith("Event") && simpleName.length() > "Event".length()
                ? simpleName.substring(0, simpleName.length() - "Event".length())
                : simpleName;
    }

    public JacksonEventSerializer register(Class<?> eventClass) {
        return register(defaultTypeName(eventClass), eventClass);
    }

    /**
     * Register event class under a type name.
     * @param typeName name stored with the event
     * @param eventClass the class
     * @return this serializer
     * @throws IllegalStateException when the name is registered for another class
     */
    public JacksonEventSerializer register(String typeName, Class<?> eventClass) {
        Objects.requireNonNull(typeName, "Type name must be specified");
        Objects.requireNonNull(eventClass, "Event class must be specified");
        Class<?> existing = typesByName.putIfAbsent(typeName, eventClass);
        if (existing != null && existing != eventClass) {
            throw new IllegalStateException("Type name " + typeName + " is already registered for "
                    + existing.getName());
        }
        namesByType.put(eventClass, typeName);
        return this;
    }

    @Override
    public EventData[] translate(Object[] events, UUID causationId, long expectedVersion, Metadata metadata) {
        Objects.requireNonNull(events, "Events must be specified");
        Objects.requireNonNull(causationId, "Causation id must be specified");
        Metadata extra = metadata == null ? Metadata.NONE : metadata;
        byte[] metadataBytes = serializeMetadata(causationId, expectedVersion, extra);
        EventData[] result = new EventData[events.length];
        for (int i = 0; i < events.length; i++) {
            Object event = Objects.requireNonNull(events[i], "Event must not be null");
            result[i] = new EventData(eventId(causationId, expectedVersion, i), typeName(event.getClass()), true,
                    serialize(event), metadataBytes);
        }
        return result;
    }

    static UUID eventId(UUID causationId, long expectedVersion, int index) {
        String seed = causationId + ":" + expectedVersion + ":" + index;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    private String typeName(Class<?> eventClass) {
        String name = namesByType.get(eventClass);
        if (name == null) {
            throw new IllegalArgumentException("Event class " + eventClass.getName() + " is not registered");
        }
        return name;
    }

    private byte[] serialize(Object event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event, e);
        }
    }

    private byte[] serializeMetadata(UUID causationId, long expectedVersion, Metadata metadata) {
        ObjectNode root = mapper.createObjectNode();
        root.put(CAUSATION_ID, causationId.toString());
        root.put(EXPECTED_VERSION, expectedVersion);
        ArrayNode pairs = root.putArray(METADATA);
        for (Metadatum metadatum : metadata) {
            pairs.addObject().put("name", metadatum.getName()).put("value", metadatum.getValue());
        }
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metadata", e);
        }
    }

    @Override
    public List<Object> translate(StreamEventsSlice slice) {
        Objects.requireNonNull(slice, "Slice must be specified");
        List<Object> result = new ArrayList<>(slice.getEvents().size());
        for (RecordedEvent event : slice.getEvents()) {
            result.add(deserialize(event));
        }
        return result;
    }

    public Object deserialize(RecordedEvent event) {
        Class<?> type = typesByName.get(event.getType());
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type " + event.getType() + " of " + event);
        }
        try {
            return mapper.readValue(event.getData(), type);
        } catch (IOException e) {
            throw StreamStoreException.storeFailed(event.getStreamId(), e);
        }
    }

    /**
     * Read metadata written by {@link #translate(Object[], UUID, long, Metadata)}.
     * @param event stored event
     * @return the additional metadata pairs
     */
    public Metadata readMetadata(RecordedEvent event) {
        List<Metadatum> pairs = new ArrayList<>();
        for (JsonNode pair : readMetadataTree(event).path(METADATA)) {
            pairs.add(new Metadatum(pair.path("name").asText(), pair.path("value").asText()));
        }
        return new Metadata(pairs);
    }

    public UUID readCausationId(RecordedEvent event) {
        JsonNode causation = readMetadataTree(event).get(CAUSATION_ID);
        return causation == null ? null : UUID.fromString(causation.asText());
    }

    private JsonNode readMetadataTree(RecordedEvent event) {
        byte[] metadata = event.getMetadata();
        if (metadata.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(metadata);
        } catch (IOException e) {
            throw StreamStoreException.storeFailed(event.getStreamId(), e);
        }
    }
}
