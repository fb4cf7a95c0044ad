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

import io.github.goodees.esd.command.Metadata;
import io.github.goodees.esd.core.EventDrivenStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Loads aggregates by replaying their stream, and saves them by appending the events they raised.
 */
public class StreamStoreRepository {
    private static final Logger logger = LoggerFactory.getLogger(StreamStoreRepository.class);
    static final int READ_PAGE_SIZE = 500;

    private final StreamNameBuilder streamNameBuilder;
    private final StreamStoreConnection connection;
    private final ChangesetTranslator changesetTranslator;
    private final SliceTranslator sliceTranslator;

    public StreamStoreRepository(StreamNameBuilder streamNameBuilder, StreamStoreConnection connection,
            ChangesetTranslator changesetTranslator, SliceTranslator sliceTranslator) {
        this.streamNameBuilder = Objects.requireNonNull(streamNameBuilder, "Stream name builder must be specified");
        this.connection = Objects.requireNonNull(connection, "Connection must be specified");
        this.changesetTranslator = Objects.requireNonNull(changesetTranslator, "Changeset translator must be specified");
        this.sliceTranslator = Objects.requireNonNull(sliceTranslator, "Slice translator must be specified");
    }

    public StreamStoreRepository(StreamNameBuilder streamNameBuilder, StreamStoreConnection connection,
            JacksonEventSerializer serializer) {
        this(streamNameBuilder, connection, serializer, serializer);
    }

    /**
     * Load an aggregate.
     * @param type type of aggregate
     * @param factory creates an empty instance to replay the events on
     * @param id id of the aggregate
     * @param <T> type of aggregate
     * @return the aggregate at its latest version
     * @throws AggregateNotFoundException when the stream does not exist
     * @throws AggregateDeletedException when the stream was deleted
     */
    public <T extends EventDrivenStateMachine> T getById(Class<T> type, Supplier<? extends T> factory, UUID id) {
        Objects.requireNonNull(type, "Type must be specified");
        Objects.requireNonNull(factory, "Factory must be specified");
        Objects.requireNonNull(id, "Id must be specified");
        String stream = streamNameBuilder.generateForAggregate(type, id);
        T aggregate = factory.get();
        long next = 0;
        StreamEventsSlice slice;
        do {
            slice = connection.readStreamForward(stream, next, READ_PAGE_SIZE);
            switch (slice.getStatus()) {
                case NOT_FOUND:
                    throw new AggregateNotFoundException(stream, type, id);
                case DELETED:
                    throw new AggregateDeletedException(stream, type, id);
                default:
                    aggregate.restoreFromEvents(sliceTranslator.translate(slice));
                    next = slice.getNextEventNumber();
            }
        } while (!slice.isEndOfStream());
        logger.debug("Loaded {} at version {}", stream, aggregate.getVersion());
        return aggregate;
    }

    /**
     * Load an aggregate if it exists.
     * @return the aggregate, or empty when the stream does not exist or was deleted
     */
    public <T extends EventDrivenStateMachine> Optional<T> tryGetById(Class<T> type, Supplier<? extends T> factory,
            UUID id) {
        try {
            return Optional.of(getById(type, factory, id));
        } catch (AggregateNotFoundException | AggregateDeletedException e) {
            logger.debug("{} not available: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(EventDrivenStateMachine aggregate) {
        save(aggregate, UUID.randomUUID(), Metadata.NONE);
    }

    /**
     * Append events raised by the aggregate to its stream. The events are taken from the aggregate before appending,
     * so after a failed save the aggregate no longer holds them and has to be loaded again.
     * @param aggregate the aggregate
     * @param causationId id of the message that caused the events
     * @param metadata metadata to store with the events
     * @throws WrongExpectedVersionException when the stream changed since the aggregate was loaded
     */
    public void save(EventDrivenStateMachine aggregate, UUID causationId, Metadata metadata) {
        Objects.requireNonNull(aggregate, "Aggregate must be specified");
        String stream = streamName(aggregate);
        long expectedVersion = aggregate.getExpectedVersion();
        Object[] events = aggregate.takeEvents();
        if (events.length == 0) {
            return;
        }
        EventData[] data = changesetTranslator.translate(events, causationId, expectedVersion, metadata);
        connection.appendToStream(stream, expectedVersion, data);
        logger.debug("Saved {} events to {}", events.length, stream);
    }

    public void delete(EventDrivenStateMachine aggregate) {
        Objects.requireNonNull(aggregate, "Aggregate must be specified");
        connection.deleteStream(streamName(aggregate), aggregate.getExpectedVersion());
    }

    private String streamName(EventDrivenStateMachine aggregate) {
        if (aggregate.getId() == null) {
            throw new IllegalArgumentException("Aggregate " + aggregate.getClass().getName() + " has no id");
        }
        return streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.getId());
    }
}
