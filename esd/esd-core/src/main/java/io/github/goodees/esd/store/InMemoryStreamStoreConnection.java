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

import io.github.goodees.esd.core.ExpectedVersion;
import io.github.goodees.esd.scheduling.SystemTimeSource;
import io.github.goodees.esd.scheduling.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Stream store kept in memory. Subscribers are called synchronously on the appending thread, in append order.
 */
public class InMemoryStreamStoreConnection implements StreamStoreConnection {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStreamStoreConnection.class);

    private final TimeSource timeSource;
    private final Map<String, Stream> streams = new HashMap<>();
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public InMemoryStreamStoreConnection() {
        this(SystemTimeSource.INSTANCE);
    }

    public InMemoryStreamStoreConnection(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "Time source must be specified");
    }

    @Override
    public synchronized long appendToStream(String stream, long expectedVersion, EventData... events) {
        Objects.requireNonNull(stream, "Stream must be specified");
        Objects.requireNonNull(events, "Events must be specified");
        Stream target = streams.get(stream);
        if (target != null && target.deleted) {
            throw new StreamDeletedException(stream);
        }
        long current = target == null ? ExpectedVersion.NO_STREAM : target.lastEventNumber();
        checkVersion(stream, expectedVersion, current);
        if (target == null) {
            target = new Stream();
            streams.put(stream, target);
        }
        Instant now = timeSource.now();
        List<RecordedEvent> appended = new ArrayList<>(events.length);
        for (EventData data : events) {
            RecordedEvent recorded = new RecordedEvent(stream, target.events.size(), data, now);
            target.events.add(recorded);
            appended.add(recorded);
        }
        logger.debug("Appended {} events to {}", events.length, stream);
        for (RecordedEvent event : appended) {
            for (Subscriber subscriber : subscribers) {
                subscriber.deliver(event);
            }
        }
        return target.lastEventNumber();
    }

    private static void checkVersion(String stream, long expectedVersion, long current) {
        if (expectedVersion == ExpectedVersion.ANY) {
            return;
        }
        if (expectedVersion < ExpectedVersion.ANY) {
            throw new IllegalArgumentException("Invalid expected version " + expectedVersion);
        }
        if (expectedVersion != current) {
            throw new WrongExpectedVersionException(stream, expectedVersion, current);
        }
    }

    @Override
    public synchronized StreamEventsSlice readStreamForward(String stream, long start, int count) {
        Objects.requireNonNull(stream, "Stream must be specified");
        if (start < 0) {
            throw new IllegalArgumentException("Start must not be negative, got " + start);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive, got " + count);
        }
        Stream source = streams.get(stream);
        if (source == null) {
            return StreamEventsSlice.of(stream, ReadResult.NOT_FOUND, start);
        }
        if (source.deleted) {
            return StreamEventsSlice.of(stream, ReadResult.DELETED, start);
        }
        int size = source.events.size();
        int from = (int) Math.min(start, size);
        int to = (int) Math.min((long) from + count, size);
        List<RecordedEvent> slice = new ArrayList<>(source.events.subList(from, to));
        return new StreamEventsSlice(stream, ReadResult.FOUND, start, slice, to, size - 1, to >= size);
    }

    @Override
    public synchronized void deleteStream(String stream, long expectedVersion) {
        Objects.requireNonNull(stream, "Stream must be specified");
        Stream target = streams.get(stream);
        if (target == null) {
            throw new StreamNotFoundException(stream);
        }
        if (target.deleted) {
            throw new StreamDeletedException(stream);
        }
        checkVersion(stream, expectedVersion, target.lastEventNumber());
        target.deleted = true;
        logger.debug("Deleted {}", stream);
    }

    @Override
    public StreamSubscription subscribeToStream(String stream, Consumer<RecordedEvent> eventAppeared) {
        Objects.requireNonNull(stream, "Stream must be specified");
        return subscribe(new Subscriber(stream, eventAppeared));
    }

    @Override
    public synchronized StreamSubscription subscribeToStreamFrom(String stream, Long lastCheckpoint,
            Consumer<RecordedEvent> eventAppeared) {
        Objects.requireNonNull(stream, "Stream must be specified");
        Subscriber subscriber = new Subscriber(stream, eventAppeared);
        Stream source = streams.get(stream);
        if (source != null && !source.deleted) {
            long from = lastCheckpoint == null ? 0 : lastCheckpoint + 1;
            for (RecordedEvent event : source.events) {
                if (event.getEventNumber() >= from) {
                    subscriber.deliver(event);
                }
            }
        }
        return subscribe(subscriber);
    }

    @Override
    public StreamSubscription subscribeToAll(Consumer<RecordedEvent> eventAppeared) {
        return subscribe(new Subscriber(null, eventAppeared));
    }

    private StreamSubscription subscribe(Subscriber subscriber) {
        subscribers.add(subscriber);
        return subscriber;
    }

    private static class Stream {
        final List<RecordedEvent> events = new ArrayList<>();
        boolean deleted;

        long lastEventNumber() {
            return events.size() - 1;
        }
    }

    private class Subscriber implements StreamSubscription {
        private final String stream;
        private final Consumer<RecordedEvent> consumer;

        Subscriber(String stream, Consumer<RecordedEvent> consumer) {
            this.stream = stream;
            this.consumer = Objects.requireNonNull(consumer, "Consumer must be specified");
        }

        void deliver(RecordedEvent event) {
            if (stream != null && !stream.equals(event.getStreamId())) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                logger.error("Subscriber of {} failed on {}", stream == null ? "all streams" : stream, event, e);
            }
        }

        @Override
        public String getStream() {
            return stream;
        }

        @Override
        public void close() {
            subscribers.remove(this);
        }
    }
}
