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

import java.util.function.Consumer;

/**
 * Connection to a store of event streams. Event numbers are zero based.
 *
 * @see ExpectedVersion
 */
public interface StreamStoreConnection {
    /**
     * Append events to a stream, creating it when it does not exist.
     * @param stream name of the stream
     * @param expectedVersion version the stream must be at, or {@link ExpectedVersion#ANY}
     * @param events events to append
     * @return number of the last event in the stream after appending
     * @throws WrongExpectedVersionException when the stream is at a different version
     * @throws StreamDeletedException when the stream is deleted
     */
    long appendToStream(String stream, long expectedVersion, EventData... events);

    /**
     * Read events of a stream in order.
     * @param stream name of the stream
     * @param start number of the first event to read
     * @param count maximum number of events to read
     * @return slice of events, with status telling whether the stream exists
     */
    StreamEventsSlice readStreamForward(String stream, long start, int count);

    /**
     * Delete a stream. Reads of a deleted stream report {@link ReadResult#DELETED}, appends fail.
     * @param stream name of the stream
     * @param expectedVersion version the stream must be at, or {@link ExpectedVersion#ANY}
     */
    void deleteStream(String stream, long expectedVersion);

    StreamSubscription subscribeToStream(String stream, Consumer<RecordedEvent> eventAppeared);

    /**
     * Deliver events of a stream after a checkpoint, followed by events appended later.
     * @param stream name of the stream
     * @param lastCheckpoint number of the last event already processed, null to start from the beginning
     * @param eventAppeared consumer of events
     * @return the subscription
     */
    StreamSubscription subscribeToStreamFrom(String stream, Long lastCheckpoint, Consumer<RecordedEvent> eventAppeared);

    StreamSubscription subscribeToAll(Consumer<RecordedEvent> eventAppeared);
}
