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

import java.util.Collections;
import java.util.List;

/**
 * Result of reading a part of a stream.
 */
public final class StreamEventsSlice {
    private final String stream;
    private final ReadResult status;
    private final long fromEventNumber;
    private final List<RecordedEvent> events;
    private final long nextEventNumber;
    private final long lastEventNumber;
    private final boolean endOfStream;

    public StreamEventsSlice(String stream, ReadResult status, long fromEventNumber, List<RecordedEvent> events,
            long nextEventNumber, long lastEventNumber, boolean endOfStream) {
        this.stream = stream;
        this.status = status;
        this.fromEventNumber = fromEventNumber;
        this.events = Collections.unmodifiableList(events);
        this.nextEventNumber = nextEventNumber;
        this.lastEventNumber = lastEventNumber;
        this.endOfStream = endOfStream;
    }

    static StreamEventsSlice of(String stream, ReadResult status, long fromEventNumber) {
        return new StreamEventsSlice(stream, status, fromEventNumber, Collections.emptyList(), fromEventNumber,
                -1, true);
    }

    public String getStream() {
        return stream;
    }

    public ReadResult getStatus() {
        return status;
    }

    public long getFromEventNumber() {
        return fromEventNumber;
    }

    public List<RecordedEvent> getEvents() {
        return events;
    }

    public long getNextEventNumber() {
        return nextEventNumber;
    }

    public long getLastEventNumber() {
        return lastEventNumber;
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }
}
