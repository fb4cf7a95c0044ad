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

import java.time.Instant;
import java.util.UUID;

/**
 * Event as stored in a stream.
 */
public final class RecordedEvent {
    private final String streamId;
    private final long eventNumber;
    private final UUID eventId;
    private final String type;
    private final boolean json;
    private final byte[] data;
    private final byte[] metadata;
    private final Instant created;

    public RecordedEvent(String streamId, long eventNumber, EventData eventData, Instant created) {
        this.streamId = streamId;
        this.eventNumber = eventNumber;
        this.eventId = eventData.getEventId();
        this.type = eventData.getType();
        this.json = eventData.isJson();
        this.data = eventData.getData();
        this.metadata = eventData.getMetadata();
        this.created = created;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Position of the event in its stream, zero based.
     * @return event number
     */
    public long getEventNumber() {
        return eventNumber;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getType() {
        return type;
    }

    public boolean isJson() {
        return json;
    }

    public byte[] getData() {
        return data.clone();
    }

    public byte[] getMetadata() {
        return metadata.clone();
    }

    public Instant getCreated() {
        return created;
    }

    @Override
    public String toString() {
        return "RecordedEvent[" + streamId + "@" + eventNumber + ", " + type + "]";
    }
}
