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

import java.util.Objects;
import java.util.UUID;

/**
 * Serialized event ready to be appended to a stream.
 */
public final class EventData {
    private final UUID eventId;
    private final String type;
    private final boolean json;
    private final byte[] data;
    private final byte[] metadata;

    public EventData(UUID eventId, String type, boolean json, byte[] data, byte[] metadata) {
        this.eventId = Objects.requireNonNull(eventId, "Event id must be specified");
        this.type = Objects.requireNonNull(type, "Type must be specified");
        this.json = json;
        this.data = Objects.requireNonNull(data, "Data must be specified").clone();
        this.metadata = metadata == null ? new byte[0] : metadata.clone();
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

    @Override
    public String toString() {
        return "EventData[" + type + ", " + eventId + "]";
    }
}
