package io.github.goodees.esd.core;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only buffer of events raised but not yet persisted.
 */
public class EventRecorder {
    private final List<Object> recorded = new ArrayList<>();

    /**
     * Record an event. The same instance recorded twice appears twice.
     * @param event the event
     * @throws NullPointerException when event is null
     */
    public void record(Object event) {
        Objects.requireNonNull(event, "Event must be specified");
        recorded.add(event);
    }

    /**
     * Snapshot of recorded events in order of recording.
     * @return new array of events
     */
    public Object[] getRecordedEvents() {
        return recorded.toArray();
    }

    public boolean hasRecordedEvents() {
        return !recorded.isEmpty();
    }

    public int size() {
        return recorded.size();
    }

    public void reset() {
        recorded.clear();
    }
}
