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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventRecorderTest {
    private final EventRecorder recorder = new EventRecorder();

    @Test
    public void keeps_events_in_recording_order() {
        recorder.record("first");
        recorder.record("second");
        recorder.record("first");
        assertArrayEquals(new Object[] {"first", "second", "first"}, recorder.getRecordedEvents());
        assertEquals(3, recorder.size());
    }

    @Test
    public void recorded_events_are_a_snapshot() {
        recorder.record("first");
        Object[] snapshot = recorder.getRecordedEvents();
        recorder.record("second");
        assertEquals(1, snapshot.length);
    }

    @Test
    public void reset_forgets_events() {
        recorder.record("first");
        assertTrue(recorder.hasRecordedEvents());
        recorder.reset();
        assertFalse(recorder.hasRecordedEvents());
        assertEquals(0, recorder.getRecordedEvents().length);
    }

    @Test(expected = NullPointerException.class)
    public void null_event_is_rejected() {
        recorder.record(null);
    }
}
