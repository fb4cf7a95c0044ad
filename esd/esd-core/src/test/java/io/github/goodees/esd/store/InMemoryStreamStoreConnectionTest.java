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
import io.github.goodees.esd.scheduling.ManualTimeSource;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class InMemoryStreamStoreConnectionTest {
    private final ManualTimeSource time = new ManualTimeSource();
    private final InMemoryStreamStoreConnection connection = new InMemoryStreamStoreConnection(time);

    private static EventData event(String payload) {
        return new EventData(UUID.randomUUID(), "Test", true,
                ("\"" + payload + "\"").getBytes(StandardCharsets.UTF_8), null);
    }

    private static List<Long> numbers(List<RecordedEvent> events) {
        List<Long> result = new ArrayList<>();
        events.forEach(e -> result.add(e.getEventNumber()));
        return result;
    }

    @Test
    public void append_creates_stream_and_returns_last_event_number() {
        assertThat(connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"), event("b")), is(1L));
        assertThat(connection.appendToStream("s", 1, event("c")), is(2L));

        StreamEventsSlice slice = connection.readStreamForward("s", 0, 10);
        assertThat(slice.getStatus(), is(ReadResult.FOUND));
        assertThat(numbers(slice.getEvents()), contains(0L, 1L, 2L));
        assertThat(slice.getLastEventNumber(), is(2L));
        assertThat(slice.isEndOfStream(), is(true));
        assertThat(slice.getEvents().get(0).getCreated(), is(time.now()));
    }

    @Test
    public void any_version_always_appends() {
        connection.appendToStream("s", ExpectedVersion.ANY, event("a"));
        connection.appendToStream("s", ExpectedVersion.ANY, event("b"));
        assertThat(connection.readStreamForward("s", 0, 10).getEvents(), hasSize(2));
    }

    @Test
    public void wrong_expected_version_is_rejected() {
        connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"));
        try {
            connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("b"));
            throw new AssertionError("Expected WrongExpectedVersionException");
        } catch (WrongExpectedVersionException e) {
            assertThat(e.getStream(), is("s"));
            assertThat(e.getExpectedVersion(), is(-1L));
            assertThat(e.getActualVersion(), is(0L));
        }
        assertThat(connection.readStreamForward("s", 0, 10).getEvents(), hasSize(1));
    }

    @Test(expected = WrongExpectedVersionException.class)
    public void append_to_missing_stream_with_version_fails() {
        connection.appendToStream("s", 3, event("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalid_expected_version_is_rejected() {
        connection.appendToStream("s", -3, event("a"));
    }

    @Test
    public void reads_are_paged() {
        for (int i = 0; i < 5; i++) {
            connection.appendToStream("s", ExpectedVersion.ANY, event("e" + i));
        }
        StreamEventsSlice first = connection.readStreamForward("s", 0, 2);
        assertThat(numbers(first.getEvents()), contains(0L, 1L));
        assertThat(first.getNextEventNumber(), is(2L));
        assertThat(first.isEndOfStream(), is(false));

        StreamEventsSlice last = connection.readStreamForward("s", 4, 2);
        assertThat(numbers(last.getEvents()), contains(4L));
        assertThat(last.isEndOfStream(), is(true));

        StreamEventsSlice beyond = connection.readStreamForward("s", 10, 2);
        assertThat(beyond.getEvents(), empty());
        assertThat(beyond.isEndOfStream(), is(true));
    }

    @Test
    public void missing_stream_reads_not_found() {
        assertThat(connection.readStreamForward("missing", 0, 10).getStatus(), is(ReadResult.NOT_FOUND));
    }

    @Test
    public void deleted_stream_reads_deleted_consistently() {
        connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"));
        connection.deleteStream("s", 0);
        assertThat(connection.readStreamForward("s", 0, 10).getStatus(), is(ReadResult.DELETED));
        assertThat(connection.readStreamForward("s", 5, 1).getStatus(), is(ReadResult.DELETED));
        assertThat(connection.readStreamForward("s", 0, 10).getEvents(), empty());
    }

    @Test(expected = StreamDeletedException.class)
    public void append_to_deleted_stream_fails() {
        connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"));
        connection.deleteStream("s", ExpectedVersion.ANY);
        connection.appendToStream("s", ExpectedVersion.ANY, event("b"));
    }

    @Test(expected = StreamDeletedException.class)
    public void deleting_twice_fails() {
        connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"));
        connection.deleteStream("s", ExpectedVersion.ANY);
        connection.deleteStream("s", ExpectedVersion.ANY);
    }

    @Test(expected = StreamNotFoundException.class)
    public void deleting_missing_stream_fails() {
        connection.deleteStream("missing", ExpectedVersion.ANY);
    }

    @Test(expected = WrongExpectedVersionException.class)
    public void delete_checks_version() {
        connection.appendToStream("s", ExpectedVersion.NO_STREAM, event("a"), event("b"));
        connection.deleteStream("s", 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_start_is_rejected() {
        connection.readStreamForward("s", -1, 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zero_count_is_rejected() {
        connection.readStreamForward("s", 0, 0);
    }

    @Test
    public void stream_subscription_receives_only_its_stream() {
        List<RecordedEvent> received = new ArrayList<>();
        StreamSubscription subscription = connection.subscribeToStream("s", received::add);
        connection.appendToStream("s", ExpectedVersion.ANY, event("a"));
        connection.appendToStream("other", ExpectedVersion.ANY, event("b"));
        assertThat(received, hasSize(1));
        assertThat(subscription.getStream(), is("s"));

        subscription.close();
        connection.appendToStream("s", ExpectedVersion.ANY, event("c"));
        assertThat(received, hasSize(1));
    }

    @Test
    public void subscription_from_checkpoint_replays_then_follows() {
        connection.appendToStream("s", ExpectedVersion.ANY, event("a"), event("b"), event("c"));
        List<RecordedEvent> received = new ArrayList<>();
        connection.subscribeToStreamFrom("s", 0L, received::add);
        assertThat(numbers(received), contains(1L, 2L));
        connection.appendToStream("s", ExpectedVersion.ANY, event("d"));
        assertThat(numbers(received), contains(1L, 2L, 3L));
    }

    @Test
    public void subscription_without_checkpoint_replays_everything() {
        connection.appendToStream("s", ExpectedVersion.ANY, event("a"), event("b"));
        List<RecordedEvent> received = new ArrayList<>();
        connection.subscribeToStreamFrom("s", null, received::add);
        assertThat(numbers(received), contains(0L, 1L));
    }

    @Test
    public void subscription_to_all_receives_every_stream() {
        List<String> received = new ArrayList<>();
        connection.subscribeToAll(e -> received.add(e.getStreamId()));
        connection.appendToStream("a", ExpectedVersion.ANY, event("1"));
        connection.appendToStream("b", ExpectedVersion.ANY, event("2"));
        assertThat(received, contains("a", "b"));
    }

    @Test
    public void failing_subscriber_does_not_fail_append() {
        List<RecordedEvent> received = new ArrayList<>();
        connection.subscribeToAll(e -> {
            throw new IllegalStateException("expected subscriber failure");
        });
        connection.subscribeToAll(received::add);
        assertThat(connection.appendToStream("s", ExpectedVersion.ANY, event("a")), is(0L));
        assertThat(received, hasSize(1));
    }
}
