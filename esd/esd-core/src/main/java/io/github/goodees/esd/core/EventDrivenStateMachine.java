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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Base class of event sourced entities, both aggregates and process managers.
 *
 * <p>An entity preserves its internal state. This state can <strong>only</strong> change as result of an event routed
 * to it, either a new one via {@link #raise(Object)} or a historical one via {@link #restoreFromEvents(Iterable)}.
 * Subclasses register a route for every event type they react to in their constructor:
 * <pre>
 *     public Account() {
 *         register(AccountCreated.class, e -&gt; balance = e.getBalance());
 *         register(FundsDeposited.class, e -&gt; balance += e.getAmount());
 *     }
 * </pre>
 *
 * <p>The version of the entity counts the events applied to it, zero based. A fresh entity has version
 * {@link ExpectedVersion#NO_STREAM}. Raising an event does not change the version; the version advances when the
 * events are taken for persistence, so that before the take it still denotes the version the store is expected to
 * be at.
 *
 * <p>The state machine introduces no concurrency of its own and is not thread safe. Whoever executes commands against
 * it must make sure one thread at a time accesses an instance.
 */
public abstract class EventDrivenStateMachine implements EventSource {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final EventRouter router = new EventRouter();
    private final EventRecorder recorder = new EventRecorder();
    private long version = ExpectedVersion.NO_STREAM;
    private LifecycleState state = LifecycleState.FRESH;
    private UUID id;

    protected EventDrivenStateMachine() {
    }

    @Override
    public UUID getId() {
        return id;
    }

    protected void setId(UUID id) {
        this.id = id;
    }

    /**
     * Version of the entity. Number of events applied or taken minus one.
     * @return current version
     */
    public long getVersion() {
        return version;
    }

    @Override
    public long getExpectedVersion() {
        return version;
    }

    @Override
    public void setExpectedVersion(long version) {
        this.version = version;
    }

    public LifecycleState getLifecycleState() {
        return state;
    }

    /**
     * Register a route for a type of event.
     * @param eventType type of event
     * @param route logic applying the event to this instance
     * @param <E> type of event
     * @throws IllegalStateException when a route for the type exists, whether typed or untyped
     */
    protected <E> void register(Class<E> eventType, Consumer<? super E> route) {
        router.registerRoute(eventType, route);
    }

    /**
     * Register an untyped route for a type of event.
     * @param eventType type of event
     * @param route logic applying the event to this instance
     * @throws IllegalStateException when a route for the type exists, whether typed or untyped
     */
    protected void registerUntyped(Class<?> eventType, Consumer<Object> route) {
        router.registerUntypedRoute(eventType, route);
    }

    /**
     * Apply a new event to this instance and record it in its history.
     * @param event the event
     */
    protected void raise(Object event) {
        Objects.requireNonNull(event, "Event must be specified");
        onEventRaised(event);
        router.route(event);
        recorder.record(event);
        state = LifecycleState.MODIFIED;
    }

    /**
     * Called before a raised event is routed. Subclasses may validate or inspect the event and throw to prevent it
     * from being applied.
     * @param event the event being raised
     */
    protected void onEventRaised(Object event) {
    }

    /**
     * Replay historical events. Each event advances the version by one. There is no rollback: when the iteration
     * fails halfway, events applied so far stay applied.
     *
     * @param events past events in order they happened
     * @throws IllegalStateException when this instance has already recorded new events
     */
    @Override
    public void restoreFromEvents(Iterable<?> events) {
        Objects.requireNonNull(events, "Events must be specified");
        assertNothingRecorded();
        for (Object event : events) {
            restoreFromEvent(event);
        }
    }

    /**
     * Replay single historical event.
     * @param event past event
     * @throws IllegalStateException when this instance has already recorded new events
     */
    public void restoreFromEvent(Object event) {
        Objects.requireNonNull(event, "Event must be specified");
        assertNothingRecorded();
        state = LifecycleState.REPLAYING;
        version = version < 0 ? 0 : version + 1;
        router.route(event);
    }

    private void assertNothingRecorded() {
        if (recorder.hasRecordedEvents()) {
            throw new IllegalStateException("Restoring from events is not possible when an instance has recorded events.");
        }
    }

    @Override
    public Object[] takeEvents() {
        takeEventsStarted();
        Object[] events = recorder.getRecordedEvents();
        recorder.reset();
        version += events.length;
        if (events.length > 0) {
            state = LifecycleState.COMMITTED;
            logger.debug("Took {} events from {}, version is now {}", events.length, id, version);
        }
        takeEventsCompleted();
        return events;
    }

    /**
     * Called before events are taken.
     */
    protected void takeEventsStarted() {
    }

    /**
     * Called after events were taken and the recorder was reset.
     */
    protected void takeEventsCompleted() {
    }

    public boolean hasRecordedEvents() {
        return recorder.hasRecordedEvents();
    }

    /**
     * Where in its life an entity is. Informative only, the invariants are enforced by the operations themselves.
     */
    public enum LifecycleState {
        FRESH, REPLAYING, MODIFIED, COMMITTED
    }
}
