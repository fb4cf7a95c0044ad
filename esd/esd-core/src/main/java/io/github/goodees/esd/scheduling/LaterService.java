package io.github.goodees.esd.scheduling;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Delivers messages to a target once they are due.
 *
 * <p>A single background thread sweeps the pending set. Envelopes arrive through an inbound queue; every sweep moves
 * the inbound envelopes into the pending set, then delivers everything due at {@link TimeSource#now()} in order of
 * due time, and then waits for the earliest due time, a new envelope or a change of time, whichever comes first.
 *
 * <p>When the time source reports a change, the notifying thread is held until a sweep at the new time has completed.
 * With {@link ManualTimeSource} this means everything due is delivered by the time
 * {@link ManualTimeSource#advance(java.time.Duration)} returns.
 *
 * @param <T> type of message
 */
public class LaterService<T> implements AutoCloseable {
    private static final long TIME_CHANGE_WAIT_SECONDS = 10;

    private final Logger logger;
    private final String name;
    private final Consumer<? super T> target;
    private final TimeSource timeSource;
    private final Queue<DelaySendEnvelope<T>> inbound = new ConcurrentLinkedQueue<>();
    private final TreeMap<Instant, List<T>> pending = new TreeMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Condition swept = lock.newCondition();
    private final Runnable timeChangeListener = this::timeChanged;

    // guarded by lock, as is pending
    private State state = State.IDLE;
    private long requestedSweep;
    private long completedSweep;
    private Thread thread;

    public LaterService(String name, Consumer<? super T> target, TimeSource timeSource) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.target = Objects.requireNonNull(target, "Target must be specified");
        this.timeSource = Objects.requireNonNull(timeSource, "Time source must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + name);
    }

    /**
     * Start the delivery thread.
     * @throws IllegalStateException when already started or closed
     */
    public void start() {
        lock.lock();
        try {
            if (state != State.IDLE) {
                throw new IllegalStateException("LaterService " + name + " cannot be started when " + state);
            }
            state = State.STARTED;
            thread = new Thread(this::loop, name);
            thread.setDaemon(true);
            timeSource.addTimeChangeListener(timeChangeListener);
            thread.start();
        } finally {
            lock.unlock();
        }
        logger.debug("Started");
    }

    /**
     * Schedule a message.
     * @param envelope message and its due time
     * @throws IllegalStateException when closed
     */
    public void handle(DelaySendEnvelope<T> envelope) {
        Objects.requireNonNull(envelope, "Envelope must be specified");
        lock.lock();
        try {
            if (state == State.CLOSED) {
                throw new IllegalStateException("LaterService " + name + " is closed");
            }
            inbound.add(envelope);
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isStarted() {
        lock.lock();
        try {
            return state == State.STARTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of messages waiting for delivery.
     * @return pending and inbound message count
     */
    public int getPendingCount() {
        lock.lock();
        try {
            return pending.values().stream().mapToInt(List::size).sum() + inbound.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop delivering. Messages not yet due are discarded.
     */
    @Override
    public void close() {
        Thread toJoin;
        lock.lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            toJoin = thread;
            wakeUp.signalAll();
            swept.signalAll();
        } finally {
            lock.unlock();
        }
        timeSource.removeTimeChangeListener(timeChangeListener);
        if (toJoin != null && toJoin != Thread.currentThread()) {
            try {
                toJoin.join(TimeUnit.SECONDS.toMillis(TIME_CHANGE_WAIT_SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.debug("Closed with {} undelivered messages", getPendingCount());
    }

    private void timeChanged() {
        lock.lock();
        try {
            if (state != State.STARTED || Thread.currentThread() == thread) {
                return;
            }
            long sweep = ++requestedSweep;
            wakeUp.signalAll();
            long remaining = TimeUnit.SECONDS.toNanos(TIME_CHANGE_WAIT_SECONDS);
            while (completedSweep < sweep && state == State.STARTED) {
                if (remaining <= 0) {
                    logger.warn("Delivery did not catch up with time change within {} seconds", TIME_CHANGE_WAIT_SECONDS);
                    return;
                }
                remaining = swept.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    private void loop() {
        lock.lock();
        try {
            while (state == State.STARTED) {
                long sweep = requestedSweep;
                processInbound();
                List<T> due = takeExpired();
                if (!due.isEmpty()) {
                    lock.unlock();
                    try {
                        due.forEach(this::deliver);
                    } finally {
                        lock.lock();
                    }
                }
                completedSweep = sweep;
                swept.signalAll();
                if (state != State.STARTED || requestedSweep != sweep || !inbound.isEmpty()) {
                    continue;
                }
                if (pending.isEmpty()) {
                    wakeUp.await();
                } else {
                    long nanos = timeSource.nanosUntil(pending.firstKey());
                    if (nanos > 0 && timeSource.isManual()) {
                        wakeUp.await();
                    } else if (nanos > 0) {
                        wakeUp.awaitNanos(nanos);
                    }
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Interrupted, stopping");
            Thread.currentThread().interrupt();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                swept.signalAll();
                lock.unlock();
            }
        }
    }

    private void processInbound() {
        DelaySendEnvelope<T> envelope;
        while ((envelope = inbound.poll()) != null) {
            pending.computeIfAbsent(envelope.getDueTime(), k -> new ArrayList<>()).add(envelope.getMessage());
        }
    }

    private List<T> takeExpired() {
        List<T> result = new ArrayList<>();
        Iterator<Map.Entry<Instant, List<T>>> due = pending.headMap(timeSource.now(), true).entrySet().iterator();
        while (due.hasNext()) {
            result.addAll(due.next().getValue());
            due.remove();
        }
        return result;
    }

    private void deliver(T message) {
        try {
            target.accept(message);
        } catch (RuntimeException e) {
            logger.error("Delivery of {} failed", message, e);
        }
    }

    private enum State {
        IDLE, STARTED, CLOSED
    }
}
