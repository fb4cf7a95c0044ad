package io.github.goodees.esd.queue;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Queue with a single dedicated consumer thread. Messages are passed to the consumer one at a time, in the order they
 * were published.
 *
 * <p>Exceptions and errors of the consumer are logged, and the next message is processed. Each published message counts as
 * {@link OutstandingWork} until the consumer returns.
 *
 * @param <T> type of message
 */
public class QueuedHandler<T> {
    /**
     * Messages processed longer than this are always logged as errors when watching slow messages.
     */
    public static final Duration VERY_SLOW_MESSAGE_THRESHOLD = Duration.ofSeconds(7);
    private static final long POLL_MILLIS = 100;

    protected final Logger logger;
    private final String name;
    private final Consumer<? super T> consumer;
    private final boolean watchSlowMessages;
    private final Duration slowMessageThreshold;
    private final Duration stopTimeout;
    private final OutstandingWork outstanding;
    private final ThreadFactory threadFactory;
    private final BlockingQueue<T> queue;
    private final Object publishLock = new Object();

    private final AtomicLong processed = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong busyNanos = new AtomicLong();
    private volatile boolean stopRequested;
    private volatile Thread thread;
    private volatile long startNanos;
    private volatile Class<?> currentMessageType;
    private volatile Class<?> lastMessageType;
    private volatile long lastProcessingNanos;

    public QueuedHandler(String name, Consumer<? super T> consumer, boolean watchSlowMessages,
            Duration slowMessageThreshold, Duration stopTimeout, OutstandingWork outstanding,
            ThreadFactory threadFactory) {
        this(name, consumer, watchSlowMessages, slowMessageThreshold, stopTimeout, outstanding, threadFactory,
                Integer.MAX_VALUE);
    }

    public QueuedHandler(String name, Consumer<? super T> consumer, boolean watchSlowMessages,
            Duration slowMessageThreshold, Duration stopTimeout, OutstandingWork outstanding) {
        this(name, consumer, watchSlowMessages, slowMessageThreshold, stopTimeout, outstanding,
                QueuedHandler::daemonThread);
    }

    public QueuedHandler(String name, Consumer<? super T> consumer) {
        this(name, consumer, false, Duration.ofMillis(100), Duration.ofSeconds(10), new OutstandingWork());
    }

    protected QueuedHandler(String name, Consumer<? super T> consumer, boolean watchSlowMessages,
            Duration slowMessageThreshold, Duration stopTimeout, OutstandingWork outstanding,
            ThreadFactory threadFactory, int capacity) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.consumer = Objects.requireNonNull(consumer, "Consumer must be specified");
        this.watchSlowMessages = watchSlowMessages;
        this.slowMessageThreshold = Objects.requireNonNull(slowMessageThreshold, "Slow message threshold must be specified");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "Stop timeout must be specified");
        this.outstanding = Objects.requireNonNull(outstanding, "Outstanding work must be specified");
        this.threadFactory = Objects.requireNonNull(threadFactory, "Thread factory must be specified");
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.logger = LoggerFactory.getLogger(QueuedHandler.class.getName() + "." + name);
    }

    private static Thread daemonThread(Runnable runnable) {
        Thread t = new Thread(runnable);
        t.setDaemon(true);
        return t;
    }

    public String getName() {
        return name;
    }

    /**
     * Start the consumer thread.
     * @throws IllegalStateException when started before
     */
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Queue " + name + " was already started");
        }
        Thread t = threadFactory.newThread(this::loop);
        t.setName(name);
        startNanos = System.nanoTime();
        thread = t;
        t.start();
        logger.debug("Started");
    }

    /**
     * Enqueue a message. Never blocks. Once stop was requested no message is accepted, so messages drained after
     * {@link #stop()} are all that is left in the queue.
     * @param message message to enqueue
     * @return true when the message was accepted
     */
    public boolean publish(T message) {
        Objects.requireNonNull(message, "Message must be specified");
        synchronized (publishLock) {
            if (stopRequested) {
                logger.debug("Stopped, message {} rejected", message);
                return false;
            }
            outstanding.increment();
            inFlight.incrementAndGet();
            if (queue.offer(message)) {
                return true;
            }
            inFlight.decrementAndGet();
            outstanding.decrement();
        }
        onRejected(message);
        return false;
    }

    /**
     * Called when a message does not fit into the queue.
     * @param message rejected message
     */
    protected void onRejected(T message) {
        logger.warn("Queue is full, message {} rejected", message);
    }

    /**
     * Whether the calling thread is this queue's consumer thread.
     * @return true when called from within the consumer
     */
    public boolean isConsumerThread() {
        return Thread.currentThread() == thread;
    }

    public void requestStop() {
        synchronized (publishLock) {
            stopRequested = true;
        }
    }

    /**
     * Stop the consumer thread and wait for it to finish its current message.
     * @throws IllegalStateException when the thread does not finish within stop timeout
     */
    public void stop() {
        requestStop();
        Thread t = thread;
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(stopTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            throw new IllegalStateException("Unable to stop thread '" + name + "'.");
        }
        logger.debug("Stopped with {} messages left", queue.size());
    }

    /**
     * Remove all messages not yet processed. They no longer count as outstanding work.
     * @return removed messages in the order they were published
     */
    public List<T> drain() {
        List<T> result = new ArrayList<>();
        queue.drainTo(result);
        result.forEach(m -> {
            inFlight.decrementAndGet();
            outstanding.decrement();
        });
        return result;
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive() && !stopRequested;
    }

    /**
     * Whether there is nothing queued and nothing being processed.
     * @return true when idle
     */
    public boolean isIdle() {
        return inFlight.get() == 0;
    }

    public int getMessageCount() {
        return queue.size();
    }

    public long getDiscardedCount() {
        return 0;
    }

    public QueueStats getStatistics() {
        long started = startNanos;
        return new QueueStats(name, queue.size(), processed.get(), getDiscardedCount(), isIdle(), currentMessageType,
                lastMessageType, Duration.ofNanos(lastProcessingNanos), Duration.ofNanos(busyNanos.get()),
                started == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started));
    }

    private void loop() {
        while (!stopRequested) {
            T message;
            try {
                message = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                logger.debug("Interrupted, stopping");
                Thread.currentThread().interrupt();
                return;
            }
            if (message != null) {
                process(message);
            }
        }
    }

    private void process(T message) {
        currentMessageType = message.getClass();
        long start = System.nanoTime();
        try {
            consumer.accept(message);
        } catch (RuntimeException | Error e) {
            logger.error("Error while processing message {}", message, e);
        } finally {
            long elapsed = System.nanoTime() - start;
            lastProcessingNanos = elapsed;
            busyNanos.addAndGet(elapsed);
            processed.incrementAndGet();
            lastMessageType = currentMessageType;
            currentMessageType = null;
            inFlight.decrementAndGet();
            outstanding.decrement();
            if (watchSlowMessages) {
                reportSlow(message, elapsed);
            }
        }
    }

    private void reportSlow(T message, long elapsedNanos) {
        if (elapsedNanos > VERY_SLOW_MESSAGE_THRESHOLD.toNanos()) {
            logger.error("Very slow message {} took {} ms", message, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        } else if (elapsedNanos > slowMessageThreshold.toNanos()) {
            logger.debug("Slow message {} took {} ms", message, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        }
    }

    @Override
    public String toString() {
        return "QueuedHandler[" + name + "]";
    }
}
