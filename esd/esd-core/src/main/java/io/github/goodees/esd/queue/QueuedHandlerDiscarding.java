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

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Queued handler of bounded depth. Messages published into a full queue are dropped and counted.
 *
 * @param <T> type of message
 */
public class QueuedHandlerDiscarding<T> extends QueuedHandler<T> {
    private final int maxQueueDepth;
    private final AtomicLong discarded = new AtomicLong();

    public QueuedHandlerDiscarding(String name, Consumer<? super T> consumer, int maxQueueDepth,
            boolean watchSlowMessages, Duration slowMessageThreshold, Duration stopTimeout,
            OutstandingWork outstanding, ThreadFactory threadFactory) {
        super(name, consumer, watchSlowMessages, slowMessageThreshold, stopTimeout, outstanding, threadFactory,
                checkDepth(maxQueueDepth));
        this.maxQueueDepth = maxQueueDepth;
    }

    public QueuedHandlerDiscarding(String name, Consumer<? super T> consumer, int maxQueueDepth) {
        this(name, consumer, maxQueueDepth, false, Duration.ofMillis(100), Duration.ofSeconds(10),
                new OutstandingWork(), r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    return t;
                });
    }

    private static int checkDepth(int maxQueueDepth) {
        if (maxQueueDepth < 1) {
            throw new IllegalArgumentException("Max queue depth must be positive, got " + maxQueueDepth);
        }
        return maxQueueDepth;
    }

    public int getMaxQueueDepth() {
        return maxQueueDepth;
    }

    @Override
    protected void onRejected(T message) {
        long count = discarded.incrementAndGet();
        logger.debug("Queue depth {} reached, discarded {}, {} discarded in total", maxQueueDepth, message, count);
    }

    @Override
    public long getDiscardedCount() {
        return discarded.get();
    }
}
