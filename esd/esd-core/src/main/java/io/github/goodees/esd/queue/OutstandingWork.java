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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter of work accepted but not finished, shared by a group of queues. Work caused by other work must be
 * {@linkplain #increment() counted} before the causing work is {@linkplain #decrement() finished}, so the counter
 * never drops to zero while anything is still in flight.
 */
public final class OutstandingWork {
    private final AtomicLong count = new AtomicLong();

    public void increment() {
        count.incrementAndGet();
    }

    public void decrement() {
        long remaining = count.decrementAndGet();
        if (remaining < 0) {
            count.incrementAndGet();
            throw new IllegalStateException("Outstanding work decremented below zero");
        }
    }

    public long get() {
        return count.get();
    }

    public boolean isIdle() {
        return count.get() == 0;
    }
}
