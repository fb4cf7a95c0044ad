package io.github.goodees.esd;

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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner side of a {@link CancellationToken}. The party that creates the source decides when to cancel, everybody
 * holding the token may only observe the cancellation.
 * <p>Cancellation is one-shot. Callbacks registered before cancellation run once on the thread calling
 * {@link #cancel()}, callbacks registered afterwards run immediately on the registering thread.</p>
 */
public class CancellationTokenSource {
    private static final Logger logger = LoggerFactory.getLogger(CancellationTokenSource.class);

    private final AtomicBoolean canceled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final CancellationToken token = new CancellationToken(this);

    public CancellationToken getToken() {
        return token;
    }

    public boolean isCancellationRequested() {
        return canceled.get();
    }

    /**
     * Request cancellation.
     * @return true if this call canceled the source, false if it was already canceled
     */
    public boolean cancel() {
        if (!canceled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
        return true;
    }

    void register(Runnable callback) {
        Runnable once = new Once(callback);
        callbacks.add(once);
        // cancel() may have already iterated the list
        if (canceled.get()) {
            callbacks.remove(once);
            runCallback(once);
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("Cancellation callback {} failed", callback, e);
        }
    }

    private static class Once implements Runnable {
        private final Runnable delegate;
        private final AtomicBoolean ran = new AtomicBoolean();

        Once(Runnable delegate) {
            this.delegate = delegate;
        }

        @Override
        public void run() {
            if (ran.compareAndSet(false, true)) {
                delegate.run();
            }
        }

        @Override
        public String toString() {
            return delegate.toString();
        }
    }
}
