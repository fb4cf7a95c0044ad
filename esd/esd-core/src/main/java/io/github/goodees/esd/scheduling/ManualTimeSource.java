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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Time that changes only when told to. Meant for tests: after {@link #advance(Duration)} returns, every listener has
 * observed the new time.
 */
public class ManualTimeSource implements TimeSource {
    private final AtomicReference<Instant> now;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public ManualTimeSource() {
        this(Instant.parse("2017-01-01T00:00:00Z"));
    }

    public ManualTimeSource(Instant start) {
        this.now = new AtomicReference<>(Objects.requireNonNull(start, "Start must be specified"));
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration duration) {
        Objects.requireNonNull(duration, "Duration must be specified");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Time cannot go backwards, got " + duration);
        }
        now.updateAndGet(n -> n.plus(duration));
        notifyListeners();
    }

    public void setNow(Instant instant) {
        now.set(Objects.requireNonNull(instant, "Instant must be specified"));
        notifyListeners();
    }

    private void notifyListeners() {
        listeners.forEach(Runnable::run);
    }

    @Override
    public boolean isManual() {
        return true;
    }

    @Override
    public void addTimeChangeListener(Runnable listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must be specified"));
    }

    @Override
    public void removeTimeChangeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
