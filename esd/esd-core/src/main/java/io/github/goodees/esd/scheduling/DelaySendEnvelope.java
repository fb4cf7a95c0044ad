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
import java.util.Objects;

/**
 * A message to be delivered by {@link LaterService} at a given time.
 * @param <T> type of message
 */
public final class DelaySendEnvelope<T> {
    private final Instant dueTime;
    private final T message;

    private DelaySendEnvelope(Instant dueTime, T message) {
        this.dueTime = Objects.requireNonNull(dueTime, "Due time must be specified");
        this.message = Objects.requireNonNull(message, "Message must be specified");
    }

    public static <T> DelaySendEnvelope<T> of(TimeSource timeSource, Duration delay, T message) {
        Objects.requireNonNull(timeSource, "Time source must be specified");
        Objects.requireNonNull(delay, "Delay must be specified");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative, got " + delay);
        }
        return new DelaySendEnvelope<>(timeSource.now().plus(delay), message);
    }

    public static <T> DelaySendEnvelope<T> at(Instant dueTime, T message) {
        return new DelaySendEnvelope<>(dueTime, message);
    }

    public Instant getDueTime() {
        return dueTime;
    }

    public T getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "DelaySendEnvelope[dueTime=" + dueTime + ", message=" + message + "]";
    }
}
