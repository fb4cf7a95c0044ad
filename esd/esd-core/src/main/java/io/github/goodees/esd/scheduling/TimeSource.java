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

/**
 * Source of current time for everything that schedules.
 */
public interface TimeSource {
    Instant now();

    /**
     * Nanoseconds from now until given instant, zero or negative when the instant has passed. Saturates at
     * {@link Long#MAX_VALUE}.
     * @param instant the instant to wait for
     * @return nanoseconds to wait
     */
    default long nanosUntil(Instant instant) {
        Duration remaining = Duration.between(now(), instant);
        if (remaining.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L) {
            return Long.MAX_VALUE;
        }
        if (remaining.getSeconds() <= Long.MIN_VALUE / 1_000_000_000L) {
            return Long.MIN_VALUE;
        }
        return remaining.toNanos();
    }

    /**
     * Whether the time only moves when listeners are notified. Waiting for such time is done by waiting for the
     * notification, not by sleeping.
     * @return true when the time does not pass on its own
     */
    default boolean isManual() {
        return false;
    }

    /**
     * Be notified when the time changes other than by passing naturally.
     * @param listener listener to call, on the thread changing the time
     */
    void addTimeChangeListener(Runnable listener);

    void removeTimeChangeListener(Runnable listener);
}
