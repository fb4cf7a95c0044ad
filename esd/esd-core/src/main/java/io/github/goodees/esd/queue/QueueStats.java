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

/**
 * Point in time snapshot of a queue's state.
 */
public final class QueueStats {
    private final String name;
    private final int length;
    private final long processedCount;
    private final long discardedCount;
    private final boolean idle;
    private final Class<?> currentMessageType;
    private final Class<?> lastProcessedMessageType;
    private final Duration lastProcessingTime;
    private final Duration busyTime;
    private final Duration uptime;

    QueueStats(String name, int length, long processedCount, long discardedCount, boolean idle,
            Class<?> currentMessageType, Class<?> lastProcessedMessageType, Duration lastProcessingTime,
            Duration busyTime, Duration uptime) {
        this.name = name;
        this.length = length;
        this.processedCount = processedCount;
        this.discardedCount = discardedCount;
        this.idle = idle;
        this.currentMessageType = currentMessageType;
        this.lastProcessedMessageType = lastProcessedMessageType;
        this.lastProcessingTime = lastProcessingTime;
        this.busyTime = busyTime;
        this.uptime = uptime;
    }

    public String getName() {
        return name;
    }

    public int getLength() {
        return length;
    }

    public long getProcessedCount() {
        return processedCount;
    }

    public long getDiscardedCount() {
        return discardedCount;
    }

    public boolean isIdle() {
        return idle;
    }

    /**
     * @return type of message being processed, null when idle
     */
    public Class<?> getCurrentMessageType() {
        return currentMessageType;
    }

    public Class<?> getLastProcessedMessageType() {
        return lastProcessedMessageType;
    }

    public Duration getLastProcessingTime() {
        return lastProcessingTime;
    }

    public Duration getBusyTime() {
        return busyTime;
    }

    public Duration getUptime() {
        return uptime;
    }

    @Override
    public String toString() {
        return "QueueStats[" + name + ", length=" + length + ", processed=" + processedCount
                + ", discarded=" + discardedCount + ", idle=" + idle
                + ", current=" + (currentMessageType == null ? "<none>" : currentMessageType.getSimpleName())
                + ", lastProcessingTime=" + lastProcessingTime + ", busy=" + busyTime + ", uptime=" + uptime + "]";
    }
}
