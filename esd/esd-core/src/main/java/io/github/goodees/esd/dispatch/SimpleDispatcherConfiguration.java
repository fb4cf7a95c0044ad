package io.github.goodees.esd.dispatch;

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

import io.github.goodees.esd.scheduling.SystemTimeSource;
import io.github.goodees.esd.scheduling.TimeSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * General Dispatcher configuration implementation, as alternative to defining own implementation. All settings are
 * passed to the constructor; {@link #defaults(String)} and the {@code withX} methods offer a shorter way.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_SLOW_MESSAGE_THRESHOLD = Duration.ofMillis(100);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final Duration ackTimeout;
    private final Duration responseTimeout;
    private final boolean watchSlowMessages;
    private final Duration slowMessageThreshold;
    private final Duration stopTimeout;
    private final ThreadFactory threadFactory;
    private final TimeSource timeSource;

    /**
     * Create dispatcher configuration.
     * @param name the name of the dispatcher
     * @param ackTimeout default acknowledgement timeout
     * @param responseTimeout default response timeout
     * @param watchSlowMessages whether to log slow messages
     * @param slowMessageThreshold processing time considered slow
     * @param stopTimeout time to wait for workers to stop
     * @param threadFactory factory of worker threads
     * @param timeSource time source for timeouts
     */
    public SimpleDispatcherConfiguration(String name, Duration ackTimeout, Duration responseTimeout,
            boolean watchSlowMessages, Duration slowMessageThreshold, Duration stopTimeout,
            ThreadFactory threadFactory, TimeSource timeSource) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.ackTimeout = positive(Objects.requireNonNull(ackTimeout, "Ack timeout must be specified"), "Ack timeout");
        this.responseTimeout = positive(Objects.requireNonNull(responseTimeout, "Response timeout must be specified"),
                "Response timeout");
        this.watchSlowMessages = watchSlowMessages;
        this.slowMessageThreshold = Objects.requireNonNull(slowMessageThreshold,
                "Slow message threshold must be specified");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "Stop timeout must be specified");
        this.threadFactory = Objects.requireNonNull(threadFactory, "Thread factory must be specified");
        this.timeSource = Objects.requireNonNull(timeSource, "Time source must be specified");
    }

    /**
     * Configuration with library defaults: acknowledgement timeout of 100 ms, response timeout of 500 ms, slow
     * message watching off, daemon threads and system time.
     * @param name the name of the dispatcher
     * @return the configuration
     */
    public static SimpleDispatcherConfiguration defaults(String name) {
        return new SimpleDispatcherConfiguration(name, DEFAULT_ACK_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT, false,
                DEFAULT_SLOW_MESSAGE_THRESHOLD, DEFAULT_STOP_TIMEOUT, daemonThreads(), SystemTimeSource.INSTANCE);
    }

    static Duration positive(Duration duration, String what) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(what + " must be positive, got " + duration);
        }
        return duration;
    }

    /**
     * Thread factory creating daemon threads.
     * @return a thread factory
     */
    public static ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        };
    }

    public SimpleDispatcherConfiguration withTimeouts(Duration ackTimeout, Duration responseTimeout) {
        return new SimpleDispatcherConfiguration(name, ackTimeout, responseTimeout, watchSlowMessages,
                slowMessageThreshold, stopTimeout, threadFactory, timeSource);
    }

    public SimpleDispatcherConfiguration withSlowMessageWatching(Duration threshold) {
        return new SimpleDispatcherConfiguration(name, ackTimeout, responseTimeout, true, threshold, stopTimeout,
                threadFactory, timeSource);
    }

    public SimpleDispatcherConfiguration withStopTimeout(Duration stopTimeout) {
        return new SimpleDispatcherConfiguration(name, ackTimeout, responseTimeout, watchSlowMessages,
                slowMessageThreshold, stopTimeout, threadFactory, timeSource);
    }

    public SimpleDispatcherConfiguration withThreadFactory(ThreadFactory threadFactory) {
        return new SimpleDispatcherConfiguration(name, ackTimeout, responseTimeout, watchSlowMessages,
                slowMessageThreshold, stopTimeout, threadFactory, timeSource);
    }

    public SimpleDispatcherConfiguration withTimeSource(TimeSource timeSource) {
        return new SimpleDispatcherConfiguration(name, ackTimeout, responseTimeout, watchSlowMessages,
                slowMessageThreshold, stopTimeout, threadFactory, timeSource);
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public Duration ackTimeout() {
        return ackTimeout;
    }

    @Override
    public Duration responseTimeout() {
        return responseTimeout;
    }

    @Override
    public boolean watchSlowMessages() {
        return watchSlowMessages;
    }

    @Override
    public Duration slowMessageThreshold() {
        return slowMessageThreshold;
    }

    @Override
    public Duration stopTimeout() {
        return stopTimeout;
    }

    @Override
    public ThreadFactory threadFactory() {
        return threadFactory;
    }

    @Override
    public TimeSource timeSource() {
        return timeSource;
    }
}
