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

import io.github.goodees.esd.scheduling.TimeSource;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;

/**
 * Dependencies and settings of a Dispatcher.
 */
public interface DispatcherConfiguration {
    String dispatcherName();

    /**
     * How long a fired command may wait for its handler to pick it up, unless given explicitly.
     * @return default acknowledgement timeout
     */
    Duration ackTimeout();

    /**
     * How long a handler may take to respond after picking a command up, unless given explicitly.
     * @return default response timeout
     */
    Duration responseTimeout();

    /**
     * Whether queues log messages processed longer than {@link #slowMessageThreshold()}.
     * @return true to watch for slow messages
     */
    boolean watchSlowMessages();

    Duration slowMessageThreshold();

    /**
     * How long to wait for a worker to finish its current message when stopping it.
     * @return stop timeout
     */
    Duration stopTimeout();

    /**
     * Factory of the threads of command workers and of the publishing queue. The dispatcher names the threads.
     * @return thread factory
     */
    ThreadFactory threadFactory();

    /**
     * Time the timeouts are measured in.
     * @return time source
     */
    TimeSource timeSource();
}
