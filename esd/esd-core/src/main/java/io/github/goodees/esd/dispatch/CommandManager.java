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

import io.github.goodees.esd.scheduling.DelaySendEnvelope;
import io.github.goodees.esd.scheduling.LaterService;
import io.github.goodees.esd.scheduling.TimeSource;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks fired commands until their response arrives. Acknowledgement and response timeouts are scheduled on an
 * internal {@link LaterService}, so they are driven by the dispatcher's {@link TimeSource}.
 *
 * <p>A tracker stays registered until the handler's response arrives, even when the caller already got a timeout.
 * That way late responses can be told apart from responses of untracked commands.
 */
class CommandManager implements AutoCloseable {
    private final Logger logger;
    private final TimeSource timeSource;
    private final ConcurrentMap<UUID, CommandTracker> trackers = new ConcurrentHashMap<>();
    private final LaterService<Runnable> timeouts;

    CommandManager(String name, TimeSource timeSource, Logger logger) {
        this.logger = logger;
        this.timeSource = timeSource;
        this.timeouts = new LaterService<>(name + "-timeouts", Runnable::run, timeSource);
    }

    void start() {
        timeouts.start();
    }

    /**
     * Start tracking a command. The acknowledgement timeout starts now.
     * @throws CommandException when the command is tracked already
     */
    CommandTracker register(Command command, Duration ackTimeout, Duration responseTimeout) {
        CommandTracker tracker = new CommandTracker(command, ackTimeout, responseTimeout);
        if (trackers.putIfAbsent(command.getMsgId(), tracker) != null) {
            throw new CommandException(command, CommandException.describe(command) + " was already fired");
        }
        timeouts.handle(DelaySendEnvelope.of(timeSource, ackTimeout, () -> {
            if (tracker.ackTimedOut()) {
                logger.warn("{} was not acknowledged within {} ms", command, ackTimeout.toMillis());
            }
        }));
        return tracker;
    }

    /**
     * Complete tracking of a command that never reached a handler.
     */
    void completeUnhandled(CommandTracker tracker, CommandResponse response) {
        trackers.remove(tracker.getCommand().getMsgId(), tracker);
        tracker.complete(response);
    }

    /**
     * Process acknowledgement of a command by a handler.
     * @return true when the handler should proceed with the command
     */
    boolean handleAck(AckCommand ack) {
        CommandTracker tracker = trackers.get(ack.getCommandId());
        if (tracker == null) {
            return true;
        }
        if (tracker.ack()) {
            Duration responseTimeout = tracker.getResponseTimeout();
            timeouts.handle(DelaySendEnvelope.of(timeSource, responseTimeout, () -> {
                if (tracker.responseTimedOut()) {
                    logger.warn("{} did not respond within {} ms", tracker.getCommand(), responseTimeout.toMillis());
                }
            }));
            return true;
        }
        if (tracker.getCommand().isCanceled()) {
            logger.debug("{} acknowledged after it was completed, skipping", ack.getSourceCommand());
        } else {
            logger.warn("{} acknowledged after it was completed, skipping", ack.getSourceCommand());
        }
        return false;
    }

    /**
     * Deliver a handler's response to the caller.
     */
    void handleResponse(CommandResponse response) {
        CommandTracker tracker = trackers.remove(response.getCommandId());
        if (tracker == null) {
            logger.debug("Response {} of untracked command", response);
            return;
        }
        if (!tracker.complete(response)) {
            if (response instanceof CommandResponse.Canceled) {
                logger.debug("{} was skipped after it had been completed", response.getSourceCommand());
            } else {
                logger.warn("Late response {} ignored, caller already received an outcome", response);
            }
        }
    }

    int getTrackedCount() {
        return trackers.size();
    }

    /**
     * Cancel all tracked commands.
     */
    void cancelAll() {
        List<CommandTracker> pending = new ArrayList<>(trackers.values());
        trackers.clear();
        for (CommandTracker tracker : pending) {
            Command command = tracker.getCommand();
            command.cancel();
            tracker.complete(command.canceled());
        }
    }

    @Override
    public void close() {
        cancelAll();
        timeouts.close();
    }
}
