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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bookkeeping of a single fired command. The tracker moves from {@link State#PENDING_ACK} to
 * {@link State#PENDING_RESPONSE} when the command is picked up, and to {@link State#COMPLETE} exactly once, by
 * whichever comes first of response, timeout or cancellation. Only the first outcome reaches the caller.
 */
public final class CommandTracker {
    public enum State {
        PENDING_ACK, PENDING_RESPONSE, COMPLETE
    }

    private final Command command;
    private final Duration ackTimeout;
    private final Duration responseTimeout;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING_ACK);
    private final CompletableFuture<CommandResponse> result = new CompletableFuture<>();

    CommandTracker(Command command, Duration ackTimeout, Duration responseTimeout) {
        this.command = command;
        this.ackTimeout = ackTimeout;
        this.responseTimeout = responseTimeout;
    }

    public Command getCommand() {
        return command;
    }

    public State getState() {
        return state.get();
    }

    Duration getResponseTimeout() {
        return responseTimeout;
    }

    CompletableFuture<CommandResponse> getResult() {
        return result;
    }

    /**
     * Record that a handler picked the command up.
     * @return true for the first acknowledgement of a pending command
     */
    boolean ack() {
        if (state.compareAndSet(State.PENDING_ACK, State.PENDING_RESPONSE)) {
            return true;
        }
        if (state.get() == State.PENDING_RESPONSE) {
            command.cancel();
            complete(command.fail(new CommandOversubscribedException(command, "acknowledged more than once")));
        }
        return false;
    }

    /**
     * Deliver the response to the caller.
     * @param response terminal response
     * @return false when the tracker was already complete
     */
    boolean complete(CommandResponse response) {
        State previous = state.getAndSet(State.COMPLETE);
        if (previous == State.COMPLETE) {
            return false;
        }
        result.complete(response);
        return true;
    }

    boolean ackTimedOut() {
        if (state.compareAndSet(State.PENDING_ACK, State.COMPLETE)) {
            command.cancel();
            result.complete(command.fail(new CommandAckTimeoutException(command, ackTimeout)));
            return true;
        }
        return false;
    }

    boolean responseTimedOut() {
        if (state.compareAndSet(State.PENDING_RESPONSE, State.COMPLETE)) {
            command.cancel();
            result.complete(new CommandResponse.Canceled(command, new CommandTimedOutException(command, responseTimeout)));
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "CommandTracker[" + command + ", " + state.get() + "]";
    }
}
