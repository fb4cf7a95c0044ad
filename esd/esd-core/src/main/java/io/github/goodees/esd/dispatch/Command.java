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

import io.github.goodees.esd.CancellationToken;
import io.github.goodees.esd.CorrelatedMessage;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A request for a single handler to do something. Subclasses are the commands of the application; the dispatcher
 * finds the handler by the exact runtime class.
 *
 * <p>A command created from another command is nested: it belongs to the same correlation, shares the parent's
 * cancellation token and is canceled whenever the parent is.
 */
public abstract class Command implements CorrelatedMessage {
    private final UUID msgId = UUID.randomUUID();
    private final UUID correlationId;
    private final UUID sourceId;
    private final CancellationToken token;
    private final Command parent;
    private final AtomicBoolean canceled = new AtomicBoolean();

    /**
     * Root command, not cancelable from outside of the dispatcher.
     */
    protected Command() {
        this(CancellationToken.NONE);
    }

    /**
     * Root command canceled via the token.
     * @param token the cancellation token
     */
    protected Command(CancellationToken token) {
        this.correlationId = msgId;
        this.sourceId = null;
        this.token = Objects.requireNonNull(token, "Token must be specified");
        this.parent = null;
    }

    /**
     * Command caused by another message. When the source is a command, this command is nested in it.
     * @param source causing message
     */
    protected Command(CorrelatedMessage source) {
        Objects.requireNonNull(source, "Source must be specified");
        this.correlationId = source.getCorrelationId();
        this.sourceId = source.getMsgId();
        this.parent = source instanceof Command ? (Command) source : null;
        this.token = parent != null ? parent.token : CancellationToken.NONE;
    }

    /**
     * Command caused by another message, with its own cancellation token.
     * @param source causing message
     * @param token the cancellation token
     */
    protected Command(CorrelatedMessage source, CancellationToken token) {
        Objects.requireNonNull(source, "Source must be specified");
        this.correlationId = source.getCorrelationId();
        this.sourceId = source.getMsgId();
        this.parent = source instanceof Command ? (Command) source : null;
        this.token = Objects.requireNonNull(token, "Token must be specified");
    }

    @Override
    public UUID getMsgId() {
        return msgId;
    }

    @Override
    public UUID getCorrelationId() {
        return correlationId;
    }

    @Override
    public UUID getSourceId() {
        return sourceId;
    }

    public CancellationToken getCancellationToken() {
        return token;
    }

    public Command getParent() {
        return parent;
    }

    /**
     * Whether this command should not be processed anymore.
     * @return true when the dispatcher canceled it, its token was canceled, or its parent is canceled
     */
    public boolean isCanceled() {
        return canceled.get() || token.isCancellationRequested() || (parent != null && parent.isCanceled());
    }

    /**
     * Mark canceled. Only the dispatcher does this, when the command times out.
     * @return true if this call changed the flag
     */
    boolean cancel() {
        return canceled.compareAndSet(false, true);
    }

    public CommandResponse.Success<Void> succeed() {
        return new CommandResponse.Success<>(this, null);
    }

    public <T> CommandResponse.Success<T> succeed(T data) {
        return new CommandResponse.Success<>(this, data);
    }

    public CommandResponse.Fail fail(Throwable exception) {
        return new CommandResponse.Fail(this, exception, null);
    }

    public CommandResponse.Fail fail(Throwable exception, Object data) {
        return new CommandResponse.Fail(this, exception, data);
    }

    public CommandResponse.Canceled canceled() {
        return new CommandResponse.Canceled(this, new CommandCanceledException(this));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[msgId=" + msgId + ", correlationId=" + correlationId + "]";
    }
}
