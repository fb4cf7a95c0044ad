package io.github.goodees.esd.command;

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

import java.security.Principal;
import java.util.Objects;
import java.util.UUID;

/**
 * A command together with its identification and context. Immutable, every {@code withX} method returns a copy.
 */
public final class CommandEnvelope {
    static final UUID NIL = new UUID(0, 0);

    private final UUID commandId;
    private final UUID correlationId;
    private final UUID sourceId;
    private final Object command;
    private final Metadata metadata;
    private final Principal principal;

    public CommandEnvelope() {
        this(NIL, NIL, null, null, Metadata.NONE, null);
    }

    private CommandEnvelope(UUID commandId, UUID correlationId, UUID sourceId, Object command, Metadata metadata,
            Principal principal) {
        this.commandId = commandId;
        this.correlationId = correlationId;
        this.sourceId = sourceId;
        this.command = command;
        this.metadata = metadata;
        this.principal = principal;
    }

    public CommandEnvelope withCommand(Object command) {
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public CommandEnvelope withCommandId(UUID commandId) {
        Objects.requireNonNull(commandId, "Command id must be specified");
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public CommandEnvelope withCorrelationId(UUID correlationId) {
        Objects.requireNonNull(correlationId, "Correlation id must be specified");
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public CommandEnvelope withSourceId(UUID sourceId) {
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public CommandEnvelope withMetadata(Metadata metadata) {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public CommandEnvelope withPrincipal(Principal principal) {
        return new CommandEnvelope(commandId, correlationId, sourceId, command, metadata, principal);
    }

    public Object getCommand() {
        return command;
    }

    public UUID getCommandId() {
        return commandId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Principal getPrincipal() {
        return principal;
    }

    /**
     * View this envelope as carrying a command of specific type.
     * @param commandType expected type of the command
     * @param <C> type of command
     * @return typed envelope with same content
     * @throws ClassCastException when the command is not an instance of the type
     */
    public <C> TypedCommandEnvelope<C> typedAs(Class<C> commandType) {
        Objects.requireNonNull(commandType, "Command type must be specified");
        return new TypedCommandEnvelope<>(commandType.cast(command), commandId, correlationId, sourceId, metadata,
                principal);
    }

    @Override
    public String toString() {
        return "CommandEnvelope[commandId=" + commandId + ", correlationId=" + correlationId + ", command=" + command
                + "]";
    }
}
