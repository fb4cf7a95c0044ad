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
 * {@link CommandEnvelope} with statically known command type. Obtained via {@link CommandEnvelope#typedAs(Class)}.
 * @param <C> type of command
 */
public final class TypedCommandEnvelope<C> {
    private final C command;
    private final UUID commandId;
    private final UUID correlationId;
    private final UUID sourceId;
    private final Metadata metadata;
    private final Principal principal;

    TypedCommandEnvelope(C command, UUID commandId, UUID correlationId, UUID sourceId, Metadata metadata,
            Principal principal) {
        this.command = command;
        this.commandId = commandId;
        this.correlationId = correlationId;
        this.sourceId = sourceId;
        this.metadata = metadata;
        this.principal = principal;
    }

    public TypedCommandEnvelope<C> withCommand(C command) {
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public TypedCommandEnvelope<C> withCommandId(UUID commandId) {
        Objects.requireNonNull(commandId, "Command id must be specified");
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public TypedCommandEnvelope<C> withCorrelationId(UUID correlationId) {
        Objects.requireNonNull(correlationId, "Correlation id must be specified");
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public TypedCommandEnvelope<C> withSourceId(UUID sourceId) {
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public TypedCommandEnvelope<C> withMetadata(Metadata metadata) {
        Objects.requireNonNull(metadata, "Metadata must be specified");
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public TypedCommandEnvelope<C> withPrincipal(Principal principal) {
        return new TypedCommandEnvelope<>(command, commandId, correlationId, sourceId, metadata, principal);
    }

    public C getCommand() {
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
}
