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

import io.github.goodees.esd.CancellationToken;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Association of a command type with the function handling it.
 */
public final class CommandHandler {
    private final Class<?> commandType;
    private final CommandHandlerFunction<CommandEnvelope> handler;

    public CommandHandler(Class<?> commandType, CommandHandlerFunction<CommandEnvelope> handler) {
        this.commandType = Objects.requireNonNull(commandType, "Command type must be specified");
        this.handler = Objects.requireNonNull(handler, "Handler must be specified");
    }

    public Class<?> getCommandType() {
        return commandType;
    }

    public CommandHandlerFunction<CommandEnvelope> getHandler() {
        return handler;
    }

    public CompletionStage<Void> handle(CommandEnvelope envelope, CancellationToken token) {
        return handler.handle(envelope, token);
    }

    @Override
    public String toString() {
        return "CommandHandler[" + commandType.getName() + "]";
    }
}
