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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Routes envelopes to the handlers of one or more modules by the exact runtime type of their command.
 */
public class CommandHandlerInvoker {
    private static final Logger logger = LoggerFactory.getLogger(CommandHandlerInvoker.class);

    private final Map<Class<?>, CommandHandler> handlers = new HashMap<>();

    /**
     * Collect handlers of modules.
     * @param modules modules to collect handlers from
     * @throws IllegalStateException when two handlers handle same command type
     */
    public CommandHandlerInvoker(CommandHandlerModule... modules) {
        for (CommandHandlerModule module : modules) {
            for (CommandHandler handler : module) {
                if (handlers.putIfAbsent(handler.getCommandType(), handler) != null) {
                    throw new IllegalStateException("There's already a handler registered for the command of type '"
                            + handler.getCommandType().getName() + "'");
                }
            }
        }
    }

    public boolean canHandle(Class<?> commandType) {
        return handlers.containsKey(commandType);
    }

    /**
     * Invoke handler of the envelope's command.
     * @param envelope envelope with the command
     * @param token cancellation of the handling
     * @return stage completing with the handling, completed exceptionally with {@link IllegalArgumentException} when
     * no handler exists for the command
     */
    public CompletionStage<Void> invoke(CommandEnvelope envelope, CancellationToken token) {
        Objects.requireNonNull(envelope, "Envelope must be specified");
        Objects.requireNonNull(envelope.getCommand(), "Envelope must carry a command");
        CommandHandler handler = handlers.get(envelope.getCommand().getClass());
        if (handler == null) {
            CompletableFuture<Void> result = new CompletableFuture<>();
            result.completeExceptionally(new IllegalArgumentException(
                    "No handler registered for the command of type '" + envelope.getCommand().getClass().getName() + "'"));
            return result;
        }
        logger.debug("Invoking {} for {}", handler, envelope);
        try {
            return handler.handle(envelope, token == null ? CancellationToken.NONE : token);
        } catch (RuntimeException e) {
            CompletableFuture<Void> result = new CompletableFuture<>();
            result.completeExceptionally(e);
            return result;
        }
    }
}
