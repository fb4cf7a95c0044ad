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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Group of command handlers, declared in the constructor of a subclass:
 * <pre>
 *     public AccountModule(StreamStoreRepository repository) {
 *         handle(OpenAccount.class, envelope -&gt; ...);
 *         forCommand(Deposit.class).pipe(logging()).handle((envelope, token) -&gt; ...);
 *     }
 * </pre>
 * Handlers are kept in declaration order.
 */
public abstract class CommandHandlerModule implements Iterable<CommandHandler> {
    private final List<CommandHandler> handlers = new ArrayList<>();

    protected CommandHandlerModule() {
    }

    protected <C> CommandHandlerBuilder<C> forCommand(Class<C> commandType) {
        Objects.requireNonNull(commandType, "Command type must be specified");
        return new CommandHandlerBuilder<>(handler -> add(commandType, handler));
    }

    protected <C> void handle(Class<C> commandType, Function<TypedCommandEnvelope<C>, CompletionStage<Void>> handler) {
        Objects.requireNonNull(handler, "Handler must be specified");
        handle(commandType, (envelope, token) -> handler.apply(envelope));
    }

    protected <C> void handle(Class<C> commandType, CommandHandlerFunction<TypedCommandEnvelope<C>> handler) {
        Objects.requireNonNull(commandType, "Command type must be specified");
        Objects.requireNonNull(handler, "Handler must be specified");
        add(commandType, handler);
    }

    private <C> void add(Class<C> commandType, CommandHandlerFunction<TypedCommandEnvelope<C>> handler) {
        handlers.add(new CommandHandler(commandType,
                (envelope, token) -> handler.handle(envelope.typedAs(commandType), token)));
    }

    public List<CommandHandler> getHandlers() {
        return Collections.unmodifiableList(new ArrayList<>(handlers));
    }

    @Override
    public Iterator<CommandHandler> iterator() {
        return getHandlers().iterator();
    }
}
