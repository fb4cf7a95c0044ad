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
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Fluent composition of a handler with the pipes wrapping it. Every {@link #pipe(UnaryOperator)} returns a new
 * builder; {@link #handle(CommandHandlerFunction)} wraps the handler so that the pipe registered first is the
 * outermost one, and passes the result on.
 * @param <C> type of command
 */
public final class CommandHandlerBuilder<C> {
    private final Consumer<CommandHandlerFunction<TypedCommandEnvelope<C>>> build;
    private final List<UnaryOperator<CommandHandlerFunction<TypedCommandEnvelope<C>>>> pipeline;

    CommandHandlerBuilder(Consumer<CommandHandlerFunction<TypedCommandEnvelope<C>>> build) {
        this(build, Collections.emptyList());
    }

    private CommandHandlerBuilder(Consumer<CommandHandlerFunction<TypedCommandEnvelope<C>>> build,
            List<UnaryOperator<CommandHandlerFunction<TypedCommandEnvelope<C>>>> pipeline) {
        this.build = Objects.requireNonNull(build, "Build must be specified");
        this.pipeline = pipeline;
    }

    public CommandHandlerBuilder<C> pipe(UnaryOperator<CommandHandlerFunction<TypedCommandEnvelope<C>>> pipe) {
        Objects.requireNonNull(pipe, "Pipe must be specified");
        List<UnaryOperator<CommandHandlerFunction<TypedCommandEnvelope<C>>>> extended = new ArrayList<>(pipeline);
        extended.add(pipe);
        return new CommandHandlerBuilder<>(build, Collections.unmodifiableList(extended));
    }

    public void handle(CommandHandlerFunction<TypedCommandEnvelope<C>> handler) {
        Objects.requireNonNull(handler, "Handler must be specified");
        CommandHandlerFunction<TypedCommandEnvelope<C>> next = handler;
        for (int i = pipeline.size() - 1; i >= 0; i--) {
            next = pipeline.get(i).apply(next);
        }
        build.accept(next);
    }
}
