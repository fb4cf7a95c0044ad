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

/**
 * Handler of a command type. Runs on the command type's worker thread, one command at a time.
 * @param <C> type of command
 */
@FunctionalInterface
public interface HandleCommand<C extends Command> {
    /**
     * Handle the command. Long running handlers should check {@link Command#isCanceled()} where they can stop.
     * @param command the command
     * @return the response, usually {@link Command#succeed()} or {@link Command#fail(Throwable)}
     * @throws Exception when handling fails; the caller receives a failure with that exception
     */
    CommandResponse handle(C command) throws Exception;
}
