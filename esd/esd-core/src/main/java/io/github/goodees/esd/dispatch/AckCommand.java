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

import io.github.goodees.esd.CorrelatedMessage;

import java.util.UUID;

/**
 * Published when a handler picks a command up.
 */
public final class AckCommand implements CorrelatedMessage {
    private final UUID msgId = UUID.randomUUID();
    private final Command sourceCommand;

    public AckCommand(Command sourceCommand) {
        this.sourceCommand = sourceCommand;
    }

    @Override
    public UUID getMsgId() {
        return msgId;
    }

    @Override
    public UUID getCorrelationId() {
        return sourceCommand.getCorrelationId();
    }

    @Override
    public UUID getSourceId() {
        return sourceCommand.getMsgId();
    }

    public Command getSourceCommand() {
        return sourceCommand;
    }

    public UUID getCommandId() {
        return sourceCommand.getMsgId();
    }

    public Class<? extends Command> getCommandType() {
        return sourceCommand.getClass();
    }

    @Override
    public String toString() {
        return "AckCommand[" + sourceCommand + "]";
    }
}
