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

import java.util.Objects;
import java.util.UUID;

/**
 * Terminal outcome of a command. Responses belong to the correlation of their command and name it as their source.
 */
public abstract class CommandResponse implements CorrelatedMessage {
    private final UUID msgId = UUID.randomUUID();
    private final Command sourceCommand;

    protected CommandResponse(Command sourceCommand) {
        this.sourceCommand = Objects.requireNonNull(sourceCommand, "Source command must be specified");
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

    public abstract boolean isSuccess();

    /**
     * Command was handled.
     * @param <T> type of data the handler returned
     */
    public static class Success<T> extends CommandResponse {
        private final T data;

        public Success(Command sourceCommand, T data) {
            super(sourceCommand);
            this.data = data;
        }

        public T getData() {
            return data;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toString() {
            return "Success[" + getSourceCommand() + "]";
        }
    }

    /**
     * Command was not handled successfully.
     */
    public static class Fail extends CommandResponse {
        private final Throwable exception;
        private final Object data;

        public Fail(Command sourceCommand, Throwable exception, Object data) {
            super(sourceCommand);
            this.exception = exception;
            this.data = data;
        }

        /**
         * @return cause of the failure, may be null
         */
        public Throwable getException() {
            return exception;
        }

        public Object getData() {
            return data;
        }

        public <T> T getData(Class<T> type) {
            return type.cast(data);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + getSourceCommand() + ", " + exception + "]";
        }
    }

    /**
     * Command was canceled, either before it was handled or because it timed out.
     */
    public static class Canceled extends Fail {
        public Canceled(Command sourceCommand, Throwable exception) {
            super(sourceCommand, exception, null);
        }
    }
}
