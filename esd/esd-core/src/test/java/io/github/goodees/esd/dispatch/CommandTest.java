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
import io.github.goodees.esd.CancellationTokenSource;
import io.github.goodees.esd.CorrelatedMessage;
import org.junit.Test;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class CommandTest {

    static class DoIt extends Command {
        DoIt() {
        }

        DoIt(CancellationToken token) {
            super(token);
        }

        DoIt(CorrelatedMessage source) {
            super(source);
        }

        DoIt(CorrelatedMessage source, CancellationToken token) {
            super(source, token);
        }
    }

    static class Happened implements CorrelatedMessage {
        private final UUID msgId = UUID.randomUUID();

        @Override
        public UUID getMsgId() {
            return msgId;
        }

        @Override
        public UUID getCorrelationId() {
            return msgId;
        }

        @Override
        public UUID getSourceId() {
            return null;
        }
    }

    @Test
    public void root_command_starts_correlation() {
        DoIt root = new DoIt();
        assertThat(root.getCorrelationId(), is(root.getMsgId()));
        assertThat(root.getSourceId(), nullValue());
        assertThat(root.getParent(), nullValue());
        assertThat(root.getCancellationToken(), sameInstance(CancellationToken.NONE));
    }

    @Test
    public void nested_command_shares_correlation_and_token() {
        CancellationTokenSource source = new CancellationTokenSource();
        DoIt root = new DoIt(source.getToken());
        DoIt nested = new DoIt(root);
        assertThat(nested.getCorrelationId(), is(root.getCorrelationId()));
        assertThat(nested.getSourceId(), is(root.getMsgId()));
        assertThat(nested.getParent(), sameInstance(root));
        assertThat(nested.getCancellationToken(), sameInstance(root.getCancellationToken()));
    }

    @Test
    public void command_caused_by_event_is_not_nested() {
        Happened event = new Happened();
        DoIt command = new DoIt(event);
        assertThat(command.getCorrelationId(), is(event.getCorrelationId()));
        assertThat(command.getSourceId(), is(event.getMsgId()));
        assertThat(command.getParent(), nullValue());
    }

    @Test
    public void canceling_parent_cancels_nested() {
        DoIt root = new DoIt();
        DoIt nested = new DoIt(root);
        DoIt grandChild = new DoIt(nested, new CancellationTokenSource().getToken());
        assertThat(grandChild.isCanceled(), is(false));
        assertThat(root.cancel(), is(true));
        assertThat(root.cancel(), is(false));
        assertThat(nested.isCanceled(), is(true));
        assertThat(grandChild.isCanceled(), is(true));
    }

    @Test
    public void canceling_nested_does_not_cancel_parent() {
        DoIt root = new DoIt();
        DoIt nested = new DoIt(root);
        nested.cancel();
        assertThat(root.isCanceled(), is(false));
    }

    @Test
    public void token_cancels_command() {
        CancellationTokenSource source = new CancellationTokenSource();
        DoIt command = new DoIt(source.getToken());
        source.cancel();
        assertThat(command.isCanceled(), is(true));
    }

    @Test
    public void responses_belong_to_command_correlation() {
        DoIt command = new DoIt(new Happened());
        CommandResponse.Success<String> success = command.succeed("done");
        assertThat(success.getData(), is("done"));
        assertThat(success.getCorrelationId(), is(command.getCorrelationId()));
        assertThat(success.getSourceId(), is(command.getMsgId()));
        assertThat(success.getCommandId(), is(command.getMsgId()));

        CommandResponse.Fail fail = command.fail(new IllegalStateException("no"), 42);
        assertThat(fail.isSuccess(), is(false));
        assertThat(fail.getData(Integer.class), is(42));

        CommandResponse.Canceled canceled = command.canceled();
        assertThat(canceled.getException(), instanceOf(CommandCanceledException.class));
    }

    @Test
    public void failure_converts_to_exception() {
        DoIt command = new DoIt();
        assertThat(Dispatcher.toException(command.fail(new IllegalStateException("x"))),
                instanceOf(IllegalStateException.class));
        assertThat(Dispatcher.toException(command.fail(new Exception("checked"))).getCause().getMessage(),
                is("checked"));
        assertThat(Dispatcher.toException(command.fail(null)), instanceOf(CommandException.class));
        assertThat(Dispatcher.toException(new CommandResponse.Canceled(command, null)),
                instanceOf(CommandCanceledException.class));
    }
}
