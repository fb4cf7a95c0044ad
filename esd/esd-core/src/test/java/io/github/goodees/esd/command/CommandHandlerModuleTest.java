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
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class CommandHandlerModuleTest {

    static class OpenAccount {
    }

    static class Deposit {
        final long amount;

        Deposit(long amount) {
            this.amount = amount;
        }
    }

    static class Withdraw {
    }

    static CompletionStage<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    static class AccountModule extends CommandHandlerModule {
        final List<String> log = new ArrayList<>();

        AccountModule() {
            handle(OpenAccount.class, envelope -> {
                log.add("open");
                return done();
            });
            handle(Deposit.class, (envelope, token) -> {
                log.add("deposit " + envelope.getCommand().amount);
                return done();
            });
            forCommand(Withdraw.class)
                    .pipe(next -> (envelope, token) -> {
                        log.add("piped");
                        return next.handle(envelope, token);
                    })
                    .handle((envelope, token) -> {
                        log.add("withdraw");
                        return done();
                    });
        }
    }

    @Test
    public void handlers_are_kept_in_registration_order() {
        AccountModule module = new AccountModule();
        List<String> types = new ArrayList<>();
        for (CommandHandler handler : module) {
            types.add(handler.getCommandType().getSimpleName());
        }
        assertThat(types, contains("OpenAccount", "Deposit", "Withdraw"));
        assertThat(module.getHandlers(), hasSize(3));
    }

    @Test
    public void handler_receives_typed_envelope() {
        AccountModule module = new AccountModule();
        module.getHandlers().get(1).handle(new CommandEnvelope().withCommand(new Deposit(42)), CancellationToken.NONE);
        assertThat(module.log, contains("deposit 42"));
    }

    @Test
    public void piped_handler_runs_through_pipe() {
        AccountModule module = new AccountModule();
        module.getHandlers().get(2).handle(new CommandEnvelope().withCommand(new Withdraw()), CancellationToken.NONE);
        assertThat(module.log, contains("piped", "withdraw"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void handlers_cannot_be_modified_from_outside() {
        new AccountModule().getHandlers().clear();
    }
}
