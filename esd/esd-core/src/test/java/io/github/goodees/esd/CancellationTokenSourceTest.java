package io.github.goodees.esd;

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

import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class CancellationTokenSourceTest {

    @Test
    public void token_observes_cancellation() {
        CancellationTokenSource source = new CancellationTokenSource();
        CancellationToken token = source.getToken();
        assertThat(token.canBeCanceled(), is(true));
        assertThat(token.isCancellationRequested(), is(false));
        assertThat(source.cancel(), is(true));
        assertThat(token.isCancellationRequested(), is(true));
        assertThat(source.isCancellationRequested(), is(true));
    }

    @Test
    public void second_cancel_has_no_effect() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.getToken().register(calls::incrementAndGet);
        source.cancel();
        assertThat(source.cancel(), is(false));
        assertThat(calls.get(), is(1));
    }

    @Test
    public void callback_registered_after_cancel_runs_immediately() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        AtomicInteger calls = new AtomicInteger();
        source.getToken().register(calls::incrementAndGet);
        assertThat(calls.get(), is(1));
    }

    @Test
    public void failing_callback_does_not_prevent_others() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.getToken().register(() -> {
            throw new IllegalStateException("callback failure");
        });
        source.getToken().register(calls::incrementAndGet);
        source.cancel();
        assertThat(calls.get(), is(1));
    }

    @Test
    public void none_is_never_canceled() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.NONE.register(calls::incrementAndGet);
        assertThat(CancellationToken.NONE.canBeCanceled(), is(false));
        assertThat(CancellationToken.NONE.isCancellationRequested(), is(false));
        assertThat(calls.get(), is(0));
    }
}
