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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.esd.CancellationToken;
import io.github.goodees.esd.CancellationTokenSource;
import io.github.goodees.esd.CorrelatedMessage;
import io.github.goodees.esd.Message;
import io.github.goodees.esd.scheduling.ManualTimeSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

public class DispatcherTest {
    private static final Logger logger = LoggerFactory.getLogger(DispatcherTest.class);
    private static final Duration ACK = Duration.ofMillis(100);
    private static final Duration RESPONSE = Duration.ofMillis(500);

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private final ManualTimeSource time = new ManualTimeSource();
    private ch.qos.logback.classic.Logger dispatcherLogger;
    private AppenderBase<ILoggingEvent> errorAppender;
    private Dispatcher dispatcher;

    @Before
    public void setUp() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        // any errors logged by dispatcher are actually assertion errors
        dispatcherLogger = ctx.getLogger(Dispatcher.class.getName() + ".Counter");
        errorAppender = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    collector.addError(new AssertionError(event.getFormattedMessage()));
                }
            }
        };
        errorAppender.setContext(ctx);
        errorAppender.start();
        dispatcherLogger.addAppender(errorAppender);
        dispatcher = new Dispatcher(SimpleDispatcherConfiguration.defaults("Counter")
                .withTimeouts(ACK, RESPONSE)
                .withSlowMessageWatching(Duration.ofSeconds(1))
                .withStopTimeout(Duration.ofSeconds(2))
                .withTimeSource(time));
    }

    @After
    public void tearDown() {
        dispatcher.close();
        dispatcherLogger.detachAppender(errorAppender);
        errorAppender.stop();
    }

    static class Increment extends Command {
        Increment() {
        }

        Increment(CancellationToken token) {
            super(token);
        }

        Increment(CorrelatedMessage source) {
            super(source);
        }
    }

    static class Decrement extends Command {
    }

    static class Slow extends Command {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        Slow() {
        }

        Slow(CancellationToken token) {
            super(token);
        }
    }

    static class Stubborn extends Command {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
    }

    static class Nest extends Command {
        final boolean sameType;

        Nest(boolean sameType) {
            this.sameType = sameType;
        }

        Nest(Nest source) {
            super(source);
            this.sameType = false;
        }
    }

    static class Numbered extends Command {
        final int number;

        Numbered(int number) {
            this.number = number;
        }
    }

    static class Unhandled extends Command {
    }

    static class Checked extends Command {
    }

    static class Noted implements Message {
        private final UUID msgId = UUID.randomUUID();

        @Override
        public UUID getMsgId() {
            return msgId;
        }
    }

    static class SpecialNoted extends Noted {
    }

    private final AtomicInteger counter = new AtomicInteger();

    private Subscription subscribeCounter() {
        return dispatcher.subscribe(Increment.class, c -> {
            counter.incrementAndGet();
            return c.succeed(counter.get());
        });
    }

    private Subscription subscribeSlow() {
        return dispatcher.subscribe(Slow.class, c -> {
            c.started.countDown();
            while (!c.release.await(5, TimeUnit.MILLISECONDS)) {
                if (c.isCanceled()) {
                    return c.canceled();
                }
            }
            return c.succeed();
        });
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!dispatcher.isIdle() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat("dispatcher should become idle", dispatcher.isIdle(), is(true));
    }

    @Test
    public void fire_returns_when_handled() {
        subscribeCounter();
        dispatcher.fire(new Increment());
        dispatcher.fire(new Increment());
        assertThat(counter.get(), is(2));
    }

    @Test
    public void try_fire_returns_handler_data() {
        subscribeCounter();
        CommandResponse response = dispatcher.tryFire(new Increment());
        assertThat(response.isSuccess(), is(true));
        assertThat(((CommandResponse.Success<?>) response).getData(), is((Object) 1));
        assertThat(response.getCommandType(), equalTo((Object) Increment.class));
    }

    @Test
    public void handles_concurrent_commands_of_multiple_types() throws Exception {
        AtomicInteger decrements = new AtomicInteger();
        subscribeCounter();
        dispatcher.subscribe(Decrement.class, c -> {
            decrements.incrementAndGet();
            return c.succeed();
        });
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<CommandResponse>> results = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                Command command = i % 2 == 0 ? new Increment() : new Decrement();
                results.add(callers.submit(() -> dispatcher.tryFire(command)));
            }
            for (Future<CommandResponse> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS).isSuccess(), is(true));
            }
        } finally {
            callers.shutdown();
        }
        assertThat(counter.get(), is(200));
        assertThat(decrements.get(), is(200));
        awaitIdle();
    }

    @Test
    public void commands_of_one_type_are_handled_in_order() throws Exception {
        List<Integer> handled = new CopyOnWriteArrayList<>();
        dispatcher.subscribe(Numbered.class, c -> {
            handled.add(c.number);
            return c.succeed();
        });
        List<CompletableFuture<CommandResponse>> results = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            results.add(dispatcher.fireAsync(new Numbered(i)));
        }
        for (CompletableFuture<CommandResponse> result : results) {
            assertThat(result.get(10, TimeUnit.SECONDS).isSuccess(), is(true));
        }
        for (int i = 0; i < 100; i++) {
            assertThat(handled.get(i), is(i));
        }
    }

    @Test
    public void command_without_handler_is_not_handled() {
        CommandResponse response = dispatcher.tryFire(new Unhandled());
        assertThat(response, instanceOf(CommandResponse.Fail.class));
        assertThat(((CommandResponse.Fail) response).getException(), instanceOf(CommandNotHandledException.class));
        try {
            dispatcher.fire(new Unhandled());
            fail("Unhandled command should throw");
        } catch (CommandNotHandledException e) {
            assertThat(e.getCommand(), instanceOf(Unhandled.class));
        }
    }

    @Test
    public void handler_exception_is_rethrown_by_fire() {
        dispatcher.subscribe(Decrement.class, c -> {
            throw new IllegalArgumentException("cannot decrement");
        });
        try {
            dispatcher.fire(new Decrement());
            fail("Handler failure should be rethrown");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), is("cannot decrement"));
        }
    }

    @Test
    public void checked_handler_exception_is_wrapped() {
        dispatcher.subscribe(Checked.class, c -> {
            throw new java.io.IOException("disk full");
        });
        try {
            dispatcher.fire(new Checked());
            fail("Handler failure should be rethrown");
        } catch (CommandException e) {
            assertThat(e.getCause(), instanceOf(java.io.IOException.class));
        }
    }

    @Test
    public void handler_error_is_returned_and_worker_keeps_running() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher.subscribe(Decrement.class, c -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("broken invariant");
            }
            return c.succeed();
        });
        try {
            dispatcher.fire(new Decrement());
            fail("Handler error should be rethrown");
        } catch (AssertionError e) {
            assertThat(e.getMessage(), is("broken invariant"));
        }
        assertThat(dispatcher.tryFire(new Decrement()).isSuccess(), is(true));
        assertThat(calls.get(), is(2));
    }

    @Test
    public void null_response_is_a_failure() {
        dispatcher.subscribe(Decrement.class, c -> null);
        CommandResponse response = dispatcher.tryFire(new Decrement());
        assertThat(((CommandResponse.Fail) response).getException(), instanceOf(IllegalStateException.class));
    }

    @Test
    public void pre_canceled_command_is_not_handled() {
        subscribeCounter();
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        CommandResponse response = dispatcher.tryFire(new Increment(source.getToken()));
        assertThat(response, instanceOf(CommandResponse.Canceled.class));
        assertThat(counter.get(), is(0));
        try {
            dispatcher.fire(new Increment(source.getToken()));
            fail("Canceled command should throw");
        } catch (CommandCanceledException e) {
            assertThat(e.getCommand(), instanceOf(Increment.class));
        }
    }

    @Test
    public void running_handler_observes_cancellation() throws Exception {
        subscribeSlow();
        CancellationTokenSource source = new CancellationTokenSource();
        Slow slow = new Slow(source.getToken());
        CompletableFuture<CommandResponse> result = dispatcher.fireAsync(slow);
        assertThat(slow.started.await(5, TimeUnit.SECONDS), is(true));
        source.cancel();
        assertThat(result.get(5, TimeUnit.SECONDS), instanceOf(CommandResponse.Canceled.class));
    }

    @Test
    public void command_canceled_while_queued_is_skipped() throws Exception {
        subscribeSlow();
        Slow blocker = new Slow();
        CompletableFuture<CommandResponse> blocking = dispatcher.fireAsync(blocker, ACK, Duration.ofHours(1));
        assertThat(blocker.started.await(5, TimeUnit.SECONDS), is(true));

        CancellationTokenSource source = new CancellationTokenSource();
        Slow queued = new Slow(source.getToken());
        CompletableFuture<CommandResponse> skipped = dispatcher.fireAsync(queued, Duration.ofHours(1), RESPONSE);
        source.cancel();
        blocker.release.countDown();

        assertThat(blocking.get(5, TimeUnit.SECONDS).isSuccess(), is(true));
        assertThat(skipped.get(5, TimeUnit.SECONDS), instanceOf(CommandResponse.Canceled.class));
        assertThat(queued.started.getCount(), is(1L));
    }

    @Test
    public void slow_handler_times_out_and_late_response_is_published() throws Exception {
        dispatcher.subscribe(Stubborn.class, c -> {
            c.started.countDown();
            c.release.await(5, TimeUnit.SECONDS);
            return c.succeed();
        });
        CountDownLatch lateSuccess = new CountDownLatch(1);
        dispatcher.subscribe(CommandResponse.class, r -> {
            if (r.isSuccess()) {
                lateSuccess.countDown();
            }
        }, true);

        Stubborn stubborn = new Stubborn();
        CompletableFuture<CommandResponse> result = dispatcher.fireAsync(stubborn);
        assertThat(stubborn.started.await(5, TimeUnit.SECONDS), is(true));
        time.advance(RESPONSE);

        CommandResponse response = result.get(5, TimeUnit.SECONDS);
        assertThat(response, instanceOf(CommandResponse.Canceled.class));
        assertThat(((CommandResponse.Fail) response).getException(), instanceOf(CommandTimedOutException.class));
        assertThat(stubborn.isCanceled(), is(true));

        stubborn.release.countDown();
        assertThat(lateSuccess.await(5, TimeUnit.SECONDS), is(true));
        assertThat(result.get(), sameInstance(response));
    }

    @Test
    public void command_not_picked_up_in_time_is_not_handled() throws Exception {
        subscribeSlow();
        Slow blocker = new Slow();
        CompletableFuture<CommandResponse> blocking = dispatcher.fireAsync(blocker, ACK, Duration.ofHours(1));
        assertThat(blocker.started.await(5, TimeUnit.SECONDS), is(true));

        Slow waiting = new Slow();
        CompletableFuture<CommandResponse> result = dispatcher.fireAsync(waiting);
        time.advance(ACK);
        CommandResponse response = result.get(5, TimeUnit.SECONDS);
        assertThat(((CommandResponse.Fail) response).getException(), instanceOf(CommandAckTimeoutException.class));

        blocker.release.countDown();
        assertThat(blocking.get(5, TimeUnit.SECONDS).isSuccess(), is(true));
        awaitIdle();
        assertThat(waiting.started.getCount(), is(1L));
    }

    @Test
    public void handler_may_fire_nested_command_of_other_type() {
        subscribeCounter();
        dispatcher.subscribe(Nest.class, c -> {
            Increment nested = new Increment(c);
            dispatcher.fire(nested);
            return c.succeed(nested);
        });
        Nest nest = new Nest(false);
        CommandResponse response = dispatcher.tryFire(nest, ACK, Duration.ofHours(1));
        assertThat(response.isSuccess(), is(true));
        Increment nested = (Increment) ((CommandResponse.Success<?>) response).getData();
        assertThat(nested.getCorrelationId(), is(nest.getCorrelationId()));
        assertThat(nested.getSourceId(), is(nest.getMsgId()));
        assertThat(nested.getParent(), sameInstance(nest));
        assertThat(counter.get(), is(1));
    }

    @Test
    public void nested_command_of_same_type_is_oversubscribed() {
        dispatcher.subscribe(Nest.class, c -> {
            if (!c.sameType) {
                return c.succeed();
            }
            CommandResponse nested = dispatcher.tryFire(new Nest(c));
            return c.succeed(nested);
        });
        CommandResponse response = dispatcher.tryFire(new Nest(true));
        CommandResponse nested = (CommandResponse) ((CommandResponse.Success<?>) response).getData();
        assertThat(nested, instanceOf(CommandResponse.Fail.class));
        assertThat(((CommandResponse.Fail) nested).getException(), instanceOf(CommandOversubscribedException.class));
    }

    @Test
    public void observers_receive_published_messages() throws Exception {
        CountDownLatch received = new CountDownLatch(2);
        List<Message> exact = new CopyOnWriteArrayList<>();
        List<Message> derived = new CopyOnWriteArrayList<>();
        dispatcher.subscribe(Noted.class, m -> {
            exact.add(m);
            received.countDown();
        }, false);
        dispatcher.subscribe(Noted.class, m -> {
            derived.add(m);
            received.countDown();
        }, true);

        dispatcher.publish(new SpecialNoted());
        dispatcher.publish(new Noted());
        awaitIdle();
        assertThat(received.await(5, TimeUnit.SECONDS), is(true));
        assertThat(exact, hasSize(1));
        assertThat(derived, hasSize(2));
    }

    @Test
    public void observers_see_acks_and_responses() throws Exception {
        List<Message> all = new CopyOnWriteArrayList<>();
        dispatcher.subscribeToAll(all::add);
        subscribeCounter();
        dispatcher.fire(new Increment());
        awaitIdle();
        assertThat(all, hasSize(2));
        assertThat(all.get(0), instanceOf(AckCommand.class));
        assertThat(all.get(1), instanceOf(CommandResponse.Success.class));
    }

    @Test
    public void published_command_is_handled() throws Exception {
        subscribeCounter();
        dispatcher.publish(new Increment());
        awaitIdle();
        assertThat(counter.get(), is(1));
    }

    @Test
    public void closed_observer_receives_nothing() throws Exception {
        List<Message> received = new ArrayList<>();
        Subscription subscription = dispatcher.subscribe(Noted.class, received::add, false);
        subscription.close();
        dispatcher.publish(new Noted());
        awaitIdle();
        assertThat(received, empty());
    }

    @Test(expected = ExistingHandlerException.class)
    public void second_handler_of_a_type_is_rejected() {
        subscribeCounter();
        subscribeCounter();
    }

    @Test
    public void unsubscribed_handler_no_longer_handles() {
        Subscription subscription = subscribeCounter();
        assertThat(dispatcher.hasSubscriberFor(Increment.class, false), is(true));
        subscription.close();
        assertThat(dispatcher.hasSubscriberFor(Increment.class, false), is(false));
        assertThat(((CommandResponse.Fail) dispatcher.tryFire(new Increment())).getException(),
                instanceOf(CommandNotHandledException.class));
        subscribeCounter();
        dispatcher.fire(new Increment());
    }

    @Test
    public void has_subscriber_considers_derived_types() {
        subscribeCounter();
        assertThat(dispatcher.hasSubscriberFor(Command.class, false), is(false));
        assertThat(dispatcher.hasSubscriberFor(Command.class, true), is(true));
        dispatcher.subscribe(SpecialNoted.class, m -> { }, false);
        assertThat(dispatcher.hasSubscriberFor(Noted.class, true), is(true));
        assertThat(dispatcher.hasSubscriberFor(Noted.class, false), is(false));
    }

    @Test
    public void becomes_idle_after_work() throws Exception {
        subscribeSlow();
        Slow slow = new Slow();
        CompletableFuture<CommandResponse> result = dispatcher.fireAsync(slow, ACK, Duration.ofHours(1));
        assertThat(slow.started.await(5, TimeUnit.SECONDS), is(true));
        assertThat(dispatcher.isIdle(), is(false));
        slow.release.countDown();
        result.get(5, TimeUnit.SECONDS);
        awaitIdle();
    }

    @Test
    public void close_cancels_waiting_callers() throws Exception {
        subscribeSlow();
        Slow slow = new Slow();
        CompletableFuture<CommandResponse> result = dispatcher.fireAsync(slow, ACK, Duration.ofHours(1));
        assertThat(slow.started.await(5, TimeUnit.SECONDS), is(true));
        dispatcher.close();
        assertThat(result.get(5, TimeUnit.SECONDS), instanceOf(CommandResponse.Canceled.class));
        logger.info("Dispatcher closed with handler still running");
    }

    @Test(expected = IllegalStateException.class)
    public void closed_dispatcher_rejects_commands() {
        dispatcher.close();
        dispatcher.fire(new Increment());
    }

    @Test(expected = IllegalArgumentException.class)
    public void timeouts_must_be_positive() {
        dispatcher.fireAsync(new Increment(), Duration.ZERO, RESPONSE);
    }
}
