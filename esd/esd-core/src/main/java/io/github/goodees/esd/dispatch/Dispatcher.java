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

import io.github.goodees.esd.Message;
import io.github.goodees.esd.queue.OutstandingWork;
import io.github.goodees.esd.queue.QueuedHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process command bus. Every command type has at most one handler, and every handler runs on its own worker
 * thread, so commands of one type are handled one at a time in the order they were fired, while different types are
 * handled concurrently.
 *
 * <p>The caller of {@link #fire(Command)} waits for the outcome. The handler must pick the command up within the
 * acknowledgement timeout and respond within the response timeout counted from the pickup. Whatever happens first
 * decides the outcome; a response arriving after a timeout is only published to observers.
 *
 * <p>Besides commands, any {@link Message} can be {@linkplain #publish(Message) published} to observers. Observers
 * are called on a single publishing thread, and also see acknowledgements and responses of commands.
 */
public class Dispatcher implements MessageBus, AutoCloseable {
    private final DispatcherConfiguration conf;
    private final Logger logger;
    private final OutstandingWork outstanding = new OutstandingWork();
    private final ConcurrentMap<Class<?>, CommandWorker<?>> workers = new ConcurrentHashMap<>();
    private final List<Observer<?>> observers = new CopyOnWriteArrayList<>();
    private final QueuedHandler<Message> publishQueue;
    private final CommandManager commandManager;
    private final AtomicBoolean closed = new AtomicBoolean();

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
        this.publishQueue = new QueuedHandler<>(conf.dispatcherName() + "-publish", this::deliverToObservers,
                conf.watchSlowMessages(), conf.slowMessageThreshold(), conf.stopTimeout(), outstanding,
                conf.threadFactory());
        this.commandManager = new CommandManager(conf.dispatcherName(), conf.timeSource(), logger);
        this.publishQueue.start();
        this.commandManager.start();
    }

    /**
     * Subscribe the handler of a command type. A worker thread for the type is started.
     * @param type exact type of command
     * @param handler the handler
     * @param <C> type of command
     * @return subscription to close in order to unsubscribe
     * @throws ExistingHandlerException when the type already has a handler
     */
    public <C extends Command> Subscription subscribe(Class<C> type, HandleCommand<C> handler) {
        Objects.requireNonNull(type, "Command type must be specified");
        Objects.requireNonNull(handler, "Handler must be specified");
        assertOpen();
        CommandWorker<C> worker = new CommandWorker<>(type, handler);
        if (workers.putIfAbsent(type, worker) != null) {
            throw new ExistingHandlerException(type);
        }
        worker.queue.start();
        logger.info("Subscribed handler of {}", type.getName());
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) {
                unsubscribe(type, handler);
            }
        };
    }

    /**
     * Remove the handler of a command type, if it is the given one. Commands still waiting for the handler fail as not
     * handled.
     * @param type type of command
     * @param handler the handler to remove
     * @param <C> type of command
     */
    public <C extends Command> void unsubscribe(Class<C> type, HandleCommand<C> handler) {
        CommandWorker<?> worker = workers.get(type);
        if (worker == null || worker.handler != handler || !workers.remove(type, worker)) {
            return;
        }
        logger.info("Unsubscribed handler of {}", type.getName());
        stopWorker(worker);
        for (Command command : worker.queue.drain()) {
            worker.respond(command.fail(new CommandNotHandledException(command)));
        }
    }

    @Override
    public <T extends Message> Subscription subscribe(Class<T> type, MessageHandler<? super T> handler,
            boolean includeDerived) {
        Objects.requireNonNull(type, "Message type must be specified");
        Objects.requireNonNull(handler, "Handler must be specified");
        Observer<T> observer = new Observer<>(type, handler, includeDerived);
        observers.add(observer);
        logger.info("Subscribed observer of {}{}", type.getName(), includeDerived ? " and subtypes" : "");
        return () -> {
            if (observers.remove(observer)) {
                logger.info("Unsubscribed observer of {}", type.getName());
            }
        };
    }

    @Override
    public boolean hasSubscriberFor(Class<?> type, boolean includeDerived) {
        Objects.requireNonNull(type, "Type must be specified");
        if (workers.containsKey(type)) {
            return true;
        }
        if (includeDerived && workers.keySet().stream().anyMatch(type::isAssignableFrom)) {
            return true;
        }
        return observers.stream().anyMatch(o -> o.type == type || (includeDerived && type.isAssignableFrom(o.type)));
    }

    /**
     * Publish a message to observers. A published command is also passed to its handler, but nobody waits for its
     * outcome.
     * @param message the message
     */
    @Override
    public void publish(Message message) {
        Objects.requireNonNull(message, "Message must be specified");
        assertOpen();
        if (message instanceof Command) {
            CommandWorker<?> worker = workers.get(message.getClass());
            if (worker == null || !worker.queue.publish((Command) message)) {
                logger.debug("No handler for published {}", message);
            }
        }
        publishQueue.publish(message);
    }

    /**
     * Fire a command with default timeouts and wait for its outcome.
     * @param command the command
     * @throws CommandException or the handler's own unchecked exception when the outcome is not a success
     */
    public void fire(Command command) {
        fire(command, conf.ackTimeout(), conf.responseTimeout());
    }

    /**
     * Fire a command and wait for its outcome.
     * @param command the command
     * @param ackTimeout time for the handler to pick the command up
     * @param responseTimeout time for the handler to respond after picking the command up
     * @throws CommandNotHandledException when there's no handler or it does not pick the command up in time
     * @throws CommandTimedOutException when the handler does not respond in time
     * @throws CommandCanceledException when the command is canceled
     * @throws CommandOversubscribedException when the command cannot be picked up exactly once
     * @throws CommandException when the handler fails with a checked exception, or with no exception at all
     */
    public void fire(Command command, Duration ackTimeout, Duration responseTimeout) {
        CommandResponse response = tryFire(command, ackTimeout, responseTimeout);
        if (response.isSuccess()) {
            return;
        }
        throw toException((CommandResponse.Fail) response);
    }

    /**
     * Fire a command with default timeouts and wait for its outcome.
     * @param command the command
     * @return the outcome
     */
    public CommandResponse tryFire(Command command) {
        return tryFire(command, conf.ackTimeout(), conf.responseTimeout());
    }

    /**
     * Fire a command and wait for its outcome. No outcome is thrown.
     * @param command the command
     * @param ackTimeout time for the handler to pick the command up
     * @param responseTimeout time for the handler to respond after picking the command up
     * @return the outcome
     */
    public CommandResponse tryFire(Command command, Duration ackTimeout, Duration responseTimeout) {
        CompletableFuture<CommandResponse> result = fireAsync(command, ackTimeout, responseTimeout);
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            command.cancel();
            return new CommandResponse.Canceled(command, new CommandCanceledException(command));
        } catch (ExecutionException e) {
            return command.fail(e.getCause());
        }
    }

    public CompletableFuture<CommandResponse> fireAsync(Command command) {
        return fireAsync(command, conf.ackTimeout(), conf.responseTimeout());
    }

    /**
     * Fire a command without waiting.
     * @param command the command
     * @param ackTimeout time for the handler to pick the command up
     * @param responseTimeout time for the handler to respond after picking the command up
     * @return future completing with the outcome
     */
    public CompletableFuture<CommandResponse> fireAsync(Command command, Duration ackTimeout, Duration responseTimeout) {
        Objects.requireNonNull(command, "Command must be specified");
        SimpleDispatcherConfiguration.positive(Objects.requireNonNull(ackTimeout, "Ack timeout must be specified"),
                "Ack timeout");
        SimpleDispatcherConfiguration.positive(Objects.requireNonNull(responseTimeout,
                "Response timeout must be specified"), "Response timeout");
        assertOpen();
        if (command.isCanceled()) {
            logger.debug("{} canceled before it was fired", command);
            return immediately(command.canceled());
        }
        CommandWorker<?> worker = workers.get(command.getClass());
        if (worker != null && worker.queue.isConsumerThread()) {
            logger.warn("{} fired from within handler of the same command type", command);
            return immediately(command.fail(new CommandOversubscribedException(command,
                    "fired from within the handler of the same command type")));
        }
        CommandTracker tracker = commandManager.register(command, ackTimeout, responseTimeout);
        if (worker == null || !worker.queue.publish(command)) {
            logger.debug("No handler for {}", command);
            CommandResponse response = command.fail(new CommandNotHandledException(command));
            commandManager.completeUnhandled(tracker, response);
            publishQueue.publish(response);
        }
        return tracker.getResult();
    }

    private CompletableFuture<CommandResponse> immediately(CommandResponse response) {
        publishQueue.publish(response);
        return CompletableFuture.completedFuture(response);
    }

    static RuntimeException toException(CommandResponse.Fail response) {
        Throwable exception = response.getException();
        Command command = response.getSourceCommand();
        if (exception instanceof RuntimeException) {
            return (RuntimeException) exception;
        }
        if (exception instanceof Error) {
            throw (Error) exception;
        }
        if (exception != null) {
            return new CommandException(command, CommandException.describe(command) + " failed", exception);
        }
        if (response instanceof CommandResponse.Canceled) {
            return new CommandCanceledException(command);
        }
        return new CommandException(command, CommandException.describe(command) + " failed");
    }

    /**
     * Whether all fired and published work is done. Work caused by other work is counted before the causing work
     * finishes, so a true result means nothing is in flight.
     * @return true when idle
     */
    public boolean isIdle() {
        return outstanding.isIdle();
    }

    public String getName() {
        return conf.dispatcherName();
    }

    /**
     * Stop all workers. Callers still waiting receive a canceled outcome.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing");
        commandManager.cancelAll();
        for (CommandWorker<?> worker : workers.values()) {
            stopWorker(worker);
            worker.queue.drain();
        }
        workers.clear();
        observers.clear();
        try {
            publishQueue.stop();
        } catch (IllegalStateException e) {
            logger.warn("Publishing did not stop in time", e);
        }
        publishQueue.drain();
        commandManager.close();
    }

    private void assertOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Dispatcher " + conf.dispatcherName() + " is closed");
        }
    }

    private void stopWorker(CommandWorker<?> worker) {
        try {
            worker.queue.stop();
        } catch (IllegalStateException e) {
            logger.warn("Handler of {} did not stop in time", worker.type.getName(), e);
        }
    }

    private void deliverToObservers(Message message) {
        for (Observer<?> observer : observers) {
            observer.deliver(message);
        }
    }

    private class CommandWorker<C extends Command> {
        final Class<C> type;
        final HandleCommand<C> handler;
        final QueuedHandler<Command> queue;

        CommandWorker(Class<C> type, HandleCommand<C> handler) {
            this.type = type;
            this.handler = handler;
            this.queue = new QueuedHandler<>(conf.dispatcherName() + "-" + type.getSimpleName(), this::process,
                    conf.watchSlowMessages(), conf.slowMessageThreshold(), conf.stopTimeout(), outstanding,
                    conf.threadFactory());
        }

        void process(Command command) {
            if (command.isCanceled()) {
                logger.debug("{} canceled while queued", command);
                respond(command.canceled());
                return;
            }
            AckCommand ack = new AckCommand(command);
            if (!commandManager.handleAck(ack)) {
                return;
            }
            publishQueue.publish(ack);
            respond(invoke(type.cast(command)));
        }

        private CommandResponse invoke(C command) {
            try {
                CommandResponse response = handler.handle(command);
                if (response == null) {
                    logger.warn("Handler of {} returned no response", type.getName());
                    return command.fail(new IllegalStateException("Handler of " + type.getName()
                            + " returned no response"));
                }
                return response;
            } catch (Exception | Error e) {
                logger.warn("Handler of {} failed", command, e);
                return command.fail(e);
            }
        }

        void respond(CommandResponse response) {
            commandManager.handleResponse(response);
            publishQueue.publish(response);
        }
    }

    private class Observer<T extends Message> {
        final Class<T> type;
        final MessageHandler<? super T> handler;
        final boolean includeDerived;

        Observer(Class<T> type, MessageHandler<? super T> handler, boolean includeDerived) {
            this.type = type;
            this.handler = handler;
            this.includeDerived = includeDerived;
        }

        void deliver(Message message) {
            if (message.getClass() != type && !(includeDerived && type.isInstance(message))) {
                return;
            }
            try {
                handler.handle(type.cast(message));
            } catch (RuntimeException e) {
                logger.error("Observer of {} failed on {}", type.getName(), message, e);
            }
        }
    }
}
