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

/**
 * Fire-and-forget delivery of messages to any number of observers.
 */
public interface MessageBus {
    /**
     * Deliver a message to all matching observers, asynchronously.
     * @param message the message
     */
    void publish(Message message);

    /**
     * Observe messages of a type.
     * @param type type of message
     * @param handler the observer
     * @param includeDerived whether to observe subtypes as well
     * @param <T> type of message
     * @return subscription to close when done observing
     */
    <T extends Message> Subscription subscribe(Class<T> type, MessageHandler<? super T> handler, boolean includeDerived);

    default Subscription subscribeToAll(MessageHandler<Message> handler) {
        return subscribe(Message.class, handler, true);
    }

    /**
     * Whether anything handles or observes messages of a type.
     * @param type type of message
     * @param includeDerived whether handlers of subtypes count
     * @return true when there is a subscriber
     */
    boolean hasSubscriberFor(Class<?> type, boolean includeDerived);
}
