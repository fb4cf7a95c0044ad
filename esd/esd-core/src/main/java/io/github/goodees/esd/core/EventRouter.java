package io.github.goodees.esd.core;

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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Routes events to the logic of an event source. Exactly one route may exist per event class, and the lookup uses
 * the exact runtime class of the event, so a route for a superclass does not receive subclass instances.
 * <p>Events without a route are ignored. This tolerates events an older version of the entity does not know about.</p>
 * <p>Not thread safe. A router belongs to a single entity, which is accessed by one thread at a time.</p>
 */
public class EventRouter {
    private final Map<Class<?>, Consumer<Object>> routes = new HashMap<>();

    /**
     * Register where to route events of given type.
     * @param eventType type of event
     * @param route logic handling the event
     * @param <E> type of event
     * @throws NullPointerException when type or route is null
     * @throws IllegalStateException when route for the type is already registered
     */
    public <E> void registerRoute(Class<E> eventType, Consumer<? super E> route) {
        Objects.requireNonNull(eventType, "Event type must be specified");
        Objects.requireNonNull(route, "Route must be specified");
        addRoute(eventType, event -> route.accept(eventType.cast(event)));
    }

    /**
     * Register untyped route for events of given type.
     * @param eventType type of event
     * @param route logic handling the event
     * @throws NullPointerException when type or route is null
     * @throws IllegalStateException when route for the type is already registered
     */
    public void registerUntypedRoute(Class<?> eventType, Consumer<Object> route) {
        Objects.requireNonNull(eventType, "Event type must be specified");
        Objects.requireNonNull(route, "Route must be specified");
        addRoute(eventType, route);
    }

    private void addRoute(Class<?> eventType, Consumer<Object> route) {
        if (routes.containsKey(eventType)) {
            throw new IllegalStateException("There's already a route registered for the event of type '"
                    + eventType.getSimpleName() + "'");
        }
        routes.put(eventType, route);
    }

    /**
     * Route the event, if a route was registered for its type.
     * @param event the event to route
     * @throws NullPointerException when event is null
     */
    public void route(Object event) {
        Objects.requireNonNull(event, "Event must be specified");
        Consumer<Object> route = routes.get(event.getClass());
        if (route != null) {
            route.accept(event);
        }
    }

    public boolean hasRouteFor(Class<?> eventType) {
        return routes.containsKey(eventType);
    }
}
