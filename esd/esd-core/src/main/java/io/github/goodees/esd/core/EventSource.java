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

import java.util.UUID;

/**
 * Contract between an event sourced entity and the infrastructure that loads and saves it.
 */
public interface EventSource {
    UUID getId();

    /**
     * The version of the entity the store is expected to be at when the recorded events are appended.
     * @return expected version, {@link ExpectedVersion#NO_STREAM} for entities that never applied an event
     */
    long getExpectedVersion();

    /**
     * Align the entity with a known store version. Used by writers that know better than the entity itself.
     * @param version the version
     */
    void setExpectedVersion(long version);

    /**
     * Apply historical events in order.
     * @param events events read from the store
     */
    void restoreFromEvents(Iterable<?> events);

    /**
     * Drain events recorded since the last take.
     * @return recorded events, in order
     */
    Object[] takeEvents();
}
