package io.github.goodees.esd.store;

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

import io.github.goodees.esd.command.Metadata;

import java.util.UUID;

/**
 * Serialization of newly raised events.
 */
@FunctionalInterface
public interface ChangesetTranslator {
    /**
     * Translate events into storable form.
     * @param events events taken from an aggregate
     * @param causationId id of the message that caused the events
     * @param expectedVersion version of the stream before the events
     * @param metadata additional metadata to store with every event
     * @return serialized events, in the same order
     */
    EventData[] translate(Object[] events, UUID causationId, long expectedVersion, Metadata metadata);
}
