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

/**
 * Special values of expected version used for optimistic concurrency against an event store.
 */
public final class ExpectedVersion {
    /**
     * The stream must not exist yet. Also the version of an entity that has not applied any event.
     */
    public static final long NO_STREAM = -1;
    /**
     * The stream may exist but must contain no events.
     */
    public static final long EMPTY_STREAM = -1;
    /**
     * Disables the concurrency check.
     */
    public static final long ANY = -2;

    private ExpectedVersion() {
    }
}
