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

import java.util.UUID;

/**
 * Message that knows the transaction it belongs to and the message that caused it.
 * <p>A root message starts a new correlation: its correlation id equals its own message id and it has no source.
 * A message created from another shares the correlation id and takes the other's message id as its source id.
 */
public interface CorrelatedMessage extends Message {
    UUID getCorrelationId();

    /**
     * Id of the message that caused this one.
     * @return the causing message id, null for a root message
     */
    UUID getSourceId();
}
