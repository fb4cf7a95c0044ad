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

/**
 * Exception of a stream store operation.
 */
public class StreamStoreException extends RuntimeException {
    private final String stream;

    protected StreamStoreException(String stream, String message, Throwable cause) {
        super(message, cause);
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }

    public static StreamStoreException storeFailed(String stream, Throwable cause) {
        return new StreamStoreException(stream, "Operation on stream " + stream + " failed. " + cause.getMessage(),
                cause);
    }
}
