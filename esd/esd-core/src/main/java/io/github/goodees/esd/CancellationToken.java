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

import java.util.Objects;

/**
 * Read-only view of a cancellation request. Cancellation is cooperative: holders poll
 * {@link #isCancellationRequested()} at points where they can stop safely, nothing is ever interrupted.
 *
 * @see CancellationTokenSource
 */
public final class CancellationToken {
    /**
     * Token that is never canceled.
     */
    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationTokenSource source;

    CancellationToken(CancellationTokenSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancellationRequested();
    }

    /**
     * Whether this token can ever become canceled.
     * @return false for {@link #NONE}
     */
    public boolean canBeCanceled() {
        return source != null;
    }

    /**
     * Run the callback once the token is canceled. Runs immediately if already canceled.
     * @param callback action to run
     */
    public void register(Runnable callback) {
        Objects.requireNonNull(callback, "Callback must be specified");
        if (source != null) {
            source.register(callback);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken[canceled=" + isCancellationRequested() + "]";
    }
}
