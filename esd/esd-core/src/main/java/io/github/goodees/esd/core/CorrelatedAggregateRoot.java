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

import io.github.goodees.esd.CorrelatedMessage;

import java.util.Objects;

/**
 * Aggregate whose events are all caused by a known message. Before raising events, the handler of a command sets that
 * command as the {@linkplain #setSource(CorrelatedMessage) source}. Every raised event must then be a
 * {@link CorrelatedMessage} created from the same source. Taking the events clears the source.
 */
public abstract class CorrelatedAggregateRoot extends AggregateRoot {
    private CorrelatedMessage source;

    protected CorrelatedAggregateRoot() {
    }

    protected CorrelatedAggregateRoot(CorrelatedMessage source) {
        this.source = source;
    }

    /**
     * Set the message that causes following events.
     * @param source causing message
     * @throws IllegalStateException when events caused by another source are recorded and not taken yet
     */
    public void setSource(CorrelatedMessage source) {
        Objects.requireNonNull(source, "Source must be specified");
        if (this.source != null && hasRecordedEvents()) {
            throw new IllegalStateException(
                    "Cannot change source unless there are no recorded events, or current source is null");
        }
        this.source = source;
    }

    public CorrelatedMessage getSource() {
        return source;
    }

    @Override
    protected void onEventRaised(Object event) {
        if (!(event instanceof CorrelatedMessage)) {
            throw new IllegalStateException("Cannot raise uncorrelated events from correlated aggregate.");
        }
        if (source == null) {
            throw new IllegalStateException("Cannot raise events without valid source.");
        }
        CorrelatedMessage correlated = (CorrelatedMessage) event;
        if (!source.getCorrelationId().equals(correlated.getCorrelationId())
                || !source.getMsgId().equals(correlated.getSourceId())) {
            throw new IllegalStateException("Cannot raise events with a different source.");
        }
    }

    @Override
    protected void takeEventsStarted() {
        if (hasRecordedEvents() && source == null) {
            throw new IllegalStateException("Cannot take events without valid source.");
        }
    }

    @Override
    protected void takeEventsCompleted() {
        source = null;
    }
}
