/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.metering.ingest;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of a batch: how many entries were stored and which were not.
 *
 * @author Inscope Metrics
 */
public final class IngestResult {

    /**
     * Public constructor.
     *
     * @param accepted the number of entries stored
     * @param rejected the entries not stored, in batch order
     */
    public IngestResult(final int accepted, final ImmutableList<RejectedPoint> rejected) {
        _accepted = accepted;
        _rejected = rejected;
    }

    public int getAccepted() {
        return _accepted;
    }

    public ImmutableList<RejectedPoint> getRejected() {
        return _rejected;
    }

    /**
     * Whether every entry of the batch was stored.
     *
     * @return true if nothing was rejected
     */
    public boolean isComplete() {
        return _rejected.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Accepted", _accepted)
                .add("Rejected", _rejected)
                .toString();
    }

    private final int _accepted;
    private final ImmutableList<RejectedPoint> _rejected;
}
