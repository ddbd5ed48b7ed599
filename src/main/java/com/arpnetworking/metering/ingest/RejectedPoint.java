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
import com.google.common.base.Objects;

/**
 * An entry of a batch that was not stored.
 *
 * @author Inscope Metrics
 */
public final class RejectedPoint {

    /**
     * Public constructor.
     *
     * @param index the position of the entry in the batch
     * @param entry the entry as submitted
     * @param reason why the entry was rejected
     */
    public RejectedPoint(final int index, final String entry, final String reason) {
        _index = index;
        _entry = entry;
        _reason = reason;
    }

    public int getIndex() {
        return _index;
    }

    public String getEntry() {
        return _entry;
    }

    public String getReason() {
        return _reason;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RejectedPoint)) {
            return false;
        }
        final RejectedPoint otherRejected = (RejectedPoint) other;
        return _index == otherRejected._index
                && Objects.equal(_entry, otherRejected._entry)
                && Objects.equal(_reason, otherRejected._reason);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_index, _entry, _reason);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Index", _index)
                .add("Entry", _entry)
                .add("Reason", _reason)
                .toString();
    }

    private final int _index;
    private final String _entry;
    private final String _reason;
}
