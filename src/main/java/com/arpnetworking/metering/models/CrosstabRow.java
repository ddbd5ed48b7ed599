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
package com.arpnetworking.metering.models;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One row of a crosstab: a timestamp and one value slot per requested
 * series, in request order. A slot is empty when that series has no point
 * at the timestamp.
 *
 * @author Inscope Metrics
 */
public final class CrosstabRow {

    /**
     * Public constructor.
     *
     * @param timestamp the row timestamp
     * @param values the value slots in column order
     */
    public CrosstabRow(final Instant timestamp, final List<Optional<Double>> values) {
        _timestamp = timestamp;
        _values = ImmutableList.copyOf(values);
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    public ImmutableList<Optional<Double>> getValues() {
        return _values;
    }

    /**
     * The value slot of one column.
     *
     * @param column zero-based column index
     * @return the value or empty if the series has no point here
     */
    public Optional<Double> getValue(final int column) {
        return _values.get(column);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CrosstabRow)) {
            return false;
        }
        final CrosstabRow otherRow = (CrosstabRow) other;
        return Objects.equal(_timestamp, otherRow._timestamp)
                && Objects.equal(_values, otherRow._values);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _values);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("Values", _values)
                .toString();
    }

    private final Instant _timestamp;
    private final ImmutableList<Optional<Double>> _values;
}
