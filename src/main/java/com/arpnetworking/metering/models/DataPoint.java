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

import java.time.Instant;

/**
 * One stored observation of a series.
 *
 * @author Inscope Metrics
 */
public final class DataPoint {

    /**
     * Public constructor.
     *
     * @param timestamp the observation time
     * @param value the observed value
     */
    public DataPoint(final Instant timestamp, final double value) {
        _timestamp = timestamp;
        _value = value;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataPoint)) {
            return false;
        }
        final DataPoint otherPoint = (DataPoint) other;
        return Double.compare(_value, otherPoint._value) == 0
                && Objects.equal(_timestamp, otherPoint._timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("Value", _value)
                .toString();
    }

    private final Instant _timestamp;
    private final double _value;
}
