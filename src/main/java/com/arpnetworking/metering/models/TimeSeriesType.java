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

import io.ebean.annotation.DbEnumType;
import io.ebean.annotation.DbEnumValue;

import java.util.Optional;

/**
 * The value semantics of the points in a series.
 *
 * @author Inscope Metrics
 */
public enum TimeSeriesType {
    /**
     * Instantaneous sample.
     */
    POINT("point"),
    /**
     * Mean over the series period.
     */
    MEAN("mean"),
    /**
     * Standard deviation over the series period.
     */
    STDEV("stdev"),
    /**
     * Number of events over the series period.
     */
    COUNT("count");

    /**
     * Look up a type by its stored value.
     *
     * @param value the stored value, e.g. {@code point}
     * @return the matching type or empty if the value is not recognized
     */
    public static Optional<TimeSeriesType> fromValue(final String value) {
        for (final TimeSeriesType type : values()) {
            if (type._value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @DbEnumValue(storage = DbEnumType.VARCHAR, length = 10)
    public String getValue() {
        return _value;
    }

    TimeSeriesType(final String value) {
        _value = value;
    }

    private final String _value;
}
