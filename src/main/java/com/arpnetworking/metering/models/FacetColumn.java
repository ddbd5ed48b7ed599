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

import java.time.Duration;
import java.util.Optional;

/**
 * The series metadata columns that may be summarized as facets.
 *
 * @author Inscope Metrics
 */
public enum FacetColumn {

    /**
     * The nominal period; values render as ISO-8601 durations.
     */
    PERIOD("period", "period_seconds") {
        @Override
        public String render(final Object storedValue) {
            return Duration.ofSeconds(((Number) storedValue).longValue()).toString();
        }
    },

    /**
     * The unit of the values.
     */
    UNITS("units", "unit"),

    /**
     * The value semantics.
     */
    TS_TYPE("ts_type", "ts_type");

    /**
     * Look up a facet column by its public name.
     *
     * @param name the public name, e.g. {@code units}
     * @return the column or empty if the name is not a facet column
     */
    public static Optional<FacetColumn> tryFromName(final String name) {
        for (final FacetColumn column : values()) {
            if (column._name.equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public String getName() {
        return _name;
    }

    /**
     * The backing table column. Only ever one of a fixed set of identifiers.
     *
     * @return the column name in the series table
     */
    public String getColumn() {
        return _column;
    }

    /**
     * Render a stored value of this column for display.
     *
     * @param storedValue the value as read from the store
     * @return the display value
     */
    public String render(final Object storedValue) {
        return String.valueOf(storedValue);
    }

    FacetColumn(final String name, final String column) {
        _name = name;
        _column = column;
    }

    private final String _name;
    private final String _column;
}
