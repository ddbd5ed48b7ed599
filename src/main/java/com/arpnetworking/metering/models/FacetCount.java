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

/**
 * Number of series sharing one value of a facet column.
 *
 * @author Inscope Metrics
 */
public final class FacetCount {

    /**
     * Public constructor.
     *
     * @param value the distinct column value
     * @param count the number of series with that value
     */
    public FacetCount(final String value, final long count) {
        _value = value;
        _count = count;
    }

    public String getValue() {
        return _value;
    }

    public long getCount() {
        return _count;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FacetCount)) {
            return false;
        }
        final FacetCount otherCount = (FacetCount) other;
        return _count == otherCount._count
                && Objects.equal(_value, otherCount._value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_value, _count);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Value", _value)
                .add("Count", _count)
                .toString();
    }

    private final String _value;
    private final long _count;
}
