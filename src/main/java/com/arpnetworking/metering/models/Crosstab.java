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

import com.arpnetworking.metering.utility.CloseableIterator;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Table-shaped result of a multi-series query: one column per requested
 * series and one row per distinct timestamp, in ascending order. The rows
 * are produced lazily from an open store cursor and can be read once.
 *
 * @author Inscope Metrics
 */
public final class Crosstab implements AutoCloseable {

    /**
     * Public constructor.
     *
     * @param series the column descriptors in request order
     * @param rows the rows in ascending timestamp order
     */
    public Crosstab(final ImmutableList<SeriesDescriptor> series, final CloseableIterator<CrosstabRow> rows) {
        _series = series;
        _rows = rows;
    }

    public ImmutableList<SeriesDescriptor> getSeries() {
        return _series;
    }

    public CloseableIterator<CrosstabRow> getRows() {
        return _rows;
    }

    @Override
    public void close() {
        _rows.close();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Series", _series)
                .toString();
    }

    private final ImmutableList<SeriesDescriptor> _series;
    private final CloseableIterator<CrosstabRow> _rows;
}
