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
package com.arpnetworking.metering.storage;

import com.arpnetworking.metering.models.DataPoint;
import com.arpnetworking.metering.utility.CloseableIterator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass sequence of the points of one series in ascending timestamp
 * order. Close the cursor if it is abandoned before it is exhausted.
 *
 * @author Inscope Metrics
 */
public final class PointCursor implements CloseableIterator<DataPoint> {

    /**
     * Open a cursor over the points of a series within a time range. A series
     * that does not exist has no points.
     *
     * @param database the database to read from
     * @param seriesId the series to read
     * @param from the inclusive lower bound; unbounded if empty
     * @param to the exclusive upper bound; unbounded if empty
     * @return the open cursor
     */
    public static PointCursor open(
            final Database database,
            final long seriesId,
            final Optional<Instant> from,
            final Optional<Instant> to) {
        final StringBuilder sql = new StringBuilder("select stamp, data_value from series_data where series_id = ?");
        final List<Object> parameters = new ArrayList<>();
        parameters.add(seriesId);
        RecordCursor.appendRange(sql, parameters, from, to);
        sql.append(" order by stamp");
        return new PointCursor(RecordCursor.open(
                database,
                sql.toString(),
                parameters,
                resultSet -> new DataPoint(RecordCursor.readInstant(resultSet, 1), resultSet.getDouble(2))));
    }

    /**
     * A cursor with no points.
     *
     * @return the empty cursor
     */
    public static PointCursor empty() {
        return new PointCursor(Collections.emptyIterator());
    }

    @Override
    public boolean hasNext() {
        return _points.hasNext();
    }

    @Override
    public DataPoint next() {
        return _points.next();
    }

    @Override
    public void close() {
        if (_points instanceof CloseableIterator) {
            ((CloseableIterator<DataPoint>) _points).close();
        }
    }

    private PointCursor(final Iterator<DataPoint> points) {
        _points = points;
    }

    private final Iterator<DataPoint> _points;
}
