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

import com.arpnetworking.metering.models.Crosstab;
import com.arpnetworking.metering.models.CrosstabRow;
import com.arpnetworking.metering.models.SeriesDescriptor;
import com.arpnetworking.metering.utility.CloseableIterator;
import com.google.common.base.Joiner;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.google.inject.Inject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges the points of several series into rows keyed by timestamp.
 *
 * <p>The points of all requested series are read with a single query ordered
 * by timestamp and series. Consecutive points sharing a timestamp form one
 * row and each point is placed in the column of its series. Only the points
 * of the current timestamp are buffered.</p>
 *
 * @author Inscope Metrics
 */
public class CrosstabEngine {

    /**
     * Public constructor.
     *
     * @param database the database to read from
     * @param registry the registry describing the series
     */
    @Inject
    public CrosstabEngine(final Database database, final SeriesRegistry registry) {
        _database = database;
        _registry = registry;
    }

    /**
     * Build the crosstab of several series within a time range. Column
     * {@code i} of every row belongs to {@code seriesIds.get(i)} and is empty
     * where that series has no point at the row timestamp.
     *
     * @param seriesIds the series in column order
     * @param from the inclusive lower bound; unbounded if empty
     * @param to the exclusive upper bound; unbounded if empty
     * @return the crosstab; close it if its rows are not exhausted
     * @throws IllegalArgumentException if no ids are given or an id is repeated
     * @throws SeriesNotFoundException if a series does not exist
     */
    public Crosstab getCrosstab(final List<Long> seriesIds, final Optional<Instant> from, final Optional<Instant> to) {
        if (seriesIds.isEmpty()) {
            throw new IllegalArgumentException("At least one series is required");
        }
        final Map<Long, Integer> columns = new HashMap<>();
        final ImmutableList.Builder<SeriesDescriptor> descriptors = ImmutableList.builder();
        for (final Long seriesId : seriesIds) {
            if (columns.putIfAbsent(seriesId, columns.size()) != null) {
                throw new IllegalArgumentException(String.format("Series requested more than once; id=%d", seriesId));
            }
            descriptors.add(SeriesDescriptor.of(
                    _registry.describe(seriesId).orElseThrow(() -> new SeriesNotFoundException(seriesId))));
        }

        final StringBuilder sql = new StringBuilder("select series_id, stamp, data_value from series_data where series_id in (")
                .append(Joiner.on(", ").join(Collections.nCopies(seriesIds.size(), "?")))
                .append(")");
        final List<Object> parameters = new ArrayList<>(seriesIds);
        RecordCursor.appendRange(sql, parameters, from, to);
        sql.append(" order by stamp, series_id");

        final RecordCursor<SeriesValue> records = RecordCursor.open(
                _database,
                sql.toString(),
                parameters,
                resultSet -> new SeriesValue(
                        resultSet.getLong(1),
                        RecordCursor.readInstant(resultSet, 2),
                        resultSet.getDouble(3)));
        return new Crosstab(descriptors.build(), new RowIterator(records, ImmutableMap.copyOf(columns)));
    }

    private final Database _database;
    private final SeriesRegistry _registry;

    private static final class RowIterator extends AbstractIterator<CrosstabRow> implements CloseableIterator<CrosstabRow> {

        private RowIterator(final RecordCursor<SeriesValue> records, final ImmutableMap<Long, Integer> columns) {
            _records = records;
            _peekable = Iterators.peekingIterator(records);
            _columns = columns;
        }

        @Override
        protected CrosstabRow computeNext() {
            if (!_peekable.hasNext()) {
                return endOfData();
            }
            final SeriesValue first = _peekable.next();
            final List<Optional<Double>> values = new ArrayList<>(Collections.nCopies(_columns.size(), Optional.<Double>empty()));
            values.set(_columns.get(first._seriesId), Optional.of(first._value));
            while (_peekable.hasNext() && _peekable.peek()._timestamp.equals(first._timestamp)) {
                final SeriesValue next = _peekable.next();
                values.set(_columns.get(next._seriesId), Optional.of(next._value));
            }
            return new CrosstabRow(first._timestamp, values);
        }

        @Override
        public void close() {
            _records.close();
        }

        private final RecordCursor<SeriesValue> _records;
        private final PeekingIterator<SeriesValue> _peekable;
        private final ImmutableMap<Long, Integer> _columns;
    }

    private static final class SeriesValue {

        private SeriesValue(final long seriesId, final Instant timestamp, final double value) {
            _seriesId = seriesId;
            _timestamp = timestamp;
            _value = value;
        }

        private final long _seriesId;
        private final Instant _timestamp;
        private final double _value;
    }
}
