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

import java.util.Optional;

/**
 * Result of a query over one or more series: the point sequence when a
 * single series was requested, otherwise a crosstab.
 *
 * @author Inscope Metrics
 */
public final class QueryResult implements AutoCloseable {

    /**
     * Wrap the points of a single series.
     *
     * @param points the points in ascending timestamp order
     * @return the result
     */
    public static QueryResult ofPoints(final CloseableIterator<DataPoint> points) {
        return new QueryResult(Optional.of(points), Optional.empty());
    }

    /**
     * Wrap a crosstab.
     *
     * @param crosstab the crosstab
     * @return the result
     */
    public static QueryResult ofCrosstab(final Crosstab crosstab) {
        return new QueryResult(Optional.empty(), Optional.of(crosstab));
    }

    public boolean isCrosstab() {
        return _crosstab.isPresent();
    }

    /**
     * The points of the single requested series.
     *
     * @return the points
     * @throws IllegalStateException if this result is a crosstab
     */
    public CloseableIterator<DataPoint> getPoints() {
        return _points.orElseThrow(() -> new IllegalStateException("Result is a crosstab"));
    }

    /**
     * The crosstab over the requested series.
     *
     * @return the crosstab
     * @throws IllegalStateException if this result is a point sequence
     */
    public Crosstab getCrosstab() {
        return _crosstab.orElseThrow(() -> new IllegalStateException("Result is a point sequence"));
    }

    @Override
    public void close() {
        _points.ifPresent(CloseableIterator::close);
        _crosstab.ifPresent(Crosstab::close);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Crosstab", _crosstab)
                .toString();
    }

    private QueryResult(final Optional<CloseableIterator<DataPoint>> points, final Optional<Crosstab> crosstab) {
        _points = points;
        _crosstab = crosstab;
    }

    private final Optional<CloseableIterator<DataPoint>> _points;
    private final Optional<Crosstab> _crosstab;
}
