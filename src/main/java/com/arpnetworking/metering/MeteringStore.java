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
package com.arpnetworking.metering;

import com.arpnetworking.metering.models.Crosstab;
import com.arpnetworking.metering.models.FacetCount;
import com.arpnetworking.metering.models.QueryResult;
import com.arpnetworking.metering.models.SeriesDefinition;
import com.arpnetworking.metering.models.SeriesFilter;
import com.arpnetworking.metering.models.SeriesMetadata;
import com.arpnetworking.metering.storage.PointCursor;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage and query operations over metering series. This is the surface the
 * request handling layer consumes.
 *
 * @author Inscope Metrics
 */
public interface MeteringStore {

    /**
     * Register a new series.
     *
     * @param definition the attributes of the series
     * @return the id of the new series, or empty if the definition was rejected
     */
    Optional<Long> createSeries(SeriesDefinition definition);

    /**
     * Delete a series and all of its points. Dropping an unknown series does
     * nothing.
     *
     * @param seriesId the series to drop
     */
    void dropSeries(long seriesId);

    /**
     * List every series.
     *
     * @return the series keyed by id in id order
     */
    ImmutableMap<Long, SeriesMetadata> listSeries();

    /**
     * List the series matching a filter.
     *
     * @param filter the predicates to apply
     * @return the matching series keyed by id in id order
     */
    ImmutableMap<Long, SeriesMetadata> listSeries(SeriesFilter filter);

    /**
     * The metadata of one series.
     *
     * @param seriesId the series id
     * @return the metadata, or empty if the series does not exist
     */
    Optional<SeriesMetadata> describeSeries(long seriesId);

    /**
     * Whether a series is registered.
     *
     * @param seriesId the series id
     * @return true if and only if the series exists
     */
    boolean isSeries(long seriesId);

    /**
     * Insert or replace the point of a series at a timestamp.
     *
     * @param seriesId the series to write to
     * @param timestamp the timestamp of the point
     * @param value the value; must be finite
     * @return true if the point was stored
     */
    boolean addValue(long seriesId, Instant timestamp, double value);

    /**
     * The points of one series in ascending timestamp order.
     *
     * @param seriesId the series to read
     * @param from the inclusive lower bound; unbounded if empty
     * @param to the exclusive upper bound; unbounded if empty
     * @return the points; empty if the series does not exist
     */
    PointCursor getValues(long seriesId, Optional<Instant> from, Optional<Instant> to);

    /**
     * The points of several series merged into rows by timestamp.
     *
     * @param seriesIds the series in column order
     * @param from the inclusive lower bound; unbounded if empty
     * @param to the exclusive upper bound; unbounded if empty
     * @return the crosstab
     */
    Crosstab getCrosstab(List<Long> seriesIds, Optional<Instant> from, Optional<Instant> to);

    /**
     * The points of one series, or the crosstab of several.
     *
     * @param seriesIds the series to read; not empty
     * @param from the inclusive lower bound; unbounded if empty
     * @param to the exclusive upper bound; unbounded if empty
     * @return the point sequence if one series was requested, otherwise the crosstab
     */
    QueryResult getValues(List<Long> seriesIds, Optional<Instant> from, Optional<Instant> to);

    /**
     * Count the series per distinct value of a metadata column.
     *
     * @param column one of {@code period}, {@code units} or {@code ts_type}
     * @return the distinct values and their counts ordered by value
     */
    ImmutableList<FacetCount> facetSummary(String column);

    /**
     * Drop everything the store owns. The backing {@link com.arpnetworking.metering.storage.Database}
     * must be shut down and launched again, which rebuilds the structure, before
     * further use.
     */
    void wipe();
}
