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
import com.arpnetworking.metering.storage.CrosstabEngine;
import com.arpnetworking.metering.storage.Database;
import com.arpnetworking.metering.storage.PointCursor;
import com.arpnetworking.metering.storage.PointStore;
import com.arpnetworking.metering.storage.SchemaManager;
import com.arpnetworking.metering.storage.SeriesRegistry;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link MeteringStore} backed by a relational {@link Database}.
 *
 * @author Inscope Metrics
 */
public final class DatabaseMeteringStore implements MeteringStore {

    /**
     * Public constructor.
     *
     * @param database the launched database
     * @param registry the series registry
     * @param pointStore the point store
     * @param crosstabEngine the crosstab engine
     */
    @Inject
    public DatabaseMeteringStore(
            final Database database,
            final SeriesRegistry registry,
            final PointStore pointStore,
            final CrosstabEngine crosstabEngine) {
        _database = database;
        _registry = registry;
        _pointStore = pointStore;
        _crosstabEngine = crosstabEngine;
    }

    @Override
    public Optional<Long> createSeries(final SeriesDefinition definition) {
        return _registry.create(definition);
    }

    @Override
    public void dropSeries(final long seriesId) {
        _registry.drop(seriesId);
    }

    @Override
    public ImmutableMap<Long, SeriesMetadata> listSeries() {
        return _registry.list(SeriesFilter.all());
    }

    @Override
    public ImmutableMap<Long, SeriesMetadata> listSeries(final SeriesFilter filter) {
        return _registry.list(filter);
    }

    @Override
    public Optional<SeriesMetadata> describeSeries(final long seriesId) {
        return _registry.describe(seriesId);
    }

    @Override
    public boolean isSeries(final long seriesId) {
        return _registry.isSeries(seriesId);
    }

    @Override
    public boolean addValue(final long seriesId, final Instant timestamp, final double value) {
        return _pointStore.addValue(seriesId, timestamp, value);
    }

    @Override
    public PointCursor getValues(final long seriesId, final Optional<Instant> from, final Optional<Instant> to) {
        return PointCursor.open(_database, seriesId, from, to);
    }

    @Override
    public Crosstab getCrosstab(final List<Long> seriesIds, final Optional<Instant> from, final Optional<Instant> to) {
        return _crosstabEngine.getCrosstab(seriesIds, from, to);
    }

    @Override
    public QueryResult getValues(final List<Long> seriesIds, final Optional<Instant> from, final Optional<Instant> to) {
        if (seriesIds.isEmpty()) {
            throw new IllegalArgumentException("At least one series is required");
        }
        if (seriesIds.size() == 1) {
            return QueryResult.ofPoints(getValues(seriesIds.get(0), from, to));
        }
        return QueryResult.ofCrosstab(getCrosstab(seriesIds, from, to));
    }

    @Override
    public ImmutableList<FacetCount> facetSummary(final String column) {
        return _registry.facetSummary(column);
    }

    @Override
    public void wipe() {
        new SchemaManager(_database.getEbeanServer()).wipe();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Database", _database)
                .toString();
    }

    private final Database _database;
    private final SeriesRegistry _registry;
    private final PointStore _pointStore;
    private final CrosstabEngine _crosstabEngine;
}
