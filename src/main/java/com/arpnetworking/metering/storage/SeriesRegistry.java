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

import com.arpnetworking.metering.models.FacetColumn;
import com.arpnetworking.metering.models.FacetCount;
import com.arpnetworking.metering.models.SeriesDefinition;
import com.arpnetworking.metering.models.SeriesFilter;
import com.arpnetworking.metering.models.SeriesMetadata;
import com.arpnetworking.metering.models.TimeSeriesType;
import com.arpnetworking.metering.models.ebean.Series;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.inject.Inject;
import io.ebean.ExpressionList;
import io.ebean.SqlRow;
import io.ebean.Transaction;
import jakarta.persistence.PersistenceException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Creates, drops, lists and describes series.
 *
 * @author Inscope Metrics
 */
public class SeriesRegistry {

    /**
     * Public constructor.
     *
     * @param database the database backing the registry
     */
    @Inject
    public SeriesRegistry(final Database database) {
        _database = database;
    }

    /**
     * Register a new series. Unknown types and definitions the store rejects
     * (for example a non-positive period or limit) are logged and create
     * nothing.
     *
     * @param definition the attributes of the series
     * @return the id of the new series, or empty if it was not created
     */
    public Optional<Long> create(final SeriesDefinition definition) {
        final Optional<TimeSeriesType> type = TimeSeriesType.fromValue(definition.getType());
        if (!type.isPresent()) {
            LOGGER.warn()
                    .setMessage("Series creation rejected; unknown type")
                    .addData("definition", definition)
                    .log();
            return Optional.empty();
        }
        if (definition.getPeriod().getNano() != 0) {
            LOGGER.warn()
                    .setMessage("Series creation rejected; period must be whole seconds")
                    .addData("definition", definition)
                    .log();
            return Optional.empty();
        }

        final Series series = new Series();
        series.setName(definition.getName());
        series.setDescription(definition.getDescription());
        series.setUnit(definition.getUnit());
        series.setPeriodSeconds(definition.getPeriod().getSeconds());
        series.setEpoch(definition.getEpoch());
        series.setType(type.get());
        series.setGetLimit(definition.getGetLimit());

        final io.ebean.Database ebeanServer = _database.getEbeanServer();
        try (Transaction transaction = ebeanServer.beginTransaction()) {
            ebeanServer.save(series);
            transaction.commit();
        } catch (final PersistenceException e) {
            LOGGER.error()
                    .setMessage("Series creation failed")
                    .addData("definition", definition)
                    .setThrowable(e)
                    .log();
            return Optional.empty();
        }
        LOGGER.debug()
                .setMessage("Created series")
                .addData("id", series.getId())
                .addData("definition", definition)
                .log();
        return Optional.of(series.getId());
    }

    /**
     * Delete a series and all of its points. Dropping an unknown series does
     * nothing.
     *
     * @param seriesId the series to drop
     */
    public void drop(final long seriesId) {
        final int deleted = _database.getEbeanServer().delete(Series.class, seriesId);
        LOGGER.debug()
                .setMessage("Dropped series")
                .addData("id", seriesId)
                .addData("deleted", deleted)
                .log();
    }

    /**
     * List the series matching a filter, ordered by id.
     *
     * @param filter the predicates to apply
     * @return the matching series keyed by id
     */
    public ImmutableMap<Long, SeriesMetadata> list(final SeriesFilter filter) {
        final ExpressionList<Series> where = _database.getEbeanServer().find(Series.class).where();
        if (filter.getId().isPresent()) {
            where.idEq(filter.getId().get());
        }
        if (filter.getPeriod().isPresent()) {
            final Duration period = filter.getPeriod().get();
            // Periods are stored in whole seconds
            if (period.getNano() != 0) {
                return ImmutableMap.of();
            }
            where.eq("periodSeconds", period.getSeconds());
        }
        if (filter.getPeriodRange().isPresent()) {
            final Range<Duration> range = filter.getPeriodRange().get();
            where.ge("periodSeconds", ceilSeconds(range.lowerEndpoint()))
                    .lt("periodSeconds", ceilSeconds(range.upperEndpoint()));
        }
        if (filter.getTypes().isPresent()) {
            if (filter.getTypes().get().isEmpty()) {
                return ImmutableMap.of();
            }
            where.in("type", filter.getTypes().get());
        }
        if (filter.getName().isPresent()) {
            where.icontains("name", filter.getName().get());
        }
        if (filter.getUnits().isPresent()) {
            final Set<String> units = filter.getUnits().get();
            if (units.isEmpty()) {
                return ImmutableMap.of();
            }
            final ExpressionList<Series> anyUnit = where.disjunction();
            for (final String unit : units) {
                anyUnit.ieq("unit", unit);
            }
            anyUnit.endJunction();
        }

        final ImmutableMap.Builder<Long, SeriesMetadata> result = ImmutableMap.builder();
        for (final Series series : where.orderBy("id").findList()) {
            result.put(series.getId(), series.toMetadata());
        }
        return result.build();
    }

    /**
     * Whether a series is registered.
     *
     * @param seriesId the series id
     * @return true if and only if the series exists
     */
    public boolean isSeries(final long seriesId) {
        return Series.exists(seriesId, _database);
    }

    /**
     * The metadata of one series.
     *
     * @param seriesId the series id
     * @return the metadata, or empty if the series does not exist
     */
    public Optional<SeriesMetadata> describe(final long seriesId) {
        return Optional.ofNullable(Series.findById(seriesId, _database)).map(Series::toMetadata);
    }

    /**
     * Count the series per distinct value of a metadata column, ordered by
     * value.
     *
     * @param columnName the public name of the column: {@code period}, {@code units} or {@code ts_type}
     * @return the distinct values and their counts
     * @throws UnknownFacetColumnException if the column may not be summarized
     */
    public ImmutableList<FacetCount> facetSummary(final String columnName) {
        final FacetColumn column = FacetColumn.tryFromName(columnName)
                .orElseThrow(() -> new UnknownFacetColumnException(columnName));
        final String sql = String.format(
                "select %1$s as facet_value, count(*) as facet_count from series group by %1$s order by %1$s",
                column.getColumn());

        final ImmutableList.Builder<FacetCount> result = ImmutableList.builder();
        for (final SqlRow row : _database.getEbeanServer().sqlQuery(sql).findList()) {
            result.add(new FacetCount(column.render(row.get("facet_value")), row.getLong("facet_count")));
        }
        return result.build();
    }

    private static long ceilSeconds(final Duration duration) {
        return duration.getNano() == 0 ? duration.getSeconds() : duration.getSeconds() + 1;
    }

    private final Database _database;

    private static final Logger LOGGER = LoggerFactory.getLogger(SeriesRegistry.class);
}
