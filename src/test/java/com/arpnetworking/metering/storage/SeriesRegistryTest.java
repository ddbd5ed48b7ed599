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

import com.arpnetworking.metering.models.FacetCount;
import com.arpnetworking.metering.models.SeriesDefinition;
import com.arpnetworking.metering.models.SeriesFilter;
import com.arpnetworking.metering.models.SeriesMetadata;
import com.arpnetworking.metering.models.TimeSeriesType;
import com.arpnetworking.test.H2Databases;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tests for the {@link SeriesRegistry}.
 *
 * @author Inscope Metrics
 */
public class SeriesRegistryTest {
    @Before
    public void setUp() {
        _database = H2Databases.launch();
        _registry = new SeriesRegistry(_database);
    }

    @After
    public void tearDown() {
        H2Databases.release(_database);
    }

    @Test
    public void createAssignsIncreasingIds() {
        final long first = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        final long second = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        Assert.assertTrue(second > first);
        Assert.assertTrue(_registry.isSeries(first));
        Assert.assertTrue(_registry.isSeries(second));
    }

    @Test
    public void describeReturnsCreatedAttributes() {
        final SeriesDefinition definition = TestBeanFactory.createSeriesDefinitionBuilder()
                .setName("Kitchen power")
                .setDescription("Main circuit")
                .setUnit("kW")
                .setPeriod(Duration.ofMinutes(5))
                .setEpoch(Instant.parse("2012-01-01T00:00:00Z"))
                .setType(TimeSeriesType.MEAN)
                .setGetLimit(500)
                .build();
        final long id = _registry.create(definition).get();

        final SeriesMetadata metadata = _registry.describe(id).get();
        Assert.assertEquals(id, metadata.getId());
        Assert.assertEquals("Kitchen power", metadata.getName());
        Assert.assertEquals("Main circuit", metadata.getDescription());
        Assert.assertEquals("kW", metadata.getUnit());
        Assert.assertEquals(Duration.ofMinutes(5), metadata.getPeriod());
        Assert.assertEquals(Instant.parse("2012-01-01T00:00:00Z"), metadata.getEpoch());
        Assert.assertEquals(TimeSeriesType.MEAN, metadata.getType());
        Assert.assertEquals(500, metadata.getGetLimit());
    }

    @Test
    public void defaultsApply() {
        final long id = _registry.create(new SeriesDefinition.Builder().setPeriod(Duration.ofSeconds(30)).build()).get();
        final SeriesMetadata metadata = _registry.describe(id).get();
        Assert.assertEquals(TimeSeriesType.POINT, metadata.getType());
        Assert.assertEquals(1000, metadata.getGetLimit());
        Assert.assertEquals(Instant.EPOCH, metadata.getEpoch());
        Assert.assertEquals("", metadata.getName());
    }

    @Test
    public void createRejectsUnknownType() {
        final Optional<Long> id = _registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setType("median").build());
        Assert.assertFalse(id.isPresent());
        Assert.assertTrue(_registry.list(SeriesFilter.all()).isEmpty());
    }

    @Test
    public void createRejectsNonPositivePeriod() {
        Assert.assertFalse(_registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setPeriod(Duration.ZERO).build()).isPresent());
        Assert.assertFalse(_registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setPeriod(Duration.ofSeconds(-60)).build()).isPresent());
        Assert.assertTrue(_registry.list(SeriesFilter.all()).isEmpty());
    }

    @Test
    public void createRejectsNonPositiveLimit() {
        Assert.assertFalse(_registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setGetLimit(0).build()).isPresent());
        Assert.assertTrue(_registry.list(SeriesFilter.all()).isEmpty());
    }

    @Test
    public void createRejectsFractionalPeriod() {
        Assert.assertFalse(_registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setPeriod(Duration.ofMillis(1500)).build()).isPresent());
    }

    @Test
    public void storeRemainsUsableAfterRejectedCreate() {
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setPeriod(Duration.ZERO).build());
        Assert.assertTrue(_registry.create(TestBeanFactory.createSeriesDefinition()).isPresent());
    }

    @Test
    public void dropIsIdempotent() {
        final long id = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        _registry.drop(id);
        Assert.assertFalse(_registry.isSeries(id));
        Assert.assertFalse(_registry.describe(id).isPresent());
        _registry.drop(id);
        _registry.drop(id + 1000);
        Assert.assertFalse(_registry.isSeries(id));
    }

    @Test
    public void listIsOrderedById() {
        final long first = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        final long second = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        final long third = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        Assert.assertEquals(
                ImmutableList.of(first, second, third),
                _registry.list(SeriesFilter.all()).keySet().asList());
    }

    @Test
    public void listFiltersById() {
        _registry.create(TestBeanFactory.createSeriesDefinition());
        final long id = _registry.create(TestBeanFactory.createSeriesDefinition()).get();
        Assert.assertEquals(
                ImmutableSet.of(id),
                _registry.list(new SeriesFilter.Builder().setId(id).build()).keySet());
    }

    @Test
    public void listFiltersByPeriod() {
        final long minute = createWithPeriod(Duration.ofMinutes(1));
        final long fiveMinutes = createWithPeriod(Duration.ofMinutes(5));
        final long hour = createWithPeriod(Duration.ofHours(1));

        Assert.assertEquals(
                ImmutableSet.of(fiveMinutes),
                _registry.list(new SeriesFilter.Builder().setPeriod(Duration.ofMinutes(5)).build()).keySet());
        Assert.assertEquals(
                ImmutableSet.of(minute, fiveMinutes),
                _registry.list(new SeriesFilter.Builder()
                        .setPeriodRange(Duration.ofMinutes(1), Duration.ofHours(1))
                        .build())
                        .keySet());
        Assert.assertEquals(
                ImmutableSet.of(hour),
                _registry.list(new SeriesFilter.Builder()
                        .setPeriodRange(Duration.ofMinutes(6), Duration.ofDays(1))
                        .build())
                        .keySet());
    }

    @Test
    public void listFiltersByFractionalPeriods() {
        final long oneSecond = createWithPeriod(Duration.ofSeconds(1));
        final long twoSeconds = createWithPeriod(Duration.ofSeconds(2));
        createWithPeriod(Duration.ofSeconds(3));

        Assert.assertTrue(_registry.list(new SeriesFilter.Builder().setPeriod(Duration.ofMillis(1500)).build()).isEmpty());
        Assert.assertEquals(
                ImmutableSet.of(oneSecond),
                _registry.list(new SeriesFilter.Builder()
                        .setPeriodRange(Duration.ofMillis(500), Duration.ofMillis(1500))
                        .build())
                        .keySet());
        Assert.assertEquals(
                ImmutableSet.of(twoSeconds),
                _registry.list(new SeriesFilter.Builder()
                        .setPeriodRange(Duration.ofMillis(1500), Duration.ofMillis(2500))
                        .build())
                        .keySet());
        Assert.assertEquals(
                ImmutableSet.of(oneSecond, twoSeconds),
                _registry.list(new SeriesFilter.Builder()
                        .setPeriodRange(Duration.ofSeconds(1), Duration.ofMillis(2001))
                        .build())
                        .keySet());
    }

    @Test
    public void listFiltersByTypes() {
        final long point = createWithType(TimeSeriesType.POINT);
        createWithType(TimeSeriesType.MEAN);
        final long count = createWithType(TimeSeriesType.COUNT);

        Assert.assertEquals(
                ImmutableSet.of(point, count),
                _registry.list(new SeriesFilter.Builder()
                        .setTypes(ImmutableSet.of(TimeSeriesType.POINT, TimeSeriesType.COUNT))
                        .build())
                        .keySet());
        Assert.assertTrue(_registry.list(new SeriesFilter.Builder().setTypes(ImmutableSet.of()).build()).isEmpty());
    }

    @Test
    public void listFiltersByNameIgnoringCase() {
        final long kitchen = _registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setName("Kitchen Temperature").build()).get();
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setName("Garage humidity").build());

        Assert.assertEquals(
                ImmutableSet.of(kitchen),
                _registry.list(new SeriesFilter.Builder().setName("temp").build()).keySet());
    }

    @Test
    public void listFiltersByUnitsIgnoringCase() {
        final long kilowatts = _registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setUnit("kW").build()).get();
        final long celsius = _registry.create(
                TestBeanFactory.createSeriesDefinitionBuilder().setUnit("degC").build()).get();
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setUnit("m3").build());

        Assert.assertEquals(
                ImmutableSet.of(kilowatts, celsius),
                _registry.list(new SeriesFilter.Builder().setUnits(ImmutableSet.of("KW", "DEGC")).build()).keySet());
    }

    @Test
    public void listCombinesFilters() {
        final long match = _registry.create(TestBeanFactory.createSeriesDefinitionBuilder()
                .setName("boiler")
                .setUnit("kW")
                .setType(TimeSeriesType.MEAN)
                .setPeriod(Duration.ofMinutes(5))
                .build()).get();
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder()
                .setName("boiler")
                .setUnit("kW")
                .setType(TimeSeriesType.POINT)
                .setPeriod(Duration.ofMinutes(5))
                .build());
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder()
                .setName("boiler")
                .setUnit("kW")
                .setType(TimeSeriesType.MEAN)
                .setPeriod(Duration.ofMinutes(1))
                .build());

        final ImmutableMap<Long, SeriesMetadata> result = _registry.list(new SeriesFilter.Builder()
                .setName("BOIL")
                .setUnits(ImmutableSet.of("kw"))
                .setTypes(ImmutableSet.of(TimeSeriesType.MEAN))
                .setPeriod(Duration.ofMinutes(5))
                .build());
        Assert.assertEquals(ImmutableSet.of(match), result.keySet());
    }

    @Test
    public void facetSummaryByUnits() {
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setUnit("kW").build());
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setUnit("kW").build());
        _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setUnit("degC").build());

        final Map<String, Long> counts = toMap(_registry.facetSummary("units"));
        Assert.assertEquals(ImmutableMap.of("kW", 2L, "degC", 1L), counts);
    }

    @Test
    public void facetSummaryByPeriodRendersDurations() {
        createWithPeriod(Duration.ofMinutes(1));
        createWithPeriod(Duration.ofHours(1));
        createWithPeriod(Duration.ofHours(1));

        Assert.assertEquals(
                ImmutableList.of(new FacetCount("PT1M", 1), new FacetCount("PT1H", 2)),
                _registry.facetSummary("period"));
    }

    @Test
    public void facetSummaryByType() {
        createWithType(TimeSeriesType.COUNT);
        createWithType(TimeSeriesType.STDEV);
        createWithType(TimeSeriesType.STDEV);

        final Map<String, Long> counts = toMap(_registry.facetSummary("ts_type"));
        Assert.assertEquals(ImmutableMap.of("count", 1L, "stdev", 2L), counts);
    }

    @Test
    public void facetSummaryOfEmptyRegistryIsEmpty() {
        Assert.assertTrue(_registry.facetSummary("units").isEmpty());
    }

    @Test
    public void facetSummaryRejectsUnknownColumn() {
        try {
            _registry.facetSummary("name; drop table series");
            Assert.fail("Expected exception not thrown");
        } catch (final UnknownFacetColumnException e) {
            MatcherAssert.assertThat(e.getColumn(), Matchers.startsWith("name"));
            MatcherAssert.assertThat(e, Matchers.instanceOf(ValidationException.class));
        }
        Assert.assertEquals(0, _registry.list(SeriesFilter.all()).size());
    }

    private long createWithPeriod(final Duration period) {
        return _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setPeriod(period).build()).get();
    }

    private long createWithType(final TimeSeriesType type) {
        return _registry.create(TestBeanFactory.createSeriesDefinitionBuilder().setType(type).build()).get();
    }

    private static Map<String, Long> toMap(final ImmutableList<FacetCount> facets) {
        return facets.stream().collect(Collectors.toMap(FacetCount::getValue, FacetCount::getCount));
    }

    private Database _database;
    private SeriesRegistry _registry;
}
