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
package com.arpnetworking.metering.models.ebean;

import com.arpnetworking.metering.models.SeriesMetadata;
import com.arpnetworking.metering.models.TimeSeriesType;
import com.arpnetworking.metering.storage.Database;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Model of a registered series. Its points live in the {@code series_data}
 * table and are removed by the store when the series row is deleted.
 *
 * @author Inscope Metrics
 */
// CHECKSTYLE.OFF: MemberNameCheck
@Entity
@Table(name = "series")
public class Series {
    /**
     * Fetches a series by id.
     *
     * @param id the series id
     * @param database the database backing the data
     * @return the series if found, otherwise null
     */
    @Nullable
    public static Series findById(final long id, final Database database) {
        return database.getEbeanServer()
                .find(Series.class)
                .where()
                .idEq(id)
                .findOne();
    }

    /**
     * Whether a series with this id exists.
     *
     * @param id the series id
     * @param database the database backing the data
     * @return true if and only if the series exists
     */
    public static boolean exists(final long id, final Database database) {
        return database.getEbeanServer()
                .find(Series.class)
                .where()
                .idEq(id)
                .findCount() > 0;
    }

    /**
     * Snapshot this row as an immutable value.
     *
     * @return the metadata of this series
     */
    public SeriesMetadata toMetadata() {
        return new SeriesMetadata.Builder()
                .setId(id)
                .setName(name)
                .setDescription(description)
                .setUnit(unit)
                .setPeriod(Duration.ofSeconds(periodSeconds))
                .setEpoch(epoch)
                .setType(type)
                .setGetLimit(getLimit)
                .build();
    }

    public Long getId() {
        return id;
    }

    public void setId(final Long value) {
        id = value;
    }

    public String getName() {
        return name;
    }

    public void setName(final String value) {
        name = value;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(final String value) {
        description = value;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(final String value) {
        unit = value;
    }

    public Long getPeriodSeconds() {
        return periodSeconds;
    }

    public void setPeriodSeconds(final Long value) {
        periodSeconds = value;
    }

    public Instant getEpoch() {
        return epoch;
    }

    public void setEpoch(final Instant value) {
        epoch = value;
    }

    public TimeSeriesType getType() {
        return type;
    }

    public void setType(final TimeSeriesType value) {
        type = value;
    }

    public Integer getGetLimit() {
        return getLimit;
    }

    public void setGetLimit(final Integer value) {
        getLimit = value;
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name")
    private String name;

    @Column(name = "description")
    private String description;

    @Column(name = "unit")
    private String unit;

    @Column(name = "period_seconds")
    private Long periodSeconds;

    @Column(name = "epoch")
    private Instant epoch;

    @Column(name = "ts_type")
    private TimeSeriesType type;

    @Column(name = "get_limit")
    private Integer getLimit;
}
// CHECKSTYLE.ON: MemberNameCheck
