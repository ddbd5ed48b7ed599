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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a registered series.
 *
 * @author Inscope Metrics
 */
public final class SeriesMetadata {

    public long getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public String getDescription() {
        return _description;
    }

    public String getUnit() {
        return _unit;
    }

    public Duration getPeriod() {
        return _period;
    }

    public Instant getEpoch() {
        return _epoch;
    }

    public TimeSeriesType getType() {
        return _type;
    }

    public int getGetLimit() {
        return _getLimit;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SeriesMetadata)) {
            return false;
        }
        final SeriesMetadata otherMetadata = (SeriesMetadata) other;
        return _id == otherMetadata._id
                && _getLimit == otherMetadata._getLimit
                && Objects.equal(_name, otherMetadata._name)
                && Objects.equal(_description, otherMetadata._description)
                && Objects.equal(_unit, otherMetadata._unit)
                && Objects.equal(_period, otherMetadata._period)
                && Objects.equal(_epoch, otherMetadata._epoch)
                && _type == otherMetadata._type;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _name, _description, _unit, _period, _epoch, _type, _getLimit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id)
                .add("Name", _name)
                .add("Description", _description)
                .add("Unit", _unit)
                .add("Period", _period)
                .add("Epoch", _epoch)
                .add("Type", _type)
                .add("GetLimit", _getLimit)
                .toString();
    }

    private SeriesMetadata(final Builder builder) {
        _id = builder._id;
        _name = builder._name;
        _description = builder._description;
        _unit = builder._unit;
        _period = builder._period;
        _epoch = builder._epoch;
        _type = builder._type;
        _getLimit = builder._getLimit;
    }

    private final long _id;
    private final String _name;
    private final String _description;
    private final String _unit;
    private final Duration _period;
    private final Instant _epoch;
    private final TimeSeriesType _type;
    private final int _getLimit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SeriesMetadata}.
     */
    public static final class Builder extends OvalBuilder<SeriesMetadata> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SeriesMetadata::new);
        }

        /**
         * The series id. Required. Cannot be null.
         *
         * @param value The id.
         * @return This instance of {@link Builder}.
         */
        public Builder setId(final Long value) {
            _id = value;
            return this;
        }

        /**
         * The series name. Required. Cannot be null.
         *
         * @param value The name.
         * @return This instance of {@link Builder}.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * The description. Required. Cannot be null.
         *
         * @param value The description.
         * @return This instance of {@link Builder}.
         */
        public Builder setDescription(final String value) {
            _description = value;
            return this;
        }

        /**
         * The unit. Required. Cannot be null.
         *
         * @param value The unit.
         * @return This instance of {@link Builder}.
         */
        public Builder setUnit(final String value) {
            _unit = value;
            return this;
        }

        /**
         * The period. Required. Cannot be null.
         *
         * @param value The period.
         * @return This instance of {@link Builder}.
         */
        public Builder setPeriod(final Duration value) {
            _period = value;
            return this;
        }

        /**
         * The epoch. Required. Cannot be null.
         *
         * @param value The epoch.
         * @return This instance of {@link Builder}.
         */
        public Builder setEpoch(final Instant value) {
            _epoch = value;
            return this;
        }

        /**
         * The type. Required. Cannot be null.
         *
         * @param value The type.
         * @return This instance of {@link Builder}.
         */
        public Builder setType(final TimeSeriesType value) {
            _type = value;
            return this;
        }

        /**
         * The retrieval limit. Required. Cannot be null.
         *
         * @param value The limit.
         * @return This instance of {@link Builder}.
         */
        public Builder setGetLimit(final Integer value) {
            _getLimit = value;
            return this;
        }

        @NotNull
        private Long _id;
        @NotNull
        private String _name;
        @NotNull
        private String _description;
        @NotNull
        private String _unit;
        @NotNull
        private Duration _period;
        @NotNull
        private Instant _epoch;
        @NotNull
        private TimeSeriesType _type;
        @NotNull
        private Integer _getLimit;
    }
}
