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
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.time.Instant;

/**
 * The attributes of a series to be created. The type is carried as the raw
 * requested value so that the registry can reject unknown types without
 * creating anything.
 *
 * @author Inscope Metrics
 */
public final class SeriesDefinition {

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

    public String getType() {
        return _type;
    }

    public int getGetLimit() {
        return _getLimit;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Description", _description)
                .add("Unit", _unit)
                .add("Period", _period)
                .add("Epoch", _epoch)
                .add("Type", _type)
                .add("GetLimit", _getLimit)
                .toString();
    }

    private SeriesDefinition(final Builder builder) {
        _name = builder._name;
        _description = builder._description;
        _unit = builder._unit;
        _period = builder._period;
        _epoch = builder._epoch;
        _type = builder._type;
        _getLimit = builder._getLimit;
    }

    private final String _name;
    private final String _description;
    private final String _unit;
    private final Duration _period;
    private final Instant _epoch;
    private final String _type;
    private final int _getLimit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SeriesDefinition}.
     */
    public static final class Builder extends OvalBuilder<SeriesDefinition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SeriesDefinition::new);
        }

        /**
         * The series name. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The name.
         * @return This instance of {@link Builder}.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * The series description. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The description.
         * @return This instance of {@link Builder}.
         */
        public Builder setDescription(final String value) {
            _description = value;
            return this;
        }

        /**
         * The unit of the values. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The unit.
         * @return This instance of {@link Builder}.
         */
        public Builder setUnit(final String value) {
            _unit = value;
            return this;
        }

        /**
         * The nominal spacing between samples, in whole seconds. Required.
         * Cannot be null.
         *
         * @param value The period.
         * @return This instance of {@link Builder}.
         */
        public Builder setPeriod(final Duration value) {
            _period = value;
            return this;
        }

        /**
         * The reference instant of the period. Optional. Cannot be null.
         * Defaults to the unix epoch.
         *
         * @param value The epoch.
         * @return This instance of {@link Builder}.
         */
        public Builder setEpoch(final Instant value) {
            _epoch = value;
            return this;
        }

        /**
         * The value semantics, one of {@code point}, {@code mean},
         * {@code stdev} or {@code count}. Optional. Cannot be null. Defaults
         * to {@code point}.
         *
         * @param value The type.
         * @return This instance of {@link Builder}.
         */
        public Builder setType(final String value) {
            _type = value;
            return this;
        }

        /**
         * Convenience for {@link #setType(String)} with a known type.
         *
         * @param value The type.
         * @return This instance of {@link Builder}.
         */
        public Builder setType(final TimeSeriesType value) {
            _type = value.getValue();
            return this;
        }

        /**
         * The maximum number of points returned without pagination. Optional.
         * Defaults to 1000.
         *
         * @param value The limit.
         * @return This instance of {@link Builder}.
         */
        public Builder setGetLimit(final Integer value) {
            _getLimit = value;
            return this;
        }

        @NotNull
        private String _name = "";
        @NotNull
        private String _description = "";
        @NotNull
        private String _unit = "";
        @NotNull
        private Duration _period;
        @NotNull
        private Instant _epoch = Instant.EPOCH;
        @NotNull
        private String _type = TimeSeriesType.POINT.getValue();
        @NotNull
        private Integer _getLimit = 1000;
    }
}
