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

/**
 * Describes one column of a crosstab.
 *
 * @author Inscope Metrics
 */
public final class SeriesDescriptor {

    /**
     * Create the descriptor of a registered series.
     *
     * @param metadata the series metadata
     * @return the descriptor
     */
    public static SeriesDescriptor of(final SeriesMetadata metadata) {
        return new Builder()
                .setId(metadata.getId())
                .setName(metadata.getName())
                .setType(metadata.getType())
                .setUnit(metadata.getUnit())
                .build();
    }

    public long getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public TimeSeriesType getType() {
        return _type;
    }

    public String getUnit() {
        return _unit;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SeriesDescriptor)) {
            return false;
        }
        final SeriesDescriptor otherDescriptor = (SeriesDescriptor) other;
        return _id == otherDescriptor._id
                && Objects.equal(_name, otherDescriptor._name)
                && _type == otherDescriptor._type
                && Objects.equal(_unit, otherDescriptor._unit);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _name, _type, _unit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id)
                .add("Name", _name)
                .add("Type", _type)
                .add("Unit", _unit)
                .toString();
    }

    private SeriesDescriptor(final Builder builder) {
        _id = builder._id;
        _name = builder._name;
        _type = builder._type;
        _unit = builder._unit;
    }

    private final long _id;
    private final String _name;
    private final TimeSeriesType _type;
    private final String _unit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SeriesDescriptor}.
     */
    public static final class Builder extends OvalBuilder<SeriesDescriptor> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SeriesDescriptor::new);
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
         * The series type. Required. Cannot be null.
         *
         * @param value The type.
         * @return This instance of {@link Builder}.
         */
        public Builder setType(final TimeSeriesType value) {
            _type = value;
            return this;
        }

        /**
         * The series unit. Required. Cannot be null.
         *
         * @param value The unit.
         * @return This instance of {@link Builder}.
         */
        public Builder setUnit(final String value) {
            _unit = value;
            return this;
        }

        @NotNull
        private Long _id;
        @NotNull
        private String _name;
        @NotNull
        private TimeSeriesType _type;
        @NotNull
        private String _unit;
    }
}
