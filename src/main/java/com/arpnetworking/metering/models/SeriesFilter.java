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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Predicates for listing series. Every predicate is optional and the
 * supplied ones are combined with AND. An empty filter matches every series.
 *
 * @author Inscope Metrics
 */
public final class SeriesFilter {

    /**
     * A filter with no predicates.
     *
     * @return the filter matching every series
     */
    public static SeriesFilter all() {
        return ALL;
    }

    public Optional<Long> getId() {
        return _id;
    }

    public Optional<Duration> getPeriod() {
        return _period;
    }

    /**
     * The period range, closed below and open above.
     *
     * @return the period range if supplied
     */
    public Optional<Range<Duration>> getPeriodRange() {
        return _periodRange;
    }

    /**
     * Acceptable types; a series matches if its type is any of them.
     *
     * @return the acceptable types if supplied
     */
    public Optional<ImmutableSet<TimeSeriesType>> getTypes() {
        return _types;
    }

    /**
     * Case-insensitive substring of the series name.
     *
     * @return the name fragment if supplied
     */
    public Optional<String> getName() {
        return _name;
    }

    /**
     * Acceptable units, compared case-insensitively; a series matches if its
     * unit is any of them.
     *
     * @return the acceptable units if supplied
     */
    public Optional<ImmutableSet<String>> getUnits() {
        return _units;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id)
                .add("Period", _period)
                .add("PeriodRange", _periodRange)
                .add("Types", _types)
                .add("Name", _name)
                .add("Units", _units)
                .toString();
    }

    private SeriesFilter(final Builder builder) {
        _id = builder._id;
        _period = builder._period;
        _periodRange = builder._periodRange;
        _types = builder._types;
        _name = builder._name;
        _units = builder._units;
    }

    private final Optional<Long> _id;
    private final Optional<Duration> _period;
    private final Optional<Range<Duration>> _periodRange;
    private final Optional<ImmutableSet<TimeSeriesType>> _types;
    private final Optional<String> _name;
    private final Optional<ImmutableSet<String>> _units;

    private static final SeriesFilter ALL = new Builder().build();

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SeriesFilter}.
     */
    public static final class Builder extends OvalBuilder<SeriesFilter> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SeriesFilter::new);
        }

        /**
         * Match only the series with this id. Optional.
         *
         * @param value The id.
         * @return This instance of {@link Builder}.
         */
        public Builder setId(final long value) {
            _id = Optional.of(value);
            return this;
        }

        /**
         * Match only series with exactly this period. Optional.
         *
         * @param value The period.
         * @return This instance of {@link Builder}.
         */
        public Builder setPeriod(final Duration value) {
            _period = Optional.of(value);
            return this;
        }

        /**
         * Match series whose period is at least {@code lower} and less than
         * {@code upper}. Optional.
         *
         * @param lower The inclusive lower bound.
         * @param upper The exclusive upper bound; not less than {@code lower}.
         * @return This instance of {@link Builder}.
         */
        public Builder setPeriodRange(final Duration lower, final Duration upper) {
            _periodRange = Optional.of(Range.closedOpen(lower, upper));
            return this;
        }

        /**
         * Match series of any of these types. Optional.
         *
         * @param value The acceptable types.
         * @return This instance of {@link Builder}.
         */
        public Builder setTypes(final Set<TimeSeriesType> value) {
            _types = Optional.of(ImmutableSet.copyOf(value));
            return this;
        }

        /**
         * Match series whose name contains this text, ignoring case. Optional.
         *
         * @param value The name fragment.
         * @return This instance of {@link Builder}.
         */
        public Builder setName(final String value) {
            _name = Optional.of(value);
            return this;
        }

        /**
         * Match series with any of these units, ignoring case. Optional.
         *
         * @param value The acceptable units.
         * @return This instance of {@link Builder}.
         */
        public Builder setUnits(final Set<String> value) {
            _units = Optional.of(ImmutableSet.copyOf(value));
            return this;
        }

        @NotNull
        private Optional<Long> _id = Optional.empty();
        @NotNull
        private Optional<Duration> _period = Optional.empty();
        @NotNull
        private Optional<Range<Duration>> _periodRange = Optional.empty();
        @NotNull
        private Optional<ImmutableSet<TimeSeriesType>> _types = Optional.empty();
        @NotNull
        private Optional<String> _name = Optional.empty();
        @NotNull
        private Optional<ImmutableSet<String>> _units = Optional.empty();
    }
}
