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
package com.arpnetworking.metering.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;

/**
 * Representation of metering store configuration.
 *
 * @author Inscope Metrics
 */
public final class MeteringConfiguration {
    /**
     * Create an {@link ObjectMapper} for metering store configuration.
     *
     * @return An {@link ObjectMapper} for metering store configuration.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    public DatabaseConfiguration getDatabase() {
        return _database;
    }

    public Duration getShutdownTimeout() {
        return _shutdownTimeout;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Database", _database)
                .add("ShutdownTimeout", _shutdownTimeout)
                .toString();
    }

    private MeteringConfiguration(final Builder builder) {
        _database = builder._database;
        _shutdownTimeout = builder._shutdownTimeout;
    }

    private final DatabaseConfiguration _database;
    private final Duration _shutdownTimeout;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MeteringConfiguration}.
     */
    public static final class Builder extends OvalBuilder<MeteringConfiguration> {
        /**
         * Public constructor.
         */
        public Builder() {
            super(MeteringConfiguration::new);
        }

        /**
         * The backing store configuration. Required. Cannot be null.
         *
         * @param value The database configuration.
         * @return This instance of {@link Builder}.
         */
        public Builder setDatabase(final DatabaseConfiguration value) {
            _database = value;
            return this;
        }

        /**
         * How long shutdown may take before the process gives up waiting.
         * Optional. Cannot be null. Defaults to one minute.
         *
         * @param value The shutdown timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setShutdownTimeout(final Duration value) {
            _shutdownTimeout = value;
            return this;
        }

        @NotNull
        private DatabaseConfiguration _database;
        @NotNull
        private Duration _shutdownTimeout = Duration.ofMinutes(1);
    }
}
