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
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;

import java.time.Duration;

/**
 * Connection parameters for the backing store.
 *
 * @author Inscope Metrics
 */
public final class DatabaseConfiguration {

    public String getJdbcUrl() {
        return _jdbcUrl;
    }

    public String getDriverName() {
        return _driverName;
    }

    public String getUsername() {
        return _username;
    }

    public String getPassword() {
        return _password;
    }

    public int getMaximumPoolSize() {
        return _maximumPoolSize;
    }

    public int getMinimumIdle() {
        return _minimumIdle;
    }

    public Duration getConnectionTimeout() {
        return _connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return _idleTimeout;
    }

    public Duration getMaxLifetime() {
        return _maxLifetime;
    }

    public int getFetchSize() {
        return _fetchSize;
    }

    @Override
    public String toString() {
        // Password omitted
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("JdbcUrl", _jdbcUrl)
                .add("DriverName", _driverName)
                .add("Username", _username)
                .add("MaximumPoolSize", _maximumPoolSize)
                .add("MinimumIdle", _minimumIdle)
                .add("ConnectionTimeout", _connectionTimeout)
                .add("IdleTimeout", _idleTimeout)
                .add("MaxLifetime", _maxLifetime)
                .add("FetchSize", _fetchSize)
                .toString();
    }

    private DatabaseConfiguration(final Builder builder) {
        _jdbcUrl = builder._jdbcUrl;
        _driverName = builder._driverName;
        _username = builder._username;
        _password = builder._password;
        _maximumPoolSize = builder._maximumPoolSize;
        _minimumIdle = builder._minimumIdle;
        _connectionTimeout = builder._connectionTimeout;
        _idleTimeout = builder._idleTimeout;
        _maxLifetime = builder._maxLifetime;
        _fetchSize = builder._fetchSize;
    }

    private final String _jdbcUrl;
    private final String _driverName;
    private final String _username;
    private final String _password;
    private final int _maximumPoolSize;
    private final int _minimumIdle;
    private final Duration _connectionTimeout;
    private final Duration _idleTimeout;
    private final Duration _maxLifetime;
    private final int _fetchSize;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DatabaseConfiguration}.
     */
    public static final class Builder extends OvalBuilder<DatabaseConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DatabaseConfiguration::new);
        }

        /**
         * The JDBC url. Required. Cannot be null or empty.
         *
         * @param value The JDBC url.
         * @return This instance of {@link Builder}.
         */
        public Builder setJdbcUrl(final String value) {
            _jdbcUrl = value;
            return this;
        }

        /**
         * The JDBC driver class name. Optional. Cannot be null or empty.
         * Defaults to the PostgreSQL driver.
         *
         * @param value The driver class name.
         * @return This instance of {@link Builder}.
         */
        public Builder setDriverName(final String value) {
            _driverName = value;
            return this;
        }

        /**
         * The user name. Required. Cannot be null.
         *
         * @param value The user name.
         * @return This instance of {@link Builder}.
         */
        public Builder setUsername(final String value) {
            _username = value;
            return this;
        }

        /**
         * The password. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The password.
         * @return This instance of {@link Builder}.
         */
        public Builder setPassword(final String value) {
            _password = value;
            return this;
        }

        /**
         * The maximum number of pooled connections. Optional. Defaults to 10.
         *
         * @param value The maximum pool size.
         * @return This instance of {@link Builder}.
         */
        public Builder setMaximumPoolSize(final Integer value) {
            _maximumPoolSize = value;
            return this;
        }

        /**
         * The minimum number of idle connections. Optional. Defaults to 1.
         *
         * @param value The minimum idle connections.
         * @return This instance of {@link Builder}.
         */
        public Builder setMinimumIdle(final Integer value) {
            _minimumIdle = value;
            return this;
        }

        /**
         * How long to wait for a pooled connection. Optional. Defaults to
         * 30 seconds.
         *
         * @param value The connection timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setConnectionTimeout(final Duration value) {
            _connectionTimeout = value;
            return this;
        }

        /**
         * How long a connection may sit idle in the pool. Optional. Defaults
         * to 10 minutes.
         *
         * @param value The idle timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setIdleTimeout(final Duration value) {
            _idleTimeout = value;
            return this;
        }

        /**
         * The maximum lifetime of a pooled connection. Optional. Defaults to
         * 30 minutes.
         *
         * @param value The maximum lifetime.
         * @return This instance of {@link Builder}.
         */
        public Builder setMaxLifetime(final Duration value) {
            _maxLifetime = value;
            return this;
        }

        /**
         * Rows fetched per round trip when streaming query results. Optional.
         * Defaults to 1000.
         *
         * @param value The fetch size.
         * @return This instance of {@link Builder}.
         */
        public Builder setFetchSize(final Integer value) {
            _fetchSize = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _jdbcUrl;
        @NotNull
        @NotEmpty
        private String _driverName = "org.postgresql.Driver";
        @NotNull
        private String _username;
        @NotNull
        private String _password = "";
        @NotNull
        @Range(min = 1, max = 1000)
        private Integer _maximumPoolSize = 10;
        @NotNull
        @Range(min = 0, max = 1000)
        private Integer _minimumIdle = 1;
        @NotNull
        private Duration _connectionTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration _idleTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration _maxLifetime = Duration.ofMinutes(30);
        @NotNull
        @Range(min = 1, max = Integer.MAX_VALUE)
        private Integer _fetchSize = 1000;
    }
}
