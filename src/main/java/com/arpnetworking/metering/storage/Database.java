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

import com.arpnetworking.metering.configuration.DatabaseConfiguration;
import com.arpnetworking.metering.models.ebean.Series;
import com.arpnetworking.metering.utility.Launchable;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.annotation.Nullable;

/**
 * Owns the connection pool and the Ebean database for one backing store. The
 * structure of the store is brought to the current version on launch, before
 * any other component may use it.
 *
 * @author Inscope Metrics
 */
public class Database implements Launchable {

    /**
     * Public constructor.
     *
     * @param name the name of the database
     * @param configuration the connection parameters
     */
    public Database(final String name, final DatabaseConfiguration configuration) {
        _name = name;
        _configuration = configuration;
    }

    @Override
    public synchronized void launch() {
        if (_ebeanServer != null) {
            return;
        }
        final HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName(_name);
        hikariConfig.setJdbcUrl(_configuration.getJdbcUrl());
        hikariConfig.setDriverClassName(_configuration.getDriverName());
        hikariConfig.setUsername(_configuration.getUsername());
        hikariConfig.setPassword(_configuration.getPassword());
        hikariConfig.setMaximumPoolSize(_configuration.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(_configuration.getMinimumIdle());
        hikariConfig.setConnectionTimeout(_configuration.getConnectionTimeout().toMillis());
        hikariConfig.setIdleTimeout(_configuration.getIdleTimeout().toMillis());
        hikariConfig.setMaxLifetime(_configuration.getMaxLifetime().toMillis());
        hikariConfig.setAutoCommit(false);
        _dataSource = new HikariDataSource(hikariConfig);

        try {
            _ebeanServer = io.ebean.Database.builder()
                    .name(_name)
                    .dataSource(_dataSource)
                    .register(false)
                    .defaultDatabase(false)
                    .ddlGenerate(false)
                    .ddlRun(false)
                    .addClass(Series.class)
                    .build();

            final SchemaManager schemaManager = new SchemaManager(_ebeanServer);
            schemaManager.ensureCurrent();
            LOGGER.info()
                    .setMessage("Database launched")
                    .addData("database", _name)
                    .addData("schemaVersion", schemaManager.currentVersion())
                    .log();
            // CHECKSTYLE.OFF: IllegalCatch - Release the pool before propagating
        } catch (final RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            LOGGER.error()
                    .setMessage("Database launch failed")
                    .addData("database", _name)
                    .setThrowable(e)
                    .log();
            shutdown();
            throw e;
        }
    }

    @Override
    public synchronized void shutdown() {
        if (_ebeanServer != null) {
            _ebeanServer.shutdown(false, false);
            _ebeanServer = null;
        }
        if (_dataSource != null) {
            _dataSource.close();
            _dataSource = null;
        }
    }

    /**
     * The Ebean database. Only available while launched.
     *
     * @return the Ebean database
     * @throws IllegalStateException if the database is not launched
     */
    public io.ebean.Database getEbeanServer() {
        final io.ebean.Database ebeanServer = _ebeanServer;
        if (ebeanServer == null) {
            throw new IllegalStateException(String.format("Database is not launched; name=%s", _name));
        }
        return ebeanServer;
    }

    public String getName() {
        return _name;
    }

    /**
     * The number of rows a cursor asks the driver to fetch per round trip.
     *
     * @return the fetch size
     */
    public int getFetchSize() {
        return _configuration.getFetchSize();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Configuration", _configuration)
                .add("Launched", _ebeanServer != null)
                .toString();
    }

    private final String _name;
    private final DatabaseConfiguration _configuration;

    @Nullable
    private volatile HikariDataSource _dataSource;
    @Nullable
    private volatile io.ebean.Database _ebeanServer;

    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);
}
