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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import io.ebean.SqlRow;
import io.ebean.Transaction;
import jakarta.persistence.PersistenceException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import javax.annotation.Nullable;

/**
 * Detects the structure version of the store and applies the migrations
 * needed to reach the version this code requires.
 *
 * <p>A store without a version marker is at version 0 and is built in a single
 * transaction which records the final version at its end. A store at version 1
 * or later is upgraded one step at a time; each step commits together with its
 * version bump. On PostgreSQL the DDL is transactional so a failed step leaves
 * nothing behind. Databases that commit DDL implicitly only guarantee that the
 * recorded version is not advanced.</p>
 *
 * @author Inscope Metrics
 */
public final class SchemaManager {

    /**
     * Public constructor.
     *
     * @param ebeanServer the Ebean database to manage
     */
    public SchemaManager(final io.ebean.Database ebeanServer) {
        this(ebeanServer, Migration.CHAIN);
    }

    /* package private */ SchemaManager(final io.ebean.Database ebeanServer, final ImmutableList<Migration> migrations) {
        for (int i = 0; i < migrations.size(); ++i) {
            if (migrations.get(i).getVersion() != i + 1) {
                throw new IllegalArgumentException(
                        String.format("Migrations must be contiguous from version 1; index=%d, migration=%s", i, migrations.get(i)));
            }
        }
        _ebeanServer = ebeanServer;
        _migrations = migrations;
    }

    /**
     * The version this code requires.
     *
     * @return the version of the last known migration
     */
    public int getTargetVersion() {
        return _migrations.size();
    }

    /**
     * The version recorded in the store.
     *
     * @return the version, 0 if the store has no version marker
     */
    public int currentVersion() {
        @Nullable final SqlRow tables = _ebeanServer.sqlQuery(VERSION_TABLE_QUERY).findOne();
        if (tables == null || tables.getLong("table_count") == 0) {
            return 0;
        }
        @Nullable final SqlRow version = _ebeanServer.sqlQuery(VERSION_QUERY).findOne();
        if (version == null) {
            throw new SchemaMigrationException("Version marker table is empty");
        }
        return version.getInteger("current_version");
    }

    /**
     * Bring the store to the target version if it is behind.
     *
     * @throws SchemaMigrationException if the store is newer than this code or a step fails
     */
    public void ensureCurrent() {
        final int current = currentVersion();
        if (current > getTargetVersion()) {
            throw new SchemaMigrationException(
                    String.format(
                            "Store version is newer than supported; current=%d, supported=%d",
                            current,
                            getTargetVersion()));
        }
        if (current < getTargetVersion()) {
            upgrade(current);
        }
    }

    /**
     * Apply every migration after {@code fromVersion}.
     *
     * @param fromVersion the version currently recorded in the store
     * @throws SchemaMigrationException if a step fails
     */
    public void upgrade(final int fromVersion) {
        if (fromVersion < 0 || fromVersion > getTargetVersion()) {
            throw new SchemaMigrationException(
                    String.format("Cannot upgrade; from=%d, target=%d", fromVersion, getTargetVersion()));
        }
        LOGGER.info()
                .setMessage("Upgrade required")
                .addData("fromVersion", fromVersion)
                .addData("toVersion", getTargetVersion())
                .log();

        if (fromVersion == 0) {
            try (Transaction transaction = _ebeanServer.beginTransaction()) {
                final Connection connection = transaction.connection();
                for (final Migration migration : _migrations) {
                    apply(connection, migration);
                }
                writeVersion(connection, INSERT_VERSION, getTargetVersion());
                transaction.commit();
            } catch (final SQLException | PersistenceException e) {
                throw failed(0, getTargetVersion(), e);
            }
            LOGGER.info()
                    .setMessage("Created store structure")
                    .addData("version", getTargetVersion())
                    .log();
            return;
        }

        for (final Migration migration : _migrations.subList(fromVersion, _migrations.size())) {
            try (Transaction transaction = _ebeanServer.beginTransaction()) {
                final Connection connection = transaction.connection();
                apply(connection, migration);
                writeVersion(connection, UPDATE_VERSION, migration.getVersion());
                transaction.commit();
            } catch (final SQLException | PersistenceException e) {
                throw failed(migration.getVersion() - 1, migration.getVersion(), e);
            }
            LOGGER.info()
                    .setMessage("Applied migration")
                    .addData("migration", migration)
                    .log();
        }
    }

    /**
     * Drop every table owned by the store. Used for tests and teardown only.
     */
    public void wipe() {
        try (Transaction transaction = _ebeanServer.beginTransaction()) {
            try (Statement statement = transaction.connection().createStatement()) {
                for (final String table : TABLES) {
                    statement.execute("drop table if exists " + table);
                }
            }
            transaction.commit();
        } catch (final SQLException e) {
            throw new PersistenceException("Failed to wipe store", e);
        }
        LOGGER.warn()
                .setMessage("Wiped store")
                .log();
    }

    private void apply(final Connection connection, final Migration migration) throws SQLException {
        LOGGER.debug()
                .setMessage("Applying migration")
                .addData("migration", migration)
                .log();
        try (Statement statement = connection.createStatement()) {
            for (final String sql : migration.getStatements()) {
                statement.execute(sql);
            }
        }
    }

    private void writeVersion(final Connection connection, final String sql, final int version) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, version);
            statement.executeUpdate();
        }
    }

    private SchemaMigrationException failed(final int fromVersion, final int toVersion, final Exception cause) {
        LOGGER.error()
                .setMessage("Failed to upgrade store structure")
                .addData("fromVersion", fromVersion)
                .addData("toVersion", toVersion)
                .setThrowable(cause)
                .log();
        return new SchemaMigrationException(
                String.format("Failed to upgrade store structure; from=%d, to=%d", fromVersion, toVersion),
                cause);
    }

    private final io.ebean.Database _ebeanServer;
    private final ImmutableList<Migration> _migrations;

    private static final String VERSION_TABLE_QUERY =
            "select count(*) as table_count from information_schema.tables "
                    + "where lower(table_name) = 'schema_version' and lower(table_schema) = lower(current_schema)";
    private static final String VERSION_QUERY = "select current_version from schema_version";
    private static final String INSERT_VERSION = "insert into schema_version (current_version) values (?)";
    private static final String UPDATE_VERSION = "update schema_version set current_version = ?";
    private static final ImmutableList<String> TABLES = ImmutableList.of("series_data", "series", "schema_version");
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaManager.class);
}
