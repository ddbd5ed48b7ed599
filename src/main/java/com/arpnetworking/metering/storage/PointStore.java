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

import com.arpnetworking.metering.models.ebean.Series;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.ebean.DuplicateKeyException;
import io.ebean.Transaction;
import jakarta.persistence.PersistenceException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Stores points. At most one point exists per series and timestamp; writing
 * an existing key replaces its value and ingest time.
 *
 * @author Inscope Metrics
 */
public class PointStore {

    /**
     * Public constructor.
     *
     * @param database the database backing the points
     */
    @Inject
    public PointStore(final Database database) {
        _database = database;
    }

    /**
     * Insert or replace the point of a series at a timestamp.
     *
     * <p>Each attempt runs in its own transaction: update the existing row, or
     * insert when there is none. An insert that loses a race against a
     * concurrent writer of the same key is rolled back and the attempt is
     * repeated, at which point the update applies.</p>
     *
     * @param seriesId the series to write to
     * @param timestamp the timestamp of the point
     * @param value the value of the point
     * @return true if the point was stored; false if the value is not finite,
     * the series does not exist or the store failed
     */
    public boolean addValue(final long seriesId, final Instant timestamp, final double value) {
        if (!Double.isFinite(value)) {
            LOGGER.debug()
                    .setMessage("Point rejected; value is not finite")
                    .addData("seriesId", seriesId)
                    .addData("timestamp", timestamp)
                    .addData("value", value)
                    .log();
            return false;
        }
        if (!Series.exists(seriesId, _database)) {
            LOGGER.debug()
                    .setMessage("Point rejected; series does not exist")
                    .addData("seriesId", seriesId)
                    .addData("timestamp", timestamp)
                    .log();
            return false;
        }

        final OffsetDateTime stamp = OffsetDateTime.ofInstant(timestamp, ZoneOffset.UTC);
        int attempt = 0;
        while (true) {
            ++attempt;
            try (Transaction transaction = _database.getEbeanServer().beginTransaction()) {
                final Connection connection = transaction.connection();
                if (execute(connection, UPDATE_POINT, value, seriesId, stamp) == 0) {
                    execute(connection, INSERT_POINT, seriesId, stamp, value);
                }
                transaction.commit();
                return true;
            } catch (final SQLException | PersistenceException e) {
                if (isKeyConflict(e)) {
                    LOGGER.debug()
                            .setMessage("Concurrent insert of point; retrying")
                            .addData("seriesId", seriesId)
                            .addData("timestamp", timestamp)
                            .addData("attempt", attempt)
                            .log();
                    continue;
                }
                LOGGER.error()
                        .setMessage("Failed to store point")
                        .addData("seriesId", seriesId)
                        .addData("timestamp", timestamp)
                        .addData("value", value)
                        .setThrowable(e)
                        .log();
                return false;
            }
        }
    }

    /**
     * Whether a failure is a uniqueness conflict on the point key.
     *
     * @param throwable the failure
     * @return true if any cause is a unique violation
     */
    /* package private */ static boolean isKeyConflict(final Throwable throwable) {
        for (final Throwable cause : Throwables.getCausalChain(throwable)) {
            if (cause instanceof DuplicateKeyException) {
                return true;
            }
            if (cause instanceof SQLException && KEY_CONFLICT_STATES.contains(((SQLException) cause).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static int execute(final Connection connection, final String sql, final Object... parameters) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; ++i) {
                statement.setObject(i + 1, parameters[i]);
            }
            return statement.executeUpdate();
        }
    }

    private final Database _database;

    private static final String UPDATE_POINT =
            "update series_data set data_value = ?, ingest = current_timestamp where series_id = ? and stamp = ?";
    private static final String INSERT_POINT =
            "insert into series_data (series_id, stamp, ingest, data_value) values (?, ?, current_timestamp, ?)";
    // 23505 is the standard unique violation; 90131 is H2's concurrent update of the same row
    private static final ImmutableSet<String> KEY_CONFLICT_STATES = ImmutableSet.of("23505", "90131");
    private static final Logger LOGGER = LoggerFactory.getLogger(PointStore.class);
}
