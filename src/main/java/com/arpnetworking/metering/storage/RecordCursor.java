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

import com.arpnetworking.metering.utility.CloseableIterator;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.AbstractIterator;
import io.ebean.Transaction;
import jakarta.persistence.PersistenceException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Lazily maps the rows of a query to values. The cursor owns a read-only
 * transaction that is not bound to the calling thread, and releases it once
 * the rows are exhausted or the cursor is closed.
 *
 * @param <T> the type of value produced per row
 * @author Inscope Metrics
 */
/* package private */ final class RecordCursor<T> extends AbstractIterator<T> implements CloseableIterator<T> {

    /**
     * Execute a query and return a cursor over its rows.
     *
     * @param database the database to query
     * @param sql the query
     * @param parameters the positional parameters of the query
     * @param mapper maps the current row to a value
     * @param <T> the type of value produced per row
     * @return the open cursor
     */
    static <T> RecordCursor<T> open(
            final Database database,
            final String sql,
            final List<Object> parameters,
            final RowMapper<T> mapper) {
        final Transaction transaction = database.getEbeanServer().createTransaction();
        PreparedStatement statement = null;
        try {
            transaction.setReadOnly(true);
            statement = transaction.connection().prepareStatement(sql);
            statement.setFetchSize(database.getFetchSize());
            for (int i = 0; i < parameters.size(); ++i) {
                statement.setObject(i + 1, parameters.get(i));
            }
            final ResultSet resultSet = statement.executeQuery();
            return new RecordCursor<>(transaction, statement, resultSet, mapper);
        } catch (final SQLException e) {
            if (statement != null) {
                closeQuietly(statement);
            }
            transaction.close();
            throw new PersistenceException(String.format("Failed to open cursor; sql=%s", sql), e);
        }
    }

    /**
     * Append the time range predicates to a query on a {@code stamp} column.
     *
     * @param sql the query so far, ending in a where clause
     * @param parameters the parameters so far
     * @param from the inclusive lower bound
     * @param to the exclusive upper bound
     */
    static void appendRange(
            final StringBuilder sql,
            final List<Object> parameters,
            final Optional<Instant> from,
            final Optional<Instant> to) {
        if (from.isPresent()) {
            sql.append(" and stamp >= ?");
            parameters.add(OffsetDateTime.ofInstant(from.get(), ZoneOffset.UTC));
        }
        if (to.isPresent()) {
            sql.append(" and stamp < ?");
            parameters.add(OffsetDateTime.ofInstant(to.get(), ZoneOffset.UTC));
        }
    }

    /**
     * Read a {@code timestamp with time zone} column.
     *
     * @param resultSet the result set positioned on a row
     * @param column the column index
     * @return the instant
     * @throws SQLException if the column cannot be read
     */
    static Instant readInstant(final ResultSet resultSet, final int column) throws SQLException {
        return resultSet.getObject(column, OffsetDateTime.class).toInstant();
    }

    @Override
    protected T computeNext() {
        if (_closed) {
            return endOfData();
        }
        try {
            if (_resultSet.next()) {
                return _mapper.map(_resultSet);
            }
        } catch (final SQLException e) {
            close();
            throw new PersistenceException("Failed to read from cursor", e);
        }
        close();
        return endOfData();
    }

    @Override
    public void close() {
        if (_closed) {
            return;
        }
        _closed = true;
        closeQuietly(_resultSet);
        closeQuietly(_statement);
        _transaction.close();
    }

    private RecordCursor(
            final Transaction transaction,
            final PreparedStatement statement,
            final ResultSet resultSet,
            final RowMapper<T> mapper) {
        _transaction = transaction;
        _statement = statement;
        _resultSet = resultSet;
        _mapper = mapper;
    }

    private static void closeQuietly(final AutoCloseable closeable) {
        try {
            closeable.close();
            // CHECKSTYLE.OFF: IllegalCatch - AutoCloseable declares Exception
        } catch (final Exception e) {
            // CHECKSTYLE.ON: IllegalCatch
            LOGGER.warn()
                    .setMessage("Failed to release cursor resource")
                    .addData("resource", closeable)
                    .setThrowable(e)
                    .log();
        }
    }

    private boolean _closed;

    private final Transaction _transaction;
    private final PreparedStatement _statement;
    private final ResultSet _resultSet;
    private final RowMapper<T> _mapper;

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordCursor.class);

    /**
     * Maps the current row of a result set.
     *
     * @param <T> the type of value produced
     */
    @FunctionalInterface
    interface RowMapper<T> {
        /**
         * Map the current row.
         *
         * @param resultSet the result set positioned on a row
         * @return the value
         * @throws SQLException if a column cannot be read
         */
        T map(ResultSet resultSet) throws SQLException;
    }
}
