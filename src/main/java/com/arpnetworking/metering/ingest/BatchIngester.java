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
package com.arpnetworking.metering.ingest;

import com.arpnetworking.metering.MeteringStore;
import com.arpnetworking.metering.storage.SeriesNotFoundException;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Stores a batch of points for one series. The batch is a JSON array of
 * {@code [timestamp, value]} pairs where the timestamp is an ISO-8601 local
 * date-time followed by an offset such as {@code Z}, {@code +01:00} or
 * {@code +0100}. Entries that cannot be stored are reported and the rest of
 * the batch is stored.
 *
 * @author Inscope Metrics
 */
public final class BatchIngester {

    /**
     * Public constructor.
     *
     * @param store the store to write to
     */
    @Inject
    public BatchIngester(final MeteringStore store) {
        _store = store;
    }

    /**
     * Store a batch of points.
     *
     * @param seriesId the series to write to
     * @param batch the JSON array of {@code [timestamp, value]} pairs
     * @return the number of stored entries and the rejected ones
     * @throws IllegalArgumentException if the batch is not a JSON array
     * @throws SeriesNotFoundException if the series does not exist
     */
    public IngestResult ingest(final long seriesId, final JsonNode batch) {
        if (!batch.isArray()) {
            throw new IllegalArgumentException(
                    String.format("Batch must be an array of [timestamp, value] pairs; type=%s", batch.getNodeType()));
        }
        if (!_store.isSeries(seriesId)) {
            throw new SeriesNotFoundException(seriesId);
        }

        int accepted = 0;
        final ImmutableList.Builder<RejectedPoint> rejected = ImmutableList.builder();
        for (int i = 0; i < batch.size(); ++i) {
            final JsonNode entry = batch.get(i);
            final Optional<String> reason = store(seriesId, entry);
            if (reason.isPresent()) {
                rejected.add(new RejectedPoint(i, entry.toString(), reason.get()));
            } else {
                ++accepted;
            }
        }

        final IngestResult result = new IngestResult(accepted, rejected.build());
        LOGGER.debug()
                .setMessage("Ingested batch")
                .addData("seriesId", seriesId)
                .addData("accepted", result.getAccepted())
                .addData("rejected", result.getRejected().size())
                .log();
        return result;
    }

    /**
     * Parse a timestamp with a mandatory offset.
     *
     * @param text the timestamp, e.g. {@code 2024-05-01T12:00:00+0100}
     * @return the instant
     * @throws DateTimeException if the text is not a timestamp with an offset
     */
    public static Instant parseTimestamp(final String text) {
        try {
            return EXTENDED_OFFSET_FORMATTER.parse(text, OffsetDateTime::from).toInstant();
        } catch (final DateTimeParseException e) {
            return BASIC_OFFSET_FORMATTER.parse(text, OffsetDateTime::from).toInstant();
        }
    }

    private Optional<String> store(final long seriesId, final JsonNode entry) {
        if (!entry.isArray() || entry.size() != 2) {
            return Optional.of("entry is not a [timestamp, value] pair");
        }
        final JsonNode timestampNode = entry.get(0);
        final JsonNode valueNode = entry.get(1);
        if (!timestampNode.isTextual()) {
            return Optional.of("timestamp is not a string");
        }
        final Instant timestamp;
        try {
            timestamp = parseTimestamp(timestampNode.textValue());
        } catch (final DateTimeException e) {
            return Optional.of("timestamp is malformed");
        }
        if (!valueNode.isNumber()) {
            return Optional.of("value is not a number");
        }
        if (!_store.addValue(seriesId, timestamp, valueNode.doubleValue())) {
            return Optional.of("value was not stored");
        }
        return Optional.empty();
    }

    private final MeteringStore _store;

    private static final DateTimeFormatter EXTENDED_OFFSET_FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();
    private static final DateTimeFormatter BASIC_OFFSET_FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHMM", "Z")
            .toFormatter();
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchIngester.class);
}
