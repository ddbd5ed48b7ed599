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

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.metering.MeteringStore;
import com.arpnetworking.metering.storage.SeriesNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Tests for the {@link BatchIngester}.
 *
 * @author Inscope Metrics
 */
public class BatchIngesterTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
        Mockito.when(_store.isSeries(SERIES_ID)).thenReturn(true);
        Mockito.when(_store.addValue(Mockito.eq(SERIES_ID), Mockito.any(Instant.class), Mockito.anyDouble()))
                .thenReturn(true);
        _ingester = new BatchIngester(_store);
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void storesEveryValidEntry() throws IOException {
        final IngestResult result = _ingester.ingest(
                SERIES_ID,
                parse("[[\"2024-05-01T12:00:00Z\", 1.5], [\"2024-05-01T12:01:00Z\", 2]]"));
        Assert.assertTrue(result.isComplete());
        Assert.assertEquals(2, result.getAccepted());
        Mockito.verify(_store).addValue(SERIES_ID, Instant.parse("2024-05-01T12:00:00Z"), 1.5);
        Mockito.verify(_store).addValue(SERIES_ID, Instant.parse("2024-05-01T12:01:00Z"), 2.0);
    }

    @Test
    public void reportsInvalidEntriesAndStoresTheRest() throws IOException {
        final IngestResult result = _ingester.ingest(
                SERIES_ID,
                parse("["
                        + "[\"2024-05-01T12:00:00Z\", 1.0],"
                        + "[\"2024-05-01T12:01:00Z\", \"high\"],"
                        + "[\"yesterday\", 3.0],"
                        + "[\"2024-05-01T12:03:00Z\"],"
                        + "[1714564980, 5.0],"
                        + "{\"timestamp\": \"2024-05-01T12:05:00Z\"},"
                        + "[\"2024-05-01T12:06:00\", 7.0],"
                        + "[\"2024-05-01T12:07:00+0100\", 8.0]"
                        + "]"));

        Assert.assertFalse(result.isComplete());
        Assert.assertEquals(2, result.getAccepted());
        Assert.assertEquals(6, result.getRejected().size());
        Assert.assertEquals(1, result.getRejected().get(0).getIndex());
        Assert.assertEquals("value is not a number", result.getRejected().get(0).getReason());
        Assert.assertEquals(2, result.getRejected().get(1).getIndex());
        Assert.assertEquals("timestamp is malformed", result.getRejected().get(1).getReason());
        Assert.assertEquals(3, result.getRejected().get(2).getIndex());
        Assert.assertEquals(4, result.getRejected().get(3).getIndex());
        Assert.assertEquals("timestamp is not a string", result.getRejected().get(3).getReason());
        Assert.assertEquals(5, result.getRejected().get(4).getIndex());
        Assert.assertEquals(6, result.getRejected().get(5).getIndex());
        Assert.assertEquals("[\"yesterday\",3.0]", result.getRejected().get(1).getEntry());

        Mockito.verify(_store).addValue(SERIES_ID, Instant.parse("2024-05-01T12:00:00Z"), 1.0);
        Mockito.verify(_store).addValue(SERIES_ID, Instant.parse("2024-05-01T11:07:00Z"), 8.0);
        Mockito.verify(_store, Mockito.times(2))
                .addValue(Mockito.eq(SERIES_ID), Mockito.any(Instant.class), Mockito.anyDouble());
    }

    @Test
    public void reportsEntriesTheStoreRefuses() throws IOException {
        Mockito.when(_store.addValue(SERIES_ID, Instant.parse("2024-05-01T12:00:00Z"), 1.0)).thenReturn(false);
        final IngestResult result = _ingester.ingest(
                SERIES_ID,
                parse("[[\"2024-05-01T12:00:00Z\", 1.0], [\"2024-05-01T12:01:00Z\", 2.0]]"));
        Assert.assertEquals(1, result.getAccepted());
        Assert.assertEquals(1, result.getRejected().size());
        Assert.assertEquals(0, result.getRejected().get(0).getIndex());
        Assert.assertEquals("value was not stored", result.getRejected().get(0).getReason());
    }

    @Test
    public void emptyBatchIsComplete() throws IOException {
        final IngestResult result = _ingester.ingest(SERIES_ID, parse("[]"));
        Assert.assertTrue(result.isComplete());
        Assert.assertEquals(0, result.getAccepted());
    }

    @Test
    public void unknownSeriesFailsWholeBatch() throws IOException {
        try {
            _ingester.ingest(UNKNOWN_SERIES_ID, parse("[[\"2024-05-01T12:00:00Z\", 1.0]]"));
            Assert.fail("Expected exception not thrown");
        } catch (final SeriesNotFoundException e) {
            Assert.assertEquals(UNKNOWN_SERIES_ID, e.getSeriesId());
        }
        Mockito.verify(_store, Mockito.never())
                .addValue(Mockito.anyLong(), Mockito.any(Instant.class), Mockito.anyDouble());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonArrayBatchIsRejected() throws IOException {
        _ingester.ingest(SERIES_ID, parse("{\"2024-05-01T12:00:00Z\": 1.0}"));
    }

    @Test
    public void parsesSupportedOffsets() {
        final Instant expected = Instant.parse("2024-05-01T11:00:00Z");
        Assert.assertEquals(expected, BatchIngester.parseTimestamp("2024-05-01T11:00:00Z"));
        Assert.assertEquals(expected, BatchIngester.parseTimestamp("2024-05-01T12:00:00+01:00"));
        Assert.assertEquals(expected, BatchIngester.parseTimestamp("2024-05-01T12:00:00+0100"));
        Assert.assertEquals(expected, BatchIngester.parseTimestamp("2024-05-01T06:30:00-0430"));
        Assert.assertEquals(
                Instant.parse("2024-05-01T11:00:00.250Z"),
                BatchIngester.parseTimestamp("2024-05-01T11:00:00.250Z"));
    }

    @Test(expected = DateTimeException.class)
    public void timestampWithoutOffsetIsRejected() {
        BatchIngester.parseTimestamp("2024-05-01T11:00:00");
    }

    @Test(expected = DateTimeException.class)
    public void timestampWithTwoOffsetsIsRejected() {
        BatchIngester.parseTimestamp("2024-01-01T00:00:00+01:00+0100");
    }

    @Test(expected = DateTimeException.class)
    public void timestampWithOffsetFollowedByZuluIsRejected() {
        BatchIngester.parseTimestamp("2024-01-01T00:00:00+0100Z");
    }

    private static JsonNode parse(final String json) throws IOException {
        return OBJECT_MAPPER.readTree(json);
    }

    @Mock
    private MeteringStore _store;
    private BatchIngester _ingester;
    private AutoCloseable _openMocks;

    private static final long SERIES_ID = 42L;
    private static final long UNKNOWN_SERIES_ID = 43L;
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
}
