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

/**
 * Thrown when a request names a series id that is not registered.
 *
 * @author Inscope Metrics
 */
public final class SeriesNotFoundException extends ValidationException {

    /**
     * Public constructor.
     *
     * @param seriesId the unknown series id
     */
    public SeriesNotFoundException(final long seriesId) {
        super(String.format("Series not found; id=%d", seriesId));
        _seriesId = seriesId;
    }

    public long getSeriesId() {
        return _seriesId;
    }

    private final long _seriesId;

    private static final long serialVersionUID = -2793056125012187384L;
}
