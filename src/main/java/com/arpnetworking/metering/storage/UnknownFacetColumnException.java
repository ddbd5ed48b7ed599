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
 * Thrown when a facet summary is requested over a column that is not one of
 * the summarizable columns.
 *
 * @author Inscope Metrics
 */
public final class UnknownFacetColumnException extends ValidationException {

    /**
     * Public constructor.
     *
     * @param column the requested column name
     */
    public UnknownFacetColumnException(final String column) {
        super(String.format("Unknown facet column; column=%s", column));
        _column = column;
    }

    public String getColumn() {
        return _column;
    }

    private final String _column;

    private static final long serialVersionUID = 6690419730351528844L;
}
