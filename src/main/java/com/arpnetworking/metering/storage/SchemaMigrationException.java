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
 * Thrown when the store structure cannot be brought to the version this code
 * requires. The recorded version is left at the last completed step.
 *
 * @author Inscope Metrics
 */
public final class SchemaMigrationException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param message the description of the failure
     */
    public SchemaMigrationException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message the description of the failure
     * @param cause the store error
     */
    public SchemaMigrationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = -5263712480431107120L;
}
