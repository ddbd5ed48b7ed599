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
 * Base class for rejected requests. Raised before any mutation of the store.
 *
 * @author Inscope Metrics
 */
public class ValidationException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param message the description of the rejected input
     */
    public ValidationException(final String message) {
        super(message);
    }

    private static final long serialVersionUID = 4122374316410527733L;
}
