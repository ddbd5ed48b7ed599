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
package com.arpnetworking.metering.configuration;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import net.sf.oval.exception.ConstraintsViolatedException;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Reads a {@link MeteringConfiguration} from a HOCON or JSON file.
 *
 * @author Inscope Metrics
 */
public final class ConfigurationLoader {

    /**
     * Load the configuration from a file. Files ending in {@code .conf} are
     * parsed as HOCON with substitutions resolved; all others as JSON.
     *
     * @param file the configuration file
     * @return the validated configuration
     * @throws IllegalArgumentException if the file cannot be read or is invalid
     */
    public static MeteringConfiguration load(final File file) {
        LOGGER.debug()
                .setMessage("Loading configuration from file")
                .addData("file", file)
                .log();
        try {
            return OBJECT_MAPPER.treeToValue(readTree(file), MeteringConfiguration.class);
        } catch (final IOException | ConfigException | ConstraintsViolatedException e) {
            throw new IllegalArgumentException(String.format("Invalid configuration; file=%s", file), e);
        }
    }

    private static JsonNode readTree(final File file) throws IOException {
        if (file.getName().toLowerCase(Locale.ROOT).endsWith(HOCON_FILE_EXTENSION)) {
            final String json = ConfigFactory.parseFile(file)
                    .resolve()
                    .root()
                    .render(ConfigRenderOptions.concise());
            return OBJECT_MAPPER.readTree(json);
        }
        return OBJECT_MAPPER.readTree(file);
    }

    private ConfigurationLoader() {}

    private static final String HOCON_FILE_EXTENSION = ".conf";
    private static final ObjectMapper OBJECT_MAPPER = MeteringConfiguration.createObjectMapper();
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);
}
