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
package com.arpnetworking.metering;

import com.arpnetworking.metering.configuration.DatabaseConfiguration;
import com.arpnetworking.metering.configuration.MeteringConfiguration;
import com.arpnetworking.metering.ingest.BatchIngester;
import com.arpnetworking.metering.storage.CrosstabEngine;
import com.arpnetworking.metering.storage.Database;
import com.arpnetworking.metering.storage.PointStore;
import com.arpnetworking.metering.storage.SeriesRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

/**
 * The Guice module for the metering store.
 *
 * @author Inscope Metrics
 */
public final class GuiceModule extends AbstractModule {

    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public GuiceModule(final MeteringConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(MeteringConfiguration.class).toInstance(_configuration);

        bind(Database.class)
                .toProvider(new DatabaseProvider(DATABASE_NAME, _configuration.getDatabase()))
                .in(Singleton.class);

        bind(SeriesRegistry.class).in(Singleton.class);
        bind(PointStore.class).in(Singleton.class);
        bind(CrosstabEngine.class).in(Singleton.class);
        bind(MeteringStore.class).to(DatabaseMeteringStore.class).in(Singleton.class);
        bind(BatchIngester.class).in(Singleton.class);
    }

    private final MeteringConfiguration _configuration;

    private static final String DATABASE_NAME = "metering";

    private static final class DatabaseProvider implements com.google.inject.Provider<Database> {

        private DatabaseProvider(final String name, final DatabaseConfiguration configuration) {
            _name = name;
            _configuration = configuration;
        }

        @Override
        public Database get() {
            return new Database(_name, _configuration);
        }

        private final String _name;
        private final DatabaseConfiguration _configuration;
    }
}
