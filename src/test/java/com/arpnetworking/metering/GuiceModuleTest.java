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

import com.arpnetworking.metering.configuration.MeteringConfiguration;
import com.arpnetworking.metering.ingest.BatchIngester;
import com.arpnetworking.metering.storage.Database;
import com.arpnetworking.metering.storage.SeriesRegistry;
import com.arpnetworking.test.H2Databases;
import com.arpnetworking.test.TestBeanFactory;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link GuiceModule}.
 *
 * @author Inscope Metrics
 */
public class GuiceModuleTest {

    @Test
    public void bindsStoreOverSingleDatabase() {
        final MeteringConfiguration configuration = new MeteringConfiguration.Builder()
                .setDatabase(TestBeanFactory.createDatabaseConfiguration())
                .build();
        final Injector injector = Guice.createInjector(new GuiceModule(configuration));

        final Database database = injector.getInstance(Database.class);
        Assert.assertSame(database, injector.getInstance(Database.class));
        Assert.assertSame(configuration, injector.getInstance(MeteringConfiguration.class));
        Assert.assertSame(injector.getInstance(SeriesRegistry.class), injector.getInstance(SeriesRegistry.class));

        database.launch();
        try {
            final MeteringStore store = injector.getInstance(MeteringStore.class);
            MatcherAssert.assertThat(store, Matchers.instanceOf(DatabaseMeteringStore.class));
            Assert.assertSame(store, injector.getInstance(MeteringStore.class));
            Assert.assertNotNull(injector.getInstance(BatchIngester.class));

            final long id = store.createSeries(TestBeanFactory.createSeriesDefinition()).get();
            Assert.assertTrue(store.isSeries(id));
        } finally {
            H2Databases.release(database);
        }
    }
}
