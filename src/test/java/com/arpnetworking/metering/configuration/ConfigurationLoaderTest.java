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

import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Tests for the {@link ConfigurationLoader}.
 *
 * @author Inscope Metrics
 */
public class ConfigurationLoaderTest {

    @Test
    public void loadsHocon() throws URISyntaxException {
        final MeteringConfiguration configuration = ConfigurationLoader.load(resource("metering-test.conf"));
        final DatabaseConfiguration database = configuration.getDatabase();
        Assert.assertEquals("jdbc:h2:mem:config-test", database.getJdbcUrl());
        Assert.assertEquals("org.h2.Driver", database.getDriverName());
        Assert.assertEquals("sa", database.getUsername());
        Assert.assertEquals("", database.getPassword());
        Assert.assertEquals(4, database.getMaximumPoolSize());
        Assert.assertEquals(4, database.getMinimumIdle());
        Assert.assertEquals(250, database.getFetchSize());
        Assert.assertEquals(Duration.ofSeconds(30), configuration.getShutdownTimeout());
    }

    @Test
    public void loadsJsonWithDefaults() throws URISyntaxException {
        final MeteringConfiguration configuration = ConfigurationLoader.load(resource("metering-test.json"));
        final DatabaseConfiguration database = configuration.getDatabase();
        Assert.assertEquals("secret", database.getPassword());
        Assert.assertEquals(10, database.getMaximumPoolSize());
        Assert.assertEquals(1000, database.getFetchSize());
        Assert.assertEquals(Duration.ofSeconds(30), database.getConnectionTimeout());
        Assert.assertEquals(Duration.ofMinutes(1), configuration.getShutdownTimeout());
    }

    @Test
    public void passwordIsNotRendered() throws URISyntaxException {
        final MeteringConfiguration configuration = ConfigurationLoader.load(resource("metering-test.json"));
        MatcherAssert.assertThat(configuration.toString(), Matchers.not(Matchers.containsString("secret")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingRequiredValueIsRejected() throws URISyntaxException {
        ConfigurationLoader.load(resource("metering-invalid.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingFileIsRejected() {
        ConfigurationLoader.load(new File("does-not-exist.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingHoconFileIsRejected() {
        ConfigurationLoader.load(new File("does-not-exist.conf"));
    }

    private static File resource(final String name) throws URISyntaxException {
        return new File(ConfigurationLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
