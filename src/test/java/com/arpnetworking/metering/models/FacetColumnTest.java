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
package com.arpnetworking.metering.models;

import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

/**
 * Tests for {@link FacetColumn}.
 *
 * @author Inscope Metrics
 */
public class FacetColumnTest {

    @Test
    public void resolvesPublicNames() {
        Assert.assertEquals(Optional.of(FacetColumn.PERIOD), FacetColumn.tryFromName("period"));
        Assert.assertEquals(Optional.of(FacetColumn.UNITS), FacetColumn.tryFromName("units"));
        Assert.assertEquals(Optional.of(FacetColumn.TS_TYPE), FacetColumn.tryFromName("ts_type"));
    }

    @Test
    public void rejectsOtherNames() {
        Assert.assertFalse(FacetColumn.tryFromName("unit").isPresent());
        Assert.assertFalse(FacetColumn.tryFromName("PERIOD").isPresent());
        Assert.assertFalse(FacetColumn.tryFromName("period_seconds").isPresent());
        Assert.assertFalse(FacetColumn.tryFromName("").isPresent());
    }

    @Test
    public void rendersPeriodAsDuration() {
        Assert.assertEquals("PT5M", FacetColumn.PERIOD.render(300L));
        Assert.assertEquals("PT24H", FacetColumn.PERIOD.render(86400));
    }

    @Test
    public void rendersOtherColumnsVerbatim() {
        Assert.assertEquals("kWh", FacetColumn.UNITS.render("kWh"));
        Assert.assertEquals("mean", FacetColumn.TS_TYPE.render("mean"));
    }
}
