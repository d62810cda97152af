/*
* Copyright 2016 Samsung Research America. All rights reserved.
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
package com.samsung.sra.sensorwatch.health;

import com.samsung.sra.sensorwatch.DetectorConfig;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class HealthIndexAggregatorTest {
    private static final double DELTA = 1e-9;

    private static SensorReading healthy() {
        return new SensorReading("pump").setZScore(0.4).setDeviationPercent(2d);
    }

    private static SensorReading faulty() {
        return new SensorReading("motor").setAnomaly(true).setZScore(3.5);
    }

    @Test
    public void deductionsAndConfidenceRefund() {
        List<ContributingFactor> factors = new ArrayList<>();
        assertEquals(100, HealthIndexAggregator.score(healthy(), factors), DELTA);
        assertThat(factors.isEmpty(), is(true));

        assertEquals(30, HealthIndexAggregator.score(faulty(), factors), DELTA);
        assertThat(factors.size(), is(2));

        SensorReading r = faulty().setDeviationPercent(-20d).setTrend("increasing", 0.3).setConfidence(0.25);
        // 95 points deducted, a quarter of them refunded
        assertEquals(100 - 95 + 23.75, HealthIndexAggregator.score(r, new ArrayList<>()), DELTA);

        SensorReading wrecked = faulty().setDeviationPercent(80d).setTrend("increasing", 1d);
        assertEquals(0, HealthIndexAggregator.score(wrecked, new ArrayList<>()), DELTA);
    }

    @Test
    public void weightedUsesConfiguredWeightsWithDefaultOne() {
        DetectorConfig config = new DetectorConfig().setSensorWeight("pump", 3);
        HealthReport report = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), faulty()), config);
        assertEquals(82.5, report.getIndex(), DELTA);
        assertThat(report.getStatus(), is(HealthStatus.HEALTHY));
        assertThat(report.getWorstSensor().getLeft(), is("motor"));
        assertEquals(30, report.getWorstSensor().getRight(), DELTA);
        assertThat(report.getDynamicWeights(), nullValue());
    }

    @Test
    public void zeroWeightCountsAsDefault() {
        DetectorConfig config = new DetectorConfig().setSensorWeight("motor", 0);
        HealthReport report = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), faulty()), config);
        assertEquals(65, report.getIndex(), DELTA);
        assertEquals(1, HealthIndexAggregator.configuredWeight(config.getSensorWeights(), "motor"), DELTA);
        assertEquals(1, HealthIndexAggregator.configuredWeight(config.getSensorWeights(), "pump"), DELTA);

        HealthReport dynamic = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), faulty()),
                new DetectorConfig(config).setAggregationMethod(AggregationMethod.DYNAMIC));
        assertEquals(1, dynamic.getDynamicWeights().get("motor"), DELTA);
    }

    @Test
    public void otherAggregations() {
        List<SensorReading> readings = Arrays.asList(healthy(), faulty());
        assertEquals(30, HealthIndexAggregator.aggregate(readings,
                new DetectorConfig().setAggregationMethod(AggregationMethod.MINIMUM)).getIndex(), DELTA);
        assertEquals(65, HealthIndexAggregator.aggregate(readings,
                new DetectorConfig().setAggregationMethod(AggregationMethod.AVERAGE)).getIndex(), DELTA);
        assertEquals(Math.sqrt(3000), HealthIndexAggregator.aggregate(readings,
                new DetectorConfig().setAggregationMethod(AggregationMethod.GEOMETRIC)).getIndex(), 1e-9);
    }

    @Test
    public void dynamicWeightsFollowReliability() {
        SensorReading noisy = faulty().setAnomalyRate(0.65).setCoefficientOfVariation(0.8);
        assertEquals(0.35, HealthIndexAggregator.reliabilityFactor(noisy), DELTA);
        assertEquals(1, HealthIndexAggregator.reliabilityFactor(healthy()), DELTA);
        assertEquals(0.1, HealthIndexAggregator.reliabilityFactor(healthy().setConfidence(0.01)), DELTA);

        HealthReport report = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), noisy),
                new DetectorConfig().setAggregationMethod(AggregationMethod.DYNAMIC));
        assertThat(report.getDynamicWeights(), notNullValue());
        assertEquals(0.35, report.getDynamicWeights().get("motor"), DELTA);
        assertEquals((100 + 30 * 0.35) / 1.35, report.getIndex(), DELTA);
    }

    @Test
    public void noWorstSensorWhenAllHealthy() {
        HealthReport report = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), new SensorReading("fan")),
                new DetectorConfig());
        assertEquals(100, report.getIndex(), DELTA);
        assertThat(report.getWorstSensor(), nullValue());
    }

    @Test
    public void unitScale() {
        HealthReport report = HealthIndexAggregator.aggregate(Arrays.asList(healthy(), faulty()),
                new DetectorConfig().setAggregationMethod(AggregationMethod.MINIMUM).setOutputScale(OutputScale.UNIT));
        assertEquals(0.3, report.getScaledIndex(), DELTA);
        assertThat(report.getStatus(), is(HealthStatus.DEGRADED));
    }

    @Test
    public void statusBands() {
        assertThat(HealthStatus.of(80), is(HealthStatus.HEALTHY));
        assertThat(HealthStatus.of(79.9), is(HealthStatus.ATTENTION));
        assertThat(HealthStatus.of(40), is(HealthStatus.WARNING));
        assertThat(HealthStatus.of(20), is(HealthStatus.DEGRADED));
        assertThat(HealthStatus.of(19.9), is(HealthStatus.CRITICAL));
    }

    @Test
    public void healthTrend() {
        HealthTrendTracker tracker = new HealthTrendTracker();
        assertThat(tracker.record(100), is("stable"));
        assertThat(tracker.record(98), is("stable"));
        assertThat(tracker.record(96), is("degrading"));
        for (int i = 0; i < 20; ++i) {
            tracker.record(50 + 2 * i);
        }
        assertThat(tracker.size(), is(HealthTrendTracker.HISTORY));
        assertThat(tracker.getTrend(), is("improving"));
        tracker.reset();
        assertThat(tracker.getTrend(), is("stable"));
    }
}
