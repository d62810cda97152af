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
package com.samsung.sra.sensorwatch.prediction;

import com.samsung.sra.sensorwatch.ConfigException;
import com.samsung.sra.sensorwatch.DetectorConfig;
import org.junit.Test;

import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class RulEngineTest {
    private static final double DELTA = 1e-9;

    private static double[] line(int n, double start, double slope) {
        double[] ret = new double[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = start + slope * i;
        }
        return ret;
    }

    private static long[] seconds(int n) {
        long[] ret = new long[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = 1000L * i;
        }
        return ret;
    }

    @Test
    public void degradationModelNames() throws ConfigException {
        assertThat(DegradationModel.values().length, is(3));
        assertThat(DegradationModel.fromName("linear"), is(DegradationModel.LINEAR));
        assertThat(DegradationModel.fromName("Exponential"), is(DegradationModel.EXPONENTIAL));
        assertThat(DegradationModel.fromName("weibull"), is(DegradationModel.WEIBULL));
    }

    @Test
    public void preconditions() {
        assertThat(RulEngine.estimate(line(10, 10, 3), seconds(10), new DetectorConfig()), nullValue());
        assertThat(RulEngine.estimate(line(4, 10, 3), seconds(4), new DetectorConfig().setFailureThreshold(100d)),
                nullValue());
    }

    @Test
    public void linearDegradation() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d).setRulUnit(RulUnit.MINUTES);
        RulEstimate rul = RulEngine.estimate(line(15, 10, 3), seconds(15), config);
        // current 52, 48 to go at 3 per second
        assertEquals(16000, rul.getMillis(), 1e-6);
        assertEquals(16000 / 60000.0, rul.getValue(), 1e-9);
        assertThat(rul.getStatus(), is(RulStatus.WARNING));
        assertEquals(3, rul.getDegradationRate(), DELTA);
        assertThat(rul.getDegradationTrend(), is("increasing"));
        assertEquals(1, rul.getConfidence(), DELTA);
        assertEquals(42 / 90.0 * 100, rul.getDegradationPercent(), 1e-9);
        assertThat(rul.getModel(), is(DegradationModel.LINEAR));
    }

    @Test
    public void cyclesCountSampleIntervals() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d).setRulUnit(RulUnit.CYCLES);
        RulEstimate rul = RulEngine.estimate(line(15, 10, 3), seconds(15), config);
        assertEquals(16, rul.getValue(), 1e-9);
    }

    @Test
    public void failedAndStable() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d);
        RulEstimate failed = RulEngine.estimate(line(6, 80, 5), seconds(6), config);
        assertThat(failed.getStatus(), is(RulStatus.FAILED));
        assertEquals(0, failed.getValue(), 0);
        assertEquals(100, failed.getDegradationPercent(), 0);

        RulEstimate stable = RulEngine.estimate(line(6, 50, -1), seconds(6), config);
        assertThat(stable.getStatus(), is(RulStatus.STABLE));
        assertTrue(Double.isInfinite(stable.getValue()));
    }

    @Test
    public void coincidentTimestampsAssumeOneSecond() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d).setRulUnit(RulUnit.CYCLES);
        RulEstimate rul = RulEngine.estimate(line(6, 10, 3), new long[6], config);
        assertEquals((100 - 25) / 3.0, rul.getValue(), 1e-9);
    }

    @Test
    public void weibullFit() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d)
                .setDegradationModel(DegradationModel.WEIBULL);
        RulEstimate rul = RulEngine.estimate(line(15, 10, 3), seconds(15), config);
        assertThat(rul.getModel(), is(DegradationModel.WEIBULL));
        WeibullFit fit = rul.getWeibull();
        assertThat(fit, notNullValue());
        assertTrue(fit.getBeta() >= RulEngine.MIN_BETA && fit.getBeta() <= RulEngine.MAX_BETA);
        assertEquals(1 - 42 / 90.0, fit.getCurrentReliability(), 1e-9);
        assertTrue(rul.getMillis() > 0 && !Double.isInfinite(rul.getMillis()));
        assertTrue(rul.getLower() <= rul.getValue() && rul.getValue() <= rul.getUpper());
        assertEquals(RulEngine.FAILURE_RELIABILITY, fit.reliability(fit.getElapsed() + rul.getMillis()), 1e-9);
        assertThat(fit.getFailureMode(), is("wear-out"));
        Map<String, Object> map = rul.toMap();
        assertThat(map.get("weibull"), notNullValue());
    }

    @Test
    public void degenerateWeibullFallsBackToLinear() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d)
                .setDegradationModel(DegradationModel.WEIBULL);
        // all timestamps equal: no elapsed time to fit a scale against
        RulEstimate rul = RulEngine.estimate(line(6, 10, 3), new long[6], config);
        assertThat(rul.getModel(), is(DegradationModel.LINEAR));
        assertThat(rul.getWeibull(), nullValue());
    }

    @Test
    public void rulDecreasesOnIncreasingStream() {
        DetectorConfig config = new DetectorConfig().setFailureThreshold(100d);
        int window = 20;
        double previous = Double.POSITIVE_INFINITY;
        for (int n = 5; n <= 25; ++n) {
            double[] values = line(n, 10, 3);
            long[] ts = seconds(n);
            int from = Math.max(0, n - window);
            RulEstimate rul = RulEngine.estimate(Arrays.copyOfRange(values, from, n), Arrays.copyOfRange(ts, from, n),
                    config);
            assertTrue(rul.getMillis() < previous);
            previous = rul.getMillis();
        }
    }

    @Test
    public void statusBands() {
        assertThat(RulEngine.status(9.9), is(RulStatus.CRITICAL));
        assertThat(RulEngine.status(10), is(RulStatus.WARNING));
        assertThat(RulEngine.status(50), is(RulStatus.HEALTHY));
    }
}
