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
package com.samsung.sra.sensorwatch.estimators;

import com.samsung.sra.sensorwatch.ConfigException;
import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.numeric.Numerics;
import org.junit.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class UnivariateEstimatorsTest {
    private static final double DELTA = 1e-9;

    @Test
    public void zScore() {
        double[] window = {10, 10, 10, 10, 10, 10, 10, 10, 10, 20};
        Verdict v = new ZScoreEstimator().ingest(20, window, new DetectorConfig());
        assertEquals(3, v.getDetail("zScore"), DELTA);
        assertEquals(Numerics.mean(window), v.getDetail("mean"), DELTA);
        assertEquals(Numerics.stdDev(window), v.getDetail("stdDev"), DELTA);
        assertThat(v.getSeverity(), is(Severity.WARNING));
        assertTrue(v.isAnomaly());

        v = new ZScoreEstimator().ingest(20, window, new DetectorConfig().setZscoreThreshold(2.5));
        assertThat(v.getSeverity(), is(Severity.CRITICAL));
    }

    @Test
    public void zScoreOfConstantWindowIsZero() {
        Verdict v = new ZScoreEstimator().ingest(5, new double[]{5, 5, 5}, new DetectorConfig());
        assertEquals(0, v.getDetail("zScore"), DELTA);
        assertThat(v.getSeverity(), is(Severity.NORMAL));
        assertFalse(v.isNumericFault());
    }

    @Test
    public void iqrBounds() {
        DetectorConfig config = new DetectorConfig();
        Verdict critical = new IqrEstimator().ingest(30, new double[]{1, 2, 3, 4, 5, 6, 7, 30}, config);
        assertEquals(3, critical.getDetail("q1"), DELTA);
        assertEquals(7, critical.getDetail("q3"), DELTA);
        assertEquals(13, critical.getDetail("upperBound"), DELTA);
        assertThat(critical.getSeverity(), is(Severity.CRITICAL));

        Verdict warning = new IqrEstimator().ingest(12, new double[]{1, 2, 3, 4, 5, 6, 7, 12}, config);
        assertThat(warning.getSeverity(), is(Severity.WARNING));
        assertThat(new IqrEstimator().getMinSamples(config), is(4));
    }

    @Test
    public void thresholdReasons() {
        DetectorConfig config = new DetectorConfig().setMinThreshold(10d).setMaxThreshold(100d);
        ThresholdEstimator estimator = new ThresholdEstimator();

        Verdict above = estimator.ingest(150, new double[]{150}, config);
        assertThat(above.getSeverity(), is(Severity.CRITICAL));
        assertThat(above.getReason(), containsString("Above maximum"));

        Verdict below = estimator.ingest(5, new double[]{5}, config);
        assertThat(below.getReason(), containsString("Below minimum"));

        Verdict approaching = estimator.ingest(95, new double[]{95}, config);
        assertThat(approaching.getSeverity(), is(Severity.WARNING));
        assertThat(approaching.getReason(), is("Approaching maximum"));
        assertEquals(90, approaching.getDetail("maxWarning"), DELTA);

        Verdict ok = estimator.ingest(50, new double[]{50}, config);
        assertThat(ok.getSeverity(), is(Severity.NORMAL));
        assertThat(ok.getReason(), nullValue());
    }

    @Test
    public void overlappingBandsJoinReasons() {
        DetectorConfig config = new DetectorConfig().setMinThreshold(10d).setMaxThreshold(11d).setWarningMargin(50);
        ThresholdEstimator estimator = new ThresholdEstimator();

        Verdict above = estimator.ingest(12, new double[]{12}, config);
        assertThat(above.getSeverity(), is(Severity.CRITICAL));
        assertThat(above.getReason(), is("Approaching minimum AND above maximum"));

        Verdict both = estimator.ingest(10.5, new double[]{10.5}, config);
        assertThat(both.getSeverity(), is(Severity.WARNING));
        assertThat(both.getReason(), is("Approaching minimum AND approaching maximum"));
    }

    @Test
    public void percentileHasNoWarning() {
        double[] window = new double[100];
        for (int i = 0; i < 100; ++i) {
            window[i] = i + 1;
        }
        DetectorConfig config = new DetectorConfig();
        Verdict v = new PercentileEstimator().ingest(100, window, config);
        assertEquals(95.05, v.getDetail("upperBound"), 1e-9);
        assertThat(v.getSeverity(), is(Severity.CRITICAL));
        assertThat(new PercentileEstimator().ingest(50, window, config).getSeverity(), is(Severity.NORMAL));
    }

    @Test
    public void emaInitializesThenTracks() {
        DetectorConfig config = new DetectorConfig();
        EmaEstimator ema = new EmaEstimator();
        Verdict first = ema.ingest(10, new double[]{10}, config);
        assertThat(first.getStatusText(), is("initializing"));
        assertThat(first.getSeverity(), is(Severity.NORMAL));
        ema.ingest(10, new double[]{10, 10}, config);
        ema.ingest(10, new double[]{10, 10, 10}, config);
        ema.ingest(10, new double[]{10, 10, 10, 10}, config);

        Verdict v = ema.ingest(20, new double[]{10, 10, 10, 10, 20}, config);
        assertEquals(13, v.getDetail("ema"), DELTA);
        assertEquals(1.75, v.getDetail("deviationFactor"), DELTA);
        assertThat(v.getSeverity(), is(Severity.WARNING));
    }

    @Test
    public void emaStateSurvivesCopy() {
        DetectorConfig config = new DetectorConfig();
        EmaEstimator a = new EmaEstimator();
        a.ingest(10, new double[]{10}, config);
        a.ingest(12, new double[]{10, 12}, config);

        EmaEstimator b = new EmaEstimator();
        b.setState(a.getState());
        double[] window = {10, 12, 15};
        assertEquals(a.ingest(15, window, config).getDetail("ema"), b.ingest(15, window, config).getDetail("ema"), 0);

        a.reset();
        assertThat(a.ingest(1, new double[]{1}, config).getStatusText(), is("initializing"));
    }

    @Test
    public void cusumResetsOnCritical() {
        DetectorConfig config = new DetectorConfig().setCusumTarget(0d);
        CusumEstimator cusum = new CusumEstimator();
        double[] window = {2};
        assertEquals(1.5, cusum.ingest(2, window, config).getDetail("cusumPos"), DELTA);
        assertThat(cusum.ingest(2, window, config).getSeverity(), is(Severity.NORMAL));
        Verdict warning = cusum.ingest(2, window, config);
        assertEquals(4.5, warning.getDetail("cusumMax"), DELTA);
        assertThat(warning.getSeverity(), is(Severity.WARNING));
        Verdict critical = cusum.ingest(2, window, config);
        assertThat(critical.getSeverity(), is(Severity.CRITICAL));
        assertEquals(6, critical.getDetail("cusumMax"), DELTA);

        EstimatorState.Cusum state = (EstimatorState.Cusum) cusum.getState();
        assertEquals(0, state.pos, 0);
        assertEquals(0, state.neg, 0);
    }

    @Test
    public void cusumSumsStayNonNegative() {
        DetectorConfig config = new DetectorConfig();
        CusumEstimator cusum = new CusumEstimator();
        double[] values = {5, 1, 9, -3, 4, 4, 12, 0, 6, 2};
        for (int i = 1; i <= values.length; ++i) {
            double[] window = Arrays.copyOf(values, i);
            Verdict v = cusum.ingest(values[i - 1], window, config);
            assertTrue(v.getDetail("cusumPos") >= 0);
            assertTrue(v.getDetail("cusumNeg") >= 0);
        }
    }

    @Test
    public void movingAveragePercentMode() {
        DetectorConfig config = new DetectorConfig().setMaMode(DeviationMode.PERCENT)
                .setMaThreshold(30).setMaWarning(20);
        Verdict v = new MovingAverageEstimator().ingest(130, new double[]{100, 100, 100, 100, 130}, config);
        assertEquals(106, v.getDetail("movingAverage"), DELTA);
        assertEquals(24 / 106.0 * 100, v.getDetail("deviationPercent"), DELTA);
        assertThat(v.getSeverity(), is(Severity.WARNING));
    }

    @Test
    public void nonFiniteDetailsAreSanitised() {
        Map<String, Double> details = new LinkedHashMap<>();
        details.put("score", Double.NaN);
        Verdict v = new Verdict(Severity.NORMAL, details, "x");
        assertTrue(v.isNumericFault());
        assertEquals(0, v.getDetail("score"), 0);
        assertThat(v.getSeverity(), is(Severity.WARNING));
    }

    @Test
    public void methodNames() throws ConfigException {
        assertThat(Method.fromName("moving-average"), is(Method.MOVING_AVERAGE));
        assertThat(Method.fromName(" ZScore "), is(Method.ZSCORE));
        assertThat(Severity.worst(Severity.WARNING, Severity.CRITICAL), is(Severity.CRITICAL));
    }

    @Test(expected = ConfigException.class)
    public void unknownMethod() throws ConfigException {
        Method.fromName("fourier");
    }

    @Test
    public void factoryCoversScalarMethods() {
        for (Method m : Method.values()) {
            if (!m.isMultivariate()) {
                assertThat(Estimators.create(m, new ModelClient(null)).getMethod(), is(m));
            }
        }
    }
}
