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

import com.samsung.sra.sensorwatch.DetectorConfig;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TrendPredictorTest {
    private static final double DELTA = 1e-9;

    private static double[] line(int n) {
        double[] ret = new double[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = 10 + 3 * i;
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
    public void needsThreeSamples() {
        assertThat(TrendPredictor.predict(line(2), seconds(2), new DetectorConfig()), nullValue());
    }

    @Test
    public void linearForecastAndThresholdCrossing() {
        DetectorConfig config = new DetectorConfig().setTrendEnabled(true).setTrendThreshold(50d).setRocThreshold(2d);
        Forecast f = TrendPredictor.predict(line(10), seconds(10), config);
        assertThat(f.getTrend(), is("increasing"));
        assertEquals(3, f.getSlope(), DELTA);
        assertEquals(10, f.getPredictedValues().length);
        assertEquals(40, f.getPredictedValues()[0], DELTA);
        assertThat(f.getStepsToThreshold(), is(5));
        assertEquals(5000, f.getTimeToThreshold(), DELTA);
        assertTrue(f.exceedsThreshold());
        assertEquals(3, f.getRateOfChange(), DELTA);
        assertEquals(0, f.getAcceleration(), DELTA);
        assertTrue(f.isRateAnomalous());
    }

    @Test
    public void thresholdOutOfReach() {
        DetectorConfig config = new DetectorConfig().setTrendThreshold(1000d).setPredictionSteps(3);
        Forecast f = TrendPredictor.predict(line(10), seconds(10), config);
        assertThat(f.getStepsToThreshold(), nullValue());
        assertThat(f.getTimeToThreshold(), nullValue());
        assertFalse(f.exceedsThreshold());
        assertFalse(f.isRateAnomalous());
    }

    @Test
    public void exponentialSmoothingFollowsExactLine() {
        DetectorConfig config = new DetectorConfig().setTrendMethod(TrendMethod.EXPONENTIAL).setPredictionSteps(2);
        Forecast f = TrendPredictor.predict(line(6), seconds(6), config);
        assertArrayEquals(new double[]{28, 31}, f.getPredictedValues(), 1e-9);
    }

    @Test
    public void onlyTheTrendWindowIsUsed() {
        double[] values = {100, 90, 80, 10, 13, 16, 19};
        DetectorConfig config = new DetectorConfig().setTrendWindow(4);
        assertEquals(3, TrendPredictor.predict(values, seconds(7), config).getSlope(), DELTA);
    }

    @Test
    public void rateOfChangeModes() {
        double[] y = {10, 20, 25};
        long[] ts = {0, 1000, 3000};
        assertEquals(2.5, TrendPredictor.rateOfChange(y, ts, RocMode.ABSOLUTE), DELTA);
        assertEquals(12.5, TrendPredictor.rateOfChange(y, ts, RocMode.PERCENTAGE), DELTA);
        assertThat(TrendPredictor.rateOfChange(new double[]{0, 5}, new long[]{0, 1000}, RocMode.PERCENTAGE),
                nullValue());
        assertThat(TrendPredictor.rateOfChange(y, new long[]{0, 1000, 1000}, RocMode.ABSOLUTE), nullValue());
        // rates 10/s then 2.5/s over a mean interval of 1.5 s
        assertEquals(-5, TrendPredictor.acceleration(y, ts), DELTA);
    }
}
