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
import com.samsung.sra.sensorwatch.numeric.DoubleExponentialSmoothing;
import com.samsung.sra.sensorwatch.numeric.LinearRegression;
import com.samsung.sra.sensorwatch.numeric.Numerics;

import java.util.Arrays;

/**
 * Forecasts the next predictionSteps values of a stream from the newest trendWindow samples, and measures the
 * current rate of change. Stateless: everything is derived from the window passed in.
 */
public class TrendPredictor {
    public static final int MIN_SAMPLES = 3;

    private TrendPredictor() {}

    /** @return null with fewer than three samples */
    public static Forecast predict(double[] values, long[] timestamps, DetectorConfig config) {
        int n = Math.min(values.length, config.getTrendWindow());
        if (n < MIN_SAMPLES) {
            return null;
        }
        double[] y = Arrays.copyOfRange(values, values.length - n, values.length);
        long[] ts = Arrays.copyOfRange(timestamps, timestamps.length - n, timestamps.length);

        double slope, intercept;
        double[] predicted;
        if (config.getTrendMethod() == TrendMethod.LINEAR) {
            LinearRegression lr = LinearRegression.fit(y);
            slope = lr.slope;
            intercept = lr.intercept;
            predicted = lr.forecast(config.getPredictionSteps());
        } else {
            DoubleExponentialSmoothing des = DoubleExponentialSmoothing.fit(y);
            slope = des.trend;
            intercept = des.level;
            predicted = des.forecast(config.getPredictionSteps());
        }

        Integer steps = null;
        Double time = null;
        if (config.getTrendThreshold() != null) {
            steps = stepsToThreshold(predicted, config.getTrendThreshold());
            if (steps != null) {
                time = steps * Numerics.meanInterval(ts);
            }
        }

        Double rate = rateOfChange(y, ts, config.getRocMode());
        Double acceleration = acceleration(y, ts);
        boolean rateAnomalous = config.getRocThreshold() != null && rate != null
                && Math.abs(rate) > config.getRocThreshold();
        return new Forecast(config.getTrendMethod(), Numerics.trendLabel(slope), slope, intercept, predicted,
                steps, time, rate, acceleration, rateAnomalous);
    }

    static Integer stepsToThreshold(double[] predicted, double threshold) {
        for (int i = 0; i < predicted.length; ++i) {
            if (predicted[i] >= threshold) {
                return i + 1;
            }
        }
        return null;
    }

    /** Change between the last two samples per second; null when time did not advance */
    static Double rateOfChange(double[] y, long[] ts, RocMode mode) {
        int n = y.length;
        double dt = (ts[n - 1] - ts[n - 2]) / 1000.0;
        if (dt <= 0) {
            return null;
        }
        double dv = y[n - 1] - y[n - 2];
        if (mode == RocMode.ABSOLUTE) {
            return dv / dt;
        }
        if (y[n - 2] == 0) {
            return null;
        }
        return dv / Math.abs(y[n - 2]) * 100 / dt;
    }

    /** Difference of the last two pairwise rates over the mean sample interval (s) */
    static Double acceleration(double[] y, long[] ts) {
        int n = y.length;
        double dt1 = (ts[n - 2] - ts[n - 3]) / 1000.0, dt2 = (ts[n - 1] - ts[n - 2]) / 1000.0;
        double meanDt = Numerics.meanInterval(ts) / 1000.0;
        if (dt1 <= 0 || dt2 <= 0 || meanDt <= 0) {
            return null;
        }
        double prevRate = (y[n - 2] - y[n - 3]) / dt1;
        double lastRate = (y[n - 1] - y[n - 2]) / dt2;
        return (lastRate - prevRate) / meanDt;
    }
}
