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
package com.samsung.sra.sensorwatch.numeric;

/** Holt's linear (double exponential) smoothing with fixed alpha = 0.3, beta = 0.1 */
public class DoubleExponentialSmoothing {
    public static final double ALPHA = 0.3, BETA = 0.1;

    public final double level, trend;

    private DoubleExponentialSmoothing(double level, double trend) {
        this.level = level;
        this.trend = trend;
    }

    /** Level starts at y0, trend at y1 - y0 */
    public static DoubleExponentialSmoothing fit(double[] y) {
        if (y.length == 0) {
            return new DoubleExponentialSmoothing(0, 0);
        }
        double level = y[0];
        double trend = y.length > 1 ? y[1] - y[0] : 0;
        for (int i = 1; i < y.length; ++i) {
            double prevLevel = level;
            level = ALPHA * y[i] + (1 - ALPHA) * (level + trend);
            trend = BETA * (level - prevLevel) + (1 - BETA) * trend;
        }
        return new DoubleExponentialSmoothing(level, trend);
    }

    public double[] forecast(int steps) {
        double[] ret = new double[steps];
        for (int i = 1; i <= steps; ++i) {
            ret[i - 1] = level + i * trend;
        }
        return ret;
    }

    public String getTrend() {
        return Numerics.trendLabel(trend);
    }
}
