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

import com.samsung.sra.sensorwatch.numeric.LinearRegression;

import java.io.Serializable;
import java.util.ArrayDeque;

/** Direction of the last few health indices: improving, degrading or stable */
public class HealthTrendTracker implements Serializable {
    public static final int HISTORY = 10;
    public static final int MIN_POINTS = 3;
    /** index points per sample */
    public static final double SLOPE_BAND = 0.5;

    private final ArrayDeque<Double> history = new ArrayDeque<>();

    public HealthTrendTracker() {
    }

    public HealthTrendTracker(HealthTrendTracker that) {
        this.history.addAll(that.history);
    }

    /** Append a 0-100 index and return the resulting trend */
    public String record(double index) {
        history.addLast(index);
        while (history.size() > HISTORY) {
            history.removeFirst();
        }
        return getTrend();
    }

    public String getTrend() {
        if (history.size() < MIN_POINTS) {
            return "stable";
        }
        double[] y = new double[history.size()];
        int i = 0;
        for (double v : history) {
            y[i++] = v;
        }
        double slope = LinearRegression.fit(y).slope;
        if (slope > SLOPE_BAND) {
            return "improving";
        } else if (slope < -SLOPE_BAND) {
            return "degrading";
        } else {
            return "stable";
        }
    }

    public int size() {
        return history.size();
    }

    public void reset() {
        history.clear();
    }
}
