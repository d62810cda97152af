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
package com.samsung.sra.sensorwatch.streams;

import com.samsung.sra.sensorwatch.numeric.Numerics;

import java.io.Serializable;
import java.util.ArrayDeque;

/** Recent values and lifetime anomaly counts of one stream, feeding the dynamic health weights */
public class ReliabilityTracker implements Serializable {
    public static final int CAPACITY = 50;

    private final ArrayDeque<Double> values = new ArrayDeque<>();
    private long anomalyCount = 0, totalCount = 0;

    public ReliabilityTracker() {
    }

    public ReliabilityTracker(ReliabilityTracker that) {
        this.values.addAll(that.values);
        this.anomalyCount = that.anomalyCount;
        this.totalCount = that.totalCount;
    }

    public void record(double value, boolean anomaly) {
        values.addLast(value);
        if (values.size() > CAPACITY) {
            values.removeFirst();
        }
        ++totalCount;
        if (anomaly) {
            ++anomalyCount;
        }
    }

    public double getAnomalyRate() {
        return totalCount == 0 ? 0 : (double) anomalyCount / totalCount;
    }

    /** sigma / |mu| of the recent values, NaN with fewer than two values or a zero mean */
    public double getCoefficientOfVariation() {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double[] arr = new double[values.size()];
        int i = 0;
        for (double v : values) {
            arr[i++] = v;
        }
        return Numerics.coefficientOfVariation(arr);
    }

    public int size() {
        return values.size();
    }

    public long getAnomalyCount() {
        return anomalyCount;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void reset() {
        values.clear();
        anomalyCount = 0;
        totalCount = 0;
    }
}
