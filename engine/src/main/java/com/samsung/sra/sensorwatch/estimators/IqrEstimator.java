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

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.numeric.Numerics;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.samsung.sra.sensorwatch.Utilities.fixed;

/** Tukey fences around the quartiles. Warning fences sit at 80% of the configured multiplier. */
public class IqrEstimator extends UnivariateEstimator {
    public static final int MIN_SAMPLES = 4;
    public static final double WARNING_FRACTION = 0.8;

    @Override
    public Method getMethod() {
        return Method.IQR;
    }

    @Override
    public int getMinSamples(DetectorConfig config) {
        return MIN_SAMPLES;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        double multiplier = config.getIqrMultiplier();
        Numerics.Quartiles q = Numerics.quartiles(window);
        double lowerBound = q.q1 - multiplier * q.iqr;
        double upperBound = q.q3 + multiplier * q.iqr;
        double lowerWarning = q.q1 - WARNING_FRACTION * multiplier * q.iqr;
        double upperWarning = q.q3 + WARNING_FRACTION * multiplier * q.iqr;

        Severity severity = Severity.NORMAL;
        if (value < lowerBound || value > upperBound) {
            severity = Severity.CRITICAL;
        } else if (value < lowerWarning || value > upperWarning) {
            severity = Severity.WARNING;
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("q1", q.q1);
        details.put("q3", q.q3);
        details.put("iqr", q.iqr);
        details.put("median", q.median);
        details.put("lowerBound", lowerBound);
        details.put("upperBound", upperBound);
        details.put("multiplier", multiplier);

        String statusText = severity == Severity.CRITICAL ? "CRITICAL: " + fixed(value, 2)
                : severity == Severity.WARNING ? "warning: " + fixed(value, 2)
                : "Q1=" + fixed(q.q1, 1) + " Q3=" + fixed(q.q3, 1);
        return new Verdict(severity, details, statusText);
    }
}
