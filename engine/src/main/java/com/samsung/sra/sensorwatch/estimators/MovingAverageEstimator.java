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

/** Deviation of the sample from the window mean, scaled by sigma or by the mean itself */
public class MovingAverageEstimator extends UnivariateEstimator {
    @Override
    public Method getMethod() {
        return Method.MOVING_AVERAGE;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        double movingAverage = Numerics.mean(window);
        double stdDev = Numerics.stdDev(window, movingAverage);
        double deviation = Math.abs(value - movingAverage);
        double deviationFactor = stdDev == 0 ? 0 : deviation / stdDev;
        double deviationPercent = movingAverage == 0 ? 0 : deviation / Math.abs(movingAverage) * 100;

        double score = config.getMaMode() == DeviationMode.STDDEV ? deviationFactor : deviationPercent;
        Severity severity = Severity.NORMAL;
        if (score > config.getMaThreshold()) {
            severity = Severity.CRITICAL;
        } else if (score > config.getMaWarning()) {
            severity = Severity.WARNING;
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("movingAverage", movingAverage);
        details.put("stdDev", stdDev);
        details.put("deviation", deviation);
        details.put("deviationFactor", deviationFactor);
        details.put("deviationPercent", deviationPercent);

        String ma = fixed(movingAverage, 2);
        String statusText = severity == Severity.CRITICAL ? "CRITICAL MA=" + ma
                : severity == Severity.WARNING ? "warning MA=" + ma
                : "MA=" + ma;
        return new Verdict(severity, details, statusText);
    }
}
