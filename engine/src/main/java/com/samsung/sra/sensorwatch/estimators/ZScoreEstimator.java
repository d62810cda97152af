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

/** z = (x - mu) / sigma over the window, 0 when sigma = 0 */
public class ZScoreEstimator extends UnivariateEstimator {
    @Override
    public Method getMethod() {
        return Method.ZSCORE;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        return evaluate(value, window, config.getZscoreThreshold(), config.getZscoreWarning());
    }

    static Verdict evaluate(double value, double[] window, double threshold, double warning) {
        double mean = Numerics.mean(window);
        double stdDev = Numerics.stdDev(window, mean);
        double z = stdDev == 0 ? 0 : (value - mean) / stdDev;

        Severity severity = Severity.NORMAL;
        if (Math.abs(z) > threshold) {
            severity = Severity.CRITICAL;
        } else if (Math.abs(z) > warning) {
            severity = Severity.WARNING;
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("zScore", z);
        details.put("mean", mean);
        details.put("stdDev", stdDev);
        details.put("threshold", threshold);
        details.put("warningThreshold", warning);
        details.put("lowerBound", mean - threshold * stdDev);
        details.put("upperBound", mean + threshold * stdDev);

        String statusText;
        switch (severity) {
            case CRITICAL:
                statusText = "CRITICAL z=" + fixed(z, 2);
                break;
            case WARNING:
                statusText = "warning z=" + fixed(z, 2);
                break;
            default:
                statusText = "μ=" + fixed(mean, 1) + " σ=" + fixed(stdDev, 2);
        }
        return new Verdict(severity, details, statusText);
    }
}
