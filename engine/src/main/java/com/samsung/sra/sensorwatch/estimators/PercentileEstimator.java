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
import static com.samsung.sra.sensorwatch.Utilities.formatNumber;

/** Outside the [P_low, P_high] band of the window is critical; there is no warning level */
public class PercentileEstimator extends UnivariateEstimator {
    @Override
    public Method getMethod() {
        return Method.PERCENTILE;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        double[] sorted = Numerics.sorted(window);
        double lowerBound = Numerics.percentile(sorted, config.getLowerPercentile());
        double upperBound = Numerics.percentile(sorted, config.getUpperPercentile());
        boolean outside = value < lowerBound || value > upperBound;

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("lowerPercentile", config.getLowerPercentile());
        details.put("upperPercentile", config.getUpperPercentile());
        details.put("lowerBound", lowerBound);
        details.put("upperBound", upperBound);

        String statusText = outside ? "ANOMALY: " + fixed(value, 2)
                : "P" + formatNumber(config.getLowerPercentile()) + "-P" + formatNumber(config.getUpperPercentile());
        return new Verdict(outside ? Severity.CRITICAL : Severity.NORMAL, details, statusText);
    }
}
