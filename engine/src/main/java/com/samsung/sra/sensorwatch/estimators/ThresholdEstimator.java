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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.samsung.sra.sensorwatch.Utilities.formatNumber;

/**
 * Fixed bounds. The warning band starts warningMargin percent inside each bound: min * (1 + margin/100) and
 * max * (1 - margin/100). Either bound may be absent.
 */
public class ThresholdEstimator extends UnivariateEstimator {
    @Override
    public Method getMethod() {
        return Method.THRESHOLD;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        Double min = config.getMinThreshold(), max = config.getMaxThreshold();
        double margin = config.getWarningMargin() / 100;

        Severity severity = Severity.NORMAL;
        List<String> reasons = new ArrayList<>();
        Map<String, Double> details = new LinkedHashMap<>();
        details.put("value", value);

        if (min != null) {
            double minWarning = min * (1 + margin);
            details.put("minThreshold", min);
            details.put("minWarning", minWarning);
            if (value < min) {
                severity = Severity.CRITICAL;
                reasons.add("Below minimum (" + formatNumber(min) + ")");
            } else if (value < minWarning) {
                severity = Severity.WARNING;
                reasons.add("Approaching minimum");
            }
        }
        if (max != null) {
            double maxWarning = max * (1 - margin);
            details.put("maxThreshold", max);
            details.put("maxWarning", maxWarning);
            if (value > max) {
                severity = Severity.CRITICAL;
                reasons.add(reasons.isEmpty() ? "Above maximum (" + formatNumber(max) + ")" : "above maximum");
            } else if (value > maxWarning && severity != Severity.CRITICAL) {
                severity = Severity.WARNING;
                reasons.add(reasons.isEmpty() ? "Approaching maximum" : "approaching maximum");
            }
        }

        String reason = reasons.isEmpty() ? null : String.join(" AND ", reasons);
        String statusText = severity == Severity.CRITICAL ? "CRITICAL: " + formatNumber(value)
                : severity == Severity.WARNING ? "warning: " + formatNumber(value)
                : "OK: " + formatNumber(value);
        return new Verdict(severity, details, statusText, reason, null);
    }
}
