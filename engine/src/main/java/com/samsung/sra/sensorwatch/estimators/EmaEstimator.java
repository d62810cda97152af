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

/**
 * Exponential moving average. The first judged sample seeds the average and is reported as "initializing"; after
 * that the average is updated with the sample before the deviation is measured against it.
 */
public class EmaEstimator extends UnivariateEstimator {
    private EstimatorState.Ema state = new EstimatorState.Ema();

    @Override
    public Method getMethod() {
        return Method.EMA;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        if (!state.initialized) {
            state.ema = value;
            state.initialized = true;
            Map<String, Double> details = new LinkedHashMap<>();
            details.put("ema", value);
            return Verdict.initializing(details);
        }
        double alpha = config.getEmaAlpha();
        state.ema = alpha * value + (1 - alpha) * state.ema;

        double stdDev = Numerics.stdDev(window);
        double deviation = Math.abs(value - state.ema);
        double deviationFactor = stdDev == 0 ? 0 : deviation / stdDev;
        double deviationPercent = state.ema == 0 ? 0 : deviation / Math.abs(state.ema) * 100;

        double score = config.getEmaMode() == DeviationMode.STDDEV ? deviationFactor : deviationPercent;
        Severity severity = Severity.NORMAL;
        if (score > config.getEmaThreshold()) {
            severity = Severity.CRITICAL;
        } else if (score > config.getEmaWarning()) {
            severity = Severity.WARNING;
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("ema", state.ema);
        details.put("deviation", deviation);
        details.put("deviationFactor", deviationFactor);
        details.put("deviationPercent", deviationPercent);
        details.put("alpha", alpha);

        String ema = fixed(state.ema, 2);
        String statusText = severity == Severity.CRITICAL ? "CRITICAL EMA=" + ema
                : severity == Severity.WARNING ? "warning EMA=" + ema
                : "EMA=" + ema;
        return new Verdict(severity, details, statusText);
    }

    @Override
    public EstimatorState getState() {
        return state.copy();
    }

    @Override
    public void setState(EstimatorState state) {
        if (!(state instanceof EstimatorState.Ema)) {
            throw new IllegalArgumentException("EMA estimator cannot take state " + state);
        }
        this.state = ((EstimatorState.Ema) state).copy();
    }

    @Override
    public void reset() {
        state = new EstimatorState.Ema();
    }
}
