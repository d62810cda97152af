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
 * Two-sided tabular CUSUM against the configured target, or the window mean when no target is set. Both sums are
 * cleared after a critical verdict only; a warning leaves them accumulating.
 */
public class CusumEstimator extends UnivariateEstimator {
    private EstimatorState.Cusum state = new EstimatorState.Cusum();

    @Override
    public Method getMethod() {
        return Method.CUSUM;
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) {
        double target = config.getCusumTarget() != null ? config.getCusumTarget() : Numerics.mean(window);
        double drift = config.getCusumDrift();
        double deviation = value - target;
        state.pos = Math.max(0, state.pos + deviation - drift);
        state.neg = Math.max(0, state.neg - deviation - drift);
        double cusumMax = Math.max(state.pos, state.neg);

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("target", target);
        details.put("cusumPos", state.pos);
        details.put("cusumNeg", state.neg);
        details.put("cusumMax", cusumMax);
        details.put("drift", drift);

        Severity severity = Severity.NORMAL;
        if (cusumMax > config.getCusumThreshold()) {
            severity = Severity.CRITICAL;
            state.pos = 0;
            state.neg = 0;
        } else if (cusumMax > config.getCusumWarning()) {
            severity = Severity.WARNING;
        }

        String statusText = severity == Severity.CRITICAL ? "CRITICAL CUSUM=" + fixed(cusumMax, 2)
                : severity == Severity.WARNING ? "warning CUSUM=" + fixed(cusumMax, 2)
                : "CUSUM=" + fixed(cusumMax, 2);
        return new Verdict(severity, details, statusText);
    }

    @Override
    public EstimatorState getState() {
        return state.copy();
    }

    @Override
    public void setState(EstimatorState state) {
        if (!(state instanceof EstimatorState.Cusum)) {
            throw new IllegalArgumentException("CUSUM estimator cannot take state " + state);
        }
        this.state = ((EstimatorState.Cusum) state).copy();
    }

    @Override
    public void reset() {
        state = new EstimatorState.Cusum();
    }
}
