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
package com.samsung.sra.sensorwatch.prediction;

import com.samsung.sra.sensorwatch.numeric.Gamma;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weibull reliability R(t) = exp(-(t / eta)^beta). All durations are in ms; reporting converts them to the RUL
 * unit.
 */
public class WeibullFit implements Serializable {
    public static final double[] B_LIFE_FRACTIONS = {0.01, 0.05, 0.10, 0.50};

    private final double beta, eta;
    /** elapsed time at which the fit was made */
    private final double t;

    public WeibullFit(double beta, double eta, double t) {
        this.beta = beta;
        this.eta = eta;
        this.t = t;
    }

    public double getBeta() {
        return beta;
    }

    public double getEta() {
        return eta;
    }

    public double getElapsed() {
        return t;
    }

    public double reliability(double time) {
        return Math.exp(-Math.pow(time / eta, beta));
    }

    public double getCurrentReliability() {
        return reliability(t);
    }

    /** Time at which reliability has dropped to r */
    public double timeAtReliability(double r) {
        return eta * Math.pow(-Math.log(r), 1 / beta);
    }

    /** h(t) = (beta / eta) (t / eta)^(beta - 1), per ms */
    public double getHazardRate() {
        return beta / eta * Math.pow(t / eta, beta - 1);
    }

    public double getMttf() {
        return eta * Gamma.gamma(1 + 1 / beta);
    }

    /** Time by which a fraction p of the population has failed */
    public double bLife(double p) {
        return timeAtReliability(1 - p);
    }

    public String getFailureMode() {
        if (beta < 0.9) {
            return "infant-mortality";
        } else if (beta <= 1.1) {
            return "random";
        } else {
            return "wear-out";
        }
    }

    Map<String, Object> toMap(RulUnit unit, double meanIntervalMs) {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("beta", beta);
        ret.put("eta", unit.fromMillis(eta, meanIntervalMs));
        ret.put("currentReliability", getCurrentReliability());
        // per unit instead of per ms
        ret.put("hazardRate", getHazardRate() / unit.fromMillis(1, meanIntervalMs));
        ret.put("mttf", unit.fromMillis(getMttf(), meanIntervalMs));
        Map<String, Double> bLife = new LinkedHashMap<>();
        for (double p : B_LIFE_FRACTIONS) {
            bLife.put("B" + Math.round(p * 100), unit.fromMillis(bLife(p), meanIntervalMs));
        }
        ret.put("bLife", bLife);
        ret.put("failureMode", getFailureMode());
        return ret;
    }
}
