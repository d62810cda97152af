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

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remaining useful life with its prediction interval and the degradation summary it was derived from. Durations
 * are kept in ms and converted to the configured unit on the way out.
 */
public class RulEstimate implements Serializable {
    private final DegradationModel model;
    private final RulUnit unit;
    private final double rulMs, lowerMs, upperMs;
    private final double meanIntervalMs;
    private final double confidence;
    private final RulStatus status;
    private final double degradationPercent, degradationRate;
    private final String degradationTrend;
    private final WeibullFit weibull;

    RulEstimate(DegradationModel model, RulUnit unit, double rulMs, double lowerMs, double upperMs,
                double meanIntervalMs, double confidence, RulStatus status,
                double degradationPercent, double degradationRate, String degradationTrend, WeibullFit weibull) {
        this.model = model;
        this.unit = unit;
        this.rulMs = rulMs;
        this.lowerMs = lowerMs;
        this.upperMs = upperMs;
        this.meanIntervalMs = meanIntervalMs;
        this.confidence = confidence;
        this.status = status;
        this.degradationPercent = degradationPercent;
        this.degradationRate = degradationRate;
        this.degradationTrend = degradationTrend;
        this.weibull = weibull;
    }

    /** Model actually used; weibull estimates that were degenerate report linear */
    public DegradationModel getModel() {
        return model;
    }

    public RulUnit getUnit() {
        return unit;
    }

    /** RUL in the configured unit, +Infinity when not degrading */
    public double getValue() {
        return unit.fromMillis(rulMs, meanIntervalMs);
    }

    public double getLower() {
        return unit.fromMillis(lowerMs, meanIntervalMs);
    }

    public double getUpper() {
        return unit.fromMillis(upperMs, meanIntervalMs);
    }

    public double getMillis() {
        return rulMs;
    }

    public double getConfidence() {
        return confidence;
    }

    public RulStatus getStatus() {
        return status;
    }

    /** How far the current value has travelled from the window minimum towards the threshold, 0..100 */
    public double getDegradationPercent() {
        return degradationPercent;
    }

    /** Fitted slope per second */
    public double getDegradationRate() {
        return degradationRate;
    }

    public String getDegradationTrend() {
        return degradationTrend;
    }

    public WeibullFit getWeibull() {
        return weibull;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("value", getValue());
        ret.put("unit", unit.getName());
        ret.put("lower", getLower());
        ret.put("upper", getUpper());
        ret.put("confidence", confidence);
        ret.put("status", status.getName());
        ret.put("model", model.getName());
        Map<String, Object> degradation = new LinkedHashMap<>();
        degradation.put("percent", degradationPercent);
        degradation.put("rate", degradationRate);
        degradation.put("trend", degradationTrend);
        ret.put("degradation", degradation);
        if (weibull != null) {
            ret.put("weibull", weibull.toMap(unit, meanIntervalMs));
        }
        return ret;
    }
}
