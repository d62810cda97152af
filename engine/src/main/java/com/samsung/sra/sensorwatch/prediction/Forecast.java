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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result of one trend prediction. Optional parts are null when they cannot be computed. */
public class Forecast implements Serializable {
    private final TrendMethod method;
    private final String trend;
    private final double slope, intercept;
    private final double[] predictedValues;
    private final Integer stepsToThreshold;
    private final Double timeToThreshold;
    private final Double rateOfChange, acceleration;
    private final boolean rateAnomalous;

    Forecast(TrendMethod method, String trend, double slope, double intercept, double[] predictedValues,
             Integer stepsToThreshold, Double timeToThreshold,
             Double rateOfChange, Double acceleration, boolean rateAnomalous) {
        this.method = method;
        this.trend = trend;
        this.slope = slope;
        this.intercept = intercept;
        this.predictedValues = predictedValues;
        this.stepsToThreshold = stepsToThreshold;
        this.timeToThreshold = timeToThreshold;
        this.rateOfChange = rateOfChange;
        this.acceleration = acceleration;
        this.rateAnomalous = rateAnomalous;
    }

    public TrendMethod getMethod() {
        return method;
    }

    /** increasing, decreasing or stable */
    public String getTrend() {
        return trend;
    }

    /** Change per sample */
    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double[] getPredictedValues() {
        return predictedValues.clone();
    }

    /** Smallest k >= 1 whose forecast reaches the threshold, null if none does or no threshold is set */
    public Integer getStepsToThreshold() {
        return stepsToThreshold;
    }

    /** stepsToThreshold * mean sample interval, in ms */
    public Double getTimeToThreshold() {
        return timeToThreshold;
    }

    public boolean exceedsThreshold() {
        return stepsToThreshold != null;
    }

    public Double getRateOfChange() {
        return rateOfChange;
    }

    public Double getAcceleration() {
        return acceleration;
    }

    public boolean isRateAnomalous() {
        return rateAnomalous;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("method", method.getName());
        ret.put("trend", trend);
        ret.put("slope", slope);
        List<Double> predicted = new ArrayList<>();
        for (double v : predictedValues) {
            predicted.add(v);
        }
        ret.put("predictedValues", predicted);
        ret.put("stepsToThreshold", stepsToThreshold);
        ret.put("timeToThreshold", timeToThreshold);
        ret.put("rateOfChange", rateOfChange);
        ret.put("acceleration", acceleration);
        ret.put("rateAnomalous", rateAnomalous);
        return ret;
    }
}
