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
package com.samsung.sra.sensorwatch;

import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.health.AggregationMethod;
import com.samsung.sra.sensorwatch.prediction.DegradationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-sample changes to a session's config. Every field is nullable; null means "keep the session's value".
 * Overrides never persist beyond the sample they were supplied with.
 */
public class ConfigOverrides {
    private static final Logger logger = LoggerFactory.getLogger(ConfigOverrides.class);

    private Method method;
    private Integer windowSize;
    private Double zscoreThreshold, zscoreWarning, iqrMultiplier;
    private Double minThreshold, maxThreshold;
    private Boolean hysteresisEnabled;
    private Integer consecutiveCount;
    private AggregationMethod aggregationMethod;
    private Map<String, Double> sensorWeights;
    private Double failureThreshold;
    private DegradationModel degradationModel;
    private Double rocThreshold;

    public ConfigOverrides() {
    }

    /**
     * Build overrides from a loosely typed map with the field names as keys, e.g. a decoded JSON object. Unknown
     * keys are ignored.
     * @throws ConfigException if a value cannot be interpreted
     */
    public static ConfigOverrides fromMap(Map<String, ?> map) throws ConfigException {
        ConfigOverrides o = new ConfigOverrides();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            Object v = e.getValue();
            if (v == null) {
                continue;
            }
            switch (e.getKey()) {
                case "method":
                    o.method = Method.fromName(v.toString());
                    break;
                case "windowSize":
                    o.windowSize = (int) number(e.getKey(), v);
                    break;
                case "zscoreThreshold":
                    o.zscoreThreshold = number(e.getKey(), v);
                    break;
                case "zscoreWarning":
                    o.zscoreWarning = number(e.getKey(), v);
                    break;
                case "iqrMultiplier":
                    o.iqrMultiplier = number(e.getKey(), v);
                    break;
                case "minThreshold":
                    o.minThreshold = number(e.getKey(), v);
                    break;
                case "maxThreshold":
                    o.maxThreshold = number(e.getKey(), v);
                    break;
                case "hysteresisEnabled":
                    o.hysteresisEnabled = v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
                    break;
                case "consecutiveCount":
                    o.consecutiveCount = (int) number(e.getKey(), v);
                    break;
                case "aggregationMethod":
                    o.aggregationMethod = AggregationMethod.fromName(v.toString());
                    break;
                case "sensorWeights":
                    if (!(v instanceof Map)) {
                        throw new ConfigException("sensorWeights must be a map of sensor name to weight");
                    }
                    Map<String, Double> weights = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> w : ((Map<?, ?>) v).entrySet()) {
                        weights.put(String.valueOf(w.getKey()), number("sensorWeights." + w.getKey(), w.getValue()));
                    }
                    o.sensorWeights = weights;
                    break;
                case "failureThreshold":
                    o.failureThreshold = number(e.getKey(), v);
                    break;
                case "degradationModel":
                    o.degradationModel = DegradationModel.fromName(v.toString());
                    break;
                case "rocThreshold":
                    o.rocThreshold = number(e.getKey(), v);
                    break;
                default:
                    logger.debug("ignoring unknown override {}", e.getKey());
            }
        }
        return o;
    }

    private static double number(String key, Object v) throws ConfigException {
        double d = Utilities.parseDouble(v);
        if (Double.isNaN(d)) {
            throw new ConfigException("override " + key + " is not a number: " + v);
        }
        return d;
    }

    /** Copy of base with these overrides applied, validated */
    public DetectorConfig applyTo(DetectorConfig base) throws ConfigException {
        DetectorConfig c = new DetectorConfig(base);
        if (method != null) c.setMethod(method);
        if (windowSize != null) c.setWindowSize(windowSize);
        if (zscoreThreshold != null) c.setZscoreThreshold(zscoreThreshold);
        if (zscoreWarning != null) c.setZscoreWarning(zscoreWarning);
        if (iqrMultiplier != null) c.setIqrMultiplier(iqrMultiplier);
        if (minThreshold != null) c.setMinThreshold(minThreshold);
        if (maxThreshold != null) c.setMaxThreshold(maxThreshold);
        if (hysteresisEnabled != null) c.setHysteresisEnabled(hysteresisEnabled);
        if (consecutiveCount != null) c.setConsecutiveCount(consecutiveCount);
        if (aggregationMethod != null) c.setAggregationMethod(aggregationMethod);
        if (sensorWeights != null) c.setSensorWeights(sensorWeights);
        if (failureThreshold != null) c.setFailureThreshold(failureThreshold);
        if (degradationModel != null) c.setDegradationModel(degradationModel);
        if (rocThreshold != null) c.setRocThreshold(rocThreshold);
        return c.validate();
    }

    /** New overrides holding this one's fields, replaced by that's where that sets them */
    public ConfigOverrides merge(ConfigOverrides that) {
        ConfigOverrides o = new ConfigOverrides();
        o.method = that.method != null ? that.method : method;
        o.windowSize = that.windowSize != null ? that.windowSize : windowSize;
        o.zscoreThreshold = that.zscoreThreshold != null ? that.zscoreThreshold : zscoreThreshold;
        o.zscoreWarning = that.zscoreWarning != null ? that.zscoreWarning : zscoreWarning;
        o.iqrMultiplier = that.iqrMultiplier != null ? that.iqrMultiplier : iqrMultiplier;
        o.minThreshold = that.minThreshold != null ? that.minThreshold : minThreshold;
        o.maxThreshold = that.maxThreshold != null ? that.maxThreshold : maxThreshold;
        o.hysteresisEnabled = that.hysteresisEnabled != null ? that.hysteresisEnabled : hysteresisEnabled;
        o.consecutiveCount = that.consecutiveCount != null ? that.consecutiveCount : consecutiveCount;
        o.aggregationMethod = that.aggregationMethod != null ? that.aggregationMethod : aggregationMethod;
        o.sensorWeights = that.sensorWeights != null ? that.sensorWeights : sensorWeights;
        o.failureThreshold = that.failureThreshold != null ? that.failureThreshold : failureThreshold;
        o.degradationModel = that.degradationModel != null ? that.degradationModel : degradationModel;
        o.rocThreshold = that.rocThreshold != null ? that.rocThreshold : rocThreshold;
        return o;
    }

    public ConfigOverrides setMethod(Method method) {
        this.method = method;
        return this;
    }

    public ConfigOverrides setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
        return this;
    }

    public ConfigOverrides setZscoreThreshold(Double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
        return this;
    }

    public ConfigOverrides setZscoreWarning(Double zscoreWarning) {
        this.zscoreWarning = zscoreWarning;
        return this;
    }

    public ConfigOverrides setIqrMultiplier(Double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
        return this;
    }

    public ConfigOverrides setMinThreshold(Double minThreshold) {
        this.minThreshold = minThreshold;
        return this;
    }

    public ConfigOverrides setMaxThreshold(Double maxThreshold) {
        this.maxThreshold = maxThreshold;
        return this;
    }

    public ConfigOverrides setHysteresisEnabled(Boolean hysteresisEnabled) {
        this.hysteresisEnabled = hysteresisEnabled;
        return this;
    }

    public ConfigOverrides setConsecutiveCount(Integer consecutiveCount) {
        this.consecutiveCount = consecutiveCount;
        return this;
    }

    public ConfigOverrides setAggregationMethod(AggregationMethod aggregationMethod) {
        this.aggregationMethod = aggregationMethod;
        return this;
    }

    public ConfigOverrides setSensorWeights(Map<String, Double> sensorWeights) {
        this.sensorWeights = sensorWeights;
        return this;
    }

    public ConfigOverrides setFailureThreshold(Double failureThreshold) {
        this.failureThreshold = failureThreshold;
        return this;
    }

    public ConfigOverrides setDegradationModel(DegradationModel degradationModel) {
        this.degradationModel = degradationModel;
        return this;
    }

    public ConfigOverrides setRocThreshold(Double rocThreshold) {
        this.rocThreshold = rocThreshold;
        return this;
    }

    public Method getMethod() {
        return method;
    }

    public Integer getWindowSize() {
        return windowSize;
    }
}
