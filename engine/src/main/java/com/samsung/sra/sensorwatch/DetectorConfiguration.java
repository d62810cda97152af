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

import com.moandjiezana.toml.Toml;
import com.samsung.sra.sensorwatch.estimators.DeviationMode;
import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.estimators.PcaMethod;
import com.samsung.sra.sensorwatch.health.AggregationMethod;
import com.samsung.sra.sensorwatch.health.OutputScale;
import com.samsung.sra.sensorwatch.prediction.DegradationModel;
import com.samsung.sra.sensorwatch.prediction.RocMode;
import com.samsung.sra.sensorwatch.prediction.RulUnit;
import com.samsung.sra.sensorwatch.prediction.TrendMethod;
import com.samsung.sra.sensorwatch.signal.PeakType;
import com.samsung.sra.sensorwatch.signal.SignalMode;
import com.samsung.sra.sensorwatch.signal.WindowFunction;

import java.io.File;
import java.util.Map;

/**
 * {@link DetectorConfig} backed by a Toml document. Keys missing from the document keep their defaults. Example:
 * <pre>
 * method = "zscore"
 * window-size = 20
 *
 * [zscore]
 * threshold = 2.5
 * warning = 2.0
 *
 * [hysteresis]
 * enabled = true
 * percent = 10
 * consecutive-count = 2
 *
 * [health.weights]
 * temperature = 2.0
 * </pre>
 * Tables: zscore, iqr, threshold, percentile, ema, cusum, moving-average, hysteresis, pca, trend, rul, health, signal, ml.
 */
public class DetectorConfiguration {
    private final Toml toml;

    public DetectorConfiguration(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent config file " + file);
        toml = new Toml().read(file);
    }

    public DetectorConfiguration(String document) {
        toml = new Toml().read(document);
    }

    public Toml getToml() {
        return toml;
    }

    /** @throws ConfigException on unknown names, mistyped values or contradictory settings */
    public DetectorConfig getDetectorConfig() throws ConfigException {
        DetectorConfig config = new DetectorConfig();
        String method = getString(toml, "method");
        if (method != null) config.setMethod(Method.fromName(method));
        Long windowSize = getLong(toml, "window-size");
        if (windowSize != null) config.setWindowSize(windowSize.intValue());

        Toml zscore = toml.getTable("zscore");
        Double d;
        Long l;
        Boolean b;
        String s;
        if ((d = getNumber(zscore, "threshold")) != null) config.setZscoreThreshold(d);
        if ((d = getNumber(zscore, "warning")) != null) config.setZscoreWarning(d);

        Toml iqr = toml.getTable("iqr");
        if ((d = getNumber(iqr, "multiplier")) != null) config.setIqrMultiplier(d);

        Toml threshold = toml.getTable("threshold");
        if ((d = getNumber(threshold, "min")) != null) config.setMinThreshold(d);
        if ((d = getNumber(threshold, "max")) != null) config.setMaxThreshold(d);
        if ((d = getNumber(threshold, "warning-margin")) != null) config.setWarningMargin(d);

        Toml percentile = toml.getTable("percentile");
        if ((d = getNumber(percentile, "lower")) != null) config.setLowerPercentile(d);
        if ((d = getNumber(percentile, "upper")) != null) config.setUpperPercentile(d);

        Toml ema = toml.getTable("ema");
        if ((d = getNumber(ema, "alpha")) != null) config.setEmaAlpha(d);
        if ((d = getNumber(ema, "threshold")) != null) config.setEmaThreshold(d);
        if ((d = getNumber(ema, "warning")) != null) config.setEmaWarning(d);
        if ((s = getString(ema, "mode")) != null) config.setEmaMode(DeviationMode.fromName(s));

        Toml cusum = toml.getTable("cusum");
        if ((d = getNumber(cusum, "target")) != null) config.setCusumTarget(d);
        if ((d = getNumber(cusum, "threshold")) != null) config.setCusumThreshold(d);
        if ((d = getNumber(cusum, "warning")) != null) config.setCusumWarning(d);
        if ((d = getNumber(cusum, "drift")) != null) config.setCusumDrift(d);

        Toml ma = toml.getTable("moving-average");
        if ((d = getNumber(ma, "threshold")) != null) config.setMaThreshold(d);
        if ((d = getNumber(ma, "warning")) != null) config.setMaWarning(d);
        if ((s = getString(ma, "mode")) != null) config.setMaMode(DeviationMode.fromName(s));

        Toml hysteresis = toml.getTable("hysteresis");
        if ((b = getBoolean(hysteresis, "enabled")) != null) config.setHysteresisEnabled(b);
        if ((d = getNumber(hysteresis, "percent")) != null) config.setHysteresisPercent(d);
        if ((l = getLong(hysteresis, "consecutive-count")) != null) config.setConsecutiveCount(l.intValue());

        Toml pca = toml.getTable("pca");
        if ((l = getLong(pca, "n-components")) != null) config.setNComponents(l.intValue());
        if ((d = getNumber(pca, "threshold")) != null) config.setPcaThreshold(d);
        if ((s = getString(pca, "method")) != null) config.setPcaMethod(PcaMethod.fromName(s));
        if ((b = getBoolean(pca, "auto-components")) != null) config.setAutoComponents(b);
        if ((d = getNumber(pca, "variance-threshold")) != null) config.setVarianceThreshold(d);
        if ((d = getNumber(pca, "contribution-threshold")) != null) config.setContributionThreshold(d);
        if ((l = getLong(pca, "top-contributors")) != null) config.setTopContributors(l.intValue());

        Toml trend = toml.getTable("trend");
        if ((b = getBoolean(trend, "enabled")) != null) config.setTrendEnabled(b);
        if ((s = getString(trend, "method")) != null) config.setTrendMethod(TrendMethod.fromName(s));
        if ((l = getLong(trend, "prediction-steps")) != null) config.setPredictionSteps(l.intValue());
        if ((l = getLong(trend, "window")) != null) config.setTrendWindow(l.intValue());
        if ((d = getNumber(trend, "threshold")) != null) config.setTrendThreshold(d);
        if ((d = getNumber(trend, "roc-threshold")) != null) config.setRocThreshold(d);
        if ((s = getString(trend, "roc-mode")) != null) config.setRocMode(RocMode.fromName(s));

        Toml rul = toml.getTable("rul");
        if ((d = getNumber(rul, "failure-threshold")) != null) config.setFailureThreshold(d);
        if ((s = getString(rul, "degradation-model")) != null) config.setDegradationModel(DegradationModel.fromName(s));
        if ((s = getString(rul, "unit")) != null) config.setRulUnit(RulUnit.fromName(s));

        Toml health = toml.getTable("health");
        if ((b = getBoolean(health, "enabled")) != null) config.setHealthEnabled(b);
        if ((s = getString(health, "aggregation-method")) != null) {
            config.setAggregationMethod(AggregationMethod.fromName(s));
        }
        if ((s = getString(health, "output-scale")) != null) config.setOutputScale(OutputScale.fromName(s));
        Toml weights = health != null ? health.getTable("weights") : null;
        if (weights != null) {
            for (Map.Entry<String, Object> e : weights.toMap().entrySet()) {
                config.setSensorWeight(e.getKey(), toDouble("health.weights." + e.getKey(), e.getValue()));
            }
        }

        Toml signal = toml.getTable("signal");
        if ((s = getString(signal, "mode")) != null) config.setSignalMode(SignalMode.fromName(s));
        if ((l = getLong(signal, "window")) != null) config.setSignalWindow(l.intValue());
        if ((l = getLong(signal, "fft-size")) != null) config.setFftSize(l.intValue());
        if ((d = getNumber(signal, "sampling-rate")) != null) config.setSamplingRate(d);
        if ((d = getNumber(signal, "peak-threshold")) != null) config.setPeakThreshold(d);
        if ((s = getString(signal, "window-function")) != null) config.setWindowFunction(WindowFunction.fromName(s));
        if ((b = getBoolean(signal, "full-spectrum")) != null) config.setFullSpectrum(b);
        if ((d = getNumber(signal, "min-peak-height")) != null) config.setMinPeakHeight(d);
        if ((l = getLong(signal, "min-peak-distance")) != null) config.setMinPeakDistance(l.intValue());
        if ((s = getString(signal, "peak-type")) != null) config.setPeakType(PeakType.fromName(s));

        Toml ml = toml.getTable("ml");
        if ((s = getString(ml, "model-id")) != null) config.setModelId(s);
        if ((s = getString(ml, "model-path")) != null) config.setModelPath(s);
        if ((d = getNumber(ml, "threshold")) != null) config.setMlThreshold(d);
        if ((l = getLong(ml, "timeout-ms")) != null) config.setMlTimeoutMs(l);
        if ((l = getLong(ml, "shutdown-grace-ms")) != null) config.setShutdownGraceMs(l);

        return config.validate();
    }

    /** Toml keeps integers as Long and floats as Double; accept either wherever a number is expected */
    private static Double getNumber(Toml table, String key) throws ConfigException {
        Object value = get(table, key);
        return value == null ? null : toDouble(key, value);
    }

    private static Double toDouble(String key, Object value) throws ConfigException {
        if (!(value instanceof Number)) {
            throw new ConfigException("expect a number for " + key + ", got " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static Long getLong(Toml table, String key) throws ConfigException {
        Object value = get(table, key);
        if (value == null) {
            return null;
        } else if (value instanceof Long) {
            return (Long) value;
        } else {
            throw new ConfigException("expect an integer for " + key + ", got " + value);
        }
    }

    private static Boolean getBoolean(Toml table, String key) throws ConfigException {
        Object value = get(table, key);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        } else {
            throw new ConfigException("expect true or false for " + key + ", got " + value);
        }
    }

    private static String getString(Toml table, String key) throws ConfigException {
        Object value = get(table, key);
        if (value == null || value instanceof String) {
            return (String) value;
        } else {
            throw new ConfigException("expect a string for " + key + ", got " + value);
        }
    }

    private static Object get(Toml table, String key) {
        return table == null ? null : table.toMap().get(key);
    }
}
