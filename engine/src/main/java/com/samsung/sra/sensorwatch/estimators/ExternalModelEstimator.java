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
import com.samsung.sra.sensorwatch.ExternalRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.samsung.sra.sensorwatch.Utilities.fixed;

/**
 * Reconstruction-error detector backed by an external model. The model input is the newest min(windowSize, 10)
 * window values; error = mean squared difference between input and prediction.
 *
 * Without a usable runtime the estimator degrades to a z-score verdict tagged with fallback = 1. Runtime failures
 * are thrown as ExternalRuntimeException and leave nothing changed.
 */
public class ExternalModelEstimator implements Estimator {
    private static final Logger logger = LoggerFactory.getLogger(ExternalModelEstimator.class);

    public static final int MAX_INPUT_LENGTH = 10;
    public static final double WARNING_FRACTION = 0.8;

    private final ModelClient client;

    public ExternalModelEstimator(ModelClient client) {
        this.client = client;
    }

    @Override
    public Method getMethod() {
        return Method.ML;
    }

    @Override
    public int getMinSamples(DetectorConfig config) {
        if (!client.isAvailable(config)) {
            return UnivariateEstimator.DEFAULT_MIN_SAMPLES;
        }
        return Math.min(config.getWindowSize(), MAX_INPUT_LENGTH);
    }

    @Override
    public Verdict ingest(double value, double[] window, DetectorConfig config) throws ExternalRuntimeException {
        if (!client.isAvailable(config)) {
            return fallback(value, window, config);
        }
        int len = Math.min(window.length, Math.min(config.getWindowSize(), MAX_INPUT_LENGTH));
        double[] input = new double[len];
        System.arraycopy(window, window.length - len, input, 0, len);

        double[] output = client.predict(input, config);
        if (output == null || output.length != input.length) {
            throw new ExternalRuntimeException(String.format("model %s returned %s values for an input of %d",
                    config.getModelId(), output == null ? "no" : String.valueOf(output.length), input.length));
        }

        double error = 0;
        for (int i = 0; i < len; ++i) {
            error += (input[i] - output[i]) * (input[i] - output[i]);
        }
        error /= len;
        double threshold = config.getMlThreshold();
        Severity severity = Severity.NORMAL;
        if (error > threshold) {
            severity = Severity.CRITICAL;
        } else if (error > WARNING_FRACTION * threshold) {
            severity = Severity.WARNING;
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("reconstructionError", error);
        details.put("threshold", threshold);
        details.put("confidence", 1 / (1 + error / threshold));
        details.put("inputLength", (double) len);
        String err = "ML err=" + fixed(error, 4);
        String statusText = severity == Severity.CRITICAL ? "CRITICAL " + err
                : severity == Severity.WARNING ? "warning " + err
                : err;
        return new Verdict(severity, details, statusText);
    }

    private Verdict fallback(double value, double[] window, DetectorConfig config) {
        logger.debug("model runtime unavailable, falling back to z-score");
        Verdict z = ZScoreEstimator.evaluate(value, window, config.getZscoreThreshold(), config.getZscoreWarning());
        Map<String, Double> details = new LinkedHashMap<>(z.getDetails());
        details.put("fallback", 1d);
        return new Verdict(z.getSeverity(), details, z.getStatusText(), null, Method.ZSCORE.getName());
    }

    @Override
    public EstimatorState getState() {
        return EstimatorState.NoState.INSTANCE;
    }

    @Override
    public void setState(EstimatorState state) {
    }

    @Override
    public void reset() {
    }
}
