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
package com.samsung.sra.sensorwatch.streams;

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.InvalidInputException;
import com.samsung.sra.sensorwatch.Output;
import com.samsung.sra.sensorwatch.estimators.EstimatorState;
import com.samsung.sra.sensorwatch.estimators.PcaEstimator;
import com.samsung.sra.sensorwatch.estimators.PcaVerdict;
import com.samsung.sra.sensorwatch.estimators.Verdict;
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;
import com.samsung.sra.sensorwatch.persistence.VectorChannelSnapshot;
import com.samsung.sra.sensorwatch.window.VectorWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;

/** The single multivariate stream of a PCA session */
public class VectorChannel {
    private static final Logger logger = LoggerFactory.getLogger(VectorChannel.class);

    private final VectorWindow window;
    private final PcaEstimator pca = new PcaEstimator();
    private Hysteresis hysteresis = new Hysteresis();

    public VectorChannel(int capacity) {
        this.window = new VectorWindow(capacity);
    }

    /** @throws InvalidInputException on fewer than two features or a change of dimension; nothing is stored then */
    public Output ingest(long timestamp, double[] vector, String[] names, DetectorConfig config)
            throws InvalidInputException {
        if (vector.length < 2) {
            throw new InvalidInputException("at least 2 sensor values are required for PCA, got " + vector.length);
        }
        if (window.size() > 0 && vector.length != window.getDimension()) {
            throw new InvalidInputException(String.format("expected %d sensor values, got %d",
                    window.getDimension(), vector.length));
        }
        window.push(timestamp, vector);
        double[][] rows = window.rows();
        int view = Math.min(config.getWindowSize(), rows.length);
        if (view < rows.length) {
            rows = Arrays.copyOfRange(rows, rows.length - view, rows.length);
        }
        Verdict verdict = pca.ingest(vector, names, rows, config);
        Hysteresis.Outcome outcome = verdict.isWarmup()
                ? Hysteresis.Outcome.passThrough(verdict, config.isHysteresisEnabled())
                : hysteresis.apply(verdict, config);
        logger.debug("vector {}: raw {} final {}", Arrays.toString(vector), verdict.getSeverity(), outcome.getSeverity());

        LinkedHashMap<String, Double> payload = new LinkedHashMap<>();
        for (int i = 0; i < vector.length; ++i) {
            payload.put(names[i], vector[i]);
        }
        Output out = new Output()
                .setPayload(payload)
                .setAnomaly(outcome.isAnomaly())
                .setRawAnomaly(verdict.isAnomaly())
                .setSeverity(outcome.getSeverity())
                .setMethod(verdict.getMethod() != null ? verdict.getMethod() : config.getMethod().getName())
                .setBufferSize(window.size())
                .setWindowSize(config.getWindowSize())
                .setTimestamp(timestamp)
                .setDetails(verdict.getDetails())
                .setStatusText(verdict.getStatusText())
                .setNumericFault(verdict.isNumericFault())
                .setHysteresis(outcome);
        if (verdict instanceof PcaVerdict) {
            out.setPca((PcaVerdict) verdict);
        }
        return out;
    }

    public boolean isTrained() {
        return pca.isTrained();
    }

    public void reset() {
        window.reset();
        pca.reset();
        hysteresis.reset();
    }

    public VectorChannelSnapshot snapshot() {
        return new VectorChannelSnapshot(window.timestamps(), window.rows(), (EstimatorState.Pca) pca.getState(),
                new Hysteresis(hysteresis));
    }

    public void restore(VectorChannelSnapshot snapshot) {
        window.restore(snapshot.timestamps, snapshot.rows);
        pca.setState(snapshot.model);
        hysteresis = new Hysteresis(snapshot.hysteresis);
    }
}
