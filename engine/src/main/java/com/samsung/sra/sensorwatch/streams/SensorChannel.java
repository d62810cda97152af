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
import com.samsung.sra.sensorwatch.ExternalRuntimeException;
import com.samsung.sra.sensorwatch.Output;
import com.samsung.sra.sensorwatch.estimators.Estimator;
import com.samsung.sra.sensorwatch.estimators.EstimatorState;
import com.samsung.sra.sensorwatch.estimators.Estimators;
import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.estimators.ModelClient;
import com.samsung.sra.sensorwatch.estimators.Verdict;
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;
import com.samsung.sra.sensorwatch.persistence.ChannelSnapshot;
import com.samsung.sra.sensorwatch.prediction.RulEngine;
import com.samsung.sra.sensorwatch.prediction.TrendPredictor;
import com.samsung.sra.sensorwatch.signal.SignalAnalyzer;
import com.samsung.sra.sensorwatch.window.SlidingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Window, estimators, debounce and reliability of one scalar stream.
 *
 * Estimators are created lazily per method, so a one-shot method override gets its own estimator (with its own
 * state) that lives as long as the stream. Window capacity is fixed at construction; a smaller windowSize in the
 * effective config only narrows the view the estimator sees. The signal analyzer, like the estimators, is created on
 * first use.
 */
public class SensorChannel {
    private static final Logger logger = LoggerFactory.getLogger(SensorChannel.class);

    private final String name;
    private final SlidingWindow window;
    private final EnumMap<Method, Estimator> estimators = new EnumMap<>(Method.class);
    private final ModelClient modelClient;
    private Hysteresis hysteresis = new Hysteresis();
    private ReliabilityTracker reliability = new ReliabilityTracker();
    private SignalAnalyzer signal = null;
    /** Restored signal buffer, replayed into the analyzer once its capacity is known */
    private long[] restoredSignalTimestamps = null;
    private double[] restoredSignalValues = null;

    public SensorChannel(String name, int capacity, ModelClient modelClient) {
        this.name = name;
        this.window = new SlidingWindow(capacity);
        this.modelClient = modelClient;
    }

    /**
     * Judge value with the method of the effective config. Nothing is changed when the external model runtime fails;
     * the returned record then carries the error and is not anomalous.
     */
    public Output ingest(long timestamp, double value, DetectorConfig config) {
        Method method = config.getMethod();
        Estimator estimator = getEstimator(method);
        int view = Math.min(config.getWindowSize(), window.capacity());
        double[] values = viewWith(value, view);

        Verdict verdict;
        int required = estimator.getMinSamples(config);
        if (values.length < required) {
            verdict = Verdict.warmup(values.length, required);
        } else {
            try {
                verdict = estimator.ingest(value, values, config);
            } catch (ExternalRuntimeException e) {
                logger.warn("stream {}: model runtime failed, passing sample through: {}", label(), e.getMessage());
                return new Output()
                        .setPayload(value)
                        .setMethod(method.getName())
                        .setBufferSize(window.size())
                        .setWindowSize(config.getWindowSize())
                        .setTimestamp(timestamp)
                        .setStatusText("external error")
                        .setExternalError(e.getMessage());
            }
        }
        window.push(timestamp, value);

        Hysteresis.Outcome outcome = verdict.isWarmup()
                ? Hysteresis.Outcome.passThrough(verdict, config.isHysteresisEnabled())
                : hysteresis.apply(verdict, config);
        reliability.record(value, outcome.isAnomaly());
        if (verdict.isWarmup()) {
            logger.debug("stream {}: {}", label(), verdict.getStatusText());
        } else {
            logger.debug("stream {}: {} raw {} final {}", label(), value, verdict.getSeverity(), outcome.getSeverity());
        }

        Output out = new Output()
                .setPayload(value)
                .setAnomaly(outcome.isAnomaly())
                .setRawAnomaly(verdict.isAnomaly())
                .setSeverity(outcome.getSeverity())
                .setMethod(verdict.getMethod() != null ? verdict.getMethod() : method.getName())
                .setBufferSize(window.size())
                .setWindowSize(config.getWindowSize())
                .setTimestamp(timestamp)
                .setDetails(verdict.getDetails())
                .setStatusText(verdict.getStatusText())
                .setReason(verdict.getReason())
                .setNumericFault(verdict.isNumericFault())
                .setHysteresis(outcome);
        if (config.isTrendEnabled()) {
            out.setTrend(TrendPredictor.predict(window.values(), window.timestamps(), config));
        }
        if (config.getFailureThreshold() != null) {
            out.setRul(RulEngine.estimate(window.lastValues(view), window.lastTimestamps(view), config));
        }
        if (config.getSignalMode() != null) {
            out.setSignal(getSignalAnalyzer(config).ingest(timestamp, value, config));
        }
        return out;
    }

    /** The newest view - 1 window values followed by value */
    private double[] viewWith(double value, int view) {
        double[] prior = window.lastValues(view - 1);
        double[] ret = new double[prior.length + 1];
        System.arraycopy(prior, 0, ret, 0, prior.length);
        ret[prior.length] = value;
        return ret;
    }

    private Estimator getEstimator(Method method) {
        Estimator e = estimators.get(method);
        if (e == null) {
            estimators.put(method, (e = Estimators.create(method, modelClient)));
        }
        return e;
    }

    private SignalAnalyzer getSignalAnalyzer(DetectorConfig config) {
        if (signal == null) {
            signal = new SignalAnalyzer(SignalAnalyzer.capacityFor(config));
            if (restoredSignalValues != null) {
                signal.restore(restoredSignalTimestamps, restoredSignalValues);
                restoredSignalTimestamps = null;
                restoredSignalValues = null;
            }
        }
        return signal;
    }

    private String label() {
        return name.isEmpty() ? "<scalar>" : name;
    }

    public String getName() {
        return name;
    }

    public SlidingWindow getWindow() {
        return window;
    }

    public Hysteresis getHysteresis() {
        return hysteresis;
    }

    public ReliabilityTracker getReliability() {
        return reliability;
    }

    public void reset() {
        window.reset();
        for (Estimator e : estimators.values()) {
            e.reset();
        }
        hysteresis.reset();
        reliability.reset();
        if (signal != null) {
            signal.reset();
        }
        restoredSignalTimestamps = null;
        restoredSignalValues = null;
    }

    public ChannelSnapshot snapshot() {
        EnumMap<Method, EstimatorState> states = new EnumMap<>(Method.class);
        for (Map.Entry<Method, Estimator> e : estimators.entrySet()) {
            states.put(e.getKey(), e.getValue().getState());
        }
        return new ChannelSnapshot(window.timestamps(), window.values(), states,
                new Hysteresis(hysteresis), new ReliabilityTracker(reliability),
                signal == null ? restoredSignalTimestamps : signal.getBuffer().timestamps(),
                signal == null ? restoredSignalValues : signal.getBuffer().values());
    }

    public void restore(ChannelSnapshot snapshot) {
        window.restore(snapshot.timestamps, snapshot.values);
        estimators.clear();
        for (Map.Entry<Method, EstimatorState> e : snapshot.estimatorStates.entrySet()) {
            getEstimator(e.getKey()).setState(e.getValue());
        }
        hysteresis = new Hysteresis(snapshot.hysteresis);
        reliability = new ReliabilityTracker(snapshot.reliability);
        if ((snapshot.signalTimestamps == null) != (snapshot.signalValues == null)
                || (snapshot.signalValues != null && snapshot.signalValues.length != snapshot.signalTimestamps.length)) {
            throw new IllegalArgumentException("inconsistent signal buffer in snapshot of stream " + label());
        }
        signal = null;
        restoredSignalTimestamps = snapshot.signalTimestamps;
        restoredSignalValues = snapshot.signalValues;
    }
}
