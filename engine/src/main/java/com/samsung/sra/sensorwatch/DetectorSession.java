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

import com.samsung.sra.sensorwatch.estimators.ModelClient;
import com.samsung.sra.sensorwatch.estimators.ModelRuntime;
import com.samsung.sra.sensorwatch.persistence.SessionSnapshot;
import com.samsung.sra.sensorwatch.persistence.StateCodec;
import com.samsung.sra.sensorwatch.persistence.StateStore;
import com.samsung.sra.sensorwatch.persistence.StateStoreException;
import com.samsung.sra.sensorwatch.streams.MultiStreamMultiplexer;
import com.samsung.sra.sensorwatch.streams.SensorChannel;
import com.samsung.sra.sensorwatch.streams.VectorChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * A detector instance: takes samples one at a time, routes them by shape (scalar, named multi-sensor map, or
 * vector for PCA) and delivers each output to exactly one sink of the installed {@link OutputListener}.
 *
 * Not thread-safe; callers ingest serially. Window capacity is fixed by the window size of the config the session
 * was created with.
 */
public class DetectorSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DetectorSession.class);

    private final DetectorConfig config;
    private final LongSupplier clock;
    private final ModelClient modelClient;
    private final StateStore store;
    private final String storeKey;

    private SensorChannel scalar = null;
    private VectorChannel vector = null;
    private final MultiStreamMultiplexer streams;

    /** overrides installed by updateConfig, consumed by the next ingest */
    private ConfigOverrides pending = null;
    private OutputListener listener = null;
    private DetectorStatus status = DetectorStatus.waiting();
    private boolean corruptStateLogged = false;
    private boolean closed = false;

    public DetectorSession(DetectorConfig config) throws ConfigException {
        this(config, null);
    }

    public DetectorSession(DetectorConfig config, ModelRuntime runtime) throws ConfigException {
        this(config, System::currentTimeMillis, runtime);
    }

    public DetectorSession(DetectorConfig config, LongSupplier clock, ModelRuntime runtime) throws ConfigException {
        this.config = new DetectorConfig(config).validate();
        this.clock = clock;
        this.modelClient = new ModelClient(runtime);
        this.store = null;
        this.storeKey = null;
        this.streams = new MultiStreamMultiplexer(this.config.getWindowSize(), modelClient);
        logger.info("created {} session, window size {}", this.config.getMethod().getName(), this.config.getWindowSize());
    }

    /**
     * Session backed by a state store: state saved under key is restored now and saved again on close().
     * @throws StateStoreException if the store cannot be read
     */
    public DetectorSession(DetectorConfig config, LongSupplier clock, ModelRuntime runtime, StateStore store,
                           String key) throws ConfigException, StateStoreException {
        this.config = new DetectorConfig(config).validate();
        this.clock = clock;
        this.modelClient = new ModelClient(runtime);
        this.store = store;
        this.storeKey = key;
        this.streams = new MultiStreamMultiplexer(this.config.getWindowSize(), modelClient);
        logger.info("created {} session {}, window size {}",
                this.config.getMethod().getName(), key, this.config.getWindowSize());
        byte[] saved = store.get(key);
        if (saved != null) {
            loadState(saved);
        }
    }

    public void setListener(OutputListener listener) {
        this.listener = listener;
    }

    public DetectorConfig getConfig() {
        return new DetectorConfig(config);
    }

    public DetectorStatus getStatus() {
        return status;
    }

    /** Install overrides for the next ingested sample only. Overrides carried by that sample take precedence. */
    public void updateConfig(ConfigOverrides overrides) {
        this.pending = overrides;
    }

    /**
     * Judge one sample. A reset sample clears all state and returns null. On error nothing is delivered to the
     * listener, the status turns to the error indicator and the exception propagates.
     * @throws InvalidInputException on a payload that is not a number, or has no numeric stream, or does not fit PCA
     * @throws NumericFaultException on an infinite value
     * @throws ConfigException if the one-shot overrides produce an invalid config
     */
    public Output ingest(Sample sample) throws DetectorException {
        if (closed) {
            throw new IllegalStateException("session is closed");
        }
        if (sample.isReset()) {
            reset();
            return null;
        }
        Output output;
        try {
            DetectorConfig effective = effectiveConfig(sample.getOverrides());
            long timestamp = sample.getTimestamp() != null ? sample.getTimestamp() : clock.getAsLong();
            output = route(sample.getPayload(), timestamp, effective);
        } catch (DetectorException e) {
            status = DetectorStatus.error(e.getMessage());
            logger.debug("rejected {}: {}", sample, e.getMessage());
            throw e;
        }
        output.setLabel(sample.getLabel()).setSeverityHint(sample.getSeverity());
        status = DetectorStatus.of(output);
        if (output.isAnomaly()) {
            logger.debug("anomaly at {}: {} {}", output.getTimestamp(), output.getSeverity(), output.getStatusText());
        }
        if (listener != null) {
            if (output.getSink() == Output.Sink.ANOMALY) {
                listener.onAnomaly(output);
            } else {
                listener.onNormal(output);
            }
        }
        return output;
    }

    private DetectorConfig effectiveConfig(ConfigOverrides sampleOverrides) throws ConfigException {
        ConfigOverrides overrides = pending;
        pending = null;
        if (sampleOverrides != null) {
            overrides = overrides == null ? sampleOverrides : overrides.merge(sampleOverrides);
        }
        return overrides == null ? config : overrides.applyTo(config);
    }

    private Output route(Object payload, long timestamp, DetectorConfig effective) throws DetectorException {
        if (payload instanceof Map || payload instanceof List) {
            LinkedHashMap<String, Object> named = toNamed(payload);
            if (effective.getMethod().isMultivariate()) {
                return ingestVector(named, timestamp, effective);
            }
            LinkedHashMap<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : named.entrySet()) {
                double v = Utilities.parseDouble(e.getValue());
                if (Double.isFinite(v)) {
                    values.put(e.getKey(), v);
                } else {
                    logger.debug("skipping non-numeric value {} of stream {}", e.getValue(), e.getKey());
                }
            }
            if (values.isEmpty()) {
                throw new InvalidInputException("no numeric sensor values in " + payload);
            }
            return streams.ingest(timestamp, values, effective);
        }
        if (effective.getMethod().isMultivariate()) {
            throw new InvalidInputException(effective.getMethod().getName()
                    + " needs several named sensor values, got a single value " + payload);
        }
        double value = parseScalar(payload);
        if (scalar == null) {
            scalar = new SensorChannel("", config.getWindowSize(), modelClient);
        }
        return scalar.ingest(timestamp, value, effective);
    }

    private Output ingestVector(LinkedHashMap<String, Object> named, long timestamp, DetectorConfig effective)
            throws DetectorException {
        double[] values = new double[named.size()];
        String[] names = new String[named.size()];
        int i = 0;
        for (Map.Entry<String, Object> e : named.entrySet()) {
            names[i] = e.getKey();
            values[i] = parseScalar(e.getValue());
            ++i;
        }
        if (vector == null) {
            vector = new VectorChannel(config.getWindowSize());
        }
        return vector.ingest(timestamp, values, names, effective);
    }

    /** Map payloads keep their keys; lists hold either NamedValues or bare numbers named sensor0, sensor1, ... */
    private static LinkedHashMap<String, Object> toNamed(Object payload) throws InvalidInputException {
        LinkedHashMap<String, Object> named = new LinkedHashMap<>();
        if (payload instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) payload).entrySet()) {
                named.put(String.valueOf(e.getKey()), e.getValue());
            }
        } else {
            List<?> list = (List<?>) payload;
            for (int i = 0; i < list.size(); ++i) {
                Object o = list.get(i);
                if (o instanceof NamedValue) {
                    named.put(((NamedValue) o).getName(), ((NamedValue) o).getValue());
                } else if (o instanceof Number || o instanceof String) {
                    named.put("sensor" + i, o);
                } else {
                    throw new InvalidInputException("unsupported element " + o + " in multi-sensor sample");
                }
            }
        }
        if (named.isEmpty()) {
            throw new InvalidInputException("empty multi-sensor sample");
        }
        return named;
    }

    private static double parseScalar(Object payload) throws DetectorException {
        double value = Utilities.parseDouble(payload);
        if (Double.isNaN(value)) {
            throw new InvalidInputException("not a number: " + payload);
        }
        if (Double.isInfinite(value)) {
            throw new NumericFaultException("non-finite value " + payload);
        }
        return value;
    }

    /** Discard every window, estimator, debounce and reliability state. Calling it twice equals calling it once. */
    public void reset() {
        scalar = null;
        vector = null;
        streams.reset();
        pending = null;
        status = DetectorStatus.reset();
        logger.debug("session reset");
    }

    public byte[] saveState() {
        return StateCodec.encode(new SessionSnapshot(
                scalar != null ? scalar.snapshot() : null,
                streams.snapshot(),
                streams.getHealthTrend(),
                vector != null ? vector.snapshot() : null));
    }

    /**
     * Replace all state by a blob from {@link #saveState()}. An undecodable blob resets the session instead; that is
     * logged once per session.
     * @return whether the blob was restored
     */
    public boolean loadState(byte[] blob) {
        reset();
        try {
            SessionSnapshot snapshot = StateCodec.decode(blob);
            if (snapshot.scalar != null) {
                scalar = new SensorChannel("", config.getWindowSize(), modelClient);
                scalar.restore(snapshot.scalar);
            }
            if (snapshot.vector != null) {
                vector = new VectorChannel(config.getWindowSize());
                vector.restore(snapshot.vector);
            }
            streams.restore(snapshot.streams, snapshot.healthTrend);
        } catch (StateStoreException | RuntimeException e) {
            if (!corruptStateLogged) {
                logger.warn("discarding unreadable saved state", e);
                corruptStateLogged = true;
            }
            reset();
            return false;
        }
        status = DetectorStatus.waiting();
        logger.info("restored state: {} streams{}{}", streams.getStreamCount(),
                scalar != null ? ", scalar" : "", vector != null ? ", vector" : "");
        return true;
    }

    public int getStreamCount() {
        return streams.getStreamCount();
    }

    /**
     * Save state to the store (if any), then shut down the model runtime, waiting up to the configured grace period
     * for an outstanding call. Only the first call has any effect.
     */
    @Override
    public void close() throws DetectorException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (store != null) {
                store.put(storeKey, saveState());
                logger.info("saved state of session {}", storeKey);
            }
        } catch (StateStoreException e) {
            throw new DetectorException("failed to save state of session " + storeKey, e);
        } finally {
            modelClient.close(config.getShutdownGraceMs());
        }
    }
}
