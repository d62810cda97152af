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

import com.samsung.sra.sensorwatch.estimators.Contribution;
import com.samsung.sra.sensorwatch.estimators.PcaVerdict;
import com.samsung.sra.sensorwatch.estimators.Severity;
import com.samsung.sra.sensorwatch.health.HealthReport;
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;
import com.samsung.sra.sensorwatch.prediction.Forecast;
import com.samsung.sra.sensorwatch.prediction.RulEstimate;
import com.samsung.sra.sensorwatch.signal.SignalReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record produced for one ingested sample. In multi-sensor mode there is one Output per stream, nested in the
 * aggregated record returned to the caller.
 *
 * Every record goes to exactly one sink: {@link Sink#ANOMALY} when the final (debounced) flag is set or the health
 * report is warning or worse or the signal analysis raised an alert, else {@link Sink#NORMAL}. Warmup records are
 * normal. Neither health nor signal alerts set the anomaly flag.
 */
public class Output {
    public enum Sink {NORMAL, ANOMALY}

    public static final String MULTI_SENSOR = "multi-sensor";

    private Object payload;
    private boolean anomaly = false, rawAnomaly = false;
    private Severity severity = Severity.NORMAL;
    private String method;
    private int bufferSize, windowSize;
    private long timestamp;
    private Map<String, Double> details = Collections.emptyMap();
    private String statusText, reason;
    private boolean numericFault = false;
    private String externalError;
    private Hysteresis.Outcome hysteresis;
    private PcaVerdict pca;
    private Forecast trend;
    private RulEstimate rul;
    private SignalReport signal;

    private LinkedHashMap<String, Output> streams;
    private List<String> anomalySensors, thresholdExceededSensors;
    private HealthReport health;

    private String label, severityHint;

    public Sink getSink() {
        boolean unhealthy = health != null && health.getStatus().isUnhealthy();
        return anomaly || unhealthy || isSignalAlert() ? Sink.ANOMALY : Sink.NORMAL;
    }

    /** Echo of the ingested value: a Double, or for multi-sensor input the map of accepted stream values */
    public Object getPayload() {
        return payload;
    }

    public Output setPayload(Object payload) {
        this.payload = payload;
        return this;
    }

    /** Final, debounced anomaly flag */
    public boolean isAnomaly() {
        return anomaly;
    }

    public Output setAnomaly(boolean anomaly) {
        this.anomaly = anomaly;
        return this;
    }

    public boolean isRawAnomaly() {
        return rawAnomaly;
    }

    public Output setRawAnomaly(boolean rawAnomaly) {
        this.rawAnomaly = rawAnomaly;
        return this;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Output setSeverity(Severity severity) {
        this.severity = severity;
        return this;
    }

    public boolean isWarmup() {
        return severity == Severity.WARMUP;
    }

    public String getMethod() {
        return method;
    }

    public Output setMethod(String method) {
        this.method = method;
        return this;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public Output setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
        return this;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Output setWindowSize(int windowSize) {
        this.windowSize = windowSize;
        return this;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Output setTimestamp(long timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public Map<String, Double> getDetails() {
        return details;
    }

    public Double getDetail(String key) {
        return details.get(key);
    }

    public Output setDetails(Map<String, Double> details) {
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        return this;
    }

    public String getStatusText() {
        return statusText;
    }

    public Output setStatusText(String statusText) {
        this.statusText = statusText;
        return this;
    }

    public String getReason() {
        return reason;
    }

    public Output setReason(String reason) {
        this.reason = reason;
        return this;
    }

    public boolean isNumericFault() {
        return numericFault;
    }

    public Output setNumericFault(boolean numericFault) {
        this.numericFault = numericFault;
        return this;
    }

    /** Message of a failed external model call; such records are never anomalous */
    public String getExternalError() {
        return externalError;
    }

    public Output setExternalError(String externalError) {
        this.externalError = externalError;
        return this;
    }

    public Hysteresis.Outcome getHysteresis() {
        return hysteresis;
    }

    public Output setHysteresis(Hysteresis.Outcome hysteresis) {
        this.hysteresis = hysteresis;
        return this;
    }

    public PcaVerdict getPca() {
        return pca;
    }

    public Output setPca(PcaVerdict pca) {
        this.pca = pca;
        return this;
    }

    public String getTopContributor() {
        return pca == null ? null : pca.getTopContributor();
    }

    public Forecast getTrend() {
        return trend;
    }

    public Output setTrend(Forecast trend) {
        this.trend = trend;
        return this;
    }

    public RulEstimate getRul() {
        return rul;
    }

    public Output setRul(RulEstimate rul) {
        this.rul = rul;
        return this;
    }

    /** Waveform analysis of the stream, null unless a signal mode is configured */
    public SignalReport getSignal() {
        return signal;
    }

    public Output setSignal(SignalReport signal) {
        this.signal = signal;
        return this;
    }

    /** Alert of this record's signal analysis, or of any nested stream's */
    public boolean isSignalAlert() {
        if (signal != null && signal.isAlert()) {
            return true;
        }
        if (streams != null) {
            for (Output o : streams.values()) {
                if (o.isSignalAlert()) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Per-stream records in first-seen order, null unless the input was multi-sensor */
    public Map<String, Output> getStreams() {
        return streams == null ? null : Collections.unmodifiableMap(streams);
    }

    public Output getStream(String name) {
        return streams == null ? null : streams.get(name);
    }

    public Output setStreams(LinkedHashMap<String, Output> streams) {
        this.streams = streams;
        return this;
    }

    public boolean isMultiSensor() {
        return streams != null;
    }

    public int getSensorCount() {
        return streams == null ? 0 : streams.size();
    }

    public List<String> getAnomalySensors() {
        return anomalySensors;
    }

    public Output setAnomalySensors(List<String> anomalySensors) {
        this.anomalySensors = Collections.unmodifiableList(anomalySensors);
        return this;
    }

    public List<String> getThresholdExceededSensors() {
        return thresholdExceededSensors;
    }

    public Output setThresholdExceededSensors(List<String> thresholdExceededSensors) {
        this.thresholdExceededSensors = Collections.unmodifiableList(thresholdExceededSensors);
        return this;
    }

    public HealthReport getHealth() {
        return health;
    }

    public Output setHealth(HealthReport health) {
        this.health = health;
        return this;
    }

    public String getLabel() {
        return label;
    }

    public Output setLabel(String label) {
        this.label = label;
        return this;
    }

    public String getSeverityHint() {
        return severityHint;
    }

    public Output setSeverityHint(String severityHint) {
        this.severityHint = severityHint;
        return this;
    }

    /**
     * Loosely typed view of the record, field names as used on the wire. With a health report the payload becomes
     * the health index and the per-stream records move to "sensors".
     */
    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        Object payloadOut = payload;
        Map<String, Object> streamMaps = null;
        if (streams != null) {
            streamMaps = new LinkedHashMap<>();
            for (Map.Entry<String, Output> e : streams.entrySet()) {
                streamMaps.put(e.getKey(), e.getValue().toMap());
            }
            payloadOut = streamMaps;
        }
        if (health != null) {
            payloadOut = health.getScaledIndex();
        }
        ret.put("payload", payloadOut);
        ret.put("isAnomaly", anomaly);
        ret.put("rawAnomaly", rawAnomaly);
        ret.put("severity", severity.getName());
        ret.put("method", method);
        ret.put("bufferSize", bufferSize);
        ret.put("windowSize", windowSize);
        ret.put("timestamp", timestamp);
        if (statusText != null) {
            ret.put("statusText", statusText);
        }
        if (!details.isEmpty()) {
            ret.put("details", new LinkedHashMap<>(details));
        }
        if (reason != null) {
            ret.put("reason", reason);
        }
        if (numericFault) {
            ret.put("numericFault", true);
        }
        if (externalError != null) {
            ret.put("externalError", externalError);
        }
        if (hysteresis != null) {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("enabled", hysteresis.isEnabled());
            h.put("applied", hysteresis.isApplied());
            h.put("consecutiveAnomalies", hysteresis.getConsecutiveAnomalies());
            h.put("consecutiveNormals", hysteresis.getConsecutiveNormals());
            ret.put("hysteresis", h);
        }
        if (pca != null) {
            ret.put("pca", new LinkedHashMap<>(pca.getDetails()));
            if (!pca.getContributions().isEmpty()) {
                ret.put("contributions", contributionMaps(pca.getContributions()));
            }
            if (anomaly) {
                ret.put("allContributions", contributionMaps(pca.getAllContributions()));
            }
            ret.put("topContributor", pca.getTopContributor());
            ret.put("sensorNames", pca.getSensorNames());
        }
        if (trend != null) {
            ret.put("trend", trend.toMap());
        }
        if (rul != null) {
            ret.put("rul", rul.toMap());
        }
        if (signal != null) {
            ret.put("signal", signal.toMap());
        }
        if (streams != null) {
            if (health != null) {
                ret.put("sensors", streamMaps);
            }
            ret.put("anomalySensors", anomalySensors);
            ret.put("sensorCount", streams.size());
            ret.put("inputFormat", MULTI_SENSOR);
            if (thresholdExceededSensors != null) {
                ret.put("thresholdExceededSensors", thresholdExceededSensors);
            }
        }
        if (health != null) {
            ret.putAll(health.toMap());
        }
        if (label != null) {
            ret.put("label", label);
        }
        if (severityHint != null) {
            ret.put("severityHint", severityHint);
        }
        return ret;
    }

    private static List<Map<String, Object>> contributionMaps(List<Contribution> contributions) {
        List<Map<String, Object>> ret = new ArrayList<>();
        for (Contribution c : contributions) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("sensor", c.getSensor());
            m.put("contribution", c.getContribution());
            m.put("normalizedContribution", c.getNormalizedContribution());
            m.put("percentContribution", c.getPercentContribution());
            m.put("originalValue", c.getOriginalValue());
            m.put("reconstructedValue", c.getReconstructedValue());
            ret.add(m);
        }
        return ret;
    }

    @Override
    public String toString() {
        return String.format("<output: %s %s %s>", severity, anomaly ? "ANOMALY" : "normal",
                statusText != null ? statusText : payload);
    }
}
