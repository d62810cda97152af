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
import com.samsung.sra.sensorwatch.Output;
import com.samsung.sra.sensorwatch.estimators.ModelClient;
import com.samsung.sra.sensorwatch.estimators.Severity;
import com.samsung.sra.sensorwatch.health.HealthIndexAggregator;
import com.samsung.sra.sensorwatch.health.HealthReport;
import com.samsung.sra.sensorwatch.health.HealthTrendTracker;
import com.samsung.sra.sensorwatch.health.SensorReading;
import com.samsung.sra.sensorwatch.persistence.ChannelSnapshot;
import com.samsung.sra.sensorwatch.prediction.Forecast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans a named multi-sensor sample out to one {@link SensorChannel} per name and folds the per-stream records
 * into one: anomalous if any stream is, with the worst final severity among the anomalous streams. Channels are
 * created on first sight and only dropped by reset().
 */
public class MultiStreamMultiplexer {
    private static final Logger logger = LoggerFactory.getLogger(MultiStreamMultiplexer.class);

    private final LinkedHashMap<String, SensorChannel> channels = new LinkedHashMap<>();
    private final int capacity;
    private final ModelClient modelClient;
    private HealthTrendTracker healthTrend = new HealthTrendTracker();

    public MultiStreamMultiplexer(int capacity, ModelClient modelClient) {
        this.capacity = capacity;
        this.modelClient = modelClient;
    }

    /** @param values non-empty, in the order the sensors appeared in the sample */
    public Output ingest(long timestamp, LinkedHashMap<String, Double> values, DetectorConfig config) {
        LinkedHashMap<String, Output> outputs = new LinkedHashMap<>();
        List<String> anomalySensors = new ArrayList<>();
        List<String> exceeded = new ArrayList<>();
        boolean rawAnomaly = false;
        Severity severity = Severity.NORMAL;
        int bufferSize = 0;
        for (Map.Entry<String, Double> e : values.entrySet()) {
            SensorChannel channel = channels.get(e.getKey());
            if (channel == null) {
                logger.debug("new stream {}", e.getKey());
                channels.put(e.getKey(), (channel = new SensorChannel(e.getKey(), capacity, modelClient)));
            }
            Output out = channel.ingest(timestamp, e.getValue(), config);
            outputs.put(e.getKey(), out);
            rawAnomaly |= out.isRawAnomaly();
            if (out.isAnomaly()) {
                anomalySensors.add(e.getKey());
                severity = Severity.worst(severity, out.getSeverity());
            }
            Forecast trend = out.getTrend();
            if (trend != null && trend.exceedsThreshold()) {
                exceeded.add(e.getKey());
            }
            bufferSize = Math.max(bufferSize, out.getBufferSize());
        }

        Output agg = new Output()
                .setPayload(new LinkedHashMap<>(values))
                .setAnomaly(!anomalySensors.isEmpty())
                .setRawAnomaly(rawAnomaly)
                .setSeverity(severity)
                .setMethod(config.getMethod().getName())
                .setBufferSize(bufferSize)
                .setWindowSize(config.getWindowSize())
                .setTimestamp(timestamp)
                .setStatusText(anomalySensors.isEmpty() ? outputs.size() + " sensors OK"
                        : "ANOMALY: " + String.join(", ", anomalySensors))
                .setStreams(outputs)
                .setAnomalySensors(anomalySensors);
        if (config.isTrendEnabled() && config.getTrendThreshold() != null) {
            agg.setThresholdExceededSensors(exceeded);
        }
        if (config.isHealthEnabled()) {
            HealthReport report = HealthIndexAggregator.aggregate(readings(outputs), config);
            report.setHealthTrend(healthTrend.record(report.getIndex()));
            agg.setHealth(report);
        }
        return agg;
    }

    private List<SensorReading> readings(Map<String, Output> outputs) {
        List<SensorReading> ret = new ArrayList<>();
        for (Map.Entry<String, Output> e : outputs.entrySet()) {
            Output out = e.getValue();
            ReliabilityTracker reliability = channels.get(e.getKey()).getReliability();
            SensorReading r = new SensorReading(e.getKey())
                    .setAnomaly(out.isAnomaly())
                    .setZScore(out.getDetail("zScore"))
                    .setDeviationPercent(out.getDetail("deviationPercent"))
                    .setConfidence(out.getDetail("confidence"))
                    .setAnomalyRate(reliability.getAnomalyRate())
                    .setCoefficientOfVariation(reliability.getCoefficientOfVariation());
            if (out.getTrend() != null) {
                r.setTrend(out.getTrend().getTrend(), out.getTrend().getSlope());
            }
            ret.add(r);
        }
        return ret;
    }

    public SensorChannel getChannel(String name) {
        return channels.get(name);
    }

    public int getStreamCount() {
        return channels.size();
    }

    /** Drop every stream */
    public void reset() {
        channels.clear();
        healthTrend.reset();
    }

    public LinkedHashMap<String, ChannelSnapshot> snapshot() {
        LinkedHashMap<String, ChannelSnapshot> ret = new LinkedHashMap<>();
        for (Map.Entry<String, SensorChannel> e : channels.entrySet()) {
            ret.put(e.getKey(), e.getValue().snapshot());
        }
        return ret;
    }

    public HealthTrendTracker getHealthTrend() {
        return new HealthTrendTracker(healthTrend);
    }

    public void restore(Map<String, ChannelSnapshot> streams, HealthTrendTracker trend) {
        channels.clear();
        for (Map.Entry<String, ChannelSnapshot> e : streams.entrySet()) {
            SensorChannel channel = new SensorChannel(e.getKey(), capacity, modelClient);
            channel.restore(e.getValue());
            channels.put(e.getKey(), channel);
        }
        healthTrend = trend != null ? new HealthTrendTracker(trend) : new HealthTrendTracker();
    }
}
