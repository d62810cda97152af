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
package com.samsung.sra.sensorwatch.health;

/**
 * What the aggregator knows about one sensor for one sample. Every field except the name is optional; absent
 * statistics simply do not deduct.
 */
public class SensorReading {
    private final String name;
    private boolean anomaly = false;
    private Double zScore = null, deviationPercent = null;
    private String trend = null;
    private Double slope = null;
    private Double confidence = null;
    private double anomalyRate = 0;
    private double coefficientOfVariation = Double.NaN;

    public SensorReading(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public SensorReading setAnomaly(boolean anomaly) {
        this.anomaly = anomaly;
        return this;
    }

    public Double getZScore() {
        return zScore;
    }

    public SensorReading setZScore(Double zScore) {
        this.zScore = zScore;
        return this;
    }

    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public SensorReading setDeviationPercent(Double deviationPercent) {
        this.deviationPercent = deviationPercent;
        return this;
    }

    public String getTrend() {
        return trend;
    }

    public Double getSlope() {
        return slope;
    }

    public SensorReading setTrend(String trend, Double slope) {
        this.trend = trend;
        this.slope = slope;
        return this;
    }

    /** Model confidence in [0, 1], null when the detector has no notion of it */
    public Double getConfidence() {
        return confidence;
    }

    public SensorReading setConfidence(Double confidence) {
        this.confidence = confidence;
        return this;
    }

    public double getAnomalyRate() {
        return anomalyRate;
    }

    public SensorReading setAnomalyRate(double anomalyRate) {
        this.anomalyRate = anomalyRate;
        return this;
    }

    /** NaN when unknown */
    public double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    public SensorReading setCoefficientOfVariation(double coefficientOfVariation) {
        this.coefficientOfVariation = coefficientOfVariation;
        return this;
    }
}
