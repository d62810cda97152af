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

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.numeric.Numerics;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.samsung.sra.sensorwatch.Utilities.fixed;

/**
 * Scores each sensor out of 100 by deducting for anomalies, large z-scores, large percent deviations and rising
 * trends, then aggregates the scores into one index.
 *
 * Dynamic aggregation scales each configured weight by a reliability factor in [0.1, 1]:
 * <ul>
 *     <li>anomaly rate r above 0.3: factor *= max(0, 1 - (r - 0.3) / 0.7)</li>
 *     <li>coefficient of variation cv above 0.5: factor *= max(0.5, 1 - (cv - 0.5))</li>
 *     <li>confidence c present: factor *= c</li>
 * </ul>
 */
public class HealthIndexAggregator {
    private static final Logger logger = LoggerFactory.getLogger(HealthIndexAggregator.class);

    public static final double ANOMALY_PENALTY = 30;
    public static final double HIGH_Z = 3, HIGH_Z_PENALTY = 40, ELEVATED_Z = 2, ELEVATED_Z_PENALTY = 20;
    public static final double HIGH_DEVIATION = 30, HIGH_DEVIATION_PENALTY = 30;
    public static final double MODERATE_DEVIATION = 15, MODERATE_DEVIATION_PENALTY = 15;
    public static final double TREND_PENALTY = 10;
    public static final double LOW_CONFIDENCE = 0.5;

    public static final double MAX_ANOMALY_RATE = 0.3, MAX_CV = 0.5;
    public static final double MIN_FACTOR = 0.1, MIN_CV_FACTOR = 0.5;
    public static final double DEFAULT_WEIGHT = 1.0;

    private HealthIndexAggregator() {}

    /** A sensor without a weight, or with a weight of 0, counts with {@link #DEFAULT_WEIGHT} */
    static double configuredWeight(Map<String, Double> weights, String sensor) {
        Double w = weights.get(sensor);
        return w == null || w == 0 ? DEFAULT_WEIGHT : w;
    }

    public static HealthReport aggregate(List<SensorReading> readings, DetectorConfig config) {
        LinkedHashMap<String, Double> scores = new LinkedHashMap<>();
        List<ContributingFactor> factors = new ArrayList<>();
        for (SensorReading r : readings) {
            scores.put(r.getName(), score(r, factors));
        }

        AggregationMethod method = config.getAggregationMethod();
        Map<String, Double> weights = config.getSensorWeights();
        LinkedHashMap<String, Double> dynamicWeights = null;
        double index;
        switch (method) {
            case WEIGHTED:
            case DYNAMIC: {
                if (method == AggregationMethod.DYNAMIC) {
                    dynamicWeights = new LinkedHashMap<>();
                }
                double weightedSum = 0, totalWeight = 0;
                for (SensorReading r : readings) {
                    double w = configuredWeight(weights, r.getName());
                    if (dynamicWeights != null) {
                        w *= reliabilityFactor(r);
                        dynamicWeights.put(r.getName(), w);
                    }
                    weightedSum += scores.get(r.getName()) * w;
                    totalWeight += w;
                }
                index = totalWeight > 0 ? weightedSum / totalWeight : 100;
                break;
            }
            case MINIMUM: {
                index = 100;
                for (double s : scores.values()) {
                    index = Math.min(index, s);
                }
                break;
            }
            case AVERAGE: {
                double sum = 0;
                for (double s : scores.values()) {
                    sum += s;
                }
                index = scores.isEmpty() ? 100 : sum / scores.size();
                break;
            }
            case GEOMETRIC: {
                double product = 1;
                for (double s : scores.values()) {
                    product *= s;
                }
                index = scores.isEmpty() ? 100 : Math.pow(product, 1.0 / scores.size());
                break;
            }
            default:
                throw new IllegalStateException("unhandled aggregation " + method);
        }

        ImmutablePair<String, Double> worst = null;
        double worstScore = 100;
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            if (e.getValue() < worstScore) {
                worstScore = e.getValue();
                worst = new ImmutablePair<>(e.getKey(), e.getValue());
            }
        }
        logger.debug("health index {} over {} sensors, worst {}", fixed(index, 1), scores.size(), worst);
        return new HealthReport(index, method, config.getOutputScale(), scores, worst, factors, dynamicWeights);
    }

    static double score(SensorReading r, List<ContributingFactor> factors) {
        String name = r.getName();
        double deduction = 0;
        if (r.isAnomaly()) {
            deduction += deduct(factors, name, "anomaly detected", ANOMALY_PENALTY);
        }
        if (r.getZScore() != null) {
            double z = Math.abs(r.getZScore());
            if (z > HIGH_Z) {
                deduction += deduct(factors, name, "high z-score: " + fixed(z, 2), HIGH_Z_PENALTY);
            } else if (z > ELEVATED_Z) {
                deduction += deduct(factors, name, "elevated z-score: " + fixed(z, 2), ELEVATED_Z_PENALTY);
            }
        }
        if (r.getDeviationPercent() != null) {
            double dev = Math.abs(r.getDeviationPercent());
            if (dev > HIGH_DEVIATION) {
                deduction += deduct(factors, name, "high deviation: " + fixed(dev, 1) + "%", HIGH_DEVIATION_PENALTY);
            } else if (dev > MODERATE_DEVIATION) {
                deduction += deduct(factors, name, "moderate deviation: " + fixed(dev, 1) + "%",
                        MODERATE_DEVIATION_PENALTY);
            }
        }
        if ("increasing".equals(r.getTrend()) && r.getSlope() != null && r.getSlope() > 0) {
            deduction += deduct(factors, name, "increasing trend", TREND_PENALTY);
        }
        Double confidence = r.getConfidence();
        if (confidence != null && confidence < LOW_CONFIDENCE && deduction > 0) {
            double refund = deduction * (1 - confidence / LOW_CONFIDENCE) * 0.5;
            factors.add(new ContributingFactor(name, "low confidence: " + fixed(confidence, 2), refund));
            deduction -= refund;
        }
        return Numerics.clamp(100 - deduction, 0, 100);
    }

    private static double deduct(List<ContributingFactor> factors, String sensor, String reason, double penalty) {
        factors.add(new ContributingFactor(sensor, reason, -penalty));
        return penalty;
    }

    public static double reliabilityFactor(SensorReading r) {
        double factor = 1;
        if (r.getAnomalyRate() > MAX_ANOMALY_RATE) {
            factor *= Math.max(0, 1 - (r.getAnomalyRate() - MAX_ANOMALY_RATE) / (1 - MAX_ANOMALY_RATE));
        }
        double cv = r.getCoefficientOfVariation();
        if (!Double.isNaN(cv) && cv > MAX_CV) {
            factor *= Math.max(MIN_CV_FACTOR, 1 - (cv - MAX_CV));
        }
        if (r.getConfidence() != null) {
            factor *= r.getConfidence();
        }
        return Numerics.clamp(factor, MIN_FACTOR, 1);
    }
}
