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

import org.apache.commons.lang3.tuple.ImmutablePair;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregated health of all sensors for one sample. Scores are held on 0-100; toMap() applies the output scale. */
public class HealthReport implements Serializable {
    private final double index;
    private final HealthStatus status;
    private final AggregationMethod method;
    private final OutputScale scale;
    private final LinkedHashMap<String, Double> sensorScores;
    private final ImmutablePair<String, Double> worstSensor;
    private final List<ContributingFactor> contributingFactors;
    private final LinkedHashMap<String, Double> dynamicWeights;
    private String healthTrend = null;

    HealthReport(double index, AggregationMethod method, OutputScale scale, LinkedHashMap<String, Double> sensorScores,
                 ImmutablePair<String, Double> worstSensor, List<ContributingFactor> contributingFactors,
                 LinkedHashMap<String, Double> dynamicWeights) {
        this.index = index;
        this.status = HealthStatus.of(index);
        this.method = method;
        this.scale = scale;
        this.sensorScores = sensorScores;
        this.worstSensor = worstSensor;
        this.contributingFactors = contributingFactors;
        this.dynamicWeights = dynamicWeights;
    }

    /** 0-100 regardless of the output scale */
    public double getIndex() {
        return index;
    }

    public double getScaledIndex() {
        return scale.scale(index);
    }

    public HealthStatus getStatus() {
        return status;
    }

    public AggregationMethod getMethod() {
        return method;
    }

    public Map<String, Double> getSensorScores() {
        return Collections.unmodifiableMap(sensorScores);
    }

    /** (name, 0-100 score) of the lowest-scoring sensor; null while every sensor is at 100 */
    public ImmutablePair<String, Double> getWorstSensor() {
        return worstSensor;
    }

    public List<ContributingFactor> getContributingFactors() {
        return Collections.unmodifiableList(contributingFactors);
    }

    /** Effective weights, only for dynamic aggregation */
    public Map<String, Double> getDynamicWeights() {
        return dynamicWeights == null ? null : Collections.unmodifiableMap(dynamicWeights);
    }

    public String getHealthTrend() {
        return healthTrend;
    }

    public void setHealthTrend(String healthTrend) {
        this.healthTrend = healthTrend;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("healthIndex", scale.scale(index));
        ret.put("status", status.getName());
        ret.put("scale", scale.getName());
        ret.put("aggregationMethod", method.getName());
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : sensorScores.entrySet()) {
            scores.put(e.getKey(), scale.scale(e.getValue()));
        }
        ret.put("sensorScores", scores);
        if (worstSensor != null) {
            Map<String, Object> worst = new LinkedHashMap<>();
            worst.put("name", worstSensor.getLeft());
            worst.put("score", scale.scale(worstSensor.getRight()));
            ret.put("worstSensor", worst);
        } else {
            ret.put("worstSensor", null);
        }
        List<Map<String, Object>> factors = new ArrayList<>();
        for (ContributingFactor f : contributingFactors) {
            factors.add(f.toMap());
        }
        ret.put("contributingFactors", factors);
        if (healthTrend != null) {
            ret.put("healthTrend", healthTrend);
        }
        if (dynamicWeights != null) {
            ret.put("dynamicWeights", new LinkedHashMap<>(dynamicWeights));
        }
        return ret;
    }
}
