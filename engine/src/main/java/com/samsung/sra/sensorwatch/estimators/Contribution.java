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

import java.io.Serializable;
import java.util.Locale;

/** Share of one feature in a PCA reconstruction error */
public class Contribution implements Serializable {
    private final String sensor;
    private final double contribution, normalizedContribution;
    private final double originalValue, reconstructedValue;

    public Contribution(String sensor, double contribution, double normalizedContribution,
                        double originalValue, double reconstructedValue) {
        this.sensor = sensor;
        this.contribution = contribution;
        this.normalizedContribution = normalizedContribution;
        this.originalValue = originalValue;
        this.reconstructedValue = reconstructedValue;
    }

    public String getSensor() {
        return sensor;
    }

    /** |x_j - xhat_j| in standardized units */
    public double getContribution() {
        return contribution;
    }

    /** contribution / sum of all contributions; the normalized values of one sample sum to 1 (or are all 0) */
    public double getNormalizedContribution() {
        return normalizedContribution;
    }

    public double getOriginalValue() {
        return originalValue;
    }

    /** Reconstruction mapped back to the sensor's own units */
    public double getReconstructedValue() {
        return reconstructedValue;
    }

    public String getPercentContribution() {
        return String.format(Locale.ROOT, "%.1f%%", normalizedContribution * 100);
    }

    @Override
    public String toString() {
        return sensor + "=" + getPercentContribution();
    }
}
