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

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/** One deduction from a sensor's score */
public class ContributingFactor implements Serializable {
    private final String sensor, reason;
    private final double impact;

    public ContributingFactor(String sensor, String reason, double impact) {
        this.sensor = sensor;
        this.reason = reason;
        this.impact = impact;
    }

    public String getSensor() {
        return sensor;
    }

    public String getReason() {
        return reason;
    }

    /** Negative for deductions, positive for the low-confidence refund */
    public double getImpact() {
        return impact;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("sensor", sensor);
        ret.put("reason", reason);
        ret.put("impact", impact);
        return ret;
    }

    @Override
    public String toString() {
        return sensor + ": " + reason + " (" + impact + ")";
    }
}
