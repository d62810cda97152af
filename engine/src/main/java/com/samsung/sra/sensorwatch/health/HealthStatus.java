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

/** critical < 20 <= degraded < 40 <= warning < 60 <= attention < 80 <= healthy, on the 0-100 scale */
public enum HealthStatus {
    HEALTHY("healthy", 80),
    ATTENTION("attention", 60),
    WARNING("warning", 40),
    DEGRADED("degraded", 20),
    CRITICAL("critical", Double.NEGATIVE_INFINITY);

    private final String name;
    private final double lowerBound;

    HealthStatus(String name, double lowerBound) {
        this.name = name;
        this.lowerBound = lowerBound;
    }

    public String getName() {
        return name;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static HealthStatus of(double index) {
        for (HealthStatus s : values()) {
            if (index >= s.lowerBound) {
                return s;
            }
        }
        return CRITICAL;
    }

    /** Routed to the anomaly sink */
    public boolean isUnhealthy() {
        return this == WARNING || this == DEGRADED || this == CRITICAL;
    }

    @Override
    public String toString() {
        return name;
    }
}
