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
package com.samsung.sra.sensorwatch.prediction;

import com.samsung.sra.sensorwatch.ConfigException;

/** Unit RUL values are reported in. Cycles count mean sample intervals. */
public enum RulUnit {
    MINUTES("minutes", 60_000),
    HOURS("hours", 3_600_000),
    DAYS("days", 86_400_000),
    CYCLES("cycles", 0);

    private final String name;
    private final long millis;

    RulUnit(String name, long millis) {
        this.name = name;
        this.millis = millis;
    }

    public String getName() {
        return name;
    }

    /** Convert a duration in ms; meanIntervalMs is only used for cycles */
    public double fromMillis(double ms, double meanIntervalMs) {
        if (this == CYCLES) {
            return meanIntervalMs > 0 ? ms / meanIntervalMs : ms;
        }
        return ms / millis;
    }

    public static RulUnit fromName(String name) throws ConfigException {
        for (RulUnit u : values()) {
            if (u.name.equalsIgnoreCase(name)) {
                return u;
            }
        }
        throw new ConfigException("unknown RUL unit " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
