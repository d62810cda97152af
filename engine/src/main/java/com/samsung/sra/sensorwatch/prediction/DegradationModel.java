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

/** How the RUL engine extrapolates degradation */
public enum DegradationModel {
    LINEAR("linear"),
    /** level and trend from double exponential smoothing */
    EXPONENTIAL("exponential"),
    /** Weibull reliability fitted from the window, linear when that is degenerate */
    WEIBULL("weibull");

    private final String name;

    DegradationModel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static DegradationModel fromName(String name) throws ConfigException {
        for (DegradationModel v : values()) {
            if (v.name.equalsIgnoreCase(name)) {
                return v;
            }
        }
        throw new ConfigException("unknown degradation model " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
