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

/** Forecasting model of the trend predictor */
public enum TrendMethod {
    /** least-squares line over the trend window */
    LINEAR("linear"),
    /** Holt double exponential smoothing */
    EXPONENTIAL("exponential");

    private final String name;

    TrendMethod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static TrendMethod fromName(String name) throws ConfigException {
        for (TrendMethod v : values()) {
            if (v.name.equalsIgnoreCase(name)) {
                return v;
            }
        }
        throw new ConfigException("unknown trend method " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
