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
package com.samsung.sra.sensorwatch.signal;

import com.samsung.sra.sensorwatch.ConfigException;

/** Which local extrema the peak detector reports */
public enum PeakType {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    BOTH("both");

    private final String name;

    PeakType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    boolean includesPositive() {
        return this != NEGATIVE;
    }

    boolean includesNegative() {
        return this != POSITIVE;
    }

    public static PeakType fromName(String name) throws ConfigException {
        for (PeakType v : values()) {
            if (v.name.equalsIgnoreCase(name)) {
                return v;
            }
        }
        throw new ConfigException("unknown peak type " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
