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

import com.samsung.sra.sensorwatch.ConfigException;

/** Range health scores are reported in. Scores are computed on 0-100 and rescaled on output. */
public enum OutputScale {
    PERCENT("0-100", 1),
    UNIT("0-1", 0.01);

    private final String name;
    private final double factor;

    OutputScale(String name, double factor) {
        this.name = name;
        this.factor = factor;
    }

    public String getName() {
        return name;
    }

    public double scale(double score) {
        return score * factor;
    }

    public static OutputScale fromName(String name) throws ConfigException {
        for (OutputScale s : values()) {
            if (s.name.equals(name)) {
                return s;
            }
        }
        throw new ConfigException("unknown output scale " + name + ", expected 0-100 or 0-1");
    }

    @Override
    public String toString() {
        return name;
    }
}
