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

import com.samsung.sra.sensorwatch.ConfigException;

/** Detection methods a session can be configured with */
public enum Method {
    ZSCORE("zscore"),
    IQR("iqr"),
    THRESHOLD("threshold"),
    PERCENTILE("percentile"),
    EMA("ema"),
    CUSUM("cusum"),
    MOVING_AVERAGE("moving-average"),
    PCA("pca"),
    /** Delegates to an external model runtime, with z-score as fallback */
    ML("ml");

    private final String name;

    Method(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** Multivariate methods consume a whole named vector per sample instead of one scalar per stream */
    public boolean isMultivariate() {
        return this == PCA;
    }

    public static Method fromName(String name) throws ConfigException {
        if (name == null) {
            throw new ConfigException("expect non-null method name");
        }
        for (Method m : values()) {
            if (m.name.equalsIgnoreCase(name.trim())) {
                return m;
            }
        }
        throw new ConfigException("unknown detection method " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
