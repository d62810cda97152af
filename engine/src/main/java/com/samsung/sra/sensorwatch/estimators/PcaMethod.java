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

/** Which PCA statistic decides the verdict */
public enum PcaMethod {
    T2("t2"),
    SPE("spe"),
    /** T2 or SPE */
    COMBINED("combined");

    private final String name;

    PcaMethod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static PcaMethod fromName(String name) throws ConfigException {
        for (PcaMethod m : values()) {
            if (m.name.equalsIgnoreCase(name)) {
                return m;
            }
        }
        throw new ConfigException("unknown PCA method " + name);
    }
}
