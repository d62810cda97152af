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

public enum Severity {
    NORMAL("normal"),
    WARNING("warning"),
    CRITICAL("critical"),
    /** Precondition unmet: the window is still too short to judge. Never anomalous. */
    WARMUP("warmup");

    private final String name;

    Severity(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isAnomalous() {
        return this == WARNING || this == CRITICAL;
    }

    /** critical > warning > everything else */
    public static Severity worst(Severity a, Severity b) {
        return a.rank() >= b.rank() ? a : b;
    }

    private int rank() {
        switch (this) {
            case CRITICAL:
                return 2;
            case WARNING:
                return 1;
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
