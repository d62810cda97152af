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

/** Health classification of a remaining-useful-life estimate */
public enum RulStatus {
    HEALTHY("healthy"),
    /** fewer than 50 mean sample intervals left */
    WARNING("warning"),
    /** fewer than 10 mean sample intervals left */
    CRITICAL("critical"),
    /** already at or above the failure threshold */
    FAILED("failed"),
    /** not degrading; RUL is infinite */
    STABLE("stable");

    private final String name;

    RulStatus(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
