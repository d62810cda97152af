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
package com.samsung.sra.sensorwatch;

import java.io.Serializable;

/** One {name, value} record of an ordered multi-sensor sample */
public class NamedValue implements Serializable {
    private final String name;
    private final Object value;

    public NamedValue(String name, Object value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    /** Raw value; numbers and numeric strings are accepted, anything else is skipped */
    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
