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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One input to a detector session: a scalar, a name -> value map, an ordered list of {@link NamedValue}s, or a
 * reset command. The payload is kept as given and only interpreted by the session, which is where malformed input
 * is reported.
 */
public class Sample {
    private final Object payload;
    private final boolean reset;
    private Long timestamp = null;
    private ConfigOverrides overrides = null;
    private String label = null, severity = null;

    private Sample(Object payload, boolean reset) {
        this.payload = payload;
        this.reset = reset;
    }

    public static Sample of(double value) {
        return new Sample(value, false);
    }

    /** Scalar given as a string (or any other object) that still has to be parsed */
    public static Sample ofRaw(Object payload) {
        return new Sample(payload, false);
    }

    public static Sample of(Map<String, ?> values) {
        return new Sample(Collections.unmodifiableMap(new LinkedHashMap<>(values)), false);
    }

    public static Sample of(List<NamedValue> values) {
        return new Sample(Collections.unmodifiableList(new ArrayList<>(values)), false);
    }

    /** Unnamed vector; sensors are named sensor0, sensor1, ... */
    public static Sample ofVector(double... values) {
        List<Double> list = new ArrayList<>();
        for (double v : values) {
            list.add(v);
        }
        return new Sample(Collections.unmodifiableList(list), false);
    }

    /** Discard all session state */
    public static Sample reset() {
        return new Sample(null, true);
    }

    public Sample withTimestamp(long timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    /** Overrides that apply to this sample only */
    public Sample withConfig(ConfigOverrides overrides) {
        this.overrides = overrides;
        return this;
    }

    public Sample withLabel(String label) {
        this.label = label;
        return this;
    }

    /** Caller-supplied severity hint; echoed, never used for detection */
    public Sample withSeverity(String severity) {
        this.severity = severity;
        return this;
    }

    public Object getPayload() {
        return payload;
    }

    public boolean isReset() {
        return reset;
    }

    /** null means "use the session clock" */
    public Long getTimestamp() {
        return timestamp;
    }

    public ConfigOverrides getOverrides() {
        return overrides;
    }

    public String getLabel() {
        return label;
    }

    public String getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return reset ? "<sample: reset>" : "<sample: " + payload + " @ " + timestamp + ">";
    }
}
