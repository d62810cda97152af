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
package com.samsung.sra.sensorwatch.persistence;

import com.samsung.sra.sensorwatch.estimators.EstimatorState;
import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;
import com.samsung.sra.sensorwatch.streams.ReliabilityTracker;

import java.io.Serializable;
import java.util.EnumMap;

/** Persisted state of one scalar stream */
public class ChannelSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    public final long[] timestamps;
    public final double[] values;
    public final EnumMap<Method, EstimatorState> estimatorStates;
    public final Hysteresis hysteresis;
    public final ReliabilityTracker reliability;
    /** Signal analysis buffer, both null when signal analysis never ran */
    public final long[] signalTimestamps;
    public final double[] signalValues;

    public ChannelSnapshot(long[] timestamps, double[] values, EnumMap<Method, EstimatorState> estimatorStates,
                           Hysteresis hysteresis, ReliabilityTracker reliability) {
        this(timestamps, values, estimatorStates, hysteresis, reliability, null, null);
    }

    public ChannelSnapshot(long[] timestamps, double[] values, EnumMap<Method, EstimatorState> estimatorStates,
                           Hysteresis hysteresis, ReliabilityTracker reliability,
                           long[] signalTimestamps, double[] signalValues) {
        this.timestamps = timestamps;
        this.values = values;
        this.estimatorStates = estimatorStates;
        this.hysteresis = hysteresis;
        this.reliability = reliability;
        this.signalTimestamps = signalTimestamps;
        this.signalValues = signalValues;
    }
}
