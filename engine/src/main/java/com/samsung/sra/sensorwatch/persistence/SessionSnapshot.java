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

import com.samsung.sra.sensorwatch.health.HealthTrendTracker;

import java.io.Serializable;
import java.util.LinkedHashMap;

/**
 * Everything a session needs to resume where it left off. Holds plain values only (arrays, scalars, estimator
 * states); config is not part of it and comes from whoever creates the session.
 */
public class SessionSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;
    public static final int VERSION = 1;

    public final int version;
    /** null if the session never saw scalar input */
    public final ChannelSnapshot scalar;
    /** in first-seen order */
    public final LinkedHashMap<String, ChannelSnapshot> streams;
    public final HealthTrendTracker healthTrend;
    /** null if the session never saw vector input */
    public final VectorChannelSnapshot vector;

    public SessionSnapshot(ChannelSnapshot scalar, LinkedHashMap<String, ChannelSnapshot> streams,
                           HealthTrendTracker healthTrend, VectorChannelSnapshot vector) {
        this.version = VERSION;
        this.scalar = scalar;
        this.streams = streams;
        this.healthTrend = healthTrend;
        this.vector = vector;
    }
}
