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
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;

import java.io.Serializable;

/** Persisted state of the PCA stream: window rows plus the trained model */
public class VectorChannelSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    public final long[] timestamps;
    public final double[][] rows;
    public final EstimatorState.Pca model;
    public final Hysteresis hysteresis;

    public VectorChannelSnapshot(long[] timestamps, double[][] rows, EstimatorState.Pca model, Hysteresis hysteresis) {
        this.timestamps = timestamps;
        this.rows = rows;
        this.model = model;
        this.hysteresis = hysteresis;
    }
}
