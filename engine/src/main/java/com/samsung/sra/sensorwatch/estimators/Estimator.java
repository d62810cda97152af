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

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.ExternalRuntimeException;

/**
 * One detection method applied to one scalar stream. We keep one Estimator instance per (stream, method) pair.
 *
 * Parameters are read from the config handed to each ingest() call rather than captured at construction, so that
 * one-shot overrides take effect for exactly one sample. The window passed in already contains the value under
 * test as its last element.
 */
public interface Estimator {
    Method getMethod();

    /** Window length below which ingest() must not be called; callers emit a warmup verdict instead */
    int getMinSamples(DetectorConfig config);

    Verdict ingest(double value, double[] window, DetectorConfig config) throws ExternalRuntimeException;

    /** Snapshot of the cross-sample state; callers may keep it after further ingests */
    EstimatorState getState();

    void setState(EstimatorState state);

    /** Return to the initial state. Never fails. */
    void reset();
}
