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

import java.util.concurrent.CompletableFuture;

/**
 * Bridge to an external inference runtime. The engine never inspects models; it only asks for a prediction on a
 * vector and treats the answer as a reconstruction of that vector. Implementations may complete futures on any
 * thread.
 */
public interface ModelRuntime {
    CompletableFuture<Void> loadModel(String path, String modelId);

    CompletableFuture<double[]> predict(String modelId, double[] input);

    CompletableFuture<Void> unloadModel(String modelId);

    /** false when the runtime cannot serve requests at all; callers then fall back to statistical detection */
    boolean isHealthy();
}
