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

/** Creates scalar estimators by method */
public class Estimators {
    private Estimators() {}

    /**
     * @param modelClient only used by {@link Method#ML}
     * @throws IllegalArgumentException for multivariate methods, which do not judge scalars
     */
    public static Estimator create(Method method, ModelClient modelClient) {
        switch (method) {
            case ZSCORE:
                return new ZScoreEstimator();
            case IQR:
                return new IqrEstimator();
            case THRESHOLD:
                return new ThresholdEstimator();
            case PERCENTILE:
                return new PercentileEstimator();
            case EMA:
                return new EmaEstimator();
            case CUSUM:
                return new CusumEstimator();
            case MOVING_AVERAGE:
                return new MovingAverageEstimator();
            case ML:
                return new ExternalModelEstimator(modelClient);
            default:
                throw new IllegalArgumentException(method + " is not a scalar method");
        }
    }
}
