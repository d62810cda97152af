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

import java.io.Serializable;
import java.util.Arrays;

/**
 * Cross-sample state of an estimator. Only the owning estimator mutates it, on ingest; reset() puts it back to the
 * initial value. The concrete classes are plain field holders so they can be exported to and imported from a
 * persisted session snapshot.
 */
public abstract class EstimatorState implements Serializable {
    private static final long serialVersionUID = 1L;

    public abstract EstimatorState copy();

    /** Stateless estimators (z-score, IQR, threshold, percentile, moving average) */
    public static final class NoState extends EstimatorState {
        private static final long serialVersionUID = 1L;
        public static final NoState INSTANCE = new NoState();

        private NoState() {}

        @Override
        public EstimatorState copy() {
            return this;
        }

        private Object readResolve() {
            return INSTANCE;
        }
    }

    public static final class Ema extends EstimatorState {
        private static final long serialVersionUID = 1L;
        public double ema = 0;
        public boolean initialized = false;

        @Override
        public Ema copy() {
            Ema ret = new Ema();
            ret.ema = ema;
            ret.initialized = initialized;
            return ret;
        }
    }

    /** pos and neg are never negative */
    public static final class Cusum extends EstimatorState {
        private static final long serialVersionUID = 1L;
        public double pos = 0, neg = 0;

        @Override
        public Cusum copy() {
            Cusum ret = new Cusum();
            ret.pos = pos;
            ret.neg = neg;
            return ret;
        }
    }

    /** Trained PCA artifacts. mean == null means "not trained yet". */
    public static final class Pca extends EstimatorState {
        private static final long serialVersionUID = 1L;
        public double[] mean, stdDev;
        /** sorted descending */
        public double[] eigenvalues;
        /** eigenvectors[i] belongs to eigenvalues[i] */
        public double[][] eigenvectors;
        public int nComponents;
        public double t2Threshold, speThreshold;

        public boolean isTrained() {
            return mean != null;
        }

        @Override
        public Pca copy() {
            Pca ret = new Pca();
            if (mean != null) {
                ret.mean = Arrays.copyOf(mean, mean.length);
                ret.stdDev = Arrays.copyOf(stdDev, stdDev.length);
                ret.eigenvalues = Arrays.copyOf(eigenvalues, eigenvalues.length);
                ret.eigenvectors = new double[eigenvectors.length][];
                for (int i = 0; i < eigenvectors.length; ++i) {
                    ret.eigenvectors[i] = Arrays.copyOf(eigenvectors[i], eigenvectors[i].length);
                }
            }
            ret.nComponents = nComponents;
            ret.t2Threshold = t2Threshold;
            ret.speThreshold = speThreshold;
            return ret;
        }
    }
}
