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
package com.samsung.sra.sensorwatch.signal;

import com.samsung.sra.sensorwatch.ConfigException;

/** Taper applied to a frame before the FFT */
public enum WindowFunction {
    HANN("hann") {
        @Override
        public double weight(int i, int n) {
            return 0.5 * (1 - Math.cos(2 * Math.PI * i / (n - 1)));
        }
    },
    HAMMING("hamming") {
        @Override
        public double weight(int i, int n) {
            return 0.54 - 0.46 * Math.cos(2 * Math.PI * i / (n - 1));
        }
    },
    BLACKMAN("blackman") {
        @Override
        public double weight(int i, int n) {
            return 0.42 - 0.5 * Math.cos(2 * Math.PI * i / (n - 1)) + 0.08 * Math.cos(4 * Math.PI * i / (n - 1));
        }
    },
    RECTANGULAR("rectangular") {
        @Override
        public double weight(int i, int n) {
            return 1;
        }
    };

    private final String name;

    WindowFunction(String name) {
        this.name = name;
    }

    /** Weight of sample i in a frame of n samples, n > 1 */
    public abstract double weight(int i, int n);

    /** Tapered copy of frame; a single-sample frame is returned unchanged */
    public double[] apply(double[] frame) {
        double[] ret = frame.clone();
        if (ret.length > 1) {
            for (int i = 0; i < ret.length; ++i) {
                ret[i] *= weight(i, ret.length);
            }
        }
        return ret;
    }

    public String getName() {
        return name;
    }

    public static WindowFunction fromName(String name) throws ConfigException {
        for (WindowFunction v : values()) {
            if (v.name.equalsIgnoreCase(name)) {
                return v;
            }
        }
        throw new ConfigException("unknown window function " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
