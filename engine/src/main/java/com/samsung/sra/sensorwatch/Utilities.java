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

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Locale;

public class Utilities {
    private Utilities() {}

    private static final NormalDistribution normalDist = new NormalDistribution(0, 1);

    public static double getNormalQuantile(double P) {
        return normalDist.inverseCumulativeProbability(P);
    }

    /** Whole numbers print without a fractional part ("100", not "100.0") */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    /** Fixed-point formatting independent of the default locale */
    public static String fixed(double d, int digits) {
        return String.format(Locale.ROOT, "%." + digits + "f", d);
    }

    /** Parse a payload that should hold one number. Returns NaN for anything that is not numeric. */
    public static double parseDouble(Object o) {
        if (o instanceof Number) {
            return ((Number) o).doubleValue();
        } else if (o instanceof String) {
            try {
                return Double.parseDouble(((String) o).trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        } else {
            return Double.NaN;
        }
    }
}
