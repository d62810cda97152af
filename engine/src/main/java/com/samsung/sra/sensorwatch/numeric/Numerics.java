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
package com.samsung.sra.sensorwatch.numeric;

import java.util.Arrays;

/**
 * Pure functions over a window's current view. Variances and standard deviations are population statistics
 * (divide by n), matching what the detectors report as mu and sigma.
 */
public class Numerics {
    /** Slopes within +/- this band are reported as a "stable" trend */
    public static final double TREND_EPSILON = 0.01;

    private Numerics() {}

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double variance(double[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double sqsum = 0;
        for (double v : values) {
            sqsum += (v - mean) * (v - mean);
        }
        return sqsum / values.length;
    }

    public static double stdDev(double[] values, double mean) {
        return Math.sqrt(variance(values, mean));
    }

    public static double stdDev(double[] values) {
        return stdDev(values, mean(values));
    }

    /** sigma / |mu|; NaN when the mean is zero (caller decides what a degenerate CV means) */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0) {
            return Double.NaN;
        }
        return stdDev(values, mean) / Math.abs(mean);
    }

    public static double[] sorted(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    /** Sorted-index quartiles: q1 = s[floor(n/4)], q3 = s[floor(3n/4)] */
    public static Quartiles quartiles(double[] values) {
        double[] s = sorted(values);
        int n = s.length;
        double q1 = s[(int) Math.floor(n * 0.25)];
        double q3 = s[(int) Math.floor(n * 0.75)];
        double median = s[(int) Math.floor(n * 0.5)];
        return new Quartiles(q1, q3, median);
    }

    /** Linear interpolation between the closest ranks of an already sorted array, p in [0, 100] */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0;
        }
        double index = (p / 100) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /** Mean gap between consecutive timestamps, 0 with fewer than two */
    public static double meanInterval(long[] timestamps) {
        if (timestamps.length < 2) {
            return 0;
        }
        return (double) (timestamps[timestamps.length - 1] - timestamps[0]) / (timestamps.length - 1);
    }

    public static String trendLabel(double slope) {
        if (slope > TREND_EPSILON) {
            return "increasing";
        } else if (slope < -TREND_EPSILON) {
            return "decreasing";
        } else {
            return "stable";
        }
    }

    public static double clamp(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    public static class Quartiles {
        public final double q1, q3, iqr, median;

        Quartiles(double q1, double q3, double median) {
            this.q1 = q1;
            this.q3 = q3;
            this.iqr = q3 - q1;
            this.median = median;
        }
    }
}
