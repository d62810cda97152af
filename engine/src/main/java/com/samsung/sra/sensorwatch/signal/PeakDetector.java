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

import java.util.ArrayList;
import java.util.List;

/**
 * Finds strict local extrema of a window. Only interior samples qualify. With a minimum height, a positive peak
 * must reach it and a negative peak must reach its negation. Peaks closer than minDistance samples to the
 * previously accepted peak are dropped, scanning oldest first.
 */
public class PeakDetector {
    private PeakDetector() {}

    /** @param minHeight null to accept extrema of any height */
    public static PeakReport detect(double[] values, long[] timestamps, Double minHeight, int minDistance,
                                    PeakType type) {
        if (values.length != timestamps.length) {
            throw new IllegalArgumentException("values and timestamps differ in length");
        }
        List<PeakReport.Peak> peaks = new ArrayList<>();
        int lastPeak = -minDistance;
        for (int i = 1; i < values.length - 1; ++i) {
            double cur = values[i], prev = values[i - 1], next = values[i + 1];
            Boolean positive = null;
            if (type.includesPositive() && cur > prev && cur > next && (minHeight == null || cur >= minHeight)) {
                positive = true;
            } else if (type.includesNegative() && cur < prev && cur < next && (minHeight == null || cur <= -minHeight)) {
                positive = false;
            }
            if (positive != null && i - lastPeak >= minDistance) {
                peaks.add(new PeakReport.Peak(i, cur, timestamps[i], positive));
                lastPeak = i;
            }
        }
        return new PeakReport(peaks, values.length);
    }
}
