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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Peaks found in a signal window and summary statistics over their absolute heights */
public class PeakReport implements Serializable {
    /** A local extremum of the window */
    public static class Peak implements Serializable {
        private final int index;
        private final double value;
        private final long timestamp;
        private final boolean positive;

        Peak(int index, double value, long timestamp, boolean positive) {
            this.index = index;
            this.value = value;
            this.timestamp = timestamp;
            this.positive = positive;
        }

        /** Position in the window, oldest sample is 0 */
        public int getIndex() {
            return index;
        }

        public double getValue() {
            return value;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public boolean isPositive() {
            return positive;
        }

        public String getDirection() {
            return positive ? "positive" : "negative";
        }

        Map<String, Object> toMap() {
            Map<String, Object> ret = new LinkedHashMap<>();
            ret.put("index", index);
            ret.put("value", value);
            ret.put("timestamp", timestamp);
            ret.put("direction", getDirection());
            return ret;
        }
    }

    private final List<Peak> peaks;
    private final int windowSize;
    private final boolean newestConfirmedPeak;

    PeakReport(List<Peak> peaks, int windowSize) {
        this.peaks = Collections.unmodifiableList(peaks);
        this.windowSize = windowSize;
        boolean newest = false;
        for (Peak p : peaks) {
            newest |= p.index == windowSize - 2;
        }
        this.newestConfirmedPeak = newest;
    }

    /** Peaks in window order */
    public List<Peak> getPeaks() {
        return peaks;
    }

    public int getPeakCount() {
        return peaks.size();
    }

    /**
     * Whether the sample before the newest one is a peak. A sample is confirmed as a peak only once its right
     * neighbour has arrived, so this is the most recent sample that can be one.
     */
    public boolean isPeak() {
        return newestConfirmedPeak;
    }

    public Double getAveragePeakHeight() {
        if (peaks.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (Peak p : peaks) {
            sum += Math.abs(p.value);
        }
        return sum / peaks.size();
    }

    public Double getMaxPeakHeight() {
        if (peaks.isEmpty()) {
            return null;
        }
        double ret = 0;
        for (Peak p : peaks) {
            ret = Math.max(ret, Math.abs(p.value));
        }
        return ret;
    }

    public Double getMinPeakHeight() {
        if (peaks.isEmpty()) {
            return null;
        }
        double ret = Double.POSITIVE_INFINITY;
        for (Peak p : peaks) {
            ret = Math.min(ret, Math.abs(p.value));
        }
        return ret;
    }

    /** Peaks per sample */
    public double getPeakFrequency() {
        return windowSize == 0 ? 0 : (double) peaks.size() / windowSize;
    }

    /** Mean gap between consecutive peaks in ms, null with fewer than two peaks */
    public Double getAverageTimeBetweenPeaks() {
        if (peaks.size() < 2) {
            return null;
        }
        return (double) (peaks.get(peaks.size() - 1).timestamp - peaks.get(0).timestamp) / (peaks.size() - 1);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("isPeak", newestConfirmedPeak);
        List<Map<String, Object>> peakMaps = new ArrayList<>();
        for (Peak p : peaks) {
            peakMaps.add(p.toMap());
        }
        ret.put("peaks", peakMaps);
        ret.put("peakCount", peaks.size());
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("averagePeakHeight", getAveragePeakHeight());
        stats.put("maxPeakHeight", getMaxPeakHeight());
        stats.put("minPeakHeight", getMinPeakHeight());
        stats.put("peakFrequency", getPeakFrequency());
        stats.put("averageTimeBetweenPeaks", getAverageTimeBetweenPeaks());
        ret.put("stats", stats);
        return ret;
    }
}
