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

/** One-sided amplitude spectrum of a frame, with its peaks and summary features */
public class Spectrum implements Serializable {
    /** Local maximum of the amplitude spectrum */
    public static class Peak implements Serializable {
        private final double frequency, magnitude, normalized;

        Peak(double frequency, double magnitude, double normalized) {
            this.frequency = frequency;
            this.magnitude = magnitude;
            this.normalized = normalized;
        }

        /** Hz */
        public double getFrequency() {
            return frequency;
        }

        public double getMagnitude() {
            return magnitude;
        }

        /** magnitude over the largest bin magnitude */
        public double getNormalized() {
            return normalized;
        }

        Map<String, Object> toMap() {
            Map<String, Object> ret = new LinkedHashMap<>();
            ret.put("frequency", frequency);
            ret.put("magnitude", magnitude);
            ret.put("normalized", normalized);
            return ret;
        }
    }

    private final double[] frequencies, magnitudes;
    private final List<Peak> peaks;
    private final double spectralCentroid, spectralSpread, rms, crestFactor, totalEnergy;
    private final double samplingRate;
    private final int fftSize;
    private final WindowFunction windowFunction;

    Spectrum(double[] frequencies, double[] magnitudes, List<Peak> peaks, double spectralCentroid,
             double spectralSpread, double rms, double crestFactor, double totalEnergy,
             double samplingRate, int fftSize, WindowFunction windowFunction) {
        this.frequencies = frequencies;
        this.magnitudes = magnitudes;
        this.peaks = Collections.unmodifiableList(peaks);
        this.spectralCentroid = spectralCentroid;
        this.spectralSpread = spectralSpread;
        this.rms = rms;
        this.crestFactor = crestFactor;
        this.totalEnergy = totalEnergy;
        this.samplingRate = samplingRate;
        this.fftSize = fftSize;
        this.windowFunction = windowFunction;
    }

    /** Bin centre frequencies in Hz, fftSize / 2 of them */
    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public double[] getMagnitudes() {
        return magnitudes.clone();
    }

    /** Peaks above the threshold, largest first */
    public List<Peak> getPeaks() {
        return peaks;
    }

    /** Frequency of the largest peak, null when there is none */
    public Double getDominantFrequency() {
        return peaks.isEmpty() ? null : peaks.get(0).getFrequency();
    }

    public double getSpectralCentroid() {
        return spectralCentroid;
    }

    public double getSpectralSpread() {
        return spectralSpread;
    }

    /** RMS of the bin magnitudes */
    public double getRms() {
        return rms;
    }

    public double getCrestFactor() {
        return crestFactor;
    }

    /** Sum of squared bin magnitudes */
    public double getTotalEnergy() {
        return totalEnergy;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public int getFftSize() {
        return fftSize;
    }

    public WindowFunction getWindowFunction() {
        return windowFunction;
    }

    /** @param full also emit the frequency and magnitude arrays */
    public Map<String, Object> toMap(boolean full) {
        Map<String, Object> ret = new LinkedHashMap<>();
        List<Map<String, Object>> peakMaps = new ArrayList<>();
        for (Peak p : peaks) {
            peakMaps.add(p.toMap());
        }
        ret.put("peaks", peakMaps);
        ret.put("dominantFrequency", getDominantFrequency());
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("spectralCentroid", spectralCentroid);
        features.put("spectralSpread", spectralSpread);
        features.put("rms", rms);
        features.put("crestFactor", crestFactor);
        features.put("totalEnergy", totalEnergy);
        ret.put("features", features);
        ret.put("samplingRate", samplingRate);
        ret.put("fftSize", fftSize);
        ret.put("windowFunction", windowFunction.getName());
        if (full) {
            ret.put("frequencies", getFrequencies());
            ret.put("magnitudes", getMagnitudes());
        }
        return ret;
    }
}
