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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Amplitude spectrum of a real frame. The frame is tapered, zero-padded (or cut to its newest samples) to fftSize,
 * transformed, and bin k is reported as |X_k| / fftSize at frequency k * samplingRate / fftSize for k < fftSize / 2.
 */
public class SpectrumAnalyzer {
    private static final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

    private SpectrumAnalyzer() {}

    /**
     * @param fftSize power of 2, at least 2
     * @param peakThreshold minimum peak magnitude relative to the largest bin
     */
    public static Spectrum analyze(double[] frame, int fftSize, double samplingRate, WindowFunction window,
                                   double peakThreshold) {
        if (!isPowerOfTwo(fftSize)) {
            throw new IllegalArgumentException("FFT size must be a power of 2, got " + fftSize);
        }
        double[] newest = frame.length > fftSize ? Arrays.copyOfRange(frame, frame.length - fftSize, frame.length) : frame;
        double[] padded = Arrays.copyOf(window.apply(newest), fftSize);
        Complex[] transformed = fft.transform(padded, TransformType.FORWARD);

        int bins = fftSize / 2;
        double[] frequencies = new double[bins], magnitudes = new double[bins];
        for (int k = 0; k < bins; ++k) {
            magnitudes[k] = transformed[k].abs() / fftSize;
            frequencies[k] = k * samplingRate / fftSize;
        }

        double weighted = 0, total = 0, sumSquares = 0, max = 0;
        for (int k = 0; k < bins; ++k) {
            weighted += frequencies[k] * magnitudes[k];
            total += magnitudes[k];
            sumSquares += magnitudes[k] * magnitudes[k];
            max = Math.max(max, magnitudes[k]);
        }
        double centroid = total > 0 ? weighted / total : 0;
        double spread = 0;
        if (total > 0) {
            double var = 0;
            for (int k = 0; k < bins; ++k) {
                var += (frequencies[k] - centroid) * (frequencies[k] - centroid) * magnitudes[k];
            }
            spread = Math.sqrt(var / total);
        }
        double rms = Math.sqrt(sumSquares / bins);
        double crestFactor = rms > 0 ? max / rms : 0;

        return new Spectrum(frequencies, magnitudes, findPeaks(frequencies, magnitudes, max, peakThreshold),
                centroid, spread, rms, crestFactor, sumSquares, samplingRate, fftSize, window);
    }

    /** Interior local maxima whose magnitude relative to max exceeds threshold, largest first */
    static List<Spectrum.Peak> findPeaks(double[] frequencies, double[] magnitudes, double max, double threshold) {
        List<Spectrum.Peak> peaks = new ArrayList<>();
        if (max <= 0) {
            return peaks;
        }
        for (int k = 1; k < magnitudes.length - 1; ++k) {
            double m = magnitudes[k];
            if (m > magnitudes[k - 1] && m > magnitudes[k + 1] && m / max > threshold) {
                peaks.add(new Spectrum.Peak(frequencies[k], m, m / max));
            }
        }
        peaks.sort(Comparator.comparingDouble(Spectrum.Peak::getMagnitude).reversed());
        return peaks;
    }

    public static boolean isPowerOfTwo(int n) {
        return n >= 2 && (n & (n - 1)) == 0;
    }
}
