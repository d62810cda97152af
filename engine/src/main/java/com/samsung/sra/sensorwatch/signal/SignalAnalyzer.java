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

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.window.SlidingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waveform analysis of one scalar stream, in the mode of the effective config. Keeps its own buffer, sized at
 * construction to the larger of fftSize and signalWindow, since spectra usually need more history than the
 * detection window holds.
 */
public class SignalAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SignalAnalyzer.class);

    private final SlidingWindow buffer;

    public SignalAnalyzer(int capacity) {
        this.buffer = new SlidingWindow(capacity);
    }

    public static int capacityFor(DetectorConfig config) {
        return Math.max(config.getFftSize(), config.getSignalWindow());
    }

    /** Buffer the sample and analyze the buffer; null when signal analysis is off */
    public SignalReport ingest(long timestamp, double value, DetectorConfig config) {
        SignalMode mode = config.getSignalMode();
        if (mode == null) {
            return null;
        }
        buffer.push(timestamp, value);
        switch (mode) {
            case FFT: {
                int n = Math.min(config.getFftSize(), buffer.capacity());
                SignalReport report = new SignalReport(mode, Math.min(buffer.size(), n), n);
                if (!report.isBuffering()) {
                    Spectrum s = SpectrumAnalyzer.analyze(buffer.lastValues(n), config.getFftSize(),
                            config.getSamplingRate(), config.getWindowFunction(), config.getPeakThreshold());
                    logger.debug("spectrum: dominant {} Hz, centroid {}", s.getDominantFrequency(), s.getSpectralCentroid());
                    report.setSpectrum(s, config.isFullSpectrum());
                }
                return report;
            }
            case VIBRATION: {
                int n = Math.min(config.getSignalWindow(), buffer.capacity());
                int size = Math.min(buffer.size(), n);
                SignalReport report = new SignalReport(mode, size, Math.min(VibrationFeatures.MIN_SAMPLES, n));
                if (!report.isBuffering()) {
                    report.setVibration(VibrationFeatures.compute(buffer.lastValues(size)));
                }
                return report;
            }
            case PEAKS: {
                int n = Math.min(config.getSignalWindow(), buffer.capacity());
                int size = Math.min(buffer.size(), n);
                SignalReport report = new SignalReport(mode, size, Math.min(3, n));
                if (!report.isBuffering()) {
                    report.setPeaks(PeakDetector.detect(buffer.lastValues(size), buffer.lastTimestamps(size),
                            config.getMinPeakHeight(), config.getMinPeakDistance(), config.getPeakType()));
                }
                return report;
            }
            default:
                throw new IllegalStateException("unhandled signal mode " + mode);
        }
    }

    public SlidingWindow getBuffer() {
        return buffer;
    }

    public void reset() {
        buffer.reset();
    }

    public void restore(long[] timestamps, double[] values) {
        buffer.restore(timestamps, values);
    }
}
