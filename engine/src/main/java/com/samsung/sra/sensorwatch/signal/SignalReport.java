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
import java.util.LinkedHashMap;
import java.util.Map;

/** Result of the waveform analysis of one sample; exactly one of the mode results is set once the buffer is full */
public class SignalReport implements Serializable {
    private final SignalMode mode;
    private final int bufferSize, required;
    private Spectrum spectrum;
    private VibrationFeatures vibration;
    private PeakReport peaks;
    private boolean fullSpectrum = false;

    SignalReport(SignalMode mode, int bufferSize, int required) {
        this.mode = mode;
        this.bufferSize = bufferSize;
        this.required = required;
    }

    public SignalMode getMode() {
        return mode;
    }

    public boolean isBuffering() {
        return bufferSize < required;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /** Samples needed before the first analysis */
    public int getRequired() {
        return required;
    }

    public Spectrum getSpectrum() {
        return spectrum;
    }

    SignalReport setSpectrum(Spectrum spectrum, boolean full) {
        this.spectrum = spectrum;
        this.fullSpectrum = full;
        return this;
    }

    public VibrationFeatures getVibration() {
        return vibration;
    }

    SignalReport setVibration(VibrationFeatures vibration) {
        this.vibration = vibration;
        return this;
    }

    public PeakReport getPeaks() {
        return peaks;
    }

    SignalReport setPeaks(PeakReport peaks) {
        this.peaks = peaks;
        return this;
    }

    /** Vibration window over the alert limits, or a newly confirmed peak. Spectra never alert. */
    public boolean isAlert() {
        return (vibration != null && vibration.isAlert()) || (peaks != null && peaks.isPeak());
    }

    public String getStatusText() {
        if (isBuffering()) {
            return String.format("buffering %d/%d", bufferSize, required);
        } else if (spectrum != null) {
            Double f = spectrum.getDominantFrequency();
            return f == null ? "no spectral peaks" : String.format("peak %.1f Hz", f);
        } else if (vibration != null) {
            return String.format("RMS %.2f CF %.2f", vibration.getRms(), vibration.getCrestFactor());
        } else {
            return "peaks: " + peaks.getPeakCount();
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("mode", mode.getName());
        ret.put("status", getStatusText());
        ret.put("bufferSize", bufferSize);
        if (isBuffering()) {
            ret.put("required", required);
        }
        if (spectrum != null) {
            ret.putAll(spectrum.toMap(fullSpectrum));
        }
        if (vibration != null) {
            ret.put("features", vibration.toMap());
        }
        if (peaks != null) {
            ret.putAll(peaks.toMap());
        }
        ret.put("alert", isAlert());
        return ret;
    }
}
