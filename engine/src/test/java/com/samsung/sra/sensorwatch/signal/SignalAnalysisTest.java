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
import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.DetectorConfiguration;
import org.junit.Test;

import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SignalAnalysisTest {
    private static final double DELTA = 1e-9;

    /** n samples of a unit sine with the given period in samples */
    private static double[] sine(int n, double period) {
        double[] ret = new double[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = Math.sin(2 * Math.PI * i / period);
        }
        return ret;
    }

    private static long[] millis(int n) {
        long[] ret = new long[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = 1000L * i;
        }
        return ret;
    }

    @Test
    public void dominantFrequencyOfSine() {
        // 125 Hz at 1 kHz is exactly bin 32 of a 256-point transform
        Spectrum s = SpectrumAnalyzer.analyze(sine(256, 8), 256, 1000, WindowFunction.HANN, 0.1);
        assertThat(s.getFrequencies().length, is(128));
        assertThat(s.getDominantFrequency(), is(125.0));
        assertEquals(1.0, s.getPeaks().get(0).getNormalized(), DELTA);
        assertTrue(s.getSpectralCentroid() > 100 && s.getSpectralCentroid() < 150);
        assertTrue(s.getCrestFactor() > 1);
    }

    @Test
    public void longFrameUsesNewestSamples() {
        double[] frame = new double[300];
        System.arraycopy(sine(256, 4), 0, frame, 44, 256);
        Spectrum s = SpectrumAnalyzer.analyze(frame, 256, 1000, WindowFunction.RECTANGULAR, 0.1);
        assertThat(s.getDominantFrequency(), is(250.0));
    }

    @Test
    public void silentFrameHasNoPeaks() {
        Spectrum s = SpectrumAnalyzer.analyze(new double[64], 64, 1000, WindowFunction.HAMMING, 0.1);
        assertThat(s.getDominantFrequency(), nullValue());
        assertTrue(s.getPeaks().isEmpty());
        assertEquals(0, s.getSpectralCentroid(), DELTA);
        assertEquals(0, s.getSpectralSpread(), DELTA);
        assertEquals(0, s.getCrestFactor(), DELTA);
        assertEquals(0, s.getTotalEnergy(), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fftSizeMustBePowerOfTwo() {
        SpectrumAnalyzer.analyze(sine(100, 8), 100, 1000, WindowFunction.HANN, 0.1);
    }

    @Test
    public void windowFunctionsTaperEnds() {
        assertEquals(0, WindowFunction.HANN.weight(0, 16), DELTA);
        assertEquals(0.08, WindowFunction.HAMMING.weight(15, 16), DELTA);
        assertEquals(0, WindowFunction.BLACKMAN.weight(0, 16), 1e-12);
        assertEquals(1, WindowFunction.RECTANGULAR.weight(7, 16), DELTA);
        assertEquals(1, WindowFunction.HANN.apply(new double[]{1})[0], DELTA);
    }

    @Test
    public void momentsOfKnownSet() {
        VibrationFeatures f = VibrationFeatures.compute(new double[]{1, 2, 3, 4, 5});
        assertEquals(3, f.getMean(), DELTA);
        assertEquals(Math.sqrt(2), f.getStdDev(), DELTA);
        assertEquals(-1.3, f.getKurtosis(), DELTA);
        assertEquals(0, f.getSkewness(), DELTA);
        assertEquals(Math.sqrt(11), f.getRms(), DELTA);
        assertEquals(4, f.getPeakToPeak(), DELTA);
        assertEquals(5 / Math.sqrt(11), f.getCrestFactor(), DELTA);
        assertEquals(Math.sqrt(11) / 3, f.getFormFactor(), DELTA);
        assertEquals(5 / 3.0, f.getImpulseFactor(), DELTA);
        assertThat(VibrationFeatures.interpretKurtosis(f.getKurtosis()), is("flat-distribution"));
        assertThat(VibrationFeatures.interpretSkewness(f.getSkewness()), is("symmetric"));
        assertThat(f.getHealthScore(), is(100));
        assertFalse(f.isAlert());
    }

    @Test
    public void constantWindowIsDegenerateButFinite() {
        double[] data = new double[20];
        Arrays.fill(data, 3.0);
        VibrationFeatures f = VibrationFeatures.compute(data);
        assertEquals(1, f.getCrestFactor(), DELTA);
        assertEquals(0, f.getKurtosis(), DELTA);
        assertEquals(0, f.getSkewness(), DELTA);
        assertEquals(1, f.getClearanceFactor(), DELTA);
        assertThat(f.getAutocorrelation().length, is(0));
        assertThat(f.getPeriod(), nullValue());
        assertThat(VibrationFeatures.interpretCrestFactor(f.getCrestFactor()), is("very-smooth"));
        assertThat(f.getHealthScore(), is(100));
    }

    @Test
    public void impulsiveWindowAlerts() {
        double[] data = new double[100];
        for (int i = 0; i < 99; ++i) {
            data[i] = i % 2 == 0 ? 1 : -1;
        }
        data[99] = 20;
        VibrationFeatures f = VibrationFeatures.compute(data);
        assertEquals(20 / Math.sqrt(4.99), f.getCrestFactor(), DELTA);
        assertThat(VibrationFeatures.interpretCrestFactor(f.getCrestFactor()), is("impulsive"));
        assertTrue(f.getKurtosis() > VibrationFeatures.KURTOSIS_ALERT);
        assertThat(VibrationFeatures.interpretSkewness(f.getSkewness()), is("right-skewed"));
        assertThat(f.getHealthScore(), is(50));
        assertTrue(f.isAlert());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void periodicityFromAutocorrelation() {
        VibrationFeatures f = VibrationFeatures.compute(sine(64, 8));
        assertThat(f.getAutocorrelation().length, is(VibrationFeatures.MAX_LAG + 1));
        assertEquals(1, f.getAutocorrelation()[0], DELTA);
        assertThat(f.getPeriod(), is(8));
        assertEquals(0.875, f.getPeriodStrength(), 1e-6);
        Map<String, Object> periodicity = (Map<String, Object>) f.toMap().get("periodicity");
        assertThat(periodicity.get("detected"), is((Object) true));
    }

    @Test
    public void sampleEntropyOfRegularAndShortSeries() {
        assertEquals(0, VibrationFeatures.sampleEntropy(new double[]{1, 2}, 2, 0.1), DELTA);
        // alternating series: every template of either length matches every other of the same phase
        double[] alternating = new double[]{0, 1, 0, 1, 0, 1, 0, 1, 0, 1};
        double b = 12, a = 9;
        assertEquals(-Math.log(a / b), VibrationFeatures.sampleEntropy(alternating, 2, 0.1), DELTA);
    }

    private static final double[] PEAKY = {0, 5, 0, 4, 0, 0, 6, 0, -7, 0};

    @Test
    public void peaksOfBothSigns() {
        PeakReport r = PeakDetector.detect(PEAKY, millis(10), null, 1, PeakType.BOTH);
        assertThat(r.getPeakCount(), is(4));
        assertThat(r.getPeaks().get(3).getIndex(), is(8));
        assertThat(r.getPeaks().get(3).getDirection(), is("negative"));
        assertTrue(r.isPeak());
        assertEquals(5.5, r.getAveragePeakHeight(), DELTA);
        assertEquals(7, r.getMaxPeakHeight(), DELTA);
        assertEquals(4, r.getMinPeakHeight(), DELTA);
        assertEquals(0.4, r.getPeakFrequency(), DELTA);
        assertEquals(7000 / 3.0, r.getAverageTimeBetweenPeaks(), DELTA);
    }

    @Test
    public void peakDistanceAndHeight() {
        PeakReport spaced = PeakDetector.detect(PEAKY, millis(10), null, 3, PeakType.BOTH);
        assertThat(spaced.getPeakCount(), is(2));
        assertThat(spaced.getPeaks().get(0).getIndex(), is(1));
        assertThat(spaced.getPeaks().get(1).getIndex(), is(6));
        assertFalse(spaced.isPeak());

        PeakReport tall = PeakDetector.detect(PEAKY, millis(10), 5d, 1, PeakType.BOTH);
        assertThat(tall.getPeakCount(), is(3));
        assertThat(tall.getPeaks().get(2).getValue(), is(-7.0));

        PeakReport positive = PeakDetector.detect(PEAKY, millis(10), null, 1, PeakType.POSITIVE);
        assertThat(positive.getPeakCount(), is(3));
        assertFalse(positive.isPeak());
    }

    @Test
    public void noPeaksInMonotoneWindow() {
        PeakReport r = PeakDetector.detect(new double[]{1, 2, 3, 4}, millis(4), null, 1, PeakType.BOTH);
        assertThat(r.getPeakCount(), is(0));
        assertThat(r.getAveragePeakHeight(), nullValue());
        assertThat(r.getAverageTimeBetweenPeaks(), nullValue());
        assertEquals(0, r.getPeakFrequency(), DELTA);
    }

    @Test
    public void analyzerBuffersUntilFrameIsFull() {
        DetectorConfig config = new DetectorConfig().setSignalMode(SignalMode.FFT).setFftSize(64).setSamplingRate(64);
        SignalAnalyzer analyzer = new SignalAnalyzer(SignalAnalyzer.capacityFor(config));
        double[] wave = sine(70, 8);
        for (int i = 0; i < 63; ++i) {
            SignalReport r = analyzer.ingest(i, wave[i], config);
            assertTrue(r.isBuffering());
            assertThat(r.getSpectrum(), nullValue());
        }
        SignalReport r = analyzer.ingest(63, wave[63], config);
        assertFalse(r.isBuffering());
        assertThat(r.getSpectrum().getDominantFrequency(), is(8.0));
        assertFalse(r.isAlert());
        assertThat(r.toMap().get("dominantFrequency"), is((Object) 8.0));

        analyzer.reset();
        assertTrue(analyzer.ingest(64, 0, config).isBuffering());
        assertThat(analyzer.ingest(65, 0, new DetectorConfig()), nullValue());
    }

    @Test
    public void vibrationModeNeedsTenSamples() {
        DetectorConfig config = new DetectorConfig().setSignalMode(SignalMode.VIBRATION).setSignalWindow(50);
        SignalAnalyzer analyzer = new SignalAnalyzer(SignalAnalyzer.capacityFor(config));
        for (int i = 0; i < 9; ++i) {
            assertTrue(analyzer.ingest(i, i % 2, config).isBuffering());
        }
        SignalReport r = analyzer.ingest(9, 1, config);
        assertThat(r.getVibration().getWindowSize(), is(10));
        assertThat(r.getStatusText(), is(String.format("RMS %.2f CF %.2f", r.getVibration().getRms(),
                r.getVibration().getCrestFactor())));
    }

    @Test
    public void signalTableIsParsed() throws ConfigException {
        DetectorConfig config = new DetectorConfiguration(
                "[signal]\nmode = \"peaks\"\nwindow = 40\nmin-peak-height = 2\nmin-peak-distance = 3\n" +
                        "peak-type = \"negative\"\nfft-size = 512\nwindow-function = \"blackman\"\n").getDetectorConfig();
        assertThat(config.getSignalMode(), is(SignalMode.PEAKS));
        assertThat(config.getSignalWindow(), is(40));
        assertThat(config.getMinPeakHeight(), is(2.0));
        assertThat(config.getMinPeakDistance(), is(3));
        assertThat(config.getPeakType(), is(PeakType.NEGATIVE));
        assertThat(config.getFftSize(), is(512));
        assertThat(config.getWindowFunction(), is(WindowFunction.BLACKMAN));
        assertThat(new DetectorConfig().getSignalMode(), nullValue());
    }

    @Test
    public void rejectsFftSizeNotPowerOfTwo() {
        try {
            new DetectorConfig().setFftSize(200).validate();
            fail();
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("power of 2"));
        }
    }
}
