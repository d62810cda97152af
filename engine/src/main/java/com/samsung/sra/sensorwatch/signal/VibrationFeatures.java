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

import com.samsung.sra.sensorwatch.numeric.Numerics;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-domain condition indicators of a vibration window. Moments are population moments; kurtosis is excess
 * kurtosis, so a Gaussian window scores near 0. Ratios with a zero denominator are reported as 0.
 */
public class VibrationFeatures implements Serializable {
    /** Windows shorter than this are not analyzed (or the whole window, if it is shorter) */
    public static final int MIN_SAMPLES = 10;
    /** Autocorrelation is computed up to this lag */
    public static final int MAX_LAG = 10;
    /** Embedding dimension of the sample entropy */
    public static final int ENTROPY_DIMENSION = 2;
    /** Minimum autocorrelation of a lag reported as a period */
    public static final double PERIODICITY_THRESHOLD = 0.3;
    /** Crest factor above which a window raises an alert */
    public static final double CREST_FACTOR_ALERT = 6;
    /** |excess kurtosis| above which a window raises an alert */
    public static final double KURTOSIS_ALERT = 4;

    private double rms, peakToPeak, peak, crestFactor, mean, stdDev, kurtosis, skewness;
    private double formFactor, impulseFactor, clearanceFactor, sampleEntropy;
    private double[] autocorrelation;
    private Integer period;
    private Double periodStrength;
    private int healthScore;
    private int windowSize;

    private VibrationFeatures() {}

    public static VibrationFeatures compute(double[] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("no samples to analyze");
        }
        VibrationFeatures f = new VibrationFeatures();
        int n = data.length;
        f.windowSize = n;
        double max = Double.NEGATIVE_INFINITY, min = Double.POSITIVE_INFINITY;
        double sumSquares = 0, sumAbs = 0, sumSqrtAbs = 0;
        for (double v : data) {
            max = Math.max(max, v);
            min = Math.min(min, v);
            sumSquares += v * v;
            sumAbs += Math.abs(v);
            sumSqrtAbs += Math.sqrt(Math.abs(v));
        }
        f.rms = Math.sqrt(sumSquares / n);
        f.peakToPeak = max - min;
        f.peak = Math.max(Math.abs(max), Math.abs(min));
        f.crestFactor = f.rms != 0 ? f.peak / f.rms : 0;

        f.mean = Numerics.mean(data);
        f.stdDev = Numerics.stdDev(data, f.mean);
        double m3 = 0, m4 = 0;
        for (double v : data) {
            double d = v - f.mean;
            m3 += d * d * d;
            m4 += d * d * d * d;
        }
        m3 /= n;
        m4 /= n;
        f.kurtosis = f.stdDev != 0 ? m4 / Math.pow(f.stdDev, 4) - 3 : 0;
        f.skewness = f.stdDev != 0 ? m3 / Math.pow(f.stdDev, 3) : 0;

        double meanAbs = sumAbs / n;
        f.formFactor = meanAbs != 0 ? f.rms / meanAbs : 0;
        f.impulseFactor = meanAbs != 0 ? f.peak / meanAbs : 0;
        double meanSqrt = Math.pow(sumSqrtAbs / n, 2);
        f.clearanceFactor = meanSqrt != 0 ? f.peak / meanSqrt : 0;

        f.sampleEntropy = sampleEntropy(data, ENTROPY_DIMENSION, 0.2 * f.stdDev);
        f.autocorrelation = autocorrelation(data, MAX_LAG);
        for (int lag = 2; lag < f.autocorrelation.length - 1; ++lag) {
            double r = f.autocorrelation[lag];
            if (r > f.autocorrelation[lag - 1] && r > f.autocorrelation[lag + 1] && r > PERIODICITY_THRESHOLD) {
                f.period = lag;
                f.periodStrength = r;
                break;
            }
        }

        int score = 100;
        if (f.crestFactor > 5) score -= 20;
        if (Math.abs(f.kurtosis) > 3) score -= 20;
        if (Math.abs(f.skewness) > 1) score -= 10;
        f.healthScore = score;
        return f;
    }

    /**
     * -ln(A / B) where B and A count pairs of templates of length m and m + 1 within Chebyshev distance r.
     * 0 when either count is zero.
     */
    static double sampleEntropy(double[] data, int m, double r) {
        int n = data.length;
        if (n < m + 1) {
            return 0;
        }
        long b = countMatches(data, m, r), a = countMatches(data, m + 1, r);
        return a == 0 || b == 0 ? 0 : -Math.log((double) a / b);
    }

    private static long countMatches(double[] data, int length, double r) {
        int n = data.length;
        long count = 0;
        for (int i = 0; i < n - length; ++i) {
            for (int j = i + 1; j < n - length; ++j) {
                boolean match = true;
                for (int k = 0; k < length && match; ++k) {
                    match = Math.abs(data[i + k] - data[j + k]) <= r;
                }
                if (match) {
                    ++count;
                }
            }
        }
        return count;
    }

    /** Biased autocorrelation for lags 0..min(maxLag, n - 1); empty for a constant window */
    static double[] autocorrelation(double[] data, int maxLag) {
        int n = data.length;
        double mean = Numerics.mean(data);
        double variance = Numerics.variance(data, mean);
        if (variance == 0) {
            return new double[0];
        }
        double[] acf = new double[Math.min(maxLag, n - 1) + 1];
        for (int lag = 0; lag < acf.length; ++lag) {
            double sum = 0;
            for (int i = 0; i < n - lag; ++i) {
                sum += (data[i] - mean) * (data[i + lag] - mean);
            }
            acf[lag] = sum / (n * variance);
        }
        return acf;
    }

    public static String interpretCrestFactor(double cf) {
        if (cf < 2) return "very-smooth";
        if (cf < 4) return "normal";
        if (cf < 6) return "slight-impulsive";
        if (cf < 10) return "impulsive";
        return "severe-impulsive";
    }

    public static String interpretKurtosis(double k) {
        if (k < -1) return "flat-distribution";
        if (k < 1) return "normal";
        if (k < 3) return "peaked";
        if (k < 5) return "very-peaked";
        return "extreme-peaks";
    }

    public static String interpretSkewness(double s) {
        if (Math.abs(s) < 0.5) return "symmetric";
        return s > 0 ? "right-skewed" : "left-skewed";
    }

    /** Impulsive or heavy-tailed enough to route the record as anomalous */
    public boolean isAlert() {
        return crestFactor > CREST_FACTOR_ALERT || Math.abs(kurtosis) > KURTOSIS_ALERT;
    }

    public double getRms() {
        return rms;
    }

    public double getPeakToPeak() {
        return peakToPeak;
    }

    public double getPeak() {
        return peak;
    }

    public double getCrestFactor() {
        return crestFactor;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getFormFactor() {
        return formFactor;
    }

    public double getImpulseFactor() {
        return impulseFactor;
    }

    public double getClearanceFactor() {
        return clearanceFactor;
    }

    public double getSampleEntropy() {
        return sampleEntropy;
    }

    public double[] getAutocorrelation() {
        return autocorrelation.clone();
    }

    /** First lag >= 2 where the autocorrelation has a local maximum above the threshold, null if none */
    public Integer getPeriod() {
        return period;
    }

    public Double getPeriodStrength() {
        return periodStrength;
    }

    /** 100 minus penalties for high crest factor, kurtosis and skewness */
    public int getHealthScore() {
        return healthScore;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put("rms", rms);
        ret.put("peakToPeak", peakToPeak);
        ret.put("peak", peak);
        ret.put("crestFactor", crestFactor);
        ret.put("kurtosis", kurtosis);
        ret.put("skewness", skewness);
        ret.put("mean", mean);
        ret.put("stdDev", stdDev);
        ret.put("formFactor", formFactor);
        ret.put("impulseFactor", impulseFactor);
        ret.put("clearanceFactor", clearanceFactor);
        ret.put("sampleEntropy", sampleEntropy);
        List<Map<String, Object>> acf = new ArrayList<>();
        for (int lag = 0; lag < autocorrelation.length; ++lag) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("lag", lag);
            m.put("value", autocorrelation[lag]);
            acf.add(m);
        }
        ret.put("autocorrelation", Collections.unmodifiableList(acf));
        Map<String, Object> periodicity = new LinkedHashMap<>();
        periodicity.put("detected", period != null);
        if (period != null) {
            periodicity.put("period", period);
            periodicity.put("strength", periodStrength);
        }
        ret.put("periodicity", periodicity);
        ret.put("healthScore", healthScore);
        Map<String, Object> interpretation = new LinkedHashMap<>();
        interpretation.put("crestFactor", interpretCrestFactor(crestFactor));
        interpretation.put("kurtosis", interpretKurtosis(kurtosis));
        interpretation.put("skewness", interpretSkewness(skewness));
        ret.put("interpretation", interpretation);
        ret.put("windowSize", windowSize);
        return ret;
    }
}
