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

import com.samsung.sra.sensorwatch.estimators.DeviationMode;
import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.estimators.PcaMethod;
import com.samsung.sra.sensorwatch.health.AggregationMethod;
import com.samsung.sra.sensorwatch.health.OutputScale;
import com.samsung.sra.sensorwatch.prediction.DegradationModel;
import com.samsung.sra.sensorwatch.prediction.RocMode;
import com.samsung.sra.sensorwatch.prediction.RulUnit;
import com.samsung.sra.sensorwatch.prediction.TrendMethod;
import com.samsung.sra.sensorwatch.signal.PeakType;
import com.samsung.sra.sensorwatch.signal.SignalMode;
import com.samsung.sra.sensorwatch.signal.SpectrumAnalyzer;
import com.samsung.sra.sensorwatch.signal.WindowFunction;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every tunable of a detector session. Setters chain so a config can be built inline:
 * <pre>new DetectorConfig().setMethod(Method.ZSCORE).setWindowSize(20).setZscoreThreshold(2.5)</pre>
 * Defaults are those of the deployed detectors. Call {@link #validate()} before use; the session does.
 */
public class DetectorConfig implements Serializable {
    private Method method = Method.ZSCORE;
    private int windowSize = 100;

    private double zscoreThreshold = 3.0, zscoreWarning = 2.0;

    private double iqrMultiplier = 1.5;

    private Double minThreshold = null, maxThreshold = null;
    /** percent */
    private double warningMargin = 10;

    private double lowerPercentile = 5, upperPercentile = 95;

    private double emaAlpha = 0.3, emaThreshold = 2.0, emaWarning = 1.5;
    private DeviationMode emaMode = DeviationMode.STDDEV;

    private Double cusumTarget = null;
    private double cusumThreshold = 5.0, cusumWarning = 3.5, cusumDrift = 0.5;

    private double maThreshold = 2.0, maWarning = 1.5;
    private DeviationMode maMode = DeviationMode.STDDEV;

    private boolean hysteresisEnabled = true;
    private double hysteresisPercent = 10;
    private int consecutiveCount = 1;

    private int nComponents = 2;
    private double pcaThreshold = 3.0;
    private PcaMethod pcaMethod = PcaMethod.T2;
    private boolean autoComponents = true;
    private double varianceThreshold = 0.95, contributionThreshold = 0.1;
    private int topContributors = 3;

    private boolean trendEnabled = false;
    private TrendMethod trendMethod = TrendMethod.LINEAR;
    private int predictionSteps = 10, trendWindow = 50;
    private Double trendThreshold = null, rocThreshold = null;
    private RocMode rocMode = RocMode.ABSOLUTE;

    private Double failureThreshold = null;
    private DegradationModel degradationModel = DegradationModel.LINEAR;
    private RulUnit rulUnit = RulUnit.HOURS;

    private boolean healthEnabled = false;
    private AggregationMethod aggregationMethod = AggregationMethod.WEIGHTED;
    private LinkedHashMap<String, Double> sensorWeights = new LinkedHashMap<>();
    private OutputScale outputScale = OutputScale.PERCENT;

    private SignalMode signalMode = null;
    private int signalWindow = 256, fftSize = 256;
    private double samplingRate = 1000, peakThreshold = 0.1;
    private WindowFunction windowFunction = WindowFunction.HANN;
    private boolean fullSpectrum = false;
    private Double minPeakHeight = null;
    private int minPeakDistance = 5;
    private PeakType peakType = PeakType.BOTH;

    private String modelId = null, modelPath = null;
    private double mlThreshold = 0.1;
    private long mlTimeoutMs = 5000, shutdownGraceMs = 2000;

    public DetectorConfig() {
    }

    public DetectorConfig(DetectorConfig that) {
        this.method = that.method;
        this.windowSize = that.windowSize;
        this.zscoreThreshold = that.zscoreThreshold;
        this.zscoreWarning = that.zscoreWarning;
        this.iqrMultiplier = that.iqrMultiplier;
        this.minThreshold = that.minThreshold;
        this.maxThreshold = that.maxThreshold;
        this.warningMargin = that.warningMargin;
        this.lowerPercentile = that.lowerPercentile;
        this.upperPercentile = that.upperPercentile;
        this.emaAlpha = that.emaAlpha;
        this.emaThreshold = that.emaThreshold;
        this.emaWarning = that.emaWarning;
        this.emaMode = that.emaMode;
        this.cusumTarget = that.cusumTarget;
        this.cusumThreshold = that.cusumThreshold;
        this.cusumWarning = that.cusumWarning;
        this.cusumDrift = that.cusumDrift;
        this.maThreshold = that.maThreshold;
        this.maWarning = that.maWarning;
        this.maMode = that.maMode;
        this.hysteresisEnabled = that.hysteresisEnabled;
        this.hysteresisPercent = that.hysteresisPercent;
        this.consecutiveCount = that.consecutiveCount;
        this.nComponents = that.nComponents;
        this.pcaThreshold = that.pcaThreshold;
        this.pcaMethod = that.pcaMethod;
        this.autoComponents = that.autoComponents;
        this.varianceThreshold = that.varianceThreshold;
        this.contributionThreshold = that.contributionThreshold;
        this.topContributors = that.topContributors;
        this.trendEnabled = that.trendEnabled;
        this.trendMethod = that.trendMethod;
        this.predictionSteps = that.predictionSteps;
        this.trendWindow = that.trendWindow;
        this.trendThreshold = that.trendThreshold;
        this.rocThreshold = that.rocThreshold;
        this.rocMode = that.rocMode;
        this.failureThreshold = that.failureThreshold;
        this.degradationModel = that.degradationModel;
        this.rulUnit = that.rulUnit;
        this.healthEnabled = that.healthEnabled;
        this.aggregationMethod = that.aggregationMethod;
        this.sensorWeights = new LinkedHashMap<>(that.sensorWeights);
        this.outputScale = that.outputScale;
        this.signalMode = that.signalMode;
        this.signalWindow = that.signalWindow;
        this.fftSize = that.fftSize;
        this.samplingRate = that.samplingRate;
        this.peakThreshold = that.peakThreshold;
        this.windowFunction = that.windowFunction;
        this.fullSpectrum = that.fullSpectrum;
        this.minPeakHeight = that.minPeakHeight;
        this.minPeakDistance = that.minPeakDistance;
        this.peakType = that.peakType;
        this.modelId = that.modelId;
        this.modelPath = that.modelPath;
        this.mlThreshold = that.mlThreshold;
        this.mlTimeoutMs = that.mlTimeoutMs;
        this.shutdownGraceMs = that.shutdownGraceMs;
    }

    /** Reject contradictory or out-of-range settings */
    public DetectorConfig validate() throws ConfigException {
        if (method == null) {
            throw new ConfigException("method must be set");
        }
        if (windowSize < 1) {
            throw new ConfigException("window size must be at least 1, got " + windowSize);
        }
        if (zscoreWarning > zscoreThreshold) {
            throw new ConfigException(String.format("z-score warning %s exceeds critical threshold %s",
                    Utilities.formatNumber(zscoreWarning), Utilities.formatNumber(zscoreThreshold)));
        }
        if (iqrMultiplier <= 0) {
            throw new ConfigException("IQR multiplier must be positive");
        }
        if (minThreshold != null && maxThreshold != null && minThreshold >= maxThreshold) {
            throw new ConfigException(String.format("min threshold %s is not below max threshold %s",
                    Utilities.formatNumber(minThreshold), Utilities.formatNumber(maxThreshold)));
        }
        if (lowerPercentile < 0 || upperPercentile > 100 || lowerPercentile >= upperPercentile) {
            throw new ConfigException(String.format("percentile bounds must satisfy 0 <= lower < upper <= 100, got %s/%s",
                    Utilities.formatNumber(lowerPercentile), Utilities.formatNumber(upperPercentile)));
        }
        if (emaAlpha <= 0 || emaAlpha > 1) {
            throw new ConfigException("EMA alpha must be in (0, 1], got " + emaAlpha);
        }
        if (emaWarning > emaThreshold) {
            throw new ConfigException("EMA warning exceeds critical threshold");
        }
        if (cusumWarning > cusumThreshold) {
            throw new ConfigException("CUSUM warning exceeds critical threshold");
        }
        if (maWarning > maThreshold) {
            throw new ConfigException("moving-average warning exceeds critical threshold");
        }
        if (consecutiveCount < 1) {
            throw new ConfigException("consecutive count must be at least 1, got " + consecutiveCount);
        }
        if (hysteresisPercent < 0) {
            throw new ConfigException("hysteresis percent must not be negative");
        }
        if (nComponents < 1) {
            throw new ConfigException("PCA needs at least one component");
        }
        if (pcaThreshold <= 0) {
            throw new ConfigException("PCA threshold must be positive");
        }
        if (varianceThreshold <= 0 || varianceThreshold > 1) {
            throw new ConfigException("variance threshold must be in (0, 1], got " + varianceThreshold);
        }
        if (predictionSteps < 1 || trendWindow < 3) {
            throw new ConfigException("trend prediction needs at least 1 step and a window of at least 3");
        }
        if (!SpectrumAnalyzer.isPowerOfTwo(fftSize)) {
            throw new ConfigException("FFT size must be a power of 2, got " + fftSize);
        }
        if (signalWindow < 1 || minPeakDistance < 1) {
            throw new ConfigException("signal window and minimum peak distance must be at least 1");
        }
        if (samplingRate <= 0 || peakThreshold < 0) {
            throw new ConfigException("sampling rate must be positive and peak threshold not negative");
        }
        if (mlThreshold <= 0 || mlTimeoutMs <= 0 || shutdownGraceMs < 0) {
            throw new ConfigException("ML threshold and timeouts must be positive");
        }
        for (Map.Entry<String, Double> e : sensorWeights.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new ConfigException("negative or missing weight for sensor " + e.getKey());
            }
        }
        return this;
    }

    public Method getMethod() {
        return method;
    }

    public DetectorConfig setMethod(Method method) {
        this.method = method;
        return this;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public DetectorConfig setWindowSize(int windowSize) {
        this.windowSize = windowSize;
        return this;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public DetectorConfig setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
        return this;
    }

    public double getZscoreWarning() {
        return zscoreWarning;
    }

    public DetectorConfig setZscoreWarning(double zscoreWarning) {
        this.zscoreWarning = zscoreWarning;
        return this;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public DetectorConfig setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
        return this;
    }

    public Double getMinThreshold() {
        return minThreshold;
    }

    public DetectorConfig setMinThreshold(Double minThreshold) {
        this.minThreshold = minThreshold;
        return this;
    }

    public Double getMaxThreshold() {
        return maxThreshold;
    }

    public DetectorConfig setMaxThreshold(Double maxThreshold) {
        this.maxThreshold = maxThreshold;
        return this;
    }

    public double getWarningMargin() {
        return warningMargin;
    }

    public DetectorConfig setWarningMargin(double warningMargin) {
        this.warningMargin = warningMargin;
        return this;
    }

    public double getLowerPercentile() {
        return lowerPercentile;
    }

    public DetectorConfig setLowerPercentile(double lowerPercentile) {
        this.lowerPercentile = lowerPercentile;
        return this;
    }

    public double getUpperPercentile() {
        return upperPercentile;
    }

    public DetectorConfig setUpperPercentile(double upperPercentile) {
        this.upperPercentile = upperPercentile;
        return this;
    }

    public double getEmaAlpha() {
        return emaAlpha;
    }

    public DetectorConfig setEmaAlpha(double emaAlpha) {
        this.emaAlpha = emaAlpha;
        return this;
    }

    public double getEmaThreshold() {
        return emaThreshold;
    }

    public DetectorConfig setEmaThreshold(double emaThreshold) {
        this.emaThreshold = emaThreshold;
        return this;
    }

    public double getEmaWarning() {
        return emaWarning;
    }

    public DetectorConfig setEmaWarning(double emaWarning) {
        this.emaWarning = emaWarning;
        return this;
    }

    public DeviationMode getEmaMode() {
        return emaMode;
    }

    public DetectorConfig setEmaMode(DeviationMode emaMode) {
        this.emaMode = emaMode;
        return this;
    }

    public Double getCusumTarget() {
        return cusumTarget;
    }

    public DetectorConfig setCusumTarget(Double cusumTarget) {
        this.cusumTarget = cusumTarget;
        return this;
    }

    public double getCusumThreshold() {
        return cusumThreshold;
    }

    public DetectorConfig setCusumThreshold(double cusumThreshold) {
        this.cusumThreshold = cusumThreshold;
        return this;
    }

    public double getCusumWarning() {
        return cusumWarning;
    }

    public DetectorConfig setCusumWarning(double cusumWarning) {
        this.cusumWarning = cusumWarning;
        return this;
    }

    public double getCusumDrift() {
        return cusumDrift;
    }

    public DetectorConfig setCusumDrift(double cusumDrift) {
        this.cusumDrift = cusumDrift;
        return this;
    }

    public double getMaThreshold() {
        return maThreshold;
    }

    public DetectorConfig setMaThreshold(double maThreshold) {
        this.maThreshold = maThreshold;
        return this;
    }

    public double getMaWarning() {
        return maWarning;
    }

    public DetectorConfig setMaWarning(double maWarning) {
        this.maWarning = maWarning;
        return this;
    }

    public DeviationMode getMaMode() {
        return maMode;
    }

    public DetectorConfig setMaMode(DeviationMode maMode) {
        this.maMode = maMode;
        return this;
    }

    public boolean isHysteresisEnabled() {
        return hysteresisEnabled;
    }

    public DetectorConfig setHysteresisEnabled(boolean hysteresisEnabled) {
        this.hysteresisEnabled = hysteresisEnabled;
        return this;
    }

    public double getHysteresisPercent() {
        return hysteresisPercent;
    }

    public DetectorConfig setHysteresisPercent(double hysteresisPercent) {
        this.hysteresisPercent = hysteresisPercent;
        return this;
    }

    public int getConsecutiveCount() {
        return consecutiveCount;
    }

    public DetectorConfig setConsecutiveCount(int consecutiveCount) {
        this.consecutiveCount = consecutiveCount;
        return this;
    }

    public int getNComponents() {
        return nComponents;
    }

    public DetectorConfig setNComponents(int nComponents) {
        this.nComponents = nComponents;
        return this;
    }

    public double getPcaThreshold() {
        return pcaThreshold;
    }

    public DetectorConfig setPcaThreshold(double pcaThreshold) {
        this.pcaThreshold = pcaThreshold;
        return this;
    }

    public PcaMethod getPcaMethod() {
        return pcaMethod;
    }

    public DetectorConfig setPcaMethod(PcaMethod pcaMethod) {
        this.pcaMethod = pcaMethod;
        return this;
    }

    public boolean isAutoComponents() {
        return autoComponents;
    }

    public DetectorConfig setAutoComponents(boolean autoComponents) {
        this.autoComponents = autoComponents;
        return this;
    }

    public double getVarianceThreshold() {
        return varianceThreshold;
    }

    public DetectorConfig setVarianceThreshold(double varianceThreshold) {
        this.varianceThreshold = varianceThreshold;
        return this;
    }

    public double getContributionThreshold() {
        return contributionThreshold;
    }

    public DetectorConfig setContributionThreshold(double contributionThreshold) {
        this.contributionThreshold = contributionThreshold;
        return this;
    }

    public int getTopContributors() {
        return topContributors;
    }

    public DetectorConfig setTopContributors(int topContributors) {
        this.topContributors = topContributors;
        return this;
    }

    public boolean isTrendEnabled() {
        return trendEnabled;
    }

    public DetectorConfig setTrendEnabled(boolean trendEnabled) {
        this.trendEnabled = trendEnabled;
        return this;
    }

    public TrendMethod getTrendMethod() {
        return trendMethod;
    }

    public DetectorConfig setTrendMethod(TrendMethod trendMethod) {
        this.trendMethod = trendMethod;
        return this;
    }

    public int getPredictionSteps() {
        return predictionSteps;
    }

    public DetectorConfig setPredictionSteps(int predictionSteps) {
        this.predictionSteps = predictionSteps;
        return this;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public DetectorConfig setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
        return this;
    }

    public Double getTrendThreshold() {
        return trendThreshold;
    }

    public DetectorConfig setTrendThreshold(Double trendThreshold) {
        this.trendThreshold = trendThreshold;
        return this;
    }

    public Double getRocThreshold() {
        return rocThreshold;
    }

    public DetectorConfig setRocThreshold(Double rocThreshold) {
        this.rocThreshold = rocThreshold;
        return this;
    }

    public RocMode getRocMode() {
        return rocMode;
    }

    public DetectorConfig setRocMode(RocMode rocMode) {
        this.rocMode = rocMode;
        return this;
    }

    public Double getFailureThreshold() {
        return failureThreshold;
    }

    public DetectorConfig setFailureThreshold(Double failureThreshold) {
        this.failureThreshold = failureThreshold;
        return this;
    }

    public DegradationModel getDegradationModel() {
        return degradationModel;
    }

    public DetectorConfig setDegradationModel(DegradationModel degradationModel) {
        this.degradationModel = degradationModel;
        return this;
    }

    public RulUnit getRulUnit() {
        return rulUnit;
    }

    public DetectorConfig setRulUnit(RulUnit rulUnit) {
        this.rulUnit = rulUnit;
        return this;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public DetectorConfig setHealthEnabled(boolean healthEnabled) {
        this.healthEnabled = healthEnabled;
        return this;
    }

    public AggregationMethod getAggregationMethod() {
        return aggregationMethod;
    }

    public DetectorConfig setAggregationMethod(AggregationMethod aggregationMethod) {
        this.aggregationMethod = aggregationMethod;
        return this;
    }

    public Map<String, Double> getSensorWeights() {
        return Collections.unmodifiableMap(sensorWeights);
    }

    public DetectorConfig setSensorWeights(Map<String, Double> sensorWeights) {
        this.sensorWeights = new LinkedHashMap<>(sensorWeights);
        return this;
    }

    public DetectorConfig setSensorWeight(String sensor, double weight) {
        this.sensorWeights.put(sensor, weight);
        return this;
    }

    public OutputScale getOutputScale() {
        return outputScale;
    }

    public DetectorConfig setOutputScale(OutputScale outputScale) {
        this.outputScale = outputScale;
        return this;
    }

    /** null when signal analysis is off */
    public SignalMode getSignalMode() {
        return signalMode;
    }

    public DetectorConfig setSignalMode(SignalMode signalMode) {
        this.signalMode = signalMode;
        return this;
    }

    /** Samples analyzed in vibration and peaks mode */
    public int getSignalWindow() {
        return signalWindow;
    }

    public DetectorConfig setSignalWindow(int signalWindow) {
        this.signalWindow = signalWindow;
        return this;
    }

    public int getFftSize() {
        return fftSize;
    }

    public DetectorConfig setFftSize(int fftSize) {
        this.fftSize = fftSize;
        return this;
    }

    /** Hz */
    public double getSamplingRate() {
        return samplingRate;
    }

    public DetectorConfig setSamplingRate(double samplingRate) {
        this.samplingRate = samplingRate;
        return this;
    }

    /** Minimum spectral peak magnitude relative to the largest bin */
    public double getPeakThreshold() {
        return peakThreshold;
    }

    public DetectorConfig setPeakThreshold(double peakThreshold) {
        this.peakThreshold = peakThreshold;
        return this;
    }

    public WindowFunction getWindowFunction() {
        return windowFunction;
    }

    public DetectorConfig setWindowFunction(WindowFunction windowFunction) {
        this.windowFunction = windowFunction;
        return this;
    }

    /** Emit the frequency and magnitude arrays along with the spectral peaks */
    public boolean isFullSpectrum() {
        return fullSpectrum;
    }

    public DetectorConfig setFullSpectrum(boolean fullSpectrum) {
        this.fullSpectrum = fullSpectrum;
        return this;
    }

    public Double getMinPeakHeight() {
        return minPeakHeight;
    }

    public DetectorConfig setMinPeakHeight(Double minPeakHeight) {
        this.minPeakHeight = minPeakHeight;
        return this;
    }

    public int getMinPeakDistance() {
        return minPeakDistance;
    }

    public DetectorConfig setMinPeakDistance(int minPeakDistance) {
        this.minPeakDistance = minPeakDistance;
        return this;
    }

    public PeakType getPeakType() {
        return peakType;
    }

    public DetectorConfig setPeakType(PeakType peakType) {
        this.peakType = peakType;
        return this;
    }

    public String getModelId() {
        return modelId;
    }

    public DetectorConfig setModelId(String modelId) {
        this.modelId = modelId;
        return this;
    }

    public String getModelPath() {
        return modelPath;
    }

    public DetectorConfig setModelPath(String modelPath) {
        this.modelPath = modelPath;
        return this;
    }

    public double getMlThreshold() {
        return mlThreshold;
    }

    public DetectorConfig setMlThreshold(double mlThreshold) {
        this.mlThreshold = mlThreshold;
        return this;
    }

    public long getMlTimeoutMs() {
        return mlTimeoutMs;
    }

    public DetectorConfig setMlTimeoutMs(long mlTimeoutMs) {
        this.mlTimeoutMs = mlTimeoutMs;
        return this;
    }

    public long getShutdownGraceMs() {
        return shutdownGraceMs;
    }

    public DetectorConfig setShutdownGraceMs(long shutdownGraceMs) {
        this.shutdownGraceMs = shutdownGraceMs;
        return this;
    }
}
