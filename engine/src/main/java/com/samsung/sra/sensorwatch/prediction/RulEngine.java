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
package com.samsung.sra.sensorwatch.prediction;

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.Utilities;
import com.samsung.sra.sensorwatch.numeric.DoubleExponentialSmoothing;
import com.samsung.sra.sensorwatch.numeric.LinearRegression;
import com.samsung.sra.sensorwatch.numeric.Numerics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remaining-useful-life estimation over one stream's window.
 *
 * Linear and exponential models divide the distance to the failure threshold by the fitted per-sample slope and
 * scale by the mean sample interval. The 95% interval comes from the slope's standard error; confidence is the
 * regression R2. The Weibull model fits shape from the window's coefficient of variation and scale from the current
 * normalized degradation, falling back to linear whenever that fit is degenerate.
 */
public class RulEngine {
    private static final Logger logger = LoggerFactory.getLogger(RulEngine.class);

    public static final int MIN_SAMPLES = 5;
    public static final int CRITICAL_INTERVALS = 10, WARNING_INTERVALS = 50;
    /** Reliability at which a unit is considered failed, and the interval bounds around it */
    public static final double FAILURE_RELIABILITY = 0.1, LOWER_RELIABILITY = 0.2, UPPER_RELIABILITY = 0.05;
    public static final double MIN_BETA = 0.5, MAX_BETA = 5;
    /** Assumed interval when all timestamps coincide */
    static final double DEFAULT_INTERVAL_MS = 1000;

    private static final double Z95 = Utilities.getNormalQuantile(0.975);

    private RulEngine() {}

    /** @return null without a failure threshold or with fewer than five samples */
    public static RulEstimate estimate(double[] values, long[] timestamps, DetectorConfig config) {
        Double threshold = config.getFailureThreshold();
        if (threshold == null || values.length < MIN_SAMPLES) {
            return null;
        }
        double meanDt = Numerics.meanInterval(timestamps);
        if (meanDt <= 0) {
            logger.debug("timestamps do not advance, assuming {} ms between samples", DEFAULT_INTERVAL_MS);
            meanDt = DEFAULT_INTERVAL_MS;
        }
        LinearRegression lr = LinearRegression.fit(values);
        double current, slope;
        if (config.getDegradationModel() == DegradationModel.EXPONENTIAL) {
            DoubleExponentialSmoothing des = DoubleExponentialSmoothing.fit(values);
            current = des.level;
            slope = des.trend;
        } else {
            current = values[values.length - 1];
            slope = lr.slope;
        }
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        double confidence = Numerics.clamp(lr.rSquared, 0, 1);
        double ratePerSecond = slope / (meanDt / 1000);
        String trend = Numerics.trendLabel(slope);
        RulUnit unit = config.getRulUnit();

        if (current >= threshold) {
            return new RulEstimate(config.getDegradationModel(), unit, 0, 0, 0, meanDt, confidence,
                    RulStatus.FAILED, 100, ratePerSecond, trend, null);
        }
        double degradation = threshold > min ? Numerics.clamp((current - min) / (threshold - min), 0, 1) : 0;
        if (slope <= 0) {
            return new RulEstimate(config.getDegradationModel(), unit, Double.POSITIVE_INFINITY,
                    Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, meanDt, confidence, RulStatus.STABLE,
                    degradation * 100, ratePerSecond, trend, null);
        }

        if (config.getDegradationModel() == DegradationModel.WEIBULL) {
            WeibullFit fit = fitWeibull(values, timestamps, degradation);
            if (fit != null) {
                double t = fit.getElapsed();
                double rul = Math.max(0, fit.timeAtReliability(FAILURE_RELIABILITY) - t);
                double lower = Math.max(0, fit.timeAtReliability(LOWER_RELIABILITY) - t);
                double upper = Math.max(0, fit.timeAtReliability(UPPER_RELIABILITY) - t);
                return new RulEstimate(DegradationModel.WEIBULL, unit, rul, lower, upper, meanDt, confidence,
                        status(rul / meanDt), degradation * 100, ratePerSecond, trend, fit);
            }
            logger.debug("degenerate Weibull fit, falling back to linear");
        }

        double distance = threshold - current;
        double steps = distance / slope;
        double slopeHi = slope + Z95 * lr.slopeStdError, slopeLo = slope - Z95 * lr.slopeStdError;
        double lowerSteps = distance / slopeHi;
        double upperSteps = slopeLo > 0 ? distance / slopeLo : Double.POSITIVE_INFINITY;
        DegradationModel model = config.getDegradationModel() == DegradationModel.EXPONENTIAL
                ? DegradationModel.EXPONENTIAL : DegradationModel.LINEAR;
        return new RulEstimate(model, unit, steps * meanDt, lowerSteps * meanDt, upperSteps * meanDt, meanDt,
                confidence, status(steps), degradation * 100, ratePerSecond, trend, null);
    }

    /** null when the window gives no usable shape or scale */
    static WeibullFit fitWeibull(double[] values, long[] timestamps, double degradation) {
        double cv = Numerics.coefficientOfVariation(values);
        double elapsed = timestamps[timestamps.length - 1] - timestamps[0];
        if (Double.isNaN(cv) || cv <= 0 || degradation <= 0 || degradation >= 1 || elapsed <= 0) {
            return null;
        }
        double beta = Numerics.clamp(1 / cv, MIN_BETA, MAX_BETA);
        double reliability = 1 - degradation;
        double eta = elapsed / Math.pow(-Math.log(reliability), 1 / beta);
        if (Double.isNaN(eta) || Double.isInfinite(eta) || eta <= 0) {
            return null;
        }
        return new WeibullFit(beta, eta, elapsed);
    }

    static RulStatus status(double intervalsLeft) {
        if (intervalsLeft < CRITICAL_INTERVALS) {
            return RulStatus.CRITICAL;
        } else if (intervalsLeft < WARNING_INTERVALS) {
            return RulStatus.WARNING;
        } else {
            return RulStatus.HEALTHY;
        }
    }
}
