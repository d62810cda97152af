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
package com.samsung.sra.sensorwatch.numeric;

/**
 * Closed-form least squares over the points (0, y0), (1, y1), ... A zero denominator (fewer than two points) gives
 * slope 0.
 */
public class LinearRegression {
    public final int n;
    public final double slope, intercept;
    /** Coefficient of determination; 1 when the data has no variance at all */
    public final double rSquared;
    /** sqrt(SSres / (n - 2)), 0 for n <= 2 */
    public final double residualStdError;
    /** Standard error of the slope estimate */
    public final double slopeStdError;

    private LinearRegression(int n, double slope, double intercept, double rSquared,
                             double residualStdError, double slopeStdError) {
        this.n = n;
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.residualStdError = residualStdError;
        this.slopeStdError = slopeStdError;
    }

    public static LinearRegression fit(double[] y) {
        int n = y.length;
        double meanX = (n - 1) / 2.0;
        double meanY = Numerics.mean(y);

        double numerator = 0, denominator = 0;
        for (int i = 0; i < n; ++i) {
            numerator += (i - meanX) * (y[i] - meanY);
            denominator += (i - meanX) * (i - meanX);
        }
        double slope = denominator != 0 ? numerator / denominator : 0;
        double intercept = meanY - slope * meanX;

        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; ++i) {
            double fitted = slope * i + intercept;
            ssRes += (y[i] - fitted) * (y[i] - fitted);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }
        double rSquared = ssTot > 0 ? 1 - ssRes / ssTot : 1;
        double residualStdError = n > 2 ? Math.sqrt(ssRes / (n - 2)) : 0;
        double slopeStdError = denominator > 0 ? residualStdError / Math.sqrt(denominator) : 0;
        return new LinearRegression(n, slope, intercept, rSquared, residualStdError, slopeStdError);
    }

    public double predict(double x) {
        return slope * x + intercept;
    }

    /** The next steps values after the fitted range, i.e. at x = n, n+1, ..., n+steps-1 */
    public double[] forecast(int steps) {
        double[] ret = new double[steps];
        for (int i = 1; i <= steps; ++i) {
            ret[i - 1] = predict(n + i - 1);
        }
        return ret;
    }

    public String getTrend() {
        return Numerics.trendLabel(slope);
    }
}
