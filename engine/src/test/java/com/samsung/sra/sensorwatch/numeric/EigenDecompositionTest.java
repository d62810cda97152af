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

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class EigenDecompositionTest {
    @Test
    public void diagonalMatrix() {
        EigenDecomposition eig = EigenDecomposition.of(new double[][]{{1, 0, 0}, {0, 5, 0}, {0, 0, 3}});
        assertEquals(5, eig.eigenvalues[0], 1e-6);
        assertEquals(3, eig.eigenvalues[1], 1e-6);
        assertEquals(1, eig.eigenvalues[2], 1e-6);
        assertEquals(1, Math.abs(eig.eigenvectors[0][1]), 1e-6);
    }

    @Test
    public void eigenvectorsSatisfyDefinition() {
        double[][] m = {{4, 1}, {1, 3}};
        EigenDecomposition eig = EigenDecomposition.of(m);
        for (int c = 0; c < 2; ++c) {
            double[] v = eig.eigenvectors[c];
            double[] mv = EigenDecomposition.multiply(m, v);
            for (int i = 0; i < 2; ++i) {
                assertEquals(eig.eigenvalues[c] * v[i], mv[i], 1e-6);
            }
            assertEquals(1, EigenDecomposition.norm(v), 1e-9);
        }
    }

    @Test
    public void eigenvaluesSumToTraceOfCorrelatedCovariance() {
        Random random = new Random(42);
        int n = 60;
        double[][] rows = new double[n][3];
        for (int i = 0; i < n; ++i) {
            double base = random.nextGaussian();
            rows[i][0] = base + 0.1 * random.nextGaussian();
            rows[i][1] = 2 * base + 0.1 * random.nextGaussian();
            rows[i][2] = -base + 0.5 * random.nextGaussian();
        }
        double[] mean = new double[3];
        for (double[] row : rows) {
            for (int j = 0; j < 3; ++j) {
                mean[j] += row[j] / n;
            }
        }
        for (double[] row : rows) {
            for (int j = 0; j < 3; ++j) {
                row[j] -= mean[j];
            }
        }
        double[][] cov = EigenDecomposition.covariance(rows);
        EigenDecomposition eig = EigenDecomposition.of(cov);
        double sum = 0;
        for (double lambda : eig.eigenvalues) {
            sum += lambda;
        }
        double trace = EigenDecomposition.trace(cov);
        assertTrue(Math.abs(sum - trace) / trace < 0.01);
        assertTrue(eig.eigenvalues[0] >= eig.eigenvalues[1] && eig.eigenvalues[1] >= eig.eigenvalues[2]);
    }
}
