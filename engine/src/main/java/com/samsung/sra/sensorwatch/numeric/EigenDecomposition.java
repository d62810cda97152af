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

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Eigendecomposition of a symmetric positive semi-definite matrix (in practice a covariance matrix) by power iteration
 * with deflation. Eigenvalues are sorted in descending order; eigenvectors[i] is the unit eigenvector for
 * eigenvalues[i].
 */
public class EigenDecomposition {
    public static final int ITERATIONS = 100;
    private static final double EPS = 1e-12;

    public final double[] eigenvalues;
    public final double[][] eigenvectors;

    private EigenDecomposition(double[] eigenvalues, double[][] eigenvectors) {
        this.eigenvalues = eigenvalues;
        this.eigenvectors = eigenvectors;
    }

    public static EigenDecomposition of(double[][] symmetric) {
        int n = symmetric.length;
        double[][] m = new double[n][];
        for (int i = 0; i < n; ++i) {
            m[i] = Arrays.copyOf(symmetric[i], n);
        }

        double[] values = new double[n];
        double[][] vectors = new double[n][];
        for (int c = 0; c < n; ++c) {
            double[] v = startVector(n, c, vectors);
            for (int it = 0; it < ITERATIONS; ++it) {
                double[] w = multiply(m, v);
                double norm = norm(w);
                if (norm < EPS) {
                    break; // remaining spectrum is (numerically) zero
                }
                for (int j = 0; j < n; ++j) {
                    v[j] = w[j] / norm;
                }
            }
            double lambda = dot(v, multiply(m, v));
            values[c] = lambda;
            vectors[c] = v;
            // deflate: M <- M - lambda v v^T
            for (int i = 0; i < n; ++i) {
                for (int j = 0; j < n; ++j) {
                    m[i][j] -= lambda * v[i] * v[j];
                }
            }
        }

        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());
        double[] sortedValues = new double[n];
        double[][] sortedVectors = new double[n][];
        for (int i = 0; i < n; ++i) {
            sortedValues[i] = values[order[i]];
            sortedVectors[i] = vectors[order[i]];
        }
        return new EigenDecomposition(sortedValues, sortedVectors);
    }

    /**
     * Deterministic start: the all-ones vector tilted towards e_c, made orthogonal to the vectors already found so a
     * deflated-away direction cannot trap the iteration at zero. Falls back to the first basis vector that survives.
     */
    private static double[] startVector(int n, int c, double[][] found) {
        double[] v = new double[n];
        Arrays.fill(v, 1);
        v[c] += 1;
        if (orthonormalize(v, found, c)) {
            return v;
        }
        for (int k = 0; k < n; ++k) {
            v = new double[n];
            v[k] = 1;
            if (orthonormalize(v, found, c)) {
                return v;
            }
        }
        v = new double[n];
        v[c] = 1;
        return v;
    }

    private static boolean orthonormalize(double[] v, double[][] found, int count) {
        for (int i = 0; i < count; ++i) {
            double proj = dot(v, found[i]);
            for (int j = 0; j < v.length; ++j) {
                v[j] -= proj * found[i][j];
            }
        }
        double norm = norm(v);
        if (norm < 1e-8) {
            return false;
        }
        for (int j = 0; j < v.length; ++j) {
            v[j] /= norm;
        }
        return true;
    }

    static double[] multiply(double[][] m, double[] v) {
        double[] ret = new double[v.length];
        for (int i = 0; i < m.length; ++i) {
            double sum = 0;
            for (int j = 0; j < v.length; ++j) {
                sum += m[i][j] * v[j];
            }
            ret[i] = sum;
        }
        return ret;
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; ++i) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    /** Sample covariance (1/(n-1)) X^T X of already-centered rows */
    public static double[][] covariance(double[][] centeredRows) {
        int n = centeredRows.length;
        int p = n > 0 ? centeredRows[0].length : 0;
        double[][] cov = new double[p][p];
        double denom = n > 1 ? n - 1 : 1;
        for (double[] row : centeredRows) {
            for (int i = 0; i < p; ++i) {
                for (int j = i; j < p; ++j) {
                    cov[i][j] += row[i] * row[j];
                }
            }
        }
        for (int i = 0; i < p; ++i) {
            for (int j = i; j < p; ++j) {
                cov[i][j] /= denom;
                cov[j][i] = cov[i][j];
            }
        }
        return cov;
    }

    public static double trace(double[][] m) {
        double sum = 0;
        for (int i = 0; i < m.length; ++i) {
            sum += m[i][i];
        }
        return sum;
    }
}
