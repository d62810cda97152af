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
package com.samsung.sra.sensorwatch.estimators;

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.InvalidInputException;
import com.samsung.sra.sensorwatch.numeric.EigenDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.samsung.sra.sensorwatch.Utilities.fixed;

/**
 * Hotelling T2 / SPE detector over a window of feature vectors.
 *
 * The model is trained once, the first time the window holds max(10, windowSize / 2) rows: columns are standardized
 * with their population sigma (0 replaced by 1), the covariance of the standardized rows is decomposed, and the
 * T2 and SPE thresholds are set at the floor(n * (1 - 1 / (10 * threshold))) order statistic of the training
 * rows' own scores. The trained artifacts stay fixed until reset().
 */
public class PcaEstimator {
    private static final Logger logger = LoggerFactory.getLogger(PcaEstimator.class);

    public static final int MIN_TRAINING_ROWS = 10;
    /** Below this many training rows the thresholds fall back to threshold^2 (T2) and threshold (SPE) */
    static final int MIN_ROWS_FOR_EMPIRICAL_THRESHOLDS = 5;
    static final double EIGENVALUE_EPS = 1e-10;

    private EstimatorState.Pca state = new EstimatorState.Pca();

    public Method getMethod() {
        return Method.PCA;
    }

    public int getMinSamples(DetectorConfig config) {
        return Math.max(MIN_TRAINING_ROWS, (int) Math.ceil(config.getWindowSize() * 0.5));
    }

    public boolean isTrained() {
        return state.isTrained();
    }

    /**
     * Judge vector, which must already be the newest row of windowRows.
     * @throws InvalidInputException if the vector has fewer than two features or does not match the trained model
     */
    public Verdict ingest(double[] vector, String[] names, double[][] windowRows, DetectorConfig config)
            throws InvalidInputException {
        if (vector.length < 2) {
            throw new InvalidInputException("at least 2 sensor values are required for PCA, got " + vector.length);
        }
        if (names.length != vector.length) {
            throw new InvalidInputException("expected one name per feature");
        }
        if (state.isTrained() && state.mean.length != vector.length) {
            throw new InvalidInputException(String.format(
                    "PCA model trained on %d features cannot judge a vector of %d", state.mean.length, vector.length));
        }
        if (!state.isTrained()) {
            int required = getMinSamples(config);
            if (windowRows.length < required) {
                return Verdict.warmup(windowRows.length, required);
            }
            train(windowRows, config);
        }

        double[] x = standardize(vector);
        Statistics stats = statistics(x);
        boolean t2Anomaly = stats.t2 > state.t2Threshold;
        boolean speAnomaly = stats.spe > state.speThreshold;
        boolean anomaly;
        switch (config.getPcaMethod()) {
            case T2:
                anomaly = t2Anomaly;
                break;
            case SPE:
                anomaly = speAnomaly;
                break;
            default:
                anomaly = t2Anomaly || speAnomaly;
        }

        List<Contribution> all = contributions(vector, names, x, stats.reconstructed);
        List<Contribution> filtered = new ArrayList<>();
        for (Contribution c : all) {
            if (filtered.size() >= config.getTopContributors()) {
                break;
            }
            if (c.getNormalizedContribution() >= config.getContributionThreshold()) {
                filtered.add(c);
            }
        }

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("t2", stats.t2);
        details.put("t2Threshold", state.t2Threshold);
        details.put("t2Anomaly", t2Anomaly ? 1d : 0d);
        details.put("spe", stats.spe);
        details.put("speThreshold", state.speThreshold);
        details.put("speAnomaly", speAnomaly ? 1d : 0d);
        details.put("nComponents", (double) state.nComponents);
        details.put("explainedVariance", explainedVariance(state.nComponents));

        String statusText = anomaly && !all.isEmpty() ? "ANOMALY: " + all.get(0).getSensor()
                : "T²=" + fixed(stats.t2, 2) + " SPE=" + fixed(stats.spe, 2);
        return new PcaVerdict(anomaly ? Severity.CRITICAL : Severity.NORMAL, details, statusText,
                "pca-" + config.getPcaMethod().getName(), filtered, all, names.clone(), stats.scores,
                Arrays.copyOf(state.eigenvalues, state.nComponents));
    }

    private void train(double[][] rows, DetectorConfig config) {
        int n = rows.length, d = rows[0].length;
        double[] mean = new double[d], stdDev = new double[d];
        for (double[] row : rows) {
            for (int j = 0; j < d; ++j) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < d; ++j) {
            mean[j] /= n;
        }
        for (double[] row : rows) {
            for (int j = 0; j < d; ++j) {
                stdDev[j] += (row[j] - mean[j]) * (row[j] - mean[j]);
            }
        }
        for (int j = 0; j < d; ++j) {
            stdDev[j] = Math.sqrt(stdDev[j] / n);
            if (stdDev[j] == 0) {
                stdDev[j] = 1;
            }
        }
        EstimatorState.Pca trained = new EstimatorState.Pca();
        trained.mean = mean;
        trained.stdDev = stdDev;
        state = trained;

        double[][] standardized = new double[n][];
        for (int i = 0; i < n; ++i) {
            standardized[i] = standardize(rows[i]);
        }
        EigenDecomposition eig = EigenDecomposition.of(EigenDecomposition.covariance(standardized));
        trained.eigenvalues = eig.eigenvalues;
        trained.eigenvectors = eig.eigenvectors;
        trained.nComponents = chooseComponents(eig.eigenvalues, config);

        double threshold = config.getPcaThreshold();
        if (n < MIN_ROWS_FOR_EMPIRICAL_THRESHOLDS) {
            trained.t2Threshold = threshold * threshold;
            trained.speThreshold = threshold;
        } else {
            double[] t2s = new double[n], spes = new double[n];
            for (int i = 0; i < n; ++i) {
                Statistics s = statistics(standardized[i]);
                t2s[i] = s.t2;
                spes[i] = s.spe;
            }
            Arrays.sort(t2s);
            Arrays.sort(spes);
            int index = Math.min((int) Math.floor(n * (1 - 1 / threshold / 10)), n - 1);
            index = Math.max(index, 0);
            trained.t2Threshold = t2s[index];
            trained.speThreshold = spes[index];
        }
        logger.info("PCA trained on {} rows: {} of {} components ({} variance), T2 threshold {}, SPE threshold {}",
                n, trained.nComponents, d, fixed(explainedVariance(trained.nComponents), 3),
                fixed(trained.t2Threshold, 4), fixed(trained.speThreshold, 4));
    }

    private static int chooseComponents(double[] eigenvalues, DetectorConfig config) {
        int d = eigenvalues.length;
        if (!config.isAutoComponents()) {
            return Math.min(config.getNComponents(), d);
        }
        double total = 0;
        for (double l : eigenvalues) {
            total += Math.max(0, l);
        }
        if (total <= 0) {
            return 1;
        }
        double cumulative = 0;
        for (int k = 0; k < d; ++k) {
            cumulative += Math.max(0, eigenvalues[k]);
            if (cumulative / total >= config.getVarianceThreshold()) {
                return k + 1;
            }
        }
        return d;
    }

    private double explainedVariance(int k) {
        double total = 0, kept = 0;
        for (int i = 0; i < state.eigenvalues.length; ++i) {
            double l = Math.max(0, state.eigenvalues[i]);
            total += l;
            if (i < k) {
                kept += l;
            }
        }
        return total > 0 ? kept / total : 0;
    }

    private double[] standardize(double[] row) {
        double[] ret = new double[row.length];
        for (int j = 0; j < row.length; ++j) {
            ret[j] = (row[j] - state.mean[j]) / state.stdDev[j];
        }
        return ret;
    }

    private Statistics statistics(double[] x) {
        int k = state.nComponents, d = x.length;
        double[] scores = new double[k];
        double[] reconstructed = new double[d];
        double t2 = 0;
        for (int i = 0; i < k; ++i) {
            double[] v = state.eigenvectors[i];
            for (int j = 0; j < d; ++j) {
                scores[i] += x[j] * v[j];
            }
            if (state.eigenvalues[i] > EIGENVALUE_EPS) {
                t2 += scores[i] * scores[i] / state.eigenvalues[i];
            }
            for (int j = 0; j < d; ++j) {
                reconstructed[j] += scores[i] * v[j];
            }
        }
        double spe = 0;
        for (int j = 0; j < d; ++j) {
            spe += (x[j] - reconstructed[j]) * (x[j] - reconstructed[j]);
        }
        return new Statistics(scores, reconstructed, t2, spe);
    }

    private List<Contribution> contributions(double[] vector, String[] names, double[] x, double[] reconstructed) {
        double total = 0;
        double[] raw = new double[x.length];
        for (int j = 0; j < x.length; ++j) {
            raw[j] = Math.abs(x[j] - reconstructed[j]);
            total += raw[j];
        }
        List<Contribution> ret = new ArrayList<>();
        for (int j = 0; j < x.length; ++j) {
            ret.add(new Contribution(names[j], raw[j], total > 0 ? raw[j] / total : 0,
                    vector[j], reconstructed[j] * state.stdDev[j] + state.mean[j]));
        }
        // stable: ties keep input order
        ret.sort(Comparator.comparingDouble(Contribution::getContribution).reversed());
        return ret;
    }

    public EstimatorState getState() {
        return state.copy();
    }

    public void setState(EstimatorState state) {
        if (!(state instanceof EstimatorState.Pca)) {
            throw new IllegalArgumentException("PCA estimator cannot take state " + state);
        }
        this.state = ((EstimatorState.Pca) state).copy();
    }

    public void reset() {
        state = new EstimatorState.Pca();
    }

    private static class Statistics {
        final double[] scores, reconstructed;
        final double t2, spe;

        Statistics(double[] scores, double[] reconstructed, double t2, double spe) {
            this.scores = scores;
            this.reconstructed = reconstructed;
            this.t2 = t2;
            this.spe = spe;
        }
    }
}
