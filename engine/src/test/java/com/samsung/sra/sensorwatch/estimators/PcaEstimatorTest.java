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
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class PcaEstimatorTest {
    private static final String[] NAMES = {"temperature", "pressure", "vibration"};

    /** Rows around (10, 20, 30) whose three features move together */
    static double[][] correlatedRows(int n) {
        double[][] rows = new double[n][];
        for (int i = 0; i < n; ++i) {
            double e = 0.05 * ((i % 5) - 2);
            rows[i] = new double[]{10 + e, 20 + e, 30 + e};
        }
        return rows;
    }

    private static double[][] append(double[][] rows, double[] row) {
        double[][] ret = Arrays.copyOf(rows, rows.length + 1);
        ret[rows.length] = row;
        return ret;
    }

    @Test
    public void warmupUntilTrainingSize() throws InvalidInputException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.PCA).setWindowSize(20);
        PcaEstimator pca = new PcaEstimator();
        assertThat(pca.getMinSamples(config), is(10));
        double[][] rows = correlatedRows(9);
        Verdict v = pca.ingest(rows[8], NAMES, rows, config);
        assertTrue(v.isWarmup());
        assertFalse(pca.isTrained());
        assertThat(pca.getMinSamples(new DetectorConfig().setWindowSize(100)), is(50));
    }

    @Test
    public void outlierOnFirstSensor() throws InvalidInputException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.PCA).setWindowSize(20).setPcaThreshold(2.0);
        PcaEstimator pca = new PcaEstimator();
        double[][] rows = correlatedRows(10);
        Verdict first = pca.ingest(rows[9], NAMES, rows, config);
        assertTrue(pca.isTrained());
        assertFalse(first.isAnomaly());
        assertThat(first.getMethod(), is("pca-t2"));
        assertEquals(1, first.getDetail("nComponents"), 0);

        double[] outlier = {100, 20, 30};
        PcaVerdict v = (PcaVerdict) pca.ingest(outlier, NAMES, append(rows, outlier), config);
        assertTrue(v.isAnomaly());
        assertThat(v.getSeverity(), is(Severity.CRITICAL));
        assertThat(v.getTopContributor(), is("temperature"));
        assertThat(v.getAllContributions().size(), is(3));
        double sum = 0;
        for (Contribution c : v.getAllContributions()) {
            sum += c.getNormalizedContribution();
        }
        assertEquals(1, sum, 1e-9);
        assertTrue(v.getContributions().size() <= config.getTopContributors());
    }

    @Test
    public void stateTransfersTrainedModel() throws InvalidInputException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.PCA).setWindowSize(20);
        PcaEstimator a = new PcaEstimator();
        double[][] rows = correlatedRows(10);
        a.ingest(rows[9], NAMES, rows, config);

        PcaEstimator b = new PcaEstimator();
        b.setState(a.getState());
        assertTrue(b.isTrained());
        double[] probe = {10.02, 20.02, 30.02};
        double[][] window = append(rows, probe);
        assertEquals(a.ingest(probe, NAMES, window, config).getDetail("t2"),
                b.ingest(probe, NAMES, window, config).getDetail("t2"), 0);

        b.reset();
        assertFalse(b.isTrained());
    }

    @Test(expected = InvalidInputException.class)
    public void needsTwoFeatures() throws InvalidInputException {
        new PcaEstimator().ingest(new double[]{1}, new String[]{"a"}, new double[][]{{1}}, new DetectorConfig());
    }

    @Test(expected = InvalidInputException.class)
    public void rejectsDimensionChangeAfterTraining() throws InvalidInputException {
        DetectorConfig config = new DetectorConfig().setWindowSize(20);
        PcaEstimator pca = new PcaEstimator();
        double[][] rows = correlatedRows(10);
        pca.ingest(rows[9], NAMES, rows, config);
        pca.ingest(new double[]{1, 2}, new String[]{"a", "b"}, new double[][]{{1, 2}}, config);
    }
}
