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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Verdict of the PCA estimator, carrying the per-feature breakdown next to the T2/SPE details */
public class PcaVerdict extends Verdict {
    private final List<Contribution> contributions, allContributions;
    private final String[] sensorNames;
    private final double[] scores, eigenvalues;

    PcaVerdict(Severity severity, Map<String, Double> details, String statusText, String method,
               List<Contribution> contributions, List<Contribution> allContributions,
               String[] sensorNames, double[] scores, double[] eigenvalues) {
        super(severity, details, statusText, null, method);
        this.contributions = contributions;
        this.allContributions = allContributions;
        this.sensorNames = sensorNames;
        this.scores = scores;
        this.eigenvalues = eigenvalues;
    }

    /** Top contributors at or above the configured share, at most topContributors of them */
    public List<Contribution> getContributions() {
        return Collections.unmodifiableList(contributions);
    }

    /** Every feature, largest contribution first */
    public List<Contribution> getAllContributions() {
        return Collections.unmodifiableList(allContributions);
    }

    /** Feature with the largest contribution, whether or not it passed the share filter */
    public String getTopContributor() {
        return allContributions.isEmpty() ? null : allContributions.get(0).getSensor();
    }

    public List<String> getSensorNames() {
        return Collections.unmodifiableList(Arrays.asList(sensorNames));
    }

    /** Projections on the retained components */
    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    /** Eigenvalues of the retained components */
    public double[] getEigenvalues() {
        return Arrays.copyOf(eigenvalues, eigenvalues.length);
    }
}
