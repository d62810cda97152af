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
package com.samsung.sra.sensorwatch.hysteresis;

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.estimators.Severity;
import com.samsung.sra.sensorwatch.estimators.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;

/**
 * Two-state debounce (Normal / Alarm) applied to raw verdicts.
 *
 * Normal -> Alarm after consecutiveCount raw anomalies in a row. Alarm -> Normal after
 * ceil(consecutiveCount * (1 + hysteresisPercent / 100)) raw normals in a row; until then the alarm is held and
 * reported as a warning. While disabled the raw verdict passes through and the counters are not touched.
 */
public class Hysteresis implements Serializable {
    private static final Logger logger = LoggerFactory.getLogger(Hysteresis.class);
    private static final double EPS = 1e-9;

    private boolean lastAnomaly = false;
    private int consecutiveAnomalies = 0;
    private int consecutiveNormals = 0;

    public Hysteresis() {
    }

    public Hysteresis(Hysteresis that) {
        this.lastAnomaly = that.lastAnomaly;
        this.consecutiveAnomalies = that.consecutiveAnomalies;
        this.consecutiveNormals = that.consecutiveNormals;
    }

    /** Number of raw normals needed to leave the alarm state */
    public static int releaseCount(int consecutiveCount, double hysteresisPercent) {
        return (int) Math.ceil(consecutiveCount * (1 + hysteresisPercent / 100) - EPS);
    }

    public Outcome apply(Verdict raw, DetectorConfig config) {
        if (!config.isHysteresisEnabled()) {
            return new Outcome(raw.isAnomaly(), raw.getSeverity(), false, false,
                    consecutiveAnomalies, consecutiveNormals);
        }
        boolean rawAnomaly = raw.isAnomaly();
        boolean anomaly;
        if (rawAnomaly) {
            ++consecutiveAnomalies;
            consecutiveNormals = 0;
            if (!lastAnomaly && consecutiveAnomalies >= config.getConsecutiveCount()) {
                lastAnomaly = true;
            }
            anomaly = lastAnomaly;
        } else {
            ++consecutiveNormals;
            consecutiveAnomalies = 0;
            if (lastAnomaly && consecutiveNormals >= releaseCount(config.getConsecutiveCount(),
                    config.getHysteresisPercent())) {
                lastAnomaly = false;
            }
            anomaly = lastAnomaly;
        }
        Severity severity;
        if (!anomaly) {
            severity = Severity.NORMAL;
        } else if (rawAnomaly) {
            severity = raw.getSeverity();
        } else {
            severity = Severity.WARNING; // held alarm
        }
        logger.debug("raw {} -> final {} ({} anomalies, {} normals in a row)",
                raw.getSeverity(), severity, consecutiveAnomalies, consecutiveNormals);
        return new Outcome(anomaly, severity, anomaly != rawAnomaly, true, consecutiveAnomalies, consecutiveNormals);
    }

    public boolean isInAlarm() {
        return lastAnomaly;
    }

    public int getConsecutiveAnomalies() {
        return consecutiveAnomalies;
    }

    public int getConsecutiveNormals() {
        return consecutiveNormals;
    }

    public void reset() {
        lastAnomaly = false;
        consecutiveAnomalies = 0;
        consecutiveNormals = 0;
    }

    /** Debounced verdict of one sample */
    public static class Outcome implements Serializable {
        private final boolean anomaly;
        private final Severity severity;
        private final boolean applied, enabled;
        private final int consecutiveAnomalies, consecutiveNormals;

        Outcome(boolean anomaly, Severity severity, boolean applied, boolean enabled,
                int consecutiveAnomalies, int consecutiveNormals) {
            this.anomaly = anomaly;
            this.severity = severity;
            this.applied = applied;
            this.enabled = enabled;
            this.consecutiveAnomalies = consecutiveAnomalies;
            this.consecutiveNormals = consecutiveNormals;
        }

        /** Pass-through outcome for samples that never reach the state machine (warmup) */
        public static Outcome passThrough(Verdict raw, boolean enabled) {
            return new Outcome(raw.isAnomaly(), raw.getSeverity(), false, enabled, 0, 0);
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public Severity getSeverity() {
            return severity;
        }

        /** true when the debounce changed the raw anomaly flag */
        public boolean isApplied() {
            return applied;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public int getConsecutiveAnomalies() {
            return consecutiveAnomalies;
        }

        public int getConsecutiveNormals() {
            return consecutiveNormals;
        }
    }
}
