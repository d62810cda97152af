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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw (pre-hysteresis) judgement of one sample by one estimator. isAnomaly() is derived from the severity, so a
 * verdict is anomalous exactly when its severity is warning or critical.
 *
 * Non-finite detail values never leave this class: they are replaced by 0 and the verdict is flagged as a numeric
 * fault, which upgrades an otherwise normal verdict to a warning.
 */
public class Verdict implements Serializable {
    private static final Logger logger = LoggerFactory.getLogger(Verdict.class);

    private final Severity severity;
    private final LinkedHashMap<String, Double> details;
    private final String statusText;
    private final String reason;
    private final String method;
    private final boolean numericFault;

    public Verdict(Severity severity, Map<String, Double> details, String statusText) {
        this(severity, details, statusText, null, null);
    }

    public Verdict(Severity severity, Map<String, Double> details, String statusText, String reason, String method) {
        LinkedHashMap<String, Double> clean = new LinkedHashMap<>();
        boolean fault = false;
        if (details != null) {
            for (Map.Entry<String, Double> e : details.entrySet()) {
                Double v = e.getValue();
                if (v == null) {
                    continue;
                }
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    logger.warn("non-finite {} = {} replaced by 0", e.getKey(), v);
                    clean.put(e.getKey(), 0d);
                    fault = true;
                } else {
                    clean.put(e.getKey(), v);
                }
            }
        }
        this.numericFault = fault;
        this.severity = fault && severity == Severity.NORMAL ? Severity.WARNING : severity;
        this.details = clean;
        this.statusText = statusText;
        this.reason = reason;
        this.method = method;
    }

    public static Verdict warmup(int bufferSize, int minRequired) {
        Map<String, Double> details = new LinkedHashMap<>();
        details.put("minRequired", (double) minRequired);
        return new Verdict(Severity.WARMUP, details, "warmup " + bufferSize + "/" + minRequired);
    }

    /** Normal verdict used while a stateful estimator seeds itself from its first sample */
    public static Verdict initializing(Map<String, Double> details) {
        return new Verdict(Severity.NORMAL, details, "initializing");
    }

    public boolean isAnomaly() {
        return severity.isAnomalous();
    }

    public boolean isWarmup() {
        return severity == Severity.WARMUP;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Map<String, Double> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public Double getDetail(String key) {
        return details.get(key);
    }

    public String getStatusText() {
        return statusText;
    }

    /** Human readable cause, only set by detectors that have one (threshold) */
    public String getReason() {
        return reason;
    }

    /** Method that actually produced this verdict if it differs from the configured one (e.g. a fallback), else null */
    public String getMethod() {
        return method;
    }

    public boolean isNumericFault() {
        return numericFault;
    }

    @Override
    public String toString() {
        return String.format("<verdict: %s %s %s>", severity, statusText, details);
    }
}
