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

import com.samsung.sra.sensorwatch.estimators.Severity;

import java.util.Locale;

/** Status indicator of a session: a colored dot or ring with a short text */
public class DetectorStatus {
    public enum Fill {BLUE, GREEN, YELLOW, RED}

    public enum Shape {DOT, RING}

    private final Fill fill;
    private final Shape shape;
    private final String text;

    public DetectorStatus(Fill fill, Shape shape, String text) {
        this.fill = fill;
        this.shape = shape;
        this.text = text;
    }

    public static DetectorStatus waiting() {
        return new DetectorStatus(Fill.BLUE, Shape.RING, "waiting for data");
    }

    public static DetectorStatus reset() {
        return new DetectorStatus(Fill.BLUE, Shape.RING, "reset");
    }

    public static DetectorStatus error(String message) {
        return new DetectorStatus(Fill.RED, Shape.RING, "error: " + message);
    }

    public static DetectorStatus of(Output output) {
        Severity severity = output.getSeverity();
        String text = output.getStatusText() != null ? output.getStatusText() : severity.getName();
        if (output.getExternalError() != null) {
            return new DetectorStatus(Fill.YELLOW, Shape.RING, "external error: " + output.getExternalError());
        }
        boolean held = output.getHysteresis() != null && output.getHysteresis().isApplied();
        Shape shape = held ? Shape.RING : Shape.DOT;
        switch (severity) {
            case WARMUP:
                return new DetectorStatus(Fill.YELLOW, Shape.RING, text);
            case CRITICAL:
                return new DetectorStatus(Fill.RED, shape, text);
            case WARNING:
                return new DetectorStatus(Fill.YELLOW, shape, text);
            default:
                return new DetectorStatus(Fill.GREEN, shape, text);
        }
    }

    public Fill getFill() {
        return fill;
    }

    public Shape getShape() {
        return shape;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return fill.name().toLowerCase(Locale.ROOT) + " " + shape.name().toLowerCase(Locale.ROOT) + ": " + text;
    }
}
