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
package com.samsung.sra.sensorwatch.experiments;

import com.samsung.sra.sensorwatch.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Replay a CSV trace as samples, one line at a time. Lines are timestamp,value or, when the first line is a header
 * starting with "timestamp", timestamp followed by one column per named sensor. Blank lines and lines starting with
 * # are skipped; so are lines whose timestamp does not parse, with a warning. Values are passed on as text so the
 * detector applies its own numeric parsing.
 */
public class TraceReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TraceReader.class);
    private final BufferedReader reader;
    private final String separator;
    private String[] columns = null;
    private boolean started = false;
    private long lineNum = 0;

    public TraceReader(Path traceFile) throws IOException {
        this(Files.newBufferedReader(traceFile), ",");
    }

    public TraceReader(Reader reader, String separator) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.separator = separator;
    }

    /** @return the next sample, or null at end of trace */
    public Sample next() throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            ++lineNum;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] vals = line.split(separator, -1);
            if (!started) {
                started = true;
                if (vals[0].trim().equalsIgnoreCase("timestamp")) {
                    columns = new String[vals.length];
                    for (int i = 0; i < vals.length; ++i) {
                        columns[i] = vals[i].trim();
                    }
                    continue;
                }
            }
            long timestamp;
            try {
                timestamp = Long.parseLong(vals[0].trim());
            } catch (NumberFormatException e) {
                logger.warn("line {}: bad timestamp {}, skipping", lineNum, vals[0]);
                continue;
            }
            if (vals.length < 2) {
                logger.warn("line {}: no value, skipping", lineNum);
                continue;
            }
            if (columns == null || columns.length == 2) {
                return Sample.ofRaw(vals[1].trim()).withTimestamp(timestamp);
            }
            LinkedHashMap<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i < columns.length && i < vals.length; ++i) {
                values.put(columns[i], vals[i].trim());
            }
            return Sample.of(values).withTimestamp(timestamp);
        }
    }

    /** Column names after the timestamp, or null for a headerless trace */
    public String[] getColumns() {
        return columns;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
