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

import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.DetectorConfiguration;
import com.samsung.sra.sensorwatch.DetectorSession;
import com.samsung.sra.sensorwatch.Sample;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TraceReaderTest {
    private static String resource(String name) throws Exception {
        return Paths.get(TraceReaderTest.class.getResource("/" + name).toURI()).toString();
    }

    @Test
    public void headerlessTrace() throws Exception {
        try (TraceReader reader = new TraceReader(new StringReader("# comment\n\n5,1.5\n7, 2.5 \n"), ",")) {
            Sample s = reader.next();
            assertThat(s.getTimestamp(), is(5L));
            assertThat(s.getPayload(), is("1.5"));
            s = reader.next();
            assertThat(s.getTimestamp(), is(7L));
            assertThat(s.getPayload(), is("2.5"));
            assertThat(reader.next(), nullValue());
            assertThat(reader.getColumns(), nullValue());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void namedColumns() throws Exception {
        try (TraceReader reader = new TraceReader(Paths.get(resource("pumps.csv")))) {
            Sample first = reader.next();
            assertThat(Arrays.asList(reader.getColumns()), is(Arrays.asList("timestamp", "pump1", "pump2")));
            Map<String, Object> values = (Map<String, Object>) first.getPayload();
            assertThat(values.get("pump1"), is("10.0"));
            assertThat(values.get("pump2"), is("20.0"));
            int n = 1;
            while (reader.next() != null) {
                ++n;
            }
            // the "bad" line is skipped
            assertThat(n, is(13));
        }
    }

    @Test
    public void replayFlagsSpike() throws Exception {
        DetectorConfig config = new DetectorConfiguration(new File(resource("replay.toml"))).getDetectorConfig();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ReplayTrace.Counts counts;
        try (DetectorSession session = new DetectorSession(config);
             TraceReader reader = new TraceReader(Paths.get(resource("pumps.csv")));
             PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
            counts = ReplayTrace.replay(session, reader, true, out);
        }
        assertThat(counts.samples, is(13L));
        assertThat(counts.rejected, is(0L));
        assertThat(counts.anomalies, is(1L));
        String printed = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(printed.startsWith("12000\t"));
        assertThat(printed, containsString("\tpump2\t"));
    }

    @Test
    public void generatedTraceIsReadable() throws Exception {
        GenerateTrace.Params p = new GenerateTrace.Params();
        p.sensors = Arrays.asList("temperature", "vibration");
        p.samples = 50;
        p.stepAt = 40;
        p.seed = 7;
        StringWriter out = new StringWriter();
        GenerateTrace.generate(p, out);
        try (TraceReader reader = new TraceReader(new StringReader(out.toString()), ",")) {
            double before = 0, after = 0;
            Sample s;
            int i = 0;
            while ((s = reader.next()) != null) {
                @SuppressWarnings("unchecked")
                double t = Double.parseDouble((String) ((Map<String, Object>) s.getPayload()).get("temperature"));
                if (i < 40) before += t / 40;
                else after += t / 10;
                ++i;
            }
            assertThat(i, is(50));
            assertEquals(10, after - before, 2);
        }
    }
}
