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
import com.samsung.sra.sensorwatch.DetectorException;
import com.samsung.sra.sensorwatch.DetectorSession;
import com.samsung.sra.sensorwatch.Output;
import com.samsung.sra.sensorwatch.Sample;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Run a detector over a CSV trace and print one tab-separated line per judged sample */
class ReplayTrace {
    private static final Logger logger = LoggerFactory.getLogger(ReplayTrace.class);

    static class Counts {
        long samples = 0, anomalies = 0, rejected = 0;
    }

    static Counts replay(DetectorSession session, TraceReader trace, boolean anomaliesOnly, PrintStream out)
            throws Exception {
        Counts counts = new Counts();
        Sample sample;
        while ((sample = trace.next()) != null) {
            ++counts.samples;
            Output output;
            try {
                output = session.ingest(sample);
            } catch (DetectorException e) {
                ++counts.rejected;
                logger.warn("rejected {}: {}", sample, e.getMessage());
                continue;
            }
            boolean anomalous = output.getSink() == Output.Sink.ANOMALY;
            if (anomalous) {
                ++counts.anomalies;
            }
            if (anomalous || !anomaliesOnly) {
                out.println(format(output));
            }
        }
        return counts;
    }

    static String format(Output output) {
        StringBuilder sb = new StringBuilder();
        sb.append(output.getTimestamp())
                .append('\t').append(output.isMultiSensor() ? String.join(",", output.getStreams().keySet())
                        : String.valueOf(output.getPayload()))
                .append('\t').append(output.getSeverity().getName())
                .append('\t').append(output.isAnomaly());
        if (output.isMultiSensor()) {
            sb.append('\t').append(String.join(",", output.getAnomalySensors()));
        }
        if (output.getHealth() != null) {
            sb.append('\t').append(output.getHealth().getStatus().getName());
        }
        sb.append('\t').append(output.getStatusText() != null ? output.getStatusText() : "");
        return sb.toString();
    }

    public static void main(String[] args) throws Exception {
        ArgumentParser parser = ArgumentParsers.newArgumentParser("ReplayTrace", false)
                .description("replay a CSV trace through a detector configured by a toml file")
                .defaultHelp(true);
        parser.addArgument("conf").help("detector config file").type(File.class);
        parser.addArgument("trace").help("CSV trace: timestamp,value or a header row with sensor names")
                .type(File.class);
        parser.addArgument("-anomalies-only").help("only print samples routed to the anomaly output")
                .action(Arguments.storeTrue());
        parser.addArgument("-state").help("file to restore detector state from and save it to afterwards")
                .type(File.class);

        DetectorConfig config;
        Path trace;
        boolean anomaliesOnly;
        File stateFile;
        try {
            Namespace parsed = parser.parseArgs(args);
            config = new DetectorConfiguration((File) parsed.get("conf")).getDetectorConfig();
            trace = ((File) parsed.get("trace")).toPath();
            anomaliesOnly = parsed.getBoolean("anomalies_only");
            stateFile = parsed.get("state");
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(2);
            return;
        }

        try (DetectorSession session = new DetectorSession(config);
             TraceReader reader = new TraceReader(trace)) {
            if (stateFile != null) {
                try {
                    if (session.loadState(Files.readAllBytes(stateFile.toPath()))) {
                        logger.info("resumed from {}", stateFile);
                    }
                } catch (NoSuchFileException e) {
                    logger.info("no saved state at {}, starting fresh", stateFile);
                }
            }
            long ts = System.currentTimeMillis();
            Counts counts = replay(session, reader, anomaliesOnly, System.out);
            long te = System.currentTimeMillis();
            logger.info("{} samples, {} anomalous, {} rejected in {} ms",
                    counts.samples, counts.anomalies, counts.rejected, te - ts);
            if (stateFile != null) {
                Files.write(stateFile.toPath(), session.saveState());
                logger.info("saved state to {}", stateFile);
            }
        }
    }
}
