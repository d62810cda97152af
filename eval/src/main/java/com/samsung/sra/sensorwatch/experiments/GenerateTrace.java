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

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.SplittableRandom;

/**
 * Write a synthetic sensor trace: Gaussian noise around a base level per sensor, with an optional step fault and an
 * optional linear drift starting at given sample indices.
 */
class GenerateTrace {
    private static final Logger logger = LoggerFactory.getLogger(GenerateTrace.class);

    static class Params {
        List<String> sensors;
        long samples = 1000, interval = 1000, seed = 0;
        double base = 50, noise = 1;
        long stepAt = -1, driftAt = -1;
        double stepSize = 10, driftRate = 0.1;
    }

    static void generate(Params p, Writer out) throws IOException {
        SplittableRandom random = new SplittableRandom(p.seed);
        if (p.sensors.size() > 1) {
            out.write("timestamp," + String.join(",", p.sensors) + "\n");
        }
        for (long i = 0; i < p.samples; ++i) {
            StringBuilder line = new StringBuilder().append(i * p.interval);
            for (int s = 0; s < p.sensors.size(); ++s) {
                double v = p.base + p.noise * gaussian(random);
                // faults hit the first sensor only
                if (s == 0) {
                    if (p.stepAt >= 0 && i >= p.stepAt) v += p.stepSize;
                    if (p.driftAt >= 0 && i >= p.driftAt) v += p.driftRate * (i - p.driftAt);
                }
                line.append(',').append(String.format(Locale.ROOT, "%.4f", v));
            }
            out.write(line.append('\n').toString());
        }
    }

    /** Box-Muller; SplittableRandom has no nextGaussian */
    private static double gaussian(SplittableRandom random) {
        double u = 1 - random.nextDouble(), v = random.nextDouble();
        return Math.sqrt(-2 * Math.log(u)) * Math.cos(2 * Math.PI * v);
    }

    public static void main(String[] args) throws IOException {
        ArgumentParser parser = ArgumentParsers.newArgumentParser("GenerateTrace", false)
                .description("generate a synthetic CSV sensor trace with injected faults")
                .defaultHelp(true);
        parser.addArgument("outfile").help("output CSV");
        parser.addArgument("-sensors").nargs("+").setDefault(Collections.singletonList("value")).help("sensor names");
        parser.addArgument("-samples").type(Long.class).setDefault(1000L);
        parser.addArgument("-interval").help("ms between samples").type(Long.class).setDefault(1000L);
        parser.addArgument("-seed").type(Long.class).setDefault(0L);
        parser.addArgument("-base").type(Double.class).setDefault(50d);
        parser.addArgument("-noise").help("noise standard deviation").type(Double.class).setDefault(1d);
        parser.addArgument("-step-at").help("sample index of a step fault").type(Long.class).setDefault(-1L);
        parser.addArgument("-step-size").type(Double.class).setDefault(10d);
        parser.addArgument("-drift-at").help("sample index where linear drift starts").type(Long.class).setDefault(-1L);
        parser.addArgument("-drift-rate").help("drift per sample").type(Double.class).setDefault(0.1d);

        Params p = new Params();
        String outfile;
        try {
            Namespace parsed = parser.parseArgs(args);
            outfile = parsed.getString("outfile");
            p.sensors = parsed.getList("sensors");
            p.samples = parsed.getLong("samples");
            p.interval = parsed.getLong("interval");
            p.seed = parsed.getLong("seed");
            p.base = parsed.getDouble("base");
            p.noise = parsed.getDouble("noise");
            p.stepAt = parsed.getLong("step_at");
            p.stepSize = parsed.getDouble("step_size");
            p.driftAt = parsed.getLong("drift_at");
            p.driftRate = parsed.getDouble("drift_rate");
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(2);
            return;
        }
        try (BufferedWriter out = Files.newBufferedWriter(Paths.get(outfile))) {
            generate(p, out);
        }
        logger.info("wrote {} samples of {} to {}", p.samples, p.sensors, outfile);
    }
}
