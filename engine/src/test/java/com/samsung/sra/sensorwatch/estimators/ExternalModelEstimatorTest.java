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
import com.samsung.sra.sensorwatch.ExternalRuntimeException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExternalModelEstimatorTest {
    /** Reconstructs every input shifted by a fixed offset */
    static class ShiftingRuntime implements ModelRuntime {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch predictRequested = new CountDownLatch(1);
        double offset = 0;
        boolean healthy = true;
        CompletableFuture<double[]> pending = null;

        @Override
        public CompletableFuture<Void> loadModel(String path, String modelId) {
            calls.add("load " + modelId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<double[]> predict(String modelId, double[] input) {
            calls.add("predict " + input.length);
            predictRequested.countDown();
            if (pending != null) {
                return pending;
            }
            double[] out = new double[input.length];
            for (int i = 0; i < input.length; ++i) {
                out[i] = input[i] + offset;
            }
            return CompletableFuture.completedFuture(out);
        }

        @Override
        public CompletableFuture<Void> unloadModel(String modelId) {
            calls.add("unload " + modelId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isHealthy() {
            return healthy;
        }
    }

    private static DetectorConfig config() {
        return new DetectorConfig().setMethod(Method.ML).setWindowSize(20).setModelId("ae").setModelPath("/models/ae")
                .setMlThreshold(0.1).setMlTimeoutMs(200);
    }

    private static double[] ramp(int n) {
        double[] ret = new double[n];
        for (int i = 0; i < n; ++i) {
            ret[i] = i;
        }
        return ret;
    }

    @Test
    public void reconstructionErrorDecidesSeverity() throws ExternalRuntimeException {
        ShiftingRuntime runtime = new ShiftingRuntime();
        ExternalModelEstimator ml = new ExternalModelEstimator(new ModelClient(runtime));
        assertThat(ml.getMinSamples(config()), is(10));

        Verdict normal = ml.ingest(11, ramp(12), config());
        assertThat(normal.getSeverity(), is(Severity.NORMAL));
        assertEquals(0, normal.getDetail("reconstructionError"), 0);
        assertEquals(10, normal.getDetail("inputLength"), 0);
        assertThat(runtime.calls.get(0), is("load ae"));
        assertThat(runtime.calls.get(1), is("predict 10"));

        runtime.offset = 0.3; // error 0.09
        assertThat(ml.ingest(11, ramp(12), config()).getSeverity(), is(Severity.WARNING));
        runtime.offset = 0.5; // error 0.25
        Verdict critical = ml.ingest(11, ramp(12), config());
        assertThat(critical.getSeverity(), is(Severity.CRITICAL));
        assertEquals(1 / (1 + 2.5), critical.getDetail("confidence"), 1e-9);
        assertThat(runtime.calls.size(), is(4));
    }

    @Test
    public void fallsBackToZScoreWithoutUsableRuntime() throws ExternalRuntimeException {
        ShiftingRuntime runtime = new ShiftingRuntime();
        runtime.healthy = false;
        ExternalModelEstimator ml = new ExternalModelEstimator(new ModelClient(runtime));
        assertThat(ml.getMinSamples(config()), is(2));
        Verdict v = ml.ingest(3, new double[]{1, 2, 3}, config());
        assertThat(v.getMethod(), is("zscore"));
        assertEquals(1, v.getDetail("fallback"), 0);
        assertTrue(runtime.calls.isEmpty());

        Verdict noRuntime = new ExternalModelEstimator(new ModelClient(null)).ingest(3, new double[]{1, 2, 3}, config());
        assertThat(noRuntime.getMethod(), is("zscore"));
    }

    @Test
    public void timeoutSurfacesAsExternalError() {
        ShiftingRuntime runtime = new ShiftingRuntime();
        runtime.pending = new CompletableFuture<>();
        ExternalModelEstimator ml = new ExternalModelEstimator(new ModelClient(runtime));
        try {
            ml.ingest(11, ramp(12), config().setMlTimeoutMs(20));
            fail("expected a timeout");
        } catch (ExternalRuntimeException e) {
            assertTrue(runtime.pending.isCancelled());
        }
    }

    @Test
    public void failedPredictionSurfacesAsExternalError() {
        ShiftingRuntime runtime = new ShiftingRuntime();
        runtime.pending = new CompletableFuture<>();
        runtime.pending.completeExceptionally(new IllegalStateException("device lost"));
        ExternalModelEstimator ml = new ExternalModelEstimator(new ModelClient(runtime));
        try {
            ml.ingest(11, ramp(12), config());
            fail("expected a failure");
        } catch (ExternalRuntimeException e) {
            assertTrue(e.getMessage().contains("device lost"));
        }
    }

    @Test
    public void closeUnloadsOnce() throws ExternalRuntimeException {
        ShiftingRuntime runtime = new ShiftingRuntime();
        ModelClient client = new ModelClient(runtime);
        new ExternalModelEstimator(client).ingest(11, ramp(12), config());
        assertTrue(client.isLoaded());
        client.close(100);
        client.close(100);
        assertFalse(client.isLoaded());
        assertThat(runtime.calls.get(runtime.calls.size() - 1), is("unload ae"));
        assertThat(runtime.calls.size(), is(3));
        assertFalse(client.isAvailable(config()));
    }

    /** Runs one ingest on its own thread, keeping the verdict or the failure */
    private static class IngestThread extends Thread {
        final ExternalModelEstimator ml;
        final DetectorConfig config;
        final AtomicReference<Verdict> verdict = new AtomicReference<>();
        final AtomicReference<Exception> failure = new AtomicReference<>();

        IngestThread(ExternalModelEstimator ml, DetectorConfig config) {
            this.ml = ml;
            this.config = config;
        }

        @Override
        public void run() {
            try {
                verdict.set(ml.ingest(11, ramp(12), config));
            } catch (Exception e) {
                failure.set(e);
            }
        }
    }

    private static void awaitPendingCall(ModelClient client) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!client.hasPendingCall()) {
            assertTrue("call never became pending", System.currentTimeMillis() < deadline);
            Thread.sleep(1);
        }
    }

    @Test
    public void closeFromAnotherThreadWaitsForSlowCall() throws Exception {
        ShiftingRuntime runtime = new ShiftingRuntime();
        runtime.pending = new CompletableFuture<>();
        ModelClient client = new ModelClient(runtime);
        IngestThread ingest = new IngestThread(new ExternalModelEstimator(client), config().setMlTimeoutMs(5000));
        ingest.start();
        assertTrue(runtime.predictRequested.await(5, TimeUnit.SECONDS));
        awaitPendingCall(client);

        CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            double[] echo = new double[10];
            for (int i = 0; i < 10; ++i) {
                echo[i] = i + 2;
            }
            runtime.pending.complete(echo);
        });
        client.close(2000);
        ingest.join(5000);

        assertFalse(runtime.pending.isCancelled());
        assertThat(ingest.failure.get() == null, is(true));
        assertThat(ingest.verdict.get().getSeverity(), is(Severity.NORMAL));
        assertFalse(client.isLoaded());
        assertThat(runtime.calls.get(runtime.calls.size() - 1), is("unload ae"));
    }

    @Test
    public void closeFromAnotherThreadCancelsStuckCall() throws Exception {
        ShiftingRuntime runtime = new ShiftingRuntime();
        runtime.pending = new CompletableFuture<>();
        ModelClient client = new ModelClient(runtime);
        IngestThread ingest = new IngestThread(new ExternalModelEstimator(client), config().setMlTimeoutMs(10000));
        ingest.start();
        assertTrue(runtime.predictRequested.await(5, TimeUnit.SECONDS));
        awaitPendingCall(client);

        long start = System.nanoTime();
        client.close(100);
        ingest.join(5000);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(runtime.pending.isCancelled());
        assertFalse(ingest.isAlive());
        assertTrue("close took " + elapsedMs + " ms", elapsedMs < 5000);
        assertThat(ingest.failure.get() instanceof ExternalRuntimeException, is(true));
        assertFalse(client.isLoaded());
    }
}
