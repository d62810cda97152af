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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session-wide handle on a {@link ModelRuntime}: loads the configured model on first use, turns asynchronous calls
 * into bounded waits, and remembers the outstanding call so that shutdown can wait for or cancel it.
 *
 * Calls are made from the ingest thread; close() may come from any thread.
 */
public class ModelClient {
    private static final Logger logger = LoggerFactory.getLogger(ModelClient.class);

    private final ModelRuntime runtime;
    /** id of the model currently loaded, null if none */
    private volatile String loadedModel = null;
    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
    private volatile boolean closed = false;

    /** @param runtime may be null, meaning no runtime is installed */
    public ModelClient(ModelRuntime runtime) {
        this.runtime = runtime;
    }

    /** Whether predictions can be requested at all under config */
    public boolean isAvailable(DetectorConfig config) {
        return !closed && runtime != null && config.getModelId() != null && runtime.isHealthy();
    }

    public double[] predict(double[] input, DetectorConfig config) throws ExternalRuntimeException {
        ensureLoaded(config);
        return await(runtime.predict(config.getModelId(), input), config.getMlTimeoutMs(), "predict");
    }

    private void ensureLoaded(DetectorConfig config) throws ExternalRuntimeException {
        String modelId = config.getModelId();
        if (modelId.equals(loadedModel)) {
            return;
        }
        if (loadedModel != null) {
            unload(config.getMlTimeoutMs());
        }
        await(runtime.loadModel(config.getModelPath(), modelId), config.getMlTimeoutMs(), "load");
        loadedModel = modelId;
        logger.info("loaded model {} from {}", modelId, config.getModelPath());
    }

    private <T> T await(CompletableFuture<T> future, long timeoutMs, String what) throws ExternalRuntimeException {
        inFlight.set(future);
        if (closed) {
            inFlight.compareAndSet(future, null);
            future.cancel(true);
            throw new ExternalRuntimeException(what + " refused: model client is closed");
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalRuntimeException(what + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExternalRuntimeException(what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalRuntimeException(what + " interrupted", e);
        } catch (CancellationException e) {
            throw new ExternalRuntimeException(what + " cancelled", e);
        } finally {
            inFlight.compareAndSet(future, null);
        }
    }

    private void unload(long timeoutMs) throws ExternalRuntimeException {
        String modelId = loadedModel;
        loadedModel = null;
        await(runtime.unloadModel(modelId), timeoutMs, "unload");
        logger.info("unloaded model {}", modelId);
    }

    /** Whether a runtime call is outstanding right now */
    public boolean hasPendingCall() {
        return inFlight.get() != null;
    }

    public boolean isLoaded() {
        return loadedModel != null;
    }

    /**
     * Wait up to graceMs for an outstanding call, cancel it if it is still running, then unload the model. Further
     * calls to close() do nothing.
     * @throws ExternalRuntimeException if unloading fails
     */
    public synchronized void close(long graceMs) throws ExternalRuntimeException {
        if (closed) {
            return;
        }
        closed = true;
        CompletableFuture<?> pending = inFlight.get();
        if (pending != null && !pending.isDone()) {
            try {
                pending.get(graceMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("abandoning model call still running after {} ms", graceMs);
                pending.cancel(true);
            } catch (ExecutionException | CancellationException e) {
                logger.warn("model call failed during shutdown", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.cancel(true);
            }
        }
        if (loadedModel != null) {
            unload(Math.max(graceMs, 1));
        }
    }
}
