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
package com.samsung.sra.sensorwatch.persistence;

import com.samsung.sra.sensorwatch.ConfigException;
import com.samsung.sra.sensorwatch.DetectorConfig;
import com.samsung.sra.sensorwatch.DetectorException;
import com.samsung.sra.sensorwatch.DetectorSession;
import com.samsung.sra.sensorwatch.Output;
import com.samsung.sra.sensorwatch.Sample;
import com.samsung.sra.sensorwatch.estimators.EstimatorState;
import com.samsung.sra.sensorwatch.estimators.Method;
import com.samsung.sra.sensorwatch.hysteresis.Hysteresis;
import com.samsung.sra.sensorwatch.prediction.TrendMethod;
import com.samsung.sra.sensorwatch.signal.SignalMode;
import com.samsung.sra.sensorwatch.streams.ReliabilityTracker;
import org.junit.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SessionStateTest {
    private static DetectorSession session(DetectorConfig config) throws ConfigException {
        return new DetectorSession(config, () -> 0L, null);
    }

    private static Sample scalarSample(Random rand, long t) {
        double v = 20 + rand.nextGaussian() + (t > 60 ? 5 : 0);
        return Sample.of(v).withTimestamp(t * 1000);
    }

    private static Sample multiSample(Random rand, long t) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("temperature", 40 + rand.nextGaussian() + 0.1 * t);
        values.put("pressure", 101 + 0.5 * rand.nextGaussian());
        return Sample.of(values).withTimestamp(t * 1000);
    }

    @Test
    public void scalarRoundTrip() throws DetectorException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.CUSUM).setWindowSize(30)
                .setConsecutiveCount(2).setTrendEnabled(true);
        DetectorSession original = session(config);
        Random rand = new Random(11);
        for (long t = 0; t < 50; ++t) {
            original.ingest(scalarSample(rand, t));
        }
        DetectorSession restored = session(config);
        assertTrue(restored.loadState(original.saveState()));
        for (long t = 50; t < 80; ++t) {
            Sample sample = scalarSample(rand, t);
            assertEquals(original.ingest(sample).toMap(), restored.ingest(sample).toMap());
        }
    }

    @Test
    public void multiStreamRoundTrip() throws DetectorException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.EMA).setWindowSize(20)
                .setTrendEnabled(true).setTrendMethod(TrendMethod.LINEAR).setHealthEnabled(true);
        DetectorSession original = session(config);
        Random rand = new Random(5);
        for (long t = 0; t < 40; ++t) {
            original.ingest(multiSample(rand, t));
        }
        DetectorSession restored = session(config);
        assertTrue(restored.loadState(original.saveState()));
        assertThat(restored.getStreamCount(), is(2));
        for (long t = 40; t < 60; ++t) {
            Sample sample = multiSample(rand, t);
            assertEquals(original.ingest(sample).toMap(), restored.ingest(sample).toMap());
        }
    }

    @Test
    public void signalBufferRoundTrip() throws DetectorException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.ZSCORE).setWindowSize(10)
                .setSignalMode(SignalMode.FFT).setFftSize(32).setSamplingRate(32);
        DetectorSession original = session(config);
        Random rand = new Random(3);
        for (long t = 0; t < 20; ++t) {
            original.ingest(scalarSample(rand, t));
        }
        DetectorSession restored = session(config);
        assertTrue(restored.loadState(original.saveState()));
        for (long t = 20; t < 40; ++t) {
            Sample sample = scalarSample(rand, t);
            Output a = original.ingest(sample), b = restored.ingest(sample);
            assertEquals(a.toMap(), b.toMap());
            assertThat(b.getSignal().isBuffering(), is(t < 31));
        }
    }

    @Test
    public void vectorRoundTrip() throws DetectorException {
        DetectorConfig config = new DetectorConfig().setMethod(Method.PCA).setWindowSize(40).setNComponents(1);
        DetectorSession original = session(config);
        Random rand = new Random(8);
        for (long t = 0; t < 45; ++t) {
            double x = rand.nextGaussian();
            original.ingest(Sample.ofVector(x, 2 * x + 0.05 * rand.nextGaussian()).withTimestamp(t));
        }
        DetectorSession restored = session(config);
        assertTrue(restored.loadState(original.saveState()));
        Sample outlier = Sample.ofVector(1, -2).withTimestamp(100);
        Output a = original.ingest(outlier), b = restored.ingest(outlier);
        assertEquals(a.toMap(), b.toMap());
    }

    @Test
    public void corruptStateResets() throws DetectorException {
        DetectorSession session = session(new DetectorConfig().setMethod(Method.ZSCORE));
        for (int i = 0; i < 10; ++i) {
            session.ingest(Sample.of(i));
        }
        assertFalse(session.loadState(new byte[]{1, 2, 3}));
        assertFalse(session.loadState(new byte[0]));
        Output out = session.ingest(Sample.of(5));
        assertTrue(out.isWarmup());
        assertThat(out.getBufferSize(), is(1));
    }

    @Test
    public void inconsistentSnapshotResets() throws DetectorException {
        DetectorSession session = session(new DetectorConfig().setMethod(Method.ZSCORE));
        for (int i = 0; i < 10; ++i) {
            session.ingest(Sample.of(i));
        }
        ChannelSnapshot mismatched = new ChannelSnapshot(new long[]{1, 2, 3}, new double[]{1.0},
                new EnumMap<Method, EstimatorState>(Method.class), new Hysteresis(), new ReliabilityTracker());
        assertFalse(session.loadState(StateCodec.encode(
                new SessionSnapshot(mismatched, new LinkedHashMap<String, ChannelSnapshot>(), null, null))));

        LinkedHashMap<String, ChannelSnapshot> streams = new LinkedHashMap<>();
        streams.put("temperature", new ChannelSnapshot(new long[]{1}, new double[]{1.0},
                new EnumMap<Method, EstimatorState>(Method.class), null, new ReliabilityTracker()));
        assertFalse(session.loadState(StateCodec.encode(new SessionSnapshot(null, streams, null, null))));
        assertThat(session.getStreamCount(), is(0));

        Output out = session.ingest(Sample.of(5));
        assertTrue(out.isWarmup());
        assertThat(out.getBufferSize(), is(1));
    }

    @Test
    public void storeSavesOnClose() throws DetectorException, StateStoreException {
        MainMemoryStateStore store = new MainMemoryStateStore();
        DetectorConfig config = new DetectorConfig().setMethod(Method.ZSCORE).setWindowSize(10);
        DetectorSession first = new DetectorSession(config, () -> 0L, null, store, "pump-1");
        for (int i = 0; i < 10; ++i) {
            first.ingest(Sample.of(10 + i % 2));
        }
        assertFalse(store.contains("pump-1"));
        first.close();
        first.close();
        assertThat(store.get("pump-1"), notNullValue());
        assertThat(store.get("pump-2"), nullValue());

        DetectorSession second = new DetectorSession(config, () -> 0L, null, store, "pump-1");
        Output out = second.ingest(Sample.of(10));
        assertFalse(out.isWarmup());
        assertThat(out.getBufferSize(), is(10));
        second.close();
    }

    @Test(expected = IllegalStateException.class)
    public void ingestAfterClose() throws DetectorException {
        DetectorSession session = session(new DetectorConfig());
        session.close();
        session.ingest(Sample.of(1));
    }

    @Test(expected = StateStoreException.class)
    public void decodeRejectsForeignObject() throws StateStoreException {
        StateCodec.decode(org.apache.commons.lang3.SerializationUtils.serialize("not a snapshot"));
    }
}
