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
package com.samsung.sra.sensorwatch.window;

import java.util.Arrays;

/**
 * Bounded FIFO of (timestamp, value) pairs backed by a ring buffer. Pushing into a full window evicts the oldest
 * element first, so size() == min(#pushes since reset, capacity) at all times.
 */
public class SlidingWindow {
    private final int capacity;
    private final long[] timestamps;
    private final double[] values;
    /** index of the oldest element */
    private int head = 0;
    private int size = 0;

    public SlidingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("window capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.timestamps = new long[capacity];
        this.values = new double[capacity];
    }

    public void push(long timestamp, double value) {
        int slot;
        if (size == capacity) {
            slot = head;
            head = (head + 1) % capacity;
        } else {
            slot = (head + size) % capacity;
            ++size;
        }
        timestamps[slot] = timestamp;
        values[slot] = value;
    }

    /** i-th oldest value, O(1) */
    public double get(int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("index " + i + " in window of size " + size);
        }
        return values[(head + i) % capacity];
    }

    public long getTimestamp(int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("index " + i + " in window of size " + size);
        }
        return timestamps[(head + i) % capacity];
    }

    public double last() {
        return get(size - 1);
    }

    /** Contiguous copy of all values, oldest first */
    public double[] values() {
        return lastValues(size);
    }

    /** Contiguous copy of the most recent min(n, size) values, oldest first */
    public double[] lastValues(int n) {
        int count = Math.min(n, size);
        double[] ret = new double[count];
        int offset = size - count;
        for (int i = 0; i < count; ++i) {
            ret[i] = values[(head + offset + i) % capacity];
        }
        return ret;
    }

    public long[] timestamps() {
        return lastTimestamps(size);
    }

    public long[] lastTimestamps(int n) {
        int count = Math.min(n, size);
        long[] ret = new long[count];
        int offset = size - count;
        for (int i = 0; i < count; ++i) {
            ret[i] = timestamps[(head + offset + i) % capacity];
        }
        return ret;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void reset() {
        head = 0;
        size = 0;
        Arrays.fill(values, 0);
        Arrays.fill(timestamps, 0);
    }

    /** Refill from a previously exported (timestamps, values) pair; keeps only the newest capacity entries */
    public void restore(long[] ts, double[] vs) {
        if (ts.length != vs.length) {
            throw new IllegalArgumentException("timestamp/value length mismatch: " + ts.length + " vs " + vs.length);
        }
        reset();
        for (int i = 0; i < ts.length; ++i) {
            push(ts[i], vs[i]);
        }
    }

    @Override
    public String toString() {
        return String.format("<sliding-window: %d/%d values>", size, capacity);
    }
}
