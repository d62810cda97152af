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

/** Bounded FIFO of (timestamp, vector) pairs. All vectors in one window have the same dimension. */
public class VectorWindow {
    private final int capacity;
    private final long[] timestamps;
    private final double[][] rows;
    private int head = 0;
    private int size = 0;

    public VectorWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("window capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.timestamps = new long[capacity];
        this.rows = new double[capacity][];
    }

    public void push(long timestamp, double[] vector) {
        if (size > 0 && vector.length != getDimension()) {
            throw new IllegalArgumentException(String.format(
                    "vector of dimension %d pushed into window of dimension %d", vector.length, getDimension()));
        }
        int slot;
        if (size == capacity) {
            slot = head;
            head = (head + 1) % capacity;
        } else {
            slot = (head + size) % capacity;
            ++size;
        }
        timestamps[slot] = timestamp;
        rows[slot] = Arrays.copyOf(vector, vector.length);
    }

    public double[] get(int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("index " + i + " in window of size " + size);
        }
        return rows[(head + i) % capacity];
    }

    /** Row copies, oldest first */
    public double[][] rows() {
        double[][] ret = new double[size][];
        for (int i = 0; i < size; ++i) {
            double[] row = rows[(head + i) % capacity];
            ret[i] = Arrays.copyOf(row, row.length);
        }
        return ret;
    }

    public long[] timestamps() {
        long[] ret = new long[size];
        for (int i = 0; i < size; ++i) {
            ret[i] = timestamps[(head + i) % capacity];
        }
        return ret;
    }

    /** Dimension of the stored vectors, 0 while empty */
    public int getDimension() {
        return size > 0 ? rows[head].length : 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public void reset() {
        head = 0;
        size = 0;
        Arrays.fill(rows, null);
    }

    public void restore(long[] ts, double[][] vs) {
        if (ts.length != vs.length) {
            throw new IllegalArgumentException("timestamp/row length mismatch: " + ts.length + " vs " + vs.length);
        }
        reset();
        for (int i = 0; i < ts.length; ++i) {
            push(ts[i], vs[i]);
        }
    }
}
