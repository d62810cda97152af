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

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class SlidingWindowTest {
    @Test
    public void sizeNeverExceedsCapacity() {
        SlidingWindow window = new SlidingWindow(5);
        for (int i = 0; i < 12; ++i) {
            window.push(i, i);
            assertThat(window.size(), is(Math.min(i + 1, 5)));
        }
        assertArrayEquals(new double[]{7, 8, 9, 10, 11}, window.values(), 0);
        assertArrayEquals(new long[]{7, 8, 9, 10, 11}, window.timestamps());
        assertEquals(11, window.last(), 0);
        assertEquals(7, window.get(0), 0);
    }

    @Test
    public void lastValuesIsClippedToSize() {
        SlidingWindow window = new SlidingWindow(10);
        window.push(0, 1);
        window.push(1, 2);
        window.push(2, 3);
        assertArrayEquals(new double[]{2, 3}, window.lastValues(2), 0);
        assertArrayEquals(new double[]{1, 2, 3}, window.lastValues(50), 0);
        assertArrayEquals(new double[0], window.lastValues(0), 0);
    }

    @Test
    public void restoreKeepsNewestEntries() {
        SlidingWindow window = new SlidingWindow(3);
        window.restore(new long[]{1, 2, 3, 4}, new double[]{10, 20, 30, 40});
        assertArrayEquals(new double[]{20, 30, 40}, window.values(), 0);
        window.reset();
        assertThat(window.isEmpty(), is(true));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void getOutsideWindow() {
        new SlidingWindow(3).get(0);
    }

    @Test
    public void vectorWindowEvictsOldestRow() {
        VectorWindow window = new VectorWindow(2);
        window.push(1, new double[]{1, 2});
        window.push(2, new double[]{3, 4});
        window.push(3, new double[]{5, 6});
        assertThat(window.size(), is(2));
        assertThat(window.getDimension(), is(2));
        assertArrayEquals(new double[]{3, 4}, window.rows()[0], 0);
        assertArrayEquals(new long[]{2, 3}, window.timestamps());
    }
}
