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

/**
 * Key-value store for saved session state, shared by every session in the process. Sessions only exchange opaque
 * blobs with it; what the bytes mean is up to {@link StateCodec}.
 */
public abstract class StateStore implements AutoCloseable {
    /** @return the stored blob, or null if nothing was ever stored under key */
    public abstract byte[] get(String key) throws StateStoreException;

    public abstract void put(String key, byte[] value) throws StateStoreException;

    @Override
    public abstract void close() throws StateStoreException;
}
