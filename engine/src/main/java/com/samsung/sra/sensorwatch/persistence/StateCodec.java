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

import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;

/** Converts {@link SessionSnapshot}s to and from the opaque blobs handed to hosts and {@link StateStore}s */
public class StateCodec {
    private StateCodec() {}

    public static byte[] encode(SessionSnapshot snapshot) {
        return SerializationUtils.serialize(snapshot);
    }

    /** @throws StateStoreException if blob is empty, undecodable or written by an incompatible version */
    public static SessionSnapshot decode(byte[] blob) throws StateStoreException {
        if (blob == null || blob.length == 0) {
            throw new StateStoreException("empty state blob");
        }
        Object obj;
        try {
            obj = SerializationUtils.deserialize(blob);
        } catch (SerializationException | ClassCastException e) {
            throw new StateStoreException("undecodable state blob", e);
        }
        if (!(obj instanceof SessionSnapshot)) {
            throw new StateStoreException("state blob holds " + (obj == null ? "null" : obj.getClass().getName()));
        }
        SessionSnapshot snapshot = (SessionSnapshot) obj;
        if (snapshot.version != SessionSnapshot.VERSION) {
            throw new StateStoreException("state version " + snapshot.version + ", expected " + SessionSnapshot.VERSION);
        }
        return snapshot;
    }
}
