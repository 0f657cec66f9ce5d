/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.nvimrpc.message;

import org.nvimrpc.exception.NvimProtocolException;

/**
 * Leading type tag of a msgpack-RPC frame.
 */
public enum MessageType {
    REQUEST(0, 4),
    RESPONSE(1, 4),
    NOTIFICATION(2, 3);

    private final int code;
    private final int arity;

    MessageType(int code, int arity) {
        this.code = code;
        this.arity = arity;
    }

    public static MessageType fromCode(long code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new NvimProtocolException("Unknown message type: " + code);
    }

    public int asCode() {
        return code;
    }

    /**
     * Number of elements in the array that carries a frame of this type.
     *
     * @return the frame arity
     */
    public int arity() {
        return arity;
    }
}
