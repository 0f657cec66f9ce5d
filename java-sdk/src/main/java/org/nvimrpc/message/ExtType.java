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

import org.nvimrpc.exception.NvimInvalidArgumentException;

/**
 * A named msgpack extension type, such as Neovim's {@code Buffer}, {@code Window} or
 * {@code Tabpage}, together with the type code the peer assigned to it.
 */
public record ExtType(String name, int code) {

    public static final int MIN_CODE = Byte.MIN_VALUE;
    public static final int MAX_CODE = Byte.MAX_VALUE;

    public ExtType {
        if (name == null || name.isEmpty()) {
            throw new NvimInvalidArgumentException("Extension type name cannot be null or empty");
        }
        if (code < MIN_CODE || code > MAX_CODE) {
            throw new NvimInvalidArgumentException(
                    "Extension type code for " + name + " must be between " + MIN_CODE + " and " + MAX_CODE);
        }
    }

    /**
     * Wraps a raw payload as a value of this type.
     *
     * @param data the payload bytes
     * @return the extension value
     */
    public ExtValue wrap(byte[] data) {
        return new ExtValue(this, data);
    }
}
