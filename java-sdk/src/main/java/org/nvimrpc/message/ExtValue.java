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

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.nvimrpc.exception.NvimProtocolException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * An opaque remote object reference carried as a msgpack extension value.
 *
 * <p>The payload is not interpreted by the codec. Two values are equal when their type codes
 * and payload bytes are equal.
 */
public record ExtValue(ExtType type, byte[] data) {

    public ExtValue {
        Objects.requireNonNull(type, "type");
        data = data == null ? new byte[0] : data.clone();
    }

    /**
     * Creates a value whose payload is a msgpack encoded integer handle, the layout Neovim
     * uses for buffer, window and tabpage references.
     *
     * @param type the extension type
     * @param handle the integer handle
     * @return the extension value
     */
    public static ExtValue ofHandle(ExtType type, long handle) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packLong(handle);
            return new ExtValue(type, packer.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public int code() {
        return type.code();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * Reads the payload as a msgpack encoded integer handle.
     *
     * @return the handle
     * @throws NvimProtocolException if the payload is not a single msgpack integer
     */
    public long handle() {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            long handle = unpacker.unpackLong();
            if (unpacker.hasNext()) {
                throw new NvimProtocolException("Trailing bytes after handle in " + this);
            }
            return handle;
        } catch (IOException | MessagePackException e) {
            throw new NvimProtocolException("Payload of " + this + " is not an integer handle", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtValue other)) {
            return false;
        }
        return type.code() == other.type.code() && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * type.code() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return type.name() + "(" + HexFormat.of().formatHex(data) + ")";
    }
}
