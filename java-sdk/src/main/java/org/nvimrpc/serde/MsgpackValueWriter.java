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

package org.nvimrpc.serde;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.nvimrpc.exception.NvimEncodingException;
import org.nvimrpc.message.ExtValue;
import org.nvimrpc.message.Frame;
import org.nvimrpc.message.NotificationFrame;
import org.nvimrpc.message.RequestFrame;
import org.nvimrpc.message.ResponseFrame;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes frames and plain Java values into msgpack.
 *
 * <p>Supported values: {@code null}, {@link Boolean}, integral {@link Number}s including
 * {@link BigInteger}, {@link Float}, {@link Double}, {@link CharSequence}, {@link Character},
 * {@code byte[]}, {@link Collection}, {@code Object[]}, {@link Map}, {@link Optional},
 * {@link Enum} (by name) and {@link ExtValue} with a registered code.
 */
public final class MsgpackValueWriter {

    private final ExtTypeRegistry extTypes;

    public MsgpackValueWriter(ExtTypeRegistry extTypes) {
        this.extTypes = extTypes;
    }

    public byte[] writeFrame(Frame frame) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            writeFrame(packer, frame);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new NvimEncodingException("Failed to encode " + frame.type() + " frame", e);
        }
    }

    public byte[] writeValue(Object value) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            writeValue(packer, value);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new NvimEncodingException("Failed to encode value", e);
        }
    }

    public void writeFrame(MessagePacker packer, Frame frame) throws IOException {
        packer.packArrayHeader(frame.type().arity());
        packer.packInt(frame.type().asCode());
        if (frame instanceof RequestFrame request) {
            packer.packLong(request.id());
            packer.packString(request.method());
            writeValue(packer, request.params());
        } else if (frame instanceof ResponseFrame response) {
            packer.packLong(response.id());
            writeValue(packer, response.error());
            writeValue(packer, response.result());
        } else if (frame instanceof NotificationFrame notification) {
            packer.packString(notification.method());
            writeValue(packer, notification.params());
        } else {
            throw new NvimEncodingException("Unsupported frame: " + frame.getClass().getName());
        }
    }

    public void writeValue(MessagePacker packer, Object value) throws IOException {
        if (value == null) {
            packer.packNil();
        } else if (value instanceof Boolean b) {
            packer.packBoolean(b);
        } else if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            packer.packLong(((Number) value).longValue());
        } else if (value instanceof BigInteger big) {
            packer.packBigInteger(big);
        } else if (value instanceof Float f) {
            packer.packFloat(f);
        } else if (value instanceof Double d) {
            packer.packDouble(d);
        } else if (value instanceof CharSequence || value instanceof Character) {
            packer.packString(value.toString());
        } else if (value instanceof byte[] bytes) {
            packer.packBinaryHeader(bytes.length);
            packer.writePayload(bytes);
        } else if (value instanceof ExtValue ext) {
            extTypes.checkEncodable(ext);
            byte[] data = ext.data();
            packer.packExtensionTypeHeader((byte) ext.code(), data.length);
            packer.writePayload(data);
        } else if (value instanceof Collection<?> items) {
            packer.packArrayHeader(items.size());
            for (Object item : items) {
                writeValue(packer, item);
            }
        } else if (value instanceof Object[] items) {
            packer.packArrayHeader(items.length);
            for (Object item : items) {
                writeValue(packer, item);
            }
        } else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                writeValue(packer, entry.getKey());
                writeValue(packer, entry.getValue());
            }
        } else if (value instanceof Optional<?> optional) {
            writeValue(packer, optional.orElse(null));
        } else if (value instanceof Enum<?> constant) {
            packer.packString(constant.name());
        } else {
            throw new NvimEncodingException("Cannot encode value of type " + value.getClass().getName());
        }
    }
}
