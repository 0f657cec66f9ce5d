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

import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessageUnpacker;
import org.nvimrpc.exception.NvimProtocolException;
import org.nvimrpc.message.Frame;
import org.nvimrpc.message.MessageType;
import org.nvimrpc.message.NotificationFrame;
import org.nvimrpc.message.RequestFrame;
import org.nvimrpc.message.ResponseFrame;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes msgpack into frames and plain Java values.
 *
 * <p>Integers become {@link Long} ({@link BigInteger} above {@link Long#MAX_VALUE}), floats
 * become {@link Double}, strings {@link String}, binaries {@code byte[]}, arrays
 * {@link List}, maps insertion ordered {@link Map}s and extension values
 * {@link org.nvimrpc.message.ExtValue}s of a registered type.
 */
public final class MsgpackValueReader {

    private final ExtTypeRegistry extTypes;

    public MsgpackValueReader(ExtTypeRegistry extTypes) {
        this.extTypes = extTypes;
    }

    public Frame readFrame(byte[] bytes) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
            return readFrame(unpacker);
        }
    }

    /**
     * Reads one complete frame.
     *
     * @throws org.msgpack.core.MessageInsufficientBufferException if the input ends mid-frame
     * @throws NvimProtocolException if the value is not a well formed frame
     */
    public Frame readFrame(MessageUnpacker unpacker) throws IOException {
        return toFrame(readValue(unpacker));
    }

    public Object readValue(MessageUnpacker unpacker) throws IOException {
        MessageFormat format = unpacker.getNextFormat();
        return switch (format.getValueType()) {
            case NIL -> {
                unpacker.unpackNil();
                yield null;
            }
            case BOOLEAN -> unpacker.unpackBoolean();
            case INTEGER -> readInteger(unpacker, format);
            case FLOAT -> unpacker.unpackDouble();
            case STRING -> unpacker.unpackString();
            case BINARY -> unpacker.readPayload(unpacker.unpackBinaryHeader());
            case ARRAY -> readArray(unpacker);
            case MAP -> readMap(unpacker);
            case EXTENSION -> {
                ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
                yield extTypes.decode(header.getType(), unpacker.readPayload(header.getLength()));
            }
        };
    }

    private static Object readInteger(MessageUnpacker unpacker, MessageFormat format) throws IOException {
        if (format == MessageFormat.UINT64) {
            BigInteger value = unpacker.unpackBigInteger();
            return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
        }
        return unpacker.unpackLong();
    }

    private List<Object> readArray(MessageUnpacker unpacker) throws IOException {
        int size = unpacker.unpackArrayHeader();
        List<Object> items = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            items.add(readValue(unpacker));
        }
        return items;
    }

    private Map<Object, Object> readMap(MessageUnpacker unpacker) throws IOException {
        int entries = unpacker.unpackMapHeader();
        Map<Object, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < entries; i++) {
            Object key = readValue(unpacker);
            map.put(key, readValue(unpacker));
        }
        return map;
    }

    Frame toFrame(Object value) {
        if (!(value instanceof List<?> items) || items.isEmpty()) {
            throw new NvimProtocolException("Expected a msgpack-rpc frame array but got " + describe(value));
        }
        MessageType type = MessageType.fromCode(asLong(items.get(0), "message type"));
        if (items.size() != type.arity()) {
            throw new NvimProtocolException(
                    type + " frame must have " + type.arity() + " elements but has " + items.size());
        }
        return switch (type) {
            case REQUEST -> new RequestFrame(
                    asLong(items.get(1), "request id"), asMethod(items.get(2)), asParams(items.get(3)));
            case RESPONSE -> new ResponseFrame(asLong(items.get(1), "response id"), items.get(2), items.get(3));
            case NOTIFICATION -> new NotificationFrame(asMethod(items.get(1)), asParams(items.get(2)));
        };
    }

    private static long asLong(Object value, String what) {
        if (value instanceof Long l) {
            return l;
        }
        throw new NvimProtocolException("Expected integer " + what + " but got " + describe(value));
    }

    private static String asMethod(Object value) {
        if (value instanceof String method) {
            return method;
        }
        throw new NvimProtocolException("Expected string method name but got " + describe(value));
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asParams(Object value) {
        if (value instanceof List<?>) {
            return (List<Object>) value;
        }
        throw new NvimProtocolException("Expected params array but got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "nil" : value.getClass().getSimpleName();
    }
}
