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

import org.nvimrpc.exception.NvimEncodingException;
import org.nvimrpc.exception.NvimProtocolException;
import org.nvimrpc.message.ExtType;
import org.nvimrpc.message.ExtValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Table of extension types known to the codec, keyed by type code and by name.
 *
 * <p>The peer announces its extension types during the handshake. Until a code is registered
 * here it can be neither decoded nor encoded.
 */
public final class ExtTypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExtTypeRegistry.class);

    private final ConcurrentMap<Integer, ExtType> byCode = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ExtType> byName = new ConcurrentHashMap<>();

    public ExtType register(String name, int code) {
        ExtType type = new ExtType(name, code);
        ExtType previous = byCode.put(code, type);
        if (previous != null && !previous.name().equals(name)) {
            byName.remove(previous.name(), previous);
            log.warn("Extension code {} re-registered from {} to {}", code, previous.name(), name);
        }
        byName.put(name, type);
        log.debug("Registered extension type {} with code {}", name, code);
        return type;
    }

    public Optional<ExtType> byCode(int code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public Optional<ExtType> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Looks up a type by name.
     *
     * @param name the type name, e.g. {@code Buffer}
     * @return the registered type
     * @throws NvimEncodingException if no type with that name is registered
     */
    public ExtType require(String name) {
        return byName(name).orElseThrow(() -> new NvimEncodingException("Extension type not registered: " + name));
    }

    /**
     * Builds the value for an inbound extension payload.
     *
     * @throws NvimProtocolException if the code is not registered
     */
    ExtValue decode(int code, byte[] data) {
        ExtType type = byCode.get(code);
        if (type == null) {
            throw new NvimProtocolException("Received extension value with unregistered type code " + code);
        }
        return type.wrap(data);
    }

    /**
     * Checks that an outbound extension value uses a registered code.
     *
     * @throws NvimEncodingException if the code is not registered
     */
    void checkEncodable(ExtValue value) {
        if (!byCode.containsKey(value.code())) {
            throw new NvimEncodingException(
                    "Cannot encode " + value + ": type code " + value.code() + " is not registered");
        }
    }

    public Collection<ExtType> types() {
        List<ExtType> types = new ArrayList<>(byCode.values());
        types.sort(Comparator.comparingInt(ExtType::code));
        return Collections.unmodifiableList(types);
    }
}
