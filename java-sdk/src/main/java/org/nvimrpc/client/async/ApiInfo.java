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

package org.nvimrpc.client.async;

import org.nvimrpc.exception.NvimProtocolException;
import org.nvimrpc.message.ExtType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of {@code nvim_get_api_info}: the channel id of this connection and the peer's API
 * metadata.
 *
 * <p>The response must be a two element array {@code [channel_id, metadata]} where
 * {@code metadata["types"]} maps extension type names to {@code {"id": code}} and
 * {@code metadata["error_types"]} is present. Anything else is a protocol violation.
 */
public record ApiInfo(
        long channelId, Map<String, Integer> types, Map<String, Long> errorTypes, Map<Object, Object> metadata) {

    public ApiInfo {
        types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        errorTypes = Collections.unmodifiableMap(new LinkedHashMap<>(errorTypes));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ApiInfo parse(Object response) {
        if (!(response instanceof List<?> pair) || pair.size() != 2) {
            throw new NvimProtocolException("nvim_get_api_info must return [channel_id, metadata], got " + response);
        }
        if (!(pair.get(0) instanceof Long channelId)) {
            throw new NvimProtocolException("Channel id must be an integer, got " + pair.get(0));
        }
        Map<?, ?> metadata = asMap(pair.get(1), "metadata");
        if (!metadata.containsKey("types")) {
            throw new NvimProtocolException("API metadata has no 'types' entry");
        }
        if (!metadata.containsKey("error_types")) {
            throw new NvimProtocolException("API metadata has no 'error_types' entry");
        }

        Map<String, Integer> types = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : asMap(metadata.get("types"), "types").entrySet()) {
            String name = asName(entry.getKey(), "types");
            long code = idOf(entry.getValue(), "types." + name);
            if (code < ExtType.MIN_CODE || code > ExtType.MAX_CODE) {
                throw new NvimProtocolException("Extension type code of " + name + " out of range: " + code);
            }
            types.put(name, (int) code);
        }

        Map<String, Long> errorTypes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : asMap(metadata.get("error_types"), "error_types").entrySet()) {
            String name = asName(entry.getKey(), "error_types");
            errorTypes.put(name, idOf(entry.getValue(), "error_types." + name));
        }

        Map<Object, Object> raw = new LinkedHashMap<>(metadata);
        return new ApiInfo(channelId, types, errorTypes, raw);
    }

    /**
     * Returns the name of an error type, e.g. {@code Exception} or {@code Validation}.
     *
     * @param id the error type id from an error response
     * @return the name, if the peer announced that id
     */
    public Optional<String> errorTypeName(long id) {
        return errorTypes.entrySet().stream()
                .filter(entry -> entry.getValue() == id)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * Returns {@code metadata["version"]["api_level"]} when the peer reports it.
     *
     * @return the API level, if present
     */
    public Optional<Long> apiLevel() {
        if (metadata.get("version") instanceof Map<?, ?> version && version.get("api_level") instanceof Long level) {
            return Optional.of(level);
        }
        return Optional.empty();
    }

    private static Map<?, ?> asMap(Object value, String what) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new NvimProtocolException("API metadata '" + what + "' must be a map, got " + value);
    }

    private static String asName(Object key, String what) {
        if (key instanceof String name) {
            return name;
        }
        throw new NvimProtocolException("API metadata '" + what + "' has a non-string key: " + key);
    }

    private static long idOf(Object value, String what) {
        Map<?, ?> entry = asMap(value, what);
        if (entry.get("id") instanceof Long id) {
            return id;
        }
        throw new NvimProtocolException("API metadata '" + what + "' has no integer 'id'");
    }
}
