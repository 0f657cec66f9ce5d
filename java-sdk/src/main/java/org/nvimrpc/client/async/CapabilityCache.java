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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client memo of {@code has(feature)} answers.
 *
 * <p>Each feature is asked for through {@code nvim_call_function("has", [feature])} at most
 * once per successful answer. Failed lookups are not cached.
 */
public final class CapabilityCache {

    private final RpcClient client;
    private final Map<String, Boolean> features = new ConcurrentHashMap<>();

    public CapabilityCache(RpcClient client) {
        this.client = client;
    }

    /**
     * Checks whether the peer supports a feature, e.g. {@code nvim-0.10}.
     *
     * @param feature the feature name understood by Vim's {@code has()}
     * @return A CompletableFuture containing the answer
     */
    public CompletableFuture<Boolean> has(String feature) {
        Boolean cached = features.get(feature);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return client.request("nvim_call_function", "has", List.of(feature)).thenApply(result -> {
            boolean supported = asBoolean(feature, result);
            features.put(feature, supported);
            return supported;
        });
    }

    public Optional<Boolean> cached(String feature) {
        return Optional.ofNullable(features.get(feature));
    }

    public void clear() {
        features.clear();
    }

    private static boolean asBoolean(String feature, Object result) {
        if (result instanceof Boolean b) {
            return b;
        }
        if (result instanceof Long l) {
            return l != 0;
        }
        throw new NvimProtocolException("has(" + feature + ") returned " + result);
    }
}
