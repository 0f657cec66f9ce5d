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

import org.nvimrpc.exception.NvimNotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registers handlers and publishes them to the editor as functions that call back into this
 * client over its channel.
 *
 * <pre>{@code
 * var functions = new RemoteFunctions(client);
 * RemoteFunction fn = functions.onRequest("my_plugin.complete", params -> complete(params));
 * functions.define().join();
 * // fn.remoteName() is My_plugin_complete_<suffix>, callable from Lua and Vimscript
 * }</pre>
 *
 * <p>Handlers are registered on the client right away. {@link #define()} sends the Lua and
 * Vimscript definitions for everything registered since the previous call, and needs the
 * channel id, so it may only run once the client is ready.
 */
public final class RemoteFunctions {
    private static final Logger log = LoggerFactory.getLogger(RemoteFunctions.class);

    static final String EXEC_LUA = "nvim_exec_lua";
    static final String EXEC = "nvim_exec";

    private final RpcClient client;
    private final Map<String, RemoteFunction> undefined = new LinkedHashMap<>();

    public RemoteFunctions(RpcClient client) {
        this.client = client;
    }

    /**
     * Registers a handler the editor calls with {@code vim.rpcrequest}, waiting for its result.
     *
     * @throws org.nvimrpc.exception.DuplicateHandlerException if the method already has a handler
     */
    public synchronized RemoteFunction onRequest(String name, RequestHandler handler) {
        RemoteFunction function = RemoteFunction.create(name, true);
        client.onRequest(name, handler);
        undefined.put(name, function);
        return function;
    }

    /**
     * Registers a handler the editor calls with {@code vim.rpcnotify}.
     *
     * @throws org.nvimrpc.exception.DuplicateHandlerException if the method already has a handler
     */
    public synchronized RemoteFunction onNotify(String name, NotificationHandler handler) {
        RemoteFunction function = RemoteFunction.create(name, false);
        client.onNotify(name, handler);
        undefined.put(name, function);
        return function;
    }

    /**
     * Defines every function registered since the last call, one after another. When a definition
     * fails, the functions not yet defined are kept for the next call.
     *
     * @return A CompletableFuture containing the functions defined by this call
     */
    public CompletableFuture<List<RemoteFunction>> define() {
        long channel;
        try {
            channel = client.channel();
        } catch (NvimNotConnectedException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<RemoteFunction> batch;
        synchronized (this) {
            batch = new ArrayList<>(undefined.values());
            undefined.clear();
        }

        List<RemoteFunction> defined = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (RemoteFunction function : batch) {
            chain = chain.thenCompose(v -> client.request(EXEC_LUA, function.luaDefinition(channel), List.of()))
                    .thenCompose(v -> client.request(EXEC, function.vimlDefinition(), false))
                    .thenAccept(v -> {
                        defined.add(function);
                        log.debug("Defined {} for {} on channel {}", function.remoteName(), function.name(), channel);
                    });
        }
        return chain.thenApply(v -> List.copyOf(defined)).exceptionallyCompose(error -> {
            requeue(batch, defined);
            return CompletableFuture.failedFuture(error);
        });
    }

    private synchronized void requeue(List<RemoteFunction> batch, List<RemoteFunction> defined) {
        for (RemoteFunction function : batch) {
            if (!defined.contains(function)) {
                undefined.putIfAbsent(function.name(), function);
            }
        }
        log.warn("Defining remote functions failed, {} left undefined", undefined.size());
    }

    public synchronized List<RemoteFunction> undefined() {
        return List.copyOf(undefined.values());
    }
}
