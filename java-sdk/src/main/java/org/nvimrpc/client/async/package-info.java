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

/**
 * Async client interfaces for msgpack-RPC communication with Neovim.
 *
 * <p>This package defines the collaborator-facing API where calls return
 * {@link java.util.concurrent.CompletableFuture} for non-blocking execution.
 * The interfaces decouple the API contract from the transport implementation
 * (see {@link org.nvimrpc.client.async.netty} for the Netty implementation).
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link org.nvimrpc.client.async.RpcClient} — requests, notifications and handler registration</li>
 *   <li>{@link org.nvimrpc.client.async.RequestHandler} and
 *       {@link org.nvimrpc.client.async.NotificationHandler} — callbacks for inbound calls</li>
 *   <li>{@link org.nvimrpc.client.async.ApiInfo} — channel id and metadata from the handshake</li>
 *   <li>{@link org.nvimrpc.client.async.CapabilityCache} — memoized feature checks</li>
 *   <li>{@link org.nvimrpc.client.async.RemoteFunctions} — handlers published to the editor as
 *       Lua and Vimscript functions</li>
 * </ul>
 *
 * <h2>Getting Started</h2>
 * <pre>{@code
 * var client = AsyncNvimClient.builder()
 *     .address("/tmp/nvim.sock")
 *     .buildAndConnect()
 *     .join();
 *
 * long channel = client.channel();
 * Object lines = client.request("nvim_buf_get_lines", 0, 0, -1, false).join();
 *
 * client.close().join();
 * }</pre>
 *
 * @see org.nvimrpc.client.async.netty.AsyncNvimClient
 */
package org.nvimrpc.client.async;
