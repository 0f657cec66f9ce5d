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
 * Netty implementation of the async msgpack-RPC client.
 *
 * <p>This package provides the concrete implementation of
 * {@link org.nvimrpc.client.async.RpcClient} over a TCP connection, a Unix domain socket
 * (native epoll transport) or an in-VM Netty local channel.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link org.nvimrpc.client.async.netty.AsyncNvimClient} — main client entry point;
 *       runs the handshake and exposes requests, notifications and handler registration</li>
 *   <li>{@link org.nvimrpc.client.async.netty.AsyncNvimClientBuilder} — fluent builder
 *       for configuring and constructing the client</li>
 *   <li>{@link org.nvimrpc.client.async.netty.AsyncRpcConnection} — manages the Netty
 *       channel and the ordered write path</li>
 *   <li>{@link org.nvimrpc.client.async.netty.MsgpackFrameDecoder} and
 *       {@link org.nvimrpc.client.async.netty.MsgpackFrameEncoder} — pipeline codecs</li>
 * </ul>
 *
 * <h2>Protocol Details</h2>
 * <p>Frames are msgpack arrays without a length prefix:
 * <ul>
 *   <li><strong>Request:</strong> {@code [0, id, method, params]}</li>
 *   <li><strong>Response:</strong> {@code [1, id, error, result]}</li>
 *   <li><strong>Notification:</strong> {@code [2, method, params]}</li>
 * </ul>
 * <p>Responses are matched to requests by id, so they may arrive in any order. All writes go
 * through the channel's event loop, which keeps outbound frames in the order they were sent.
 *
 * @see org.nvimrpc.client.async.netty.AsyncNvimClient
 */
package org.nvimrpc.client.async.netty;
