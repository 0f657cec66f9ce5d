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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Async interface for msgpack-RPC traffic with the peer.
 *
 * <p>This is the whole surface higher layers build on: buffer, window and tabpage wrappers
 * only ever send requests and notifications, and register handlers for calls coming back
 * from the peer.
 */
public interface RpcClient {

    /**
     * Sends a notification. No response is expected.
     *
     * @param method the remote method name
     * @param params the positional parameters
     * @return A CompletableFuture that completes once the frame has been written
     */
    CompletableFuture<Void> notify(String method, Object... params);

    /**
     * Sends a request and waits for the matching response without a deadline.
     *
     * @param method the remote method name
     * @param params the positional parameters
     * @return A CompletableFuture containing the decoded result, or failing with
     *     {@link org.nvimrpc.exception.NvimRemoteException} when the peer answers with an error
     */
    CompletableFuture<Object> request(String method, Object... params);

    /**
     * Sends a request that fails with {@link org.nvimrpc.exception.NvimRequestTimeoutException}
     * if no response arrives within {@code timeout}.
     *
     * @param timeout the deadline for this call
     * @param method the remote method name
     * @param params the positional parameters
     * @return A CompletableFuture containing the decoded result
     */
    CompletableFuture<Object> request(Duration timeout, String method, Object... params);

    /**
     * Registers the handler for notifications sent by the peer.
     *
     * @param method the method name
     * @param handler the handler
     * @throws org.nvimrpc.exception.DuplicateHandlerException if the method already has a handler
     */
    void onNotify(String method, NotificationHandler handler);

    /**
     * Registers the handler for requests sent by the peer. The handler's return value, or the
     * description of the exception it throws, is sent back as the response.
     *
     * @param method the method name
     * @param handler the handler
     * @throws org.nvimrpc.exception.DuplicateHandlerException if the method already has a handler
     */
    void onRequest(String method, RequestHandler handler);

    /**
     * Returns the channel id the peer assigned to this connection.
     *
     * @return the channel id
     * @throws org.nvimrpc.exception.NvimNotConnectedException before the handshake has completed
     */
    long channel();
}
