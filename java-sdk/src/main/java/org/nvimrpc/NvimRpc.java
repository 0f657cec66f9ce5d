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

package org.nvimrpc;

import org.nvimrpc.client.async.netty.AsyncNvimClient;
import org.nvimrpc.client.async.netty.AsyncNvimClientBuilder;

/**
 * Main entry point for creating RPC clients.
 *
 * <pre>{@code
 * var client = NvimRpc.clientBuilder()
 *     .fromEnvironment()
 *     .build();
 * client.onNotify("my_plugin_event", params -> log.info("event {}", params));
 * client.connect().join();
 *
 * Object buffer = client.request("nvim_get_current_buf").join();
 * client.notify("nvim_command", "echo 'hello'").join();
 * }</pre>
 *
 * @see AsyncNvimClientBuilder
 * @see NvimRpcVersion
 */
public final class NvimRpc {

    private NvimRpc() {}

    /**
     * Creates a builder for the async client.
     *
     * @return a client builder
     */
    public static AsyncNvimClientBuilder clientBuilder() {
        return AsyncNvimClient.builder();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "1.0.0")
     */
    public static String version() {
        return NvimRpcVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static NvimRpcVersion versionInfo() {
        return NvimRpcVersion.getInstance();
    }
}
