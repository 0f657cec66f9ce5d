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

package org.nvimrpc.client.async.netty;

import org.apache.commons.lang3.StringUtils;
import org.nvimrpc.config.ClientIdentity;
import org.nvimrpc.config.NvimAddress;
import org.nvimrpc.config.RetryPolicy;
import org.nvimrpc.exception.NvimInvalidArgumentException;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builder for creating configured AsyncNvimClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Address taken from $NVIM, as set for processes started by Neovim
 * var client = AsyncNvimClient.builder()
 *     .fromEnvironment()
 *     .build();
 * client.onRequest("my_plugin_complete", params -> complete(params));
 * client.connect().join();
 *
 * // Explicit TCP endpoint with a per-request deadline
 * var client = AsyncNvimClient.builder()
 *     .address("127.0.0.1:6666")
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .buildAndConnect()
 *     .join();
 * }</pre>
 *
 * @see AsyncNvimClient#builder()
 */
public final class AsyncNvimClientBuilder {

    /**
     * Extension types a Neovim peer must announce for the handshake to succeed.
     */
    public static final List<String> DEFAULT_REQUIRED_EXT_TYPES = List.of("Buffer", "Window", "Tabpage");

    private NvimAddress address;
    private String clientName = ClientIdentity.DEFAULT_NAME;
    private int[] clientVersion;
    private Duration connectionTimeout;
    private Duration requestTimeout;
    private RetryPolicy retryPolicy = RetryPolicy.noRetry();
    private int maxReadChunkSize = AsyncRpcConnection.DEFAULT_MAX_READ_CHUNK_SIZE;
    private Set<String> requiredExtTypes = new LinkedHashSet<>(DEFAULT_REQUIRED_EXT_TYPES);
    private Executor handlerExecutor;
    private Map<String, String> environment = System.getenv();

    AsyncNvimClientBuilder() {}

    /**
     * Sets the peer address in {@code nvim --listen} notation.
     *
     * @param address {@code host:port} or a Unix domain socket path
     * @return this builder
     */
    public AsyncNvimClientBuilder address(String address) {
        this.address = NvimAddress.parse(address);
        return this;
    }

    /**
     * Sets the peer address.
     *
     * @param address an {@code InetSocketAddress}, a Netty {@code DomainSocketAddress} or a
     *     Netty {@code LocalAddress}
     * @return this builder
     */
    public AsyncNvimClientBuilder address(SocketAddress address) {
        this.address = NvimAddress.of(address);
        return this;
    }

    public AsyncNvimClientBuilder address(NvimAddress address) {
        this.address = address;
        return this;
    }

    /**
     * Takes the address from the {@code NVIM} environment variable, falling back to
     * {@code NVIM_LISTEN_ADDRESS}.
     *
     * @return this builder
     * @throws NvimInvalidArgumentException if neither variable is set
     */
    public AsyncNvimClientBuilder fromEnvironment() {
        this.address = NvimAddress.fromEnvironment(environment)
                .orElseThrow(() -> new NvimInvalidArgumentException(
                        "Neither " + NvimAddress.NVIM_ENV + " nor " + NvimAddress.LEGACY_LISTEN_ENV + " is set"));
        return this;
    }

    AsyncNvimClientBuilder environment(Map<String, String> environment) {
        this.environment = environment;
        return this;
    }

    /**
     * Sets the name announced through {@code nvim_set_client_info}.
     *
     * @param clientName the client name
     * @return this builder
     */
    public AsyncNvimClientBuilder clientName(String clientName) {
        this.clientName = clientName;
        return this;
    }

    /**
     * Sets the version announced through {@code nvim_set_client_info}. Defaults to the SDK
     * version.
     *
     * @return this builder
     */
    public AsyncNvimClientBuilder clientVersion(int major, int minor, int patch) {
        this.clientVersion = new int[] {major, minor, patch};
        return this;
    }

    /**
     * Sets the connection timeout.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public AsyncNvimClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the default deadline for requests. Without one, a request waits until its response
     * arrives or the connection closes.
     *
     * @param requestTimeout the request timeout duration
     * @return this builder
     */
    public AsyncNvimClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Sets the retry policy used while connecting.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public AsyncNvimClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Sets the largest chunk read from the socket at once.
     *
     * @param maxReadChunkSize the size in bytes
     * @return this builder
     */
    public AsyncNvimClientBuilder maxReadChunkSize(int maxReadChunkSize) {
        this.maxReadChunkSize = maxReadChunkSize;
        return this;
    }

    /**
     * Sets the extension types the peer must describe in its API metadata.
     *
     * @param names the type names
     * @return this builder
     */
    public AsyncNvimClientBuilder requiredExtTypes(String... names) {
        this.requiredExtTypes = new LinkedHashSet<>(List.of(names));
        return this;
    }

    /**
     * Sets the executor that runs request and notification handlers. When not set the client
     * uses its own cached thread pool and shuts it down on close.
     *
     * @param handlerExecutor the executor
     * @return this builder
     */
    public AsyncNvimClientBuilder handlerExecutor(Executor handlerExecutor) {
        this.handlerExecutor = handlerExecutor;
        return this;
    }

    /**
     * Builds and returns a configured AsyncNvimClient instance.
     * Note: You still need to call {@link AsyncNvimClient#connect()} on the returned client.
     *
     * @return a new AsyncNvimClient instance
     * @throws NvimInvalidArgumentException if the configuration is incomplete or invalid
     */
    public AsyncNvimClient build() {
        if (address == null) {
            throw new NvimInvalidArgumentException("Address must be set");
        }
        if (StringUtils.isBlank(clientName)) {
            throw new NvimInvalidArgumentException("Client name cannot be null or empty");
        }
        if (maxReadChunkSize < 64) {
            throw new NvimInvalidArgumentException("Max read chunk size must be at least 64 bytes");
        }
        if (retryPolicy == null) {
            throw new NvimInvalidArgumentException("Retry policy cannot be null, use RetryPolicy.noRetry()");
        }
        if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
            throw new NvimInvalidArgumentException("Request timeout must be positive");
        }
        if (connectionTimeout != null && (connectionTimeout.isNegative() || connectionTimeout.isZero())) {
            throw new NvimInvalidArgumentException("Connection timeout must be positive");
        }
        ClientIdentity identity;
        if (clientVersion == null) {
            ClientIdentity defaults = ClientIdentity.defaultIdentity();
            identity = new ClientIdentity(clientName, defaults.major(), defaults.minor(), defaults.patch());
        } else {
            identity = new ClientIdentity(clientName, clientVersion[0], clientVersion[1], clientVersion[2]);
        }
        return new AsyncNvimClient(
                address,
                identity,
                connectionTimeout,
                requestTimeout,
                retryPolicy,
                maxReadChunkSize,
                requiredExtTypes,
                handlerExecutor);
    }

    /**
     * Builds the client and runs {@link AsyncNvimClient#connect()}.
     *
     * @return a CompletableFuture that completes with the ready client
     */
    public CompletableFuture<AsyncNvimClient> buildAndConnect() {
        AsyncNvimClient client = build();
        return client.connect().thenApply(v -> client);
    }
}
