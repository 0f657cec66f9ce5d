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

import io.netty.util.concurrent.DefaultThreadFactory;
import org.nvimrpc.client.async.ApiInfo;
import org.nvimrpc.client.async.CapabilityCache;
import org.nvimrpc.client.async.ClientState;
import org.nvimrpc.client.async.NotificationHandler;
import org.nvimrpc.client.async.RequestHandler;
import org.nvimrpc.client.async.RpcClient;
import org.nvimrpc.config.ClientIdentity;
import org.nvimrpc.config.NvimAddress;
import org.nvimrpc.config.RetryPolicy;
import org.nvimrpc.exception.NvimNotConnectedException;
import org.nvimrpc.exception.NvimProtocolException;
import org.nvimrpc.message.NotificationFrame;
import org.nvimrpc.message.RequestFrame;
import org.nvimrpc.serde.ExtTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Async msgpack-RPC client for Neovim using Netty.
 *
 * <p>{@link #connect()} opens the connection and runs the handshake: the client announces
 * itself with {@code nvim_set_client_info}, asks for {@code nvim_get_api_info}, and registers
 * the extension types the peer reports. Only then does the client become
 * {@link ClientState#READY}. Handlers may be registered before connecting; calls the peer
 * makes during the handshake are held back until the client is ready.
 */
public class AsyncNvimClient implements RpcClient {
    private static final Logger log = LoggerFactory.getLogger(AsyncNvimClient.class);

    static final String SET_CLIENT_INFO = "nvim_set_client_info";
    static final String GET_API_INFO = "nvim_get_api_info";
    static final String CLIENT_TYPE = "remote";

    private final NvimAddress address;
    private final ClientIdentity identity;
    private final Optional<Duration> connectionTimeout;
    private final Optional<Duration> requestTimeout;
    private final RetryPolicy retryPolicy;
    private final int maxReadChunkSize;
    private final Set<String> requiredExtTypes;
    private final Executor handlerExecutor;
    private final ExecutorService ownedExecutor;

    private final ExtTypeRegistry extTypes = new ExtTypeRegistry();
    private final PendingCalls pendingCalls = new PendingCalls();
    private final HandlerRegistry handlers;
    private final CapabilityCache capabilities = new CapabilityCache(this);
    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.NEW);
    private volatile ApiInfo apiInfo;
    private AsyncRpcConnection connection;

    @SuppressWarnings("checkstyle:ParameterNumber")
    AsyncNvimClient(
            NvimAddress address,
            ClientIdentity identity,
            Duration connectionTimeout,
            Duration requestTimeout,
            RetryPolicy retryPolicy,
            int maxReadChunkSize,
            Set<String> requiredExtTypes,
            Executor handlerExecutor) {
        this.address = address;
        this.identity = identity;
        this.connectionTimeout = Optional.ofNullable(connectionTimeout);
        this.requestTimeout = Optional.ofNullable(requestTimeout);
        this.retryPolicy = retryPolicy;
        this.maxReadChunkSize = maxReadChunkSize;
        this.requiredExtTypes = Set.copyOf(requiredExtTypes);
        if (handlerExecutor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("nvim-rpc-handler", true));
            this.handlerExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.handlerExecutor = handlerExecutor;
        }
        this.handlers = new HandlerRegistry(this.handlerExecutor);
    }

    /**
     * Creates a new builder for configuring AsyncNvimClient.
     *
     * @return a new builder instance
     */
    public static AsyncNvimClientBuilder builder() {
        return new AsyncNvimClientBuilder();
    }

    /**
     * Connects to the peer and performs the handshake. May be called once.
     *
     * @return a CompletableFuture that completes when the client is ready, or fails with
     *     {@link org.nvimrpc.exception.NvimConnectionException} or {@link NvimProtocolException}
     */
    public CompletableFuture<Void> connect() {
        if (!state.compareAndSet(ClientState.NEW, ClientState.CONNECTING)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("connect() may only be called once, client is " + state.get()));
        }
        connection = new AsyncRpcConnection(
                address, connectionTimeout, retryPolicy, maxReadChunkSize, extTypes, pendingCalls, handlers::dispatch);
        connection.closeFuture().thenRun(this::onClosed);

        return connection
                .connect()
                .thenCompose(v -> announceClientInfo())
                .thenCompose(v -> fetchApiInfo())
                .thenAccept(this::registerExtTypes)
                .whenComplete((v, error) -> {
                    if (error == null) {
                        advance(ClientState.HANDSHAKE_EXT_TYPES, ClientState.READY);
                        log.debug("Client ready on channel {}", apiInfo.channelId());
                        connection.execute(() -> handlers.open(connection));
                    } else {
                        state.set(ClientState.FAILED);
                        log.warn("Handshake with {} failed: {}", address, error.getMessage());
                        connection.close();
                        shutdownExecutor();
                    }
                });
    }

    private CompletableFuture<Void> announceClientInfo() {
        advance(ClientState.CONNECTING, ClientState.HANDSHAKE_CLIENT_INFO);
        log.debug("Announcing client {} to {}", identity.name(), address);
        return connection.send(new NotificationFrame(
                SET_CLIENT_INFO, List.of(identity.name(), identity.versionInfo(), CLIENT_TYPE, List.of(), Map.of())));
    }

    private CompletableFuture<ApiInfo> fetchApiInfo() {
        advance(ClientState.HANDSHAKE_CLIENT_INFO, ClientState.HANDSHAKE_CAPABILITIES);
        return call(requestTimeout.orElse(null), GET_API_INFO, new Object[0]).thenApply(ApiInfo::parse);
    }

    private void registerExtTypes(ApiInfo info) {
        advance(ClientState.HANDSHAKE_CAPABILITIES, ClientState.HANDSHAKE_EXT_TYPES);
        for (String required : requiredExtTypes) {
            if (!info.types().containsKey(required)) {
                throw new NvimProtocolException("API metadata does not describe extension type " + required);
            }
        }
        info.types().forEach(extTypes::register);
        apiInfo = info;
    }

    private void advance(ClientState from, ClientState to) {
        if (!state.compareAndSet(from, to)) {
            throw new NvimNotConnectedException("Client left the handshake while " + from + ", now " + state.get());
        }
    }

    private void onClosed() {
        ClientState previous =
                state.getAndUpdate(current -> current == ClientState.FAILED ? current : ClientState.CLOSED);
        if (previous != ClientState.FAILED && previous != ClientState.CLOSED) {
            log.debug("Client on {} closed", address);
        }
        shutdownExecutor();
    }

    private void shutdownExecutor() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    @Override
    public CompletableFuture<Void> notify(String method, Object... params) {
        if (state.get() != ClientState.READY) {
            return CompletableFuture.failedFuture(new NvimNotConnectedException());
        }
        return connection.send(new NotificationFrame(method, Arrays.asList(params)));
    }

    @Override
    public CompletableFuture<Object> request(String method, Object... params) {
        return request(requestTimeout.orElse(null), method, params);
    }

    @Override
    public CompletableFuture<Object> request(Duration timeout, String method, Object... params) {
        if (state.get() != ClientState.READY) {
            return CompletableFuture.failedFuture(new NvimNotConnectedException());
        }
        return call(timeout, method, params);
    }

    private CompletableFuture<Object> call(Duration timeout, String method, Object[] params) {
        PendingCalls.PendingCall call = pendingCalls.register(method);
        if (call.future().isDone()) {
            return call.future();
        }
        connection.send(new RequestFrame(call.id(), method, Arrays.asList(params))).whenComplete((v, error) -> {
            if (error != null) {
                pendingCalls.fail(call.id(), error);
            }
        });
        if (timeout != null) {
            pendingCalls.expireAfter(call, timeout, connection.scheduler());
        }
        return call.future();
    }

    @Override
    public void onNotify(String method, NotificationHandler handler) {
        handlers.onNotify(method, handler);
    }

    @Override
    public void onRequest(String method, RequestHandler handler) {
        handlers.onRequest(method, handler);
    }

    @Override
    public long channel() {
        return apiInfo().channelId();
    }

    /**
     * Returns the metadata received during the handshake.
     *
     * @throws NvimNotConnectedException before the handshake has completed
     */
    public ApiInfo apiInfo() {
        ApiInfo info = apiInfo;
        if (info == null) {
            throw new NvimNotConnectedException("Channel is not known before the handshake completes");
        }
        return info;
    }

    public CapabilityCache capabilities() {
        return capabilities;
    }

    public ExtTypeRegistry extTypes() {
        return extTypes;
    }

    public ClientState state() {
        return state.get();
    }

    /**
     * Completes once the connection has closed, by {@link #close()} or by the peer.
     */
    public CompletableFuture<Void> closeFuture() {
        if (connection == null) {
            return CompletableFuture.failedFuture(new NvimNotConnectedException());
        }
        return connection.closeFuture();
    }

    /**
     * Closes the connection and releases resources. Every pending request is rejected.
     */
    public CompletableFuture<Void> close() {
        if (connection != null) {
            return connection.close();
        }
        state.compareAndSet(ClientState.NEW, ClientState.CLOSED);
        shutdownExecutor();
        return CompletableFuture.completedFuture(null);
    }
}
