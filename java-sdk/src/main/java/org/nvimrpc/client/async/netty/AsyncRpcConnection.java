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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.AdaptiveRecvByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.EncoderException;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.nvimrpc.config.NvimAddress;
import org.nvimrpc.config.RetryPolicy;
import org.nvimrpc.exception.NvimConnectionException;
import org.nvimrpc.exception.NvimNotConnectedException;
import org.nvimrpc.message.Frame;
import org.nvimrpc.serde.ExtTypeRegistry;
import org.nvimrpc.serde.MsgpackValueReader;
import org.nvimrpc.serde.MsgpackValueWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Async connection to the peer using Netty for non-blocking I/O.
 *
 * <p>The channel's event loop is the single reader and writer of the stream. Frames are written
 * in the order {@link #write}/{@link #send} are called; {@link #flush} pushes buffered frames out
 * without closing anything. Reads are bounded by {@code maxReadChunkSize} and fed to the
 * streaming {@link MsgpackFrameDecoder}.
 */
public class AsyncRpcConnection implements FrameSink {
    private static final Logger log = LoggerFactory.getLogger(AsyncRpcConnection.class);

    public static final int DEFAULT_MAX_READ_CHUNK_SIZE = 1_000_000;
    private static final int MIN_READ_CHUNK_SIZE = 64;
    private static final int INITIAL_READ_CHUNK_SIZE = 64 * 1024;

    private final NvimAddress address;
    private final Optional<Duration> connectionTimeout;
    private final RetryPolicy retryPolicy;
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final AtomicBoolean closing = new AtomicBoolean();
    private volatile Channel channel;

    @SuppressWarnings("checkstyle:ParameterNumber")
    AsyncRpcConnection(
            NvimAddress address,
            Optional<Duration> connectionTimeout,
            RetryPolicy retryPolicy,
            int maxReadChunkSize,
            ExtTypeRegistry extTypes,
            PendingCalls pendingCalls,
            Consumer<Frame> dispatcher) {
        this.address = address;
        this.connectionTimeout = connectionTimeout;
        this.retryPolicy = retryPolicy;
        this.eventLoopGroup = newEventLoopGroup(address.kind());
        this.bootstrap = new Bootstrap();
        configureBootstrap(maxReadChunkSize, extTypes, pendingCalls, dispatcher);
    }

    private void configureBootstrap(
            int maxReadChunkSize, ExtTypeRegistry extTypes, PendingCalls pendingCalls, Consumer<Frame> dispatcher) {
        bootstrap
                .group(eventLoopGroup)
                .channel(channelType(address.kind()))
                .option(
                        ChannelOption.RCVBUF_ALLOCATOR,
                        new AdaptiveRecvByteBufAllocator(
                                MIN_READ_CHUNK_SIZE,
                                Math.min(INITIAL_READ_CHUNK_SIZE, maxReadChunkSize),
                                maxReadChunkSize))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast("frameDecoder", new MsgpackFrameDecoder(new MsgpackValueReader(extTypes)));
                        pipeline.addLast("frameEncoder", new MsgpackFrameEncoder(new MsgpackValueWriter(extTypes)));
                        pipeline.addLast("rpcHandler", new RpcInboundHandler(pendingCalls, dispatcher));
                    }
                });
        if (address.kind() == NvimAddress.Kind.TCP) {
            bootstrap.option(ChannelOption.TCP_NODELAY, true);
        }
        connectionTimeout.ifPresent(
                timeout -> bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis()));
    }

    private static EventLoopGroup newEventLoopGroup(NvimAddress.Kind kind) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory("nvim-rpc-io", true);
        return switch (kind) {
            case TCP -> new NioEventLoopGroup(1, threadFactory);
            case UNIX_SOCKET -> {
                if (!Epoll.isAvailable()) {
                    throw new NvimConnectionException(
                            "Unix domain sockets need the native epoll transport", Epoll.unavailabilityCause());
                }
                yield new EpollEventLoopGroup(1, threadFactory);
            }
            case LOCAL -> new DefaultEventLoopGroup(1, threadFactory);
        };
    }

    private static Class<? extends Channel> channelType(NvimAddress.Kind kind) {
        return switch (kind) {
            case TCP -> NioSocketChannel.class;
            case UNIX_SOCKET -> EpollDomainSocketChannel.class;
            case LOCAL -> LocalChannel.class;
        };
    }

    /**
     * Connects to the peer asynchronously, retrying according to the retry policy.
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        attemptConnect(future, 0);
        return future;
    }

    private void attemptConnect(CompletableFuture<Void> future, int retries) {
        bootstrap.connect(address.socketAddress()).addListener((ChannelFutureListener) channelFuture -> {
            if (channelFuture.isSuccess()) {
                channel = channelFuture.channel();
                channel.closeFuture().addListener((ChannelFutureListener) closed -> close());
                log.debug("Connected to {}", address);
                future.complete(null);
            } else if (retries < retryPolicy.getMaxRetries() && !closing.get()) {
                Duration delay = retryPolicy.delayBefore(retries + 1);
                log.debug(
                        "Connection to {} failed ({}), retrying in {}ms",
                        address,
                        channelFuture.cause().getMessage(),
                        delay.toMillis());
                eventLoopGroup.schedule(
                        () -> attemptConnect(future, retries + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                future.completeExceptionally(
                        new NvimConnectionException("Failed to connect to " + address, channelFuture.cause()));
            }
        });
    }

    /**
     * Writes a frame and flushes it.
     */
    @Override
    public CompletableFuture<Void> send(Frame frame) {
        return write(frame, true);
    }

    /**
     * Queues a frame behind everything written before it without flushing.
     */
    public CompletableFuture<Void> write(Frame frame) {
        return write(frame, false);
    }

    public void flush() {
        Channel ch = channel;
        if (ch != null) {
            ch.flush();
        }
    }

    private CompletableFuture<Void> write(Frame frame, boolean flush) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(
                    new NvimNotConnectedException("Connection not established or closed"));
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        ChannelFuture written = flush ? ch.writeAndFlush(frame) : ch.write(frame);
        written.addListener((ChannelFutureListener) result -> {
            if (result.isSuccess()) {
                log.trace("Sent {} frame to {}", frame.type(), address);
                future.complete(null);
            } else {
                Throwable cause = result.cause();
                if (cause instanceof EncoderException && cause.getCause() != null) {
                    cause = cause.getCause();
                } else {
                    log.error("Failed to send {} frame: {}", frame.type(), cause.getMessage());
                }
                future.completeExceptionally(cause);
            }
        });
        return future;
    }

    ScheduledExecutorService scheduler() {
        return eventLoopGroup;
    }

    void execute(Runnable task) {
        eventLoopGroup.execute(task);
    }

    public boolean isActive() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    /**
     * Completes once the connection is closed, whether by {@link #close()} or by the peer.
     */
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    /**
     * Closes the connection and releases resources. Closing more than once is a no-op.
     */
    public CompletableFuture<Void> close() {
        if (!closing.compareAndSet(false, true)) {
            return closeFuture;
        }
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            ch.close().addListener((ChannelFutureListener) channelFuture -> shutdown());
        } else {
            shutdown();
        }
        return closeFuture;
    }

    private void shutdown() {
        eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.debug("Connection to {} released", address);
        closeFuture.complete(null);
    }

    public NvimAddress address() {
        return address;
    }
}
