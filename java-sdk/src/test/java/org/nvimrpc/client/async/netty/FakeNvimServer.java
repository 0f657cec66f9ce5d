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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalServerChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.nvimrpc.message.ExtType;
import org.nvimrpc.message.Frame;
import org.nvimrpc.message.NotificationFrame;
import org.nvimrpc.message.RequestFrame;
import org.nvimrpc.message.ResponseFrame;
import org.nvimrpc.serde.ExtTypeRegistry;
import org.nvimrpc.serde.MsgpackValueReader;
import org.nvimrpc.serde.MsgpackValueWriter;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stand-in for a Neovim process, listening on a Netty local address or on a loopback TCP port.
 *
 * <p>It answers {@code nvim_get_api_info} on its own and records every other frame it
 * receives.
 */
final class FakeNvimServer implements AutoCloseable {

    static final long CHANNEL_ID = 3L;
    static final long AWAIT_SECONDS = 5;

    enum Transport {
        LOCAL,
        TCP
    }

    private final Transport transport;
    private final EventLoopGroup group;
    private final ExtTypeRegistry extTypes = new ExtTypeRegistry();
    private final BlockingQueue<Frame> received = new LinkedBlockingQueue<>();
    private final PendingCalls pendingCalls = new PendingCalls();
    private final Map<String, BiFunction<Long, List<Object>, ResponseFrame>> answers = new ConcurrentHashMap<>();
    private final CompletableFuture<Channel> accepted = new CompletableFuture<>();
    private final List<Frame> sentBeforeApiInfo = new ArrayList<>();
    private volatile Object apiInfoResult;
    private SocketAddress address;

    private FakeNvimServer(Transport transport, Map<String, Integer> types) {
        this.transport = transport;
        this.group = transport == Transport.TCP ? new NioEventLoopGroup(1) : new DefaultEventLoopGroup(1);
        types.forEach(extTypes::register);
        apiInfoResult = List.of(CHANNEL_ID, metadata(types));
    }

    static FakeNvimServer start() {
        return start(Transport.LOCAL);
    }

    static FakeNvimServer start(Transport transport) {
        Map<String, Integer> types = new LinkedHashMap<>();
        types.put("Buffer", 0);
        types.put("Window", 1);
        types.put("Tabpage", 2);
        return start(transport, types);
    }

    static FakeNvimServer start(Map<String, Integer> types) {
        return start(Transport.LOCAL, types);
    }

    static FakeNvimServer start(Transport transport, Map<String, Integer> types) {
        FakeNvimServer server = new FakeNvimServer(transport, types);
        server.bind();
        return server;
    }

    static Map<Object, Object> metadata(Map<String, Integer> types) {
        Map<Object, Object> typeEntries = new LinkedHashMap<>();
        types.forEach((name, code) -> typeEntries.put(name, Map.of("id", code)));
        Map<Object, Object> errorTypes = new LinkedHashMap<>();
        errorTypes.put("Exception", Map.of("id", 0));
        errorTypes.put("Validation", Map.of("id", 1));
        Map<Object, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", Map.of("api_level", 12));
        metadata.put("types", typeEntries);
        metadata.put("error_types", errorTypes);
        return metadata;
    }

    private void bind() {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(transport == Transport.TCP ? NioServerSocketChannel.class : LocalServerChannel.class)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline()
                                .addLast(new MsgpackFrameDecoder(new MsgpackValueReader(extTypes)))
                                .addLast(new MsgpackFrameEncoder(new MsgpackValueWriter(extTypes)))
                                .addLast(new PeerHandler());
                    }
                });
        SocketAddress bindAddress = transport == Transport.TCP
                ? new InetSocketAddress("127.0.0.1", 0)
                : new LocalAddress("fake-nvim-" + UUID.randomUUID());
        address = bootstrap.bind(bindAddress).syncUninterruptibly().channel().localAddress();
    }

    SocketAddress address() {
        return address;
    }

    ExtType extType(String name) {
        return extTypes.require(name);
    }

    /**
     * Replaces the result sent for {@code nvim_get_api_info}.
     */
    void apiInfoResult(Object result) {
        this.apiInfoResult = result;
    }

    /**
     * Frames pushed to the client right before the {@code nvim_get_api_info} response.
     */
    void sendBeforeApiInfo(Frame frame) {
        sentBeforeApiInfo.add(frame);
    }

    void answer(String method, Function<List<Object>, Object> answer) {
        answers.put(method, (id, params) -> ResponseFrame.success(id, answer.apply(params)));
    }

    void answerWithError(String method, Object error) {
        answers.put(method, (id, params) -> ResponseFrame.failure(id, error));
    }

    void send(Frame frame) {
        client().writeAndFlush(frame).syncUninterruptibly();
    }

    /**
     * Sends a request to the client and returns the pending server side call.
     */
    CompletableFuture<Object> request(String method, Object... params) {
        PendingCalls.PendingCall call = pendingCalls.register(method);
        send(new RequestFrame(call.id(), method, Arrays.asList(params)));
        return call.future();
    }

    Frame nextFrame() throws InterruptedException {
        Frame frame = received.poll(AWAIT_SECONDS, TimeUnit.SECONDS);
        assertThat(frame).as("frame received within %ss", AWAIT_SECONDS).isNotNull();
        return frame;
    }

    Frame awaitFrame(Predicate<Frame> matcher) throws InterruptedException {
        while (true) {
            Frame frame = nextFrame();
            if (matcher.test(frame)) {
                return frame;
            }
        }
    }

    RequestFrame awaitRequest(String method) throws InterruptedException {
        return (RequestFrame)
                awaitFrame(frame -> frame instanceof RequestFrame request && request.method().equals(method));
    }

    NotificationFrame awaitNotification(String method) throws InterruptedException {
        return (NotificationFrame) awaitFrame(
                frame -> frame instanceof NotificationFrame notification && notification.method().equals(method));
    }

    ResponseFrame awaitResponse(long id) throws InterruptedException {
        return (ResponseFrame) awaitFrame(frame -> frame instanceof ResponseFrame response && response.id() == id);
    }

    Frame pollFrame(long millis) throws InterruptedException {
        return received.poll(millis, TimeUnit.MILLISECONDS);
    }

    void disconnectClient() {
        client().close().syncUninterruptibly();
    }

    private Channel client() {
        return accepted.join();
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private final class PeerHandler extends SimpleChannelInboundHandler<Frame> {

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            accepted.complete(ctx.channel());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Frame frame) {
            if (frame instanceof ResponseFrame response) {
                pendingCalls.resolve(response);
            } else if (frame instanceof RequestFrame request) {
                if (AsyncNvimClient.GET_API_INFO.equals(request.method())) {
                    sentBeforeApiInfo.forEach(ctx::write);
                    ctx.writeAndFlush(ResponseFrame.success(request.id(), apiInfoResult));
                } else if (answers.containsKey(request.method())) {
                    ctx.writeAndFlush(answers.get(request.method()).apply(request.id(), request.params()));
                }
            }
            received.add(frame);
        }
    }
}
