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

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.nvimrpc.exception.NvimConnectionException;
import org.nvimrpc.exception.NvimRpcException;
import org.nvimrpc.message.Frame;
import org.nvimrpc.message.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Last inbound handler of the pipeline: responses go to the correlator, everything else to
 * the dispatcher. Loss of the channel rejects every pending call.
 */
class RpcInboundHandler extends SimpleChannelInboundHandler<Frame> {
    private static final Logger log = LoggerFactory.getLogger(RpcInboundHandler.class);

    private final PendingCalls pendingCalls;
    private final Consumer<Frame> dispatcher;

    RpcInboundHandler(PendingCalls pendingCalls, Consumer<Frame> dispatcher) {
        this.pendingCalls = pendingCalls;
        this.dispatcher = dispatcher;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Frame frame) {
        if (frame instanceof ResponseFrame response) {
            pendingCalls.resolve(response);
        } else {
            dispatcher.accept(frame);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Connection to {} closed", ctx.channel().remoteAddress());
        pendingCalls.rejectAll(new NvimConnectionException("Connection closed"));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable error = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        log.error("Closing connection after unrecoverable error", error);
        pendingCalls.rejectAll(
                error instanceof NvimRpcException ? error : new NvimConnectionException("Connection failed", error));
        ctx.close();
    }
}
