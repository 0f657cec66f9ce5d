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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.nvimrpc.message.Frame;
import org.nvimrpc.serde.MsgpackValueWriter;

/**
 * Encodes outbound frames into msgpack. The whole frame is encoded before anything is written,
 * so a value that cannot be encoded never leaves a partial frame on the wire.
 */
public class MsgpackFrameEncoder extends MessageToByteEncoder<Frame> {

    private final MsgpackValueWriter writer;

    public MsgpackFrameEncoder(MsgpackValueWriter writer) {
        super(Frame.class);
        this.writer = writer;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame frame, ByteBuf out) {
        out.writeBytes(writer.writeFrame(frame));
    }
}
