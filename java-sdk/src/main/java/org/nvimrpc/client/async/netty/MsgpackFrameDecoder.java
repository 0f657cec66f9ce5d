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
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.nvimrpc.exception.NvimProtocolException;
import org.nvimrpc.message.Frame;
import org.nvimrpc.serde.MsgpackValueReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Streaming decoder for msgpack-RPC frames.
 *
 * <p>Frames have no length prefix, so a frame is complete once a whole top level msgpack value
 * is buffered. {@link MsgpackValueScanner} finds that boundary from the headers alone and
 * resumes where it stopped on the next read; values are built only once the frame is complete.
 * msgpack-core is always handed a heap array, never the direct buffers socket reads produce.
 * A malformed value cannot be skipped reliably, so everything buffered is discarded and the
 * error is raised to the pipeline.
 */
public class MsgpackFrameDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(MsgpackFrameDecoder.class);

    private final MsgpackValueReader reader;
    private final MsgpackValueScanner scanner = new MsgpackValueScanner();

    public MsgpackFrameDecoder(MsgpackValueReader reader) {
        this.reader = reader;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!in.isReadable()) {
            return;
        }

        Frame frame;
        int length;
        try {
            length = scanner.scan(in);
            if (length < 0) {
                log.trace("Buffered {} bytes of an incomplete frame", in.readableBytes());
                return;
            }
            frame = readFrame(in, length);
        } catch (NvimProtocolException e) {
            discard(in);
            throw e;
        } catch (MessagePackException e) {
            discard(in);
            throw new NvimProtocolException("Malformed msgpack input", e);
        }

        in.skipBytes(length);
        log.trace("Decoded {} frame ({} bytes)", frame.type(), length);
        out.add(frame);
    }

    private Frame readFrame(ByteBuf in, int length) throws Exception {
        byte[] bytes;
        int offset;
        if (in.hasArray()) {
            bytes = in.array();
            offset = in.arrayOffset() + in.readerIndex();
        } else {
            bytes = ByteBufUtil.getBytes(in, in.readerIndex(), length);
            offset = 0;
        }
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes, offset, length)) {
            return reader.readFrame(unpacker);
        }
    }

    private void discard(ByteBuf in) {
        scanner.reset();
        in.skipBytes(in.readableBytes());
    }
}
