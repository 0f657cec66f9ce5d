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
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.nvimrpc.exception.NvimProtocolException;

import java.io.IOException;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MsgpackValueScannerTest {

    private final MsgpackValueScanner scanner = new MsgpackValueScanner();

    private static byte[] everyFormat() throws IOException {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packArrayHeader(35);
        packer.packNil().packBoolean(true).packBoolean(false);
        packer.packInt(5).packInt(-3).packInt(200).packInt(-100).packInt(40_000).packInt(-40_000);
        packer.packInt(-1_000).packInt(100_000);
        packer.packLong(5_000_000_000L).packLong(-5_000_000_000L);
        packer.packBigInteger(BigInteger.ONE.shiftLeft(63));
        packer.packFloat(1.5f).packDouble(2.5d);
        packer.packString("short").packString("s".repeat(100)).packString("m".repeat(1_000));
        packer.packString("l".repeat(70_000));
        packBinary(packer, 10);
        packBinary(packer, 1_000);
        packBinary(packer, 70_000);
        packer.packMapHeader(2).packString("a").packInt(1).packString("b").packArrayHeader(0);
        packer.packArrayHeader(20);
        for (int i = 0; i < 20; i++) {
            packer.packInt(i);
        }
        packer.packMapHeader(0);
        packer.packMapHeader(16);
        for (int i = 0; i < 16; i++) {
            packer.packInt(i).packNil();
        }
        for (int length : new int[] {1, 2, 4, 8, 16, 3, 300, 70_000}) {
            packer.packExtensionTypeHeader((byte) 1, length);
            packer.writePayload(new byte[length]);
        }
        return packer.toByteArray();
    }

    private static void packBinary(MessageBufferPacker packer, int length) throws IOException {
        packer.packBinaryHeader(length);
        packer.writePayload(new byte[length]);
    }

    @Test
    void shouldFindEndOfValueContainingEveryFormat() throws IOException {
        // given
        byte[] value = everyFormat();
        ByteBuf input = Unpooled.buffer();
        input.writeBytes(value);
        input.writeBytes(new byte[] {(byte) 0x90});

        // when
        int length = scanner.scan(input);

        // then
        assertThat(length).isEqualTo(value.length);
    }

    @Test
    void shouldResumeScanAsBytesArrive() throws IOException {
        // given
        byte[] value = everyFormat();
        ByteBuf input = Unpooled.buffer();
        int step = 997;

        // when
        int length = -1;
        for (int from = 0; from < value.length; from += step) {
            assertThat(length).isEqualTo(-1);
            input.writeBytes(value, from, Math.min(step, value.length - from));
            length = scanner.scan(input);
        }

        // then
        assertThat(length).isEqualTo(value.length);
    }

    @Test
    void shouldNeedMoreBytesWhenPayloadIsCutShort() {
        // given
        ByteBuf input = Unpooled.wrappedBuffer(new byte[] {(byte) 0xa5, 'h', 'e'});

        // when
        int length = scanner.scan(input);

        // then
        assertThat(length).isEqualTo(-1);
    }

    @Test
    void shouldStartOverAfterCompleteValue() {
        // given
        ByteBuf input = Unpooled.wrappedBuffer(new byte[] {(byte) 0x92, 0x01, 0x02, (byte) 0xc0});

        // when
        int first = scanner.scan(input);
        input.skipBytes(first);
        int second = scanner.scan(input);

        // then
        assertThat(first).isEqualTo(3);
        assertThat(second).isEqualTo(1);
    }

    @Test
    void shouldRejectNeverUsedFormatByte() {
        // given
        ByteBuf input = Unpooled.wrappedBuffer(new byte[] {(byte) 0xc1});

        // when & then
        assertThatThrownBy(() -> scanner.scan(input))
                .isInstanceOf(NvimProtocolException.class)
                .hasMessageContaining("0xc1");
    }
}
