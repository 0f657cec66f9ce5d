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
import org.nvimrpc.exception.NvimProtocolException;

/**
 * Finds where the next top level msgpack value ends without decoding it.
 *
 * <p>The scan walks value headers only, so strings and binaries are stepped over by their
 * length. Progress is kept relative to the buffer's reader index between calls, so bytes
 * already scanned are not looked at again when more input arrives.
 */
final class MsgpackValueScanner {

    private long scanned;
    private long pending = 1;

    /**
     * Continues the scan over {@code in} starting at its reader index.
     *
     * @return the length of the complete value, or {@code -1} if more bytes are needed
     * @throws NvimProtocolException on a byte that cannot start a msgpack value
     */
    int scan(ByteBuf in) {
        int base = in.readerIndex();
        int readable = in.readableBytes();
        while (pending > 0) {
            if (scanned >= readable) {
                return -1;
            }
            int offset = base + (int) scanned;
            int available = readable - (int) scanned;
            int b = in.getUnsignedByte(offset);

            if (b <= 0x7f || b >= 0xe0 || b == 0xc0 || b == 0xc2 || b == 0xc3) {
                step(1, 0, 0);
            } else if (b <= 0x8f) {
                step(1, 0, 2L * (b & 0x0f));
            } else if (b <= 0x9f) {
                step(1, 0, b & 0x0f);
            } else if (b <= 0xbf) {
                step(1, b & 0x1f, 0);
            } else {
                int headerSize = headerSize(b);
                if (available < headerSize) {
                    return -1;
                }
                long length = lengthField(in, offset, b);
                if (isMap(b)) {
                    step(headerSize, 0, 2 * length);
                } else if (isArray(b)) {
                    step(headerSize, 0, length);
                } else {
                    step(headerSize, length, 0);
                }
            }
        }
        if (scanned > readable) {
            return -1;
        }
        if (scanned > Integer.MAX_VALUE) {
            throw new NvimProtocolException("Frame of " + scanned + " bytes is too large");
        }
        int length = (int) scanned;
        reset();
        return length;
    }

    void reset() {
        scanned = 0;
        pending = 1;
    }

    private void step(int headerSize, long payload, long children) {
        scanned += headerSize + payload;
        pending += children - 1;
    }

    private static int headerSize(int b) {
        return switch (b) {
            case 0xc4, 0xcc, 0xd0, 0xd9 -> 2;
            case 0xc5, 0xc7, 0xcd, 0xd1, 0xd4, 0xda, 0xdc, 0xde -> 3;
            case 0xc8, 0xd5 -> 4;
            case 0xc6, 0xca, 0xce, 0xd2, 0xdb, 0xdd, 0xdf -> 5;
            case 0xc9, 0xd6 -> 6;
            case 0xcb, 0xcf, 0xd3 -> 9;
            case 0xd7 -> 10;
            case 0xd8 -> 18;
            default -> throw new NvimProtocolException(String.format("Invalid msgpack format byte 0x%02x", b));
        };
    }

    /**
     * Payload length or element count carried by the header, zero for fixed size values.
     */
    private static long lengthField(ByteBuf in, int offset, int b) {
        return switch (b) {
            case 0xc4, 0xc7, 0xd9 -> in.getUnsignedByte(offset + 1);
            case 0xc5, 0xc8, 0xda, 0xdc, 0xde -> in.getUnsignedShort(offset + 1);
            case 0xc6, 0xc9, 0xdb, 0xdd, 0xdf -> in.getUnsignedInt(offset + 1);
            default -> 0;
        };
    }

    private static boolean isArray(int b) {
        return b == 0xdc || b == 0xdd;
    }

    private static boolean isMap(int b) {
        return b == 0xde || b == 0xdf;
    }
}
