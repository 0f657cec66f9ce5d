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

package org.nvimrpc.message;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.nvimrpc.exception.NvimInvalidArgumentException;
import org.nvimrpc.exception.NvimProtocolException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtValueTest {

    private static final ExtType BUFFER = new ExtType("Buffer", 0);

    @Nested
    class Equality {

        @Test
        void shouldBeEqualForSameCodeAndPayload() {
            // given
            ExtValue first = BUFFER.wrap(new byte[] {0x01});
            ExtValue second = new ExtValue(new ExtType("Buffer", 0), new byte[] {0x01});

            // then
            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        }

        @Test
        void shouldDifferByPayload() {
            assertThat(BUFFER.wrap(new byte[] {0x01})).isNotEqualTo(BUFFER.wrap(new byte[] {0x02}));
        }

        @Test
        void shouldDifferByCode() {
            // given
            ExtType window = new ExtType("Window", 1);

            // then
            assertThat(BUFFER.wrap(new byte[] {0x01})).isNotEqualTo(window.wrap(new byte[] {0x01}));
        }

        @Test
        void shouldNotShareBytesWithCaller() {
            // given
            byte[] payload = {0x01};
            ExtValue value = BUFFER.wrap(payload);

            // when
            payload[0] = 0x7f;
            value.data()[0] = 0x7e;

            // then
            assertThat(value.data()).containsExactly(0x01);
        }
    }

    @Nested
    class Handles {

        @Test
        void shouldRoundTripHandle() {
            // when
            ExtValue value = ExtValue.ofHandle(BUFFER, 1000);

            // then
            assertThat(value.code()).isZero();
            assertThat(value.handle()).isEqualTo(1000);
        }

        @Test
        void shouldEncodeSmallHandleAsSingleByte() {
            assertThat(ExtValue.ofHandle(BUFFER, 2).data()).containsExactly(0x02);
        }

        @Test
        void shouldRejectPayloadThatIsNotAnInteger() {
            // given
            ExtValue value = BUFFER.wrap(new byte[] {(byte) 0xa1, 'x'});

            // when & then
            assertThatThrownBy(value::handle).isInstanceOf(NvimProtocolException.class);
        }

        @Test
        void shouldRejectEmptyPayload() {
            assertThatThrownBy(() -> BUFFER.wrap(new byte[0]).handle()).isInstanceOf(NvimProtocolException.class);
        }
    }

    @Test
    void shouldRenderNameAndHexPayload() {
        assertThat(BUFFER.wrap(new byte[] {0x0a, (byte) 0xff})).hasToString("Buffer(0aff)");
    }

    @Test
    void shouldRejectCodeOutsideSignedByteRange() {
        assertThatThrownBy(() -> new ExtType("Huge", 128)).isInstanceOf(NvimInvalidArgumentException.class);
        assertThatThrownBy(() -> new ExtType("Tiny", -129)).isInstanceOf(NvimInvalidArgumentException.class);
    }

    @Test
    void shouldRejectEmptyTypeName() {
        assertThatThrownBy(() -> new ExtType("", 0)).isInstanceOf(NvimInvalidArgumentException.class);
    }
}
