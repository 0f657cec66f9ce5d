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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nvimrpc.client.async.ClientState;
import org.nvimrpc.config.NvimAddress;
import org.nvimrpc.exception.NvimConnectionException;
import org.nvimrpc.message.ExtValue;
import org.nvimrpc.message.RequestFrame;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the client against a peer on a loopback TCP socket, where reads land in direct buffers.
 */
class AsyncNvimClientTcpTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeNvimServer server;
    private AsyncNvimClient client;

    @BeforeEach
    void setUp() {
        server = FakeNvimServer.start(FakeNvimServer.Transport.TCP);
        client = AsyncNvimClient.builder()
                .address(server.address())
                .clientName("tcp-client")
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close().join();
        server.close();
    }

    @Test
    void shouldCompleteHandshakeOverTcp() throws Exception {
        // when
        client.connect().get(5, TimeUnit.SECONDS);

        // then
        assertThat(server.awaitRequest("nvim_get_api_info").params()).isEmpty();
        assertThat(client.state()).isEqualTo(ClientState.READY);
        assertThat(client.channel()).isEqualTo(FakeNvimServer.CHANNEL_ID);
        assertThat(NvimAddress.of(server.address()).kind()).isEqualTo(NvimAddress.Kind.TCP);
    }

    @Test
    void shouldReturnExtensionValueResultOverTcp() throws Exception {
        // given
        server.answer("nvim_get_current_win", params -> server.extType("Window").wrap(new byte[] {0x05}));
        client.connect().get(5, TimeUnit.SECONDS);

        // when
        Object result = client.request("nvim_get_current_win").get(5, TimeUnit.SECONDS);

        // then
        assertThat(result).isInstanceOf(ExtValue.class);
        assertThat(((ExtValue) result).type().name()).isEqualTo("Window");
        assertThat(((ExtValue) result).handle()).isEqualTo(5L);
    }

    @Test
    void shouldReceiveResponseSpanningManyReads() throws Exception {
        // given
        String line = "0123456789abcdef".repeat(64);
        List<String> lines = Collections.nCopies(2_000, line);
        server.answer("nvim_buf_get_lines", params -> lines);
        client.connect().get(5, TimeUnit.SECONDS);

        // when
        Object result = client.request("nvim_buf_get_lines", 0L, 0L, -1L, false).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result).isInstanceOf(List.class);
        assertThat((List<?>) result).hasSize(2_000).allMatch(line::equals);
    }

    @Test
    void shouldAnswerPeerRequestOverTcp() throws Exception {
        // given
        client.onRequest("ping", params -> "pong " + params.get(0));
        client.connect().get(5, TimeUnit.SECONDS);

        // when
        CompletableFuture<Object> answer = server.request("ping", 1L);

        // then
        assertThat(answer).succeedsWithin(WAIT).isEqualTo("pong 1");
    }

    @Test
    void shouldRejectOutstandingRequestWhenPeerClosesSocket() throws Exception {
        // given
        client.connect().get(5, TimeUnit.SECONDS);
        CompletableFuture<Object> pending = client.request("slow");
        RequestFrame sent = server.awaitRequest("slow");

        // when
        server.disconnectClient();

        // then
        assertThat(sent.method()).isEqualTo("slow");
        assertThat(pending)
                .failsWithin(WAIT)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(NvimConnectionException.class);
        assertThat(client.closeFuture()).succeedsWithin(WAIT);
    }
}
