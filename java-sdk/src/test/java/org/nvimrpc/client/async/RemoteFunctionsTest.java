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

package org.nvimrpc.client.async;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.nvimrpc.exception.DuplicateHandlerException;
import org.nvimrpc.exception.NvimInvalidArgumentException;
import org.nvimrpc.exception.NvimNotConnectedException;
import org.nvimrpc.exception.NvimRemoteException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteFunctionsTest {

    private static final Duration WAIT = Duration.ofSeconds(1);

    @Nested
    class Definitions {

        @Test
        void shouldBindRequestFunctionToChannel() {
            // given
            RemoteFunction function = RemoteFunction.create("my_plugin.complete", true);

            // when
            String lua = function.luaDefinition(7);

            // then
            assertThat(function.remoteName()).matches("My_plugin_complete_[0-9a-f]{32}");
            assertThat(lua)
                    .isEqualTo(function.remoteName()
                            + " = function (...) return vim.rpcrequest(7, 'my_plugin.complete', {...}) end");
        }

        @Test
        void shouldUseNotifyForNonBlockingFunction() {
            // given
            RemoteFunction function = RemoteFunction.create("on_text_changed", false);

            // when
            String lua = function.luaDefinition(3);
            String viml = function.vimlDefinition();

            // then
            assertThat(lua).contains("vim.rpcnotify(3, 'on_text_changed', {...})");
            assertThat(viml)
                    .isEqualTo("function! " + function.remoteName() + "(...)\n"
                            + "  call v:lua." + function.remoteName() + "(a:000)\n"
                            + "endfunction");
        }

        @Test
        void shouldReturnResultFromBlockingVimlWrapper() {
            // given
            RemoteFunction function = RemoteFunction.create("lookup", true);

            // when
            String viml = function.vimlDefinition();

            // then
            assertThat(viml).contains("  return v:lua." + function.remoteName() + "(a:000)");
        }

        @Test
        void shouldGiveEachRegistrationItsOwnName() {
            // when
            RemoteFunction first = RemoteFunction.create("refresh", false);
            RemoteFunction second = RemoteFunction.create("refresh", false);

            // then
            assertThat(first.remoteName()).startsWith("Refresh_").isNotEqualTo(second.remoteName());
        }

        @Test
        void shouldPrefixNamesThatCannotStartVimFunction() {
            // when
            RemoteFunction function = RemoteFunction.create("_private", true);

            // then
            assertThat(function.remoteName()).startsWith("Rpc__private_");
        }

        @Test
        void shouldEscapeQuotesInMethodName() {
            // given
            RemoteFunction function = RemoteFunction.create("it's", true);

            // when
            String lua = function.luaDefinition(1);

            // then
            assertThat(lua).contains("'it\\'s'");
            assertThat(function.remoteName()).startsWith("It_s_");
        }

        @Test
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> RemoteFunction.create(" ", true))
                    .isInstanceOf(NvimInvalidArgumentException.class);
        }
    }

    @Nested
    class Define {

        @Test
        void shouldRegisterHandlersAndDefineFunctions() {
            // given
            var client = new RecordingClient(call -> CompletableFuture.completedFuture(null));
            var functions = new RemoteFunctions(client);
            RequestHandler complete = params -> List.of("a", "b");
            NotificationHandler changed = params -> {};

            // when
            RemoteFunction first = functions.onRequest("complete", complete);
            RemoteFunction second = functions.onNotify("changed", changed);
            List<RemoteFunction> defined = functions.define().join();

            // then
            assertThat(client.requestHandlers).containsEntry("complete", complete);
            assertThat(client.notificationHandlers).containsEntry("changed", changed);
            assertThat(defined).containsExactly(first, second);
            assertThat(client.calls)
                    .containsExactly(
                            List.of("nvim_exec_lua", first.luaDefinition(RecordingClient.CHANNEL), List.of()),
                            List.of("nvim_exec", first.vimlDefinition(), false),
                            List.of("nvim_exec_lua", second.luaDefinition(RecordingClient.CHANNEL), List.of()),
                            List.of("nvim_exec", second.vimlDefinition(), false));
            assertThat(functions.undefined()).isEmpty();
        }

        @Test
        void shouldDefineOnlyNewFunctionsOnNextCall() {
            // given
            var client = new RecordingClient(call -> CompletableFuture.completedFuture(null));
            var functions = new RemoteFunctions(client);
            functions.onRequest("first", params -> null);
            functions.define().join();

            // when
            RemoteFunction second = functions.onRequest("second", params -> null);
            List<RemoteFunction> defined = functions.define().join();

            // then
            assertThat(defined).containsExactly(second);
            assertThat(client.calls).hasSize(4);
        }

        @Test
        void shouldKeepFunctionsUndefinedWhenDefinitionFails() {
            // given
            var client = new RecordingClient(call -> call.get(1).toString().startsWith("Broken")
                    ? CompletableFuture.failedFuture(new NvimRemoteException("nvim_exec_lua", "E5108: syntax"))
                    : CompletableFuture.completedFuture(null));
            var functions = new RemoteFunctions(client);
            functions.onRequest("working", params -> null);
            RemoteFunction broken = functions.onRequest("broken", params -> null);

            // when
            CompletableFuture<List<RemoteFunction>> defined = functions.define();

            // then
            assertThat(defined)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(NvimRemoteException.class);
            assertThat(functions.undefined()).containsExactly(broken);
        }

        @Test
        void shouldFailBeforeClientIsReady() {
            // given
            var client = new RecordingClient(call -> CompletableFuture.completedFuture(null));
            client.ready = false;
            var functions = new RemoteFunctions(client);
            RemoteFunction pending = functions.onRequest("early", params -> null);

            // when
            CompletableFuture<List<RemoteFunction>> defined = functions.define();

            // then
            assertThat(defined)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(NvimNotConnectedException.class);
            assertThat(client.calls).isEmpty();
            assertThat(functions.undefined()).containsExactly(pending);
        }

        @Test
        void shouldPropagateDuplicateRegistration() {
            // given
            var functions = new RemoteFunctions(new RecordingClient(call -> CompletableFuture.completedFuture(null)));
            functions.onRequest("complete", params -> null);

            // when & then
            assertThatThrownBy(() -> functions.onNotify("complete", params -> {}))
                    .isInstanceOf(DuplicateHandlerException.class);
            assertThat(functions.undefined()).hasSize(1);
        }
    }

    private static final class RecordingClient implements RpcClient {

        static final long CHANNEL = 5;

        private final Function<List<Object>, CompletableFuture<Object>> answers;
        private final List<List<Object>> calls = new ArrayList<>();
        private final Map<String, RequestHandler> requestHandlers = new LinkedHashMap<>();
        private final Map<String, NotificationHandler> notificationHandlers = new LinkedHashMap<>();
        private boolean ready = true;

        RecordingClient(Function<List<Object>, CompletableFuture<Object>> answers) {
            this.answers = answers;
        }

        @Override
        public CompletableFuture<Void> notify(String method, Object... params) {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Object> request(String method, Object... params) {
            List<Object> call = new ArrayList<>();
            call.add(method);
            call.addAll(Arrays.asList(params));
            calls.add(call);
            return answers.apply(call);
        }

        @Override
        public CompletableFuture<Object> request(Duration timeout, String method, Object... params) {
            return request(method, params);
        }

        @Override
        public void onNotify(String method, NotificationHandler handler) {
            register(method);
            notificationHandlers.put(method, handler);
        }

        @Override
        public void onRequest(String method, RequestHandler handler) {
            register(method);
            requestHandlers.put(method, handler);
        }

        private void register(String method) {
            if (requestHandlers.containsKey(method) || notificationHandlers.containsKey(method)) {
                throw new DuplicateHandlerException(method);
            }
        }

        @Override
        public long channel() {
            if (!ready) {
                throw new NvimNotConnectedException();
            }
            return CHANNEL;
        }
    }
}
