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

import org.apache.commons.lang3.StringUtils;
import org.nvimrpc.exception.NvimInvalidArgumentException;

import java.util.UUID;

/**
 * A handler of this client published to the editor as a global Lua function and a Vimscript
 * function of the same name.
 *
 * @param name the method name the editor calls back with
 * @param remoteName the function name defined in the editor, unique per registration
 * @param blocking whether the function waits for the handler's answer ({@code vim.rpcrequest})
 *     or fires a notification ({@code vim.rpcnotify})
 */
public record RemoteFunction(String name, String remoteName, boolean blocking) {

    static RemoteFunction create(String name, boolean blocking) {
        if (StringUtils.isBlank(name)) {
            throw new NvimInvalidArgumentException("Function name cannot be null or empty");
        }
        String base = StringUtils.capitalize(name.replaceAll("[^A-Za-z0-9_]", "_"));
        if (!Character.isUpperCase(base.charAt(0))) {
            base = "Rpc_" + base;
        }
        String suffix = UUID.randomUUID().toString().replace("-", "");
        return new RemoteFunction(name, base + "_" + suffix, blocking);
    }

    /**
     * Lua chunk defining the global function, bound to {@code channel}.
     */
    public String luaDefinition(long channel) {
        String op = blocking ? "rpcrequest" : "rpcnotify";
        String method = name.replace("\\", "\\\\").replace("'", "\\'");
        return remoteName + " = function (...) return vim." + op + "(" + channel + ", '" + method + "', {...}) end";
    }

    /**
     * Vimscript wrapper forwarding its arguments, as one list, to the Lua function.
     */
    public String vimlDefinition() {
        String body = blocking ? "  return v:lua." : "  call v:lua.";
        return "function! " + remoteName + "(...)\n" + body + remoteName + "(a:000)\nendfunction";
    }
}
