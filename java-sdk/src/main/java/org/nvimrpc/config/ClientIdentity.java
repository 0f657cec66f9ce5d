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

package org.nvimrpc.config;

import org.apache.commons.lang3.StringUtils;
import org.nvimrpc.NvimRpcVersion;
import org.nvimrpc.exception.NvimInvalidArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How the client introduces itself to the peer through {@code nvim_set_client_info}.
 */
public record ClientIdentity(String name, int major, int minor, int patch) {

    public static final String DEFAULT_NAME = "nvim-rpc-java";

    public ClientIdentity {
        if (StringUtils.isBlank(name)) {
            throw new NvimInvalidArgumentException("Client name cannot be null or empty");
        }
        if (major < 0 || minor < 0 || patch < 0) {
            throw new NvimInvalidArgumentException("Client version components must not be negative");
        }
    }

    /**
     * Identity named {@value #DEFAULT_NAME} carrying the SDK version.
     *
     * @return the default identity
     */
    public static ClientIdentity defaultIdentity() {
        NvimRpcVersion version = NvimRpcVersion.getInstance();
        return new ClientIdentity(DEFAULT_NAME, version.getMajor(), version.getMinor(), version.getPatch());
    }

    /**
     * The version dictionary in the shape {@code nvim_set_client_info} expects.
     *
     * @return a map with {@code major}, {@code minor} and {@code patch} keys
     */
    public Map<String, Object> versionInfo() {
        Map<String, Object> version = new LinkedHashMap<>();
        version.put("major", major);
        version.put("minor", minor);
        version.put("patch", patch);
        return version;
    }
}
