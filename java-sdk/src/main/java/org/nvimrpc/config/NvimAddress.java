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

import io.netty.channel.local.LocalAddress;
import io.netty.channel.unix.DomainSocketAddress;
import org.apache.commons.lang3.StringUtils;
import org.nvimrpc.exception.NvimInvalidArgumentException;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the peer listens: a TCP endpoint, a Unix domain socket path, or an in-VM Netty
 * {@link LocalAddress}.
 *
 * <p>String addresses follow the conventions of {@code nvim --listen}: {@code host:port} is a
 * TCP endpoint, anything else is a socket path.
 */
public final class NvimAddress {

    /**
     * Environment variable Neovim exports to its child processes.
     */
    public static final String NVIM_ENV = "NVIM";

    /**
     * Environment variable used by older Neovim releases.
     */
    public static final String LEGACY_LISTEN_ENV = "NVIM_LISTEN_ADDRESS";

    public enum Kind {
        TCP,
        UNIX_SOCKET,
        LOCAL
    }

    private final Kind kind;
    private final SocketAddress socketAddress;

    private NvimAddress(Kind kind, SocketAddress socketAddress) {
        this.kind = kind;
        this.socketAddress = socketAddress;
    }

    public static NvimAddress tcp(String host, int port) {
        if (StringUtils.isBlank(host)) {
            throw new NvimInvalidArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new NvimInvalidArgumentException("Port must be between 1 and 65535");
        }
        return new NvimAddress(Kind.TCP, InetSocketAddress.createUnresolved(host, port));
    }

    public static NvimAddress unixSocket(String path) {
        if (StringUtils.isBlank(path)) {
            throw new NvimInvalidArgumentException("Socket path cannot be null or empty");
        }
        return new NvimAddress(Kind.UNIX_SOCKET, new DomainSocketAddress(path));
    }

    public static NvimAddress of(SocketAddress address) {
        Objects.requireNonNull(address, "address");
        if (address instanceof InetSocketAddress) {
            return new NvimAddress(Kind.TCP, address);
        }
        if (address instanceof DomainSocketAddress) {
            return new NvimAddress(Kind.UNIX_SOCKET, address);
        }
        if (address instanceof LocalAddress) {
            return new NvimAddress(Kind.LOCAL, address);
        }
        throw new NvimInvalidArgumentException("Unsupported address type: " + address.getClass().getName());
    }

    /**
     * Parses an address in {@code nvim --listen} notation.
     *
     * @param address {@code host:port}, {@code [ipv6]:port} or a socket path
     * @return the parsed address
     */
    public static NvimAddress parse(String address) {
        if (StringUtils.isBlank(address)) {
            throw new NvimInvalidArgumentException("Address cannot be null or empty");
        }
        String trimmed = address.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            return unixSocket(trimmed);
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon > 0 && colon < trimmed.length() - 1) {
            String port = trimmed.substring(colon + 1);
            if (StringUtils.isNumeric(port)) {
                String host = StringUtils.strip(trimmed.substring(0, colon), "[]");
                return tcp(host, Integer.parseInt(port));
            }
        }
        return unixSocket(trimmed);
    }

    public static Optional<NvimAddress> fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolves the address from {@value #NVIM_ENV}, falling back to {@value #LEGACY_LISTEN_ENV}.
     *
     * @param environment the environment variables to consult
     * @return the address, or empty if neither variable is set
     */
    public static Optional<NvimAddress> fromEnvironment(Map<String, String> environment) {
        String address = environment.get(NVIM_ENV);
        if (StringUtils.isBlank(address)) {
            address = environment.get(LEGACY_LISTEN_ENV);
        }
        return StringUtils.isBlank(address) ? Optional.empty() : Optional.of(parse(address));
    }

    public Kind kind() {
        return kind;
    }

    public SocketAddress socketAddress() {
        return socketAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NvimAddress other)) {
            return false;
        }
        return kind == other.kind && socketAddress.equals(other.socketAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, socketAddress);
    }

    @Override
    public String toString() {
        if (socketAddress instanceof DomainSocketAddress domain) {
            return domain.path();
        }
        if (socketAddress instanceof InetSocketAddress inet) {
            return inet.getHostString() + ":" + inet.getPort();
        }
        return socketAddress.toString();
    }
}
