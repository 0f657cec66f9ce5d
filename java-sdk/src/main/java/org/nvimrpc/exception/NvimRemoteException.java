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

package org.nvimrpc.exception;

import java.util.List;
import java.util.Optional;

/**
 * Exception thrown when the peer answers a request with an error response.
 *
 * <p>The raw error payload is kept as decoded from the wire. Neovim reports errors as a
 * {@code [error_type_id, message]} pair; when the payload has that shape the type id and the
 * message are exposed separately. Any other payload is rendered with {@link String#valueOf}.
 */
public class NvimRemoteException extends NvimRpcException {

    private final String method;
    private final Object payload;
    private final Optional<Long> errorTypeId;
    private final String reason;

    /**
     * Constructs a new NvimRemoteException.
     *
     * @param method the method of the request that failed
     * @param payload the error payload sent by the peer, never {@code null}
     */
    public NvimRemoteException(String method, Object payload) {
        this(method, payload, errorTypeIdOf(payload), reasonOf(payload));
    }

    private NvimRemoteException(String method, Object payload, Optional<Long> errorTypeId, String reason) {
        super("Remote error from " + method + ": " + reason);
        this.method = method;
        this.payload = payload;
        this.errorTypeId = errorTypeId;
        this.reason = reason;
    }

    /**
     * Returns the method of the request that failed.
     *
     * @return the method name
     */
    public String getMethod() {
        return method;
    }

    /**
     * Returns the error payload exactly as decoded from the response frame.
     *
     * @return the raw payload
     */
    public Object getPayload() {
        return payload;
    }

    /**
     * Returns the error type id if the payload has the {@code [id, message]} shape.
     *
     * @return the error type id, if present
     */
    public Optional<Long> getErrorTypeId() {
        return errorTypeId;
    }

    /**
     * Returns the human readable part of the payload.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }

    private static Optional<Long> errorTypeIdOf(Object payload) {
        if (payload instanceof List<?> pair && pair.size() == 2 && pair.get(0) instanceof Number id) {
            return Optional.of(id.longValue());
        }
        return Optional.empty();
    }

    private static String reasonOf(Object payload) {
        if (payload instanceof List<?> pair && pair.size() == 2 && pair.get(0) instanceof Number) {
            return String.valueOf(pair.get(1));
        }
        return String.valueOf(payload);
    }
}
