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

/**
 * Answer to a {@link RequestFrame} with the same id.
 *
 * <p>Exactly one of {@code error} and {@code result} is meaningful: a non-null error marks the
 * response as failed regardless of the result.
 */
public record ResponseFrame(long id, Object error, Object result) implements Frame {

    public static ResponseFrame success(long id, Object result) {
        return new ResponseFrame(id, null, result);
    }

    public static ResponseFrame failure(long id, Object error) {
        return new ResponseFrame(id, error, null);
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public MessageType type() {
        return MessageType.RESPONSE;
    }
}
