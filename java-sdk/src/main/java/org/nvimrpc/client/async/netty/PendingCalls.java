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

import org.nvimrpc.exception.NvimConnectionException;
import org.nvimrpc.exception.NvimRemoteException;
import org.nvimrpc.exception.NvimRequestTimeoutException;
import org.nvimrpc.message.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Correlates responses with the requests this client sent.
 *
 * <p>Ids come from a monotonically increasing counter and are never reused. Each call is
 * settled exactly once: by its response, by its deadline, or by {@link #rejectAll} when the
 * connection goes away. Once the table has been rejected, new calls fail immediately.
 */
class PendingCalls {
    private static final Logger log = LoggerFactory.getLogger(PendingCalls.class);

    private final AtomicLong requestIdGenerator = new AtomicLong(0);
    private final ConcurrentHashMap<Long, PendingCall> calls = new ConcurrentHashMap<>();
    private final AtomicReference<Throwable> closedCause = new AtomicReference<>();

    PendingCall register(String method) {
        PendingCall call = new PendingCall(requestIdGenerator.incrementAndGet(), method, new CompletableFuture<>());
        calls.put(call.id(), call);
        Throwable cause = closedCause.get();
        if (cause != null) {
            calls.remove(call.id());
            call.future().completeExceptionally(cause);
        }
        return call;
    }

    /**
     * Settles the call matching the response. Error wins over result.
     *
     * @return {@code false} if no call with that id is outstanding
     */
    boolean resolve(ResponseFrame response) {
        PendingCall call = calls.remove(response.id());
        if (call == null) {
            log.warn("Dropping response for unknown request id {}", response.id());
            return false;
        }
        if (response.isError()) {
            log.debug("Request {} ({}) failed: {}", call.id(), call.method(), response.error());
            call.future().completeExceptionally(new NvimRemoteException(call.method(), response.error()));
        } else {
            call.future().complete(response.result());
        }
        return true;
    }

    boolean fail(long id, Throwable cause) {
        PendingCall call = calls.remove(id);
        return call != null && call.future().completeExceptionally(cause);
    }

    boolean expire(long id, Duration timeout) {
        PendingCall call = calls.remove(id);
        if (call == null) {
            return false;
        }
        log.debug("Request {} ({}) timed out after {}", id, call.method(), timeout);
        return call.future().completeExceptionally(new NvimRequestTimeoutException(call.method(), timeout));
    }

    /**
     * Arms a deadline for the call on {@code scheduler}. A scheduler that is already shutting down
     * fails the call instead.
     */
    void expireAfter(PendingCall call, Duration timeout, ScheduledExecutorService scheduler) {
        ScheduledFuture<?> deadline;
        try {
            deadline = scheduler.schedule(() -> expire(call.id(), timeout), timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            fail(call.id(), new NvimConnectionException("Connection closed while sending " + call.method(), e));
            return;
        }
        call.future().whenComplete((result, error) -> deadline.cancel(false));
    }

    /**
     * Rejects every outstanding call and every call registered afterwards. Calling it again only
     * rejects calls that raced in; the first cause is kept.
     *
     * @return the number of calls rejected
     */
    int rejectAll(Throwable cause) {
        closedCause.compareAndSet(null, cause);
        int rejected = 0;
        for (Long id : calls.keySet()) {
            PendingCall call = calls.remove(id);
            if (call != null && call.future().completeExceptionally(cause)) {
                rejected++;
            }
        }
        if (rejected > 0) {
            log.debug("Rejected {} pending requests: {}", rejected, cause.getMessage());
        }
        return rejected;
    }

    int size() {
        return calls.size();
    }

    record PendingCall(long id, String method, CompletableFuture<Object> future) {}
}
