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

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.nvimrpc.client.async.NotificationHandler;
import org.nvimrpc.client.async.RequestHandler;
import org.nvimrpc.exception.DuplicateHandlerException;
import org.nvimrpc.exception.NvimEncodingException;
import org.nvimrpc.message.Frame;
import org.nvimrpc.message.NotificationFrame;
import org.nvimrpc.message.RequestFrame;
import org.nvimrpc.message.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Routes inbound requests and notifications to registered handlers.
 *
 * <p>Each invocation runs on the handler executor, never on the event loop, so a slow handler
 * does not hold up decoding of later frames. Handler failures are answered with an error
 * response and never escape. Frames that arrive before {@link #open} are queued and dispatched
 * in arrival order once the sink is attached.
 */
class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final ConcurrentHashMap<String, RequestHandler> handlers = new ConcurrentHashMap<>();
    private final Executor executor;
    private final Queue<Frame> backlog = new ArrayDeque<>();
    private volatile FrameSink sink;

    HandlerRegistry(Executor executor) {
        this.executor = executor;
    }

    void onRequest(String method, RequestHandler handler) {
        register(method, handler);
    }

    void onNotify(String method, NotificationHandler handler) {
        Objects.requireNonNull(handler, "handler");
        register(method, params -> {
            handler.handle(params);
            return null;
        });
    }

    private void register(String method, RequestHandler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(method, handler) != null) {
            throw new DuplicateHandlerException(method);
        }
        log.debug("Registered handler for {}", method);
    }

    boolean hasHandler(String method) {
        return handlers.containsKey(method);
    }

    /**
     * Attaches the sink responses are written to and releases the queued frames.
     */
    void open(FrameSink sink) {
        List<Frame> queued;
        synchronized (backlog) {
            this.sink = sink;
            queued = new ArrayList<>(backlog);
            backlog.clear();
        }
        if (!queued.isEmpty()) {
            log.debug("Dispatching {} frames received during the handshake", queued.size());
        }
        queued.forEach(this::invoke);
    }

    void dispatch(Frame frame) {
        if (sink == null) {
            synchronized (backlog) {
                if (sink == null) {
                    backlog.add(frame);
                    return;
                }
            }
        }
        invoke(frame);
    }

    private void invoke(Frame frame) {
        if (frame instanceof RequestFrame request) {
            handleRequest(request);
        } else if (frame instanceof NotificationFrame notification) {
            handleNotification(notification);
        } else {
            log.warn("Ignoring unexpected {} frame", frame.type());
        }
    }

    private void handleNotification(NotificationFrame notification) {
        RequestHandler handler = handlers.get(notification.method());
        if (handler == null) {
            log.warn("No handler for notification {} {}", notification.method(), notification.params());
            return;
        }
        run(handler, notification.params()).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Handler for notification {} failed", notification.method(), unwrap(error));
            }
        });
    }

    private void handleRequest(RequestFrame request) {
        RequestHandler handler = handlers.get(request.method());
        if (handler == null) {
            log.warn("No handler for request {} (id {}) {}", request.method(), request.id(), request.params());
            return;
        }
        run(handler, request.params()).whenComplete((result, error) -> {
            if (error == null) {
                respond(request, ResponseFrame.success(request.id(), result));
            } else {
                Throwable cause = unwrap(error);
                log.warn("Handler for request {} (id {}) failed", request.method(), request.id(), cause);
                respond(request, ResponseFrame.failure(request.id(), describe(cause)));
            }
        });
    }

    private CompletableFuture<Object> run(RequestHandler handler, List<Object> params) {
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    Object result = handler.handle(params);
                    if (result instanceof CompletionStage<?> stage) {
                        stage.whenComplete((value, error) -> {
                            if (error != null) {
                                outcome.completeExceptionally(error);
                            } else {
                                outcome.complete(value);
                            }
                        });
                    } else {
                        outcome.complete(result);
                    }
                } catch (Exception e) {
                    outcome.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    private void respond(RequestFrame request, ResponseFrame response) {
        sink.send(response).whenComplete((v, error) -> {
            if (error == null) {
                return;
            }
            if (error instanceof NvimEncodingException && !response.isError()) {
                log.warn("Result of {} (id {}) cannot be encoded", request.method(), request.id(), error);
                respond(request, ResponseFrame.failure(request.id(), describe(error)));
            } else {
                log.warn(
                        "Failed to send response for {} (id {}): {}",
                        request.method(),
                        request.id(),
                        error.getMessage());
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    static String describe(Throwable error) {
        return ExceptionUtils.getMessage(error);
    }
}
