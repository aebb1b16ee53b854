/**
 * @file QueryTask.java
 * @brief in-flight paginated query
 * @author Doug Anson
 * @version 1.0
 * @see
 *
 * Copyright 2015. ARM Ltd. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package org.fiware.ngsi.source.coordinator.processors.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-flight paginated query: cancellable, counts its page requests and holds the buffered entities
 *
 * @author Doug Anson
 */
public class QueryTask {
    private volatile boolean m_cancelled = false;
    private final boolean m_buffering;
    private final String m_format;
    private final ArrayList<Map<String, Object>> m_buffer;
    private final AtomicInteger m_pages_requested;
    private final CompletableFuture<Void> m_completion;

    // constructor
    public QueryTask(String format, boolean buffering) {
        this.m_format = format;
        this.m_buffering = buffering;
        this.m_buffer = new ArrayList<>();
        this.m_pages_requested = new AtomicInteger(0);
        this.m_completion = new CompletableFuture<>();
    }

    // stop requesting pages and emitting results
    public void cancel() {
        this.m_cancelled = true;
        synchronized (this.m_buffer) {
            this.m_buffer.clear();
        }
        this.m_completion.complete(null);
    }

    public boolean isCancelled() {
        return this.m_cancelled;
    }

    public boolean isBuffering() {
        return this.m_buffering;
    }

    public String format() {
        return this.m_format;
    }

    // number of page requests issued so far
    public int pagesRequested() {
        return this.m_pages_requested.get();
    }

    // completes when the query finished, failed or was cancelled
    public CompletableFuture<Void> completion() {
        return this.m_completion;
    }

    public boolean isDone() {
        return this.m_completion.isDone();
    }

    // a page request is about to be issued
    void pageRequested() {
        this.m_pages_requested.incrementAndGet();
    }

    // accumulate a page
    void buffer(List<Map<String, Object>> entities) {
        synchronized (this.m_buffer) {
            this.m_buffer.addAll(entities);
        }
    }

    // take everything buffered so far
    List<Map<String, Object>> drainBuffer() {
        synchronized (this.m_buffer) {
            ArrayList<Map<String, Object>> drained = new ArrayList<>(this.m_buffer);
            this.m_buffer.clear();
            return drained;
        }
    }

    // finished normally
    void finished() {
        this.m_completion.complete(null);
    }

    // failed
    void failed(Throwable cause) {
        synchronized (this.m_buffer) {
            this.m_buffer.clear();
        }
        this.m_completion.completeExceptionally(cause);
    }
}
