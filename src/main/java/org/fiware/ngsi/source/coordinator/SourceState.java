/**
 * @file SourceState.java
 * @brief NGSI source coordinator state
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
package org.fiware.ngsi.source.coordinator;

import org.fiware.ngsi.source.coordinator.processors.core.QueryTask;
import org.fiware.ngsi.source.ngsi.NGSIConnection;
import org.fiware.ngsi.source.subscription.Subscription;
import org.fiware.ngsi.source.subscription.SubscriptionRefresherThread;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordinator state. Only mutated from the orchestrator's event loop, except the set of pending creations.
 *
 * @author Doug Anson
 */
public class SourceState {
    private volatile SourceLifecycle m_lifecycle = SourceLifecycle.UNCONFIGURED;
    private volatile SourceConfiguration m_configuration = null;
    private volatile NGSIConnection m_connection = null;
    private volatile Subscription m_subscription = null;
    private volatile SubscriptionRefresherThread m_refresher = null;
    private volatile QueryTask m_query_task = null;
    private volatile long m_generation = 0;
    private volatile boolean m_shut_down = false;

    // subscription creations whose outcome has not been settled yet
    private final Set<CompletableFuture<Void>> m_pending_creations = ConcurrentHashMap.newKeySet();

    // default constructor
    public SourceState() {
    }

    public SourceLifecycle lifecycle() {
        return this.m_lifecycle;
    }

    public SourceConfiguration configuration() {
        return this.m_configuration;
    }

    public NGSIConnection connection() {
        return this.m_connection;
    }

    public Subscription subscription() {
        return this.m_subscription;
    }

    public SubscriptionRefresherThread refresher() {
        return this.m_refresher;
    }

    public QueryTask queryTask() {
        return this.m_query_task;
    }

    // current cycle generation
    public long generation() {
        return this.m_generation;
    }

    public boolean isShutDown() {
        return this.m_shut_down;
    }

    // creations still in flight (or whose late result is still being released)
    public List<CompletableFuture<Void>> pendingCreations() {
        return new ArrayList<>(this.m_pending_creations);
    }

    void setLifecycle(SourceLifecycle lifecycle) {
        this.m_lifecycle = lifecycle;
    }

    void setConfiguration(SourceConfiguration configuration) {
        this.m_configuration = configuration;
    }

    void setConnection(NGSIConnection connection) {
        this.m_connection = connection;
    }

    void setSubscription(Subscription subscription) {
        this.m_subscription = subscription;
    }

    void setRefresher(SubscriptionRefresherThread refresher) {
        this.m_refresher = refresher;
    }

    void setQueryTask(QueryTask query_task) {
        this.m_query_task = query_task;
    }

    // track a creation until its outcome is settled
    void addPendingCreation(CompletableFuture<Void> settled) {
        this.m_pending_creations.add(settled);
        settled.whenComplete((v, ex) -> this.m_pending_creations.remove(settled));
    }

    void setShutDown() {
        this.m_shut_down = true;
    }

    // start a new cycle, invalidating the continuations of the previous one
    long nextGeneration() {
        this.m_generation = this.m_generation + 1;
        return this.m_generation;
    }

    // is the given cycle still the current one?
    boolean isCurrent(long generation) {
        return !this.m_shut_down && this.m_generation == generation;
    }
}
