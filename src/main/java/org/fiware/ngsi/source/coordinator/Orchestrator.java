/**
 * @file Orchestrator.java
 * @brief NGSI source orchestrator: subscription lifecycle and initial snapshot coordination
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

import org.fiware.ngsi.source.coordinator.processors.core.EntityFormatTranslator;
import org.fiware.ngsi.source.coordinator.processors.core.MetadataProcessor;
import org.fiware.ngsi.source.coordinator.processors.core.PaginatedQueryProcessor;
import org.fiware.ngsi.source.coordinator.processors.core.QueryTask;
import org.fiware.ngsi.source.coordinator.processors.interfaces.ConnectionCreator;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.ngsi.NGSIConnection;
import org.fiware.ngsi.source.ngsi.NGSIProxyConnectionException;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.preferences.interfaces.PreferenceListener;
import org.fiware.ngsi.source.subscription.Subscription;
import org.fiware.ngsi.source.subscription.SubscriptionRefresherThread;
import org.fiware.ngsi.source.subscription.interfaces.SubscriptionManager;
import org.fiware.ngsi.source.subscription.interfaces.SubscriptionRefresherResponder;
import org.fiware.ngsi.source.subscription.managers.NGSISubscriptionManager;
import org.fiware.ngsi.source.wiring.interfaces.Wiring;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Orchestrator: owns the source state. Every state change runs on the single threaded event loop.
 *
 * @author Doug Anson
 */
public class Orchestrator extends BaseClass implements PreferenceListener, SubscriptionRefresherResponder {
    // wiring endpoints
    public static final String ENTITY_OUTPUT = "entityOutput";
    public static final String NORMALIZED_OUTPUT = "normalizedOutput";
    public static final String METADATA_OUTPUT = "ngsimetadata";
    public static final String METADATA_INPUT = "ngsimetadataInput";

    // NGSI attribute formats
    public static final String FORMAT_NORMALIZED = "normalized";
    public static final String FORMAT_KEY_VALUES = "keyValues";

    private final Wiring m_wiring;
    private final ConnectionCreator m_connection_creator;
    private final SubscriptionManager m_subscription_manager;
    private final PaginatedQueryProcessor m_query_processor;
    private final MetadataProcessor m_metadata_processor;
    private final Executor m_event_loop;
    private final SourceState m_state;
    private long m_refresh_interval_ms = SubscriptionRefresherThread.DEFAULT_REFRESH_INTERVAL_MS;

    // constructor
    public Orchestrator(ErrorLogger error_logger, PreferenceManager preference_manager, Wiring wiring, ConnectionCreator connection_creator, Executor event_loop) {
        this(error_logger, preference_manager, wiring, connection_creator, new NGSISubscriptionManager(error_logger, preference_manager), event_loop);
    }

    // constructor with an explicit subscription manager
    public Orchestrator(ErrorLogger error_logger, PreferenceManager preference_manager, Wiring wiring, ConnectionCreator connection_creator,
            SubscriptionManager subscription_manager, Executor event_loop) {
        super(error_logger, preference_manager);
        this.m_wiring = wiring;
        this.m_connection_creator = connection_creator;
        this.m_subscription_manager = subscription_manager;
        this.m_event_loop = event_loop;
        this.m_query_processor = new PaginatedQueryProcessor(error_logger, preference_manager, event_loop);
        this.m_metadata_processor = new MetadataProcessor(error_logger, preference_manager);
        this.m_state = new SourceState();

        // renewal interval override
        long interval = this.prefLongValue("ngsi_subscription_refresh_interval_ms");
        if (interval > 0) {
            this.m_refresh_interval_ms = interval;
        }
    }

    // coordinator state (read only outside of the event loop)
    public SourceState state() {
        return this.m_state;
    }

    /**
     * activate: register our callbacks and subscribe unless metadata is expected first
     */
    public void init() {
        this.post(() -> {
            this.preferences().registerCallback(this);
            this.m_wiring.registerStatusCallback(() -> this.post(this::wiringStatusChanged));
            if (!this.m_wiring.isInputConnected(METADATA_INPUT)) {
                this.doInitialSubscription();

                // initial metadata
                this.sendMetadata();
            }
            this.m_wiring.registerCallback(METADATA_INPUT, data -> this.post(() -> this.handleMetadataInput(data)));
        });
    }

    /**
     * shutdown: cancel everything and delete the current subscription
     * @return completes once the subscription deletion settled
     */
    public CompletableFuture<Void> shutdown() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean posted = this.post(() -> {
            if (this.m_state.isShutDown()) {
                done.complete(null);
                return;
            }
            this.m_state.setLifecycle(SourceLifecycle.TEARING_DOWN);
            this.m_state.nextGeneration();
            this.m_state.setShutDown();
            this.preferences().unregisterCallback(this);
            this.stopRefresher();
            this.cancelQuery();

            Subscription subscription = this.m_state.subscription();
            NGSIConnection connection = this.m_state.connection();
            this.m_state.setSubscription(null);
            CompletableFuture<Void> deletion = CompletableFuture.completedFuture(null);
            if (subscription != null) {
                deletion = this.m_subscription_manager.deleteSubscription(connection, subscription).handle((v, ex) -> {
                    if (ex == null) {
                        this.errorLogger().info("Subscription cancelled successfully");
                    }
                    else {
                        this.errorLogger().critical("Error cancelling current context broker subscription", NGSIConnection.unwrap(ex));
                    }
                    return null;
                });
            }

            // creations still in flight release their subscription before we are done
            List<CompletableFuture<Void>> creations = this.m_state.pendingCreations();
            creations.add(deletion);
            CompletableFuture.allOf(creations.toArray(new CompletableFuture<?>[0])).whenComplete((v, ex) -> {
                this.m_state.setLifecycle(SourceLifecycle.UNCONFIGURED);
                done.complete(null);
            });
        });
        if (!posted) {
            done.complete(null);
        }
        return done;
    }

    // PreferenceListener
    @Override
    public void preferencesChanged(Map<String, String> changes) {
        this.post(this::reconfigure);
    }

    // SubscriptionRefresherResponder: renewal tick (refresher thread)
    @Override
    public void refreshSubscription() {
        this.post(() -> {
            Subscription subscription = this.m_state.subscription();
            NGSIConnection connection = this.m_state.connection();
            if (subscription == null || connection == null || this.m_state.isShutDown()) {
                return;
            }
            this.m_subscription_manager.renewSubscription(connection, subscription).whenComplete((expires, ex) -> {
                if (ex == null) {
                    this.errorLogger().info("Subscription refreshed successfully");
                }
                else {
                    this.errorLogger().critical("Error refreshing current context broker subscription", NGSIConnection.unwrap(ex));
                }
            });
        });
    }

    // format requested from the broker: normalized only when someone consumes it
    public String negotiateFormat() {
        if (this.m_wiring.isOutputConnected(NORMALIZED_OUTPUT)) {
            return FORMAT_NORMALIZED;
        }
        return FORMAT_KEY_VALUES;
    }

    // route received entities to the connected outputs
    public void handleReceivedEntities(String format, List<Map<String, Object>> entities) {
        if (this.m_wiring.isOutputConnected(ENTITY_OUTPUT) && FORMAT_KEY_VALUES.equals(format)) {
            this.m_wiring.pushEvent(ENTITY_OUTPUT, entities);
        }
        else if (this.m_wiring.isOutputConnected(ENTITY_OUTPUT)) {
            this.m_wiring.pushEvent(ENTITY_OUTPUT, EntityFormatTranslator.toKeyValues(entities));
        }
        if (this.m_wiring.isOutputConnected(NORMALIZED_OUTPUT) && FORMAT_NORMALIZED.equals(format)) {
            this.m_wiring.pushEvent(NORMALIZED_OUTPUT, entities);
        }
    }

    // a wiring connection changed
    private void wiringStatusChanged() {
        if (!this.m_state.isShutDown() && this.m_state.connection() == null) {
            this.doInitialSubscription();
        }
    }

    // preferences changed: tear down the current cycle and start a new one
    private void reconfigure() {
        if (this.m_state.isShutDown()) {
            return;
        }
        this.m_state.setLifecycle(SourceLifecycle.RECONFIGURING);
        this.sendMetadata();
        this.stopRefresher();
        this.cancelQuery();

        // delete the old subscription without waiting for the outcome
        Subscription subscription = this.m_state.subscription();
        NGSIConnection connection = this.m_state.connection();
        this.m_state.setSubscription(null);
        if (subscription != null) {
            this.m_subscription_manager.deleteSubscription(connection, subscription).whenComplete((v, ex) -> {
                if (ex == null) {
                    this.errorLogger().info("Old subscription has been cancelled successfully");
                }
                else {
                    this.errorLogger().warning("Error cancelling old subscription", NGSIConnection.unwrap(ex));
                }
            });
        }
        this.doInitialSubscription();
    }

    // start a new cycle with the current preferences
    private void doInitialSubscription() {
        long generation = this.m_state.nextGeneration();
        this.m_state.setSubscription(null);
        this.m_state.setConnection(null);

        // nobody to feed
        if (!this.m_wiring.isOutputConnected(ENTITY_OUTPUT) && !this.m_wiring.isOutputConnected(NORMALIZED_OUTPUT)) {
            this.errorLogger().info("Orchestrator: no entity output connected, waiting for wiring changes");
            this.m_state.setLifecycle(SourceLifecycle.UNCONFIGURED);
            return;
        }

        SourceConfiguration configuration = SourceConfiguration.fromPreferences(this.preferences());
        NGSIConnection connection = this.m_connection_creator.createConnection(configuration);
        this.m_state.setConfiguration(configuration);
        this.m_state.setConnection(connection);
        this.m_state.setLifecycle(SourceLifecycle.SUBSCRIBING);

        String format = this.negotiateFormat();
        if (!configuration.wantsSubscription()) {
            // no update attributes: initial values only
            this.doInitialQueries(connection, configuration, format, generation);
            this.m_state.setLifecycle(SourceLifecycle.ACTIVE);
            return;
        }

        CompletableFuture<Void> settled = new CompletableFuture<>();
        this.m_state.addPendingCreation(settled);
        this.m_subscription_manager.createSubscription(connection, configuration, format, (subscription_id, data) -> this.post(() -> {
            if (this.m_state.isCurrent(generation)) {
                this.handleReceivedEntities(format, data);
            }
        })).whenComplete((subscription, ex) -> {
            boolean posted = this.post(() -> this.onSubscriptionCreated(generation, connection, configuration, format, subscription, ex, settled));
            if (!posted) {
                // event loop gone: release a late subscription from here
                this.releaseSubscription(connection, (ex == null) ? subscription : null, settled);
            }
        });
    }

    // subscription creation settled
    private void onSubscriptionCreated(long generation, NGSIConnection connection, SourceConfiguration configuration, String format, Subscription subscription,
            Throwable ex, CompletableFuture<Void> settled) {
        if (ex != null) {
            settled.complete(null);
            if (!this.m_state.isCurrent(generation)) {
                return;
            }
            Throwable cause = NGSIConnection.unwrap(ex);
            if (cause instanceof NGSIProxyConnectionException) {
                this.errorLogger().critical("Error connecting with the NGSI Proxy: " + cause.getMessage());
            }
            else {
                this.errorLogger().critical("Error creating subscription in the context broker server: " + cause.getMessage());
            }
            this.m_state.setLifecycle(SourceLifecycle.UNCONFIGURED);
            return;
        }

        // superseded while in flight: never becomes current
        if (!this.m_state.isCurrent(generation)) {
            this.releaseSubscription(connection, subscription, settled);
            return;
        }

        this.errorLogger().info("Subscription created successfully (id: " + subscription.id() + ")");
        this.m_state.setSubscription(subscription);
        settled.complete(null);

        // periodic renewal
        SubscriptionRefresherThread refresher = new SubscriptionRefresherThread(this, this.m_refresh_interval_ms);
        this.m_state.setRefresher(refresher);
        refresher.startRefreshing();

        this.doInitialQueries(connection, configuration, format, generation);
        this.m_state.setLifecycle(SourceLifecycle.ACTIVE);
    }

    // delete a subscription that arrived after its cycle ended; settled completes once the deletion did
    private void releaseSubscription(NGSIConnection connection, Subscription subscription, CompletableFuture<Void> settled) {
        if (subscription == null) {
            settled.complete(null);
            return;
        }
        this.errorLogger().info("Orchestrator: deleting superseded subscription (id: " + subscription.id() + ")");
        try {
            this.m_subscription_manager.deleteSubscription(connection, subscription).whenComplete((v, ex) -> {
                if (ex != null) {
                    this.errorLogger().warning("Error cancelling old subscription", NGSIConnection.unwrap(ex));
                }
                settled.complete(null);
            });
        }
        catch (RuntimeException ex) {
            this.errorLogger().warning("Error cancelling old subscription", ex);
            settled.complete(null);
        }
    }

    // paginated snapshot of the current values
    private void doInitialQueries(NGSIConnection connection, SourceConfiguration configuration, String format, long generation) {
        QueryTask task = this.m_query_processor.start(connection, configuration, format, (batch_format, entities) -> {
            if (this.m_state.isCurrent(generation)) {
                this.handleReceivedEntities(batch_format, entities);
            }
        });
        this.m_state.setQueryTask(task);
    }

    // metadata import
    private void handleMetadataInput(Object data) {
        if (this.m_state.isShutDown()) {
            return;
        }
        if (data == null) {
            // clear the consumers
            if (this.m_wiring.isOutputConnected(ENTITY_OUTPUT)) {
                this.m_wiring.pushEvent(ENTITY_OUTPUT, null);
            }
            if (this.m_wiring.isOutputConnected(NORMALIZED_OUTPUT)) {
                this.m_wiring.pushEvent(NORMALIZED_OUTPUT, null);
            }
            return;
        }
        if (!(data instanceof Map)) {
            this.errorLogger().warning("Orchestrator: ignoring metadata that is not a JSON object: " + data);
            return;
        }
        HashMap<String, Object> metadata = new HashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
            metadata.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        this.m_metadata_processor.importMetadata(metadata);
        this.reconfigure();
    }

    // export metadata (only if someone listens)
    private void sendMetadata() {
        if (this.m_wiring.isOutputConnected(METADATA_OUTPUT)) {
            this.m_wiring.pushEvent(METADATA_OUTPUT, this.m_metadata_processor.exportMetadata());
        }
    }

    // halt the renewal thread
    private void stopRefresher() {
        SubscriptionRefresherThread refresher = this.m_state.refresher();
        if (refresher != null) {
            refresher.haltThread();
            this.m_state.setRefresher(null);
        }
    }

    // cancel the in-flight query
    private void cancelQuery() {
        QueryTask task = this.m_state.queryTask();
        if (task != null) {
            task.cancel();
            this.m_state.setQueryTask(null);
        }
    }

    // run on the event loop; false if the loop no longer accepts work
    private boolean post(Runnable event) {
        try {
            this.m_event_loop.execute(() -> {
                try {
                    event.run();
                }
                catch (RuntimeException ex) {
                    this.errorLogger().critical("Orchestrator: event processing failed: " + ex.getMessage(), ex);
                }
            });
            return true;
        }
        catch (RejectedExecutionException ex) {
            this.errorLogger().warning("Orchestrator: event loop stopped, event dropped");
            return false;
        }
    }
}
