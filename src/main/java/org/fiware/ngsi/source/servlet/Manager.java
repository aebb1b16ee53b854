/**
 * @file Manager.java
 * @brief primary servlet manager for ngsi-source-bridge
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
package org.fiware.ngsi.source.servlet;

import org.fiware.ngsi.source.coordinator.Orchestrator;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.Utils;
import org.fiware.ngsi.source.json.JSONParser;
import org.fiware.ngsi.source.ngsi.NGSIConnectionFactory;
import org.fiware.ngsi.source.ngsi.NotificationCallbackRegistry;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.transport.HttpTransport;
import org.fiware.ngsi.source.wiring.HttpPeerSender;
import org.fiware.ngsi.source.wiring.LocalWiring;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Primary Servlet Manager for ngsi-source-bridge
 *
 * @author Doug Anson
 */
public final class Manager {
    public static final String LOG_TAG = "NGSI-Source-Bridge";          // Log Tag
    public static final String BRIDGE_VERSION_STR = "1.0.0";            // our version

    // routes (relative to the events path)
    public static final String DEFAULT_EVENTS_PATH = "/events";
    public static final String NOTIFY_ROUTE = "/notify";
    public static final String METADATA_ROUTE = "/metadata";
    public static final String PREFERENCES_ROUTE = "/preferences";

    // metadata input is fed through the events path when enabled
    public static final String METADATA_INPUT_CONNECTED_PREF = "ngsimetadataInput_connected";

    private static volatile Manager m_manager = null;

    private final ErrorLogger m_error_logger;
    private final PreferenceManager m_preference_manager;
    private final NotificationCallbackRegistry m_registry;
    private final LocalWiring m_wiring;
    private final Orchestrator m_orchestrator;
    private final JSONParser m_json_parser;
    private HttpTransport m_transport = null;
    private HttpPeerSender m_peer_sender = null;
    private ExecutorService m_event_loop = null;
    private ExecutorService m_io_executor = null;

    // instance factory
    public static synchronized Manager getInstance(ErrorLogger error_logger, PreferenceManager preferences) {
        if (Manager.m_manager == null) {
            Manager.m_manager = new Manager(error_logger, preferences);
        }
        return Manager.m_manager;
    }

    // default constructor: builds the full component graph
    public Manager(ErrorLogger error_logger, PreferenceManager preferences) {
        this.m_error_logger = error_logger;
        this.m_preference_manager = preferences;
        this.m_json_parser = new JSONParser(error_logger);

        // announce our self
        this.errorLogger().info(LOG_TAG + ": Date: " + Utils.dateToString(Utils.now()) + ". Bridge version: v" + BRIDGE_VERSION_STR);

        // executors: one event loop for the coordinator state, a pool for blocking I/O
        this.m_event_loop = Executors.newSingleThreadExecutor(Manager.namedThreads("ngsi-source-event-loop"));
        this.m_io_executor = Executors.newCachedThreadPool(Manager.namedThreads("ngsi-source-io"));

        // components
        this.m_transport = new HttpTransport(error_logger, preferences);
        this.m_registry = new NotificationCallbackRegistry(error_logger);
        this.m_wiring = new LocalWiring(error_logger, preferences);
        this.m_peer_sender = new HttpPeerSender(error_logger, preferences, this.m_transport, this.m_io_executor);
        NGSIConnectionFactory factory = new NGSIConnectionFactory(error_logger, preferences, this.m_transport, this.m_registry, this.m_io_executor, this.notifyPath());
        this.m_orchestrator = new Orchestrator(error_logger, preferences, this.m_wiring, factory, this.m_event_loop);
    }

    // constructor with supplied components
    public Manager(ErrorLogger error_logger, PreferenceManager preferences, NotificationCallbackRegistry registry, LocalWiring wiring, Orchestrator orchestrator) {
        this.m_error_logger = error_logger;
        this.m_preference_manager = preferences;
        this.m_json_parser = new JSONParser(error_logger);
        this.m_registry = registry;
        this.m_wiring = wiring;
        this.m_orchestrator = orchestrator;
    }

    // events servlet path
    public String eventsPath() {
        String path = this.m_preference_manager.valueOf("events_path");
        if (path == null || path.trim().length() == 0) {
            return DEFAULT_EVENTS_PATH;
        }
        path = path.trim();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    // servlet context path ("" for the root context)
    public String contextPath() {
        String path = this.m_preference_manager.valueOf("context_path");
        if (path == null) {
            return "";
        }
        path = path.trim();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.length() > 0 && !path.startsWith("/")) {
            path = "/" + path;
        }
        return path;
    }

    // notification path as seen from outside (callback URLs are <proxy><notify path>/<callback id>)
    public String notifyPath() {
        return this.contextPath() + this.eventsPath() + NOTIFY_ROUTE;
    }

    public Orchestrator orchestrator() {
        return this.m_orchestrator;
    }

    public LocalWiring wiring() {
        return this.m_wiring;
    }

    public NotificationCallbackRegistry registry() {
        return this.m_registry;
    }

    // start: connect the configured wiring peers and activate the orchestrator
    public void start() {
        if (this.m_transport != null) {
            this.m_transport.start();
        }
        if (this.m_peer_sender != null) {
            String[] outputs = {Orchestrator.ENTITY_OUTPUT, Orchestrator.NORMALIZED_OUTPUT, Orchestrator.METADATA_OUTPUT};
            for (String output : outputs) {
                if (this.m_peer_sender.peerURL(output) != null) {
                    this.m_wiring.connectOutput(output, this.m_peer_sender);
                }
            }
        }
        if (this.m_preference_manager.booleanValueOf(METADATA_INPUT_CONNECTED_PREF)) {
            this.m_wiring.connectInput(Orchestrator.METADATA_INPUT);
        }
        this.m_orchestrator.init();
    }

    // shutdown: tear the orchestrator down, then release the transport and executors
    public CompletableFuture<Void> shutdown() {
        return this.m_orchestrator.shutdown().whenComplete((v, ex) -> {
            if (this.m_transport != null) {
                this.m_transport.stop();
            }
            if (this.m_event_loop != null) {
                this.m_event_loop.shutdown();
            }
            if (this.m_io_executor != null) {
                this.m_io_executor.shutdown();
            }
        });
    }

    // process an inbound event
    public void processEvent(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String path = request.getPathInfo();
        if (path == null) {
            path = "";
        }
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            this.errorLogger().info("Manager: unsupported method: " + request.getMethod() + " on: " + path);
            this.sendResponse(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED);
            return;
        }

        String body = this.readBody(request);
        if (path.startsWith(NOTIFY_ROUTE + "/")) {
            this.processNotification(path.substring(NOTIFY_ROUTE.length() + 1), body);
        }
        else if (path.equals(METADATA_ROUTE)) {
            this.processMetadata(body);
        }
        else if (path.equals(PREFERENCES_ROUTE)) {
            this.processPreferences(body);
        }
        else {
            this.errorLogger().info("Manager: unknown event path: " + path);
            this.sendResponse(response, HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        this.sendResponse(response, HttpServletResponse.SC_OK);
    }

    // NGSI v2 notification: {subscriptionId, data: [...]}
    private void processNotification(String callback_id, String body) {
        Map<String, Object> notification = this.m_json_parser.parseJson(body);
        if (notification == null) {
            this.errorLogger().warning("Manager: ignoring malformed notification for: " + callback_id);
            return;
        }
        Object subscription_id = notification.get("subscriptionId");
        List<Map<String, Object>> entities = new ArrayList<>();
        Object data = notification.get("data");
        if (data instanceof List) {
            for (Object item : (List<?>) data) {
                if (item instanceof Map) {
                    HashMap<String, Object> entity = new HashMap<>();
                    for (Map.Entry<?, ?> entry : ((Map<?, ?>) item).entrySet()) {
                        entity.put(String.valueOf(entry.getKey()), entry.getValue());
                    }
                    entities.add(entity);
                }
            }
        }
        this.m_registry.dispatch(callback_id, (subscription_id != null) ? subscription_id.toString() : null, entities);
    }

    // metadata import ("null" clears the consumers)
    private void processMetadata(String body) {
        String trimmed = Utils.trim(body);
        Object metadata = null;
        if (!trimmed.equals("null")) {
            metadata = this.m_json_parser.parseJsonValue(trimmed);
            if (metadata == null) {
                this.errorLogger().warning("Manager: ignoring malformed metadata: " + trimmed);
                return;
            }
        }
        this.m_wiring.deliver(Orchestrator.METADATA_INPUT, metadata);
    }

    // runtime preference updates: {key: value, ...}
    private void processPreferences(String body) {
        Map<String, Object> values = this.m_json_parser.parseJson(body);
        if (values == null) {
            this.errorLogger().warning("Manager: ignoring malformed preference update");
            return;
        }
        HashMap<String, String> updates = new HashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            updates.put(entry.getKey(), (entry.getValue() != null) ? entry.getValue().toString() : null);
        }
        this.m_preference_manager.update(updates);
    }

    // read the request body
    private String readBody(HttpServletRequest request) throws IOException {
        StringBuilder sb = new StringBuilder();
        BufferedReader reader = request.getReader();
        if (reader != null) {
            String line = reader.readLine();
            while (line != null) {
                sb.append(line).append('\n');
                line = reader.readLine();
            }
        }
        return sb.toString();
    }

    // send the (empty JSON) response
    private void sendResponse(HttpServletResponse response, int status) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json;charset=utf-8");
        response.setHeader("Pragma", "no-cache");
        PrintWriter out = response.getWriter();
        out.print("{}");
        out.flush();
    }

    // named daemon threads
    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger count = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // error logger
    private ErrorLogger errorLogger() {
        return this.m_error_logger;
    }
}
