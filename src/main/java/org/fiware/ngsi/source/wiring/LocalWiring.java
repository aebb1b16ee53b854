/**
 * @file LocalWiring.java
 * @brief in-process wiring bus
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
package org.fiware.ngsi.source.wiring;

import org.fiware.ngsi.source.coordinator.processors.interfaces.GenericSender;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.json.JSONGenerator;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.wiring.interfaces.Wiring;
import org.fiware.ngsi.source.wiring.interfaces.WiringCallback;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local wiring bus: output endpoints fan out to GenericSenders, input endpoints dispatch to one handler
 *
 * @author Doug Anson
 */
public class LocalWiring extends BaseClass implements Wiring {
    private final ConcurrentHashMap<String, List<GenericSender>> m_outputs;
    private final Set<String> m_inputs;
    private final ConcurrentHashMap<String, WiringCallback> m_callbacks;
    private final CopyOnWriteArrayList<Runnable> m_status_callbacks;
    private final JSONGenerator m_json_generator;

    // constructor
    public LocalWiring(ErrorLogger error_logger, PreferenceManager preference_manager) {
        super(error_logger, preference_manager);
        this.m_outputs = new ConcurrentHashMap<>();
        this.m_inputs = ConcurrentHashMap.newKeySet();
        this.m_callbacks = new ConcurrentHashMap<>();
        this.m_status_callbacks = new CopyOnWriteArrayList<>();
        this.m_json_generator = new JSONGenerator();
    }

    // connect a consumer to an output
    public void connectOutput(String endpoint, GenericSender sender) {
        this.m_outputs.computeIfAbsent(endpoint, k -> new CopyOnWriteArrayList<>()).add(sender);
        this.errorLogger().info("Wiring: output connected: " + endpoint);
        this.statusChanged();
    }

    // disconnect every consumer of an output
    public void disconnectOutput(String endpoint) {
        if (this.m_outputs.remove(endpoint) != null) {
            this.errorLogger().info("Wiring: output disconnected: " + endpoint);
            this.statusChanged();
        }
    }

    // mark an input as connected
    public void connectInput(String endpoint) {
        if (this.m_inputs.add(endpoint)) {
            this.errorLogger().info("Wiring: input connected: " + endpoint);
            this.statusChanged();
        }
    }

    // mark an input as disconnected
    public void disconnectInput(String endpoint) {
        if (this.m_inputs.remove(endpoint)) {
            this.errorLogger().info("Wiring: input disconnected: " + endpoint);
            this.statusChanged();
        }
    }

    // deliver an event to the handler of an input; false if there is none
    public boolean deliver(String endpoint, Object data) {
        WiringCallback callback = this.m_callbacks.get(endpoint);
        if (callback == null) {
            this.errorLogger().warning("Wiring: no handler for input: " + endpoint + " (event dropped)");
            return false;
        }
        callback.onEvent(data);
        return true;
    }

    @Override
    public boolean isOutputConnected(String endpoint) {
        List<GenericSender> senders = this.m_outputs.get(endpoint);
        return senders != null && !senders.isEmpty();
    }

    @Override
    public boolean isInputConnected(String endpoint) {
        return this.m_inputs.contains(endpoint);
    }

    @Override
    public void pushEvent(String endpoint, Object data) {
        List<GenericSender> senders = this.m_outputs.get(endpoint);
        if (senders == null || senders.isEmpty()) {
            this.errorLogger().info("Wiring: output not connected: " + endpoint + " (event dropped)");
            return;
        }
        String message = this.m_json_generator.generateJson(data);
        for (GenericSender sender : new ArrayList<>(senders)) {
            sender.sendMessage(endpoint, message);
        }
    }

    @Override
    public void registerCallback(String endpoint, WiringCallback callback) {
        if (callback != null) {
            this.m_callbacks.put(endpoint, callback);
        }
        else {
            this.m_callbacks.remove(endpoint);
        }
    }

    @Override
    public void registerStatusCallback(Runnable callback) {
        if (callback != null) {
            this.m_status_callbacks.add(callback);
        }
    }

    // notify status listeners
    private void statusChanged() {
        for (Runnable callback : this.m_status_callbacks) {
            try {
                callback.run();
            }
            catch (RuntimeException ex) {
                this.errorLogger().warning("Wiring: status callback failed: " + ex.getMessage(), ex);
            }
        }
    }
}
