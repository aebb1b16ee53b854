/**
 * @file NotificationCallbackRegistry.java
 * @brief routes inbound NGSI notifications to their subscription callbacks
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
package org.fiware.ngsi.source.ngsi;

import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.ngsi.interfaces.NotificationCallback;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Notification callback registry: callback id (path segment of the notification URL) to callback
 *
 * @author Doug Anson
 */
public class NotificationCallbackRegistry extends BaseClass {
    private final ConcurrentHashMap<String, NotificationCallback> m_callbacks;

    // constructor
    public NotificationCallbackRegistry(ErrorLogger error_logger) {
        super(error_logger, null);
        this.m_callbacks = new ConcurrentHashMap<>();
    }

    // register a callback, returning its new id
    public String register(NotificationCallback callback) {
        String callback_id = UUID.randomUUID().toString();
        this.m_callbacks.put(callback_id, callback);
        return callback_id;
    }

    // remove a callback
    public boolean unregister(String callback_id) {
        if (callback_id != null) {
            return this.m_callbacks.remove(callback_id) != null;
        }
        return false;
    }

    // is the callback registered?
    public boolean contains(String callback_id) {
        return callback_id != null && this.m_callbacks.containsKey(callback_id);
    }

    // number of registered callbacks
    public int size() {
        return this.m_callbacks.size();
    }

    // dispatch a notification; false if nobody is listening on that id
    public boolean dispatch(String callback_id, String subscription_id, List<Map<String, Object>> data) {
        NotificationCallback callback = (callback_id != null) ? this.m_callbacks.get(callback_id) : null;
        if (callback == null) {
            this.errorLogger().info("NotificationCallbackRegistry: no callback for id: " + callback_id + " (ignored)");
            return false;
        }
        try {
            callback.onNotification(subscription_id, data);
        }
        catch (RuntimeException ex) {
            this.errorLogger().warning("NotificationCallbackRegistry: callback " + callback_id + " failed: " + ex.getMessage(), ex);
        }
        return true;
    }
}
