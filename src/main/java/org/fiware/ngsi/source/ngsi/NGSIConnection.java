/**
 * @file NGSIConnection.java
 * @brief NGSI v2 context broker connection
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

import org.fiware.ngsi.source.core.ApiResponse;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.KeyValuePair;
import org.fiware.ngsi.source.json.JSONGenerator;
import org.fiware.ngsi.source.json.JSONParser;
import org.fiware.ngsi.source.ngsi.interfaces.NotificationCallback;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.subscription.Subscription;
import org.fiware.ngsi.source.transport.HttpTransport;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * NGSI v2 connection: the subscription and entity listing calls against one context broker
 *
 * @author Doug Anson
 */
public class NGSIConnection extends BaseClass {
    public static final String SUBSCRIPTIONS_PATH = "/v2/subscriptions";
    public static final String ENTITIES_PATH = "/v2/entities";
    public static final String SKIP_INITIAL_NOTIFICATION = "skipInitialNotification";
    public static final String TOTAL_COUNT_HEADER = "Fiware-Total-Count";

    private final HttpTransport m_transport;
    private final NotificationCallbackRegistry m_registry;
    private final Executor m_io_executor;
    private final String m_server_url;
    private final String m_proxy_url;
    private final String m_notify_path;
    private final List<KeyValuePair> m_headers;
    private final JSONParser m_json_parser;
    private final JSONGenerator m_json_generator;

    // subscription id -> notification callback id
    private final ConcurrentHashMap<String, String> m_subscription_callbacks;

    // constructor
    public NGSIConnection(ErrorLogger error_logger, PreferenceManager preference_manager, HttpTransport transport, NotificationCallbackRegistry registry,
            Executor io_executor, String server_url, String proxy_url, String notify_path, List<KeyValuePair> headers) {
        super(error_logger, preference_manager);
        this.m_transport = transport;
        this.m_registry = registry;
        this.m_io_executor = io_executor;
        this.m_server_url = NGSIConnection.stripTrailingSlash(server_url);
        this.m_proxy_url = NGSIConnection.stripTrailingSlash(proxy_url);
        this.m_notify_path = (notify_path != null) ? notify_path : "";
        this.m_headers = (headers != null) ? new ArrayList<>(headers) : new ArrayList<>();
        this.m_json_parser = new JSONParser(error_logger);
        this.m_json_generator = new JSONGenerator();
        this.m_subscription_callbacks = new ConcurrentHashMap<>();
    }

    // context broker URL
    public String serverURL() {
        return this.m_server_url;
    }

    // notification proxy (public base) URL
    public String proxyURL() {
        return this.m_proxy_url;
    }

    // headers sent with every request
    public List<KeyValuePair> headers() {
        return new ArrayList<>(this.m_headers);
    }

    // unwrap the NGSI failure carried by a failed future
    public static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Create a subscription. The notification callback URL is filled in from the proxy URL.
     * @param body subscription payload (without notification.http)
     * @param callback receives the notifications
     * @param skip_initial_notification ask the broker not to send the initial notification
     * @return the created subscription (expiration not set)
     */
    public CompletableFuture<Subscription> createSubscription(Map<String, Object> body, NotificationCallback callback, boolean skip_initial_notification) {
        return CompletableFuture.supplyAsync(() -> this.doCreateSubscription(body, callback, skip_initial_notification), this.m_io_executor);
    }

    // update (PATCH) a subscription
    public CompletableFuture<Void> updateSubscription(String subscription_id, Map<String, Object> patch) {
        return CompletableFuture.runAsync(() -> {
            String url = this.m_server_url + SUBSCRIPTIONS_PATH + "/" + subscription_id;
            ApiResponse response = this.m_transport.httpPatch(url, this.m_headers, this.m_json_generator.generateJson(patch), HttpTransport.JSON_CONTENT_TYPE);
            this.checkResponse("updateSubscription", response);
        }, this.m_io_executor);
    }

    // delete a subscription and release its notification route
    public CompletableFuture<Void> deleteSubscription(String subscription_id) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
            String url = this.m_server_url + SUBSCRIPTIONS_PATH + "/" + subscription_id;
            ApiResponse response = this.m_transport.httpDelete(url, this.m_headers);
            this.checkResponse("deleteSubscription", response);
        }, this.m_io_executor);
        return future.whenComplete((result, ex) -> {
            String callback_id = this.m_subscription_callbacks.remove(subscription_id);
            this.m_registry.unregister(callback_id);
        });
    }

    // list entities (one page)
    public CompletableFuture<EntityPage> listEntities(EntityQuery query) {
        return CompletableFuture.supplyAsync(() -> {
            String url = this.m_server_url + ENTITIES_PATH + "?" + query.toQueryString();
            ApiResponse response = this.m_transport.httpGet(url, this.m_headers);
            this.checkResponse("listEntities", response);
            List<Map<String, Object>> results = this.m_json_parser.parseJsonToArray(response.getReplyData());
            if (results == null) {
                throw new CompletionException(new NGSIBrokerException("listEntities", response.getHttpCode(), "invalid entity list: " + response.getReplyData()));
            }
            int count = results.size();
            String total = response.getHeader(TOTAL_COUNT_HEADER);
            if (total != null && total.trim().length() > 0) {
                try {
                    count = Integer.parseInt(total.trim());
                }
                catch (NumberFormatException ex) {
                    this.errorLogger().warning("NGSIConnection: invalid " + TOTAL_COUNT_HEADER + " header: " + total);
                }
            }
            return new EntityPage(results, count);
        }, this.m_io_executor);
    }

    // blocking create (runs on the I/O executor)
    private Subscription doCreateSubscription(Map<String, Object> body, NotificationCallback callback, boolean skip_initial_notification) {
        // the notification proxy must be usable before anything is registered
        this.validateProxyURL();

        String callback_id = this.m_registry.register(callback);
        String callback_url = this.m_proxy_url + this.m_notify_path + "/" + callback_id;

        // complete the notification section
        LinkedHashMap<String, Object> payload = new LinkedHashMap<>(body);
        HashMap<String, Object> notification = new LinkedHashMap<>();
        Object current = body.get("notification");
        if (current instanceof Map) {
            for (Object key : ((Map<?, ?>) current).keySet()) {
                notification.put(String.valueOf(key), ((Map<?, ?>) current).get(key));
            }
        }
        HashMap<String, Object> http = new HashMap<>();
        http.put("url", callback_url);
        notification.put("http", http);
        payload.put("notification", notification);

        String url = this.m_server_url + SUBSCRIPTIONS_PATH;
        if (skip_initial_notification) {
            url += "?options=" + SKIP_INITIAL_NOTIFICATION;
        }

        ApiResponse response = this.m_transport.httpPost(url, this.m_headers, this.m_json_generator.generateJson(payload), HttpTransport.JSON_CONTENT_TYPE);
        try {
            this.checkResponse("createSubscription", response);
        }
        catch (CompletionException ex) {
            this.m_registry.unregister(callback_id);
            throw ex;
        }

        // Location: /v2/subscriptions/<id>
        String location = response.getHeader("Location");
        if (location == null || location.lastIndexOf('/') < 0 || location.endsWith("/")) {
            this.m_registry.unregister(callback_id);
            throw new CompletionException(new NGSIBrokerException("createSubscription", response.getHttpCode(), "missing subscription Location header"));
        }
        String subscription_id = location.substring(location.lastIndexOf('/') + 1);
        this.m_subscription_callbacks.put(subscription_id, callback_id);
        return new Subscription(subscription_id, callback_id, null);
    }

    // the proxy URL must be an absolute http(s) URL
    private void validateProxyURL() {
        if (this.m_proxy_url == null || this.m_proxy_url.length() == 0) {
            throw new CompletionException(new NGSIProxyConnectionException("no NGSI proxy URL configured"));
        }
        try {
            URI uri = new URI(this.m_proxy_url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new CompletionException(new NGSIProxyConnectionException("invalid NGSI proxy URL: " + this.m_proxy_url));
            }
        }
        catch (URISyntaxException ex) {
            throw new CompletionException(new NGSIProxyConnectionException("invalid NGSI proxy URL: " + this.m_proxy_url, ex));
        }
    }

    // map transport failures and non-2xx replies onto the NGSI exceptions
    private void checkResponse(String operation, ApiResponse response) {
        if (response.transportFailed()) {
            Exception ex = response.getException();
            throw new CompletionException(new NGSIConnectionException(operation + ": unable to reach the context broker: " + ex.getMessage(), ex));
        }
        if (!response.isOK()) {
            throw new CompletionException(new NGSIBrokerException(operation, response.getHttpCode(), response.getReplyData()));
        }
    }

    // remove any trailing '/'
    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
