/**
 * @file HttpTransport.java
 * @brief HTTP Transport Support
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
package org.fiware.ngsi.source.transport;

import org.fiware.ngsi.source.core.ApiResponse;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.KeyValuePair;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.util.ssl.SslContextFactory;

/**
 * HTTP Transport Support
 *
 * @author Doug Anson
 */
public class HttpTransport extends BaseClass {
    private static final int REQUEST_TIMEOUT_MS = 120000;       // 2 minutes on read/connect timeout..
    public static final String JSON_CONTENT_TYPE = "application/json";

    private final HttpClient m_http_client;
    private int m_request_timeout_ms = REQUEST_TIMEOUT_MS;
    private boolean m_started = false;

    /**
     * constructor
     * @param error_logger
     * @param preference_manager
     */
    public HttpTransport(ErrorLogger error_logger, PreferenceManager preference_manager) {
        super(error_logger, preference_manager);

        // override for the timeout value
        this.m_request_timeout_ms = this.prefIntValue("http_timeout_ms");
        if (this.m_request_timeout_ms <= 0) {
            this.m_request_timeout_ms = REQUEST_TIMEOUT_MS;
        }

        // TLS: trust-all only when explicitly asked for
        SslContextFactory.Client ssl = new SslContextFactory.Client(this.prefBoolValue("http_trust_all"));
        this.m_http_client = new HttpClient(ssl);
        this.m_http_client.setFollowRedirects(false);
        this.m_http_client.setConnectTimeout(this.m_request_timeout_ms);
    }

    // manually set a specific timeout in ms
    public void setConnectionTimeout(int timeout_ms) {
        this.m_request_timeout_ms = timeout_ms;
    }

    // start the underlying client
    public synchronized boolean start() {
        if (!this.m_started) {
            try {
                this.m_http_client.start();
                this.m_started = true;
            }
            catch (Exception ex) {
                this.errorLogger().critical("HTTP: ERROR! Unable to start HTTP client: " + ex.getMessage(), ex);
            }
        }
        return this.m_started;
    }

    // stop the underlying client
    public synchronized void stop() {
        if (this.m_started) {
            try {
                this.m_http_client.stop();
            }
            catch (Exception ex) {
                this.errorLogger().warning("HTTP: Exception while stopping HTTP client: " + ex.getMessage(), ex);
            }
            this.m_started = false;
        }
    }

    // HTTP GET
    public ApiResponse httpGet(String url, List<KeyValuePair> headers) {
        return this.doHTTP(HttpMethod.GET, url, headers, null, null);
    }

    // HTTP POST
    public ApiResponse httpPost(String url, List<KeyValuePair> headers, String data, String content_type) {
        return this.doHTTP(HttpMethod.POST, url, headers, data, content_type);
    }

    // HTTP PATCH
    public ApiResponse httpPatch(String url, List<KeyValuePair> headers, String data, String content_type) {
        return this.doHTTP(HttpMethod.PATCH, url, headers, data, content_type);
    }

    // HTTP DELETE
    public ApiResponse httpDelete(String url, List<KeyValuePair> headers) {
        return this.doHTTP(HttpMethod.DELETE, url, headers, null, null);
    }

    // perform the HTTP operation (blocking)
    private ApiResponse doHTTP(HttpMethod verb, String url, List<KeyValuePair> headers, String data, String content_type) {
        ApiResponse response = new ApiResponse(verb.asString(), url, data, content_type);

        // lazy start
        if (!this.start()) {
            response.setException(new IllegalStateException("HTTP client not started"));
            return response;
        }

        try {
            Request request = this.m_http_client.newRequest(url)
                    .method(verb)
                    .timeout(this.m_request_timeout_ms, TimeUnit.MILLISECONDS)
                    .header("Accept", JSON_CONTENT_TYPE);

            // additional headers
            if (headers != null) {
                for (KeyValuePair kvp : headers) {
                    if (kvp.key() != null && kvp.value() != null) {
                        request.header(kvp.key(), kvp.value());
                    }
                }
            }

            // body
            if (data != null) {
                String type = (content_type != null) ? content_type : JSON_CONTENT_TYPE;
                request.content(new StringContentProvider(type, data, StandardCharsets.UTF_8));
            }

            // DEBUG
            if (response.getRequestData() != null) {
                this.errorLogger().info("HTTP: " + response.getRequestVerb() + " URL: " + response.getRequestURL() + " CONTENT_TYPE: " + response.getContentType() + " DATA: " + response.getRequestData());
            }
            else {
                this.errorLogger().info("HTTP: " + response.getRequestVerb() + " URL: " + response.getRequestURL());
            }

            ContentResponse reply = request.send();
            response.setHttpCode(reply.getStatus());
            response.setReplyData(reply.getContentAsString());
            for (HttpField field : reply.getHeaders()) {
                response.setHeader(field.getName(), field.getValue());
            }

            // DEBUG
            this.errorLogger().info("HTTP: " + verb.asString() + " URL: " + url + " CODE: " + reply.getStatus());
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            this.errorLogger().warning("HTTP: " + verb.asString() + " interrupted: " + url);
            response.setException(ex);
        }
        catch (TimeoutException | ExecutionException ex) {
            this.errorLogger().warning("HTTP: " + verb.asString() + " failed: " + url + " Exception: " + ex.getMessage());
            response.setException(ex);
        }
        catch (RuntimeException ex) {
            // malformed URLs and the like
            this.errorLogger().warning("HTTP: " + verb.asString() + " rejected: " + url + " Exception: " + ex.getMessage());
            response.setException(ex);
        }
        return response;
    }
}
