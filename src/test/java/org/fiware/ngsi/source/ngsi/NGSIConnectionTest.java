/**
 * @file NGSIConnectionTest.java
 * @brief NGSI connection tests against an embedded fake broker
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.KeyValuePair;
import org.fiware.ngsi.source.json.JSONParser;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.subscription.Subscription;
import org.fiware.ngsi.source.transport.HttpTransport;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NGSIConnectionTest {
    private Server server;
    private FakeBroker broker;
    private String brokerURL;
    private ErrorLogger logger;
    private PreferenceManager preferences;
    private HttpTransport transport;
    private NotificationCallbackRegistry registry;
    private ExecutorService executor;

    // a recorded request
    private static class Recorded {
        String method;
        String path;
        String query;
        String body;
        Map<String, String> headers = new HashMap<>();
        Map<String, String> parameters = new HashMap<>();
    }

    // minimal context broker: records requests and answers with the configured reply
    private static class FakeBroker extends HttpServlet {
        private static final long serialVersionUID = 1L;
        final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());
        volatile int status = 200;
        volatile String reply = "";
        final Map<String, String> replyHeaders = new HashMap<>();

        @Override
        protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException {
            Recorded recorded = new Recorded();
            recorded.method = request.getMethod();
            recorded.path = request.getRequestURI();
            recorded.query = request.getQueryString();
            for (String name : Collections.list(request.getHeaderNames())) {
                recorded.headers.put(name.toLowerCase(), request.getHeader(name));
            }
            for (String name : Collections.list(request.getParameterNames())) {
                recorded.parameters.put(name, request.getParameter(name));
            }
            StringBuilder sb = new StringBuilder();
            BufferedReader reader = request.getReader();
            String line = reader.readLine();
            while (line != null) {
                sb.append(line);
                line = reader.readLine();
            }
            recorded.body = sb.toString();
            this.requests.add(recorded);

            response.setStatus(this.status);
            for (Map.Entry<String, String> header : this.replyHeaders.entrySet()) {
                response.setHeader(header.getKey(), header.getValue());
            }
            response.setContentType("application/json");
            response.getWriter().print(this.reply);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        this.broker = new FakeBroker();
        this.server = new Server();
        ServerConnector connector = new ServerConnector(this.server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        this.server.addConnector(connector);
        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(this.broker), "/*");
        this.server.setHandler(context);
        this.server.start();
        this.brokerURL = "http://127.0.0.1:" + connector.getLocalPort();

        this.logger = new ErrorLogger();
        Properties properties = new Properties();
        properties.setProperty("http_timeout_ms", "5000");
        this.preferences = new PreferenceManager(this.logger, "test", properties);
        this.transport = new HttpTransport(this.logger, this.preferences);
        this.transport.start();
        this.registry = new NotificationCallbackRegistry(this.logger);
        this.executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws Exception {
        this.transport.stop();
        this.executor.shutdownNow();
        this.server.stop();
    }

    private NGSIConnection connection(String proxy_url) {
        List<KeyValuePair> headers = Arrays.asList(new KeyValuePair("FIWARE-Service", "smartcity"), new KeyValuePair("FIWARE-ServicePath", "/gardens"));
        return new NGSIConnection(this.logger, this.preferences, this.transport, this.registry, this.executor, this.brokerURL + "/", proxy_url, "/events/notify", headers);
    }

    private static Map<String, Object> subscriptionBody() {
        Map<String, Object> notification = new HashMap<>();
        notification.put("attrsFormat", "keyValues");
        Map<String, Object> body = new HashMap<>();
        body.put("description", "ngsi source subscription");
        body.put("notification", notification);
        return body;
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCreateSubscription() {
        this.broker.status = 201;
        this.broker.replyHeaders.put("Location", "/v2/subscriptions/5a1b2c3d");

        Subscription subscription = this.connection("http://bridge.example.com:8080/").createSubscription(subscriptionBody(), (id, data) -> { }, true).join();

        assertEquals("5a1b2c3d", subscription.id());
        assertTrue(this.registry.contains(subscription.callbackId()));

        Recorded request = this.broker.requests.get(0);
        assertEquals("POST", request.method);
        assertEquals("/v2/subscriptions", request.path);
        assertEquals("skipInitialNotification", request.parameters.get("options"));
        assertEquals("smartcity", request.headers.get("fiware-service"));
        assertEquals("/gardens", request.headers.get("fiware-servicepath"));

        Map<String, Object> sent = new JSONParser().parseJson(request.body);
        Map<String, Object> notification = (Map<String, Object>) sent.get("notification");
        assertEquals("keyValues", notification.get("attrsFormat"));
        Map<String, Object> http = (Map<String, Object>) notification.get("http");
        assertEquals("http://bridge.example.com:8080/events/notify/" + subscription.callbackId(), http.get("url"));
    }

    @Test
    void testMissingProxyFailsBeforeContactingBroker() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> this.connection("").createSubscription(subscriptionBody(), (id, data) -> { }, true).join());

        assertTrue(NGSIConnection.unwrap(ex) instanceof NGSIProxyConnectionException);
        assertTrue(this.broker.requests.isEmpty());
        assertEquals(0, this.registry.size());
    }

    @Test
    void testMalformedProxyFails() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> this.connection("not a url").createSubscription(subscriptionBody(), (id, data) -> { }, true).join());

        assertTrue(NGSIConnection.unwrap(ex) instanceof NGSIProxyConnectionException);
    }

    @Test
    void testBrokerRejection() {
        this.broker.status = 400;
        this.broker.reply = "{\"error\":\"BadRequest\",\"description\":\"invalid expires\"}";

        CompletionException ex = assertThrows(CompletionException.class,
                () -> this.connection("http://bridge:8080").createSubscription(subscriptionBody(), (id, data) -> { }, true).join());

        Throwable cause = NGSIConnection.unwrap(ex);
        assertTrue(cause instanceof NGSIBrokerException);
        assertEquals(400, ((NGSIBrokerException) cause).httpCode());
        assertTrue(((NGSIBrokerException) cause).body().contains("invalid expires"));
        assertEquals(0, this.registry.size());
    }

    @Test
    void testListEntities() {
        this.broker.reply = "[{\"id\":\"room1\",\"type\":\"Room\",\"temperature\":21}]";
        this.broker.replyHeaders.put("Fiware-Total-Count", "250");

        EntityQuery query = new EntityQuery().idPattern(".*").types("Room,Store").q("temperature>20").limit(100).offset(200).count(true).keyValues(true);
        EntityPage page = this.connection("http://bridge:8080").listEntities(query).join();

        assertEquals(250, page.count());
        assertEquals(1, page.results().size());
        assertEquals("room1", page.results().get(0).get("id"));

        Recorded request = this.broker.requests.get(0);
        assertEquals("GET", request.method);
        assertEquals("/v2/entities", request.path);
        assertEquals(".*", request.parameters.get("idPattern"));
        assertEquals("Room,Store", request.parameters.get("type"));
        assertEquals("temperature>20", request.parameters.get("q"));
        assertEquals("100", request.parameters.get("limit"));
        assertEquals("200", request.parameters.get("offset"));
        assertEquals("count,keyValues", request.parameters.get("options"));
    }

    @Test
    void testListEntitiesWithoutCountHeader() {
        this.broker.reply = "[{\"id\":\"a\"},{\"id\":\"b\"}]";

        EntityPage page = this.connection("http://bridge:8080").listEntities(new EntityQuery()).join();

        assertEquals(2, page.count());
        assertFalse(this.broker.requests.get(0).parameters.containsKey("q"));
    }

    @Test
    void testUpdateSubscription() {
        this.broker.status = 204;
        Map<String, Object> patch = new HashMap<>();
        patch.put("expires", "2030-01-01T00:00:00.000Z");

        this.connection("http://bridge:8080").updateSubscription("5a1b2c3d", patch).join();

        Recorded request = this.broker.requests.get(0);
        assertEquals("PATCH", request.method);
        assertEquals("/v2/subscriptions/5a1b2c3d", request.path);
        assertEquals("2030-01-01T00:00:00.000Z", new JSONParser().parseJson(request.body).get("expires"));
        assertTrue(this.logger.lastEntries().contains("HTTP: PATCH URL: " + this.brokerURL + "/v2/subscriptions/5a1b2c3d CONTENT_TYPE: application/json DATA: {\"expires\":\"2030-01-01T00:00:00.000Z\"}"));
    }

    @Test
    void testDeleteSubscriptionReleasesCallback() {
        NGSIConnection connection = this.connection("http://bridge:8080");
        this.broker.status = 201;
        this.broker.replyHeaders.put("Location", "/v2/subscriptions/abc");
        Subscription subscription = connection.createSubscription(subscriptionBody(), (id, data) -> { }, false).join();
        assertEquals(1, this.registry.size());
        assertFalse(this.broker.requests.get(0).parameters.containsKey("options"));

        this.broker.status = 204;
        connection.deleteSubscription(subscription.id()).join();

        Recorded request = this.broker.requests.get(1);
        assertEquals("DELETE", request.method);
        assertEquals("/v2/subscriptions/abc", request.path);
        assertEquals(0, this.registry.size());
    }

    @Test
    void testUnreachableBroker() throws Exception {
        this.server.stop();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> this.connection("http://bridge:8080").listEntities(new EntityQuery()).join());

        assertTrue(NGSIConnection.unwrap(ex) instanceof NGSIConnectionException);
        assertFalse(NGSIConnection.unwrap(ex) instanceof NGSIProxyConnectionException);
    }
}
