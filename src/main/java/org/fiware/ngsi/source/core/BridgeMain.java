/**
 * @file BridgeMain.java
 * @brief main entry point for the ngsi-source-bridge application
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
package org.fiware.ngsi.source.core;

import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.servlet.EventsProcessor;
import org.fiware.ngsi.source.servlet.Manager;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.ssl.SslContextFactory;

/**
 * BridgeMain: Main entry point for the ngsi-source-bridge application
 *
 * @author Doug Anson
 */
public class BridgeMain {
    // Defaults
    private static final int DEF_PORT = 8080;
    private static final long DEF_SHUTDOWN_WAIT_MS = 10000;         // wait at most 10 seconds for the subscription removal

    // Bridge Components
    private ErrorLogger m_logger = null;
    private PreferenceManager m_preferences = null;
    private EventsProcessor m_events_processor = null;
    private Manager m_manager = null;

    // Jetty Server
    private Server m_server = null;

    // constructor
    public BridgeMain(String[] args) {
        // Error Logger
        this.m_logger = new ErrorLogger();

        // Preferences Manager
        this.m_preferences = new PreferenceManager(this.m_logger, Manager.LOG_TAG);

        // configure the error logging level
        this.m_logger.configureLoggingLevel(this.m_preferences);

        // Create the Eventing Processor and its Manager
        this.m_manager = Manager.getInstance(this.m_logger, this.m_preferences);
        this.m_events_processor = new EventsProcessor(this.m_logger, this.m_manager);

        // initialize the server
        this.m_server = new Server();

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        String context_path = this.m_manager.contextPath();
        context.setContextPath((context_path.length() > 0) ? context_path : "/");
        this.m_server.setHandler(context);

        int port = this.m_preferences.intValueOf("port");
        if (port <= 0) {
            port = DEF_PORT;
        }

        // SSL only when a keystore is configured
        ServerConnector connector = null;
        String keystore = this.m_preferences.valueOf("keystore_path");
        if (keystore != null && keystore.length() > 0) {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStorePath(keystore);
            sslContextFactory.setKeyStorePassword(this.m_preferences.valueOf("keystore_password"));
            connector = new ServerConnector(this.m_server, sslContextFactory);
            this.errorLogger().warning("Main: SSL enabled (keystore: " + keystore + ")");
        }
        else {
            connector = new ServerConnector(this.m_server);
        }
        connector.setHost("0.0.0.0");
        connector.setPort(port);
        connector.setIdleTimeout(TimeUnit.MINUTES.toMillis(5));
        connector.setReuseAddress(true);
        this.m_server.addConnector(connector);

        // eventing process servlet bindings (wildcarded)
        context.addServlet(new ServletHolder(this.m_events_processor), this.m_manager.eventsPath() + "/*");

        // add a shutdown hook for graceful shutdowns...
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            errorLogger().warning("Main: Removing NGSI subscription...");
            try {
                m_manager.shutdown().get(DEF_SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                errorLogger().warning("Main: interrupted while removing the NGSI subscription");
            }
            catch (ExecutionException | TimeoutException ex) {
                errorLogger().warning("Main: NGSI subscription removal did not complete: " + ex.getMessage());
            }
            stop();
        }));
    }

    // start the bridge
    public void start() {
        try {
            // DEBUG
            this.errorLogger().warning("Main: Starting Bridge instance...");

            // Start the Bridge Service
            this.errorLogger().warning("Main: Starting bridge service");
            this.m_server.start();

            // subscribe and fetch the initial values
            this.m_manager.start();

            // Join
            this.m_server.join();
        }
        catch (Exception ex) {
            this.errorLogger().critical("Main: EXCEPTION during bridge start(): " + ex.getMessage(), ex);
        }
    }

    // stop the bridge
    public void stop() {
        try {
            // stop the bridge service
            this.errorLogger().warning("Main: Stopping current bridge service...");
            this.m_server.stop();

            // current bridge server stoped
            this.errorLogger().warning("Main: All services have been stopped");
        }
        catch (Exception ex) {
            // ERROR
            this.errorLogger().critical("Main: EXCEPTION during service(s) stop: " + ex.getMessage(), ex);
        }
    }

    // error logger
    private ErrorLogger errorLogger() {
        return this.m_logger;
    }
}
