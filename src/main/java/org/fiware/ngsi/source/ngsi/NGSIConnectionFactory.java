/**
 * @file NGSIConnectionFactory.java
 * @brief creates NGSI connections for source configurations
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

import org.fiware.ngsi.source.coordinator.SourceConfiguration;
import org.fiware.ngsi.source.coordinator.processors.interfaces.ConnectionCreator;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.transport.HttpTransport;
import java.util.concurrent.Executor;

/**
 * NGSI connection factory: binds a configuration to the shared transport and notification registry
 *
 * @author Doug Anson
 */
public class NGSIConnectionFactory extends BaseClass implements ConnectionCreator {
    private final HttpTransport m_transport;
    private final NotificationCallbackRegistry m_registry;
    private final Executor m_io_executor;
    private final String m_notify_path;

    // constructor
    public NGSIConnectionFactory(ErrorLogger error_logger, PreferenceManager preference_manager, HttpTransport transport,
            NotificationCallbackRegistry registry, Executor io_executor, String notify_path) {
        super(error_logger, preference_manager);
        this.m_transport = transport;
        this.m_registry = registry;
        this.m_io_executor = io_executor;
        this.m_notify_path = notify_path;
    }

    @Override
    public NGSIConnection createConnection(SourceConfiguration configuration) {
        this.errorLogger().info("NGSIConnectionFactory: connecting to: " + configuration.serverURL() + " (proxy: " + configuration.proxyURL() + ")");
        return new NGSIConnection(this.errorLogger(), this.preferences(), this.m_transport, this.m_registry, this.m_io_executor,
                configuration.serverURL(), configuration.proxyURL(), this.m_notify_path, configuration.requestHeaders());
    }
}
