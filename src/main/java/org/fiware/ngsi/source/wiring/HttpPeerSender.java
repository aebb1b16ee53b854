/**
 * @file HttpPeerSender.java
 * @brief HTTP peer sender for wiring outputs
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
import org.fiware.ngsi.source.core.ApiResponse;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.transport.HttpTransport;
import java.util.concurrent.Executor;

/**
 * HTTP peer sender: POSTs each wiring event to the URL configured as "<endpoint>_url"
 *
 * @author Doug Anson
 */
public class HttpPeerSender extends BaseClass implements GenericSender {
    public static final String URL_SUFFIX = "_url";

    private final HttpTransport m_transport;
    private final Executor m_io_executor;

    // constructor
    public HttpPeerSender(ErrorLogger error_logger, PreferenceManager preference_manager, HttpTransport transport, Executor io_executor) {
        super(error_logger, preference_manager);
        this.m_transport = transport;
        this.m_io_executor = io_executor;
    }

    // peer URL of an endpoint (null if none)
    public String peerURL(String endpoint) {
        String url = this.prefValue(endpoint + URL_SUFFIX);
        if (url != null && url.trim().length() > 0) {
            return url.trim();
        }
        return null;
    }

    @Override
    public void sendMessage(String to, String message) {
        String url = this.peerURL(to);
        if (url == null) {
            this.errorLogger().warning("HttpPeerSender: no peer URL configured for: " + to);
            return;
        }
        this.m_io_executor.execute(() -> {
            ApiResponse response = this.m_transport.httpPost(url, null, message, HttpTransport.JSON_CONTENT_TYPE);
            if (!response.isOK()) {
                this.errorLogger().warning("HttpPeerSender: unable to deliver " + to + " event to " + url + " CODE: " + response.getHttpCode());
            }
        });
    }
}
