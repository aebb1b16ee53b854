/**
 * @file HttpPeerSenderTest.java
 * @brief HTTP peer sender tests
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.fiware.ngsi.source.core.ApiResponse;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.transport.HttpTransport;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HttpPeerSenderTest {
    private ErrorLogger logger;
    private HttpTransport transport;
    private HttpPeerSender sender;

    @BeforeEach
    void setUp() {
        this.logger = new ErrorLogger();
        Properties properties = new Properties();
        properties.setProperty("entityOutput_url", " http://consumer:9000/entities ");
        properties.setProperty("normalizedOutput_url", "");
        this.transport = mock(HttpTransport.class);
        this.sender = new HttpPeerSender(this.logger, new PreferenceManager(this.logger, "test", properties), this.transport, Runnable::run);
    }

    @Test
    void testPeerURL() {
        assertEquals("http://consumer:9000/entities", this.sender.peerURL("entityOutput"));
        assertNull(this.sender.peerURL("normalizedOutput"));
        assertNull(this.sender.peerURL("ngsimetadata"));
    }

    @Test
    void testMessageIsPosted() {
        ApiResponse ok = new ApiResponse("POST", "http://consumer:9000/entities", "[]", HttpTransport.JSON_CONTENT_TYPE);
        ok.setHttpCode(200);
        when(this.transport.httpPost(anyString(), any(), anyString(), anyString())).thenReturn(ok);

        this.sender.sendMessage("entityOutput", "[{\"id\":\"room1\"}]");

        verify(this.transport).httpPost(eq("http://consumer:9000/entities"), any(), eq("[{\"id\":\"room1\"}]"), eq(HttpTransport.JSON_CONTENT_TYPE));
    }

    @Test
    void testFailedDeliveryIsLogged() {
        ApiResponse failed = new ApiResponse("POST", "http://consumer:9000/entities", "[]", HttpTransport.JSON_CONTENT_TYPE);
        failed.setHttpCode(503);
        when(this.transport.httpPost(anyString(), any(), anyString(), anyString())).thenReturn(failed);

        this.sender.sendMessage("entityOutput", "[]");

        assertTrue(this.logger.lastEntries().stream().anyMatch(entry -> entry.contains("CODE: 503")));
    }

    @Test
    void testUnconfiguredPeerIsSkipped() {
        this.sender.sendMessage("normalizedOutput", "[]");

        verify(this.transport, never()).httpPost(anyString(), any(), anyString(), anyString());
    }
}
