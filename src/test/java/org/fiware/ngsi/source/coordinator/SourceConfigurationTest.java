/**
 * @file SourceConfigurationTest.java
 * @brief source configuration tests
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
package org.fiware.ngsi.source.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.KeyValuePair;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class SourceConfigurationTest {

    private static String header(List<KeyValuePair> headers, String name) {
        for (KeyValuePair kvp : headers) {
            if (kvp.key().equalsIgnoreCase(name)) {
                return kvp.value();
            }
        }
        return null;
    }

    @Test
    void testNormalizesFilters() {
        SourceConfiguration config = new SourceConfiguration(" http://orion:1026 ", "http://proxy", "", "", " Room,  Store, \tTruck ", "  ",
                "  ", "temperature,  pressure", false, false, false, null);

        assertEquals("http://orion:1026", config.serverURL());
        assertEquals("Room,Store,Truck", config.types());
        assertEquals(Arrays.asList("Room", "Store", "Truck"), config.typeList());
        assertEquals(".*", config.idPattern());
        assertNull(config.query());
        assertEquals(Arrays.asList("temperature", "pressure"), config.updateAttributes());
        assertTrue(config.wantsSubscription());
    }

    @Test
    void testEmptyValues() {
        SourceConfiguration config = new SourceConfiguration(null, null, null, null, null, null, null, null, false, false, false, null);

        assertNull(config.types());
        assertTrue(config.typeList().isEmpty());
        assertEquals(".*", config.idPattern());
        assertNull(config.query());
        assertTrue(config.updateAttributes().isEmpty());
        assertFalse(config.wantsSubscription());
        assertTrue(config.requestHeaders().isEmpty());
    }

    @Test
    void testTenantAndServicePathHeaders() {
        SourceConfiguration config = new SourceConfiguration("http://orion", "", " smartcity ", " /gardens ", "", "", "", "", false, false, false, null);
        List<KeyValuePair> headers = config.requestHeaders();

        assertEquals("smartcity", header(headers, "FIWARE-Service"));
        assertEquals("/gardens", header(headers, "FIWARE-ServicePath"));
    }

    @Test
    void testRootServicePathIsNotSent() {
        SourceConfiguration config = new SourceConfiguration("http://orion", "", "", "/", "", "", "", "", false, false, false, null);

        assertNull(header(config.requestHeaders(), "FIWARE-ServicePath"));
    }

    @Test
    void testCredentialHeaders() {
        SourceConfiguration owner = new SourceConfiguration("http://orion", "", "", "", "", "", "", "", false, true, false, null);
        List<KeyValuePair> headers = owner.requestHeaders();
        assertEquals("true", header(headers, "FIWARE-OAuth-Token"));
        assertEquals("X-Auth-Token", header(headers, "FIWARE-OAuth-Header-Name"));
        assertEquals("workspaceowner", header(headers, "FIWARE-OAuth-Source"));
        assertNull(header(headers, "X-Auth-Token"));

        SourceConfiguration user = new SourceConfiguration("http://orion", "", "", "", "", "", "", "", false, false, true, "abc123");
        assertEquals("abc123", header(user.requestHeaders(), "X-Auth-Token"));

        SourceConfiguration no_token = new SourceConfiguration("http://orion", "", "", "", "", "", "", "", false, false, true, "");
        assertNull(header(no_token.requestHeaders(), "X-Auth-Token"));
    }

    @Test
    void testFromPreferences() {
        Properties properties = new Properties();
        properties.setProperty("ngsi_server", "http://orion:1026");
        properties.setProperty("ngsi_proxy", "http://bridge:8080");
        properties.setProperty("ngsi_entities", "Room");
        properties.setProperty("ngsi_id_filter", "room.*");
        properties.setProperty("query", "temperature>20");
        properties.setProperty("ngsi_update_attributes", "temperature");
        properties.setProperty("buffering", "true");
        PreferenceManager preferences = new PreferenceManager(new ErrorLogger(), "test", properties);

        SourceConfiguration config = SourceConfiguration.fromPreferences(preferences);

        assertEquals("http://bridge:8080", config.proxyURL());
        assertEquals("Room", config.types());
        assertEquals("room.*", config.idPattern());
        assertEquals("temperature>20", config.query());
        assertTrue(config.buffering());
        assertFalse(config.useOwnerCredentials());
    }
}
