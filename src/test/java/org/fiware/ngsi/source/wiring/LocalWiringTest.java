/**
 * @file LocalWiringTest.java
 * @brief local wiring tests
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.fiware.ngsi.source.coordinator.processors.interfaces.GenericSender;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LocalWiringTest {
    private LocalWiring wiring;
    private AtomicInteger statusChanges;

    @BeforeEach
    void setUp() {
        ErrorLogger logger = new ErrorLogger();
        this.wiring = new LocalWiring(logger, new PreferenceManager(logger, "test", new Properties()));
        this.statusChanges = new AtomicInteger();
        this.wiring.registerStatusCallback(this.statusChanges::incrementAndGet);
    }

    @Test
    void testPushEventFansOut() {
        GenericSender first = mock(GenericSender.class);
        GenericSender second = mock(GenericSender.class);
        this.wiring.connectOutput("entityOutput", first);
        this.wiring.connectOutput("entityOutput", second);

        this.wiring.pushEvent("entityOutput", Arrays.asList("a", "b"));

        verify(first).sendMessage("entityOutput", "[\"a\",\"b\"]");
        verify(second).sendMessage("entityOutput", "[\"a\",\"b\"]");
        assertEquals(2, this.statusChanges.get());
    }

    @Test
    void testDisconnectedOutputDropsEvents() {
        GenericSender sender = mock(GenericSender.class);
        this.wiring.connectOutput("entityOutput", sender);
        this.wiring.disconnectOutput("entityOutput");

        this.wiring.pushEvent("entityOutput", "ignored");

        assertFalse(this.wiring.isOutputConnected("entityOutput"));
        verify(sender, never()).sendMessage(anyString(), anyString());
        assertEquals(2, this.statusChanges.get());
    }

    @Test
    void testNullEventIsSerialized() {
        GenericSender sender = mock(GenericSender.class);
        this.wiring.connectOutput("normalizedOutput", sender);

        this.wiring.pushEvent("normalizedOutput", null);

        verify(sender).sendMessage("normalizedOutput", "null");
    }

    @Test
    void testInputs() {
        List<Object> received = new ArrayList<>();
        assertFalse(this.wiring.deliver("ngsimetadataInput", "x"));

        this.wiring.registerCallback("ngsimetadataInput", received::add);
        this.wiring.connectInput("ngsimetadataInput");
        this.wiring.connectInput("ngsimetadataInput");

        assertTrue(this.wiring.isInputConnected("ngsimetadataInput"));
        assertTrue(this.wiring.deliver("ngsimetadataInput", null));
        assertEquals(1, received.size());
        assertNull(received.get(0));
        assertEquals(1, this.statusChanges.get());

        this.wiring.disconnectInput("ngsimetadataInput");
        assertFalse(this.wiring.isInputConnected("ngsimetadataInput"));
        assertEquals(2, this.statusChanges.get());
    }

    @Test
    void testFailingStatusCallbackIsContained() {
        this.wiring.registerStatusCallback(() -> {
            throw new IllegalStateException("boom");
        });

        this.wiring.connectInput("ngsimetadataInput");

        assertEquals(1, this.statusChanges.get());
    }
}
