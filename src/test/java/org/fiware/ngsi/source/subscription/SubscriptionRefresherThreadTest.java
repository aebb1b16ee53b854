/**
 * @file SubscriptionRefresherThreadTest.java
 * @brief subscription refresher thread tests
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
package org.fiware.ngsi.source.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.subscription.interfaces.SubscriptionRefresherResponder;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class SubscriptionRefresherThreadTest {
    // counts refresh requests
    private static class CountingResponder implements SubscriptionRefresherResponder {
        private final AtomicInteger refreshes = new AtomicInteger();
        private final ErrorLogger logger = new ErrorLogger();

        @Override
        public void refreshSubscription() {
            this.refreshes.incrementAndGet();
        }

        @Override
        public ErrorLogger errorLogger() {
            return this.logger;
        }
    }

    @Test
    void testRefreshesPeriodically() throws InterruptedException {
        CountingResponder responder = new CountingResponder();
        SubscriptionRefresherThread refresher = new SubscriptionRefresherThread(responder, 20);
        refresher.startRefreshing();

        long deadline = System.currentTimeMillis() + 5000;
        while (responder.refreshes.get() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        refresher.haltThread();
        refresher.join(5000);

        assertTrue(responder.refreshes.get() >= 2);
        assertFalse(refresher.isRunning());
        assertFalse(refresher.isAlive());
    }

    @Test
    void testHaltBeforeFirstRefresh() throws InterruptedException {
        CountingResponder responder = new CountingResponder();
        SubscriptionRefresherThread refresher = new SubscriptionRefresherThread(responder, 60000);
        refresher.startRefreshing();
        assertTrue(refresher.isRunning());

        refresher.haltThread();
        refresher.join(5000);

        assertEquals(0, responder.refreshes.get());
        assertFalse(refresher.isAlive());
    }

    @Test
    void testDefaultInterval() {
        SubscriptionRefresherThread refresher = new SubscriptionRefresherThread(new CountingResponder(), 0);

        assertEquals(SubscriptionRefresherThread.DEFAULT_REFRESH_INTERVAL_MS, refresher.refreshIntervalMs());
        assertTrue(refresher.isDaemon());
    }
}
