/**
 * @file SubscriptionRefresherThread.java
 * @brief periodic subscription renewal thread
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

import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.subscription.interfaces.SubscriptionRefresherResponder;

/**
 * Subscription Refresher Thread implementation
 *
 * @author Doug Anson
 */
public class SubscriptionRefresherThread extends Thread {
    public static final long DEFAULT_REFRESH_INTERVAL_MS = 2L * 60 * 60 * 1000;     // 2 hours

    private final SubscriptionRefresherResponder m_responder;
    private volatile boolean m_running = false;
    private final long m_wait_between_refresh_ms;

    // Constructor
    public SubscriptionRefresherThread(SubscriptionRefresherResponder responder, long wait_between_refresh_ms) {
        super("ngsi-subscription-refresher");
        this.m_responder = responder;
        this.m_wait_between_refresh_ms = (wait_between_refresh_ms > 0) ? wait_between_refresh_ms : DEFAULT_REFRESH_INTERVAL_MS;
        this.setDaemon(true);
    }

    /**
     * get our running state
     *
     * @return
     */
    public boolean isRunning() {
        return this.m_running;
    }

    // refresh interval
    public long refreshIntervalMs() {
        return this.m_wait_between_refresh_ms;
    }

    // begin refreshing
    public void startRefreshing() {
        this.m_running = true;
        this.start();
    }

    // stop running
    public void haltThread() {
        this.m_running = false;
        this.interrupt();
    }

    /**
     * run method for the refresher thread
     */
    @Override
    public void run() {
        this.m_running = true;
        this.refresherThreadLoop();

        // Exiting
        if (this.errorLogger() != null) {
            this.errorLogger().info("SubscriptionRefresher: refresh thread STOPPED");
        }
    }

    /**
     * main thread loop
     */
    private void refresherThreadLoop() {
        while (this.m_running) {
            try {
                // sleep until we need to refresh the subscription
                Thread.sleep(this.m_wait_between_refresh_ms);
            }
            catch (InterruptedException ex) {
                // halted
                this.m_running = false;
                break;
            }
            if (this.m_running) {
                this.m_responder.refreshSubscription();
            }
        }
    }

    // Error Logger
    private ErrorLogger errorLogger() {
        if (this.m_responder != null) {
            return this.m_responder.errorLogger();
        }
        return null;
    }
}
