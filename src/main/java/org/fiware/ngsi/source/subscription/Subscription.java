/**
 * @file Subscription.java
 * @brief live NGSI subscription handle
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

import java.util.Date;

/**
 * A subscription registered with the context broker
 *
 * @author Doug Anson
 */
public class Subscription {
    private final String m_id;
    private final String m_callback_id;
    private volatile Date m_expires;

    // constructor
    public Subscription(String id, String callback_id, Date expires) {
        this.m_id = id;
        this.m_callback_id = callback_id;
        this.m_expires = expires;
    }

    // broker assigned id
    public String id() {
        return this.m_id;
    }

    // notification route id
    public String callbackId() {
        return this.m_callback_id;
    }

    // current expiration
    public Date expires() {
        return this.m_expires;
    }

    // record a renewed expiration
    public void setExpires(Date expires) {
        this.m_expires = expires;
    }

    @Override
    public String toString() {
        return "Subscription(id: " + this.m_id + " callback: " + this.m_callback_id + ")";
    }
}
