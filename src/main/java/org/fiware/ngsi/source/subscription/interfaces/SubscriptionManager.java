/**
 * @file SubscriptionManager.java
 * @brief subscription manager interface
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
package org.fiware.ngsi.source.subscription.interfaces;

import org.fiware.ngsi.source.coordinator.SourceConfiguration;
import org.fiware.ngsi.source.ngsi.NGSIConnection;
import org.fiware.ngsi.source.ngsi.interfaces.NotificationCallback;
import org.fiware.ngsi.source.subscription.Subscription;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * SubscriptionManager Interface defines context broker subscription management
 * @author Doug Anson
 */
public interface SubscriptionManager {
    // build the subscription payload for a configuration and output format
    public Map<String, Object> buildSubscription(SourceConfiguration configuration, String format);

    // create a subscription
    public CompletableFuture<Subscription> createSubscription(NGSIConnection connection, SourceConfiguration configuration, String format, NotificationCallback callback);

    // push the expiration of a subscription forward, returning the new expiration
    public CompletableFuture<Date> renewSubscription(NGSIConnection connection, Subscription subscription);

    // delete a subscription
    public CompletableFuture<Void> deleteSubscription(NGSIConnection connection, Subscription subscription);
}
