/**
 * @file NGSISubscriptionManager.java
 * @brief NGSI v2 subscription manager
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
package org.fiware.ngsi.source.subscription.managers;

import org.fiware.ngsi.source.coordinator.SourceConfiguration;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.Utils;
import org.fiware.ngsi.source.ngsi.NGSIConnection;
import org.fiware.ngsi.source.ngsi.interfaces.NotificationCallback;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.subscription.Subscription;
import org.fiware.ngsi.source.subscription.interfaces.SubscriptionManager;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * NGSI v2 subscription manager: create, renew and delete the source subscription
 *
 * @author Doug Anson
 */
public class NGSISubscriptionManager extends BaseClass implements SubscriptionManager {
    public static final String SUBSCRIPTION_DESCRIPTION = "ngsi source subscription";
    public static final long DEFAULT_SUBSCRIPTION_DURATION_MS = 3L * 60 * 60 * 1000;    // 3 hours

    private long m_subscription_duration_ms = DEFAULT_SUBSCRIPTION_DURATION_MS;

    // constructor
    public NGSISubscriptionManager(ErrorLogger error_logger, PreferenceManager preference_manager) {
        super(error_logger, preference_manager);
        this.m_subscription_duration_ms = this.prefLongValue("ngsi_subscription_duration_ms");
        if (this.m_subscription_duration_ms <= 0) {
            this.m_subscription_duration_ms = DEFAULT_SUBSCRIPTION_DURATION_MS;
        }
    }

    // subscription lifetime
    public long subscriptionDurationMs() {
        return this.m_subscription_duration_ms;
    }

    @Override
    public Map<String, Object> buildSubscription(SourceConfiguration configuration, String format) {
        return this.buildSubscription(configuration, format, this.nextExpiration());
    }

    // build the payload with a given expiration
    private Map<String, Object> buildSubscription(SourceConfiguration configuration, String format, Date expires) {
        // one entity filter per type, or a single id pattern filter
        List<Map<String, Object>> entities = new ArrayList<>();
        List<String> types = configuration.typeList();
        if (!types.isEmpty()) {
            for (String type : types) {
                LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
                entity.put("idPattern", configuration.idPattern());
                entity.put("type", type);
                entities.add(entity);
            }
        }
        else {
            LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
            entity.put("idPattern", configuration.idPattern());
            entities.add(entity);
        }

        LinkedHashMap<String, Object> subject = new LinkedHashMap<>();
        subject.put("entities", entities);

        // condition only when there is something to condition on
        if (configuration.query() != null || !configuration.updateAttributes().isEmpty()) {
            LinkedHashMap<String, Object> condition = new LinkedHashMap<>();
            if (!configuration.updateAttributes().isEmpty()) {
                condition.put("attrs", new ArrayList<>(configuration.updateAttributes()));
            }
            if (configuration.query() != null) {
                LinkedHashMap<String, Object> expression = new LinkedHashMap<>();
                expression.put("q", configuration.query());
                condition.put("expression", expression);
            }
            subject.put("condition", condition);
        }

        LinkedHashMap<String, Object> notification = new LinkedHashMap<>();
        notification.put("attrsFormat", format);

        LinkedHashMap<String, Object> subscription = new LinkedHashMap<>();
        subscription.put("description", SUBSCRIPTION_DESCRIPTION);
        subscription.put("subject", subject);
        subscription.put("notification", notification);
        subscription.put("expires", Utils.dateToISO8601(expires));
        return subscription;
    }

    @Override
    public CompletableFuture<Subscription> createSubscription(NGSIConnection connection, SourceConfiguration configuration, String format, NotificationCallback callback) {
        Date expires = this.nextExpiration();
        Map<String, Object> body = this.buildSubscription(configuration, format, expires);
        return connection.createSubscription(body, callback, true).thenApply(subscription -> {
            subscription.setExpires(expires);
            return subscription;
        });
    }

    @Override
    public CompletableFuture<Date> renewSubscription(NGSIConnection connection, Subscription subscription) {
        Date expires = this.nextExpiration();
        LinkedHashMap<String, Object> patch = new LinkedHashMap<>();
        patch.put("expires", Utils.dateToISO8601(expires));
        return connection.updateSubscription(subscription.id(), patch).thenApply(v -> {
            subscription.setExpires(expires);
            return expires;
        });
    }

    @Override
    public CompletableFuture<Void> deleteSubscription(NGSIConnection connection, Subscription subscription) {
        return connection.deleteSubscription(subscription.id());
    }

    // now + subscription lifetime
    private Date nextExpiration() {
        return Utils.dateFromNow(this.m_subscription_duration_ms);
    }
}
