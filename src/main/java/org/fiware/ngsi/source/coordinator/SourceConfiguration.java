/**
 * @file SourceConfiguration.java
 * @brief normalized NGSI source configuration for one activation cycle
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

import org.fiware.ngsi.source.core.KeyValuePair;
import org.fiware.ngsi.source.core.Utils;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable configuration snapshot taken from the preferences at the start of a cycle
 *
 * @author Doug Anson
 */
public class SourceConfiguration {
    // preference keys
    public static final String PREF_SERVER = "ngsi_server";
    public static final String PREF_PROXY = "ngsi_proxy";
    public static final String PREF_TENANT = "ngsi_tenant";
    public static final String PREF_SERVICE_PATH = "ngsi_service_path";
    public static final String PREF_ENTITIES = "ngsi_entities";
    public static final String PREF_ID_FILTER = "ngsi_id_filter";
    public static final String PREF_QUERY = "query";
    public static final String PREF_UPDATE_ATTRIBUTES = "ngsi_update_attributes";
    public static final String PREF_BUFFERING = "buffering";
    public static final String PREF_USE_OWNER_CREDENTIALS = "use_owner_credentials";
    public static final String PREF_USE_USER_FIWARE_TOKEN = "use_user_fiware_token";
    public static final String PREF_USER_TOKEN = "ngsi_user_token";

    // defaults
    public static final String DEFAULT_ID_PATTERN = ".*";

    private final String m_server_url;
    private final String m_proxy_url;
    private final String m_tenant;
    private final String m_service_path;
    private final String m_types;
    private final String m_id_pattern;
    private final String m_query;
    private final List<String> m_update_attributes;
    private final boolean m_buffering;
    private final boolean m_use_owner_credentials;
    private final boolean m_use_user_fiware_token;
    private final String m_user_token;

    // constructor (raw values are normalized here)
    public SourceConfiguration(String server_url, String proxy_url, String tenant, String service_path, String types, String id_pattern,
            String query, String update_attributes, boolean buffering, boolean use_owner_credentials, boolean use_user_fiware_token, String user_token) {
        this.m_server_url = Utils.trim(server_url);
        this.m_proxy_url = Utils.trim(proxy_url);
        this.m_tenant = Utils.trim(tenant);
        this.m_service_path = Utils.trim(service_path);

        // "A,  B" -> "A,B"; empty means no type filter
        String normalized_types = Utils.trim(types).replaceAll(",+\\s+", ",");
        this.m_types = (normalized_types.length() > 0) ? normalized_types : null;

        String pattern = Utils.trim(id_pattern);
        this.m_id_pattern = (pattern.length() > 0) ? pattern : DEFAULT_ID_PATTERN;

        String q = Utils.trim(query);
        this.m_query = (q.length() > 0) ? q : null;

        String attrs = Utils.trim(update_attributes);
        if (attrs.length() > 0) {
            this.m_update_attributes = Collections.unmodifiableList(Utils.split(attrs, ",\\s*"));
        }
        else {
            this.m_update_attributes = Collections.emptyList();
        }

        this.m_buffering = buffering;
        this.m_use_owner_credentials = use_owner_credentials;
        this.m_use_user_fiware_token = use_user_fiware_token;
        this.m_user_token = Utils.trim(user_token);
    }

    // build from the current preferences
    public static SourceConfiguration fromPreferences(PreferenceManager preferences) {
        return new SourceConfiguration(
                preferences.valueOf(PREF_SERVER),
                preferences.valueOf(PREF_PROXY),
                preferences.valueOf(PREF_TENANT),
                preferences.valueOf(PREF_SERVICE_PATH),
                preferences.valueOf(PREF_ENTITIES),
                preferences.valueOf(PREF_ID_FILTER),
                preferences.valueOf(PREF_QUERY),
                preferences.valueOf(PREF_UPDATE_ATTRIBUTES),
                preferences.booleanValueOf(PREF_BUFFERING),
                preferences.booleanValueOf(PREF_USE_OWNER_CREDENTIALS),
                preferences.booleanValueOf(PREF_USE_USER_FIWARE_TOKEN),
                preferences.valueOf(PREF_USER_TOKEN));
    }

    // headers sent with every NGSI request
    public List<KeyValuePair> requestHeaders() {
        ArrayList<KeyValuePair> headers = new ArrayList<>();
        if (this.m_use_owner_credentials) {
            headers.add(new KeyValuePair("FIWARE-OAuth-Token", "true"));
            headers.add(new KeyValuePair("FIWARE-OAuth-Header-Name", "X-Auth-Token"));
            headers.add(new KeyValuePair("FIWARE-OAuth-Source", "workspaceowner"));
        }
        if (this.m_use_user_fiware_token && this.m_user_token.length() > 0) {
            headers.add(new KeyValuePair("X-Auth-Token", this.m_user_token));
        }
        if (this.m_tenant.length() > 0) {
            headers.add(new KeyValuePair("FIWARE-Service", this.m_tenant));
        }
        if (this.m_service_path.length() > 0 && !this.m_service_path.equals("/")) {
            headers.add(new KeyValuePair("FIWARE-ServicePath", this.m_service_path));
        }
        return headers;
    }

    // type list (empty if no type filter)
    public List<String> typeList() {
        if (this.m_types == null) {
            return Collections.emptyList();
        }
        return Utils.split(this.m_types, ",");
    }

    // should a subscription be created? (only when update attributes are configured)
    public boolean wantsSubscription() {
        return !this.m_update_attributes.isEmpty();
    }

    public String serverURL() {
        return this.m_server_url;
    }

    public String proxyURL() {
        return this.m_proxy_url;
    }

    public String tenant() {
        return this.m_tenant;
    }

    public String servicePath() {
        return this.m_service_path;
    }

    // comma separated types, null when there is no type filter
    public String types() {
        return this.m_types;
    }

    public String idPattern() {
        return this.m_id_pattern;
    }

    // query filter, null when there is none
    public String query() {
        return this.m_query;
    }

    public List<String> updateAttributes() {
        return this.m_update_attributes;
    }

    public boolean buffering() {
        return this.m_buffering;
    }

    public boolean useOwnerCredentials() {
        return this.m_use_owner_credentials;
    }

    public boolean useUserFiwareToken() {
        return this.m_use_user_fiware_token;
    }

    @Override
    public String toString() {
        return "SourceConfiguration(server: " + this.m_server_url + " proxy: " + this.m_proxy_url + " types: " + this.m_types
                + " idPattern: " + this.m_id_pattern + " query: " + this.m_query + " attrs: " + this.m_update_attributes + ")";
    }
}
