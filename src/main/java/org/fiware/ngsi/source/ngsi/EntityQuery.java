/**
 * @file EntityQuery.java
 * @brief NGSI v2 entity listing options
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
package org.fiware.ngsi.source.ngsi;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;

/**
 * Options of a GET /v2/entities listing
 *
 * @author Doug Anson
 */
public class EntityQuery {
    private String m_id_pattern = null;
    private String m_types = null;
    private String m_q = null;
    private int m_limit = 100;
    private int m_offset = 0;
    private boolean m_count = true;
    private boolean m_key_values = false;

    // default constructor
    public EntityQuery() {
    }

    public EntityQuery idPattern(String id_pattern) {
        this.m_id_pattern = id_pattern;
        return this;
    }

    public EntityQuery types(String types) {
        this.m_types = types;
        return this;
    }

    public EntityQuery q(String q) {
        this.m_q = q;
        return this;
    }

    public EntityQuery limit(int limit) {
        this.m_limit = limit;
        return this;
    }

    public EntityQuery offset(int offset) {
        this.m_offset = offset;
        return this;
    }

    public EntityQuery count(boolean count) {
        this.m_count = count;
        return this;
    }

    public EntityQuery keyValues(boolean key_values) {
        this.m_key_values = key_values;
        return this;
    }

    public String idPattern() {
        return this.m_id_pattern;
    }

    public String types() {
        return this.m_types;
    }

    public String q() {
        return this.m_q;
    }

    public int limit() {
        return this.m_limit;
    }

    public int offset() {
        return this.m_offset;
    }

    public boolean count() {
        return this.m_count;
    }

    public boolean keyValues() {
        return this.m_key_values;
    }

    // URL query string (without the leading '?')
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        this.append(sb, "idPattern", this.m_id_pattern);
        this.append(sb, "type", this.m_types);
        this.append(sb, "q", this.m_q);
        this.append(sb, "limit", String.valueOf(this.m_limit));
        this.append(sb, "offset", String.valueOf(this.m_offset));
        String options = null;
        if (this.m_count && this.m_key_values) {
            options = "count,keyValues";
        }
        else if (this.m_count) {
            options = "count";
        }
        else if (this.m_key_values) {
            options = "keyValues";
        }
        this.append(sb, "options", options);
        return sb.toString();
    }

    // append a parameter when it has a value
    private void append(StringBuilder sb, String name, String value) {
        if (value != null && value.length() > 0) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(name).append('=').append(EntityQuery.encode(value));
        }
    }

    // URL-encode a parameter value
    private static String encode(String value) {
        try {
            return URLEncoder.encode(value, "UTF-8").replace("+", "%20");
        }
        catch (UnsupportedEncodingException ex) {
            throw new IllegalStateException("UTF-8 not supported", ex);
        }
    }

    @Override
    public String toString() {
        return "EntityQuery(" + this.toQueryString() + ")";
    }
}
