/**
 * @file MetadataProcessor.java
 * @brief NGSI source metadata export and import
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
package org.fiware.ngsi.source.coordinator.processors.core;

import org.fiware.ngsi.source.coordinator.SourceConfiguration;
import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.core.Utils;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata processor: describes the current source settings and applies imported ones
 *
 * @author Doug Anson
 */
public class MetadataProcessor extends BaseClass {
    // metadata key -> preference
    private static final String[][] METADATA_TABLE = {
        {"serverURL", SourceConfiguration.PREF_SERVER},
        {"proxyURL", SourceConfiguration.PREF_PROXY},
        {"use_user_fiware_token", SourceConfiguration.PREF_USE_USER_FIWARE_TOKEN},
        {"use_owner_credentials", SourceConfiguration.PREF_USE_OWNER_CREDENTIALS},
        {"tenant", SourceConfiguration.PREF_TENANT},
        {"servicePath", SourceConfiguration.PREF_SERVICE_PATH},
        {"types", SourceConfiguration.PREF_ENTITIES},
        {"idPattern", SourceConfiguration.PREF_ID_FILTER},
        {"query", SourceConfiguration.PREF_QUERY},
        {"updateAttributes", SourceConfiguration.PREF_UPDATE_ATTRIBUTES}
    };

    // constructor
    public MetadataProcessor(ErrorLogger error_logger, PreferenceManager preference_manager) {
        super(error_logger, preference_manager);
    }

    // metadata describing the current preferences
    public Map<String, Object> exportMetadata() {
        LinkedHashMap<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("types", this.splitPref(SourceConfiguration.PREF_ENTITIES));
        metadata.put("filteredAttributes", "");
        metadata.put("updateAttributes", this.splitPref(SourceConfiguration.PREF_UPDATE_ATTRIBUTES));
        metadata.put("auth_type", "");
        metadata.put("idPattern", this.trimmedPref(SourceConfiguration.PREF_ID_FILTER));
        metadata.put("query", this.trimmedPref(SourceConfiguration.PREF_QUERY));
        metadata.put("values", false);
        metadata.put("serverURL", this.trimmedPref(SourceConfiguration.PREF_SERVER));
        metadata.put("proxyURL", this.trimmedPref(SourceConfiguration.PREF_PROXY));
        metadata.put("servicePath", this.trimmedPref(SourceConfiguration.PREF_SERVICE_PATH));
        metadata.put("tenant", this.trimmedPref(SourceConfiguration.PREF_TENANT));
        return metadata;
    }

    // write every non-null metadata value to its preference; returns the number written
    public int importMetadata(Map<String, Object> metadata) {
        int written = 0;
        if (metadata != null) {
            for (String[] row : METADATA_TABLE) {
                Object value = metadata.get(row[0]);
                if (value != null) {
                    this.preferences().set(row[1], this.toPreferenceValue(value));
                    ++written;
                }
            }
        }
        this.errorLogger().info("MetadataProcessor: imported " + written + " metadata value(s)");
        return written;
    }

    // metadata value -> preference string (lists are joined with ',')
    private String toPreferenceValue(Object value) {
        if (value instanceof Collection) {
            StringBuilder sb = new StringBuilder();
            boolean first = true;
            for (Object item : (Collection<?>) value) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(item);
                first = false;
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    // trimmed preference value
    private String trimmedPref(String key) {
        return Utils.trim(this.prefValue(key));
    }

    // trimmed preference value split on ','
    private List<String> splitPref(String key) {
        return Arrays.asList(this.trimmedPref(key).split(",", -1));
    }
}
