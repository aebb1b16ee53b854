/**
 * @file EntityFormatTranslator.java
 * @brief NGSI normalized to keyValues entity translator
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates normalized NGSI entities into their keyValues form
 *
 * @author Doug Anson
 */
public class EntityFormatTranslator {
    public static final String ID_KEY = "id";
    public static final String TYPE_KEY = "type";
    public static final String VALUE_KEY = "value";

    // static only
    private EntityFormatTranslator() {
    }

    // {id, type, attr: {value: v, ...}} -> {id, type, attr: v}
    public static Map<String, Object> toKeyValues(Map<String, Object> entity) {
        if (entity == null) {
            return null;
        }
        LinkedHashMap<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : entity.entrySet()) {
            String key = entry.getKey();
            Object attribute = entry.getValue();
            if (ID_KEY.equals(key) || TYPE_KEY.equals(key)) {
                result.put(key, attribute);
            }
            else if (attribute instanceof Map) {
                result.put(key, ((Map<?, ?>) attribute).get(VALUE_KEY));
            }
            else {
                // not an attribute object: keep as-is
                result.put(key, attribute);
            }
        }
        return result;
    }

    // translate a batch
    public static List<Map<String, Object>> toKeyValues(List<Map<String, Object>> entities) {
        ArrayList<Map<String, Object>> results = new ArrayList<>();
        if (entities != null) {
            for (Map<String, Object> entity : entities) {
                results.add(EntityFormatTranslator.toKeyValues(entity));
            }
        }
        return results;
    }
}
