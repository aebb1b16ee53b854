/**
 * @file JSONParser.java
 * @brief JSON parser wrapper
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
package org.fiware.ngsi.source.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fiware.ngsi.source.core.ErrorLogger;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSON Parser wrapper class
 * @author Doug Anson
 */
public class JSONParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final ErrorLogger m_error_logger;

    // default constructor
    public JSONParser() {
        this(null);
    }

    // constructor with a logger for parse failures
    public JSONParser(ErrorLogger error_logger) {
        this.m_error_logger = error_logger;
    }

    // parse JSON into Map (null if not a JSON object)
    public Map<String, Object> parseJson(String json) {
        if (json != null && json.trim().length() > 0) {
            try {
                return MAPPER.readValue(json, new TypeReference<Map<String, Object>>(){});
            }
            catch (IOException ex) {
                this.parseFailed("parseJson", json, ex);
            }
        }
        return null;
    }

    // parse JSON into Array (List) of objects (null if not a JSON array of objects)
    public List<Map<String, Object>> parseJsonToArray(String json) {
        if (json != null && json.trim().length() > 0) {
            try {
                return MAPPER.readValue(json, new TypeReference<List<Map<String, Object>>>(){});
            }
            catch (IOException ex) {
                this.parseFailed("parseJsonToArray", json, ex);
            }
        }
        return null;
    }

    // parse any JSON value (objects, arrays, scalars or null)
    public Object parseJsonValue(String json) {
        if (json != null && json.trim().length() > 0) {
            try {
                return MAPPER.readValue(json, Object.class);
            }
            catch (IOException ex) {
                this.parseFailed("parseJsonValue", json, ex);
            }
        }
        return null;
    }

    // record a parse failure
    private void parseFailed(String method, String json, IOException ex) {
        if (this.m_error_logger != null) {
            this.m_error_logger.warning("JSONParser: " + method + ": unable to parse: " + json + " Exception: " + ex.getMessage());
        }
    }
}
