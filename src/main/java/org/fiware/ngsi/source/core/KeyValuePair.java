/**
 * @file KeyValuePair.java
 * @brief simple key/value pair (HTTP headers and the like)
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
package org.fiware.ngsi.source.core;

/**
 * Key/Value pair
 *
 * @author Doug Anson
 */
public class KeyValuePair {
    private final String m_key;
    private final String m_value;

    // constructor
    public KeyValuePair(String key, String value) {
        this.m_key = key;
        this.m_value = value;
    }

    // key
    public String key() {
        return this.m_key;
    }

    // value
    public String value() {
        return this.m_value;
    }

    // same key (case insensitive) and value
    public boolean same(KeyValuePair kvp) {
        if (kvp != null && this.m_key != null && this.m_key.equalsIgnoreCase(kvp.key())) {
            if (this.m_value == null) {
                return kvp.value() == null;
            }
            return this.m_value.equals(kvp.value());
        }
        return false;
    }

    @Override
    public String toString() {
        return this.m_key + ": " + this.m_value;
    }
}
