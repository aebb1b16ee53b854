/**
 * @file BaseClass.java
 * @brief base class for most classes defined in ngsi-source-bridge
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

import org.fiware.ngsi.source.preferences.PreferenceManager;

/**
 * Base Class for fundamental base class for ngsi-source-bridge
 *
 * @author Doug Anson
 */
public class BaseClass {

    private ErrorLogger m_error_logger = null;
    private PreferenceManager m_preference_manager = null;

    /**
     * default constructor
     * @param error_logger
     * @param preference_manager
     */
    public BaseClass(ErrorLogger error_logger, PreferenceManager preference_manager) {
        this.m_error_logger = error_logger;
        this.m_preference_manager = preference_manager;
    }

    /**
     * Get our error handler
     * @return
     */
    public ErrorLogger errorLogger() {
        return this.m_error_logger;
    }

    /**
     * Get the preferences manager
     * @return
     */
    public PreferenceManager preferences() {
        return this.m_preference_manager;
    }

    /**
     * get a preference value
     * @param key
     * @return
     */
    protected String prefValue(String key) {
        if (this.m_preference_manager != null) {
            return this.m_preference_manager.valueOf(key);
        }
        return null;
    }

    /**
     * get a preference value with a default if none exists
     * @param key
     * @param def_value
     * @return
     */
    protected String prefValueWithDefault(String key, String def_value) {
        String value = this.prefValue(key);
        if (value != null && value.length() > 0) {
            return value;
        }
        return def_value;
    }

    /**
     * get an integer preference value
     * @param key
     * @return
     */
    protected int prefIntValue(String key) {
        if (this.m_preference_manager != null) {
            return this.m_preference_manager.intValueOf(key);
        }
        return -1;
    }

    /**
     * get a long preference value
     * @param key
     * @return
     */
    protected long prefLongValue(String key) {
        if (this.m_preference_manager != null) {
            return this.m_preference_manager.longValueOf(key);
        }
        return -1;
    }

    /**
     * get a boolean preference value
     * @param key
     * @return
     */
    protected boolean prefBoolValue(String key) {
        if (this.m_preference_manager != null) {
            return this.m_preference_manager.booleanValueOf(key);
        }
        return false;
    }
}
