/**
 * @file PreferenceManager.java
 * @brief preferences manager
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
package org.fiware.ngsi.source.preferences;

import org.fiware.ngsi.source.core.BaseClass;
import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.interfaces.PreferenceListener;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * preferences manager
 *
 * @author Doug Anson
 */
public class PreferenceManager extends BaseClass {
    // DEBUG tag
    private static final String DEFAULT_LOG_TAG = "PreferenceManager";

    // Config Tags
    private static final String SERVICE_PROPERTIES_FILE_TAG = "config_file";      // passed as -Dconfig_file="../conf/service.properties"

    // Defaults
    private static final int DEFAULT_INT_VALUE = -1;
    private static final long DEFAULT_LONG_VALUE = -1;
    private static final String DEFAULT_PROPERTIES_FILE = "service.properties";

    private String m_properties_file = null;
    private final Properties m_config_properties;
    private String m_log_tag = DEFAULT_LOG_TAG;
    private final List<PreferenceListener> m_listeners;

    // constructor
    public PreferenceManager(ErrorLogger error_logger, String log_tag) {
        super(error_logger, null);
        this.m_properties_file = DEFAULT_PROPERTIES_FILE;
        this.m_log_tag = (log_tag != null) ? log_tag : DEFAULT_LOG_TAG;
        this.m_config_properties = new Properties();
        this.m_listeners = new CopyOnWriteArrayList<>();
        this.readPreferencesFile();
    }

    // constructor with supplied properties (no file is read)
    public PreferenceManager(ErrorLogger error_logger, String log_tag, Properties properties) {
        super(error_logger, null);
        this.m_properties_file = null;
        this.m_log_tag = (log_tag != null) ? log_tag : DEFAULT_LOG_TAG;
        this.m_config_properties = new Properties();
        if (properties != null) {
            this.m_config_properties.putAll(properties);
        }
        this.m_listeners = new CopyOnWriteArrayList<>();
    }

    // register a preference change listener
    public void registerCallback(PreferenceListener listener) {
        if (listener != null && !this.m_listeners.contains(listener)) {
            this.m_listeners.add(listener);
        }
    }

    // remove a preference change listener
    public void unregisterCallback(PreferenceListener listener) {
        this.m_listeners.remove(listener);
    }

    public boolean booleanValueOf(String key) {
        boolean result = false;
        String value = this.valueOf(key);
        if (value != null && value.length() > 0 && value.trim().equalsIgnoreCase("true")) {
            result = true;
        }
        return result;
    }

    public int intValueOf(String key) {
        int result = DEFAULT_INT_VALUE;
        String value = this.valueOf(key);
        try {
            if (value != null && value.length() > 0) {
                result = Integer.parseInt(value.trim());
            }
        }
        catch (NumberFormatException ex) {
            result = DEFAULT_INT_VALUE;
        }
        return result;
    }

    public long longValueOf(String key) {
        long result = DEFAULT_LONG_VALUE;
        String value = this.valueOf(key);
        try {
            if (value != null && value.length() > 0) {
                result = Long.parseLong(value.trim());
            }
        }
        catch (NumberFormatException ex) {
            result = DEFAULT_LONG_VALUE;
        }
        return result;
    }

    public String valueOf(String key) {
        if (key != null) {
            return this.m_config_properties.getProperty(key);
        }
        return null;
    }

    // set a single preference without notifying listeners
    public void set(String key, String value) {
        if (key != null) {
            if (value != null) {
                this.m_config_properties.setProperty(key, value);
            }
            else {
                this.m_config_properties.remove(key);
            }
        }
    }

    // update a set of preferences and notify the listeners of the ones that changed
    public void update(Map<String, String> values) {
        HashMap<String, String> changes = new HashMap<>();
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                String current = this.valueOf(entry.getKey());
                String updated = entry.getValue();
                boolean same = (current == null) ? updated == null : current.equals(updated);
                if (!same) {
                    this.set(entry.getKey(), updated);
                    changes.put(entry.getKey(), updated);
                }
            }
        }
        if (!changes.isEmpty()) {
            this.notifyListeners(changes);
        }
    }

    // re-read the preference file (if any) and notify listeners
    public void reload() {
        if (this.m_properties_file != null) {
            this.readPreferencesFile();
        }
        HashMap<String, String> all = new HashMap<>();
        for (String key : this.m_config_properties.stringPropertyNames()) {
            all.put(key, this.m_config_properties.getProperty(key));
        }
        this.notifyListeners(all);
    }

    // notify listeners
    private void notifyListeners(Map<String, String> changes) {
        ArrayList<PreferenceListener> listeners = new ArrayList<>(this.m_listeners);
        for (PreferenceListener listener : listeners) {
            try {
                listener.preferencesChanged(changes);
            }
            catch (RuntimeException ex) {
                this.errorLogger().warning(this.m_log_tag + ": preference listener failed: " + ex.getMessage(), ex);
            }
        }
    }

    // read the preferences file
    private boolean readPreferencesFile() {
        boolean success = false;
        String file = System.getProperty(PreferenceManager.SERVICE_PROPERTIES_FILE_TAG);
        if (file != null && file.length() > 0) {
            this.m_properties_file = file;
            success = this.readPreferencesFile(file, false);
            if (!success) {
                this.errorLogger().warning(this.m_log_tag + ": WARNING - Unable to read specified config file: " + file + " trying default: " + PreferenceManager.DEFAULT_PROPERTIES_FILE);
            }
        }
        if (!success) {
            this.m_properties_file = PreferenceManager.DEFAULT_PROPERTIES_FILE;
            success = this.readPreferencesFile(PreferenceManager.DEFAULT_PROPERTIES_FILE, true);
        }
        return success;
    }

    // read the configuration properties file (filesystem or classpath)
    private boolean readPreferencesFile(String file, boolean classpath) {
        boolean success = false;
        InputStream input = null;
        try {
            if (classpath) {
                input = PreferenceManager.class.getClassLoader().getResourceAsStream(file);
            }
            else {
                input = new FileInputStream(file);
            }
            if (input != null) {
                this.m_config_properties.load(input);
                success = true;
                this.errorLogger().info(this.m_log_tag + ": Read configuration file: " + file);
            }
            else {
                this.errorLogger().warning(this.m_log_tag + ": Unable to locate configuration file: " + file);
            }
        }
        catch (IOException ex) {
            this.errorLogger().warning(this.m_log_tag + ": Unable to read configuration file: " + file + " Exception: " + ex.getMessage());
        }
        finally {
            if (input != null) {
                try {
                    input.close();
                }
                catch (IOException ex) {
                    this.errorLogger().info(this.m_log_tag + ": error closing configuration file: " + ex.getMessage());
                }
            }
        }
        return success;
    }
}
