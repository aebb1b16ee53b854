/**
 * @file PreferenceListener.java
 * @brief preference change listener interface
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
package org.fiware.ngsi.source.preferences.interfaces;

import java.util.Map;

/**
 * Preference Listener Interface
 *
 * @author Doug Anson
 */
public interface PreferenceListener {
    // one or more preferences have changed (changed keys and their new values)
    public void preferencesChanged(Map<String, String> changes);
}
