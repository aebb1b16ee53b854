/**
 * @file EntityPage.java
 * @brief one page of an NGSI v2 entity listing
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One page of entity results plus the total count reported by the broker
 *
 * @author Doug Anson
 */
public class EntityPage {
    private final List<Map<String, Object>> m_results;
    private final int m_count;

    // constructor
    public EntityPage(List<Map<String, Object>> results, int count) {
        this.m_results = (results != null) ? results : new ArrayList<>();
        this.m_count = count;
    }

    // entities in this page
    public List<Map<String, Object>> results() {
        return this.m_results;
    }

    // total number of matching entities (Fiware-Total-Count)
    public int count() {
        return this.m_count;
    }
}
