/**
 * @file EntityFormatTranslatorTest.java
 * @brief entity format translator tests
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class EntityFormatTranslatorTest {

    private static Map<String, Object> attribute(Object value, String type) {
        LinkedHashMap<String, Object> attribute = new LinkedHashMap<>();
        attribute.put("type", type);
        attribute.put("value", value);
        attribute.put("metadata", new LinkedHashMap<String, Object>());
        return attribute;
    }

    @Test
    void testUnwrapsAttributeValues() {
        LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", "e1");
        entity.put("type", "T");
        entity.put("a", attribute(5, "Number"));

        Map<String, Object> result = EntityFormatTranslator.toKeyValues(entity);

        LinkedHashMap<String, Object> expected = new LinkedHashMap<>();
        expected.put("id", "e1");
        expected.put("type", "T");
        expected.put("a", 5);
        assertEquals(expected, result);
    }

    @Test
    void testStructuredValuesAreKeptWhole() {
        LinkedHashMap<String, Object> location = new LinkedHashMap<>();
        location.put("type", "Point");
        location.put("coordinates", Arrays.asList(-3.7, 40.4));

        LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", "room1");
        entity.put("type", "Room");
        entity.put("location", attribute(location, "geo:json"));
        entity.put("name", attribute("Kitchen", "Text"));

        Map<String, Object> result = EntityFormatTranslator.toKeyValues(entity);

        assertEquals(location, result.get("location"));
        assertEquals("Kitchen", result.get("name"));
    }

    @Test
    void testNonObjectAttributesAreCopied() {
        LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", "e2");
        entity.put("type", "T");
        entity.put("raw", 12);

        Map<String, Object> result = EntityFormatTranslator.toKeyValues(entity);

        assertEquals(12, result.get("raw"));
    }

    @Test
    void testAttributeWithoutValue() {
        LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", "e3");
        entity.put("type", "T");
        entity.put("empty", new LinkedHashMap<String, Object>());

        Map<String, Object> result = EntityFormatTranslator.toKeyValues(entity);

        assertTrue(result.containsKey("empty"));
        assertNull(result.get("empty"));
    }

    @Test
    void testBatchKeepsOrder() {
        List<Map<String, Object>> entities = new ArrayList<>();
        for (int i = 0; i < 3; ++i) {
            LinkedHashMap<String, Object> entity = new LinkedHashMap<>();
            entity.put("id", "e" + i);
            entity.put("type", "T");
            entity.put("n", attribute(i, "Number"));
            entities.add(entity);
        }

        List<Map<String, Object>> results = EntityFormatTranslator.toKeyValues(entities);

        assertEquals(3, results.size());
        for (int i = 0; i < 3; ++i) {
            assertEquals("e" + i, results.get(i).get("id"));
            assertEquals(i, results.get(i).get("n"));
        }
        assertTrue(EntityFormatTranslator.toKeyValues((List<Map<String, Object>>) null).isEmpty());
    }
}
