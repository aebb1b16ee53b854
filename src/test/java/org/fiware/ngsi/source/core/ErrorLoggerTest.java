/**
 * @file ErrorLoggerTest.java
 * @brief error logger tests
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.fiware.ngsi.source.preferences.PreferenceManager;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class ErrorLoggerTest {
    private static PreferenceManager preferences(ErrorLogger logger, String level) {
        Properties properties = new Properties();
        properties.setProperty("bridge_error_level", level);
        return new PreferenceManager(logger, "test", properties);
    }

    @Test
    void testEntriesAreBuffered() {
        ErrorLogger logger = new ErrorLogger();
        logger.info("Subscription created successfully (id: 5a1b)");
        logger.critical("Error retrieving initial values", new IllegalStateException("broker down"));

        List<String> entries = logger.lastEntries();
        assertEquals(2, entries.size());
        assertEquals("Subscription created successfully (id: 5a1b)", entries.get(0));
        assertTrue(entries.get(1).startsWith("Error retrieving initial values"));
        assertTrue(entries.get(1).contains("broker down"));
    }

    @Test
    void testMaskFiltersLevels() {
        ErrorLogger logger = new ErrorLogger();
        logger.configureLoggingLevel(preferences(logger, "warning,critical"));

        logger.info("hidden");
        logger.warning("shown warning");
        logger.critical("shown critical");

        assertEquals(ErrorLogger.SHOW_WARNING | ErrorLogger.SHOW_CRITICAL, logger.loggingMask());
        assertEquals(2, logger.lastEntries().size());
        assertEquals("shown warning", logger.lastEntries().get(0));
    }

    @Test
    void testBufferIsBounded() {
        ErrorLogger logger = new ErrorLogger();
        for (int i = 0; i <= ErrorLogger.MAX_LOG_ENTRIES; ++i) {
            logger.info("entry " + i);
        }

        assertEquals(1, logger.lastEntries().size());
        assertEquals("entry " + ErrorLogger.MAX_LOG_ENTRIES, logger.lastEntries().get(0));
    }
}
