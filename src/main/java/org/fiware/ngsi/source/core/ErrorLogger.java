/**
 * @file ErrorLogger.java
 * @brief error logging facility
 * @author Doug Anson
 * @version 1.0
 * @see
 *
 * Copyright 2018. ARM Ltd. All rights reserved.
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
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Error Logger - log bridge messages to the SLF4J logging facility
 *
 * @author Doug Anson
 */
public class ErrorLogger extends BaseClass {
    /**
     * default message
     */
    public static final String DEFAULT_MESSAGE = "<No Message-OK>";

    /**
     * Informational message
     */
    public static final int INFO = 0x0001;     // informational

    /**
     * Warning message
     */
    public static final int WARNING = 0x0002;     // warning

    /**
     * Critical message
     */
    public static final int CRITICAL = 0x0004;     // critical error

    /**
     * masks
     */
    public static final int SHOW_ALL = 0x00FF;     // show all
    public static final int SHOW_INFO = 0x0001;     // show INFO only
    public static final int SHOW_WARNING = 0x0002;     // show WARNING only
    public static final int SHOW_CRITICAL = 0x0004;     // show CRITICAL only

    /**
     * maximum number of tracked log entries
     */
    public static final int MAX_LOG_ENTRIES = 500;      // reset the list after retaining this many entries

    // SLF4J logging instance
    private final Logger m_slf4j_logger;

    private int m_mask = SHOW_ALL;                      // default error classification mask
    private final ArrayList<String> m_log;              // error log
    private String m_bridge_error_level = null;         // our preference

    /**
     * constructor
     */
    public ErrorLogger() {
        this(LoggerFactory.getLogger(ErrorLogger.class));
    }

    /**
     * constructor with a specific SLF4J logger
     * @param logger
     */
    public ErrorLogger(Logger logger) {
        super(null, null);
        this.m_slf4j_logger = logger;
        this.m_mask = ErrorLogger.SHOW_ALL;
        this.m_log = new ArrayList<>();
        this.m_bridge_error_level = null;
    }

    /*
     * Configure the logging level
     */
    public void configureLoggingLevel(PreferenceManager preferences) {
        if (this.m_bridge_error_level == null) {
            // get once only...
            this.m_bridge_error_level = preferences.valueOf("bridge_error_level");
        }
        if (this.m_bridge_error_level != null && this.m_bridge_error_level.length() > 0) {
            int mask = 0;
            if (this.m_bridge_error_level.contains("all")) {
                mask = ErrorLogger.SHOW_ALL;
            }
            if (this.m_bridge_error_level.contains("critical")) {
                mask |= ErrorLogger.SHOW_CRITICAL;
            }
            if (this.m_bridge_error_level.contains("warning")) {
                mask |= ErrorLogger.SHOW_WARNING;
            }
            if (this.m_bridge_error_level.contains("info")) {
                mask |= ErrorLogger.SHOW_INFO;
            }
            this.m_mask = mask;
        }
    }

    // get the current logging mask
    public int loggingMask() {
        return this.m_mask;
    }

    // most recent buffered entries (oldest first)
    public synchronized List<String> lastEntries() {
        return new ArrayList<>(this.m_log);
    }

    // buffer the log entry
    private synchronized void buffer(String entry) {
        if (entry != null && entry.length() > 0) {
            if (this.m_log.size() >= MAX_LOG_ENTRIES) {
                this.m_log.clear();
            }
            this.m_log.add(entry);
        }
    }

    /**
     * info message
     * @param message
     */
    public void info(String message) {
        this.log(ErrorLogger.INFO, message, null);
    }

    /**
     * warning message
     * @param message
     */
    public void warning(String message) {
        this.log(ErrorLogger.WARNING, message, null);
    }

    /**
     * critical message
     * @param message
     */
    public void critical(String message) {
        this.log(ErrorLogger.CRITICAL, message, null);
    }

    /**
     * info message with exception
     * @param message
     * @param ex
     */
    public void info(String message, Throwable ex) {
        this.log(ErrorLogger.INFO, message, ex);
    }

    /**
     * warning message with exception
     * @param message
     * @param ex
     */
    public void warning(String message, Throwable ex) {
        this.log(ErrorLogger.WARNING, message, ex);
    }

    /**
     * critical message with exception
     * @param message
     * @param ex
     */
    public void critical(String message, Throwable ex) {
        this.log(ErrorLogger.CRITICAL, message, ex);
    }

    // log a message (base)
    private void log(int level, String message, Throwable exception) {
        if ((this.m_mask & level) == 0) {
            return;
        }
        if (message == null) {
            message = (exception != null) ? ErrorLogger.DEFAULT_MESSAGE : "UNKNOWN ERROR";
        }
        if (exception != null) {
            this.buffer(message + " Exception: " + exception);
        }
        else {
            this.buffer(message);
        }
        this.logit(level, message, exception);
    }

    // dispatch to SLF4J
    private void logit(int level, String message, Throwable exception) {
        switch (level) {
            case ErrorLogger.CRITICAL:
                this.m_slf4j_logger.error(message, exception);
                break;
            case ErrorLogger.WARNING:
                this.m_slf4j_logger.warn(message, exception);
                break;
            default:
                this.m_slf4j_logger.info(message, exception);
                break;
        }
    }
}
