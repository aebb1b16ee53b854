/**
 * @file EventsProcessor.java
 * @brief events servlet handler
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
package org.fiware.ngsi.source.servlet;

import org.fiware.ngsi.source.core.ErrorLogger;
import org.fiware.ngsi.source.preferences.PreferenceManager;
import org.fiware.ngsi.source.servlet.interfaces.ServletProcessor;
import java.io.IOException;
import java.io.PrintWriter;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Events Servlet Handler: broker notifications, metadata imports and preference updates
 *
 * @author Doug Anson
 */
public class EventsProcessor extends HttpServlet implements ServletProcessor {
    private static final long serialVersionUID = 1L;

    private transient Manager m_manager = null;
    private transient ErrorLogger m_error_logger = null;

    // constructor
    public EventsProcessor(ErrorLogger error_logger, PreferenceManager preferences) {
        this(error_logger, Manager.getInstance(error_logger, preferences));
    }

    // constructor with a given manager
    public EventsProcessor(ErrorLogger error_logger, Manager manager) {
        super();
        this.m_error_logger = error_logger;
        this.m_manager = manager;
    }

    // get our manager
    public Manager manager() {
        return this.m_manager;
    }

    // process an inbound event request
    protected void processRequest(HttpServletRequest request, HttpServletResponse response) {
        this.invokeRequest(request, response);
    }

    // invoke the event processing request
    @Override
    public void invokeRequest(HttpServletRequest request, HttpServletResponse response) {
        try {
            if (this.m_manager != null) {
                // process our event
                this.m_manager.processEvent(request, response);
            }
            else {
                // error - no Manager instance
                this.m_error_logger.warning("EventsProcessor: ERROR: Manager instance is NULL. Ignoring the event...");

                // send a response
                response.setContentType("application/json;charset=utf-8");
                response.setHeader("Pragma", "no-cache");
                PrintWriter out = response.getWriter();
                out.println("{}");
            }
        }
        catch (IOException ex) {
            this.m_error_logger.critical("EventsProcessor: Unable to send event response...", ex);
        }
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processRequest(request, response);
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processRequest(request, response);
    }

    @Override
    protected void doPut(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processRequest(request, response);
    }

    @Override
    protected void doDelete(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        processRequest(request, response);
    }

    /**
     * Returns a short description of the servlet.
     *
     * @return a String containing servlet description
     */
    @Override
    public String getServletInfo() {
        return "NGSI Source Bridge " + Manager.BRIDGE_VERSION_STR;
    }
}
