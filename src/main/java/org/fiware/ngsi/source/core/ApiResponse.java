/**
 * @file ApiResponse.java
 * @brief HTTP API Response
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

import java.util.HashMap;

/**
 * API Response class: outcome of a single HTTP dispatch
 *
 * @author Doug Anson
 */
public class ApiResponse {
    /**
     * no response has been recorded yet
     */
    public static final int NO_RESPONSE_CODE = 900;

    /**
     * transport failed before any HTTP status was received
     */
    public static final int TRANSPORT_FAILURE_CODE = 599;

    private final String m_request_verb;
    private final String m_request_url;
    private final String m_request_data;
    private final String m_content_type;
    private int m_response_http_code;
    private String m_response_data;
    private final HashMap<String, String> m_response_headers;
    private Exception m_exception;

    // default constructor
    public ApiResponse(String verb, String url, String data, String content_type) {
        this.m_request_verb = verb;
        this.m_request_url = url;
        this.m_request_data = data;
        this.m_content_type = content_type;
        this.m_response_http_code = NO_RESPONSE_CODE;
        this.m_response_data = "";
        this.m_response_headers = new HashMap<>();
        this.m_exception = null;
    }

    // set the response data
    public void setReplyData(String response_data) {
        this.m_response_data = response_data;
    }

    // set the HTTP response code
    public void setHttpCode(int http_code) {
        this.m_response_http_code = http_code;
    }

    // record a response header (names are kept lower case)
    public void setHeader(String name, String value) {
        if (name != null) {
            this.m_response_headers.put(name.toLowerCase(), value);
        }
    }

    // record the transport exception
    public void setException(Exception ex) {
        this.m_exception = ex;
        this.m_response_http_code = TRANSPORT_FAILURE_CODE;
    }

    // get the HTTP response code
    public int getHttpCode() {
        return this.m_response_http_code;
    }

    // get the response data
    public String getReplyData() {
        return this.m_response_data;
    }

    // get a response header (case insensitive)
    public String getHeader(String name) {
        if (name != null) {
            return this.m_response_headers.get(name.toLowerCase());
        }
        return null;
    }

    // the transport exception, if any
    public Exception getException() {
        return this.m_exception;
    }

    // did the transport fail outright?
    public boolean transportFailed() {
        return this.m_exception != null;
    }

    // 2xx response?
    public boolean isOK() {
        return this.m_exception == null && Utils.httpResponseCodeOK(this.m_response_http_code);
    }

    // get the content type
    public String getContentType() {
        return this.m_content_type;
    }

    // get the request URL
    public String getRequestURL() {
        return this.m_request_url;
    }

    // get the request data
    public String getRequestData() {
        return this.m_request_data;
    }

    // get the request http verb
    public String getRequestVerb() {
        return this.m_request_verb;
    }

    @Override
    public String toString() {
        return "ApiResponse(" + this.m_request_verb + " " + this.m_request_url + " CODE: " + this.m_response_http_code + ")";
    }
}
