/**
 * @file NGSIBrokerException.java
 * @brief NGSI broker rejection
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

/**
 * The context broker answered with a non-2xx status
 *
 * @author Doug Anson
 */
public class NGSIBrokerException extends NGSIException {
    private static final long serialVersionUID = 1L;
    private final int m_http_code;
    private final String m_body;

    public NGSIBrokerException(String operation, int http_code, String body) {
        super(operation + " rejected by the context broker (HTTP " + http_code + "): " + body);
        this.m_http_code = http_code;
        this.m_body = body;
    }

    // HTTP status returned by the broker
    public int httpCode() {
        return this.m_http_code;
    }

    // raw reply body
    public String body() {
        return this.m_body;
    }
}
