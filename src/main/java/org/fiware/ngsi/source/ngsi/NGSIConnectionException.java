/**
 * @file NGSIConnectionException.java
 * @brief NGSI connectivity failure
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
 * The context broker could not be reached
 *
 * @author Doug Anson
 */
public class NGSIConnectionException extends NGSIException {
    private static final long serialVersionUID = 1L;

    public NGSIConnectionException(String message) {
        super(message);
    }

    public NGSIConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
