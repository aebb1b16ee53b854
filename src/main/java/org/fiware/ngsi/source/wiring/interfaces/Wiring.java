/**
 * @file Wiring.java
 * @brief wiring bus interface
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
package org.fiware.ngsi.source.wiring.interfaces;

/**
 * Wiring Interface: the event bus between the source and its consumers
 * @author Doug Anson
 */
public interface Wiring {
    // is an output endpoint connected to at least one consumer?
    public boolean isOutputConnected(String endpoint);

    // is an input endpoint connected to a producer?
    public boolean isInputConnected(String endpoint);

    // push an event on an output endpoint
    public void pushEvent(String endpoint, Object data);

    // register the (single) handler of an input endpoint
    public void registerCallback(String endpoint, WiringCallback callback);

    // register a callback invoked when connections change
    public void registerStatusCallback(Runnable callback);
}
