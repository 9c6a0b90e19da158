/*
 * Copyright (c) 2026, Orlo Authors.
 * All rights reserved.
 *
 * This file is part of Orlo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package org.orlo.netlist;

import java.util.Collections;
import java.util.Map;

/**
 * An instance of a primitive or library cell inside a {@link Module}. Port
 * connections, parameters and recorded port directions keep insertion order.
 */
public class Cell extends PropertyObject {

    private final Module module;

    private String type;

    private Map<String, SigSpec> connections;

    private Map<String, String> parameters;

    private Map<String, PortDirection> portDirections;

    Cell(Module module, String name, String type) {
        super(name);
        this.module = module;
        this.type = type;
    }

    public Module getModule() {
        return module;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public void setPort(String port, SigSpec sig) {
        if (connections == null) connections = getNewMap();
        connections.put(port, sig);
    }

    public void setPort(String port, Wire wire) {
        setPort(port, SigSpec.of(wire));
    }

    /**
     * @param port Name of the port
     * @return The connected signal, or an empty signal if the port is unconnected.
     */
    public SigSpec getPort(String port) {
        if (connections == null) return SigSpec.EMPTY;
        SigSpec sig = connections.get(port);
        return sig == null ? SigSpec.EMPTY : sig;
    }

    public Map<String, SigSpec> getConnections() {
        return connections == null ? Collections.emptyMap() : Collections.unmodifiableMap(connections);
    }

    public void setParameter(String key, String value) {
        if (parameters == null) parameters = getNewMap();
        parameters.put(key, value);
    }

    public void setParameter(String key, int value) {
        setParameter(key, Const.fromInt(value, 32));
    }

    public String getParameter(String key) {
        return parameters == null ? null : parameters.get(key);
    }

    public Map<String, String> getParameters() {
        return parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(parameters);
    }

    public void setPortDirection(String port, PortDirection dir) {
        if (portDirections == null) portDirections = getNewMap();
        portDirections.put(port, dir);
    }

    public Map<String, PortDirection> getPortDirections() {
        return portDirections == null ? Collections.emptyMap() : Collections.unmodifiableMap(portDirections);
    }

    @Override
    public String toString() {
        return getName() + " (" + type + ")";
    }
}
