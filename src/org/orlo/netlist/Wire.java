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

/**
 * A named, fixed-width signal inside a {@link Module}. A wire with a non-zero
 * port index is a module port.
 */
public class Wire extends PropertyObject {

    public static final String KEEP = "keep";
    public static final String INIT = "init";
    public static final String SRC = "src";

    private final Module module;

    private final int width;

    private PortDirection direction;

    private int portId;

    Wire(Module module, String name, int width) {
        super(name);
        if (width < 1) {
            throw new RuntimeException("ERROR: Wire " + name + " must be at least one bit wide");
        }
        this.module = module;
        this.width = width;
    }

    public Module getModule() {
        return module;
    }

    public int getWidth() {
        return width;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public int getPortId() {
        return portId;
    }

    public boolean isPort() {
        return portId > 0;
    }

    public void setPort(PortDirection direction, int portId) {
        this.direction = direction;
        this.portId = portId;
    }

    public boolean isKeep() {
        return getBoolAttribute(KEEP);
    }

    public SigBit getBit(int offset) {
        return new SigBit(this, offset);
    }

    public SigSpec getSigSpec() {
        return SigSpec.of(this);
    }
}
