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
package org.orlo.gate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Wide multiplexers. They are never extracted from the host design; the
 * optimizer may produce them from the built-in library when enabled.
 */
public enum WideMuxType {
    MUX4("$_MUX4_", 2, pins("A", "B", "C", "D", "S", "T"),
            "Y=(!S*!T*A)+(S*!T*B)+(!S*T*C)+(S*T*D)"),
    MUX8("$_MUX8_", 4, pins("A", "B", "C", "D", "E", "F", "G", "H", "S", "T", "U"),
            "Y=(!S*!T*!U*A)+(S*!T*!U*B)+(!S*T*!U*C)+(S*T*!U*D)+(!S*!T*U*E)+(S*!T*U*F)+(!S*T*U*G)+(S*T*U*H)"),
    MUX16("$_MUX16_", 8, pins("A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K", "L", "M", "N", "O", "P",
            "S", "T", "U", "V"),
            "Y=(!S*!T*!U*!V*A)+(S*!T*!U*!V*B)+(!S*T*!U*!V*C)+(S*T*!U*!V*D)+(!S*!T*U*!V*E)+(S*!T*U*!V*F)"
            + "+(!S*T*U*!V*G)+(S*T*U*!V*H)+(!S*!T*!U*V*I)+(S*!T*!U*V*J)+(!S*T*!U*V*K)+(S*T*!U*V*L)"
            + "+(!S*!T*U*V*M)+(S*!T*U*V*N)+(!S*T*U*V*O)+(S*T*U*V*P)");

    private final String hostType;
    private final int muxCostFactor;
    private final List<String> inputPins;
    private final String genlibFunction;

    WideMuxType(String hostType, int muxCostFactor, List<String> inputPins, String genlibFunction) {
        this.hostType = hostType;
        this.muxCostFactor = muxCostFactor;
        this.inputPins = inputPins;
        this.genlibFunction = genlibFunction;
    }

    private static List<String> pins(String... pins) {
        return Collections.unmodifiableList(Arrays.asList(pins));
    }

    public String getHostType() {
        return hostType;
    }

    public String getLibName() {
        return name();
    }

    public List<String> getInputPins() {
        return inputPins;
    }

    public String getGenlibFunction() {
        return genlibFunction;
    }

    public int getCost(boolean cmos) {
        return muxCostFactor * GateType.MUX.getCost(cmos);
    }

    public static WideMuxType fromLibName(String libName) {
        for (WideMuxType t : values()) {
            if (t.name().equals(libName)) return t;
        }
        return null;
    }
}
