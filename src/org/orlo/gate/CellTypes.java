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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.Wire;

/**
 * Knows which ports of a cell are inputs and which are outputs. Built-in gate,
 * register and LUT types are known up front; other cells fall back to the
 * directions recorded on the cell and then to the ports of a design module of
 * the same name.
 */
public class CellTypes {

    private final Map<String, Set<String>> inputs = new HashMap<>();

    private final Map<String, Set<String>> outputs = new HashMap<>();

    private final Design design;

    public CellTypes(Design design) {
        this.design = design;
        for (GateType t : GateType.values()) {
            if (t.getHostType() != null) {
                setup(t.getHostType(), t.getInputPins().toArray(new String[0]), GateType.OUTPUT_PIN);
            }
        }
        for (WideMuxType t : WideMuxType.values()) {
            setup(t.getHostType(), t.getInputPins().toArray(new String[0]), GateType.OUTPUT_PIN);
        }
        setup(ClockDomainKey.DFF_P, new String[]{"C", "D"}, "Q");
        setup(ClockDomainKey.DFF_N, new String[]{"C", "D"}, "Q");
        for (String pols : new String[]{"PP", "PN", "NP", "NN"}) {
            setup(ClockDomainKey.DFFE_PREFIX + pols + "_", new String[]{"C", "D", "E"}, "Q");
        }
        setup("$lut", new String[]{"A"}, "Y");
        setup("$sop", new String[]{"A"}, "Y");
    }

    private void setup(String type, String[] in, String out) {
        inputs.put(type, new HashSet<>(Arrays.asList(in)));
        outputs.put(type, new HashSet<>(Arrays.asList(out)));
    }

    public boolean isInput(Cell cell, String port) {
        PortDirection dir = getDirection(cell, port);
        return dir != null && dir.isInput();
    }

    public boolean isOutput(Cell cell, String port) {
        PortDirection dir = getDirection(cell, port);
        return dir != null && dir.isOutput();
    }

    private PortDirection getDirection(Cell cell, String port) {
        Set<String> in = inputs.get(cell.getType());
        if (in != null) {
            if (in.contains(port)) return PortDirection.INPUT;
            return outputs.get(cell.getType()).contains(port) ? PortDirection.OUTPUT : null;
        }
        PortDirection recorded = cell.getPortDirections().get(port);
        if (recorded != null) return recorded;
        if (design != null) {
            Module m = design.getModule(cell.getType());
            if (m != null) {
                Wire w = m.getWire(port);
                if (w != null && w.isPort()) return w.getDirection();
            }
        }
        return null;
    }
}
