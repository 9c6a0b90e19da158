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

import java.util.List;

import org.orlo.netlist.Cell;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.Wire;

/**
 * Moves supported primitive cells from the host module into the gate graph.
 * Registers are taken only when they belong to the active clock domain;
 * cells of any other type stay in the host module.
 */
public class GateExtractor {

    /**
     * Extracts every supported cell of the list.
     * @param ctx Cycle context
     * @param cells Candidate cells, in the order they should be visited
     * @return Number of cells removed from the host module
     */
    public static int extractCells(MappingContext ctx, List<Cell> cells) {
        int count = 0;
        for (Cell cell : cells) {
            if (extractCell(ctx, cell)) count++;
        }
        return count;
    }

    /**
     * @return True if the cell was moved into the graph (and removed from its module).
     */
    public static boolean extractCell(MappingContext ctx, Cell cell) {
        Module module = ctx.getModule();
        GateGraph graph = ctx.getGraph();

        if (ClockDomainKey.isRegisterType(cell.getType())) {
            if (!ctx.getDomain().matches(cell, ctx.getSigMap())) {
                return false;
            }
            SigBit d = getPinBit(cell, "D");
            SigSpec q = cell.getPort("Q");
            SigBit qBit = getPinBit(cell, "Q");
            if (ctx.isKeepff()) {
                for (SigBit b : q) {
                    Wire w = b.getWire();
                    if (w != null) w.setAttribute(Wire.KEEP, 1);
                }
            }
            graph.mapSignal(qBit, GateType.FF, graph.mapSignal(d));
            module.removeCell(cell);
            return true;
        }

        GateType type = GateType.fromHostType(cell.getType());
        if (type == null) {
            return false;
        }
        List<String> pins = type.getInputPins();
        int[] mapped = new int[pins.size()];
        for (int i = 0; i < pins.size(); i++) {
            mapped[i] = graph.mapSignal(getPinBit(cell, pins.get(i)));
        }
        graph.mapSignal(getPinBit(cell, GateType.OUTPUT_PIN), type, mapped);
        module.removeCell(cell);
        return true;
    }

    private static SigBit getPinBit(Cell cell, String pin) {
        SigSpec sig = cell.getPort(pin);
        if (sig.size() != 1) {
            throw new RuntimeException("ERROR: Cell " + cell.getName() + " of type " + cell.getType()
                    + " has " + sig.size() + " bits connected to pin " + pin + ", expected exactly one.");
        }
        return sig.get(0);
    }
}
