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
package org.orlo.blif;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.orlo.gate.GateType;
import org.orlo.gate.WideMuxType;
import org.orlo.util.FileTools;

/**
 * Writes the built-in cell library in genlib format: constants, buffer and
 * inverter always, then the enabled gates and wide multiplexers.
 */
public class GenlibWriter {

    public static final String FILE_NAME = "stdcells.genlib";

    private static final GateType[] LIBRARY_ORDER = {
        GateType.BUF, GateType.NOT, GateType.AND, GateType.NAND, GateType.OR, GateType.NOR,
        GateType.XOR, GateType.XNOR, GateType.ANDNOT, GateType.ORNOT, GateType.AOI3, GateType.OAI3,
        GateType.AOI4, GateType.OAI4, GateType.MUX, GateType.NMUX
    };

    /**
     * @param enabledGates Library names of the enabled two to four input gates
     * @param muxes Enabled wide multiplexers
     * @param cmosCost Select the CMOS cost table
     * @return The library, one gate per line
     */
    public static List<String> render(Set<String> enabledGates, Set<WideMuxType> muxes, boolean cmosCost) {
        List<String> lines = new ArrayList<>();
        lines.add("GATE ZERO    1 Y=CONST0;");
        lines.add("GATE ONE     1 Y=CONST1;");
        for (GateType t : LIBRARY_ORDER) {
            if (t != GateType.BUF && t != GateType.NOT && !enabledGates.contains(t.getLibName())) continue;
            lines.add(gateLine(t.getLibName(), t.getCost(cmosCost), t.getGenlibFunction(), t.getPolarity()));
        }
        for (WideMuxType m : WideMuxType.values()) {
            if (!muxes.contains(m)) continue;
            lines.add(gateLine(m.getLibName(), m.getCost(cmosCost), m.getGenlibFunction(), GateType.Polarity.UNKNOWN));
        }
        return lines;
    }

    private static String gateLine(String name, int cost, String function, GateType.Polarity polarity) {
        return String.format("GATE %-6s %d %-21s PIN * %-7s 1 999 1 0 1 0", name, cost, function + ";", polarity);
    }

    public static void write(File file, Set<String> enabledGates, Set<WideMuxType> muxes, boolean cmosCost) {
        FileTools.writeLinesToTextFile(render(enabledGates, muxes, cmosCost), file.getPath());
    }
}
