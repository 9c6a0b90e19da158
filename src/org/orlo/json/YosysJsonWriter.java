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
package org.orlo.json;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import org.json.JSONArray;
import org.json.JSONObject;
import org.orlo.gate.CellTypes;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.PropertyObject;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.Wire;
import org.orlo.util.FileTools;

/**
 * Writes a design in the Yosys JSON netlist format. Aliased bits are resolved
 * through the module's {@link SigMap} so that every alias class shares one bit
 * id; module connections are not written otherwise.
 */
public class YosysJsonWriter {

    public static final String CREATOR = "Orlo";

    /** Bit ids 0 and 1 are reserved for the constants */
    private static final int FIRST_BIT_ID = 2;

    public static void write(Design design, File file) {
        FileTools.writeStringToTextFile(toJson(design).toString(2), file.getPath());
    }

    public static JSONObject toJson(Design design) {
        JSONObject root = new JSONObject();
        root.put("creator", CREATOR);
        root.put(YosysJsonReader.AUTOIDX, design.getAutoIdx());
        if (!design.getScratchpad().isEmpty()) {
            root.put(YosysJsonReader.SCRATCHPAD, new JSONObject(design.getScratchpad()));
        }
        CellTypes cellTypes = new CellTypes(design);
        JSONObject modules = new JSONObject();
        for (Module module : design.getModules()) {
            modules.put(module.getName(), writeModule(module, cellTypes));
        }
        root.put(YosysJsonReader.MODULES, modules);
        return root;
    }

    private static JSONObject writeModule(Module module, CellTypes cellTypes) {
        SigMap sigMap = new SigMap(module);
        Map<SigBit, Integer> bitIds = new HashMap<>();

        JSONObject json = new JSONObject();
        json.put("attributes", attributes(module));
        if (module.hasProcesses()) {
            json.put(YosysJsonReader.PROCESSES, true);
        }

        JSONObject ports = new JSONObject();
        for (Wire w : module.getPorts()) {
            JSONObject port = new JSONObject();
            port.put("direction", w.getDirection().toJsonString());
            port.put("bits", bits(w.getSigSpec(), sigMap, bitIds));
            ports.put(w.getName(), port);
        }
        json.put("ports", ports);

        JSONObject cells = new JSONObject();
        Map<String, Cell> sortedCells = new TreeMap<>();
        for (Cell c : module.getCells()) {
            sortedCells.put(c.getName(), c);
        }
        for (Cell c : sortedCells.values()) {
            JSONObject jc = new JSONObject();
            jc.put("hide_name", c.isSynthetic() ? 1 : 0);
            jc.put("type", c.getType());
            jc.put("parameters", new JSONObject(c.getParameters()));
            jc.put("attributes", attributes(c));
            JSONObject dirs = new JSONObject();
            JSONObject conns = new JSONObject();
            for (Map.Entry<String, SigSpec> e : c.getConnections().entrySet()) {
                String port = e.getKey();
                PortDirection dir = c.getPortDirections().get(port);
                if (dir == null) {
                    boolean in = cellTypes.isInput(c, port);
                    boolean out = cellTypes.isOutput(c, port);
                    if (in && out) dir = PortDirection.INOUT;
                    else if (in) dir = PortDirection.INPUT;
                    else if (out) dir = PortDirection.OUTPUT;
                }
                if (dir != null) {
                    dirs.put(port, dir.toJsonString());
                }
                conns.put(port, bits(e.getValue(), sigMap, bitIds));
            }
            jc.put("port_directions", dirs);
            jc.put("connections", conns);
            cells.put(c.getName(), jc);
        }
        json.put("cells", cells);

        JSONObject netnames = new JSONObject();
        for (Wire w : module.getWires()) {
            JSONObject net = new JSONObject();
            net.put("hide_name", w.isSynthetic() ? 1 : 0);
            net.put("bits", bits(w.getSigSpec(), sigMap, bitIds));
            net.put("attributes", attributes(w));
            netnames.put(w.getName(), net);
        }
        json.put("netnames", netnames);
        return json;
    }

    private static JSONArray bits(SigSpec sig, SigMap sigMap, Map<SigBit, Integer> bitIds) {
        JSONArray arr = new JSONArray();
        for (SigBit bit : sigMap.apply(sig)) {
            if (bit.isConst()) {
                arr.put(String.valueOf(bit.getData().getSymbol()));
            } else {
                arr.put(bitIds.computeIfAbsent(bit, b -> bitIds.size() + FIRST_BIT_ID));
            }
        }
        return arr;
    }

    private static JSONObject attributes(PropertyObject obj) {
        return new JSONObject(obj.getAttributes());
    }
}
