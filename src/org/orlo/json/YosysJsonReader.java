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
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Const;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.PropertyObject;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.State;
import org.orlo.netlist.Wire;

/**
 * Reads a design in the Yosys JSON netlist format. Object members are visited
 * in sorted key order so the same file always yields the same in-memory order.
 * Integer bit ids shared by several nets become module connections; bit ids
 * that no net names get a wire of their own called {@code $json$<id>}.
 */
public class YosysJsonReader {

    public static final String MODULES = "modules";
    public static final String SCRATCHPAD = "scratchpad";
    public static final String AUTOIDX = "autoidx";
    public static final String PROCESSES = "processes";
    public static final String UNNAMED_BIT_PREFIX = "$json$";

    public static Design read(File file) {
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return read(r);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read design " + file, e);
        }
    }

    public static Design read(Reader reader) {
        JSONObject root;
        try {
            root = new JSONObject(new JSONTokener(reader));
        } catch (JSONException e) {
            throw new RuntimeException("ERROR: Malformed JSON design: " + e.getMessage(), e);
        }
        Design design = new Design();
        JSONObject modules = root.optJSONObject(MODULES);
        if (modules != null) {
            for (String name : new TreeSet<>(modules.keySet())) {
                readModule(design, name, modules.getJSONObject(name));
            }
        }
        JSONObject scratchpad = root.optJSONObject(SCRATCHPAD);
        if (scratchpad != null) {
            for (String key : new TreeSet<>(scratchpad.keySet())) {
                design.setScratchpadString(key, scratchpad.get(key).toString());
            }
        }
        if (root.has(AUTOIDX)) {
            design.setAutoIdx(Math.max(design.getAutoIdx(), root.getInt(AUTOIDX)));
        }
        return design;
    }

    private static void readModule(Design design, String name, JSONObject json) {
        Module module = design.addModule(name);
        readAttributes(module, json.optJSONObject("attributes"));
        module.setHasProcesses(isPresent(json.opt(PROCESSES)));

        Map<Integer, SigBit> bitOwners = new HashMap<>();
        JSONObject ports = json.optJSONObject("ports");
        JSONObject netnames = json.optJSONObject("netnames");

        if (netnames != null) {
            for (String netName : new TreeSet<>(netnames.keySet())) {
                JSONObject net = netnames.getJSONObject(netName);
                JSONArray bits = net.getJSONArray("bits");
                Wire w = module.addWire(netName, bits.length());
                readAttributes(w, net.optJSONObject("attributes"));
            }
        }
        if (ports != null) {
            int portId = 1;
            for (String portName : new TreeSet<>(ports.keySet())) {
                JSONObject port = ports.getJSONObject(portName);
                Wire w = module.getWire(portName);
                if (w == null) {
                    w = module.addWire(portName, port.getJSONArray("bits").length());
                }
                w.setPort(PortDirection.getEnum(port.getString("direction")), portId++);
            }
        }
        // Bind net bits after all ports are known so connections see final port flags
        if (netnames != null) {
            for (String netName : new TreeSet<>(netnames.keySet())) {
                bindWireBits(module, module.getWire(netName), netnames.getJSONObject(netName).getJSONArray("bits"),
                        bitOwners);
            }
        }
        if (ports != null) {
            for (String portName : new TreeSet<>(ports.keySet())) {
                if (netnames != null && netnames.has(portName)) continue;
                bindWireBits(module, module.getWire(portName), ports.getJSONObject(portName).getJSONArray("bits"),
                        bitOwners);
            }
        }

        JSONObject cells = json.optJSONObject("cells");
        if (cells == null) return;
        for (String cellName : new TreeSet<>(cells.keySet())) {
            JSONObject jc = cells.getJSONObject(cellName);
            Cell cell = module.addCell(cellName, jc.getString("type"));
            JSONObject params = jc.optJSONObject("parameters");
            if (params != null) {
                for (String key : new TreeSet<>(params.keySet())) {
                    cell.setParameter(key, valueToString(params.get(key)));
                }
            }
            readAttributes(cell, jc.optJSONObject("attributes"));
            JSONObject dirs = jc.optJSONObject("port_directions");
            if (dirs != null) {
                for (String port : new TreeSet<>(dirs.keySet())) {
                    cell.setPortDirection(port, PortDirection.getEnum(dirs.getString(port)));
                }
            }
            JSONObject conns = jc.optJSONObject("connections");
            if (conns != null) {
                for (String port : new TreeSet<>(conns.keySet())) {
                    cell.setPort(port, readBits(module, conns.getJSONArray(port), bitOwners));
                }
            }
        }
    }

    private static void bindWireBits(Module module, Wire w, JSONArray bits, Map<Integer, SigBit> bitOwners) {
        if (bits.length() != w.getWidth()) {
            throw new RuntimeException("ERROR: Port " + w.getName() + " of module " + module.getName()
                    + " does not match the width of its net.");
        }
        for (int i = 0; i < bits.length(); i++) {
            SigBit bit = w.getBit(i);
            Object o = bits.get(i);
            if (o instanceof String) {
                module.connect(bit, SigBit.of(parseState((String) o)));
                continue;
            }
            int id = bits.getInt(i);
            SigBit owner = bitOwners.putIfAbsent(id, bit);
            if (owner != null) {
                module.connect(bit, owner);
            }
        }
    }

    private static SigSpec readBits(Module module, JSONArray bits, Map<Integer, SigBit> bitOwners) {
        List<SigBit> result = new ArrayList<>(bits.length());
        for (int i = 0; i < bits.length(); i++) {
            Object o = bits.get(i);
            if (o instanceof String) {
                result.add(SigBit.of(parseState((String) o)));
                continue;
            }
            int id = bits.getInt(i);
            SigBit bit = bitOwners.get(id);
            if (bit == null) {
                bit = module.addWire(UNNAMED_BIT_PREFIX + id).getBit(0);
                bitOwners.put(id, bit);
            }
            result.add(bit);
        }
        return SigSpec.of(result);
    }

    private static State parseState(String s) {
        if (s.length() != 1) {
            throw new RuntimeException("ERROR: Invalid constant bit \"" + s + "\" in JSON design.");
        }
        return State.fromChar(s.charAt(0));
    }

    private static void readAttributes(PropertyObject obj, JSONObject attrs) {
        if (attrs == null) return;
        for (String key : new TreeSet<>(attrs.keySet())) {
            obj.setAttribute(key, valueToString(attrs.get(key)));
        }
    }

    /**
     * Numbers become 32-bit binary strings, everything else keeps its text.
     */
    static String valueToString(Object value) {
        if (value instanceof Number) {
            return Const.fromInt(((Number) value).intValue(), 32);
        }
        if (value instanceof Boolean) {
            return Const.fromInt((Boolean) value ? 1 : 0, 32);
        }
        return value.toString();
    }

    private static boolean isPresent(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) return false;
        if (value instanceof JSONObject) return !((JSONObject) value).isEmpty();
        if (value instanceof JSONArray) return !((JSONArray) value).isEmpty();
        if (value instanceof Boolean) return (Boolean) value;
        return true;
    }
}
