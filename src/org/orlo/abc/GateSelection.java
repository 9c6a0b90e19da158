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
package org.orlo.abc;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.orlo.gate.GateType;

/**
 * The set of gate kinds the built-in library offers the optimizer, together
 * with the cost table to use. Built from a comma separated list of gate names
 * and aliases; an entry starting with '-' removes instead of adds.
 */
public class GateSelection {

    public static final List<String> SELECTABLE_GATES = Collections.unmodifiableList(Arrays.asList(
            "AND", "NAND", "OR", "NOR", "XOR", "XNOR", "ANDNOT", "ORNOT", "MUX", "NMUX", "AOI3", "OAI3", "AOI4", "OAI4"));

    public static final List<String> DEFAULT_GATES = Collections.unmodifiableList(Arrays.asList(
            "AND", "NAND", "OR", "NOR", "XOR", "XNOR", "ANDNOT", "ORNOT", "MUX"));

    private static final Map<String, List<String>> aliases = new HashMap<>();

    static {
        aliases.put("simple", Arrays.asList("AND", "OR", "XOR", "MUX"));
        aliases.put("cmos2", Arrays.asList("NAND", "NOR"));
        aliases.put("cmos3", Arrays.asList("NAND", "NOR", "AOI3", "OAI3"));
        aliases.put("cmos4", Arrays.asList("NAND", "NOR", "AOI3", "OAI3", "AOI4", "OAI4"));
        aliases.put("cmos", Arrays.asList("NAND", "NOR", "AOI3", "OAI3", "AOI4", "OAI4", "NMUX", "MUX", "XOR", "XNOR"));
        aliases.put("gates", Arrays.asList("AND", "NAND", "OR", "NOR", "XOR", "XNOR", "ANDNOT", "ORNOT"));
        aliases.put("aig", Arrays.asList("AND", "NAND", "OR", "NOR", "ANDNOT", "ORNOT"));
        aliases.put("all", Arrays.asList("AND", "NAND", "OR", "NOR", "XOR", "XNOR", "ANDNOT", "ORNOT",
                "AOI3", "OAI3", "AOI4", "OAI4", "MUX", "NMUX"));
    }

    private final Set<String> enabledGates;

    private final boolean cmosCost;

    public GateSelection(Set<String> enabledGates, boolean cmosCost) {
        this.enabledGates = Collections.unmodifiableSet(new TreeSet<>(enabledGates));
        this.cmosCost = cmosCost;
    }

    /**
     * @return The default selection: {@link #DEFAULT_GATES} at default cost.
     */
    public static GateSelection getDefault() {
        return new GateSelection(new TreeSet<>(DEFAULT_GATES), false);
    }

    /**
     * Parses a gate list such as "cmos2,-NOR,XOR". Adding a cmos alias selects
     * the CMOS cost table. An empty result falls back to the default gates.
     * @param gateList Comma separated gate names and aliases, may be null or empty
     * @throws RuntimeException for an unknown gate name
     */
    public static GateSelection parse(String gateList) {
        Set<String> enabled = new TreeSet<>();
        boolean cmosCost = false;
        if (gateList != null) {
            for (String token : gateList.split(",")) {
                String g = token.trim();
                if (g.isEmpty()) continue;
                boolean remove = false;
                if (g.charAt(0) == '-') {
                    remove = true;
                    g = g.substring(1);
                }
                List<String> gates;
                if (SELECTABLE_GATES.contains(g)) {
                    gates = Collections.singletonList(g);
                } else if (aliases.containsKey(g)) {
                    gates = aliases.get(g);
                    if (g.startsWith("cmos") && !remove) cmosCost = true;
                } else {
                    throw new RuntimeException("ERROR: Unsupported gate type: " + g);
                }
                if (remove) {
                    enabled.removeAll(gates);
                } else {
                    enabled.addAll(gates);
                }
            }
        }
        if (enabled.isEmpty()) {
            enabled.addAll(DEFAULT_GATES);
        }
        return new GateSelection(enabled, cmosCost);
    }

    public Set<String> getEnabledGates() {
        return enabledGates;
    }

    public boolean isEnabled(GateType type) {
        return enabledGates.contains(type.getLibName());
    }

    public boolean isCmosCost() {
        return cmosCost;
    }

    @Override
    public String toString() {
        return String.join(",", enabledGates) + (cmosCost ? " (cmos cost)" : "");
    }
}
