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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.orlo.util.Pair;

/**
 * A flat circuit module: wires, cells and direct connections. A direct
 * connection drives its first signal from its second one.
 */
public class Module extends PropertyObject {

    public static final String BLACKBOX = "blackbox";

    private final Design design;

    private final Map<String, Wire> wires = new LinkedHashMap<>();

    private final Map<String, Cell> cells = new LinkedHashMap<>();

    private final List<Pair<SigSpec, SigSpec>> connections = new ArrayList<>();

    private boolean hasProcesses;

    Module(Design design, String name) {
        super(name);
        this.design = design;
    }

    public Design getDesign() {
        return design;
    }

    public Wire addWire(String name) {
        return addWire(name, 1);
    }

    public Wire addWire(String name, int width) {
        Wire w = new Wire(this, name, width);
        Wire collision = wires.putIfAbsent(name, w);
        if (collision != null) {
            throw new RuntimeException("ERROR: Name collision inside module " + getName()
                    + ", trying to add wire " + name + " which already exists.");
        }
        return w;
    }

    public Wire getWire(String name) {
        return wires.get(name);
    }

    public Collection<Wire> getWires() {
        return Collections.unmodifiableCollection(wires.values());
    }

    public Cell addCell(String name, String type) {
        Cell c = new Cell(this, name, type);
        Cell collision = cells.putIfAbsent(name, c);
        if (collision != null) {
            throw new RuntimeException("ERROR: Name collision inside module " + getName()
                    + ", trying to add cell " + name + " which already exists.");
        }
        return c;
    }

    public Cell getCell(String name) {
        return cells.get(name);
    }

    /**
     * @return A snapshot of the cells, safe to iterate while cells are removed.
     */
    public List<Cell> getCells() {
        return new ArrayList<>(cells.values());
    }

    public int getCellCount() {
        return cells.size();
    }

    public Cell removeCell(Cell cell) {
        return cells.remove(cell.getName());
    }

    public void connect(SigSpec lhs, SigSpec rhs) {
        if (lhs.size() != rhs.size()) {
            throw new RuntimeException("ERROR: Width mismatch connecting " + lhs + " to " + rhs
                    + " in module " + getName());
        }
        connections.add(new Pair<>(lhs, rhs));
    }

    public void connect(SigBit lhs, SigBit rhs) {
        connect(SigSpec.of(lhs), SigSpec.of(rhs));
    }

    public List<Pair<SigSpec, SigSpec>> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public boolean hasProcesses() {
        return hasProcesses;
    }

    public void setHasProcesses(boolean hasProcesses) {
        this.hasProcesses = hasProcesses;
    }

    public boolean isBlackbox() {
        return getBoolAttribute(BLACKBOX);
    }

    /**
     * @return Port wires ordered by port index.
     */
    public List<Wire> getPorts() {
        List<Wire> ports = new ArrayList<>();
        for (Wire w : wires.values()) {
            if (w.isPort()) ports.add(w);
        }
        ports.sort((a, b) -> Integer.compare(a.getPortId(), b.getPortId()));
        return ports;
    }
}
