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
package org.orlo.partition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.orlo.gate.CellTypes;
import org.orlo.gate.ClockDomainKey;
import org.orlo.netlist.Cell;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.SigSpec;
import org.orlo.util.MessageGenerator;

/**
 * Splits the cells of a module into independent clock domains. Every register
 * seeds the partition of its domain; partitions then grow along directly
 * adjacent cells, first breadth-first in driver and consumer direction, then
 * through any shared net. Cells that no register reaches form the
 * {@link ClockDomainKey#NO_CLOCK} partition.
 *
 * All sets are ordered by cell name and canonical bit so the result depends
 * only on the netlist, never on object identity.
 */
public class ClockDomainPartitioner {

    private static final Comparator<Cell> CELL_ORDER = Comparator.comparing(Cell::getName);

    private final SigMap sigMap;

    private final CellTypes cellTypes;

    /** Every wire bit a cell touches */
    private final Map<Cell, Set<SigBit>> cellToBit = new HashMap<>();
    /** Input bits of a cell, followed towards their drivers */
    private final Map<Cell, Set<SigBit>> cellToBitUp = new HashMap<>();
    /** Output bits of a cell, followed towards their consumers */
    private final Map<Cell, Set<SigBit>> cellToBitDown = new HashMap<>();

    private final Map<SigBit, Set<Cell>> bitToCell = new HashMap<>();
    /** Drivers of a bit */
    private final Map<SigBit, Set<Cell>> bitToCellUp = new HashMap<>();
    /** Consumers of a bit */
    private final Map<SigBit, Set<Cell>> bitToCellDown = new HashMap<>();

    private final Set<Cell> unassigned = new TreeSet<>(CELL_ORDER);

    private final SortedMap<ClockDomainKey, List<Cell>> assigned = new TreeMap<>();

    private final Map<Cell, ClockDomainKey> assignedReverse = new HashMap<>();

    public ClockDomainPartitioner(SigMap sigMap, CellTypes cellTypes) {
        this.sigMap = sigMap;
        this.cellTypes = cellTypes;
    }

    /**
     * Convenience wrapper that partitions a list of cells of a module.
     * @return Cells per clock domain, in key order. Every input cell occurs exactly once.
     */
    public static SortedMap<ClockDomainKey, List<Cell>> partition(List<Cell> cells, SigMap sigMap,
                                                                  CellTypes cellTypes) {
        return new ClockDomainPartitioner(sigMap, cellTypes).partition(cells);
    }

    public SortedMap<ClockDomainKey, List<Cell>> partition(List<Cell> cells) {
        TreeSet<Cell> expandQueue = new TreeSet<>(CELL_ORDER);
        TreeSet<Cell> expandQueueUp = new TreeSet<>(CELL_ORDER);
        TreeSet<Cell> expandQueueDown = new TreeSet<>(CELL_ORDER);

        unassigned.addAll(cells);
        List<Cell> ordered = new ArrayList<>(cells);
        ordered.sort(CELL_ORDER);
        for (Cell cell : ordered) {
            indexCell(cell);
            ClockDomainKey key = ClockDomainKey.ofRegister(cell, sigMap);
            if (key == null) continue;
            unassigned.remove(cell);
            expandQueue.add(cell);
            expandQueueUp.add(cell);
            expandQueueDown.add(cell);
            assign(cell, key);
        }

        TreeSet<Cell> nextExpandQueueUp = new TreeSet<>(CELL_ORDER);
        TreeSet<Cell> nextExpandQueueDown = new TreeSet<>(CELL_ORDER);
        while (!expandQueueUp.isEmpty() || !expandQueueDown.isEmpty()) {
            if (!expandQueueUp.isEmpty()) {
                Cell cell = expandQueueUp.pollFirst();
                expandOneHop(cell, cellToBitUp, bitToCellUp, nextExpandQueueUp, expandQueue);
            }
            if (!expandQueueDown.isEmpty()) {
                Cell cell = expandQueueDown.pollFirst();
                expandOneHop(cell, cellToBitDown, bitToCellDown, nextExpandQueueDown, expandQueue);
            }
            if (expandQueueUp.isEmpty() && expandQueueDown.isEmpty()) {
                TreeSet<Cell> tmp = expandQueueUp;
                expandQueueUp = nextExpandQueueUp;
                nextExpandQueueUp = tmp;
                tmp = expandQueueDown;
                expandQueueDown = nextExpandQueueDown;
                nextExpandQueueDown = tmp;
            }
        }

        TreeSet<Cell> nextExpandQueue = new TreeSet<>(CELL_ORDER);
        while (!expandQueue.isEmpty()) {
            Cell cell = expandQueue.pollFirst();
            ClockDomainKey key = assignedReverse.get(cell);
            for (SigBit bit : cellToBit.getOrDefault(cell, new TreeSet<>())) {
                Set<Cell> neighbors = bitToCell.get(bit);
                if (neighbors == null) continue;
                for (Cell c : neighbors) {
                    if (unassigned.remove(c)) {
                        nextExpandQueue.add(c);
                        assign(c, key);
                    }
                }
                neighbors.clear();
            }
            if (expandQueue.isEmpty()) {
                TreeSet<Cell> tmp = expandQueue;
                expandQueue = nextExpandQueue;
                nextExpandQueue = tmp;
            }
        }

        for (Cell cell : unassigned) {
            assign(cell, ClockDomainKey.NO_CLOCK);
        }
        unassigned.clear();

        MessageGenerator.printHeader("Summary of detected clock domains");
        for (Map.Entry<ClockDomainKey, List<Cell>> e : assigned.entrySet()) {
            System.out.println("  " + e.getValue().size() + " cells in " + e.getKey().describe());
        }
        return assigned;
    }

    private void indexCell(Cell cell) {
        for (Map.Entry<String, SigSpec> conn : cell.getConnections().entrySet()) {
            boolean isInput = cellTypes.isInput(cell, conn.getKey());
            boolean isOutput = cellTypes.isOutput(cell, conn.getKey());
            for (SigBit b : conn.getValue()) {
                SigBit bit = sigMap.apply(b);
                if (bit.isConst()) continue;
                link(cellToBit, bitToCell, cell, bit);
                if (isInput) link(cellToBitUp, bitToCellDown, cell, bit);
                if (isOutput) link(cellToBitDown, bitToCellUp, cell, bit);
            }
        }
    }

    private static void link(Map<Cell, Set<SigBit>> cellToBit, Map<SigBit, Set<Cell>> bitToCell,
                             Cell cell, SigBit bit) {
        cellToBit.computeIfAbsent(cell, k -> new TreeSet<>()).add(bit);
        bitToCell.computeIfAbsent(bit, k -> new TreeSet<>(CELL_ORDER)).add(cell);
    }

    /**
     * Claims every unassigned cell one hop away from a cell, in one direction.
     * Claimed cells continue to expand in that same direction.
     */
    private void expandOneHop(Cell cell, Map<Cell, Set<SigBit>> cellToBitDir, Map<SigBit, Set<Cell>> bitToCellDir,
                              Set<Cell> nextQueue, Set<Cell> expandQueue) {
        ClockDomainKey key = assignedReverse.get(cell);
        Set<SigBit> bits = cellToBitDir.get(cell);
        if (bits == null) return;
        for (SigBit bit : bits) {
            Set<Cell> neighbors = bitToCellDir.get(bit);
            if (neighbors == null) continue;
            for (Cell c : neighbors) {
                if (unassigned.remove(c)) {
                    nextQueue.add(c);
                    assign(c, key);
                    expandQueue.add(c);
                }
            }
        }
    }

    private void assign(Cell cell, ClockDomainKey key) {
        assigned.computeIfAbsent(key, k -> new ArrayList<>()).add(cell);
        assignedReverse.put(cell, key);
    }
}
