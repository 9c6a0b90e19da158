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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.Wire;

/**
 * Removes combinational feedback from the gate graph with a Kahn style
 * topological sweep. Whenever the sweep stalls, one node of a remaining
 * cycle is split: it becomes a boundary output, a new boundary input node
 * takes over its fanout, and a direct host connection joins the two.
 */
public class LoopBreaker {

    public static final String LOOP_WIRE_PREFIX = "$abcloop$";

    /**
     * Breaks every combinational cycle in the context's graph.
     * @param ctx Cycle context
     * @return Number of breaks inserted
     */
    public static int breakLoops(MappingContext ctx) {
        GateGraph graph = ctx.getGraph();
        Map<Integer, TreeSet<Integer>> edges = new TreeMap<>();
        List<Integer> inEdgesCount = new ArrayList<>();
        TreeSet<Integer> workpool = new TreeSet<>();

        for (GateNode g : graph.getNodes()) {
            inEdgesCount.add(0);
        }
        for (GateNode g : graph.getNodes()) {
            if (!g.getType().isCombinational()) {
                workpool.add(g.getId());
                continue;
            }
            for (int in : g.getDistinctInputs()) {
                edges.computeIfAbsent(in, k -> new TreeSet<>()).add(g.getId());
                inEdgesCount.set(g.getId(), inEdgesCount.get(g.getId()) + 1);
            }
        }

        int breaks = 0;
        while (true) {
            while (!workpool.isEmpty()) {
                int id = workpool.pollFirst();
                TreeSet<Integer> fanout = edges.remove(id);
                if (fanout == null) continue;
                for (int id2 : fanout) {
                    int count = inEdgesCount.get(id2) - 1;
                    if (count < 0) {
                        throw new RuntimeException("ERROR: Negative in-degree for node " + id2 + " while sorting the gate graph");
                    }
                    inEdgesCount.set(id2, count);
                    if (count == 0) workpool.add(id2);
                }
            }
            if (edges.isEmpty()) break;

            // The sweep stalled (or never had a source): every remaining edge lies on or behind a cycle
            int id1 = selectBreakNode(graph, edges);
            TreeSet<Integer> targets = edges.get(id1);
            if (targets.isEmpty()) {
                edges.remove(id1);
                continue;
            }
            GateNode broken = graph.getNode(id1);
            if (broken.getBit().isConst()) {
                throw new RuntimeException("ERROR: Cannot break a loop at constant node " + broken);
            }

            Wire wire = ctx.getModule().addWire(LOOP_WIRE_PREFIX + ctx.getDesign().nextAutoIdx());
            logBreak(wire, broken, targets, graph);

            int id3 = graph.mapSignal(wire.getBit(0));
            graph.markPort(id1);
            graph.markPort(id3);
            inEdgesCount.add(0);
            workpool.add(id3);

            for (int id2 : targets) {
                graph.getNode(id2).replaceInput(id1, id3);
            }
            edges.put(id3, edges.remove(id1));

            ctx.getModule().connect(SigSpec.of(wire.getBit(0)), SigSpec.of(broken.getBit()));
            breaks++;
        }

        if (!graph.isExportAcyclic()) {
            throw new RuntimeException("ERROR: Gate graph of module " + ctx.getModule().getName()
                    + " still contains a combinational cycle after loop breaking.");
        }
        return breaks;
    }

    /**
     * Picks the node to split: user-named signals first, then the node with
     * the most remaining fanout, then the smallest signal.
     */
    static int selectBreakNode(GateGraph graph, Map<Integer, TreeSet<Integer>> edges) {
        int id1 = -1;
        for (Map.Entry<Integer, TreeSet<Integer>> e : edges.entrySet()) {
            int id2 = e.getKey();
            if (id1 < 0) {
                id1 = id2;
                continue;
            }
            SigBit b1 = graph.getNode(id1).getBit();
            SigBit b2 = graph.getNode(id2).getBit();
            if (b1.isConst()) {
                id1 = id2;
            } else if (b2.isConst()) {
                continue;
            } else if (b1.getWire().isSynthetic() && !b2.getWire().isSynthetic()) {
                id1 = id2;
            } else if (!b1.getWire().isSynthetic() && b2.getWire().isSynthetic()) {
                continue;
            } else if (edges.get(id1).size() < e.getValue().size()) {
                id1 = id2;
            } else if (edges.get(id1).size() > e.getValue().size()) {
                continue;
            } else if (b2.compareTo(b1) < 0) {
                id1 = id2;
            }
        }
        return id1;
    }

    private static void logBreak(Wire wire, GateNode broken, TreeSet<Integer> targets, GateGraph graph) {
        boolean firstLine = true;
        for (int id2 : targets) {
            String edge = broken.getBit() + " -> " + graph.getNode(id2).getBit();
            if (firstLine) {
                System.out.println("Breaking loop using new signal " + wire.getName() + ": " + edge);
            } else {
                System.out.println("                               "
                        + " ".repeat(wire.getName().length()) + "  " + edge);
            }
            firstLine = false;
        }
    }
}
