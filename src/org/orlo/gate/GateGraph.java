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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.orlo.netlist.InitValues;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.State;

/**
 * Dense, indexed graph of gate nodes with a bijection between nodes and
 * canonical signals. Node ids start at zero and grow by one with each new
 * signal.
 */
public class GateGraph {

    private final List<GateNode> nodes = new ArrayList<>();

    private final Map<SigBit, Integer> signalMap = new HashMap<>();

    private final SigMap sigMap;

    private final InitValues initValues;

    public GateGraph(SigMap sigMap, InitValues initValues) {
        this.sigMap = sigMap;
        this.initValues = initValues;
    }

    /**
     * Looks up (or creates) the node of a signal's canonical bit and optionally
     * sets its type and inputs. Mapping the same signal again always yields
     * the same node.
     * @param bit Any alias of the signal
     * @param type New node type, or {@link GateType#NONE} to leave it unchanged
     * @param inputs Input node ids in pin order; negative ids are skipped
     * @return The node id
     */
    public int mapSignal(SigBit bit, GateType type, int... inputs) {
        SigBit canonical = sigMap.apply(bit);
        Integer id = signalMap.get(canonical);
        if (id == null) {
            id = nodes.size();
            nodes.add(new GateNode(id, canonical, initValues == null ? State.Sx
                    : initValues.get(canonical)));
            signalMap.put(canonical, id);
        }
        GateNode node = nodes.get(id);
        if (type != GateType.NONE) {
            node.setType(type);
        }
        for (int i = 0; i < inputs.length; i++) {
            if (inputs[i] >= 0) node.setInput(i, inputs[i]);
        }
        return id;
    }

    public int mapSignal(SigBit bit) {
        return mapSignal(bit, GateType.NONE);
    }

    /**
     * Flags the nodes of all wire bits of a signal that already have a node.
     * @param sig Signal to mark as boundary
     */
    public void markPort(SigSpec sig) {
        for (SigBit b : sig) {
            SigBit canonical = sigMap.apply(b);
            if (canonical.isConst()) continue;
            Integer id = signalMap.get(canonical);
            if (id != null) nodes.get(id).setPort(true);
        }
    }

    public void markPort(int id) {
        nodes.get(id).setPort(true);
    }

    public Integer getNodeId(SigBit bit) {
        return signalMap.get(sigMap.apply(bit));
    }

    public GateNode getNode(int id) {
        return nodes.get(id);
    }

    public List<GateNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public SigMap getSigMap() {
        return sigMap;
    }

    /**
     * Builds the edges of the exported network: an edge runs from every input
     * of a combinational node to that node. Terminals and registers have no
     * incoming edges.
     */
    public Graph<Integer, DefaultEdge> toDependencyGraph() {
        Graph<Integer, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (GateNode n : nodes) {
            g.addVertex(n.getId());
        }
        for (GateNode n : nodes) {
            if (!n.getType().isCombinational()) continue;
            for (int in : n.getDistinctInputs()) {
                g.addEdge(in, n.getId());
            }
        }
        return g;
    }

    public boolean isExportAcyclic() {
        CycleDetector<Integer, DefaultEdge> cycleDetector = new CycleDetector<>(toDependencyGraph());
        return !cycleDetector.detectCycles();
    }

    /**
     * @return True if any extracted register carries a definite initial value.
     */
    public boolean hasDefinedRegisterInit() {
        for (GateNode n : nodes) {
            if (n.getType() == GateType.FF && n.getInit().isDefined()) return true;
        }
        return false;
    }
}
