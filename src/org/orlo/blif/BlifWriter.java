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

import org.orlo.gate.GateGraph;
import org.orlo.gate.GateNode;
import org.orlo.gate.GateType;
import org.orlo.gate.MappingContext;
import org.orlo.netlist.State;
import org.orlo.util.FileTools;

/**
 * Writes the gate graph of a {@link MappingContext} as a BLIF network named
 * "netlist". Boundary terminals become primary inputs, boundary gates and
 * registers become primary outputs, and every node is named by its id.
 */
public class BlifWriter {

    public static final String MODEL_NAME = "netlist";

    public static final String DUMMY_INPUT = "dummy_input";

    /**
     * Sizes of a written network.
     */
    public static class NetworkSummary {
        private final int gates;
        private final int wires;
        private final int inputs;
        private final int outputs;

        public NetworkSummary(int gates, int wires, int inputs, int outputs) {
            this.gates = gates;
            this.wires = wires;
            this.inputs = inputs;
            this.outputs = outputs;
        }

        public int getGates() {
            return gates;
        }

        public int getWires() {
            return wires;
        }

        public int getInputs() {
            return inputs;
        }

        public int getOutputs() {
            return outputs;
        }

        @Override
        public String toString() {
            return "Extracted " + gates + " gates and " + wires + " wires to a netlist network with "
                    + inputs + " inputs and " + outputs + " outputs.";
        }
    }

    /**
     * Writes the network and fills the context's primary input/output maps.
     * @param ctx Cycle context after loop breaking
     * @param file Destination file
     * @return Gate, wire, input and output counts of the network
     */
    public static NetworkSummary write(MappingContext ctx, File file) {
        List<String> lines = new ArrayList<>();
        NetworkSummary summary = render(ctx, lines);
        FileTools.writeLinesToTextFile(lines, file.getPath());
        System.out.println(summary);
        return summary;
    }

    static NetworkSummary render(MappingContext ctx, List<String> lines) {
        GateGraph graph = ctx.getGraph();
        ctx.getPiMap().clear();
        ctx.getPoMap().clear();
        lines.add(".model " + MODEL_NAME);

        StringBuilder sb = new StringBuilder(".inputs");
        int countInput = 0;
        for (GateNode n : graph.getNodes()) {
            if (!n.isPort() || n.getType() != GateType.NONE) continue;
            sb.append(' ').append(n.getExportName());
            ctx.getPiMap().put(countInput++, n.getBit().toString());
        }
        if (countInput == 0) {
            sb.append(' ').append(DUMMY_INPUT);
        }
        lines.add(sb.toString());

        sb = new StringBuilder(".outputs");
        int countOutput = 0;
        for (GateNode n : graph.getNodes()) {
            if (!n.isPort() || n.getType() == GateType.NONE) continue;
            sb.append(' ').append(n.getExportName());
            ctx.getPoMap().put(countOutput++, n.getBit().toString());
        }
        lines.add(sb.toString());

        for (GateNode n : graph.getNodes()) {
            lines.add(String.format("# ys__n%-5d %s", n.getId(), n.getBit()));
        }

        for (GateNode n : graph.getNodes()) {
            if (!n.getBit().isConst()) continue;
            lines.add(".names " + n.getExportName());
            if (n.getBit().getData() == State.S1) {
                lines.add("1");
            }
        }

        int countGates = 0;
        for (GateNode n : graph.getNodes()) {
            GateType type = n.getType();
            if (type == GateType.NONE) continue;
            if (type == GateType.FF) {
                State init = n.getInit();
                int initCode = init == State.S1 ? 1 : init == State.S0 ? 0 : 2;
                lines.add(".latch " + GateNode.exportName(n.getInput(0)) + " " + n.getExportName() + " " + initCode);
            } else {
                sb = new StringBuilder(".names");
                for (int i = 0; i < type.getArity(); i++) {
                    int in = n.getInput(i);
                    if (in == GateNode.UNSET) {
                        throw new RuntimeException("ERROR: Node " + n + " has no driver for pin "
                                + type.getInputPins().get(i));
                    }
                    sb.append(' ').append(GateNode.exportName(in));
                }
                sb.append(' ').append(n.getExportName());
                lines.add(sb.toString());
                for (String row : type.getCoverRows()) {
                    lines.add(row + " 1");
                }
            }
            countGates++;
        }
        lines.add(".end");
        return new NetworkSummary(countGates, graph.size(), countInput, countOutput);
    }
}
