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
import java.util.Arrays;
import java.util.List;

import org.orlo.netlist.SigBit;
import org.orlo.netlist.State;

/**
 * One node of the gate graph. A node stands for exactly one canonical signal
 * and, once typed, for the gate that drives it.
 */
public class GateNode {

    public static final int MAX_INPUTS = 4;

    public static final int UNSET = -1;

    public static final String EXPORT_PREFIX = "ys__n";

    private final int id;

    private GateType type;

    private final int[] inputs;

    private boolean port;

    private final SigBit bit;

    private final State init;

    GateNode(int id, SigBit bit, State init) {
        this.id = id;
        this.type = GateType.NONE;
        this.inputs = new int[MAX_INPUTS];
        Arrays.fill(inputs, UNSET);
        this.bit = bit;
        this.init = init;
    }

    public int getId() {
        return id;
    }

    public GateType getType() {
        return type;
    }

    void setType(GateType type) {
        this.type = type;
    }

    public int getInput(int i) {
        return inputs[i];
    }

    void setInput(int i, int nodeId) {
        inputs[i] = nodeId;
    }

    /**
     * @return The set input node ids in pin order, duplicates removed.
     */
    public List<Integer> getDistinctInputs() {
        List<Integer> result = new ArrayList<>(MAX_INPUTS);
        for (int in : inputs) {
            if (in != UNSET && !result.contains(in)) result.add(in);
        }
        return result;
    }

    /**
     * Replaces every input reference to one node with another.
     * @return True if any input changed.
     */
    boolean replaceInput(int from, int to) {
        boolean changed = false;
        for (int i = 0; i < MAX_INPUTS; i++) {
            if (inputs[i] == from) {
                inputs[i] = to;
                changed = true;
            }
        }
        return changed;
    }

    public boolean isPort() {
        return port;
    }

    void setPort(boolean port) {
        this.port = port;
    }

    public SigBit getBit() {
        return bit;
    }

    public State getInit() {
        return init;
    }

    /**
     * @return The node's name in the exchange files.
     */
    public String getExportName() {
        return exportName(id);
    }

    public static String exportName(int id) {
        return EXPORT_PREFIX + id;
    }

    @Override
    public String toString() {
        return getExportName() + " " + type + " " + bit;
    }
}
