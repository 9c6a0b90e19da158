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

import java.util.Map;
import java.util.TreeMap;

import org.orlo.netlist.Design;
import org.orlo.netlist.InitValues;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigMap;

/**
 * State of one extract, mark, break and reintegrate cycle for a single module
 * and clock domain. A new context is created for every cycle and handed from
 * stage to stage; nothing of it outlives the cycle.
 */
public class MappingContext {

    private final Design design;

    private final Module module;

    private final SigMap sigMap;

    private final GateGraph graph;

    private final ClockDomainKey domain;

    private final int mapAutoIdx;

    private boolean keepff;

    private boolean markgroups;

    private final Map<Integer, String> piMap = new TreeMap<>();

    private final Map<Integer, String> poMap = new TreeMap<>();

    /**
     * @param design The design that owns the module (supplies unique indices)
     * @param module Module to work on
     * @param domain Active clock domain, {@link ClockDomainKey#NO_CLOCK} to leave registers alone
     */
    public MappingContext(Design design, Module module, ClockDomainKey domain) {
        this.design = design;
        this.module = module;
        this.sigMap = new SigMap(module);
        this.graph = new GateGraph(sigMap, new InitValues(sigMap, module));
        this.domain = domain;
        this.mapAutoIdx = design.nextAutoIdx();
    }

    public Design getDesign() {
        return design;
    }

    public Module getModule() {
        return module;
    }

    public SigMap getSigMap() {
        return sigMap;
    }

    public GateGraph getGraph() {
        return graph;
    }

    public ClockDomainKey getDomain() {
        return domain;
    }

    /**
     * @return The index that prefixes every name created while reintegrating this cycle.
     */
    public int getMapAutoIdx() {
        return mapAutoIdx;
    }

    public boolean isKeepff() {
        return keepff;
    }

    public void setKeepff(boolean keepff) {
        this.keepff = keepff;
    }

    public boolean isMarkgroups() {
        return markgroups;
    }

    public void setMarkgroups(boolean markgroups) {
        this.markgroups = markgroups;
    }

    /**
     * Initial values are restored after reintegration only if some extracted
     * register had a definite one.
     */
    public boolean isRecoverInit() {
        return graph.hasDefinedRegisterInit();
    }

    /** Primary input index of the exported network to host signal text */
    public Map<Integer, String> getPiMap() {
        return piMap;
    }

    /** Primary output index of the exported network to host signal text */
    public Map<Integer, String> getPoMap() {
        return poMap;
    }
}
