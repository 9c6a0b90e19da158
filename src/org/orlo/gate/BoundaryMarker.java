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

import org.orlo.netlist.Cell;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.Wire;

/**
 * Flags the gate graph nodes that must remain visible outside the exported
 * network. Must run after all extraction of the cycle is done.
 */
public class BoundaryMarker {

    public static void markBoundary(MappingContext ctx) {
        GateGraph graph = ctx.getGraph();
        for (Wire w : ctx.getModule().getWires()) {
            if (w.isPort() || w.isKeep()) {
                graph.markPort(w.getSigSpec());
            }
        }
        for (Cell c : ctx.getModule().getCells()) {
            for (SigSpec sig : c.getConnections().values()) {
                graph.markPort(sig);
            }
        }
        ClockDomainKey domain = ctx.getDomain();
        if (domain.hasClock()) {
            graph.markPort(domain.getClkSig());
        }
        if (domain.hasEnable()) {
            graph.markPort(domain.getEnSig());
        }
    }
}
