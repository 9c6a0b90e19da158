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
package org.orlo.reint;

import org.orlo.gate.GateGraph;
import org.orlo.gate.GateNode;
import org.orlo.gate.MappingContext;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.Wire;

/**
 * Translates names found in the optimizer's network into host wire names.
 * Names that refer to a node ({@code ys__n<id>}, optionally prefixed with
 * {@code new_} and followed by a suffix) keep the name of the node's original
 * signal; anything else keeps its own name. All results carry the cycle's
 * auto index, e.g. {@code $abc$12$count[3]_new}.
 */
public class NameMap {

    private static final String NEW_PREFIX = "new_";

    private final MappingContext ctx;

    public NameMap(MappingContext ctx) {
        this.ctx = ctx;
    }

    private static String stripEscape(String name) {
        return name.startsWith("$") ? name.substring(1) : name;
    }

    /**
     * @param abcName A net or cell name of the optimizer's network
     * @return The host name for it
     */
    public String remap(String abcName) {
        String sname = stripEscape(abcName);
        String prefix = "$abc$" + ctx.getMapAutoIdx() + "$";
        SigBit bit = resolve(abcName);
        if (bit != null) {
            boolean isNew = sname.startsWith(NEW_PREFIX);
            String rest = sname.substring((isNew ? NEW_PREFIX.length() : 0) + GateNode.EXPORT_PREFIX.length());
            int postfixStart = 0;
            while (postfixStart < rest.length() && Character.isDigit(rest.charAt(postfixStart))) {
                postfixStart++;
            }
            StringBuilder sb = new StringBuilder(prefix).append(stripEscape(bit.getWire().getName()));
            if (bit.getWire().getWidth() != 1) {
                sb.append('[').append(bit.getOffset()).append(']');
            }
            if (isNew) sb.append("_new");
            sb.append(rest.substring(postfixStart));
            return sb.toString();
        }
        return prefix + sname;
    }

    /**
     * @return The original wire bit of the node an optimizer name refers to, or
     * null if the name refers to no node or to a constant node.
     */
    public SigBit resolve(String abcName) {
        String sname = stripEscape(abcName);
        if (sname.startsWith(NEW_PREFIX)) {
            sname = sname.substring(NEW_PREFIX.length());
        }
        if (!sname.startsWith(GateNode.EXPORT_PREFIX)) return null;
        sname = sname.substring(GateNode.EXPORT_PREFIX.length());
        int end = 0;
        while (end < sname.length() && Character.isDigit(sname.charAt(end))) {
            end++;
        }
        if (end == 0 || end > 9) return null;
        int id = Integer.parseInt(sname.substring(0, end));
        GateGraph graph = ctx.getGraph();
        if (id >= graph.size()) return null;
        SigBit bit = graph.getNode(id).getBit();
        return bit.isConst() ? null : bit;
    }

    /**
     * @return The original wire of the node an optimizer name refers to, or null.
     */
    public Wire originalWire(String abcName) {
        SigBit bit = resolve(abcName);
        return bit == null ? null : bit.getWire();
    }

    /**
     * Looks up the host wire created for an optimizer net.
     * @throws RuntimeException if no such wire exists
     */
    public Wire wire(String abcName) {
        Module module = ctx.getModule();
        String name = remap(abcName);
        Wire w = module.getWire(name);
        if (w == null) {
            throw new RuntimeException("ERROR: Optimizer signal " + abcName + " maps to " + name
                    + " which does not exist in module " + module.getName() + ".");
        }
        return w;
    }
}
