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

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.orlo.blif.BlifParser;
import org.orlo.blif.BlifWriter;
import org.orlo.gate.ClockDomainKey;
import org.orlo.gate.GateNode;
import org.orlo.gate.GateType;
import org.orlo.gate.MappingContext;
import org.orlo.gate.WideMuxType;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Const;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PropertyObject;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.State;
import org.orlo.netlist.Wire;
import org.orlo.util.MessageGenerator;
import org.orlo.util.Pair;

/**
 * Rewrites the optimizer's network into the host module of a
 * {@link MappingContext} and reconnects the network's boundary to the
 * signals it was extracted from. The context must be the one the network was
 * exported from (or an identical rebuild of it), so node ids still refer to
 * the same signals.
 */
public class Reintegrator {

    public static final String OUTPUT_FILE = "output.blif";

    /** Attribute that tags everything created by one cycle when groups are marked */
    public static final String ABCGROUP = "abcgroup";

    public static final String BUILTIN_DFF = "DFF";
    public static final String GENERIC_DFF = "_dff_";
    public static final String CONST0 = "_const0_";
    public static final String CONST1 = "_const1_";
    public static final String LIB_ZERO = "ZERO";
    public static final String LIB_ONE = "ONE";

    private final MappingContext ctx;

    private final Module module;

    private final NameMap nameMap;

    private final boolean builtinLib;

    private Reintegrator(MappingContext ctx, boolean builtinLib) {
        this.ctx = ctx;
        this.module = ctx.getModule();
        this.nameMap = new NameMap(ctx);
        this.builtinLib = builtinLib;
    }

    /**
     * Reads {@code <dir>/output.blif} and merges it into the context's module.
     * @param ctx Context of the cycle that produced the network
     * @param dir Work directory of the cycle
     * @param builtinLib True if the network was mapped to the built-in gate library
     * @param sopMode True if cover tables should be read as "$sop" cells
     * @return Statistics, or {@link ReintegrationResult#SKIPPED} if there is no output file.
     */
    public static ReintegrationResult reintegrate(MappingContext ctx, File dir, boolean builtinLib, boolean sopMode) {
        File output = new File(dir, OUTPUT_FILE);
        if (!output.exists()) {
            System.out.println("ABC file " + output.getPath() + " doesn't exist.  Skipping.");
            return ReintegrationResult.SKIPPED;
        }
        Design mapped = BlifParser.parse(output, builtinLib ? BUILTIN_DFF : GENERIC_DFF, sopMode);
        return reintegrate(ctx, mapped, builtinLib);
    }

    /**
     * Merges an already parsed network into the context's module.
     */
    public static ReintegrationResult reintegrate(MappingContext ctx, Design mapped, boolean builtinLib) {
        MessageGenerator.printHeader("Re-integrating ABC results");
        Module mappedMod = mapped.getModule(BlifWriter.MODEL_NAME);
        if (mappedMod == null) {
            throw new RuntimeException("ERROR: ABC output file does not contain a module `" + BlifWriter.MODEL_NAME + "'.");
        }
        return new Reintegrator(ctx, builtinLib).run(mappedMod);
    }

    private ReintegrationResult run(Module mappedMod) {
        for (Wire w : mappedMod.getWires()) {
            Wire wire = module.addWire(nameMap.remap(w.getName()));
            Wire orig = nameMap.originalWire(w.getName());
            if (orig != null && orig.hasAttribute(Wire.SRC)) {
                wire.setAttribute(Wire.SRC, orig.getAttribute(Wire.SRC));
            }
            markGroup(wire);
        }

        SortedMap<String, Integer> cellStats = new TreeMap<>();
        for (Cell c : mappedMod.getCells()) {
            cellStats.merge(c.getType(), 1, Integer::sum);
            if (builtinLib && translateLibraryCell(c)) {
                continue;
            }
            translateCell(c);
        }

        for (Pair<SigSpec, SigSpec> conn : mappedMod.getConnections()) {
            module.connect(remapSignal(conn.getFirst()), remapSignal(conn.getSecond()));
        }

        if (ctx.isRecoverInit()) {
            for (Wire w : mappedMod.getWires()) {
                String init = w.getAttribute(Wire.INIT);
                if (init == null) continue;
                Wire host = nameMap.wire(w.getName());
                if (host.hasAttribute(Wire.INIT)) {
                    throw new RuntimeException("ERROR: Wire " + host.getName() + " already has an initial value.");
                }
                host.setAttribute(Wire.INIT, init);
            }
        }

        for (Map.Entry<String, Integer> e : cellStats.entrySet()) {
            System.out.println(String.format("ABC RESULTS:   %15s cells: %8d", e.getKey(), e.getValue()));
        }

        int inWires = 0;
        int outWires = 0;
        for (GateNode n : ctx.getGraph().getNodes()) {
            if (!n.isPort()) continue;
            SigSpec orig = SigSpec.of(n.getBit());
            SigSpec mappedSig = nameMap.wire(n.getExportName()).getSigSpec();
            if (n.getType() != GateType.NONE) {
                module.connect(orig, mappedSig);
                outWires++;
            } else {
                module.connect(mappedSig, orig);
                inWires++;
            }
        }
        int internal = ctx.getGraph().size() - inWires - outWires;
        System.out.println(String.format("ABC RESULTS:        internal signals: %8d", internal));
        System.out.println(String.format("ABC RESULTS:           input signals: %8d", inWires));
        System.out.println(String.format("ABC RESULTS:          output signals: %8d", outWires));
        return new ReintegrationResult(false, cellStats, internal, inWires, outWires);
    }

    /**
     * Translates a cell of the built-in library back into host primitives.
     * @return False if the cell is not a built-in library cell.
     */
    private boolean translateLibraryCell(Cell c) {
        String type = c.getType();
        if (type.equals(LIB_ZERO) || type.equals(LIB_ONE)) {
            module.connect(hostSignal(c, GateType.OUTPUT_PIN), SigSpec.of(type.equals(LIB_ZERO) ? State.S0 : State.S1));
            return true;
        }
        if (type.equals(GateType.BUF.getLibName())) {
            module.connect(hostSignal(c, GateType.OUTPUT_PIN), hostSignal(c, "A"));
            return true;
        }
        GateType gate = GateType.fromLibName(type);
        if (gate != null) {
            addHostCell(c, gate.getHostType(), gate.getInputPins());
            return true;
        }
        WideMuxType mux = WideMuxType.fromLibName(type);
        if (mux != null) {
            addHostCell(c, mux.getHostType(), mux.getInputPins());
            return true;
        }
        if (type.equals(BUILTIN_DFF)) {
            addRegister(c);
            return true;
        }
        return false;
    }

    private void translateCell(Cell c) {
        String type = c.getType();
        if (type.equals(CONST0) || type.equals(CONST1)) {
            SigSpec first = c.getConnections().values().iterator().next();
            module.connect(remapSignal(first), SigSpec.of(type.equals(CONST0) ? State.S0 : State.S1));
            return;
        }
        if (type.equals(GENERIC_DFF)) {
            addRegister(c);
            return;
        }
        if (type.equals(BlifParser.LUT_TYPE) && c.getPort("A").size() == 1
                && Const.toInt(c.getParameter("LUT")) == 2) {
            module.connect(hostSignal(c, "Y"), hostSignal(c, "A"));
            return;
        }
        Cell cell = module.addCell(nameMap.remap(c.getName()), type);
        markGroup(cell);
        for (Map.Entry<String, String> e : c.getParameters().entrySet()) {
            cell.setParameter(e.getKey(), e.getValue());
        }
        for (Map.Entry<String, SigSpec> e : c.getConnections().entrySet()) {
            cell.setPort(e.getKey(), remapSignal(e.getValue()));
        }
    }

    private void addHostCell(Cell c, String hostType, List<String> inputPins) {
        Cell cell = module.addCell(nameMap.remap(c.getName()), hostType);
        markGroup(cell);
        List<String> pins = new ArrayList<>(inputPins);
        pins.add(GateType.OUTPUT_PIN);
        for (String pin : pins) {
            cell.setPort(pin, hostSignal(c, pin));
        }
    }

    private void addRegister(Cell c) {
        ClockDomainKey domain = ctx.getDomain();
        if (domain.getClkSig().size() != 1) {
            throw new RuntimeException("ERROR: Register " + c.getName() + " in optimizer output but the clock domain "
                    + domain.describe() + " has no single bit clock.");
        }
        Cell cell = module.addCell(nameMap.remap(c.getName()), domain.getRegisterType());
        if (domain.hasEnable()) {
            if (domain.getEnSig().size() != 1) {
                throw new RuntimeException("ERROR: Enable signal " + domain.getEnSig() + " is not a single bit.");
            }
            cell.setPort("E", domain.getEnSig());
        }
        markGroup(cell);
        cell.setPort("D", hostSignal(c, "D"));
        cell.setPort("Q", hostSignal(c, "Q"));
        cell.setPort("C", domain.getClkSig());
    }

    /**
     * @return The host wire of the single bit wire on a pin of a mapped cell.
     */
    private SigSpec hostSignal(Cell c, String pin) {
        SigSpec sig = c.getPort(pin);
        if (sig.size() != 1 || sig.get(0).isConst()) {
            throw new RuntimeException("ERROR: Optimizer cell " + c.getName() + " of type " + c.getType()
                    + " needs a single wire on pin " + pin + ", found " + sig + ".");
        }
        return nameMap.wire(sig.get(0).getWire().getName()).getSigSpec();
    }

    private SigSpec remapSignal(SigSpec sig) {
        List<SigBit> bits = new ArrayList<>(sig.size());
        for (SigBit b : sig) {
            bits.add(b.isConst() ? b : nameMap.wire(b.getWire().getName()).getBit(0));
        }
        return SigSpec.of(bits);
    }

    private void markGroup(PropertyObject o) {
        if (ctx.isMarkgroups()) o.setAttribute(ABCGROUP, ctx.getMapAutoIdx());
    }
}
