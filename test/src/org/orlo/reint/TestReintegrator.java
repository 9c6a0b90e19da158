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
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.orlo.blif.BlifParser;
import org.orlo.gate.BoundaryMarker;
import org.orlo.gate.ClockDomainKey;
import org.orlo.gate.GateExtractor;
import org.orlo.gate.GateType;
import org.orlo.gate.LoopBreaker;
import org.orlo.gate.MappingContext;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.Wire;
import org.orlo.support.SmallDesigns;
import org.orlo.util.FileTools;

public class TestReintegrator {

    private static MappingContext prepare(Design design, Module m, ClockDomainKey domain) {
        MappingContext ctx = new MappingContext(design, m, domain);
        GateExtractor.extractCells(ctx, m.getCells());
        BoundaryMarker.markBoundary(ctx);
        LoopBreaker.breakLoops(ctx);
        return ctx;
    }

    private static Design parse(String blif, boolean builtinLib) {
        return BlifParser.parse(new StringReader(blif), builtinLib ? Reintegrator.BUILTIN_DFF
                : Reintegrator.GENERIC_DFF, false);
    }

    private static List<Cell> cellsOfType(Module m, String type) {
        List<Cell> cells = new ArrayList<>();
        for (Cell c : m.getCells()) {
            if (c.getType().equals(type)) cells.add(c);
        }
        return cells;
    }

    @ParameterizedTest
    @EnumSource(value = GateType.class, names = {"NONE", "FF", "BUF"}, mode = EnumSource.Mode.EXCLUDE)
    public void testLibraryGateRoundTrip(GateType type) {
        Design design = new Design();
        Module m = design.addModule("m");
        Cell g = m.addCell("g", type.getHostType());
        StringBuilder gate = new StringBuilder(".gate " + type.getLibName());
        for (int i = 0; i < type.getArity(); i++) {
            String pin = type.getInputPins().get(i);
            g.setPort(pin, SmallDesigns.addPort(m, pin.toLowerCase(), PortDirection.INPUT));
            gate.append(' ').append(pin).append("=ys__n").append(i);
        }
        g.setPort(GateType.OUTPUT_PIN, SmallDesigns.addPort(m, "y", PortDirection.OUTPUT));
        gate.append(" Y=ys__n").append(type.getArity());

        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);
        Assertions.assertEquals(0, m.getCellCount());

        StringBuilder inputs = new StringBuilder(".inputs");
        for (int i = 0; i < type.getArity(); i++) {
            inputs.append(" ys__n").append(i);
        }
        String blif = ".model netlist\n" + inputs + "\n.outputs ys__n" + type.getArity() + "\n" + gate + "\n.end\n";
        ReintegrationResult result = Reintegrator.reintegrate(ctx, parse(blif, true), true);

        Assertions.assertFalse(result.isSkipped());
        Assertions.assertEquals(1, result.getCellCount(type.getLibName()));
        Assertions.assertEquals(type.getArity(), result.getInputSignals());
        Assertions.assertEquals(1, result.getOutputSignals());
        Assertions.assertEquals(0, result.getInternalSignals());

        List<Cell> cells = cellsOfType(m, type.getHostType());
        Assertions.assertEquals(1, cells.size());
        Cell c = cells.get(0);
        int idx = ctx.getMapAutoIdx();
        for (String pin : type.getInputPins()) {
            Assertions.assertEquals("$abc$" + idx + "$" + pin.toLowerCase(), c.getPort(pin).asWire().getName());
        }
        Assertions.assertEquals("$abc$" + idx + "$y", c.getPort("Y").asWire().getName());

        // Boundary connections join the new wires to the original signals
        SigMap sigMap = new SigMap(m);
        Assertions.assertEquals(sigMap.apply(m.getWire("y").getBit(0)), sigMap.apply(c.getPort("Y").asBit()));
        Assertions.assertEquals(sigMap.apply(m.getWire("a").getBit(0)), sigMap.apply(c.getPort("A").asBit()));
    }

    @Test
    public void testBufferAndConstants() {
        Design design = new Design();
        Module m = design.addModule("m");
        Wire a = SmallDesigns.addPort(m, "a", PortDirection.INPUT);
        Wire y = SmallDesigns.addPort(m, "y", PortDirection.OUTPUT);
        Wire z = SmallDesigns.addPort(m, "z", PortDirection.OUTPUT);
        SmallDesigns.addGate(m, "b0", "$_BUF_", a, y);
        SmallDesigns.addGate(m, "n0", "$_NOT_", a, z);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);

        String blif = ".model netlist\n.inputs ys__n0\n.outputs ys__n1 ys__n2\n"
                + ".gate BUF A=ys__n0 Y=ys__n1\n"
                + ".gate ZERO Y=ys__n2\n"
                + ".end\n";
        ReintegrationResult result = Reintegrator.reintegrate(ctx, parse(blif, true), true);
        Assertions.assertEquals(0, m.getCellCount());
        Assertions.assertEquals(1, result.getCellCount("BUF"));
        Assertions.assertEquals(1, result.getCellCount("ZERO"));

        SigMap sigMap = new SigMap(m);
        Assertions.assertEquals(SigBit.S0, sigMap.apply(z.getBit(0)));
        Assertions.assertEquals(sigMap.apply(a.getBit(0)), sigMap.apply(y.getBit(0)));
    }

    @Test
    public void testLutsCopiedAndIdentityCollapsed() {
        Design design = new Design();
        Module m = design.addModule("m");
        Wire a = SmallDesigns.addPort(m, "a", PortDirection.INPUT);
        Wire b = SmallDesigns.addPort(m, "b", PortDirection.INPUT);
        Wire y = SmallDesigns.addPort(m, "y", PortDirection.OUTPUT);
        Wire z = SmallDesigns.addPort(m, "z", PortDirection.OUTPUT);
        SmallDesigns.addGate(m, "x0", "$_XOR_", a, b, y);
        SmallDesigns.addGate(m, "b0", "$_BUF_", a, z);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);

        String blif = ".model netlist\n.inputs ys__n0 ys__n1\n.outputs ys__n2 ys__n3\n"
                + ".names ys__n0 ys__n1 ys__n2\n01 1\n10 1\n"
                + ".names ys__n0 ys__n3\n1 1\n"
                + ".end\n";
        Reintegrator.reintegrate(ctx, parse(blif, false), false);
        List<Cell> luts = cellsOfType(m, BlifParser.LUT_TYPE);
        Assertions.assertEquals(1, luts.size());
        Assertions.assertEquals("0110", luts.get(0).getParameter("LUT"));
        Assertions.assertTrue(luts.get(0).getName().startsWith("$abc$" + ctx.getMapAutoIdx() + "$"));

        SigMap sigMap = new SigMap(m);
        Assertions.assertEquals(sigMap.apply(a.getBit(0)), sigMap.apply(z.getBit(0)));
    }

    @Test
    public void testRegisterAndInitRecovery() {
        Design design = new Design();
        Module m = SmallDesigns.andIntoRegister(design);
        m.getWire("q").setAttribute(Wire.INIT, "1");
        MappingContext ctx = prepare(design, m, ClockDomainKey.parse("clk", m, new SigMap(m)));
        Assertions.assertTrue(ctx.isRecoverInit());

        String blif = ".model netlist\n.inputs ys__n0 ys__n1\n.outputs ys__n3\n"
                + ".gate AND A=ys__n0 B=ys__n1 Y=ys__n2\n"
                + ".latch ys__n2 ys__n3 1\n"
                + ".end\n";
        Reintegrator.reintegrate(ctx, parse(blif, true), true);
        Assertions.assertEquals("1", m.getWire("$abc$" + ctx.getMapAutoIdx() + "$q").getAttribute(Wire.INIT));
    }

    @Test
    public void testRegisterRebuiltInDomain() {
        Design design = new Design();
        Module m = SmallDesigns.andIntoRegister(design);
        MappingContext ctx = prepare(design, m, ClockDomainKey.parse("clk", m, new SigMap(m)));
        Assertions.assertFalse(ctx.isRecoverInit());

        String blif = ".model netlist\n.inputs ys__n0 ys__n1\n.outputs ys__n3\n"
                + ".gate AND A=ys__n0 B=ys__n1 Y=ys__n2\n"
                + ".latch ys__n2 ys__n3 2\n"
                + ".end\n";
        ReintegrationResult result = Reintegrator.reintegrate(ctx, parse(blif, true), true);
        Assertions.assertEquals(1, result.getCellCount("DFF"));
        List<Cell> ffs = cellsOfType(m, "$_DFF_P_");
        Assertions.assertEquals(1, ffs.size());
        Cell ff = ffs.get(0);
        Assertions.assertEquals(m.getWire("clk").getSigSpec(), ff.getPort("C"));
        Assertions.assertEquals("$abc$" + ctx.getMapAutoIdx() + "$q", ff.getPort("Q").asWire().getName());
        Assertions.assertEquals("$abc$" + ctx.getMapAutoIdx() + "$y", ff.getPort("D").asWire().getName());
        Assertions.assertEquals(1, cellsOfType(m, "$_AND_").size());
        Assertions.assertNull(m.getWire("$abc$" + ctx.getMapAutoIdx() + "$q").getAttribute(Wire.INIT));
    }

    @Test
    public void testMarkgroups() {
        Design design = new Design();
        Module m = SmallDesigns.orLoop(design);
        MappingContext ctx = new MappingContext(design, m, ClockDomainKey.NO_CLOCK);
        ctx.setMarkgroups(true);
        GateExtractor.extractCells(ctx, m.getCells());
        BoundaryMarker.markBoundary(ctx);
        LoopBreaker.breakLoops(ctx);

        String blif = ".model netlist\n.inputs ys__n0 ys__n3\n.outputs ys__n1 ys__n2\n"
                + ".gate BUF A=ys__n2 Y=ys__n1\n"
                + ".gate OR A=ys__n0 B=ys__n3 Y=ys__n2\n"
                + ".end\n";
        Reintegrator.reintegrate(ctx, parse(blif, true), true);
        Cell or = cellsOfType(m, "$_OR_").get(0);
        Assertions.assertTrue(or.hasAttribute(Reintegrator.ABCGROUP));
        Assertions.assertTrue(m.getWire("$abc$" + ctx.getMapAutoIdx() + "$w").hasAttribute(Reintegrator.ABCGROUP));
    }

    @Test
    public void testMissingFileSkips(@TempDir Path tmp) {
        Design design = new Design();
        Module m = SmallDesigns.orLoop(design);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);
        ReintegrationResult result = Reintegrator.reintegrate(ctx, tmp.toFile(), true, false);
        Assertions.assertTrue(result.isSkipped());
    }

    @Test
    public void testReadsOutputFile(@TempDir Path tmp) {
        Design design = new Design();
        Module m = design.addModule("m");
        Wire a = SmallDesigns.addPort(m, "a", PortDirection.INPUT);
        Wire y = SmallDesigns.addPort(m, "y", PortDirection.OUTPUT);
        SmallDesigns.addGate(m, "n0", "$_NOT_", a, y);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);
        FileTools.writeStringToTextFile(".model netlist\n.inputs ys__n0\n.outputs ys__n1\n"
                + ".gate NOT A=ys__n0 Y=ys__n1\n.end",
                new File(tmp.toFile(), Reintegrator.OUTPUT_FILE).getPath());
        ReintegrationResult result = Reintegrator.reintegrate(ctx, tmp.toFile(), true, false);
        Assertions.assertEquals(1, result.getCellCount("NOT"));
        Assertions.assertEquals(1, cellsOfType(m, "$_NOT_").size());
    }

    @Test
    public void testMissingModelFails() {
        Design design = new Design();
        Module m = SmallDesigns.orLoop(design);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> Reintegrator.reintegrate(ctx, parse(".model other\n.end\n", true), true));
        Assertions.assertTrue(e.getMessage().contains("netlist"));
    }

    @Test
    public void testUnknownOutputSignalFails() {
        Design design = new Design();
        Module m = design.addModule("m");
        Wire a = SmallDesigns.addPort(m, "a", PortDirection.INPUT);
        Wire y = SmallDesigns.addPort(m, "y", PortDirection.OUTPUT);
        SmallDesigns.addGate(m, "n0", "$_NOT_", a, y);
        MappingContext ctx = prepare(design, m, ClockDomainKey.NO_CLOCK);
        // ys__n1 is a boundary output but the network does not define it
        String blif = ".model netlist\n.inputs ys__n0\n.outputs other\n.gate NOT A=ys__n0 Y=other\n.end\n";
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> Reintegrator.reintegrate(ctx, parse(blif, true), true));
        Assertions.assertTrue(e.getMessage().contains("ys__n1"));
    }
}
