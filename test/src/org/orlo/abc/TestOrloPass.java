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
package org.orlo.abc;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.orlo.blif.BlifParser;
import org.orlo.json.YosysJsonReader;
import org.orlo.json.YosysJsonWriter;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.Wire;
import org.orlo.reint.ReintegrationResult;
import org.orlo.support.SmallDesigns;
import org.orlo.util.FileTools;

/**
 * Runs the passes against a stand-in optimizer: a shell script that returns
 * the exported network unchanged.
 */
public class TestOrloPass {

    @TempDir
    Path tmp;

    private String passThroughAbc;

    @BeforeEach
    public void setup() {
        Assumptions.assumeTrue(new File("/bin/sh").canExecute(), "needs a POSIX shell");
        passThroughAbc = writeScript("abc-copy", "cp " + AbcScript.INPUT_FILE + " output.blif");
    }

    private String writeScript(String name, String body) {
        File f = tmp.resolve(name).toFile();
        FileTools.writeStringToTextFile("#!/bin/sh\n" + body, f.getPath());
        Assertions.assertTrue(f.setExecutable(true));
        return f.getAbsolutePath();
    }

    private OrloConfig config(String exe) {
        OrloConfig config = new OrloConfig();
        config.setExe(exe);
        config.setAbcTopDir(tmp.toString());
        config.setCleanup(true);
        config.resolve();
        return config;
    }

    private static int count(Module m, String type) {
        int n = 0;
        for (Cell c : m.getCells()) {
            if (c.getType().equals(type)) n++;
        }
        return n;
    }

    @Test
    public void testCombinationalOnly() {
        Design design = new Design();
        Module m = SmallDesigns.andIntoRegister(design);
        List<ReintegrationResult> results = OrloPass.execute(design, config(passThroughAbc));

        Assertions.assertEquals(1, results.size());
        Assertions.assertEquals(1, results.get(0).getCellCount(BlifParser.LUT_TYPE));
        Assertions.assertEquals(0, count(m, "$_AND_"));
        Assertions.assertEquals(1, count(m, BlifParser.LUT_TYPE));
        Assertions.assertNotNull(m.getCell("ff0"));

        String topDir = design.getScratchpadString(OrloConfig.SCRATCH_DIR, null);
        Assertions.assertNotNull(topDir);
        Assertions.assertFalse(new File(topDir).exists());
    }

    @Test
    public void testRegistersPerClockDomain() {
        Design design = new Design();
        Module m = SmallDesigns.twoDomains(design);
        OrloConfig config = config(passThroughAbc);
        config.setDffMode(true);
        List<ReintegrationResult> results = OrloPass.execute(design, config);

        // clk2 (negedge), clk1 (posedge) and the unclocked AND gate
        Assertions.assertEquals(3, results.size());
        Assertions.assertEquals(1, count(m, "$_DFF_P_"));
        Assertions.assertEquals(1, count(m, "$_DFF_N_"));
        Assertions.assertEquals(0, count(m, "$_NOT_"));
        Assertions.assertEquals(3, count(m, BlifParser.LUT_TYPE));
        Assertions.assertNull(m.getCell("ff1"));
    }

    @Test
    public void testSelectedClockDomain() {
        Design design = new Design();
        Module m = SmallDesigns.twoDomains(design);
        OrloConfig config = config(passThroughAbc);
        config.setClkStr("!clk2");
        OrloPass.execute(design, config);
        Assertions.assertNotNull(m.getCell("ff1"));
        Assertions.assertNull(m.getCell("ff2"));
        Assertions.assertEquals(1, count(m, "$_DFF_N_"));
    }

    @Test
    public void testMissingClock() {
        Design design = new Design();
        SmallDesigns.twoDomains(design);
        OrloConfig config = config(passThroughAbc);
        config.setClkStr("clk3");
        RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> OrloPass.execute(design, config));
        Assertions.assertEquals("ERROR: Clock domain clk3 not found.", e.getMessage());
    }

    @Test
    public void testNothingToMap() {
        Design design = new Design();
        Module m = design.addModule("regs");
        Wire clk = SmallDesigns.addPort(m, "clk", PortDirection.INPUT);
        Wire d = SmallDesigns.addPort(m, "d", PortDirection.INPUT);
        Wire q = SmallDesigns.addPort(m, "q", PortDirection.OUTPUT);
        SmallDesigns.addRegister(m, "ff", "$_DFF_P_", clk, d, q);
        List<ReintegrationResult> results = OrloPass.execute(design, config("/nonexistent/yosys-abc"));
        Assertions.assertTrue(results.get(0).isSkipped());
        Assertions.assertEquals(1, m.getCellCount());
    }

    @Test
    public void testSkippedModules() {
        Design design = new Design();
        Module procs = SmallDesigns.andIntoRegister(design);
        procs.setHasProcesses(true);
        Module box = SmallDesigns.orLoop(design);
        box.setAttribute(Module.BLACKBOX, 1);
        List<ReintegrationResult> results = OrloPass.execute(design, config("/nonexistent/yosys-abc"));
        Assertions.assertTrue(results.isEmpty());
        Assertions.assertEquals(2, procs.getCellCount());
        Assertions.assertEquals(2, box.getCellCount());
    }

    @Test
    public void testOptimizerFailure() {
        Design design = new Design();
        SmallDesigns.andIntoRegister(design);
        String failing = writeScript("abc-fail", "exit 3");
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> OrloPass.execute(design, config(failing)));
        Assertions.assertTrue(e.getMessage().endsWith("failed: return code 3."));
    }

    @Test
    public void testSplitFlow() {
        Design first = new Design();
        SmallDesigns.andIntoRegister(first);
        OrloConfig mapConfig = config(passThroughAbc);
        mapConfig.setCleanup(false);
        OrloPass.execute(first, mapConfig);
        String topDir = first.getScratchpadString(OrloConfig.SCRATCH_DIR, null);
        Assertions.assertTrue(new File(topDir, "top_0/output.blif").exists());

        Design second = new Design();
        Module m = SmallDesigns.andIntoRegister(second);
        second.setScratchpadString(OrloConfig.SCRATCH_DIR, topDir);
        OrloConfig reintConfig = new OrloConfig(second);
        reintConfig.resolve();
        List<ReintegrationResult> results = OrloReintegratePass.execute(second, reintConfig);
        Assertions.assertEquals(1, results.get(0).getCellCount(BlifParser.LUT_TYPE));
        Assertions.assertEquals(0, count(m, "$_AND_"));
    }

    @Test
    public void testReintegrateNeedsDirectory() {
        Design design = new Design();
        SmallDesigns.andIntoRegister(design);
        OrloConfig config = new OrloConfig();
        config.resolve();
        Assertions.assertThrows(RuntimeException.class, () -> OrloReintegratePass.execute(design, config));
    }

    @Test
    public void testCommandLine() {
        Design design = new Design();
        SmallDesigns.andIntoRegister(design);
        File in = tmp.resolve("in.json").toFile();
        File out = tmp.resolve("out.json").toFile();
        YosysJsonWriter.write(design, in);

        OrloPass.main(new String[]{"-exe", passThroughAbc, "-abc_topdir", tmp.toString(), "-dff",
                in.getPath(), out.getPath()});

        Module m = YosysJsonReader.read(out).getModule("top");
        Assertions.assertEquals(1, count(m, BlifParser.LUT_TYPE));
        Assertions.assertEquals(1, count(m, "$_DFF_P_"));
        Assertions.assertNull(m.getCell("ff0"));
    }
}
