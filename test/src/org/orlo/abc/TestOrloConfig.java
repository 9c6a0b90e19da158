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
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.orlo.gate.WideMuxType;
import org.orlo.netlist.Design;

import joptsimple.OptionException;
import joptsimple.OptionSet;

public class TestOrloConfig {

    private static OrloConfig configure(boolean reint, String... args) {
        OptionSet options = OrloConfig.createOptionParser(reint).parse(args);
        OrloConfig config = new OrloConfig();
        config.applyOptions(options);
        config.resolve();
        return config;
    }

    @Test
    public void testDefaults() {
        OrloConfig config = configure(false);
        Assertions.assertTrue(config.isBuiltinLibrary());
        Assertions.assertFalse(config.isDffMode());
        Assertions.assertEquals("", config.getClkStr());
        Assertions.assertTrue(config.getLutCosts().isEmpty());
        Assertions.assertEquals(OrloConfig.DEFAULT_LUTIN_SHARED, config.getLutinShared());
        Assertions.assertEquals(GateSelection.getDefault().getEnabledGates(),
                config.getGateSelection().getEnabledGates());
    }

    @Test
    public void testOptions() {
        OrloConfig config = configure(false, "-D", "1000", "-fast", "-mux4", "-g", "cmos3",
                "-clk", "!clk,en", "-keepff", "-markgroups", "-nocleanup", "-showtmp", "in.json", "out.json");
        Assertions.assertEquals("1000", config.getDelayTarget());
        Assertions.assertTrue(config.isFast());
        Assertions.assertEquals(Collections.singleton(WideMuxType.MUX4), config.getWideMuxes());
        Assertions.assertTrue(config.getGateSelection().isCmosCost());
        Assertions.assertEquals("!clk,en", config.getClkStr());
        Assertions.assertTrue(config.isDffMode());
        Assertions.assertTrue(config.isKeepff());
        Assertions.assertTrue(config.isMarkgroups());
        Assertions.assertFalse(config.isCleanup());
        Assertions.assertTrue(config.isShowTempDir());
    }

    @Test
    public void testLutArguments() {
        Assertions.assertEquals(Arrays.asList(1, 1, 1, 1), OrloConfig.parseLut("4"));
        Assertions.assertEquals(Arrays.asList(1, 1, 1, 1, 2, 4), OrloConfig.parseLut("4:6"));
        Assertions.assertEquals(Arrays.asList(2, 4, 8), OrloConfig.parseLuts("2,4,8"));
        Assertions.assertEquals(Arrays.asList(1, 1, 1, 1, 1, 1, 3), OrloConfig.parseLuts("6:1,3"));
        Assertions.assertEquals(Arrays.asList(2, 2, 4), OrloConfig.parseLuts("2,,4"));
        Assertions.assertThrows(RuntimeException.class, () -> OrloConfig.parseLut("x"));
        Assertions.assertThrows(RuntimeException.class, () -> OrloConfig.parseLuts("1:2:3"));

        OrloConfig config = configure(false, "-lut", "4");
        Assertions.assertEquals(4, config.getLutCosts().size());
        Assertions.assertTrue(config.isBuiltinLibrary());
    }

    @Test
    public void testExclusiveOptions() {
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> configure(false, "-lut", "4", "-liberty", "cells.lib"));
        Assertions.assertTrue(e.getMessage().contains("exclusive"));
        Assertions.assertThrows(RuntimeException.class, () -> configure(false, "-constr", "c.constr"));
        Assertions.assertThrows(RuntimeException.class, () -> configure(false, "-g", "AND", "-g", "OR"));
    }

    @Test
    public void testLibraryPathsMadeAbsolute() {
        OrloConfig config = configure(false, "-liberty", "cells.lib", "-constr", "c.constr");
        Assertions.assertFalse(config.isBuiltinLibrary());
        Assertions.assertEquals(new File("cells.lib").getAbsolutePath(), config.getLibertyFiles().get(0));
        Assertions.assertEquals(new File("c.constr").getAbsolutePath(), config.getConstrFile());
    }

    @Test
    public void testReintOptions() {
        OrloConfig config = configure(true, "-abc_dir", "work", "-dff");
        Assertions.assertEquals(new File("work").getAbsolutePath(), config.getAbcDir());
        Assertions.assertTrue(config.isDffMode());
        Assertions.assertThrows(OptionException.class,
                () -> OrloConfig.createOptionParser(true).parse("-fast"));
    }

    @Test
    public void testScratchpadDefaults() {
        Design design = new Design();
        design.setScratchpadString("abc.D", "500");
        design.setScratchpadString("abc.mux8", "1");
        design.setScratchpadString("abc.clk", "clk");
        design.setScratchpadString("abc.nocleanup", "true");
        design.setScratchpadString(OrloConfig.SCRATCH_DIR, "/tmp/yosys-abc-XXXXXX");
        OrloConfig config = new OrloConfig(design);
        Assertions.assertEquals("500", config.getDelayTarget());
        Assertions.assertTrue(config.getWideMuxes().contains(WideMuxType.MUX8));
        Assertions.assertTrue(config.isDffMode());
        Assertions.assertFalse(config.isCleanup());
        Assertions.assertEquals("/tmp/yosys-abc-XXXXXX", config.getAbcDir());

        // Command line options override the scratchpad
        config.applyOptions(OrloConfig.createOptionParser(false).parse("-D", "250"));
        Assertions.assertEquals("250", config.getDelayTarget());
    }
}
