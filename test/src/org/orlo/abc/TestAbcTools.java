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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;

public class TestAbcTools {

    @Test
    public void testModuleDir() {
        Design design = new Design();
        Module plain = design.addModule("top");
        Module escaped = design.addModule("$paramod\\fifo'8");
        Assertions.assertEquals(new File("/w", "top_0"), AbcTools.moduleDir(plain, "/w", 0));
        Assertions.assertEquals(new File("/w", "paramod-fifo-8_2"), AbcTools.moduleDir(escaped, "/w", 2));

        StringBuilder longName = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            longName.append('x');
        }
        Module big = design.addModule(longName.toString());
        Assertions.assertEquals(252 + 2, AbcTools.moduleDir(big, "/w", 0).getName().length());
    }

    @Test
    public void testMakeTopDir(@TempDir Path tmp) {
        String dir = AbcTools.makeTopDir(tmp.toString());
        File f = new File(dir);
        Assertions.assertTrue(f.isDirectory());
        Assertions.assertTrue(f.isAbsolute());
        Assertions.assertTrue(f.getName().startsWith(AbcTools.TOP_DIR_PREFIX));
        Assertions.assertEquals(AbcTools.TOP_DIR_PREFIX.length() + 6, f.getName().length());
        Assertions.assertNotEquals(dir, AbcTools.makeTopDir(tmp.toString()));
    }

    @Test
    public void testCommand() {
        Assertions.assertArrayEquals(new String[]{"yosys-abc", "-s", "-f", "/w/top_0/abc.script"},
                AbcTools.getCommand("yosys-abc", new File("/w/top_0/abc.script")));
    }
}
