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
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.orlo.util.FileTools;

import joptsimple.OptionSet;

public class TestAbcScript {

    private static final File DIR = new File("/work/top_0");

    private static OrloConfig configure(String... args) {
        OptionSet options = OrloConfig.createOptionParser(false).parse(args);
        OrloConfig config = new OrloConfig();
        config.applyOptions(options);
        config.resolve();
        return config;
    }

    @Test
    public void testBuiltinLibraryScript() {
        List<String> cmds = AbcScript.build(configure(), DIR).getCommands();
        Assertions.assertEquals(Arrays.asList(
                "read_blif /work/top_0/input.blif",
                "read_library /work/top_0/stdcells.genlib",
                "strash", "ifraig", "scorr", "dc2", "dretime", "strash",
                "&get -n", "&dch -f", "&nf", "&put",
                "write_blif /work/top_0/output.blif"), cmds);
    }

    @Test
    public void testDelayTarget() {
        List<String> cmds = AbcScript.build(configure("-D", "1000", "-fast", "-dress"), DIR).getCommands();
        Assertions.assertEquals(Arrays.asList(
                "read_blif /work/top_0/input.blif",
                "read_library /work/top_0/stdcells.genlib",
                "strash", "dretime", "retime -o -D 1000", "map",
                "dress",
                "write_blif /work/top_0/output.blif"), cmds);
    }

    @Test
    public void testLutScript() {
        List<String> cmds = AbcScript.build(configure("-lut", "4"), DIR).getCommands();
        Assertions.assertEquals("read_lut /work/top_0/lutdefs.txt", cmds.get(1));
        Assertions.assertTrue(cmds.contains("if"));
        Assertions.assertEquals("lutpack -S 1", cmds.get(cmds.size() - 2));

        List<String> mixed = AbcScript.build(configure("-lut", "4:6"), DIR).getCommands();
        Assertions.assertFalse(mixed.get(mixed.size() - 2).startsWith("lutpack"));
    }

    @Test
    public void testSopScript() {
        List<String> cmds = AbcScript.build(configure("-sop", "-I", "8", "-P", "32"), DIR).getCommands();
        Assertions.assertEquals("cover -I 8 -P 32", cmds.get(cmds.size() - 2));
        Assertions.assertEquals(AbcScript.ScriptRecipe.SOP, AbcScript.ScriptRecipe.select(configure("-sop")));
    }

    @Test
    public void testLibraryScripts() {
        OrloConfig config = configure("-liberty", "/libs/cells.lib", "-constr", "/libs/c.constr", "-D", "200");
        List<String> cmds = AbcScript.build(config, DIR).getCommands();
        Assertions.assertEquals("read_lib -w /libs/cells.lib", cmds.get(1));
        Assertions.assertEquals("read_constr -v /libs/c.constr", cmds.get(2));
        Assertions.assertTrue(cmds.contains("upsize -D 200"));
        Assertions.assertEquals("stime -p", cmds.get(cmds.size() - 2));
        Assertions.assertEquals(AbcScript.ScriptRecipe.LIB,
                AbcScript.ScriptRecipe.select(configure("-genlib", "/libs/cells.genlib")));
    }

    @Test
    public void testUserScript() {
        OrloConfig config = configure("-script", "+strash;map,{D};print_stats", "-D", "100");
        List<String> cmds = AbcScript.build(config, DIR).getCommands();
        Assertions.assertEquals(Arrays.asList(
                "read_blif /work/top_0/input.blif",
                "read_library /work/top_0/stdcells.genlib",
                "strash", "map -D 100", "print_stats",
                "write_blif /work/top_0/output.blif"), cmds);

        List<String> noDelay = AbcScript.parseUserCommands("map,{D}", configure());
        Assertions.assertEquals(Arrays.asList("map"), noDelay);

        OrloConfig file = configure("-script", "my.abc");
        Assertions.assertEquals("source " + new File("my.abc").getAbsolutePath(),
                AbcScript.build(file, DIR).getCommands().get(2));
    }

    @Test
    public void testRenderAndWrite(@TempDir Path tmp) {
        AbcScript script = new AbcScript(Arrays.asList("strash", "map"));
        Assertions.assertEquals("echo + strash;\nstrash;\necho + map;\nmap\n", script.render());
        script.write(tmp.toFile());
        Assertions.assertEquals(Arrays.asList("echo + strash;", "strash;", "echo + map;", "map"),
                FileTools.getLinesFromTextFile(new File(tmp.toFile(), AbcScript.FILE_NAME).getPath()));
    }
}
