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
import java.util.ArrayList;
import java.util.List;

import org.orlo.json.YosysJsonReader;
import org.orlo.json.YosysJsonWriter;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.reint.ReintegrationResult;
import org.orlo.util.FileTools;
import org.orlo.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Technology mapping of a whole design: every module (or every clock domain of
 * a module) is exported, optimized by ABC and merged back.
 */
public class OrloPass {

    public static final String COMMAND = "map";

    /**
     * Maps all eligible modules of a design. The run's work directory is
     * published under the "abc.dir" scratchpad key.
     * @param design The design to transform in place
     * @param config A resolved configuration
     * @return The outcome of every cycle in module order
     */
    public static List<ReintegrationResult> execute(Design design, OrloConfig config) {
        MessageGenerator.printHeader("Executing ABC pass (technology mapping using ABC).");
        String topDir = AbcTools.makeTopDir(config.getAbcTopDir());
        design.setScratchpadString(OrloConfig.SCRATCH_DIR, topDir);
        System.out.println("Using work directory " + AbcOutputFilter.replaceTempDir(topDir, topDir,
                config.isShowTempDir()) + ".");

        ModuleMapper mapper = new ModuleMapper(design, config, topDir, false);
        List<ReintegrationResult> results = new ArrayList<>();
        for (Module module : selectModules(design)) {
            results.addAll(mapper.processModule(module));
        }

        if (config.isCleanup()) {
            FileTools.deleteFolder(topDir);
        }
        return results;
    }

    /**
     * @return The modules a pass works on, skipping black boxes and modules
     * that still contain processes.
     */
    static List<Module> selectModules(Design design) {
        List<Module> modules = new ArrayList<>();
        for (Module module : design.getModules()) {
            if (module.isBlackbox()) continue;
            if (module.hasProcesses()) {
                MessageGenerator.warning("Skipping module " + module.getName() + " as it contains processes.");
                continue;
            }
            modules.add(module);
        }
        return modules;
    }

    /**
     * Parses the command line of a pass.
     * @return The options, or null if help was printed
     */
    static OptionSet parseArgs(String command, boolean reint, String[] args) {
        OptionParser p = OrloConfig.createOptionParser(reint);
        OptionSet options = p.parse(args);
        if (options.has(OrloConfig.HELP_OPT)) {
            OrloConfig.printHelp(command, reint);
            return null;
        }
        if (options.nonOptionArguments().size() != 2) {
            OrloConfig.printHelp(command, reint);
            throw new RuntimeException("ERROR: Expected an input and an output JSON file name, found "
                    + options.nonOptionArguments());
        }
        return options;
    }

    public static void main(String[] args) {
        OptionSet options = parseArgs(COMMAND, false, args);
        if (options == null) return;
        String inputFile = (String) options.nonOptionArguments().get(0);
        String outputFile = (String) options.nonOptionArguments().get(1);

        Design design = YosysJsonReader.read(new File(inputFile));
        OrloConfig config = new OrloConfig(design);
        config.applyOptions(options);
        config.resolve();

        execute(design, config);
        YosysJsonWriter.write(design, new File(outputFile));
        System.out.println("Wrote " + outputFile);
    }
}
