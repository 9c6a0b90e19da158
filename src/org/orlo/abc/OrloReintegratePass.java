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
import org.orlo.util.MessageGenerator;

import joptsimple.OptionSet;

/**
 * Second half of a split mapping flow. The design is extracted exactly as the
 * mapping pass did, but the optimized networks are read from the per-module
 * directories of an earlier run instead of running ABC again.
 */
public class OrloReintegratePass {

    public static final String COMMAND = "reint";

    public static List<ReintegrationResult> execute(Design design, OrloConfig config) {
        MessageGenerator.printHeader("Executing ABC reintegration pass.");
        String abcDir = config.getAbcDir();
        if (abcDir == null || abcDir.isEmpty()) {
            throw new RuntimeException("ERROR: An ABC work directory must be specified (-abc_dir or the '"
                    + OrloConfig.SCRATCH_DIR + "' scratchpad value).");
        }
        if (!new File(abcDir).isDirectory()) {
            MessageGenerator.warning("ABC work directory " + abcDir + " does not exist.");
        }

        ModuleMapper mapper = new ModuleMapper(design, config, abcDir, true);
        List<ReintegrationResult> results = new ArrayList<>();
        for (Module module : OrloPass.selectModules(design)) {
            results.addAll(mapper.processModule(module));
        }
        return results;
    }

    public static void main(String[] args) {
        OptionSet options = OrloPass.parseArgs(COMMAND, true, args);
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
