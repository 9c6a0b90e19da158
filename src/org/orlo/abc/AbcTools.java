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

import org.orlo.netlist.Module;
import org.orlo.util.FileTools;

/**
 * Work directory handling and invocation of the external optimizer.
 */
public class AbcTools {

    public static final String TOP_DIR_PREFIX = "yosys-abc-";

    private static final int MAX_MODULE_DIR_LENGTH = 252;

    /**
     * Creates the run's work directory {@code <topDir>/yosys-abc-XXXXXX}.
     * @return The absolute path of the new directory
     */
    public static String makeTopDir(String topDir) {
        return FileTools.makeTempDir(topDir, TOP_DIR_PREFIX);
    }

    /**
     * Names the work directory of one module and clock domain: the module
     * name with quote, dollar and backslash characters replaced by '-',
     * leading '-' removed, followed by the domain index.
     */
    public static File moduleDir(Module module, String topDir, int domainIdx) {
        String name = module.getName().replaceAll("['$\\\\]", "-");
        int idx = 0;
        while (idx < name.length() && name.charAt(idx) == '-') {
            idx++;
        }
        name = name.substring(idx);
        if (name.length() > MAX_MODULE_DIR_LENGTH) {
            name = name.substring(0, MAX_MODULE_DIR_LENGTH);
        }
        return new File(topDir, name + "_" + domainIdx);
    }

    /**
     * @return The command line that runs a script file.
     */
    public static String[] getCommand(String exe, File scriptFile) {
        return new String[]{exe, "-s", "-f", scriptFile.getPath()};
    }

    /**
     * Runs the optimizer on a script and blocks until it exits.
     * @throws RuntimeException if the optimizer exits with a non-zero code
     */
    public static void runAbc(String exe, File scriptFile, AbcOutputFilter filter, boolean showTempDir) {
        String[] cmd = getCommand(exe, scriptFile);
        String cmdLine = String.join(" ", cmd);
        System.out.println("Running ABC command: " + AbcOutputFilter.replaceTempDir(cmdLine,
                scriptFile.getParent(), showTempDir));
        int ret = FileTools.runCommand(cmd, filter, scriptFile.getParentFile());
        if (ret != 0) {
            throw new RuntimeException("ERROR: ABC: execution of command \"" + cmdLine + "\" failed: return code " + ret + ".");
        }
    }
}
