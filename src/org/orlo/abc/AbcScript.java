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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.orlo.blif.GenlibWriter;
import org.orlo.blif.LutLibraryWriter;
import org.orlo.reint.Reintegrator;
import org.orlo.util.FileTools;

/**
 * An optimizer script: commands that read the network and library, an
 * optimization recipe, and the command that writes the result. Rendered with
 * an echo before every command so the optimizer log shows what it runs.
 */
public class AbcScript {

    public static final String FILE_NAME = "abc.script";

    public static final String INPUT_FILE = "input.blif";

    /** Value a recipe step takes from the configuration */
    public enum ArgKind {
        DELAY("-D"),
        SOP_INPUTS("-I"),
        SOP_PRODUCTS("-P"),
        LUTIN_SHARED("-S");

        private final String flag;

        ArgKind(String flag) {
            this.flag = flag;
        }

        public String getFlag() {
            return flag;
        }

        String valueOf(OrloConfig config) {
            switch (this) {
                case DELAY: return config.getDelayTarget();
                case SOP_INPUTS: return config.getSopInputs();
                case SOP_PRODUCTS: return config.getSopProducts();
                default: return config.getLutinShared();
            }
        }
    }

    /**
     * One optimizer command with fixed text and configurable arguments.
     * Arguments whose value is not set are left out.
     */
    public static class Step {
        private final String command;
        private final List<ArgKind> args;

        public Step(String command, ArgKind... args) {
            this.command = command;
            this.args = Collections.unmodifiableList(Arrays.asList(args));
        }

        public String getCommand() {
            return command;
        }

        public String render(OrloConfig config) {
            StringBuilder sb = new StringBuilder(command);
            for (ArgKind a : args) {
                String value = a.valueOf(config);
                if (value == null || value.isEmpty()) continue;
                sb.append(' ').append(a.getFlag()).append(' ').append(value);
            }
            return sb.toString();
        }
    }

    private static Step step(String command, ArgKind... args) {
        return new Step(command, args);
    }

    private static List<Step> steps(Step... steps) {
        return Collections.unmodifiableList(Arrays.asList(steps));
    }

    private static final List<Step> RESYN = steps(step("strash"), step("ifraig"), step("scorr"), step("dc2"),
            step("dretime"), step("strash"));

    private static List<Step> concat(List<Step> a, Step... b) {
        List<Step> l = new ArrayList<>(a);
        l.addAll(Arrays.asList(b));
        return Collections.unmodifiableList(l);
    }

    /** Default optimization command sequences per target */
    public enum ScriptRecipe {
        /** Cell library without timing constraints */
        LIB(concat(RESYN, step("&get -n"), step("&dch -f"), step("&nf", ArgKind.DELAY), step("&put")),
                steps(step("strash"), step("dretime"), step("map", ArgKind.DELAY))),
        /** Cell library with timing constraints */
        CTR(concat(RESYN, step("&get -n"), step("&dch -f"), step("&nf", ArgKind.DELAY), step("&put"),
                step("buffer"), step("upsize", ArgKind.DELAY), step("dnsize", ArgKind.DELAY), step("stime -p")),
                steps(step("strash"), step("dretime"), step("map", ArgKind.DELAY), step("buffer"),
                        step("upsize", ArgKind.DELAY), step("dnsize", ArgKind.DELAY), step("stime -p"))),
        /** Lookup tables */
        LUT(concat(RESYN, step("dch -f"), step("if"), step("mfs2")),
                steps(step("strash"), step("dretime"), step("if"))),
        /** Sum of products */
        SOP(concat(RESYN, step("dch -f"), step("cover", ArgKind.SOP_INPUTS, ArgKind.SOP_PRODUCTS)),
                steps(step("strash"), step("dretime"), step("cover", ArgKind.SOP_INPUTS, ArgKind.SOP_PRODUCTS))),
        /** Built-in gate library */
        DFL(concat(RESYN, step("&get -n"), step("&dch -f"), step("&nf", ArgKind.DELAY), step("&put")),
                steps(step("strash"), step("dretime"), step("map")));

        private final List<Step> normal;
        private final List<Step> fast;

        ScriptRecipe(List<Step> normal, List<Step> fast) {
            this.normal = normal;
            this.fast = fast;
        }

        public List<Step> getSteps(boolean fastMode) {
            return fastMode ? fast : normal;
        }

        /**
         * Picks the recipe matching the configured target.
         */
        public static ScriptRecipe select(OrloConfig config) {
            if (!config.getLutCosts().isEmpty()) return LUT;
            if (!config.isBuiltinLibrary()) {
                String constr = config.getConstrFile();
                return constr == null || constr.isEmpty() ? LIB : CTR;
            }
            return config.isSopMode() ? SOP : DFL;
        }
    }

    private final List<String> commands;

    public AbcScript(List<String> commands) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
    }

    /**
     * Builds the script of one module/domain work directory.
     * @param config Pass configuration, already resolved
     * @param dir Work directory holding input.blif and the generated libraries
     */
    public static AbcScript build(OrloConfig config, File dir) {
        List<String> cmds = new ArrayList<>();
        cmds.add("read_blif " + new File(dir, INPUT_FILE).getPath());
        if (!config.isBuiltinLibrary()) {
            for (String lib : config.getLibertyFiles()) {
                cmds.add("read_lib -w " + lib);
            }
            for (String lib : config.getGenlibFiles()) {
                cmds.add("read_library " + lib);
            }
            String constr = config.getConstrFile();
            if (constr != null && !constr.isEmpty()) {
                cmds.add("read_constr -v " + constr);
            }
        } else if (!config.getLutCosts().isEmpty()) {
            cmds.add("read_lut " + new File(dir, LutLibraryWriter.FILE_NAME).getPath());
        } else {
            cmds.add("read_library " + new File(dir, GenlibWriter.FILE_NAME).getPath());
        }

        String script = config.getScriptFile();
        if (script != null && !script.isEmpty()) {
            if (script.startsWith("+")) {
                cmds.addAll(parseUserCommands(script.substring(1), config));
            } else {
                cmds.add("source " + script);
            }
        } else {
            boolean delay = config.getDelayTarget() != null && !config.getDelayTarget().isEmpty();
            for (Step s : ScriptRecipe.select(config).getSteps(config.isFast())) {
                cmds.add(s.render(config));
                if (delay && s.getCommand().equals("dretime")) {
                    cmds.add(step("retime -o", ArgKind.DELAY).render(config));
                }
            }
            if (!config.getLutCosts().isEmpty() && !config.isFast() && allCostsEqual(config.getLutCosts())) {
                cmds.add(step("lutpack", ArgKind.LUTIN_SHARED).render(config));
            }
        }
        if (config.isDress()) {
            cmds.add("dress");
        }
        cmds.add("write_blif " + new File(dir, Reintegrator.OUTPUT_FILE).getPath());
        return new AbcScript(cmds);
    }

    private static boolean allCostsEqual(List<Integer> costs) {
        for (int c : costs) {
            if (c != costs.get(0)) return false;
        }
        return true;
    }

    /**
     * Splits inline script text at ';'. Commas stand for blanks and the
     * placeholders {D}, {I}, {P} and {S} are replaced by their flag and value.
     */
    static List<String> parseUserCommands(String text, OrloConfig config) {
        String s = text.replace(",", " ").replace("'", "'\\''");
        for (ArgKind a : ArgKind.values()) {
            String value = a.valueOf(config);
            String replacement = value == null || value.isEmpty() ? "" : a.getFlag() + " " + value;
            s = s.replace("{" + a.getFlag().substring(1) + "}", replacement);
        }
        List<String> cmds = new ArrayList<>();
        for (String c : s.split(";")) {
            String trimmed = c.trim();
            if (!trimmed.isEmpty()) cmds.add(trimmed);
        }
        return cmds;
    }

    public List<String> getCommands() {
        return commands;
    }

    /**
     * @return The script text: every command echoed, then run.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < commands.size(); i++) {
            String c = commands.get(i);
            sb.append("echo + ").append(c).append(";\n");
            sb.append(c).append(i + 1 < commands.size() ? ";\n" : "\n");
        }
        return sb.toString();
    }

    public void write(File dir) {
        String text = render();
        FileTools.writeStringToTextFile(text.substring(0, text.length() - 1), new File(dir, FILE_NAME).getPath());
    }
}
