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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import joptsimple.OptionParser;
import joptsimple.OptionSet;
import org.orlo.gate.WideMuxType;
import org.orlo.netlist.Design;
import org.orlo.util.MessageGenerator;
import org.orlo.util.Params;

/**
 * A collection of customizable parameters for the {@link OrloPass} and
 * {@link OrloReintegratePass}. Defaults come from {@link Params}, are then
 * overridden by "abc.*" values in the design's scratchpad and finally by
 * command options. Call {@link #resolve()} once all values are set.
 */
public class OrloConfig {

    public static final String SCRATCH_DIR = "abc.dir";

    public static final String DEFAULT_LUTIN_SHARED = "1";

    private String exe;

    private String scriptFile;

    private String defaultLibertyFile;

    private final List<String> libertyFiles = new ArrayList<>();

    private final List<String> genlibFiles = new ArrayList<>();

    private String constrFile;

    private String delayTarget;

    private String sopInputs;

    private String sopProducts;

    private String lutinShared;

    private String lutArg;

    private String lutsArg;

    private String gateArg;

    private List<Integer> lutCosts = Collections.emptyList();

    private GateSelection gateSelection = GateSelection.getDefault();

    private final Set<WideMuxType> wideMuxes = EnumSet.noneOf(WideMuxType.class);

    private boolean sopMode;

    private boolean dress;

    private boolean fast;

    private boolean dffMode;

    private String clkStr = "";

    private boolean keepff;

    private boolean cleanup;

    private boolean showTempDir;

    private boolean markgroups;

    private String abcTopDir;

    private String abcDir;

    private static final String EXE_OPT = "exe";
    private static final String SCRIPT_OPT = "script";
    private static final String LIBERTY_OPT = "liberty";
    private static final String GENLIB_OPT = "genlib";
    private static final String CONSTR_OPT = "constr";
    private static final String DELAY_OPT = "D";
    private static final String SOP_INPUTS_OPT = "I";
    private static final String SOP_PRODUCTS_OPT = "P";
    private static final String LUTIN_SHARED_OPT = "S";
    private static final String LUT_OPT = "lut";
    private static final String LUTS_OPT = "luts";
    private static final String SOP_OPT = "sop";
    private static final String MUX4_OPT = "mux4";
    private static final String MUX8_OPT = "mux8";
    private static final String MUX16_OPT = "mux16";
    private static final String DRESS_OPT = "dress";
    private static final String GATES_OPT = "g";
    private static final String FAST_OPT = "fast";
    private static final String DFF_OPT = "dff";
    private static final String CLK_OPT = "clk";
    private static final String KEEPFF_OPT = "keepff";
    private static final String NOCLEANUP_OPT = "nocleanup";
    private static final String SHOWTMP_OPT = "showtmp";
    private static final String MARKGROUPS_OPT = "markgroups";
    private static final String ABC_TOPDIR_OPT = "abc_topdir";
    private static final String ABC_DIR_OPT = "abc_dir";
    public static final String HELP_OPT = "help";

    public OrloConfig() {
        exe = Params.getAbcExecutable();
        abcTopDir = Params.getAbcTopDir();
        lutinShared = DEFAULT_LUTIN_SHARED;
        cleanup = true;
        if (Params.isParamSet(Params.ORLO_DEBUG_NAME)) {
            cleanup = false;
            showTempDir = true;
        }
    }

    /**
     * Creates a configuration seeded from the "abc.*" scratchpad values of a design.
     */
    public OrloConfig(Design design) {
        this();
        exe = design.getScratchpadString("abc.exe", exe);
        scriptFile = design.getScratchpadString("abc.script", scriptFile);
        defaultLibertyFile = design.getScratchpadString("abc.liberty", defaultLibertyFile);
        constrFile = design.getScratchpadString("abc.constr", constrFile);
        delayTarget = design.getScratchpadString("abc.D", delayTarget);
        sopInputs = design.getScratchpadString("abc.I", sopInputs);
        sopProducts = design.getScratchpadString("abc.P", sopProducts);
        lutinShared = design.getScratchpadString("abc.S", lutinShared);
        lutArg = design.getScratchpadString("abc.lut", lutArg);
        lutsArg = design.getScratchpadString("abc.luts", lutsArg);
        sopMode = design.getScratchpadBool("abc.sop", sopMode);
        setMux(WideMuxType.MUX4, design.getScratchpadBool("abc.mux4", false));
        setMux(WideMuxType.MUX8, design.getScratchpadBool("abc.mux8", false));
        setMux(WideMuxType.MUX16, design.getScratchpadBool("abc.mux16", false));
        dress = design.getScratchpadBool("abc.dress", dress);
        gateArg = design.getScratchpadString("abc.g", gateArg);
        fast = design.getScratchpadBool("abc.fast", fast);
        dffMode = design.getScratchpadBool("abc.dff", dffMode);
        if (design.hasScratchpadValue("abc.clk")) {
            setClkStr(design.getScratchpadString("abc.clk", ""));
        }
        keepff = design.getScratchpadBool("abc.keepff", keepff);
        cleanup = !design.getScratchpadBool("abc.nocleanup", !cleanup);
        showTempDir = design.getScratchpadBool("abc.showtmp", showTempDir);
        markgroups = design.getScratchpadBool("abc.markgroups", markgroups);
        if (design.getScratchpadBool("abc.debug", false)) {
            cleanup = false;
            showTempDir = true;
        }
        abcDir = design.getScratchpadString(SCRATCH_DIR, abcDir);
    }

    /**
     * @param reint True for the options of the reintegration command
     */
    public static OptionParser createOptionParser(boolean reint) {
        return new OptionParser() {
            {
                accepts(LIBERTY_OPT, "Generate netlists for the specified cell library (liberty format)").withRequiredArg();
                accepts(GENLIB_OPT, "Generate netlists for the specified cell library (genlib format)").withRequiredArg();
                accepts(SOP_OPT, "Map to sum-of-product cells and inverters");
                accepts(DFF_OPT, "Also pass $_DFF_?_ and $_DFFE_??_ cells through the optimizer, one clock domain at a time");
                accepts(CLK_OPT, "Use only the specified clock domain: [!]<clock-signal>[,[!]<enable-signal>]").withRequiredArg();
                accepts(KEEPFF_OPT, "Set the keep attribute on flip-flop output wires");
                if (reint) {
                    accepts(ABC_DIR_OPT, "Work directory holding the per-module output.blif files "
                            + "(default: the 'abc.dir' scratchpad value)").withRequiredArg();
                } else {
                    accepts(EXE_OPT, "Use the specified command to execute ABC").withRequiredArg();
                    accepts(SCRIPT_OPT, "Use the specified ABC script file, or '+cmd1,args;cmd2' as the script text").withRequiredArg();
                    accepts(CONSTR_OPT, "Timing constraints file for -liberty/-genlib").withRequiredArg();
                    accepts(DELAY_OPT, "Delay target (in picoseconds)").withRequiredArg();
                    accepts(SOP_INPUTS_OPT, "Maximum number of SOP inputs").withRequiredArg();
                    accepts(SOP_PRODUCTS_OPT, "Maximum number of SOP products").withRequiredArg();
                    accepts(LUTIN_SHARED_OPT, "Maximum number of LUT inputs shared (lutpack -S)").withRequiredArg();
                    accepts(LUT_OPT, "Generate netlist for LUTs of the given width, or width range n:m").withRequiredArg();
                    accepts(LUTS_OPT, "Generate netlist for LUTs with the given costs, e.g. 2,4,8 or 6:1").withRequiredArg();
                    accepts(MUX4_OPT, "Map to MUX4 cells as well");
                    accepts(MUX8_OPT, "Map to MUX8 cells as well");
                    accepts(MUX16_OPT, "Map to MUX16 cells as well");
                    accepts(DRESS_OPT, "Run the 'dress' command after mapping");
                    accepts(GATES_OPT, "Comma separated list of gate types and aliases to use").withRequiredArg();
                    accepts(FAST_OPT, "Use a faster but less optimizing script");
                    accepts(NOCLEANUP_OPT, "Do not remove the work directories when finished");
                    accepts(SHOWTMP_OPT, "Print the work directory names in log messages");
                    accepts(MARKGROUPS_OPT, "Set the 'abcgroup' attribute on all objects created by one run");
                    accepts(ABC_TOPDIR_OPT, "Directory in which the 'yosys-abc-XXXXXX' work directory is created").withRequiredArg();
                }
                accepts(HELP_OPT, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp(String command, boolean reint) {
        OptionParser p = createOptionParser(reint);
        MessageGenerator.printHeader("orlo " + command);
        System.out.println(reint
                ? "Reintegrates optimized networks from an existing work directory into the design."
                : "Passes the combinational logic (and optionally registers) of every module through ABC.");
        System.out.println("usage: orlo " + command + " [options] <in.json> <out.json>");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Applies parsed command options on top of the current values.
     */
    public void applyOptions(OptionSet options) {
        if (options.has(EXE_OPT)) exe = (String) options.valueOf(EXE_OPT);
        if (options.has(SCRIPT_OPT)) scriptFile = (String) options.valueOf(SCRIPT_OPT);
        for (Object o : options.valuesOf(LIBERTY_OPT)) libertyFiles.add((String) o);
        for (Object o : options.valuesOf(GENLIB_OPT)) genlibFiles.add((String) o);
        if (options.has(CONSTR_OPT)) constrFile = (String) options.valueOf(CONSTR_OPT);
        if (options.has(DELAY_OPT)) delayTarget = (String) options.valueOf(DELAY_OPT);
        if (options.has(SOP_INPUTS_OPT)) sopInputs = (String) options.valueOf(SOP_INPUTS_OPT);
        if (options.has(SOP_PRODUCTS_OPT)) sopProducts = (String) options.valueOf(SOP_PRODUCTS_OPT);
        if (options.has(LUTIN_SHARED_OPT)) lutinShared = (String) options.valueOf(LUTIN_SHARED_OPT);
        if (options.has(LUT_OPT)) lutArg = (String) options.valueOf(LUT_OPT);
        if (options.has(LUTS_OPT)) lutsArg = (String) options.valueOf(LUTS_OPT);
        if (options.has(SOP_OPT)) sopMode = true;
        if (options.has(MUX4_OPT)) setMux(WideMuxType.MUX4, true);
        if (options.has(MUX8_OPT)) setMux(WideMuxType.MUX8, true);
        if (options.has(MUX16_OPT)) setMux(WideMuxType.MUX16, true);
        if (options.has(DRESS_OPT)) dress = true;
        if (options.has(GATES_OPT)) {
            if (options.valuesOf(GATES_OPT).size() > 1) {
                throw new RuntimeException("ERROR: Can only use -g once. Please combine.");
            }
            gateArg = (String) options.valueOf(GATES_OPT);
        }
        if (options.has(FAST_OPT)) fast = true;
        if (options.has(DFF_OPT)) dffMode = true;
        if (options.has(CLK_OPT)) setClkStr((String) options.valueOf(CLK_OPT));
        if (options.has(KEEPFF_OPT)) keepff = true;
        if (options.has(NOCLEANUP_OPT)) cleanup = false;
        if (options.has(SHOWTMP_OPT)) showTempDir = true;
        if (options.has(MARKGROUPS_OPT)) markgroups = true;
        if (options.has(ABC_TOPDIR_OPT)) abcTopDir = (String) options.valueOf(ABC_TOPDIR_OPT);
        if (options.has(ABC_DIR_OPT)) abcDir = (String) options.valueOf(ABC_DIR_OPT);
    }

    /**
     * Makes paths absolute, expands the LUT and gate arguments and rejects
     * contradicting settings.
     * @throws RuntimeException for any configuration error
     */
    public void resolve() {
        if (libertyFiles.isEmpty() && genlibFiles.isEmpty() && isSet(defaultLibertyFile)) {
            libertyFiles.add(defaultLibertyFile);
        }
        abcTopDir = absolutePath(abcTopDir);
        if (isSet(abcDir)) abcDir = absolutePath(abcDir);
        if (isSet(scriptFile) && !scriptFile.startsWith("+")) scriptFile = absolutePath(scriptFile);
        libertyFiles.replaceAll(OrloConfig::absolutePath);
        genlibFiles.replaceAll(OrloConfig::absolutePath);
        if (isSet(constrFile)) constrFile = absolutePath(constrFile);

        if (isSet(lutArg)) lutCosts = parseLut(lutArg);
        if (isSet(lutsArg)) lutCosts = parseLuts(lutsArg);
        gateSelection = GateSelection.parse(gateArg);

        boolean hasLibrary = !libertyFiles.isEmpty() || !genlibFiles.isEmpty();
        if (!lutCosts.isEmpty() && hasLibrary) {
            throw new RuntimeException("ERROR: Got -lut and -liberty/-genlib! These two options are exclusive.");
        }
        if (isSet(constrFile) && !hasLibrary) {
            throw new RuntimeException("ERROR: Got -constr but no -liberty/-genlib!");
        }
    }

    private static boolean isSet(String s) {
        return s != null && !s.isEmpty();
    }

    private static String absolutePath(String path) {
        if (!isSet(path)) return path;
        return new File(path).getAbsolutePath();
    }

    /**
     * Expands "-lut n" (n LUT sizes of cost 1) and "-lut n:m" (sizes above n
     * doubling in cost up to m).
     */
    static List<Integer> parseLut(String arg) {
        int lutMode;
        int lutMode2;
        try {
            int pos = arg.indexOf(':');
            if (pos >= 0) {
                lutMode = Integer.parseInt(arg.substring(0, pos).trim());
                lutMode2 = Integer.parseInt(arg.substring(pos + 1).trim());
            } else {
                lutMode = Integer.parseInt(arg.trim());
                lutMode2 = lutMode;
            }
        } catch (NumberFormatException e) {
            throw new RuntimeException("ERROR: Invalid -lut argument: " + arg, e);
        }
        List<Integer> costs = new ArrayList<>();
        for (int i = 0; i < lutMode; i++) {
            costs.add(1);
        }
        for (int i = lutMode; i < lutMode2; i++) {
            costs.add(2 << (i - lutMode));
        }
        return costs;
    }

    /**
     * Expands "-luts c1,c2,..." where an entry "n:c" fills costs c up to size n
     * and an empty entry repeats the previous cost.
     */
    static List<Integer> parseLuts(String arg) {
        List<Integer> costs = new ArrayList<>();
        try {
            for (String tok : arg.split(",", -1)) {
                List<String> parts = new ArrayList<>();
                for (String p : tok.split(":")) {
                    if (!p.trim().isEmpty()) parts.add(p.trim());
                }
                if (parts.isEmpty()) {
                    if (!costs.isEmpty()) costs.add(costs.get(costs.size() - 1));
                } else if (parts.size() == 1) {
                    costs.add(Integer.parseInt(parts.get(0)));
                } else if (parts.size() == 2) {
                    int size = Integer.parseInt(parts.get(0));
                    int cost = Integer.parseInt(parts.get(1));
                    while (costs.size() < size) {
                        costs.add(cost);
                    }
                } else {
                    throw new RuntimeException("ERROR: Invalid -luts syntax.");
                }
            }
        } catch (NumberFormatException e) {
            throw new RuntimeException("ERROR: Invalid -luts syntax.", e);
        }
        return costs;
    }

    public String getExe() {
        return exe;
    }

    public void setExe(String exe) {
        this.exe = exe;
    }

    public String getScriptFile() {
        return scriptFile;
    }

    public void setScriptFile(String scriptFile) {
        this.scriptFile = scriptFile;
    }

    public List<String> getLibertyFiles() {
        return libertyFiles;
    }

    public List<String> getGenlibFiles() {
        return genlibFiles;
    }

    /**
     * @return True if the optimizer maps to the built-in gate library.
     */
    public boolean isBuiltinLibrary() {
        return libertyFiles.isEmpty() && genlibFiles.isEmpty();
    }

    public String getConstrFile() {
        return constrFile;
    }

    public void setConstrFile(String constrFile) {
        this.constrFile = constrFile;
    }

    public String getDelayTarget() {
        return delayTarget;
    }

    public void setDelayTarget(String delayTarget) {
        this.delayTarget = delayTarget;
    }

    public String getSopInputs() {
        return sopInputs;
    }

    public String getSopProducts() {
        return sopProducts;
    }

    public String getLutinShared() {
        return lutinShared;
    }

    public List<Integer> getLutCosts() {
        return lutCosts;
    }

    public void setLutArg(String lutArg) {
        this.lutArg = lutArg;
    }

    public void setLutsArg(String lutsArg) {
        this.lutsArg = lutsArg;
    }

    public void setGateArg(String gateArg) {
        this.gateArg = gateArg;
    }

    public GateSelection getGateSelection() {
        return gateSelection;
    }

    public Set<WideMuxType> getWideMuxes() {
        return wideMuxes;
    }

    public void setMux(WideMuxType mux, boolean enabled) {
        if (enabled) {
            wideMuxes.add(mux);
        } else {
            wideMuxes.remove(mux);
        }
    }

    public boolean isSopMode() {
        return sopMode;
    }

    public void setSopMode(boolean sopMode) {
        this.sopMode = sopMode;
    }

    public boolean isDress() {
        return dress;
    }

    public boolean isFast() {
        return fast;
    }

    public void setFast(boolean fast) {
        this.fast = fast;
    }

    public boolean isDffMode() {
        return dffMode;
    }

    public void setDffMode(boolean dffMode) {
        this.dffMode = dffMode;
    }

    public String getClkStr() {
        return clkStr;
    }

    /**
     * Selects a single clock domain; this implies register extraction.
     */
    public void setClkStr(String clkStr) {
        this.clkStr = clkStr == null ? "" : clkStr;
        if (!this.clkStr.isEmpty()) dffMode = true;
    }

    public boolean isKeepff() {
        return keepff;
    }

    public void setKeepff(boolean keepff) {
        this.keepff = keepff;
    }

    public boolean isCleanup() {
        return cleanup;
    }

    public void setCleanup(boolean cleanup) {
        this.cleanup = cleanup;
    }

    public boolean isShowTempDir() {
        return showTempDir;
    }

    public void setShowTempDir(boolean showTempDir) {
        this.showTempDir = showTempDir;
    }

    public boolean isMarkgroups() {
        return markgroups;
    }

    public void setMarkgroups(boolean markgroups) {
        this.markgroups = markgroups;
    }

    public String getAbcTopDir() {
        return abcTopDir;
    }

    public void setAbcTopDir(String abcTopDir) {
        this.abcTopDir = abcTopDir;
    }

    public String getAbcDir() {
        return abcDir;
    }

    public void setAbcDir(String abcDir) {
        this.abcDir = abcDir;
    }
}
