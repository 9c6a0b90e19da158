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
import java.util.Map;

import org.orlo.blif.BlifWriter;
import org.orlo.blif.GenlibWriter;
import org.orlo.blif.LutLibraryWriter;
import org.orlo.gate.BoundaryMarker;
import org.orlo.gate.CellTypes;
import org.orlo.gate.ClockDomainKey;
import org.orlo.gate.GateExtractor;
import org.orlo.gate.LoopBreaker;
import org.orlo.gate.MappingContext;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigMap;
import org.orlo.partition.ClockDomainPartitioner;
import org.orlo.reint.ReintegrationResult;
import org.orlo.reint.Reintegrator;
import org.orlo.util.FileTools;
import org.orlo.util.MessageGenerator;

/**
 * Runs the extract, mark, break and reintegrate cycle on the modules of a
 * design, once per module or once per clock domain of a module. In map mode
 * the network goes through the optimizer in between; in reintegration mode
 * the optimizer's output is taken from an existing work directory.
 */
public class ModuleMapper {

    private final Design design;

    private final OrloConfig config;

    private final String workDir;

    private final boolean reintegrateOnly;

    /**
     * @param workDir The run's work directory (created by the caller)
     * @param reintegrateOnly True to only pick up existing optimizer results
     */
    public ModuleMapper(Design design, OrloConfig config, String workDir, boolean reintegrateOnly) {
        this.design = design;
        this.config = config;
        this.workDir = workDir;
        this.reintegrateOnly = reintegrateOnly;
    }

    /**
     * Processes one module: all of it with the configured clock domain, or
     * one clock domain after another when registers are extracted and no
     * clock is given.
     * @return One result per cycle, in domain order
     */
    public List<ReintegrationResult> processModule(Module module) {
        List<ReintegrationResult> results = new ArrayList<>();
        if (!config.isDffMode() || !config.getClkStr().isEmpty()) {
            ClockDomainKey domain = selectDomain(module, config);
            results.add(processDomain(module, module.getCells(), domain, !config.getClkStr().isEmpty(), 0));
            return results;
        }

        Map<ClockDomainKey, List<Cell>> domains = ClockDomainPartitioner.partition(module.getCells(),
                new SigMap(module), new CellTypes(design));
        int domainIdx = 0;
        for (Map.Entry<ClockDomainKey, List<Cell>> e : domains.entrySet()) {
            results.add(processDomain(module, e.getValue(), canonicalize(e.getKey(), new SigMap(module)), true, domainIdx));
            domainIdx++;
        }
        return results;
    }

    /**
     * Resolves the clock selection of the configuration in a module.
     * @throws RuntimeException if registers are to be extracted but the clock does not exist
     */
    static ClockDomainKey selectDomain(Module module, OrloConfig config) {
        if (config.getClkStr().isEmpty()) {
            return ClockDomainKey.NO_CLOCK;
        }
        ClockDomainKey domain = ClockDomainKey.parse(config.getClkStr(), module, new SigMap(module));
        if (config.isDffMode() && !domain.hasClock()) {
            throw new RuntimeException("ERROR: Clock domain " + config.getClkStr() + " not found.");
        }
        return domain;
    }

    private static ClockDomainKey canonicalize(ClockDomainKey key, SigMap sigMap) {
        return new ClockDomainKey(key.getClkPolarity(), sigMap.apply(key.getClkSig()),
                key.getEnPolarity(), sigMap.apply(key.getEnSig()));
    }

    private static void logDomain(ClockDomainKey domain) {
        if (!domain.hasClock()) {
            System.out.println("No matching clock domain found. Not extracting any FF cells.");
            return;
        }
        StringBuilder sb = new StringBuilder("Found matching ");
        sb.append(domain.getClkPolarity() ? "posedge" : "negedge").append(" clock domain: ").append(domain.getClkSig());
        if (domain.hasEnable()) {
            sb.append(", enabled by ").append(domain.getEnPolarity() ? "" : "!").append(domain.getEnSig());
        }
        System.out.println(sb);
    }

    /**
     * Runs one cycle on a set of cells.
     * @param logDomain Print which clock domain is active
     */
    public ReintegrationResult processDomain(Module module, List<Cell> cells, ClockDomainKey domain,
                                             boolean logDomain, int domainIdx) {
        MappingContext ctx = new MappingContext(design, module, domain);
        ctx.setKeepff(config.isKeepff());
        ctx.setMarkgroups(config.isMarkgroups());
        File dir = AbcTools.moduleDir(module, workDir, domainIdx);

        if (reintegrateOnly) {
            extract(ctx, cells, logDomain);
            return Reintegrator.reintegrate(ctx, dir, config.isBuiltinLibrary(), config.isSopMode());
        }

        if (!FileTools.makeDir(dir.getPath())) {
            throw new RuntimeException("ERROR: Could not create " + dir.getPath() + " directory.");
        }
        MessageGenerator.printHeader("Extracting gate netlist of module `" + module.getName() + "' to `"
                + AbcOutputFilter.replaceTempDir(dir.getPath(), dir.getPath(), config.isShowTempDir()) + "/"
                + AbcScript.INPUT_FILE + "'");
        AbcScript script = AbcScript.build(config, dir);
        script.write(dir);

        extract(ctx, cells, logDomain);
        BlifWriter.NetworkSummary summary = BlifWriter.write(ctx, new File(dir, AbcScript.INPUT_FILE));

        ReintegrationResult result = ReintegrationResult.SKIPPED;
        if (summary.getOutputs() > 0) {
            MessageGenerator.printHeader("Executing ABC");
            GenlibWriter.write(new File(dir, GenlibWriter.FILE_NAME), config.getGateSelection().getEnabledGates(),
                    config.getWideMuxes(), config.getGateSelection().isCmosCost());
            if (!config.getLutCosts().isEmpty()) {
                LutLibraryWriter.write(new File(dir, LutLibraryWriter.FILE_NAME), config.getLutCosts());
            }
            AbcOutputFilter filter = new AbcOutputFilter(dir.getPath(), config.isShowTempDir(),
                    ctx.getPiMap(), ctx.getPoMap());
            AbcTools.runAbc(config.getExe(), new File(dir, AbcScript.FILE_NAME), filter, config.isShowTempDir());
            result = Reintegrator.reintegrate(ctx, dir, config.isBuiltinLibrary(), config.isSopMode());
        } else {
            MessageGenerator.briefMessage("Don't call ABC as there is nothing to map.");
        }

        if (config.isCleanup()) {
            MessageGenerator.briefMessage("Removing temp directory.");
            FileTools.deleteFolder(dir.getPath());
        }
        return result;
    }

    /**
     * Moves the cells into a fresh gate graph and prepares it for export.
     */
    private static void extract(MappingContext ctx, List<Cell> cells, boolean logDomain) {
        if (logDomain) {
            logDomain(ctx.getDomain());
        }
        GateExtractor.extractCells(ctx, cells);
        BoundaryMarker.markBoundary(ctx);
        LoopBreaker.breakLoops(ctx);
    }
}
