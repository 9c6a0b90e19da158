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
package org.orlo.blif;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.PortDirection;
import org.orlo.netlist.SigBit;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.State;
import org.orlo.netlist.Wire;

/**
 * Reads a BLIF network, as written by the optimizer, into a {@link Design}.
 * Only the constructs the optimizer emits are understood. Every net becomes
 * a one bit wire; cover tables become "$lut" cells (or "$sop" cells in SOP
 * mode), library gates and sub-circuits become cells of their own type and
 * generic latches become cells of the given register type with D and Q pins.
 */
public class BlifParser {

    public static final String LUT_TYPE = "$lut";
    public static final String SOP_TYPE = "$sop";

    private final Design design = new Design();

    private final String dffName;

    private final boolean sopMode;

    private Module module;

    private Cell lastCell;

    private int portCount;

    private int cellCount;

    private List<String> lines;

    private int lineIdx;

    /**
     * @param dffName Cell type given to generic latches
     * @param sopMode Create "$sop" instead of "$lut" cells for cover tables
     */
    public BlifParser(String dffName, boolean sopMode) {
        this.dffName = dffName;
        this.sopMode = sopMode;
    }

    public static Design parse(File file, String dffName, boolean sopMode) {
        try (Reader r = new FileReader(file)) {
            return parse(r, dffName, sopMode);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Can't open BLIF file `" + file + "'.", e);
        }
    }

    public static Design parse(Reader reader, String dffName, boolean sopMode) {
        BlifParser parser = new BlifParser(dffName, sopMode);
        parser.readLines(reader);
        parser.parseLines();
        return parser.design;
    }

    /**
     * Reads logical lines: comments removed, continuation lines joined, blank lines dropped.
     */
    private void readLines(Reader reader) {
        lines = new ArrayList<>();
        BufferedReader br = new BufferedReader(reader);
        StringBuilder pending = new StringBuilder();
        try {
            String line;
            while ((line = br.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) line = line.substring(0, comment);
                String trimmed = line.trim();
                if (trimmed.endsWith("\\")) {
                    pending.append(trimmed, 0, trimmed.length() - 1).append(' ');
                    continue;
                }
                pending.append(trimmed);
                String logical = pending.toString().trim();
                pending.setLength(0);
                if (!logical.isEmpty()) lines.add(logical);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read BLIF input", e);
        }
        if (pending.length() > 0 && !pending.toString().trim().isEmpty()) {
            lines.add(pending.toString().trim());
        }
    }

    private void parseLines() {
        lineIdx = 0;
        while (lineIdx < lines.size()) {
            String line = lines.get(lineIdx++);
            String[] tokens = line.split("\\s+");
            String cmd = tokens[0];
            if (module == null && !cmd.equals(".model")) {
                throw syntaxError(line);
            }
            switch (cmd) {
                case ".model":
                    if (module != null) throw syntaxError(line);
                    module = design.addModule(tokens.length > 1 ? tokens[1] : BlifWriter.MODEL_NAME);
                    portCount = 0;
                    lastCell = null;
                    break;
                case ".end":
                    module = null;
                    break;
                case ".inputs":
                case ".outputs":
                    PortDirection dir = cmd.equals(".inputs") ? PortDirection.INPUT : PortDirection.OUTPUT;
                    for (int i = 1; i < tokens.length; i++) {
                        Wire w = getWire(tokens[i]);
                        w.setPort(w.isPort() ? PortDirection.INOUT : dir, w.isPort() ? w.getPortId() : ++portCount);
                    }
                    break;
                case ".names":
                    parseNames(Arrays.asList(tokens).subList(1, tokens.length));
                    break;
                case ".gate":
                case ".subckt":
                    parseGate(line, tokens);
                    break;
                case ".latch":
                    parseLatch(line, tokens);
                    break;
                case ".conn":
                    if (tokens.length != 3) throw syntaxError(line);
                    module.connect(getWire(tokens[2]).getSigSpec(), getWire(tokens[1]).getSigSpec());
                    break;
                case ".cname":
                    if (tokens.length != 2 || lastCell == null) throw syntaxError(line);
                    lastCell = renameCell(lastCell, tokens[1]);
                    break;
                case ".param":
                case ".attr":
                    if (tokens.length < 3 || lastCell == null) throw syntaxError(line);
                    String value = unquote(String.join(" ", Arrays.asList(tokens).subList(2, tokens.length)));
                    if (cmd.equals(".param")) {
                        lastCell.setParameter(tokens[1], value);
                    } else {
                        lastCell.setAttribute(tokens[1], value);
                    }
                    break;
                default:
                    throw syntaxError(line);
            }
        }
    }

    private RuntimeException syntaxError(String line) {
        return new RuntimeException("ERROR: Syntax error in BLIF line " + lineIdx + ": " + line);
    }

    private Wire getWire(String name) {
        Wire w = module.getWire(name);
        return w == null ? module.addWire(name) : w;
    }

    private String nextCellName() {
        return "$blif$" + (++cellCount);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /**
     * Collects the cover rows that follow a .names line.
     */
    private List<String[]> readCover() {
        List<String[]> rows = new ArrayList<>();
        while (lineIdx < lines.size() && !lines.get(lineIdx).startsWith(".")) {
            rows.add(lines.get(lineIdx++).split("\\s+"));
        }
        return rows;
    }

    private void parseNames(List<String> nets) {
        if (nets.isEmpty()) throw syntaxError(".names");
        Wire out = getWire(nets.get(nets.size() - 1));
        List<SigBit> inputs = new ArrayList<>();
        for (String n : nets.subList(0, nets.size() - 1)) {
            inputs.add(getWire(n).getBit(0));
        }
        List<String[]> rows = readCover();

        if (inputs.isEmpty()) {
            State value = State.S0;
            for (String[] row : rows) {
                if (row[0].equals("1")) value = State.S1;
            }
            module.connect(out.getSigSpec(), SigSpec.of(value));
            return;
        }

        for (String[] row : rows) {
            if (row.length != 2 || row[0].length() != inputs.size()
                    || !(row[1].equals("0") || row[1].equals("1"))) {
                throw syntaxError(String.join(" ", row));
            }
        }

        if (sopMode) {
            createSop(inputs, out, rows);
        } else {
            createLut(inputs, out, rows);
        }
    }

    private void createLut(List<SigBit> inputs, Wire out, List<String[]> rows) {
        int width = inputs.size();
        State[] lut = new State[1 << width];
        Arrays.fill(lut, State.Sx);
        State defaultState = State.Sx;
        for (String[] row : rows) {
            boolean onSet = row[1].equals("1");
            defaultState = onSet ? State.S0 : State.S1;
            for (int i = 0; i < lut.length; i++) {
                if (rowMatches(row[0], i)) lut[i] = onSet ? State.S1 : State.S0;
            }
        }
        StringBuilder sb = new StringBuilder(lut.length);
        for (int i = lut.length - 1; i >= 0; i--) {
            State s = lut[i] == State.Sx ? defaultState : lut[i];
            sb.append(s == State.Sx ? State.S0.getSymbol() : s.getSymbol());
        }
        Cell cell = module.addCell(nextCellName(), LUT_TYPE);
        cell.setParameter("WIDTH", width);
        cell.setParameter("LUT", sb.toString());
        cell.setPort("A", SigSpec.of(inputs));
        cell.setPort("Y", out);
        lastCell = cell;
    }

    private static boolean rowMatches(String pattern, int index) {
        for (int j = 0; j < pattern.length(); j++) {
            char c = pattern.charAt(j);
            boolean bit = ((index >> j) & 1) != 0;
            if (c == '1' && !bit) return false;
            if (c == '0' && bit) return false;
        }
        return true;
    }

    private void createSop(List<SigBit> inputs, Wire out, List<String[]> rows) {
        int width = inputs.size();
        boolean inverted = !rows.isEmpty() && rows.get(rows.size() - 1)[1].equals("0");
        boolean[] table = new boolean[2 * width * rows.size()];
        for (int t = 0; t < rows.size(); t++) {
            String pattern = rows.get(t)[0];
            for (int j = 0; j < width; j++) {
                char c = pattern.charAt(j);
                if (c == '0') table[2 * width * t + 2 * j] = true;
                if (c == '1') table[2 * width * t + 2 * j + 1] = true;
            }
        }
        StringBuilder sb = new StringBuilder(table.length);
        for (int i = table.length - 1; i >= 0; i--) {
            sb.append(table[i] ? '1' : '0');
        }
        Cell cell = module.addCell(nextCellName(), SOP_TYPE);
        cell.setParameter("WIDTH", width);
        cell.setParameter("DEPTH", rows.size());
        cell.setParameter("TABLE", sb.length() == 0 ? "0" : sb.toString());
        cell.setPort("A", SigSpec.of(inputs));
        if (inverted) {
            Wire mid = module.addWire(nextCellName());
            cell.setPort("Y", mid);
            Cell inv = module.addCell(nextCellName(), "$_NOT_");
            inv.setPort("A", mid);
            inv.setPort("Y", out);
        } else {
            cell.setPort("Y", out);
        }
        lastCell = cell;
    }

    private void parseGate(String line, String[] tokens) {
        if (tokens.length < 2) throw syntaxError(line);
        Cell cell = module.addCell(nextCellName(), tokens[1]);
        for (int i = 2; i < tokens.length; i++) {
            int eq = tokens[i].indexOf('=');
            if (eq <= 0) throw syntaxError(line);
            cell.setPort(tokens[i].substring(0, eq), getWire(tokens[i].substring(eq + 1)));
        }
        lastCell = cell;
    }

    /**
     * Handles {@code .latch <d> <q> [<type> <control>] [<init>]}.
     */
    private void parseLatch(String line, String[] tokens) {
        if (tokens.length < 3 || tokens.length > 6) throw syntaxError(line);
        Wire d = getWire(tokens[1]);
        Wire q = getWire(tokens[2]);
        String init = null;
        Cell cell;
        if (tokens.length >= 5) {
            String type = tokens[3];
            Wire ctrl = getWire(tokens[4]);
            if (tokens.length == 6) init = tokens[5];
            switch (type) {
                case "re":
                    cell = module.addCell(nextCellName(), "$_DFF_P_");
                    cell.setPort("C", ctrl);
                    break;
                case "fe":
                    cell = module.addCell(nextCellName(), "$_DFF_N_");
                    cell.setPort("C", ctrl);
                    break;
                case "ah":
                    cell = module.addCell(nextCellName(), "$_DLATCH_P_");
                    cell.setPort("E", ctrl);
                    break;
                case "al":
                    cell = module.addCell(nextCellName(), "$_DLATCH_N_");
                    cell.setPort("E", ctrl);
                    break;
                default:
                    throw syntaxError(line);
            }
        } else {
            if (tokens.length == 4) init = tokens[3];
            cell = module.addCell(nextCellName(), dffName);
        }
        cell.setPort("D", d);
        cell.setPort("Q", q);
        if ("0".equals(init) || "1".equals(init)) {
            q.setAttribute(Wire.INIT, init);
        }
        lastCell = cell;
    }

    private Cell renameCell(Cell cell, String name) {
        Cell renamed = module.addCell(name, cell.getType());
        for (Map.Entry<String, SigSpec> e : cell.getConnections().entrySet()) {
            renamed.setPort(e.getKey(), e.getValue());
        }
        for (Map.Entry<String, String> e : cell.getParameters().entrySet()) {
            renamed.setParameter(e.getKey(), e.getValue());
        }
        for (Map.Entry<String, String> e : cell.getAttributes().entrySet()) {
            renamed.setAttribute(e.getKey(), e.getValue());
        }
        module.removeCell(cell);
        return renamed;
    }
}
