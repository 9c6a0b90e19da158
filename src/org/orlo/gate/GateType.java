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
package org.orlo.gate;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kinds of gate graph nodes. For every combinational kind this table holds the
 * host cell type, the optimizer library name, the ordered input pins, the cover
 * rows written to the exchange file, the library function with its pin
 * polarity, and the cost in both cost tables. Extraction, export and
 * reintegration all read from here.
 */
public enum GateType {
    /** Terminal: a primary input of the exported network or a constant */
    NONE(null, null, pins(), rows(), null, null, 0, 0),
    /** Register, see {@link ClockDomainKey} for its host cell types */
    FF(null, "DFF", pins("D"), rows(), null, null, 0, 0),
    BUF("$_BUF_", "BUF", pins("A"), rows("1"), "Y=A", Polarity.NONINV, 1, 1),
    NOT("$_NOT_", "NOT", pins("A"), rows("0"), "Y=!A", Polarity.INV, 2, 2),
    AND("$_AND_", "AND", pins("A", "B"), rows("11"), "Y=A*B", Polarity.NONINV, 4, 6),
    NAND("$_NAND_", "NAND", pins("A", "B"), rows("0-", "-0"), "Y=!(A*B)", Polarity.INV, 4, 4),
    OR("$_OR_", "OR", pins("A", "B"), rows("-1", "1-"), "Y=A+B", Polarity.NONINV, 4, 6),
    NOR("$_NOR_", "NOR", pins("A", "B"), rows("00"), "Y=!(A+B)", Polarity.INV, 4, 4),
    XOR("$_XOR_", "XOR", pins("A", "B"), rows("01", "10"), "Y=(A*!B)+(!A*B)", Polarity.UNKNOWN, 5, 12),
    XNOR("$_XNOR_", "XNOR", pins("A", "B"), rows("00", "11"), "Y=(A*B)+(!A*!B)", Polarity.UNKNOWN, 5, 12),
    ANDNOT("$_ANDNOT_", "ANDNOT", pins("A", "B"), rows("10"), "Y=A*!B", Polarity.UNKNOWN, 4, 6),
    ORNOT("$_ORNOT_", "ORNOT", pins("A", "B"), rows("1-", "-0"), "Y=A+!B", Polarity.UNKNOWN, 4, 6),
    MUX("$_MUX_", "MUX", pins("A", "B", "S"), rows("1-0", "-11"),
            "Y=(A*B)+(S*B)+(!S*A)", Polarity.UNKNOWN, 4, 12),
    NMUX("$_NMUX_", "NMUX", pins("A", "B", "S"), rows("0-0", "-01"),
            "Y=!((A*B)+(S*B)+(!S*A))", Polarity.UNKNOWN, 4, 10),
    AOI3("$_AOI3_", "AOI3", pins("A", "B", "C"), rows("-00", "0-0"), "Y=!((A*B)+C)", Polarity.INV, 6, 6),
    OAI3("$_OAI3_", "OAI3", pins("A", "B", "C"), rows("00-", "--0"), "Y=!((A+B)*C)", Polarity.INV, 6, 6),
    AOI4("$_AOI4_", "AOI4", pins("A", "B", "C", "D"), rows("-0-0", "-00-", "0--0", "0-0-"),
            "Y=!((A*B)+(C*D))", Polarity.INV, 7, 8),
    OAI4("$_OAI4_", "OAI4", pins("A", "B", "C", "D"), rows("00--", "--00"),
            "Y=!((A+B)*(C+D))", Polarity.INV, 7, 8);

    /** Pin polarity as declared in a genlib library */
    public enum Polarity {
        NONINV,
        INV,
        UNKNOWN
    }

    public static final String OUTPUT_PIN = "Y";

    private static final Map<String, GateType> hostTypeMap = new HashMap<>();
    private static final Map<String, GateType> libNameMap = new HashMap<>();

    static {
        for (GateType t : values()) {
            if (t.hostType != null) hostTypeMap.put(t.hostType, t);
            if (t.isCombinational()) libNameMap.put(t.libName, t);
        }
    }

    private final String hostType;
    private final String libName;
    private final List<String> inputPins;
    private final List<String> coverRows;
    private final String genlibFunction;
    private final Polarity polarity;
    private final int defaultCost;
    private final int cmosCost;

    GateType(String hostType, String libName, List<String> inputPins, List<String> coverRows,
             String genlibFunction, Polarity polarity, int defaultCost, int cmosCost) {
        this.hostType = hostType;
        this.libName = libName;
        this.inputPins = inputPins;
        this.coverRows = coverRows;
        this.genlibFunction = genlibFunction;
        this.polarity = polarity;
        this.defaultCost = defaultCost;
        this.cmosCost = cmosCost;
    }

    private static List<String> pins(String... pins) {
        return Collections.unmodifiableList(Arrays.asList(pins));
    }

    private static List<String> rows(String... rows) {
        return Collections.unmodifiableList(Arrays.asList(rows));
    }

    public String getHostType() {
        return hostType;
    }

    public String getLibName() {
        return libName;
    }

    public List<String> getInputPins() {
        return inputPins;
    }

    public int getArity() {
        return inputPins.size();
    }

    /**
     * @return The on-set cover of this gate, one row per product term, one
     * character ('0', '1' or '-') per input pin in pin order.
     */
    public List<String> getCoverRows() {
        return coverRows;
    }

    public String getGenlibFunction() {
        return genlibFunction;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public int getCost(boolean cmos) {
        return cmos ? cmosCost : defaultCost;
    }

    public boolean isCombinational() {
        return this != NONE && this != FF;
    }

    /**
     * Evaluates this gate's cover on the given input values.
     * @param inputs One value per input pin, in pin order
     * @return The output value
     */
    public boolean evaluate(boolean... inputs) {
        if (!isCombinational() || inputs.length != inputPins.size()) {
            throw new RuntimeException("ERROR: Cannot evaluate " + this + " with " + inputs.length + " inputs");
        }
        for (String row : coverRows) {
            boolean match = true;
            for (int i = 0; i < inputs.length && match; i++) {
                char c = row.charAt(i);
                if (c != '-' && (c == '1') != inputs[i]) match = false;
            }
            if (match) return true;
        }
        return false;
    }

    /**
     * @return Truth table with input pin i at bit i of the row index.
     */
    public int getTruthTable() {
        int n = getArity();
        int table = 0;
        for (int row = 0; row < (1 << n); row++) {
            boolean[] in = new boolean[n];
            for (int i = 0; i < n; i++) {
                in[i] = ((row >> i) & 1) != 0;
            }
            if (evaluate(in)) table |= 1 << row;
        }
        return table;
    }

    /**
     * @param hostType Host cell type such as "$_AND_"
     * @return The matching combinational kind or null if the type is not extractable.
     */
    public static GateType fromHostType(String hostType) {
        return hostTypeMap.get(hostType);
    }

    /**
     * @param libName Optimizer library cell name such as "AND"
     * @return The matching combinational kind or null.
     */
    public static GateType fromLibName(String libName) {
        return libNameMap.get(libName);
    }
}
