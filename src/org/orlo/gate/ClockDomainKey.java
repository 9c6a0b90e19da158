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

import java.util.Objects;

import org.orlo.netlist.Cell;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.SigSpec;
import org.orlo.netlist.Wire;

/**
 * Identity of a clock/enable combination: clock polarity, clock signal,
 * enable polarity and enable signal (signals in canonical form). Keys are
 * ordered like tuples so domains are always visited in the same order.
 */
public final class ClockDomainKey implements Comparable<ClockDomainKey> {

    /** Reserved key of cells that belong to no clock domain */
    public static final ClockDomainKey NO_CLOCK = new ClockDomainKey(true, SigSpec.EMPTY, true, SigSpec.EMPTY);

    public static final String DFF_P = "$_DFF_P_";
    public static final String DFF_N = "$_DFF_N_";
    public static final String DFFE_PREFIX = "$_DFFE_";

    private final boolean clkPolarity;
    private final SigSpec clkSig;
    private final boolean enPolarity;
    private final SigSpec enSig;

    public ClockDomainKey(boolean clkPolarity, SigSpec clkSig, boolean enPolarity, SigSpec enSig) {
        this.clkPolarity = clkPolarity;
        this.clkSig = Objects.requireNonNull(clkSig);
        this.enPolarity = enPolarity;
        this.enSig = Objects.requireNonNull(enSig);
    }

    public boolean getClkPolarity() {
        return clkPolarity;
    }

    public SigSpec getClkSig() {
        return clkSig;
    }

    public boolean getEnPolarity() {
        return enPolarity;
    }

    public SigSpec getEnSig() {
        return enSig;
    }

    public boolean hasClock() {
        return !clkSig.isEmpty();
    }

    public boolean hasEnable() {
        return !enSig.isEmpty();
    }

    public static boolean isRegisterType(String type) {
        return type.equals(DFF_P) || type.equals(DFF_N) || isEnabledRegisterType(type);
    }

    private static boolean isEnabledRegisterType(String type) {
        return type.length() == 10 && type.startsWith(DFFE_PREFIX) && type.endsWith("_")
                && isPolarityChar(type.charAt(7)) && isPolarityChar(type.charAt(8));
    }

    private static boolean isPolarityChar(char c) {
        return c == 'P' || c == 'N';
    }

    /**
     * Computes the domain of a register cell.
     * @param cell Any cell
     * @param sigMap Alias resolution of the cell's module
     * @return The register's domain, or null if the cell is no register.
     */
    public static ClockDomainKey ofRegister(Cell cell, SigMap sigMap) {
        String type = cell.getType();
        if (type.equals(DFF_P) || type.equals(DFF_N)) {
            return new ClockDomainKey(type.equals(DFF_P), sigMap.apply(cell.getPort("C")), true, SigSpec.EMPTY);
        }
        if (isEnabledRegisterType(type)) {
            return new ClockDomainKey(type.charAt(7) == 'P', sigMap.apply(cell.getPort("C")),
                    type.charAt(8) == 'P', sigMap.apply(cell.getPort("E")));
        }
        return null;
    }

    /**
     * Checks whether a register belongs to this (active) domain and may be extracted.
     */
    public boolean matches(Cell cell, SigMap sigMap) {
        ClockDomainKey other = ofRegister(cell, sigMap);
        if (other == null) return false;
        if (other.clkPolarity != clkPolarity || !other.clkSig.equals(clkSig)) return false;
        if (!hasEnable()) return !other.hasEnable();
        return other.hasEnable() && other.enPolarity == enPolarity && other.enSig.equals(enSig);
    }

    /**
     * Parses a clock selection of the form {@code [!]clk[,[!]en]}. Wires that do
     * not exist in the module leave the matching signal empty.
     */
    public static ClockDomainKey parse(String clkStr, Module module, SigMap sigMap) {
        boolean clkPol = true;
        boolean enPol = true;
        SigSpec clk = SigSpec.EMPTY;
        SigSpec en = SigSpec.EMPTY;
        String clkName = clkStr;
        int comma = clkStr.indexOf(',');
        if (comma >= 0) {
            String enName = clkStr.substring(comma + 1);
            clkName = clkStr.substring(0, comma);
            if (enName.startsWith("!")) {
                enPol = false;
                enName = enName.substring(1);
            }
            Wire w = module.getWire(enName);
            if (w != null) en = sigMap.apply(w.getSigSpec());
        }
        if (clkName.startsWith("!")) {
            clkPol = false;
            clkName = clkName.substring(1);
        }
        Wire w = module.getWire(clkName);
        if (w != null) clk = sigMap.apply(w.getSigSpec());
        return new ClockDomainKey(clkPol, clk, enPol, en);
    }

    /**
     * @return Host cell type of a register in this domain.
     */
    public String getRegisterType() {
        if (!hasEnable()) {
            return clkPolarity ? DFF_P : DFF_N;
        }
        return DFFE_PREFIX + (clkPolarity ? 'P' : 'N') + (enPolarity ? 'P' : 'N') + "_";
    }

    /**
     * @return Text as used in the clock domain summary, e.g. "clk=!clk, en=en".
     */
    public String describe() {
        return "clk=" + (clkPolarity ? "" : "!") + clkSig + ", en=" + (enPolarity ? "" : "!") + enSig;
    }

    @Override
    public int compareTo(ClockDomainKey o) {
        int c = Boolean.compare(clkPolarity, o.clkPolarity);
        if (c != 0) return c;
        c = clkSig.compareTo(o.clkSig);
        if (c != 0) return c;
        c = Boolean.compare(enPolarity, o.enPolarity);
        if (c != 0) return c;
        return enSig.compareTo(o.enSig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clkPolarity, clkSig, enPolarity, enSig);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ClockDomainKey)) return false;
        ClockDomainKey other = (ClockDomainKey) obj;
        return clkPolarity == other.clkPolarity && enPolarity == other.enPolarity
                && clkSig.equals(other.clkSig) && enSig.equals(other.enSig);
    }

    @Override
    public String toString() {
        return describe();
    }
}
