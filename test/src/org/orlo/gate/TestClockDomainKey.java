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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.orlo.netlist.Cell;
import org.orlo.netlist.Design;
import org.orlo.netlist.Module;
import org.orlo.netlist.SigMap;
import org.orlo.netlist.Wire;
import org.orlo.support.SmallDesigns;

public class TestClockDomainKey {

    @Test
    public void testParse() {
        Design design = new Design();
        Module m = design.addModule("m");
        m.addWire("clk");
        m.addWire("en");
        SigMap sigMap = new SigMap(m);

        ClockDomainKey key = ClockDomainKey.parse("!clk,!en", m, sigMap);
        Assertions.assertFalse(key.getClkPolarity());
        Assertions.assertFalse(key.getEnPolarity());
        Assertions.assertTrue(key.hasClock());
        Assertions.assertTrue(key.hasEnable());
        Assertions.assertEquals("$_DFFE_NN_", key.getRegisterType());
        Assertions.assertEquals("clk=!clk, en=!en", key.describe());

        ClockDomainKey missing = ClockDomainKey.parse("nope", m, sigMap);
        Assertions.assertFalse(missing.hasClock());
        Assertions.assertEquals("$_DFF_P_", ClockDomainKey.parse("clk", m, sigMap).getRegisterType());
    }

    @Test
    public void testRegisterTypes() {
        Assertions.assertTrue(ClockDomainKey.isRegisterType("$_DFF_P_"));
        Assertions.assertTrue(ClockDomainKey.isRegisterType("$_DFFE_NP_"));
        Assertions.assertFalse(ClockDomainKey.isRegisterType("$_DFFE_XP_"));
        Assertions.assertFalse(ClockDomainKey.isRegisterType("$_DFFSR_PPP_"));
        Assertions.assertFalse(ClockDomainKey.isRegisterType("$_AND_"));
    }

    @Test
    public void testMatchesUsesAliases() {
        Design design = new Design();
        Module m = design.addModule("m");
        Wire clk = m.addWire("clk");
        Wire clkAlias = m.addWire("$clk_buf");
        Wire en = m.addWire("en");
        Wire d = m.addWire("d");
        Wire q = m.addWire("q");
        m.connect(clkAlias.getSigSpec(), clk.getSigSpec());
        Cell ff = SmallDesigns.addRegister(m, "ff", "$_DFFE_PP_", clkAlias, d, q);
        ff.setPort("E", en);
        SigMap sigMap = new SigMap(m);

        Assertions.assertTrue(ClockDomainKey.parse("clk,en", m, sigMap).matches(ff, sigMap));
        Assertions.assertFalse(ClockDomainKey.parse("clk", m, sigMap).matches(ff, sigMap));
        Assertions.assertFalse(ClockDomainKey.parse("clk,!en", m, sigMap).matches(ff, sigMap));
        Assertions.assertEquals(ClockDomainKey.parse("clk,en", m, sigMap), ClockDomainKey.ofRegister(ff, sigMap));
        Assertions.assertNull(ClockDomainKey.ofRegister(m.addCell("x", "$_AND_"), sigMap));
    }
}
