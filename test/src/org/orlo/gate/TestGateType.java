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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

public class TestGateType {

    @ParameterizedTest
    @CsvSource({
            "BUF, 2",
            "NOT, 1",
            "AND, 8",
            "NAND, 7",
            "OR, 14",
            "NOR, 1",
            "XOR, 6",
            "XNOR, 9",
            "ANDNOT, 2",
            "ORNOT, 11",
            "MUX, 202",
            "NMUX, 53",
            "AOI3, 7",
            "OAI3, 31",
    })
    public void testTruthTable(GateType type, int expected) {
        Assertions.assertEquals(expected, type.getTruthTable());
    }

    @Test
    public void testFourInputGates() {
        // AOI4 is low whenever A&B or C&D holds
        Assertions.assertFalse(GateType.AOI4.evaluate(true, true, false, false));
        Assertions.assertFalse(GateType.AOI4.evaluate(false, false, true, true));
        Assertions.assertTrue(GateType.AOI4.evaluate(true, false, false, true));
        Assertions.assertTrue(GateType.OAI4.evaluate(false, false, true, true));
        Assertions.assertFalse(GateType.OAI4.evaluate(true, false, false, true));
    }

    @ParameterizedTest
    @EnumSource(value = GateType.class, names = {"NONE", "FF"}, mode = EnumSource.Mode.EXCLUDE)
    public void testLookups(GateType type) {
        Assertions.assertEquals(type, GateType.fromHostType(type.getHostType()));
        Assertions.assertEquals(type, GateType.fromLibName(type.getLibName()));
        for (String row : type.getCoverRows()) {
            Assertions.assertEquals(type.getArity(), row.length());
        }
        Assertions.assertTrue(type.getCost(false) > 0);
        Assertions.assertTrue(type.getCost(true) > 0);
    }

    @Test
    public void testTerminalsAreNotCombinational() {
        Assertions.assertFalse(GateType.NONE.isCombinational());
        Assertions.assertFalse(GateType.FF.isCombinational());
        Assertions.assertNull(GateType.fromLibName("DFF"));
        Assertions.assertNull(GateType.fromHostType("$_DFF_P_"));
        Assertions.assertThrows(RuntimeException.class, () -> GateType.FF.evaluate(true));
    }

    @Test
    public void testWideMuxCost() {
        Assertions.assertEquals(2 * GateType.MUX.getCost(false), WideMuxType.MUX4.getCost(false));
        Assertions.assertEquals(8 * GateType.MUX.getCost(true), WideMuxType.MUX16.getCost(true));
        Assertions.assertEquals(WideMuxType.MUX8, WideMuxType.fromLibName("MUX8"));
        Assertions.assertEquals(11, WideMuxType.MUX8.getInputPins().size());
    }
}
