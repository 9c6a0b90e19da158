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

import java.util.Arrays;
import java.util.TreeSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.orlo.gate.GateType;

public class TestGateSelection {

    @Test
    public void testDefault() {
        GateSelection s = GateSelection.parse(null);
        Assertions.assertEquals(new TreeSet<>(GateSelection.DEFAULT_GATES), s.getEnabledGates());
        Assertions.assertFalse(s.isCmosCost());
        Assertions.assertTrue(s.isEnabled(GateType.MUX));
        Assertions.assertFalse(s.isEnabled(GateType.NMUX));
    }

    @Test
    public void testAliasesAndRemoval() {
        GateSelection s = GateSelection.parse("cmos2,-NOR,XOR");
        Assertions.assertEquals(new TreeSet<>(Arrays.asList("NAND", "XOR")), s.getEnabledGates());
        Assertions.assertTrue(s.isCmosCost());

        GateSelection simple = GateSelection.parse("simple");
        Assertions.assertEquals(new TreeSet<>(Arrays.asList("AND", "MUX", "OR", "XOR")), simple.getEnabledGates());
        Assertions.assertFalse(simple.isCmosCost());
    }

    @Test
    public void testEmptyResultFallsBackToDefault() {
        Assertions.assertEquals(GateSelection.getDefault().getEnabledGates(),
                GateSelection.parse("AND,-AND").getEnabledGates());
    }

    @Test
    public void testUnknownGate() {
        RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> GateSelection.parse("AND,FOO"));
        Assertions.assertEquals("ERROR: Unsupported gate type: FOO", e.getMessage());
    }
}
