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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.TreeSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.orlo.abc.GateSelection;
import org.orlo.gate.WideMuxType;

public class TestGenlibWriter {

    private static List<String> gateNames(List<String> lines) {
        List<String> names = new ArrayList<>();
        for (String line : lines) {
            names.add(line.trim().split("\\s+")[1]);
        }
        return names;
    }

    @Test
    public void testDefaultLibrary() {
        List<String> lines = GenlibWriter.render(GateSelection.getDefault().getEnabledGates(),
                Collections.emptySet(), false);
        Assertions.assertEquals(Arrays.asList("ZERO", "ONE", "BUF", "NOT", "AND", "NAND", "OR", "NOR",
                "XOR", "XNOR", "ANDNOT", "ORNOT", "MUX"), gateNames(lines));
        Assertions.assertEquals("GATE ZERO    1 Y=CONST0;", lines.get(0));

        String[] and = lines.get(4).split("\\s+");
        Assertions.assertArrayEquals(new String[]{"GATE", "AND", "4", "Y=A*B;", "PIN", "*", "NONINV",
                "1", "999", "1", "0", "1", "0"}, and);
    }

    @Test
    public void testCmosCostsAndMuxes() {
        List<String> lines = GenlibWriter.render(new TreeSet<>(Arrays.asList("NAND", "NOR")),
                EnumSet.of(WideMuxType.MUX4), true);
        Assertions.assertEquals(Arrays.asList("ZERO", "ONE", "BUF", "NOT", "NAND", "NOR", "MUX4"), gateNames(lines));
        Assertions.assertEquals("2", lines.get(3).split("\\s+")[2]);
        String[] mux4 = lines.get(6).split("\\s+");
        Assertions.assertEquals(String.valueOf(WideMuxType.MUX4.getCost(true)), mux4[2]);
        Assertions.assertEquals("UNKNOWN", mux4[6]);
    }

    @Test
    public void testLutLibrary() {
        Assertions.assertEquals(Arrays.asList("1 1.00 1.00", "2 1.00 1.00", "3 2.00 1.00"),
                LutLibraryWriter.render(Arrays.asList(1, 1, 2)));
    }
}
