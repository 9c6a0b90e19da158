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
package org.orlo.netlist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.orlo.util.Pair;

/**
 * Resolves aliased signal bits of a module to one canonical bit each. Two bits
 * are aliases when a direct connection joins them. The canonical bit of an
 * alias class is a constant if the class has one, else a port bit, else a
 * bit with a user-given name, else the smallest bit in {@link SigBit} order.
 */
public class SigMap {

    private final Map<SigBit, SigBit> parent = new HashMap<>();

    public SigMap() {
    }

    public SigMap(Module module) {
        set(module);
    }

    /**
     * Rebuilds the alias classes from the module's current connections.
     * @param module The module to read connections from
     */
    public void set(Module module) {
        parent.clear();
        for (Pair<SigSpec, SigSpec> conn : module.getConnections()) {
            add(conn.getFirst(), conn.getSecond());
        }
    }

    public void clear() {
        parent.clear();
    }

    public void add(SigSpec a, SigSpec b) {
        for (int i = 0; i < a.size(); i++) {
            add(a.get(i), b.get(i));
        }
    }

    public void add(SigBit a, SigBit b) {
        SigBit ra = find(a);
        SigBit rb = find(b);
        if (ra.equals(rb)) return;
        if (isPreferred(ra, rb)) {
            parent.put(rb, ra);
        } else {
            parent.put(ra, rb);
        }
    }

    private SigBit find(SigBit bit) {
        SigBit root = bit;
        SigBit next;
        while ((next = parent.get(root)) != null) {
            root = next;
        }
        SigBit cur = bit;
        while (!cur.equals(root)) {
            next = parent.get(cur);
            parent.put(cur, root);
            cur = next;
        }
        return root;
    }

    private static int rank(SigBit bit) {
        if (bit.isConst()) return bit.getData().isDefined() ? 0 : 1;
        if (bit.getWire().isPort()) return 2;
        if (!bit.getWire().isSynthetic()) return 3;
        return 4;
    }

    private static boolean isPreferred(SigBit a, SigBit b) {
        int ra = rank(a);
        int rb = rank(b);
        if (ra != rb) return ra < rb;
        return a.compareTo(b) <= 0;
    }

    public SigBit apply(SigBit bit) {
        return find(bit);
    }

    public SigSpec apply(SigSpec sig) {
        List<SigBit> bits = new ArrayList<>(sig.size());
        for (SigBit b : sig) {
            bits.add(find(b));
        }
        return SigSpec.of(bits);
    }
}
