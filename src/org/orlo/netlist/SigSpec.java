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
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable, ordered vector of {@link SigBit}s (LSB at index 0).
 */
public final class SigSpec implements Iterable<SigBit>, Comparable<SigSpec> {

    public static final SigSpec EMPTY = new SigSpec(Collections.emptyList());

    private final List<SigBit> bits;

    private SigSpec(List<SigBit> bits) {
        this.bits = bits;
    }

    public static SigSpec of(Wire wire) {
        List<SigBit> bits = new ArrayList<>(wire.getWidth());
        for (int i = 0; i < wire.getWidth(); i++) {
            bits.add(new SigBit(wire, i));
        }
        return new SigSpec(Collections.unmodifiableList(bits));
    }

    public static SigSpec of(SigBit... bits) {
        return new SigSpec(Collections.unmodifiableList(Arrays.asList(bits.clone())));
    }

    public static SigSpec of(List<SigBit> bits) {
        return new SigSpec(Collections.unmodifiableList(new ArrayList<>(bits)));
    }

    public static SigSpec of(State state) {
        return of(SigBit.of(state));
    }

    public int size() {
        return bits.size();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public SigBit get(int i) {
        return bits.get(i);
    }

    /**
     * @return The wire this signal covers completely (all bits, in order), or null.
     */
    public Wire asWire() {
        if (bits.isEmpty()) return null;
        Wire w = bits.get(0).getWire();
        if (w == null || w.getWidth() != bits.size()) return null;
        for (int i = 0; i < bits.size(); i++) {
            if (bits.get(i).getWire() != w || bits.get(i).getOffset() != i) return null;
        }
        return w;
    }

    public SigBit asBit() {
        if (bits.size() != 1) {
            throw new RuntimeException("ERROR: Expected a single bit signal, found " + this);
        }
        return bits.get(0);
    }

    @Override
    public Iterator<SigBit> iterator() {
        return bits.iterator();
    }

    @Override
    public int compareTo(SigSpec o) {
        if (bits.size() != o.bits.size()) return Integer.compare(bits.size(), o.bits.size());
        for (int i = 0; i < bits.size(); i++) {
            int c = bits.get(i).compareTo(o.bits.get(i));
            if (c != 0) return c;
        }
        return 0;
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SigSpec)) return false;
        return bits.equals(((SigSpec) obj).bits);
    }

    @Override
    public String toString() {
        if (bits.isEmpty()) return "{}";
        if (bits.size() == 1) return bits.get(0).toString();
        Wire w = asWire();
        if (w != null) return w.getName();
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = bits.size() - 1; i >= 0; i--) {
            sb.append(bits.get(i)).append(' ');
        }
        return sb.append('}').toString();
    }
}
