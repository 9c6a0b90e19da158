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

/**
 * One bit of a circuit signal: either bit {@code offset} of a wire or a
 * constant logic value. SigBits are immutable and totally ordered: constants
 * first, then by wire name, then by offset.
 */
public final class SigBit implements Comparable<SigBit> {

    public static final SigBit S0 = new SigBit(State.S0);
    public static final SigBit S1 = new SigBit(State.S1);
    public static final SigBit Sx = new SigBit(State.Sx);
    public static final SigBit Sz = new SigBit(State.Sz);

    private final Wire wire;
    private final int offset;
    private final State data;

    public SigBit(Wire wire, int offset) {
        if (offset < 0 || offset >= wire.getWidth()) {
            throw new RuntimeException("ERROR: Bit " + offset + " out of range for wire " + wire.getName());
        }
        this.wire = wire;
        this.offset = offset;
        this.data = null;
    }

    private SigBit(State data) {
        this.wire = null;
        this.offset = 0;
        this.data = data;
    }

    public static SigBit of(State state) {
        switch (state) {
            case S0: return S0;
            case S1: return S1;
            case Sz: return Sz;
            default: return Sx;
        }
    }

    public Wire getWire() {
        return wire;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * @return The constant value of this bit, or null if it is a wire bit.
     */
    public State getData() {
        return data;
    }

    public boolean isConst() {
        return wire == null;
    }

    @Override
    public int compareTo(SigBit o) {
        if (wire == null || o.wire == null) {
            if (wire != null) return 1;
            if (o.wire != null) return -1;
            return data.compareTo(o.data);
        }
        int c = wire.getName().compareTo(o.wire.getName());
        if (c != 0) return c;
        return Integer.compare(offset, o.offset);
    }

    @Override
    public int hashCode() {
        if (wire == null) return data.hashCode();
        return wire.getName().hashCode() * 31 + offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SigBit)) return false;
        SigBit other = (SigBit) obj;
        return wire == other.wire && offset == other.offset && data == other.data;
    }

    @Override
    public String toString() {
        if (wire == null) return "1'" + data.getSymbol();
        if (wire.getWidth() == 1) return wire.getName();
        return wire.getName() + "[" + offset + "]";
    }
}
