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

import java.util.HashMap;
import java.util.Map;

/**
 * Initial values of register outputs, read from the 'init' attributes of a
 * module's wires and keyed by canonical bit.
 */
public class InitValues {

    private final Map<SigBit, State> values = new HashMap<>();

    private final SigMap sigMap;

    public InitValues(SigMap sigMap, Module module) {
        this.sigMap = sigMap;
        for (Wire w : module.getWires()) {
            String init = w.getAttribute(Wire.INIT);
            if (init == null || !Const.isBinary(init)) continue;
            for (int i = 0; i < w.getWidth(); i++) {
                State s = Const.bitAt(init, i);
                if (s.isDefined()) {
                    values.put(sigMap.apply(w.getBit(i)), s);
                }
            }
        }
    }

    /**
     * @param bit Any bit of the module
     * @return The recorded initial value, or {@link State#Sx} if none.
     */
    public State get(SigBit bit) {
        State s = values.get(sigMap.apply(bit));
        return s == null ? State.Sx : s;
    }
}
