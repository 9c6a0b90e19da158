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
 * Logic value of a single constant bit.
 */
public enum State {
    S0('0'),
    S1('1'),
    Sx('x'),
    Sz('z');

    private final char symbol;

    State(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public boolean isDefined() {
        return this == S0 || this == S1;
    }

    public static State fromChar(char c) {
        switch (c) {
            case '0': return S0;
            case '1': return S1;
            case 'z':
            case 'Z': return Sz;
            case 'x':
            case 'X':
            case '-': return Sx;
            default:
                throw new RuntimeException("ERROR: Unknown logic value '" + c + "'");
        }
    }
}
