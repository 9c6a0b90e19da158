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
 * Helpers for constant values stored as binary strings (MSB first), the form
 * used for parameters and attributes.
 */
public class Const {

    public static String fromInt(int value, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            sb.append(i < 32 && ((value >>> i) & 1) != 0 ? '1' : '0');
        }
        return sb.toString();
    }

    public static boolean isBinary(String value) {
        if (value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '0' && c != '1' && c != 'x' && c != 'z') return false;
        }
        return true;
    }

    /**
     * Interprets a binary string as an unsigned integer; x and z bits count as 0.
     */
    public static int toInt(String value) {
        if (!isBinary(value)) {
            return Integer.parseInt(value.trim());
        }
        int result = 0;
        int width = Math.min(value.length(), 32);
        for (int i = 0; i < width; i++) {
            char c = value.charAt(value.length() - 1 - i);
            if (c == '1') result |= 1 << i;
        }
        return result;
    }

    /**
     * Gets bit i (LSB is bit 0) of a binary string.
     */
    public static State bitAt(String value, int i) {
        if (i >= value.length()) return State.S0;
        return State.fromChar(value.charAt(value.length() - 1 - i));
    }

    public static boolean isTrue(String value) {
        if (isBinary(value)) return value.indexOf('1') >= 0;
        return !value.isEmpty() && !value.equals("false");
    }
}
