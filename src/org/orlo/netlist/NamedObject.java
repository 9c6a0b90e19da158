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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Common ancestor of all named netlist objects. Names that begin with '$' are
 * synthetic (tool generated), all others are user-given.
 */
public class NamedObject implements Comparable<NamedObject> {

    private final String name;

    public NamedObject(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    /**
     * @return True if this object carries a tool generated name (starting with '$').
     */
    public boolean isSynthetic() {
        return isSyntheticName(name);
    }

    public static boolean isSyntheticName(String name) {
        return name.startsWith("$");
    }

    public static <K, V> Map<K, V> getNewMap() {
        // Keeps insertion order for reproducible iteration
        return new LinkedHashMap<K, V>(2);
    }

    @Override
    public int compareTo(NamedObject o) {
        return this.getName().compareTo(o.getName());
    }

    @Override
    public String toString() {
        return name;
    }
}
