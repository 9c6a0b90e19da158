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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Top level container of a netlist: its modules, a process-wide auto index
 * used to name generated objects uniquely, and a string scratchpad that
 * carries settings and results between passes.
 */
public class Design {

    private final Map<String, Module> modules = new LinkedHashMap<>();

    private final Map<String, String> scratchpad = new TreeMap<>();

    private int autoIdx = 1;

    public Module addModule(String name) {
        Module m = new Module(this, name);
        Module collision = modules.putIfAbsent(name, m);
        if (collision != null) {
            throw new RuntimeException("ERROR: Name collision inside design, trying to add module "
                    + name + " which already exists.");
        }
        return m;
    }

    public Module getModule(String name) {
        return modules.get(name);
    }

    public List<Module> getModules() {
        return new ArrayList<>(modules.values());
    }

    /**
     * @return A fresh index, never returned before by this design.
     */
    public int nextAutoIdx() {
        return autoIdx++;
    }

    public void setAutoIdx(int autoIdx) {
        this.autoIdx = autoIdx;
    }

    public int getAutoIdx() {
        return autoIdx;
    }

    public Map<String, String> getScratchpad() {
        return scratchpad;
    }

    public boolean hasScratchpadValue(String key) {
        return scratchpad.containsKey(key);
    }

    public String getScratchpadString(String key, String defaultValue) {
        String value = scratchpad.get(key);
        return value == null ? defaultValue : value;
    }

    public boolean getScratchpadBool(String key, boolean defaultValue) {
        String value = scratchpad.get(key);
        if (value == null) return defaultValue;
        return value.equals("1") || value.equalsIgnoreCase("true");
    }

    public void setScratchpadString(String key, String value) {
        scratchpad.put(key, value);
    }
}
