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

import java.util.Collections;
import java.util.Map;

/**
 * All netlist objects that can carry attributes inherit from this class.
 * Attribute values are kept in their textual form; integer values are
 * encoded as 32-bit binary strings, MSB first.
 */
public class PropertyObject extends NamedObject {

    private Map<String, String> attributes;

    public PropertyObject(String name) {
        super(name);
    }

    public String setAttribute(String key, String value) {
        if (attributes == null) attributes = getNewMap();
        return attributes.put(key, value);
    }

    public String setAttribute(String key, int value) {
        return setAttribute(key, Const.fromInt(value, 32));
    }

    public String getAttribute(String key) {
        if (attributes == null) return null;
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes != null && attributes.containsKey(key);
    }

    /**
     * Checks a flag style attribute such as 'keep'.
     * @param key Attribute name
     * @return True if the attribute exists and holds a non-zero value.
     */
    public boolean getBoolAttribute(String key) {
        String value = getAttribute(key);
        if (value == null) return false;
        return Const.isTrue(value);
    }

    public Map<String, String> getAttributes() {
        return attributes == null ? Collections.emptyMap() : attributes;
    }
}
