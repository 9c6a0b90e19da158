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
package org.orlo.util;

/**
 * Aims to be a centralized helper class to manage global Orlo settings.
 */
public class Params {

    public static final String ORLO_ABC_EXE_NAME = "ORLO_ABC_EXE";

    public static final String ORLO_ABC_TOPDIR_NAME = "ORLO_ABC_TOPDIR";

    public static final String ORLO_DEBUG_NAME = "ORLO_DEBUG";

    /** Name of the ABC executable used when no -exe option or abc.exe scratchpad entry is given */
    public static final String DEFAULT_ABC_EXE = "yosys-abc";

    /** Root below which the per-run work directory is created */
    public static final String DEFAULT_ABC_TOPDIR = "/tmp";

    /**
     * Checks if the named Orlo parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global Orlo parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.length() == 0
               || value.equals("0")
               || value.toLowerCase().equals("false"));
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise defaultValue.
     */
    public static String getParamOrDefault(String key, String defaultValue) {
        String value = getParamValue(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public static String getAbcExecutable() {
        return getParamOrDefault(ORLO_ABC_EXE_NAME, DEFAULT_ABC_EXE);
    }

    public static String getAbcTopDir() {
        return getParamOrDefault(ORLO_ABC_TOPDIR_NAME, DEFAULT_ABC_TOPDIR);
    }
}
