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
package org.orlo.abc;

import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans up the optimizer's console output before it is logged: terminal
 * escape sequences are dropped, carriage-return progress lines collapse to
 * their last state, the work directory is hidden and timing path end points
 * are annotated with the host signal names.
 */
public class AbcOutputFilter implements Consumer<String> {

    public static final String TEMP_DIR_PLACEHOLDER = "<abc-temp-dir>";

    private static final Pattern PATH_POINTS = Pattern.compile("Start-point = pi(\\d+)\\.  End-point = po(\\d+)\\..*");

    private final String tempDir;

    private final boolean showTempDir;

    private final Map<Integer, String> piMap;

    private final Map<Integer, String> poMap;

    private final Consumer<String> sink;

    private boolean gotCr;

    private int escapeSeqState;

    private final StringBuilder lineBuf = new StringBuilder();

    public AbcOutputFilter(String tempDir, boolean showTempDir, Map<Integer, String> piMap, Map<Integer, String> poMap) {
        this(tempDir, showTempDir, piMap, poMap, System.out::println);
    }

    /**
     * @param sink Receives every cleaned up line
     */
    public AbcOutputFilter(String tempDir, boolean showTempDir, Map<Integer, String> piMap, Map<Integer, String> poMap,
                           Consumer<String> sink) {
        this.tempDir = tempDir;
        this.showTempDir = showTempDir;
        this.piMap = piMap;
        this.poMap = poMap;
        this.sink = sink;
    }

    /**
     * Replaces every occurrence of the work directory with a placeholder.
     */
    public static String replaceTempDir(String text, String tempDir, boolean showTempDir) {
        if (showTempDir || tempDir == null || tempDir.isEmpty()) return text;
        return text.replace(tempDir, TEMP_DIR_PLACEHOLDER);
    }

    @Override
    public void accept(String line) {
        Matcher m = PATH_POINTS.matcher(line);
        if (m.matches()) {
            int pi = Integer.parseInt(m.group(1));
            int po = Integer.parseInt(m.group(2));
            sink.accept("ABC: Start-point = pi" + pi + " (" + piMap.getOrDefault(pi, "???") + ").  End-point = po"
                    + po + " (" + poMap.getOrDefault(po, "???") + ").");
            return;
        }
        for (int i = 0; i < line.length(); i++) {
            nextChar(line.charAt(i));
        }
        nextChar('\n');
    }

    private void nextChar(char ch) {
        if (escapeSeqState == 0 && ch == '\033') {
            escapeSeqState = 1;
            return;
        }
        if (escapeSeqState == 1) {
            escapeSeqState = ch == '[' ? 2 : 0;
            return;
        }
        if (escapeSeqState == 2) {
            if ((ch < '0' || '9' < ch) && ch != ';') {
                escapeSeqState = 0;
            }
            return;
        }
        escapeSeqState = 0;
        if (ch == '\r') {
            gotCr = true;
            return;
        }
        if (ch == '\n') {
            sink.accept("ABC: " + replaceTempDir(lineBuf.toString(), tempDir, showTempDir));
            gotCr = false;
            lineBuf.setLength(0);
            return;
        }
        if (gotCr) {
            gotCr = false;
            lineBuf.setLength(0);
        }
        lineBuf.append(ch);
    }
}
