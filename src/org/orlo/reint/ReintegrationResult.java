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
package org.orlo.reint;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one reintegration: cells per optimizer cell type and how many
 * graph signals stayed internal or were reconnected as inputs or outputs.
 */
public class ReintegrationResult {

    /** Result of a cycle whose optimizer output was missing */
    public static final ReintegrationResult SKIPPED = new ReintegrationResult(true, new TreeMap<>(), 0, 0, 0);

    private final boolean skipped;

    private final SortedMap<String, Integer> cellStats;

    private final int internalSignals;

    private final int inputSignals;

    private final int outputSignals;

    public ReintegrationResult(boolean skipped, SortedMap<String, Integer> cellStats, int internalSignals,
                               int inputSignals, int outputSignals) {
        this.skipped = skipped;
        this.cellStats = Collections.unmodifiableSortedMap(cellStats);
        this.internalSignals = internalSignals;
        this.inputSignals = inputSignals;
        this.outputSignals = outputSignals;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public SortedMap<String, Integer> getCellStats() {
        return cellStats;
    }

    public int getCellCount(String type) {
        return cellStats.getOrDefault(type, 0);
    }

    public int getInternalSignals() {
        return internalSignals;
    }

    public int getInputSignals() {
        return inputSignals;
    }

    public int getOutputSignals() {
        return outputSignals;
    }
}
