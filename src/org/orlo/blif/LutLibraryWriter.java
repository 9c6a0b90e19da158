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
package org.orlo.blif;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.orlo.util.FileTools;

/**
 * Writes the LUT library: one line per LUT size (starting at 1) with its area.
 */
public class LutLibraryWriter {

    public static final String FILE_NAME = "lutdefs.txt";

    public static List<String> render(List<Integer> lutCosts) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < lutCosts.size(); i++) {
            lines.add(String.format("%d %d.00 1.00", i + 1, lutCosts.get(i)));
        }
        return lines;
    }

    public static void write(File file, List<Integer> lutCosts) {
        FileTools.writeLinesToTextFile(render(lutCosts), file.getPath());
    }
}
