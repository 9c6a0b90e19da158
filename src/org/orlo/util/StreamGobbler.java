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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Class to help concurrent threads read stdout/stderr of an external process.
 * Each line read is handed to a line consumer (or dropped when none is given).
 */
public class StreamGobbler extends Thread {
    private final InputStream is;
    private final Consumer<String> lineConsumer;

    public StreamGobbler(InputStream is, Consumer<String> lineConsumer) {
        this.is = is;
        this.lineConsumer = lineConsumer;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String str = null;
            while ((str = br.readLine()) != null) {
                if (lineConsumer != null) {
                    synchronized (lineConsumer) {
                        lineConsumer.accept(str);
                    }
                }
            }
        } catch (IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
    }
}
