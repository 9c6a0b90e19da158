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
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * A collection of file and external process helpers used by the Orlo passes.
 */
public class FileTools {

    private static final String TEMP_DIR_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private static final SecureRandom random = new SecureRandom();

    /**
     * This is a simple method that writes a String to a file and adds a new line.
     * @param text the String to write to the file
     * @param fileName Name of the text file to write
     */
    public static void writeStringToTextFile(String text, String fileName) {
        String nl = System.lineSeparator();
        try (FileWriter fw = new FileWriter(fileName);
            BufferedWriter bw = new BufferedWriter(fw)) {
            bw.write(text + nl);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Opening " + fileName + " for writing failed: " + e.getMessage(), e);
        }
    }

    /**
     * This is a simple method that will write an ArrayList of Strings to a file,
     * one line each.
     * @param lines The lines to write
     * @param fileName Name of the text file to write
     */
    public static void writeLinesToTextFile(List<String> lines, String fileName) {
        String nl = System.lineSeparator();
        try (FileWriter fw = new FileWriter(fileName);
            BufferedWriter bw = new BufferedWriter(fw)) {
            for (String line : lines) {
                bw.write(line + nl);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Opening " + fileName + " for writing failed: " + e.getMessage(), e);
        }
    }

    /**
     * This is a simple method that will read in a text file and put each line in a
     * string and put all the lines in an ArrayList.
     * @param fileName Name of the text file to load.
     * @return An ArrayList containing strings of each line in the file.
     */
    public static ArrayList<String> getLinesFromTextFile(String fileName) {
        String line;
        ArrayList<String> lines = new ArrayList<String>();
        try (FileReader fr = new FileReader(fileName);
            BufferedReader br = new BufferedReader(fr)) {
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        }
        catch (FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
        return lines;
    }

    /**
     * Creates a single directory called dirName. The parent must exist.
     * @param dirName Name of the directory to be created.
     * @return True if the directory was created, false if it exists or could not be made.
     */
    public static boolean makeDir(String dirName) {
        return new File(dirName).mkdir();
    }

    /**
     * Creates a fresh directory below parentDir whose name is prefix followed by
     * six random alphanumeric characters.
     * @param parentDir Existing or creatable parent directory
     * @param prefix Leading part of the new directory's name
     * @return Absolute path of the created directory
     */
    public static String makeTempDir(String parentDir, String prefix) {
        File parent = new File(parentDir).getAbsoluteFile();
        if (!parent.isDirectory() && !parent.mkdirs()) {
            throw new RuntimeException("ERROR: Could not create directory " + parent);
        }
        for (int attempt = 0; attempt < 100; attempt++) {
            StringBuilder sb = new StringBuilder(prefix);
            for (int i = 0; i < 6; i++) {
                sb.append(TEMP_DIR_CHARS.charAt(random.nextInt(TEMP_DIR_CHARS.length())));
            }
            File dir = new File(parent, sb.toString());
            if (dir.mkdir()) {
                return dir.getAbsolutePath();
            }
        }
        throw new RuntimeException("ERROR: Could not create a temporary directory below " + parent);
    }

    /**
     * Delete the folder and recursively files and folders below
     * @param folderName
     * @return true for successful deletion, false otherwise
     */
    public static boolean deleteFolder(String folderName) {
        File f = new File(folderName);
        if (!f.exists() || !f.isDirectory()) {
            MessageGenerator.briefError("WARNING: Attempted to delete folder " + folderName + " but it wasn't there.");
            return false;
        }
        for (File i : f.listFiles()) {
            if (i.isDirectory()) {
                deleteFolder(i.getAbsolutePath());
            } else if (!i.delete()) {
                throw new IllegalArgumentException("Delete: deletion failed: " + i.getAbsolutePath());
            }
        }
        return f.delete();
    }

    /**
     * Runs a command from the system command line, merging its stderr into
     * stdout. This method blocks until the command finishes.
     * @param command The command and its arguments.
     * @param lineConsumer Receives every output line, may be null to discard output.
     * @param runDir The working directory of the subprocess, or null to inherit it.
     * @return The return value of the process.
     */
    public static int runCommand(String[] command, Consumer<String> lineConsumer, File runDir) {
        ProcessBuilder pb = new ProcessBuilder(Arrays.asList(command));
        pb.redirectErrorStream(true);
        if (runDir != null) {
            pb.directory(runDir);
        }
        Process p = null;
        try {
            p = pb.start();
            StreamGobbler output = new StreamGobbler(p.getInputStream(), lineConsumer);
            output.start();
            int returnValue = p.waitFor();
            output.join();
            return returnValue;
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: In running the command \"" + String.join(" ", command) + "\"", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("ERROR: The command was interrupted: \"" + String.join(" ", command) + "\"", e);
        } finally {
            if (p != null) p.destroyForcibly();
        }
    }
}
