/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.rmqcli.output;

import java.io.PrintStream;

/**
 * Human readable progress and result lines, written to standard error so that standard
 * output only carries messages and results. Quiet mode suppresses everything but errors.
 */
public class StatusOutput {

    static final String STATUS_SYMBOL = "•";
    static final String SUCCESS_SYMBOL = "✓";
    static final String WARNING_SYMBOL = "⚠";
    static final String ERROR_SYMBOL = "✗";

    private static final String RESET = "\u001B[0m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String RED = "\u001B[31m";

    private final PrintStream err;

    private final boolean quiet;

    private final boolean color;

    public StatusOutput(PrintStream err, boolean quiet, boolean color) {
        this.err = err;
        this.quiet = quiet;
        this.color = color;
    }

    public void status(String message) {
        if (!quiet)
            err.println(STATUS_SYMBOL + " " + message);
    }

    public void success(String message) {
        if (!quiet)
            err.println(paint(GREEN, SUCCESS_SYMBOL) + " " + message);
    }

    public void warning(String message) {
        if (!quiet)
            err.println(paint(YELLOW, WARNING_SYMBOL) + " " + message);
    }

    public void error(String message) {
        err.println(paint(RED, ERROR_SYMBOL) + " " + message);
    }

    /**
     * Prints the prompt without a line break, used before reading a confirmation.
     */
    public void prompt(String message) {
        err.print(paint(YELLOW, WARNING_SYMBOL) + " " + message);
        err.flush();
    }

    public boolean isQuiet() {
        return quiet;
    }

    private String paint(String ansi, String text) {
        return color ? ansi + text + RESET : text;
    }
}
