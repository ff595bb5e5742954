/*
 * EBML-Catalog - EBML/Matroska schema catalog generator
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.ebml.catalog.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.ebml.catalog.core.GenerationListener;
import net.boyechko.ebml.catalog.core.GenerationResult;
import net.boyechko.ebml.catalog.core.VerbosityLevel;
import org.slf4j.LoggerFactory;

/** Console transcript of a generation run, drawn as one box per phase. */
public class GenerationReporter implements GenerationListener {
    private static final String APP_LOGGER = "net.boyechko.ebml.catalog";

    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public GenerationReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS, VerbosityLevel.NORMAL);
    }

    @Override
    public void onWarning(String message) {
        printLine(message, WARNING, VerbosityLevel.NORMAL);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onSummary(GenerationResult result) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");
        printLine(
                "Elements: " + result.elementCount()
                        + " (" + result.masterCount() + " master, "
                        + result.rootCount() + " root, "
                        + result.deprecatedCount() + " deprecated)",
                INFO,
                VerbosityLevel.NORMAL);
        printLine("Enumerated values: " + result.enumerationCount(), INFO, VerbosityLevel.NORMAL);
        printLine("Tags: " + result.tagCount(), INFO, VerbosityLevel.NORMAL);
        for (Path path : result.writtenFiles()) {
            printLine("Output saved to " + path, SUCCESS, VerbosityLevel.NORMAL);
        }
        printBoxFooter();
        phaseOpen = false;
    }

    /** Closes the open phase box, e.g. before printing a failure after a phase aborted. */
    public void finish() {
        closePhaseBoxIfOpen();
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Prints warnings and errors logged since the last drain inside the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : WARNING;
            printLine(
                    "[" + event.getLevel() + "] " + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.NORMAL);
        }
    }

    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.isAtLeast(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    /** Word-wraps text at word boundaries to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
