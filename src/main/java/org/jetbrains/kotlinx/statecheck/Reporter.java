/*-
 * #%L
 * Statecheck
 * %%
 * Copyright (C) 2019 - 2020 JetBrains s.r.o.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 * 
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */
package org.jetbrains.kotlinx.statecheck;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;
import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;

import java.io.PrintStream;

/**
 * Writes the progress of a test run to the output stream, filtered by {@link LoggingLevel}.
 * Trials can run in parallel, so every message is written atomically.
 */
public class Reporter {
    public static final LoggingLevel DEFAULT_LOG_LEVEL = LoggingLevel.WARN;

    private final LoggingLevel logLevel;
    private final PrintStream out;

    public Reporter(LoggingLevel logLevel) {
        this(logLevel, System.out);
    }

    public Reporter(LoggingLevel logLevel, PrintStream out) {
        this.logLevel = logLevel;
        this.out = out;
    }

    public void logIteration(int iteration, int iterations, long trialSeed, CommandSequence<?, ?> sequence) {
        log(LoggingLevel.INFO, "= Iteration " + iteration + " / " + iterations + " (trial seed " + trialSeed + ") =\n" +
            "Commands: " + sequence);
    }

    public void logCommand(Object command, @Nullable Object result) {
        log(LoggingLevel.DEBUG, "  " + command + ": " + result);
    }

    public void logScenarioMinimization(CommandSequence<?, ?> sequence, CommandExecutionException error) {
        log(LoggingLevel.WARN, "Failing sequence of " + sequence.size() + " commands found, trying to minimize it\n" +
            "Commands: " + sequence + "\n" +
            "Error: " + error.getMessage());
    }

    public void logShrinkStep(int shrinkIteration, CommandSequence<?, ?> candidate, @Nullable CommandExecutionException error) {
        log(LoggingLevel.DEBUG, "Shrink iteration " + shrinkIteration + ", " +
            (error == null ? "passed" : "failed") + ": " + candidate);
    }

    public void logFailure(StateCheckFailure failure) {
        log(LoggingLevel.WARN, failure.toString());
    }

    private void log(LoggingLevel level, String message) {
        if (logLevel == LoggingLevel.OFF || level.compareTo(logLevel) < 0)
            return;
        synchronized (out) {
            out.println(message);
        }
    }
}
