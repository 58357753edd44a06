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

import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;

import java.util.function.Supplier;

import static org.jetbrains.kotlinx.statecheck.StateCheckConfiguration.*;

/**
 * Options for a model-based test run.
 */
public class StateCheckOptions {
    protected int iterations = DEFAULT_ITERATIONS;
    protected int minSequenceSize = DEFAULT_MIN_SEQUENCE_SIZE;
    protected int maxSequenceSize = DEFAULT_MAX_SEQUENCE_SIZE;
    protected int minShrunkSequenceSize = DEFAULT_MIN_SHRUNK_SEQUENCE_SIZE;
    protected boolean shrinkCommands = DEFAULT_SHRINK_COMMANDS;
    protected int maxShrinkIterations = DEFAULT_MAX_SHRINK_ITERATIONS;
    protected int threads = DEFAULT_THREADS;
    protected boolean minimizeFailedScenario = DEFAULT_MINIMIZE_ERROR;
    protected Long seed;
    protected Long trialSeed;
    protected LoggingLevel logLevel = Reporter.DEFAULT_LOG_LEVEL;

    /**
     * Number of independent trials, each with its own randomly generated sequence.
     */
    public StateCheckOptions iterations(int iterations) {
        this.iterations = iterations;
        return this;
    }

    /**
     * Minimal number of commands in a generated sequence, {@code 1} by default.
     */
    public StateCheckOptions minSequenceSize(int minSequenceSize) {
        this.minSequenceSize = minSequenceSize;
        return this;
    }

    /**
     * Maximal number of commands in a generated sequence, {@code 100} by default.
     */
    public StateCheckOptions maxSequenceSize(int maxSequenceSize) {
        this.maxSequenceSize = maxSequenceSize;
        return this;
    }

    /**
     * Shrinking never deletes commands below this number, {@code 1} by default.
     */
    public StateCheckOptions minShrunkSequenceSize(int minShrunkSequenceSize) {
        this.minShrunkSequenceSize = minShrunkSequenceSize;
        return this;
    }

    /**
     * Once no command can be deleted from the failing sequence anymore,
     * also simplify the arguments of the remaining commands. Disabled by default.
     */
    public StateCheckOptions shrinkCommands(boolean shrinkCommands) {
        this.shrinkCommands = shrinkCommands;
        return this;
    }

    /**
     * Maximal number of candidate sequences executed while minimizing a failure.
     */
    public StateCheckOptions maxShrinkIterations(int maxShrinkIterations) {
        this.maxShrinkIterations = maxShrinkIterations;
        return this;
    }

    /**
     * Number of threads running the trials. Each trial uses its own model copy and system under test.
     */
    public StateCheckOptions threads(int threads) {
        this.threads = threads;
        return this;
    }

    /**
     * Set to {@code false} to report the originally generated failing sequence.
     */
    public StateCheckOptions minimizeFailedScenario(boolean minimizeFailedScenario) {
        this.minimizeFailedScenario = minimizeFailedScenario;
        return this;
    }

    /**
     * Seed of the run, a random one is chosen if it is not specified.
     */
    public StateCheckOptions seed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * Replays the single trial with the specified seed, as reported by a {@link CounterexampleFailure}.
     */
    public StateCheckOptions trialSeed(long trialSeed) {
        this.trialSeed = trialSeed;
        return this;
    }

    public StateCheckOptions logLevel(LoggingLevel logLevel) {
        this.logLevel = logLevel;
        return this;
    }

    public StateCheckConfiguration createTestConfiguration() {
        return new StateCheckConfiguration(iterations, minSequenceSize, maxSequenceSize, minShrunkSequenceSize,
            shrinkCommands, maxShrinkIterations, threads, minimizeFailedScenario, seed,
            trialSeed, logLevel);
    }

    /**
     * Runs the test with these options.
     *
     * @throws StateCheckAssertionError if the system under test disagrees with the model.
     * @see StateChecker#check(StateMachine, Supplier, StateCheckOptions)
     */
    public <C, R> void check(StateMachine<C, R> model, Supplier<? extends SystemUnderTest<C, R>> sutFactory) {
        StateChecker.check(model, sutFactory, this);
    }
}
