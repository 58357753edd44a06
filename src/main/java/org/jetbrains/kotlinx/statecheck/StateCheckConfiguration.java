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
import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;

/**
 * Configuration of a model-based test run, see {@link StateCheckOptions} for the description of the parameters.
 */
public class StateCheckConfiguration {
    public static final int DEFAULT_ITERATIONS = 256;
    public static final int DEFAULT_MIN_SEQUENCE_SIZE = 1;
    public static final int DEFAULT_MAX_SEQUENCE_SIZE = 100;
    public static final int DEFAULT_MIN_SHRUNK_SEQUENCE_SIZE = 1;
    public static final boolean DEFAULT_SHRINK_COMMANDS = false;
    public static final int DEFAULT_MAX_SHRINK_ITERATIONS = Integer.MAX_VALUE;
    public static final int DEFAULT_THREADS = 1;
    public static final boolean DEFAULT_MINIMIZE_ERROR = true;

    public final int iterations;
    public final int minSequenceSize;
    public final int maxSequenceSize;
    public final int minShrunkSequenceSize;
    public final boolean shrinkCommands;
    public final int maxShrinkIterations;
    public final int threads;
    public final boolean minimizeFailedScenario;
    @Nullable
    public final Long seed;
    @Nullable
    public final Long trialSeed;
    public final LoggingLevel logLevel;

    public StateCheckConfiguration(int iterations, int minSequenceSize, int maxSequenceSize, int minShrunkSequenceSize,
                                   boolean shrinkCommands, int maxShrinkIterations, int threads,
                                   boolean minimizeFailedScenario, @Nullable Long seed,
                                   @Nullable Long trialSeed, LoggingLevel logLevel)
    {
        if (iterations <= 0)
            throw new IllegalArgumentException("The number of iterations should be positive: " + iterations);
        if (minSequenceSize < 0 || maxSequenceSize < minSequenceSize) {
            throw new IllegalArgumentException("Illegal sequence size range: [" + minSequenceSize + "; " +
                maxSequenceSize + "]");
        }
        if (minShrunkSequenceSize < 1) {
            throw new IllegalArgumentException("At least one command should remain after shrinking: " +
                minShrunkSequenceSize);
        }
        if (maxShrinkIterations < 0)
            throw new IllegalArgumentException("maxShrinkIterations should be non-negative: " + maxShrinkIterations);
        if (threads <= 0)
            throw new IllegalArgumentException("The number of threads should be positive: " + threads);
        this.iterations = iterations;
        this.minSequenceSize = minSequenceSize;
        this.maxSequenceSize = maxSequenceSize;
        this.minShrunkSequenceSize = minShrunkSequenceSize;
        this.shrinkCommands = shrinkCommands;
        this.maxShrinkIterations = maxShrinkIterations;
        this.threads = threads;
        this.minimizeFailedScenario = minimizeFailedScenario;
        this.seed = seed;
        this.trialSeed = trialSeed;
        this.logLevel = logLevel;
    }
}
