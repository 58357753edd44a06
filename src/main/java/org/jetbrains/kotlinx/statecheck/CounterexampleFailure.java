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

import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;

import java.util.List;

/**
 * A trial found a command sequence on which the system under test disagrees with the model.
 * <p>
 * The reported {@link #getCounterexample() counterexample} is the smallest failing sequence
 * the minimization has found, and {@link #getError() the error} is the one it fails with.
 * During the minimization any failure is accepted as a reproduction, so this error
 * may differ from the one of the originally generated sequence.
 */
public class CounterexampleFailure extends StateCheckFailure {
    private final long trialSeed;
    private final CommandSequence<?, ?> counterexample;
    private final CommandExecutionException error;
    private final int originalSize;
    private final int shrinkIterations;

    public CounterexampleFailure(long seed, long trialSeed, CommandSequence<?, ?> counterexample,
                                 CommandExecutionException error, int originalSize, int shrinkIterations)
    {
        super(seed);
        this.trialSeed = trialSeed;
        this.counterexample = counterexample;
        this.error = error;
        this.originalSize = originalSize;
        this.shrinkIterations = shrinkIterations;
    }

    /**
     * The seed which regenerates the original failing sequence, see {@link StateCheckOptions#trialSeed(long)}.
     */
    public long getTrialSeed() {
        return trialSeed;
    }

    public CommandSequence<?, ?> getCounterexample() {
        return counterexample;
    }

    @Override
    public CommandExecutionException getError() {
        return error;
    }

    /**
     * The number of commands in the originally generated failing sequence.
     */
    public int getOriginalSize() {
        return originalSize;
    }

    public int getShrinkIterations() {
        return shrinkIterations;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("= Counterexample found =\n");
        sb.append("Seed: ").append(getSeed()).append(", trial seed: ").append(trialSeed).append('\n');
        sb.append("Original sequence of ").append(originalSize).append(" commands minimized to ")
            .append(counterexample.size()).append(" in ").append(shrinkIterations).append(" shrink iterations\n");
        List<?> commands = counterexample.getCommands();
        for (int i = 0; i < commands.size(); i++) {
            sb.append(String.format("%4d. %s%n", i + 1, commands.get(i)));
        }
        sb.append("Error: ").append(error.getMessage());
        return sb.toString();
    }
}
