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
package org.jetbrains.kotlinx.statecheck.shrinking;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.kotlinx.statecheck.StateMachine;
import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;
import org.jetbrains.kotlinx.statecheck.paramgen.ShrinkableValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Searches for a smaller failing command sequence.
 * <p>
 * The search is greedy and has two phases. First, it tries to delete the commands
 * one by one, from the first to the last; a deleted command keeps its position,
 * so it can be restored by {@link #complicate()}. The deletion never goes below
 * {@code minIncluded} commands. Then, if {@code shrinkCommands} is enabled, it
 * simplifies the remaining commands one by one, each until the command itself
 * cannot be simplified anymore.
 * <p>
 * The number of successful {@link #simplify()} calls is bounded by the sequence size
 * plus the number of steps the commands can be simplified in.
 * <p>
 * Note that the commands surviving a deletion are replayed as is, although they were
 * generated for the model state reached through the deleted ones; their preconditions
 * are not validated again.
 */
public class CommandSequenceShrinker<C, R> implements ShrinkableValue<CommandSequence<C, R>> {
    private final List<ShrinkableValue<? extends C>> elements;
    private final boolean[] included;
    private final StateMachine<C, R> model;
    private final int minIncluded;
    private final boolean shrinkCommands;

    private int includedCount;
    private ShrinkStep step = ShrinkStep.deleteCommand(0);
    @Nullable
    private ShrinkStep lastStep;

    public CommandSequenceShrinker(List<? extends ShrinkableValue<? extends C>> elements, StateMachine<C, R> model,
                                   int minIncluded, boolean shrinkCommands)
    {
        if (minIncluded < 1)
            throw new IllegalArgumentException("At least one command should remain after shrinking: " + minIncluded);
        this.elements = new ArrayList<>(elements);
        this.included = new boolean[elements.size()];
        Arrays.fill(included, true);
        this.includedCount = elements.size();
        this.model = model;
        this.minIncluded = minIncluded;
        this.shrinkCommands = shrinkCommands;
    }

    /**
     * Returns the currently included commands paired with a fresh copy of the model.
     */
    @Override
    public CommandSequence<C, R> current() {
        List<C> commands = new ArrayList<>(includedCount);
        for (int i = 0; i < elements.size(); i++) {
            if (included[i])
                commands.add(elements.get(i).current());
        }
        StateMachine<C, R> stateMachine = model.copy();
        stateMachine.reset();
        return new CommandSequence<>(commands, stateMachine);
    }

    @Override
    public boolean simplify() {
        if (step.kind == ShrinkStep.Kind.DELETE_COMMAND) {
            int index = step.index;
            if (index >= elements.size() || includedCount <= minIncluded) {
                step = ShrinkStep.shrinkCommand(0);
            } else {
                included[index] = false;
                includedCount--;
                lastStep = step;
                step = ShrinkStep.deleteCommand(index + 1);
                return true;
            }
        }
        if (!shrinkCommands)
            return false;
        while (step.index < elements.size()) {
            int index = step.index;
            if (included[index] && elements.get(index).simplify()) {
                lastStep = step;
                return true;
            }
            step = ShrinkStep.shrinkCommand(index + 1);
        }
        return false;
    }

    @Override
    public boolean complicate() {
        if (lastStep == null)
            return false;
        int index = lastStep.index;
        if (lastStep.kind == ShrinkStep.Kind.DELETE_COMMAND) {
            included[index] = true;
            includedCount++;
            lastStep = null;
            return true;
        }
        if (elements.get(index).complicate())
            return true;
        lastStep = null;
        return false;
    }

    /**
     * The number of originally generated commands.
     */
    public int size() {
        return elements.size();
    }

    public int includedCount() {
        return includedCount;
    }

    public boolean isIncluded(int index) {
        return included[index];
    }

    @Override
    public String toString() {
        return "CommandSequenceShrinker{step=" + step + ", lastStep=" + lastStep +
            ", included=" + includedCount + "/" + elements.size() + "}";
    }
}
