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
package org.jetbrains.kotlinx.statecheck.execution;

import org.jetbrains.kotlinx.statecheck.StateCheckConfiguration;
import org.jetbrains.kotlinx.statecheck.StateMachine;
import org.jetbrains.kotlinx.statecheck.paramgen.ShrinkableValue;
import org.jetbrains.kotlinx.statecheck.shrinking.CommandSequenceShrinker;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds random command sequences.
 * <p>
 * The length is drawn uniformly from {@code [minSequenceSize; maxSequenceSize]}.
 * Every next command is sampled from the options the model offers in the state
 * reached by the previously generated commands.
 */
public class CommandSequenceGenerator<C, R> {
    private final StateMachine<C, R> model;
    private final StateCheckConfiguration testCfg;

    public CommandSequenceGenerator(StateMachine<C, R> model, StateCheckConfiguration testCfg) {
        this.model = model;
        this.testCfg = testCfg;
    }

    public CommandSequenceShrinker<C, R> nextSequence(Random random) throws GenerationException {
        int minSize = testCfg.minSequenceSize;
        int size = (int) (minSize + random.nextLong((long) testCfg.maxSequenceSize - minSize + 1));
        StateMachine<C, R> stateMachine = model.copy();
        stateMachine.reset();
        CommandSelector selector = new CommandSelector(random);
        List<ShrinkableValue<? extends C>> elements = new ArrayList<>(size);
        while (elements.size() < size) {
            ShrinkableValue<? extends C> command = selector.next(stateMachine.commands());
            stateMachine.nextState(command.current());
            elements.add(command);
        }
        stateMachine.reset();
        return new CommandSequenceShrinker<>(elements, stateMachine,
            testCfg.minShrunkSequenceSize, testCfg.shrinkCommands);
    }
}
