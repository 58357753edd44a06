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

import org.jetbrains.kotlinx.statecheck.CommandExecutionException;
import org.jetbrains.kotlinx.statecheck.Reporter;
import org.jetbrains.kotlinx.statecheck.StateMachine;
import org.jetbrains.kotlinx.statecheck.SystemUnderTest;
import org.jetbrains.kotlinx.statecheck.runner.SequenceRunner;
import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of commands together with the model instance used to replay them.
 * The order of the commands is significant and never changes.
 * <p>
 * The paired model is mutated by every {@link #run run}, so a sequence
 * should not be executed by several threads at the same time.
 */
public class CommandSequence<C, R> {
    private final List<C> commands;
    private final StateMachine<C, R> model;

    public CommandSequence(List<? extends C> commands, StateMachine<C, R> model) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
        this.model = model;
    }

    public List<C> getCommands() {
        return commands;
    }

    public StateMachine<C, R> getModel() {
        return model;
    }

    public int size() {
        return commands.size();
    }

    /**
     * Executes this sequence against {@code sut}, checking the postconditions after each command.
     *
     * @throws CommandExecutionException on the first failed command
     */
    public void run(SystemUnderTest<C, R> sut) throws CommandExecutionException {
        new SequenceRunner<C, R>(new Reporter(LoggingLevel.OFF)).run(this, sut);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        CommandSequence<?, ?> that = (CommandSequence<?, ?>) o;
        return commands.equals(that.commands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commands);
    }

    @Override
    public String toString() {
        return commands.toString();
    }
}
