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
package org.jetbrains.kotlinx.statecheck.runner;

import org.jetbrains.kotlinx.statecheck.CommandExecutionException;
import org.jetbrains.kotlinx.statecheck.Reporter;
import org.jetbrains.kotlinx.statecheck.StateMachine;
import org.jetbrains.kotlinx.statecheck.SystemUnderTest;
import org.jetbrains.kotlinx.statecheck.SystemUnderTestException;
import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;

/**
 * Executes a {@link CommandSequence} against the system under test and its model.
 * <p>
 * The commands are applied one by one, in order. After each command the result is checked
 * with {@link StateMachine#postcondition} and the model advances with {@link StateMachine#nextState}.
 * The execution stops on the first failure, since the following commands were generated
 * assuming the previous ones succeeded.
 */
public class SequenceRunner<C, R> {
    private final Reporter reporter;

    public SequenceRunner(Reporter reporter) {
        this.reporter = reporter;
    }

    public void run(CommandSequence<C, R> sequence, SystemUnderTest<C, R> sut) throws CommandExecutionException {
        StateMachine<C, R> model = sequence.getModel();
        model.reset();
        for (C command : sequence.getCommands()) {
            R result;
            try {
                result = sut.run(command);
            } catch (CommandExecutionException e) {
                throw e;
            } catch (Exception | AssertionError e) {
                throw new SystemUnderTestException(command, e);
            }
            reporter.logCommand(command, result);
            model.postcondition(command, result);
            model.nextState(command);
        }
    }
}
