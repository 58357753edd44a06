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
import org.jetbrains.kotlinx.statecheck.PostconditionException;
import org.jetbrains.kotlinx.statecheck.Reporter;
import org.jetbrains.kotlinx.statecheck.StackModel;
import org.jetbrains.kotlinx.statecheck.StackModel.Command;
import org.jetbrains.kotlinx.statecheck.SystemUnderTest;
import org.jetbrains.kotlinx.statecheck.SystemUnderTestException;
import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;
import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.jetbrains.kotlinx.statecheck.StackModel.pop;
import static org.jetbrains.kotlinx.statecheck.StackModel.push;
import static org.junit.Assert.*;

public class SequenceRunnerTest {
    private final SequenceRunner<Command, Integer> runner = new SequenceRunner<>(new Reporter(LoggingLevel.OFF));

    @Test
    public void correctSystemPasses() throws CommandExecutionException {
        runner.run(sequence(push(1), push(2), pop(), push(3), pop(), pop()), StackModel.system());
    }

    @Test
    public void modelIsResetBeforeEveryRun() throws CommandExecutionException {
        CommandSequence<Command, Integer> sequence = sequence(push(1), push(2), pop());
        runner.run(sequence, StackModel.system());
        runner.run(sequence, StackModel.system());
    }

    @Test
    public void postconditionFailureStopsExecution() {
        List<Command> executed = new ArrayList<>();
        SystemUnderTest<Command, Integer> queue = StackModel.queue();
        SystemUnderTest<Command, Integer> sut = command -> {
            executed.add(command);
            return queue.run(command);
        };
        try {
            runner.run(sequence(push(1), push(2), pop(), push(3), pop()), sut);
            fail("The postcondition should have failed");
        } catch (PostconditionException e) {
            assertEquals("Pop", e.getCommand());
            assertEquals("2", e.getExpected());
            assertEquals("1", e.getActual());
            assertEquals("Postcondition does not hold. Command: Pop. Expected result: 2. Actual result: 1",
                e.getMessage());
        } catch (CommandExecutionException e) {
            fail("Unexpected error: " + e);
        }
        assertEquals(Arrays.asList(push(1), push(2), pop()), executed);
    }

    @Test
    public void systemExceptionIsWrapped() {
        try {
            runner.run(sequence(pop(), push(1)), StackModel.system());
            fail("The system under test should have failed");
        } catch (SystemUnderTestException e) {
            assertEquals("Pop", e.getCommand());
            assertTrue(e.getCause() instanceof NoSuchElementException);
        } catch (CommandExecutionException e) {
            fail("Unexpected error: " + e);
        }
    }

    @Test
    public void assertionErrorIsWrapped() {
        SystemUnderTest<Command, Integer> sut = command -> {
            throw new AssertionError("broken");
        };
        try {
            runner.run(sequence(push(1)), sut);
            fail("The system under test should have failed");
        } catch (SystemUnderTestException e) {
            assertEquals("Push(1)", e.getCommand());
            assertTrue(e.getCause() instanceof AssertionError);
        } catch (CommandExecutionException e) {
            fail("Unexpected error: " + e);
        }
    }

    @Test
    public void commandsAreLoggedOnDebugLevel() throws CommandExecutionException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SequenceRunner<Command, Integer> debugRunner =
            new SequenceRunner<>(new Reporter(LoggingLevel.DEBUG, new PrintStream(out, true)));
        debugRunner.run(sequence(push(7), pop()), StackModel.system());
        String log = out.toString();
        assertTrue(log, log.contains("Push(7): null"));
        assertTrue(log, log.contains("Pop: 7"));
    }

    private static CommandSequence<Command, Integer> sequence(Command... commands) {
        return new CommandSequence<>(Arrays.asList(commands), new StackModel());
    }
}
