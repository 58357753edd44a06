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

import org.jetbrains.kotlinx.statecheck.UpDownModel.Command;
import org.jetbrains.kotlinx.statecheck.execution.CommandSequence;
import org.jetbrains.kotlinx.statecheck.execution.GenerationException;
import org.jetbrains.kotlinx.statecheck.util.LoggingLevel;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import static org.jetbrains.kotlinx.statecheck.UpDownModel.down;
import static org.jetbrains.kotlinx.statecheck.UpDownModel.up;
import static org.junit.Assert.*;

public class StateCheckerTest {
    @Test
    public void shrinkRemovesSequenceHead() throws Exception {
        checkMinimized(Arrays.asList(down(), down(), up(1), up(2), up(3)));
    }

    @Test
    public void shrinkRemovesSequenceTail() throws Exception {
        checkMinimized(Arrays.asList(up(1), up(2), up(3), down()));
    }

    @Test
    public void shrinkRemovesArbitrary() throws Exception {
        checkMinimized(Arrays.asList(down(), up(1), down(), down(), up(2), down(), down(), down(), up(3), down()));
    }

    @Test
    public void shrinkKeepsSingleCommand() {
        UpDownModel model = new UpDownModel(Arrays.asList(down(), down(), up(1), down()));
        CounterexampleFailure failure = (CounterexampleFailure) StateChecker.checkImpl(model, UpDownModel::system,
            planOptions(4));
        assertNotNull(failure);
        assertEquals(Arrays.asList(up(1)), failure.getCounterexample().getCommands());
    }

    @Test
    public void checkThrowsAssertionError() {
        UpDownModel model = new UpDownModel(Arrays.asList(down(), up(1)));
        try {
            planOptions(2).check(model, UpDownModel::system);
            fail("The check should have failed");
        } catch (StateCheckAssertionError e) {
            assertTrue(e.getFailure() instanceof CounterexampleFailure);
            assertTrue(e.getCause() instanceof PostconditionException);
        }
    }

    @Test
    public void maxShrinkIterationsLimitsMinimization() {
        UpDownModel model = new UpDownModel(Arrays.asList(down(), down(), up(1), up(2)));
        CounterexampleFailure failure = (CounterexampleFailure) StateChecker.checkImpl(model, UpDownModel::system,
            planOptions(4).maxShrinkIterations(1));
        assertNotNull(failure);
        assertEquals(1, failure.getShrinkIterations());
        assertEquals(3, failure.getCounterexample().size());
        assertEquals(4, failure.getOriginalSize());
    }

    @Test
    public void minimizationCanBeDisabled() {
        List<Command> plan = Arrays.asList(down(), down(), up(1), up(2));
        CounterexampleFailure failure = (CounterexampleFailure) StateChecker.checkImpl(new UpDownModel(plan),
            UpDownModel::system, planOptions(4).minimizeFailedScenario(false));
        assertNotNull(failure);
        assertEquals(0, failure.getShrinkIterations());
        assertEquals(plan, failure.getCounterexample().getCommands());
    }

    @Test
    public void minimalSequenceSizeIsConfigurable() {
        UpDownModel model = new UpDownModel(Arrays.asList(down(), down(), down(), up(1)));
        CounterexampleFailure failure = (CounterexampleFailure) StateChecker.checkImpl(model, UpDownModel::system,
            planOptions(4).minShrunkSequenceSize(2));
        assertNotNull(failure);
        assertEquals(Arrays.asList(down(), up(1)), failure.getCounterexample().getCommands());
    }

    @Test
    public void failureReportContainsCommandsAndSeeds() {
        UpDownModel model = new UpDownModel(Arrays.asList(down(), up(7)));
        StateCheckFailure failure = StateChecker.checkImpl(model, UpDownModel::system, planOptions(2).seed(42));
        assertNotNull(failure);
        assertEquals(42, failure.getSeed());
        String report = failure.toString();
        assertTrue(report, report.contains("Seed: 42"));
        assertTrue(report, report.contains("1. Up{tag=7}"));
        assertTrue(report, report.contains("Postcondition does not hold. Command: Up{tag=7}"));
        assertFalse(report, report.contains("Down"));
    }

    @Test
    public void correctSystemPasses() {
        assertNull(StateChecker.checkImpl(new StackModel(), StackModel::system, new StateCheckOptions()
            .iterations(50)
            .logLevel(LoggingLevel.OFF)));
    }

    @Test
    public void invalidWeightsFailGeneration() {
        StateMachine<String, String> model = new ConstantModel(Collections.singletonList(Weighted.just(0, "noop")));
        StateCheckFailure failure = StateChecker.checkImpl(model, () -> command -> command, new StateCheckOptions()
            .logLevel(LoggingLevel.OFF));
        assertTrue(failure instanceof GenerationFailure);
        assertTrue(failure.getError() instanceof GenerationException);
    }

    @Test
    public void generationErrorInSomeStatesAbortsRun() {
        StateCheckOptions options = new StateCheckOptions()
            .iterations(20)
            .minSequenceSize(3)
            .maxSequenceSize(3)
            .seed(1)
            .logLevel(LoggingLevel.OFF);
        StateCheckFailure result = StateChecker.checkImpl(new DeadEndModel(), () -> command -> command, options);
        assertTrue("Invalid command distribution should fail the run", result instanceof GenerationFailure);
        GenerationFailure failure = (GenerationFailure) result;
        assertTrue(failure.toString(), failure.toString().contains("trial seed: " + failure.getTrialSeed()));
        // The failed trial is reproducible on its own
        StateCheckFailure replayed = StateChecker.checkImpl(new DeadEndModel(), () -> command -> command,
            new StateCheckOptions()
                .minSequenceSize(3)
                .maxSequenceSize(3)
                .trialSeed(failure.getTrialSeed())
                .logLevel(LoggingLevel.OFF));
        assertTrue(replayed instanceof GenerationFailure);
        assertEquals(failure.getTrialSeed(), ((GenerationFailure) replayed).getTrialSeed());
    }

    @Test
    public void noLegalCommandsFailGeneration() {
        StateMachine<String, String> model = new ConstantModel(Collections.<Weighted<String>>emptyList());
        try {
            new StateCheckOptions()
                .logLevel(LoggingLevel.OFF)
                .check(model, () -> command -> command);
            fail("The check should have failed");
        } catch (StateCheckAssertionError e) {
            assertTrue(e.getFailure() instanceof GenerationFailure);
            assertTrue(e.getCause() instanceof GenerationException);
        }
    }

    @Test
    public void shrinkCommandsFindsSmallestArgument() {
        StateCheckFailure result = StateChecker.checkImpl(new StackModel(), () -> boundedStack(50),
            new StateCheckOptions()
                .maxSequenceSize(20)
                .shrinkCommands(true)
                .seed(0)
                .logLevel(LoggingLevel.OFF));
        assertTrue(result instanceof CounterexampleFailure);
        CounterexampleFailure failure = (CounterexampleFailure) result;
        assertTrue(failure.getError() instanceof SystemUnderTestException);
        assertEquals(Collections.singletonList(StackModel.push(50)), failure.getCounterexample().getCommands());
    }

    @Test
    public void sameSeedSameFailure() {
        StateCheckOptions options = new StateCheckOptions()
            .iterations(100)
            .seed(7)
            .logLevel(LoggingLevel.OFF);
        CounterexampleFailure first = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, options);
        CounterexampleFailure second = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, options);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals(first.getTrialSeed(), second.getTrialSeed());
        assertEquals(first.getCounterexample(), second.getCounterexample());
        assertEquals(first.getError().getMessage(), second.getError().getMessage());
    }

    @Test
    public void trialSeedReplaysFailedTrial() {
        CounterexampleFailure original = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, new StateCheckOptions()
                .iterations(100)
                .minimizeFailedScenario(false)
                .logLevel(LoggingLevel.OFF));
        assertNotNull(original);
        CounterexampleFailure replayed = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, new StateCheckOptions()
                .trialSeed(original.getTrialSeed())
                .minimizeFailedScenario(false)
                .logLevel(LoggingLevel.OFF));
        assertNotNull(replayed);
        assertEquals(original.getTrialSeed(), replayed.getTrialSeed());
        assertEquals(original.getCounterexample(), replayed.getCounterexample());
    }

    @Test
    public void parallelTrialsReportSameFailure() {
        CounterexampleFailure sequential = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, new StateCheckOptions()
                .iterations(64)
                .seed(11)
                .logLevel(LoggingLevel.OFF));
        CounterexampleFailure parallel = (CounterexampleFailure) StateChecker.checkImpl(new StackModel(),
            StackModel::queue, new StateCheckOptions()
                .iterations(64)
                .seed(11)
                .threads(4)
                .logLevel(LoggingLevel.OFF));
        assertNotNull(sequential);
        assertNotNull(parallel);
        assertEquals(sequential.getTrialSeed(), parallel.getTrialSeed());
        assertEquals(sequential.getCounterexample(), parallel.getCounterexample());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidSequenceSizeRange() {
        new StateCheckOptions().minSequenceSize(10).maxSequenceSize(5).createTestConfiguration();
    }

    @Test
    public void progressIsReported() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Reporter reporter = new Reporter(LoggingLevel.INFO, new PrintStream(out, true));
        UpDownModel model = new UpDownModel(Arrays.asList(down(), up(1)));
        reporter.logFailure(StateChecker.checkImpl(model, UpDownModel::system, planOptions(2)));
        String log = out.toString();
        assertTrue(log, log.contains("= Counterexample found ="));
    }

    private static void checkMinimized(List<Command> plan) throws Exception {
        UpDownModel model = new UpDownModel(plan);
        StateCheckFailure result = StateChecker.checkImpl(model, UpDownModel::system,
            planOptions(plan.size()).maxShrinkIterations(100));
        assertTrue("The test should have failed", result instanceof CounterexampleFailure);
        CounterexampleFailure failure = (CounterexampleFailure) result;
        assertEquals("Invalid minimal sequence length", model.getTarget(), failure.getCounterexample().size());
        assertTrue(failure.getCounterexample().size() <= failure.getOriginalSize());
        assertTrue(failure.getError() instanceof PostconditionException);
        // The minimal sequence reproduces the reported error
        @SuppressWarnings("unchecked")
        CommandSequence<Command, Integer> counterexample = (CommandSequence<Command, Integer>) failure.getCounterexample();
        try {
            counterexample.run(UpDownModel.system());
            fail("The minimal sequence should fail");
        } catch (PostconditionException e) {
            assertEquals(failure.getError().getMessage(), e.getMessage());
        }
    }

    private static StateCheckOptions planOptions(int planLength) {
        return new StateCheckOptions()
            .iterations(1)
            .minSequenceSize(planLength)
            .maxSequenceSize(planLength)
            .logLevel(LoggingLevel.OFF);
    }

    // Push fails for values from the bound on, Pop of an empty stack returns null
    private static SystemUnderTest<StackModel.Command, Integer> boundedStack(int bound) {
        Deque<Integer> stack = new ArrayDeque<>();
        return command -> {
            if (command.equals(StackModel.pop()))
                return stack.pollFirst();
            int value = Integer.parseInt(command.toString().replaceAll("\\D", ""));
            if (value >= bound)
                throw new IllegalStateException("Value " + value + " is too large");
            stack.push(value);
            return null;
        };
    }

    private static class ConstantModel implements StateMachine<String, String> {
        private final List<Weighted<String>> commands;

        ConstantModel(List<Weighted<String>> commands) {
            this.commands = commands;
        }

        @Override
        public void reset() {
        }

        @Override
        public List<Weighted<String>> commands() {
            return commands;
        }

        @Override
        public void postcondition(String command, String result) {
        }

        @Override
        public void nextState(String command) {
        }

        @Override
        public ConstantModel copy() {
            return new ConstantModel(commands);
        }
    }

    // Offers "a" and "b", but no commands at all once "b" has been applied
    private static class DeadEndModel implements StateMachine<String, String> {
        private boolean deadEnd;

        @Override
        public void reset() {
            deadEnd = false;
        }

        @Override
        public List<Weighted<String>> commands() {
            if (deadEnd)
                return Collections.emptyList();
            return Arrays.asList(Weighted.just(1, "a"), Weighted.just(1, "b"));
        }

        @Override
        public void postcondition(String command, String result) {
        }

        @Override
        public void nextState(String command) {
            if (command.equals("b"))
                deadEnd = true;
        }

        @Override
        public DeadEndModel copy() {
            return new DeadEndModel();
        }
    }
}
