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
import org.jetbrains.kotlinx.statecheck.execution.CommandSequenceGenerator;
import org.jetbrains.kotlinx.statecheck.execution.GenerationException;
import org.jetbrains.kotlinx.statecheck.runner.SequenceRunner;
import org.jetbrains.kotlinx.statecheck.shrinking.CommandSequenceShrinker;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * This class runs model-based tests.
 * See {@link #check(StateMachine, Supplier, StateCheckOptions)} for details.
 * <p>
 * Every trial generates a random command sequence with a copy of the model and executes it
 * against a fresh system under test, checking the model postconditions after each command.
 * A failing sequence is minimized: commands are deleted one by one and, if
 * {@link StateCheckOptions#shrinkCommands(boolean) enabled}, their arguments are simplified,
 * as long as the sequence keeps failing.
 * <p>
 * The minimization has two sharp edges test authors should be aware of. Any failure counts as
 * a reproduction, so the minimized sequence may fail with a different error than the original one.
 * And the commands are replayed without checking that they are still legal after the deletion
 * of the preceding ones, since the model offered them for the original history.
 */
public class StateChecker<C, R> {
    private final Supplier<? extends SystemUnderTest<C, R>> sutFactory;
    private final StateCheckConfiguration testCfg;
    private final Reporter reporter;
    private final CommandSequenceGenerator<C, R> generator;
    private final SequenceRunner<C, R> runner;

    private StateChecker(StateMachine<C, R> model, Supplier<? extends SystemUnderTest<C, R>> sutFactory,
                         StateCheckConfiguration testCfg)
    {
        this.sutFactory = sutFactory;
        this.testCfg = testCfg;
        this.reporter = new Reporter(testCfg.logLevel);
        this.generator = new CommandSequenceGenerator<>(model, testCfg);
        this.runner = new SequenceRunner<>(reporter);
    }

    /**
     * Runs the model-based test with the default options.
     *
     * @throws StateCheckAssertionError if the system under test is not correct.
     */
    public static <C, R> void check(StateMachine<C, R> model, Supplier<? extends SystemUnderTest<C, R>> sutFactory) {
        check(model, sutFactory, new StateCheckOptions());
    }

    /**
     * Runs the model-based test with the specified options.
     *
     * @param model      the model, it is used as a prototype for the copies the trials work with
     * @param sutFactory creates a fresh system under test for every executed sequence
     * @throws StateCheckAssertionError if the system under test is not correct.
     */
    public static <C, R> void check(StateMachine<C, R> model, Supplier<? extends SystemUnderTest<C, R>> sutFactory,
                                    StateCheckOptions options)
    {
        StateCheckFailure failure = checkImpl(model, sutFactory, options);
        if (failure != null)
            throw new StateCheckAssertionError(failure);
    }

    /**
     * Runs the model-based test with the specified options.
     *
     * @return the failure, or {@code null} if all the trials have passed.
     */
    @Nullable
    public static <C, R> StateCheckFailure checkImpl(StateMachine<C, R> model,
                                                     Supplier<? extends SystemUnderTest<C, R>> sutFactory,
                                                     StateCheckOptions options)
    {
        StateChecker<C, R> checker = new StateChecker<>(model, sutFactory, options.createTestConfiguration());
        StateCheckFailure failure = checker.checkImpl();
        if (failure != null)
            checker.reporter.logFailure(failure);
        return failure;
    }

    @Nullable
    private StateCheckFailure checkImpl() {
        long seed = testCfg.seed != null ? testCfg.seed : ThreadLocalRandom.current().nextLong();
        long[] trialSeeds;
        if (testCfg.trialSeed != null) {
            trialSeeds = new long[] { testCfg.trialSeed };
        } else {
            RandomProvider randomProvider = new RandomProvider(seed);
            trialSeeds = new long[testCfg.iterations];
            for (int i = 0; i < trialSeeds.length; i++) {
                trialSeeds[i] = randomProvider.nextSeed();
            }
        }
        TrialOutcome<C, R> outcome = testCfg.threads == 1 ? runTrials(trialSeeds) : runTrialsInParallel(trialSeeds);
        if (outcome == null)
            return null;
        if (outcome.generationError != null)
            return new GenerationFailure(seed, outcome.trialSeed, outcome.generationError);
        return minimize(seed, outcome.trialSeed, outcome.shrinker, outcome.error);
    }

    @Nullable
    private TrialOutcome<C, R> runTrials(long[] trialSeeds) {
        for (int i = 0; i < trialSeeds.length; i++) {
            TrialOutcome<C, R> outcome = runTrial(i + 1, trialSeeds.length, trialSeeds[i]);
            if (outcome != null)
                return outcome;
        }
        return null;
    }

    // Trials fan out to the pool, but the reported one is the first failing trial
    // in the iteration order, independent of the scheduling.
    @Nullable
    private TrialOutcome<C, R> runTrialsInParallel(long[] trialSeeds) {
        ExecutorService executor = Executors.newFixedThreadPool(testCfg.threads);
        AtomicInteger firstFailedIteration = new AtomicInteger(Integer.MAX_VALUE);
        try {
            List<Future<TrialOutcome<C, R>>> futures = new ArrayList<>(trialSeeds.length);
            for (int i = 0; i < trialSeeds.length; i++) {
                int iteration = i + 1;
                long trialSeed = trialSeeds[i];
                futures.add(executor.submit(() -> {
                    if (iteration > firstFailedIteration.get())
                        return null;
                    TrialOutcome<C, R> outcome = runTrial(iteration, trialSeeds.length, trialSeed);
                    if (outcome != null)
                        firstFailedIteration.accumulateAndGet(iteration, Math::min);
                    return outcome;
                }));
            }
            for (Future<TrialOutcome<C, R>> future : futures) {
                TrialOutcome<C, R> outcome = future.get();
                if (outcome != null)
                    return outcome;
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the trials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new IllegalStateException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Generates and executes a single sequence.
     * A {@link GenerationException} is not retried: the model offered an invalid
     * command distribution, so the trial fails and the run stops.
     *
     * @return {@code null} if the trial has passed.
     */
    @Nullable
    private TrialOutcome<C, R> runTrial(int iteration, int iterations, long trialSeed) {
        Random random = RandomProvider.createRandom(trialSeed);
        CommandSequenceShrinker<C, R> shrinker;
        try {
            shrinker = generator.nextSequence(random);
        } catch (GenerationException e) {
            return TrialOutcome.generationFailed(trialSeed, e);
        }
        CommandSequence<C, R> sequence = shrinker.current();
        reporter.logIteration(iteration, iterations, trialSeed, sequence);
        CommandExecutionException error = execute(sequence);
        return error == null ? null : TrialOutcome.failed(trialSeed, shrinker, error);
    }

    // Tries to minimize the failing sequence to make the error easier to understand.
    // Every candidate is executed against a fresh system under test: a failing candidate is kept
    // and simplified further, a passing one is reverted with `complicate` to the last failing
    // sequence and simplified in another way. The search ends when the sequence cannot be
    // simplified anymore or the shrink iterations are exhausted.
    private CounterexampleFailure minimize(long seed, long trialSeed, CommandSequenceShrinker<C, R> shrinker,
                                           CommandExecutionException error)
    {
        CommandSequence<C, R> failing = shrinker.current();
        int originalSize = failing.size();
        int shrinkIterations = 0;
        if (testCfg.minimizeFailedScenario) {
            reporter.logScenarioMinimization(failing, error);
            boolean hasCandidate = shrinker.simplify();
            while (hasCandidate && shrinkIterations < testCfg.maxShrinkIterations) {
                shrinkIterations++;
                CommandSequence<C, R> candidate = shrinker.current();
                CommandExecutionException candidateError = execute(candidate);
                reporter.logShrinkStep(shrinkIterations, candidate, candidateError);
                if (candidateError != null) {
                    failing = candidate;
                    error = candidateError;
                    hasCandidate = shrinker.simplify();
                } else {
                    shrinker.complicate();
                    hasCandidate = shrinker.simplify();
                }
            }
        }
        return new CounterexampleFailure(seed, trialSeed, failing, error, originalSize, shrinkIterations);
    }

    /**
     * @return the error of the first failed command, or {@code null} if the sequence has passed.
     */
    @Nullable
    private CommandExecutionException execute(CommandSequence<C, R> sequence) {
        try {
            runner.run(sequence, sutFactory.get());
            return null;
        } catch (CommandExecutionException e) {
            return e;
        }
    }

    private static final class TrialOutcome<C, R> {
        final long trialSeed;
        @Nullable
        final CommandSequenceShrinker<C, R> shrinker;
        @Nullable
        final CommandExecutionException error;
        @Nullable
        final GenerationException generationError;

        private TrialOutcome(long trialSeed, @Nullable CommandSequenceShrinker<C, R> shrinker,
                             @Nullable CommandExecutionException error, @Nullable GenerationException generationError)
        {
            this.trialSeed = trialSeed;
            this.shrinker = shrinker;
            this.error = error;
            this.generationError = generationError;
        }

        static <C, R> TrialOutcome<C, R> failed(long trialSeed, CommandSequenceShrinker<C, R> shrinker,
                                                CommandExecutionException error)
        {
            return new TrialOutcome<>(trialSeed, shrinker, error, null);
        }

        static <C, R> TrialOutcome<C, R> generationFailed(long trialSeed, GenerationException error) {
            return new TrialOutcome<>(trialSeed, null, null, error);
        }
    }
}
