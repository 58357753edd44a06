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

import java.util.List;

/**
 * The simplified model of the system under test.
 * <p>
 * The model keeps its own state, which approximates the state of the tested system,
 * and predicts the results of the commands applied to it.
 * The engine never shares a model instance between trials: it works with
 * {@link #copy() copies} and {@link #reset() resets} them before every use.
 *
 * @param <C> type which encodes the commands accepted by the model
 * @param <R> type which encodes the responses to the commands
 */
public interface StateMachine<C, R> {
    /**
     * Resets the model to its initial state.
     */
    void reset();

    /**
     * Returns the commands which are legal in the current state.
     * Each option is a positive weight and a generator for the command;
     * the weight biases the sampling toward specific commands
     * (for example, one might want to generate writes more often than reads).
     */
    List<Weighted<C>> commands();

    /**
     * Checks that {@code result} of the system under test is consistent with the current state of the model.
     *
     * @throws PostconditionException if the result is not the expected one
     */
    void postcondition(C command, R result) throws PostconditionException;

    /**
     * Advances the model to the next state by applying {@code command}.
     */
    void nextState(C command);

    /**
     * Creates an independent instance of this model.
     * The state of the returned instance is not relevant, it is reset before use.
     */
    StateMachine<C, R> copy();
}
