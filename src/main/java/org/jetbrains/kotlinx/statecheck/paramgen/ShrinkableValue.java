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
package org.jetbrains.kotlinx.statecheck.paramgen;

/**
 * A generated value together with its own shrinking state.
 * <p>
 * The engine drives every value with the following protocol:
 * {@link #simplify()} proposes a smaller candidate, the candidate is tested,
 * and if the test no longer fails {@link #complicate()} reverts it.
 * After {@code complicate()} the {@link #current() current} value is the one
 * before the last simplification, and the next {@code simplify()} call
 * proposes a less aggressive candidate.
 * <p>
 * Implementations are stateful and are not thread-safe.
 */
public interface ShrinkableValue<T> {
    /**
     * Returns the current value.
     */
    T current();

    /**
     * Replaces the current value with a simpler candidate.
     *
     * @return {@code false} if no simpler candidate remains; the current value is not changed then.
     */
    boolean simplify();

    /**
     * Reverts the last successful {@link #simplify()} call.
     *
     * @return {@code false} if there is nothing to revert.
     */
    boolean complicate();
}
