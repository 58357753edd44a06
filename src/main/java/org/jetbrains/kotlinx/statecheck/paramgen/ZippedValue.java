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

import org.jetbrains.annotations.Nullable;

import java.util.function.BiFunction;

/**
 * Combines two values. The first one is shrunk until it cannot be simplified anymore,
 * then the second one.
 */
public class ZippedValue<A, B, T> implements ShrinkableValue<T> {
    private final ShrinkableValue<A> first;
    private final ShrinkableValue<B> second;
    private final BiFunction<? super A, ? super B, ? extends T> combiner;
    private boolean firstExhausted;
    @Nullable
    private ShrinkableValue<?> lastSimplified;

    public ZippedValue(ShrinkableValue<A> first, ShrinkableValue<B> second,
                       BiFunction<? super A, ? super B, ? extends T> combiner)
    {
        this.first = first;
        this.second = second;
        this.combiner = combiner;
    }

    @Override
    public T current() {
        return combiner.apply(first.current(), second.current());
    }

    @Override
    public boolean simplify() {
        if (!firstExhausted) {
            if (first.simplify()) {
                lastSimplified = first;
                return true;
            }
            firstExhausted = true;
        }
        if (second.simplify()) {
            lastSimplified = second;
            return true;
        }
        return false;
    }

    @Override
    public boolean complicate() {
        if (lastSimplified == null)
            return false;
        if (lastSimplified.complicate())
            return true;
        lastSimplified = null;
        return false;
    }
}
