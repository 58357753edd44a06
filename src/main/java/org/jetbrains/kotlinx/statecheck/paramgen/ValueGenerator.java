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

import java.util.Random;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The implementation of this interface is used to generate command arguments
 * (and commands themselves) as {@link ShrinkableValue shrinkable values}.
 * <p>
 * Implementations should take all the randomness from the provided {@link Random},
 * so that a seed is enough to reproduce the generated value.
 *
 * @see Generators
 */
@FunctionalInterface
public interface ValueGenerator<T> {
    ShrinkableValue<T> generate(Random random);

    default <U> ValueGenerator<U> map(Function<? super T, ? extends U> mapper) {
        return random -> new MappedValue<>(generate(random), mapper);
    }

    default <U, V> ValueGenerator<V> zip(ValueGenerator<U> other, BiFunction<? super T, ? super U, ? extends V> combiner) {
        return random -> new ZippedValue<>(generate(random), other.generate(random), combiner);
    }
}
