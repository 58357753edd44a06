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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factory methods for the built-in {@link ValueGenerator value generators}.
 */
public final class Generators {
    private Generators() {
    }

    /**
     * Always generates {@code value}, which cannot be simplified.
     */
    public static <T> ValueGenerator<T> just(T value) {
        return random -> new JustValue<>(value);
    }

    public static ValueGenerator<Integer> integers(int begin, int end) {
        return new IntGen(begin, end);
    }

    public static ValueGenerator<Long> longs(long begin, long end) {
        return new LongGen(begin, end);
    }

    /**
     * {@code true} shrinks to {@code false}.
     */
    public static ValueGenerator<Boolean> booleans() {
        return longs(0, 1).map(v -> v == 1);
    }

    /**
     * Chooses one of {@code values} uniformly, shrinks toward the first one.
     */
    @SafeVarargs
    public static <T> ValueGenerator<T> elements(T... values) {
        return elements(Arrays.asList(values));
    }

    public static <T> ValueGenerator<T> elements(List<? extends T> values) {
        if (values.isEmpty())
            throw new IllegalArgumentException("At least one element is required");
        List<T> copy = Collections.unmodifiableList(new ArrayList<>(values));
        return integers(0, copy.size() - 1).map(copy::get);
    }

    /**
     * Chooses one of {@code generators} uniformly and shrinks the value it produces.
     */
    @SafeVarargs
    public static <T> ValueGenerator<T> oneOf(ValueGenerator<? extends T>... generators) {
        if (generators.length == 0)
            throw new IllegalArgumentException("At least one generator is required");
        List<ValueGenerator<? extends T>> copy = Arrays.asList(generators.clone());
        return random -> widen(copy.get(random.nextInt(copy.size())).generate(random));
    }

    private static <T> ShrinkableValue<T> widen(ShrinkableValue<? extends T> value) {
        return new MappedValue<>(value, v -> v);
    }
}
