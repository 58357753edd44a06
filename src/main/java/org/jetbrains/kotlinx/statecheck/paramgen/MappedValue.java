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

import java.util.function.Function;

/**
 * Applies {@code mapper} to the current source value; shrinking is delegated to the source.
 */
public class MappedValue<S, T> implements ShrinkableValue<T> {
    private final ShrinkableValue<S> source;
    private final Function<? super S, ? extends T> mapper;

    public MappedValue(ShrinkableValue<S> source, Function<? super S, ? extends T> mapper) {
        this.source = source;
        this.mapper = mapper;
    }

    @Override
    public T current() {
        return mapper.apply(source.current());
    }

    @Override
    public boolean simplify() {
        return source.simplify();
    }

    @Override
    public boolean complicate() {
        return source.complicate();
    }
}
