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

import org.jetbrains.kotlinx.statecheck.paramgen.Generators;
import org.jetbrains.kotlinx.statecheck.paramgen.ValueGenerator;

/**
 * A command generator paired with its sampling weight.
 * The weight is validated only when the command is sampled,
 * a non-positive one makes the generation fail.
 *
 * @see StateMachine#commands()
 */
public final class Weighted<C> {
    private final int weight;
    private final ValueGenerator<? extends C> generator;

    private Weighted(int weight, ValueGenerator<? extends C> generator) {
        this.weight = weight;
        this.generator = generator;
    }

    public static <C> Weighted<C> of(int weight, ValueGenerator<? extends C> generator) {
        return new Weighted<>(weight, generator);
    }

    /**
     * Shortcut for a command without arguments.
     */
    public static <C> Weighted<C> just(int weight, C command) {
        return new Weighted<>(weight, Generators.just(command));
    }

    public int getWeight() {
        return weight;
    }

    public ValueGenerator<? extends C> getGenerator() {
        return generator;
    }

    @Override
    public String toString() {
        return weight + ":" + generator;
    }
}
