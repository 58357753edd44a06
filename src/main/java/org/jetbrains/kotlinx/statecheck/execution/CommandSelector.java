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
package org.jetbrains.kotlinx.statecheck.execution;

import org.jetbrains.kotlinx.statecheck.Weighted;
import org.jetbrains.kotlinx.statecheck.paramgen.ShrinkableValue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Draws one command from the weighted options offered by the model.
 * The probability of each option is proportional to its weight.
 */
public class CommandSelector {
    private final Random random;

    public CommandSelector(Random random) {
        this.random = random;
    }

    public <C> ShrinkableValue<? extends C> next(List<Weighted<C>> options) throws GenerationException {
        if (options == null || options.isEmpty())
            throw new GenerationException("The model offers no legal commands in the current state");
        long[] cumulativeWeights = new long[options.size()];
        long total = 0;
        for (int i = 0; i < options.size(); i++) {
            int weight = options.get(i).getWeight();
            if (weight <= 0) {
                throw new GenerationException("Command option #" + i + " has weight " + weight +
                    ", all weights should be positive");
            }
            total += weight;
            cumulativeWeights[i] = total;
        }
        return options.get(choose(cumulativeWeights, random.nextLong(total))).getGenerator().generate(random);
    }

    // Returns the first index whose cumulative weight exceeds the point
    private static int choose(long[] cumulativeWeights, long point) {
        int index = Arrays.binarySearch(cumulativeWeights, point);
        return index >= 0 ? index + 1 : -index - 1;
    }
}
