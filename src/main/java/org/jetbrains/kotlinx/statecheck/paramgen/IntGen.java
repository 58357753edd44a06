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

public class IntGen implements ValueGenerator<Integer> {
    private final LongGen longGen;

    public IntGen(int begin, int end) {
        longGen = new LongGen(begin, end);
    }

    public IntGen(String configuration) {
        long begin = LongGen.parseBegin(configuration, Integer.MIN_VALUE);
        long end = LongGen.parseEnd(configuration, Integer.MAX_VALUE);
        checkRange(begin, end);
        longGen = new LongGen(begin, end);
    }

    @Override
    public ShrinkableValue<Integer> generate(Random random) {
        return new MappedValue<>(longGen.generate(random), Long::intValue);
    }

    private static void checkRange(long begin, long end) {
        if (begin < Integer.MIN_VALUE || end > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Illegal range for int type: [" + begin + "; " + end + "]");
        }
    }
}
