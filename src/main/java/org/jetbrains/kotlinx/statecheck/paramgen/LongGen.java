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

import java.util.Random;

/**
 * Generates {@code long} values uniformly from {@code [begin; end]}.
 * Generated values shrink toward the point of the range closest to zero.
 */
public class LongGen implements ValueGenerator<Long> {
    private final long begin;
    private final long end;

    public LongGen(long begin, long end) {
        if (end < begin)
            throw new IllegalArgumentException("end must be >= than begin");
        this.begin = begin;
        this.end = end;
    }

    /**
     * @param configuration range configuration in {@code begin:end} format (both inclusive), may be empty
     */
    public LongGen(String configuration) {
        this(parseBegin(configuration, Long.MIN_VALUE), parseEnd(configuration, Long.MAX_VALUE));
    }

    @Override
    public BinarySearchValue generate(Random random) {
        return BinarySearchValue.inRange(nextLong(random, begin, end), begin, end);
    }

    static long nextLong(Random random, long begin, long end) {
        if (begin == Long.MIN_VALUE && end == Long.MAX_VALUE)
            return random.nextLong();
        long bound = end - begin + 1;
        if (bound > 0)
            return begin + random.nextLong(bound);
        // The range is wider than Long.MAX_VALUE, at least a half of all values fits
        long value;
        do {
            value = random.nextLong();
        } while (value < begin || value > end);
        return value;
    }

    static long parseBegin(String configuration, long defaultBegin) {
        String[] args = splitConfiguration(configuration);
        return args == null ? defaultBegin : Long.parseLong(args[0]);
    }

    static long parseEnd(String configuration, long defaultEnd) {
        String[] args = splitConfiguration(configuration);
        return args == null ? defaultEnd : Long.parseLong(args[1]);
    }

    @Nullable
    private static String[] splitConfiguration(String configuration) {
        if (configuration.isEmpty())
            return null;
        String[] args = configuration.replaceAll("\\s", "").split(":");
        if (args.length != 2) {
            throw new IllegalArgumentException("Configuration should have " +
                "two arguments (begin and end) separated by colon");
        }
        return args;
    }
}
